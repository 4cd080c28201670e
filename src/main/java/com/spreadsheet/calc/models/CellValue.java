package com.spreadsheet.calc.models;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Immutable value held by a cell: empty, number, text, boolean or error.
 * Numbers are IEEE doubles as in Excel; NaN and infinities never appear
 * here, they become #NUM! at construction.
 */
public final class CellValue implements Operand {

    public static final CellValue EMPTY = new CellValue(ValueType.EMPTY, 0, null, false, null);
    public static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, 0, null, true, null);
    public static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, 0, null, false, null);
    public static final CellValue ZERO = new CellValue(ValueType.NUMBER, 0, null, false, null);
    public static final CellValue EMPTY_TEXT = new CellValue(ValueType.TEXT, 0, "", false, null);

    // Excel displays at most 15 significant digits
    private static final MathContext DISPLAY_PRECISION = new MathContext(15);

    private final ValueType type;
    private final double number;
    private final String text;
    private final boolean bool;
    private final ErrorCode error;

    private CellValue(ValueType type, double number, String text, boolean bool, ErrorCode error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.error = error;
    }

    public static CellValue of(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return error(ErrorCode.NUM);
        }
        if (number == 0) {
            return ZERO;
        }
        return new CellValue(ValueType.NUMBER, number, null, false, null);
    }

    public static CellValue of(BigDecimal number) {
        return of(number.doubleValue());
    }

    public static CellValue text(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return EMPTY_TEXT;
        }
        return new CellValue(ValueType.TEXT, 0, text, false, null);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(ErrorCode code) {
        Objects.requireNonNull(code, "code");
        return new CellValue(ValueType.ERROR, 0, null, false, code);
    }

    /**
     * Converts a JSON scalar (Number, String, Boolean or null) into a value.
     * Strings that spell an error code ("#N/A") become errors.
     */
    public static CellValue fromObject(Object raw) {
        if (raw == null) {
            return EMPTY;
        }
        if (raw instanceof CellValue) {
            return (CellValue) raw;
        }
        if (raw instanceof Number) {
            return of(((Number) raw).doubleValue());
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        String s = raw.toString();
        ErrorCode code = ErrorCode.fromText(s);
        if (code != null) {
            return error(code);
        }
        return text(s);
    }

    @Override
    public boolean isRange() {
        return false;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isBoolean() {
        return type == ValueType.BOOLEAN;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public double getNumber() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return number;
    }

    public String getText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Not text: " + this);
        }
        return text;
    }

    public boolean getBoolean() {
        if (type != ValueType.BOOLEAN) {
            throw new IllegalStateException("Not a boolean: " + this);
        }
        return bool;
    }

    public ErrorCode getError() {
        if (type != ValueType.ERROR) {
            throw new IllegalStateException("Not an error: " + this);
        }
        return error;
    }

    /**
     * Plain Java representation: Double, String, Boolean, the error text, or null.
     */
    public Object toObject() {
        switch (type) {
            case NUMBER:
                return number;
            case TEXT:
                return text;
            case BOOLEAN:
                return bool;
            case ERROR:
                return error.getText();
            default:
                return null;
        }
    }

    /**
     * Value as Excel's "General" format shows it.
     */
    public String format() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case TEXT:
                return text;
            case BOOLEAN:
                return bool ? "TRUE" : "FALSE";
            case ERROR:
                return error.getText();
            default:
                return "";
        }
    }

    public static String formatNumber(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).round(DISPLAY_PRECISION).stripTrailingZeros();
        double abs = Math.abs(value);
        if (abs >= 1e15 || abs < 1e-9) {
            return rounded.toString();
        }
        return rounded.toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case TEXT:
                return text.equals(other.text);
            case BOOLEAN:
                return bool == other.bool;
            case ERROR:
                return error == other.error;
            default:
                return true;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, bool, error);
    }

    @Override
    public String toString() {
        switch (type) {
            case TEXT:
                return "\"" + text + "\"";
            case EMPTY:
                return "<empty>";
            default:
                return format();
        }
    }
}
