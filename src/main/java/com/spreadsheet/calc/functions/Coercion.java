package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.InvalidTypeException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;
import com.spreadsheet.calc.parser.FormulaParser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Excel's implicit conversions between value types.
 */
public final class Coercion {

    private Coercion() {
    }

    /**
     * Reduces an operand to a single value. A one-cell range yields its cell;
     * a single row or column intersects with the current cell; anything else is #VALUE!.
     */
    public static CellValue scalar(Operand operand, FunctionContext context) {
        if (!operand.isRange()) {
            return (CellValue) operand;
        }
        RangeValue range = (RangeValue) operand;
        if (range.size() == 1) {
            return range.get(0, 0);
        }
        CellAddress current = context == null ? null : context.getCurrentCell();
        if (current != null && range.getFirstRow() > 0 && sameSheet(range, current)) {
            if (range.getColumns() == 1) {
                int offset = current.getRow() - range.getFirstRow();
                if (offset >= 0 && offset < range.getRows()) {
                    return range.get(offset, 0);
                }
            } else if (range.getRows() == 1) {
                int offset = current.getColumn() - range.getFirstColumn();
                if (offset >= 0 && offset < range.getColumns()) {
                    return range.get(0, offset);
                }
            }
        }
        throw new InvalidTypeException("Range used where a single value is expected");
    }

    private static boolean sameSheet(RangeValue range, CellAddress current) {
        return range.getSheetName() == null || current.getSheetName() == null
                || range.getSheetName().equalsIgnoreCase(current.getSheetName());
    }

    /**
     * Scalar argument with error values rethrown.
     */
    public static CellValue value(Operand operand, FunctionContext context) {
        CellValue value = scalar(operand, context);
        if (value.isError()) {
            throw CellErrorException.of(value.getError(), "Error argument");
        }
        return value;
    }

    public static double toNumber(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case EMPTY:
                return 0;
            case BOOLEAN:
                return value.getBoolean() ? 1 : 0;
            case TEXT:
                Double parsed = FormulaParser.parseNumber(value.getText().trim());
                if (parsed == null) {
                    throw new InvalidTypeException("Not a number: " + value.getText());
                }
                return parsed;
            default:
                throw CellErrorException.of(value.getError(), "Error operand");
        }
    }

    public static double toNumber(Operand operand, FunctionContext context) {
        return toNumber(scalar(operand, context));
    }

    public static int toInt(Operand operand, FunctionContext context) {
        double number = toNumber(operand, context);
        if (Math.abs(number) > Integer.MAX_VALUE) {
            throw CellErrorException.of(ErrorCode.NUM, "Integer out of range");
        }
        return (int) number;
    }

    public static String toText(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
                return CellValue.formatNumber(value.getNumber());
            case TEXT:
                return value.getText();
            case BOOLEAN:
                return value.getBoolean() ? "TRUE" : "FALSE";
            case EMPTY:
                return "";
            default:
                throw CellErrorException.of(value.getError(), "Error operand");
        }
    }

    public static String toText(Operand operand, FunctionContext context) {
        return toText(scalar(operand, context));
    }

    public static boolean toBoolean(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0;
            case EMPTY:
                return false;
            case TEXT:
                if ("TRUE".equalsIgnoreCase(value.getText())) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(value.getText())) {
                    return false;
                }
                throw new InvalidTypeException("Not a logical value: " + value.getText());
            default:
                throw CellErrorException.of(value.getError(), "Error operand");
        }
    }

    public static boolean toBoolean(Operand operand, FunctionContext context) {
        return toBoolean(scalar(operand, context));
    }

    /**
     * Numbers for aggregate functions. Direct arguments are coerced (text "5"
     * counts, "abc" is #VALUE!); inside ranges only numbers count. Errors in
     * either propagate.
     */
    public static List<Double> numbers(List<Operand> args, FunctionContext context) {
        List<Double> result = new ArrayList<>();
        for (Operand arg : args) {
            if (arg.isRange()) {
                for (CellValue value : ((RangeValue) arg).values()) {
                    if (value.isError()) {
                        throw CellErrorException.of(value.getError(), "Error in range");
                    }
                    if (value.isNumber()) {
                        result.add(value.getNumber());
                    }
                }
            } else {
                CellValue value = (CellValue) arg;
                if (!value.isEmpty()) {
                    result.add(toNumber(value));
                }
            }
        }
        return result;
    }

    /**
     * All cell values of the arguments, ranges flattened row by row.
     */
    public static List<CellValue> flatten(List<Operand> args) {
        List<CellValue> result = new ArrayList<>();
        for (Operand arg : args) {
            if (arg.isRange()) {
                result.addAll(((RangeValue) arg).values());
            } else {
                result.add((CellValue) arg);
            }
        }
        return result;
    }

    /**
     * Views an operand as a range; scalars become a 1x1 block.
     */
    public static RangeValue toRange(Operand operand) {
        if (operand.isRange()) {
            return (RangeValue) operand;
        }
        return new RangeValue(null, 0, 0, 1, 1, new CellValue[] {(CellValue) operand});
    }

    public static BigDecimal decimal(double value) {
        return BigDecimal.valueOf(value);
    }

    /**
     * Excel ordering: numbers before text before booleans. Text compares
     * case-insensitively. Empty behaves as 0, "" or FALSE depending on the other side.
     */
    public static int compare(CellValue left, CellValue right) {
        if (left.isError()) {
            throw CellErrorException.of(left.getError(), "Error operand");
        }
        if (right.isError()) {
            throw CellErrorException.of(right.getError(), "Error operand");
        }
        CellValue a = left.isEmpty() ? emptyAs(right) : left;
        CellValue b = right.isEmpty() ? emptyAs(left) : right;
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (a.getType()) {
            case NUMBER:
                double x = a.getNumber();
                double y = b.getNumber();
                return x < y ? -1 : (x > y ? 1 : 0);
            case TEXT:
                return Integer.signum(a.getText().toLowerCase(Locale.ROOT)
                        .compareTo(b.getText().toLowerCase(Locale.ROOT)));
            case BOOLEAN:
                return Boolean.compare(a.getBoolean(), b.getBoolean());
            default:
                return 0;
        }
    }

    private static CellValue emptyAs(CellValue other) {
        switch (other.getType()) {
            case TEXT:
                return CellValue.EMPTY_TEXT;
            case BOOLEAN:
                return CellValue.FALSE;
            default:
                return CellValue.ZERO;
        }
    }

    private static int rank(CellValue value) {
        switch (value.getType()) {
            case NUMBER:
            case EMPTY:
                return 0;
            case TEXT:
                return 1;
            default:
                return 2;
        }
    }

    /**
     * Equality used by exact lookups: same kind of value and compare() == 0.
     */
    public static boolean matches(CellValue candidate, CellValue lookup) {
        if (candidate.isError() || candidate.isEmpty()) {
            return false;
        }
        if (rank(candidate) != rank(lookup)) {
            return false;
        }
        return compare(candidate, lookup) == 0;
    }

    public static boolean sameKind(CellValue a, CellValue b) {
        return !a.isError() && !b.isError() && !a.isEmpty() && rank(a) == rank(b);
    }
}
