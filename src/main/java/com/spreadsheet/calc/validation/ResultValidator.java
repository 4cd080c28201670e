package com.spreadsheet.calc.validation;

import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;

import java.util.Collection;

/**
 * Compares calculated values with reference values.
 */
public class ResultValidator {

    private final Tolerance defaultTolerance;

    public ResultValidator(Tolerance defaultTolerance) {
        this.defaultTolerance = defaultTolerance;
    }

    public ResultValidator() {
        this(Tolerance.DEFAULT);
    }

    /**
     * Numbers must agree within the tolerance; text (case-sensitive) and
     * booleans exactly; an expected error only matches the same error.
     *
     * @param tolerance null for the validator's default
     */
    public ValidationResult validateResult(CellValue actual, String cellId, CellValue expected, Tolerance tolerance) {
        Tolerance bounds = tolerance == null ? defaultTolerance : tolerance;
        if (expected.isError()) {
            boolean same = actual.isError() && actual.getError() == expected.getError();
            return new ValidationResult(cellId, same, null,
                    same ? null : "expected " + expected.getError() + " but got " + describe(actual));
        }
        if (actual.isError()) {
            return new ValidationResult(cellId, false, null, "unexpected " + actual.getError());
        }
        if (expected.isNumber() || (expected.isEmpty() && actual.isNumber())) {
            double reference = expected.isEmpty() ? 0 : expected.getNumber();
            if (!actual.isNumber() && !actual.isEmpty()) {
                return new ValidationResult(cellId, false, null,
                        "expected number " + expected.format() + " but got " + describe(actual));
            }
            double value = actual.isEmpty() ? 0 : actual.getNumber();
            double delta = Math.abs(value - reference);
            boolean ok = bounds.accepts(value, reference);
            return new ValidationResult(cellId, ok, delta,
                    ok ? null : "expected " + CellValue.formatNumber(reference) + " but got " + actual.format());
        }
        if (expected.isEmpty()) {
            boolean blank = actual.isEmpty() || (actual.isText() && actual.getText().isEmpty());
            return new ValidationResult(cellId, blank, null, blank ? null : "expected blank but got " + describe(actual));
        }
        boolean ok = expected.getType() == actual.getType() && expected.equals(actual);
        return new ValidationResult(cellId, ok, null,
                ok ? null : "expected " + describe(expected) + " but got " + describe(actual));
    }

    public ValidationResult validateResult(CellValue actual, String cellId, CellValue expected) {
        return validateResult(actual, cellId, expected, null);
    }

    /**
     * For cells without a reference value: resolved when it is a value or one of the accepted errors.
     */
    public ValidationResult validateResolved(CellValue actual, String cellId, Collection<ErrorCode> acceptedErrors) {
        if (!actual.isError() || acceptedErrors.contains(actual.getError())) {
            return new ValidationResult(cellId, true, null, null);
        }
        return new ValidationResult(cellId, false, null, "unresolved " + actual.getError());
    }

    private static String describe(CellValue value) {
        switch (value.getType()) {
            case TEXT:
                return "\"" + value.getText() + "\"";
            case EMPTY:
                return "blank";
            default:
                return value.format();
        }
    }
}
