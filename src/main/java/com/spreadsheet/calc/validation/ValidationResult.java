package com.spreadsheet.calc.validation;

/**
 * Whether one calculated value matches its reference value.
 * delta is set for numeric comparisons only.
 */
public final class ValidationResult {

    private final String cellId;
    private final boolean valid;
    private final Double delta;
    private final String reason;

    public ValidationResult(String cellId, boolean valid, Double delta, String reason) {
        this.cellId = cellId;
        this.valid = valid;
        this.delta = delta;
        this.reason = reason;
    }

    public String getCellId() {
        return cellId;
    }

    public boolean isValid() {
        return valid;
    }

    public Double getDelta() {
        return delta;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return cellId + (valid ? " ok" : " FAILED: " + reason);
    }
}
