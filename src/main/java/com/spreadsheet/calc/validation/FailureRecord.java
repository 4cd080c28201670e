package com.spreadsheet.calc.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One cell that did not validate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FailureRecord {

    private final String cell;
    private final String formula;
    private final String category;
    private final Object expected;
    private final Object actual;
    private final String reason;

    public FailureRecord(String cell, String formula, String category, Object expected, Object actual, String reason) {
        this.cell = cell;
        this.formula = formula;
        this.category = category;
        this.expected = expected;
        this.actual = actual;
        this.reason = reason;
    }

    public String getCell() {
        return cell;
    }

    public String getFormula() {
        return formula;
    }

    public String getCategory() {
        return category;
    }

    public Object getExpected() {
        return expected;
    }

    public Object getActual() {
        return actual;
    }

    public String getReason() {
        return reason;
    }
}
