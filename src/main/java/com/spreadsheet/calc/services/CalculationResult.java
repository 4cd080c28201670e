package com.spreadsheet.calc.services;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;

/**
 * Outcome of calculating one cell: the value, its error code if it is an
 * error, and the text Excel would display.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CalculationResult {

    private final CellValue cellValue;

    private CalculationResult(CellValue cellValue) {
        this.cellValue = cellValue;
    }

    public static CalculationResult of(CellValue value) {
        return new CalculationResult(value == null ? CellValue.EMPTY : value);
    }

    @JsonIgnore
    public CellValue getCellValue() {
        return cellValue;
    }

    /**
     * Plain Java value: Double, String, Boolean, null, or the error text.
     */
    public Object getValue() {
        return cellValue.toObject();
    }

    public ErrorCode getError() {
        return cellValue.isError() ? cellValue.getError() : null;
    }

    public String getFormattedValue() {
        return cellValue.format();
    }

    public boolean isError() {
        return cellValue.isError();
    }

    @Override
    public String toString() {
        return getFormattedValue();
    }
}
