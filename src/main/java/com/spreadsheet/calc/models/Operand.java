package com.spreadsheet.calc.models;

/**
 * Result of evaluating a formula sub-expression: either a single
 * {@link CellValue} or a rectangular {@link RangeValue}.
 */
public interface Operand {

    boolean isRange();
}
