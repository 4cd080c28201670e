package com.spreadsheet.calc.models;

/**
 * Calculation state of a cell.
 * DIRTY cells are recalculated on the next pass; CALCULATING is only
 * observed while the cell's formula is being evaluated.
 */
public enum CellState {
    CLEAN,
    DIRTY,
    CALCULATING,
    ERROR
}
