package com.spreadsheet.calc.models;

/**
 * Type tag of a {@link CellValue}.
 */
public enum ValueType {
    EMPTY,
    NUMBER,
    TEXT,
    BOOLEAN,
    ERROR
}
