package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a caller addresses a sheet that doesn't exist in the workbook.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
