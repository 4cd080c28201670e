package com.spreadsheet.calc.exceptions;

/**
 * Thrown when creating a sheet whose name is already taken
 * (names compare case-insensitively).
 */
public class DuplicateSheetException extends RuntimeException {
    public DuplicateSheetException(String message) {
        super(message);
    }
}
