package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a workbook id is not registered with the WorkbookService.
 */
public class WorkbookNotFoundException extends RuntimeException {
    public WorkbookNotFoundException(String message) {
        super(message);
    }
}
