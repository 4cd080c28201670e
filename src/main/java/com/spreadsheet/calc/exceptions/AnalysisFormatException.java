package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a workbook analysis document is malformed.
 * Aborts the whole load.
 */
public class AnalysisFormatException extends RuntimeException {
    public AnalysisFormatException(String message) {
        super(message);
    }

    public AnalysisFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
