package com.spreadsheet.calc.exceptions;

/**
 * Simple DTO to structure error output with a code and message.
 * For example:
 * {
 *   "code": "INVALID_ANALYSIS",
 *   "message": "formulas_by_sheet must be an object"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Maps an exception escaping the engine to its error code.
     */
    public static ErrorResponse from(RuntimeException ex) {
        if (ex instanceof AnalysisFormatException) {
            return new ErrorResponse("INVALID_ANALYSIS", ex.getMessage());
        }
        if (ex instanceof SheetNotFoundException) {
            return new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        }
        if (ex instanceof WorkbookNotFoundException) {
            return new ErrorResponse("WORKBOOK_NOT_FOUND", ex.getMessage());
        }
        if (ex instanceof DuplicateSheetException) {
            return new ErrorResponse("DUPLICATE_SHEET", ex.getMessage());
        }
        if (ex instanceof InvalidAddressException) {
            return new ErrorResponse("INVALID_ADDRESS", ex.getMessage());
        }
        if (ex instanceof CellErrorException) {
            return new ErrorResponse(((CellErrorException) ex).getErrorCode().getText(), ex.getMessage());
        }
        return new ErrorResponse("INTERNAL_ERROR", ex.getMessage());
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
