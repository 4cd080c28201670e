package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown while evaluating a formula when the result is an Excel error.
 * The evaluator turns it into an error value on the cell being calculated;
 * it never escapes a calculation pass.
 */
public class CellErrorException extends RuntimeException {

    private final ErrorCode errorCode;

    public CellErrorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CellErrorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Creates the most specific exception for the given code.
     */
    public static CellErrorException of(ErrorCode code, String message) {
        switch (code) {
            case DIV0:
                return new DivisionByZeroException(message);
            case VALUE:
                return new InvalidTypeException(message);
            case REF:
                return new InvalidReferenceException(message);
            case NUM:
                return new NumericDomainException(message);
            case NA:
                return new LookupMissException(message);
            case CIRCULAR:
                return new CircularReferenceException(message);
            default:
                return new CellErrorException(code, message);
        }
    }
}
