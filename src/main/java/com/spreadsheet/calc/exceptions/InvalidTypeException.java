package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when an operand can't be coerced to the type an operator or
 * function expects, e.g. "abc" + 1 (#VALUE!).
 */
public class InvalidTypeException extends CellErrorException {
    public InvalidTypeException(String message) {
        super(ErrorCode.VALUE, message);
    }
}
