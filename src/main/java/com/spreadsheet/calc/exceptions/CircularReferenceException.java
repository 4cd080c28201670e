package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when a cell is reached again while it is still being calculated,
 * or when a cycle fails to converge within the iteration limit.
 */
public class CircularReferenceException extends CellErrorException {
    public CircularReferenceException(String message) {
        super(ErrorCode.CIRCULAR, message);
    }
}
