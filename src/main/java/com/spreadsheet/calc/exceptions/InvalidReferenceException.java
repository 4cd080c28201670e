package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when a formula points at a sheet or cell that does not exist,
 * or an index walks outside a range (#REF!).
 */
public class InvalidReferenceException extends CellErrorException {
    public InvalidReferenceException(String message) {
        super(ErrorCode.REF, message);
    }
}
