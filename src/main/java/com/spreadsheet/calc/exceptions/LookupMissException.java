package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when a lookup finds no match (#N/A).
 */
public class LookupMissException extends CellErrorException {
    public LookupMissException(String message) {
        super(ErrorCode.NA, message);
    }
}
