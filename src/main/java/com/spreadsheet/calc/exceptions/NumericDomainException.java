package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when a numeric argument is outside a function's domain,
 * e.g. SQRT(-1) (#NUM!).
 */
public class NumericDomainException extends CellErrorException {
    public NumericDomainException(String message) {
        super(ErrorCode.NUM, message);
    }
}
