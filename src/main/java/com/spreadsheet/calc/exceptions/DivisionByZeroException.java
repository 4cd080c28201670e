package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

public class DivisionByZeroException extends CellErrorException {
    public DivisionByZeroException(String message) {
        super(ErrorCode.DIV0, message);
    }
}
