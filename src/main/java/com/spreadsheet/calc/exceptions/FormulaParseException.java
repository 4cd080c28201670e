package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.ErrorCode;

/**
 * Thrown when formula text cannot be parsed.
 * The cell holding the formula resolves to #NAME?.
 */
public class FormulaParseException extends CellErrorException {

    private final String formula;
    private final int position;

    public FormulaParseException(String message, String formula, int position) {
        super(ErrorCode.NAME, message + " at position " + position + " in '" + formula + "'");
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() {
        return formula;
    }

    public int getPosition() {
        return position;
    }
}
