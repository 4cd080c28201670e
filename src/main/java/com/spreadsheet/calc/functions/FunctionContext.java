package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Operand;

/**
 * What a function may know about the cell it is evaluated for.
 */
public interface FunctionContext {

    /**
     * The cell whose formula is being evaluated (sheet-qualified), or null outside a cell.
     */
    CellAddress getCurrentCell();

    /**
     * Resolves a reference given as text ("B2", "Sheet2!A1:A9") at evaluation time.
     */
    Operand resolveReference(String reference);
}
