package com.spreadsheet.calc.services;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.NamedRange;

/**
 * Where the evaluator gets referenced values from.
 */
public interface CellReader {

    /**
     * Value of a sheet-qualified cell; empty for cells never set.
     *
     * @throws com.spreadsheet.calc.exceptions.InvalidReferenceException if the sheet doesn't exist
     */
    CellValue read(CellAddress address);

    NamedRange resolveName(String name, String currentSheet);
}
