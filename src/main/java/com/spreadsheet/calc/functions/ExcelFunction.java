package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.models.Operand;

import java.util.List;

/**
 * Handler of one built-in function. Arguments arrive evaluated; errors are
 * signalled by throwing a {@link com.spreadsheet.calc.exceptions.CellErrorException}
 * or by returning an error value.
 */
@FunctionalInterface
public interface ExcelFunction {

    Operand apply(FunctionContext context, List<Operand> args);
}
