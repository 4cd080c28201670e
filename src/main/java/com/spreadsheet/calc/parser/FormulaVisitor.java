package com.spreadsheet.calc.parser;

/**
 * Visitor over {@link FormulaNode} subtypes.
 */
public interface FormulaVisitor<R> {

    R visitNumber(FormulaNode.NumberLiteral node);

    R visitString(FormulaNode.StringLiteral node);

    R visitBoolean(FormulaNode.BooleanLiteral node);

    R visitError(FormulaNode.ErrorLiteral node);

    R visitMissing(FormulaNode.MissingArgument node);

    R visitCellReference(FormulaNode.CellReference node);

    R visitRangeReference(FormulaNode.RangeReference node);

    R visitFunctionCall(FormulaNode.FunctionCall node);

    R visitBinary(FormulaNode.BinaryOp node);

    R visitUnary(FormulaNode.UnaryOp node);
}
