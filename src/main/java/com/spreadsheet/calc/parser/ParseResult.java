package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellValue;

/**
 * Outcome of parsing cell content: either a literal value or a formula tree.
 */
public final class ParseResult {

    public enum Kind {
        VALUE,
        FORMULA
    }

    private final Kind kind;
    private final CellValue value;
    private final FormulaNode ast;

    private ParseResult(Kind kind, CellValue value, FormulaNode ast) {
        this.kind = kind;
        this.value = value;
        this.ast = ast;
    }

    public static ParseResult value(CellValue value) {
        return new ParseResult(Kind.VALUE, value, null);
    }

    public static ParseResult formula(FormulaNode ast) {
        return new ParseResult(Kind.FORMULA, null, ast);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isFormula() {
        return kind == Kind.FORMULA;
    }

    /**
     * The literal value; null for formulas.
     */
    public CellValue getValue() {
        return value;
    }

    /**
     * The formula tree; null for literals.
     */
    public FormulaNode getAst() {
        return ast;
    }
}
