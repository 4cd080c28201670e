package com.spreadsheet.calc.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the free references of a formula tree: every cell reference,
 * every range reference, and whether the formula contains a dynamic
 * reference (INDIRECT) whose target is only known at evaluation time.
 */
public final class ReferenceCollector implements FormulaVisitor<Void> {

    private final List<FormulaNode.CellReference> cells = new ArrayList<>();
    private final List<FormulaNode.RangeReference> ranges = new ArrayList<>();
    private boolean dynamic;

    private ReferenceCollector() {
    }

    public static ReferenceCollector collect(FormulaNode node) {
        ReferenceCollector collector = new ReferenceCollector();
        node.accept(collector);
        return collector;
    }

    public List<FormulaNode.CellReference> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public List<FormulaNode.RangeReference> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    public boolean hasDynamicReferences() {
        return dynamic;
    }

    @Override
    public Void visitNumber(FormulaNode.NumberLiteral node) {
        return null;
    }

    @Override
    public Void visitString(FormulaNode.StringLiteral node) {
        return null;
    }

    @Override
    public Void visitBoolean(FormulaNode.BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitError(FormulaNode.ErrorLiteral node) {
        return null;
    }

    @Override
    public Void visitMissing(FormulaNode.MissingArgument node) {
        return null;
    }

    @Override
    public Void visitCellReference(FormulaNode.CellReference node) {
        cells.add(node);
        return null;
    }

    @Override
    public Void visitRangeReference(FormulaNode.RangeReference node) {
        ranges.add(node);
        return null;
    }

    @Override
    public Void visitFunctionCall(FormulaNode.FunctionCall node) {
        if ("INDIRECT".equals(node.getName())) {
            dynamic = true;
        }
        for (FormulaNode arg : node.getArguments()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinary(FormulaNode.BinaryOp node) {
        node.getLeft().accept(this);
        node.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(FormulaNode.UnaryOp node) {
        node.getOperand().accept(this);
        return null;
    }
}
