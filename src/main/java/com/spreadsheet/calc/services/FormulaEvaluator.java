package com.spreadsheet.calc.services;

import com.spreadsheet.calc.exceptions.CellErrorException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.functions.Coercion;
import com.spreadsheet.calc.functions.FunctionContext;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.NamedRange;
import com.spreadsheet.calc.models.Operand;
import com.spreadsheet.calc.models.RangeValue;
import com.spreadsheet.calc.parser.FormulaNode;
import com.spreadsheet.calc.parser.FormulaVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a formula tree for one cell and produces its value.
 * Operators and functions go through the registry; a {@link CellErrorException}
 * raised anywhere below a function argument becomes an error value there,
 * so IFERROR and friends can see it.
 */
public class FormulaEvaluator implements FormulaVisitor<Operand>, FunctionContext {

    private static final int MAX_RANGE_CELLS = 5_000_000;

    private final FunctionRegistry registry;
    private final CellReader reader;
    private final CellAddress currentCell;

    public FormulaEvaluator(FunctionRegistry registry, CellReader reader, CellAddress currentCell) {
        this.registry = registry;
        this.reader = reader;
        this.currentCell = currentCell;
    }

    /**
     * Evaluates a whole formula to the single value stored in the cell.
     * A blank result reads as 0, a range result is intersected with the current cell.
     */
    public CellValue evaluate(FormulaNode formula) {
        try {
            CellValue value = Coercion.scalar(formula.accept(this), this);
            return value.isEmpty() ? CellValue.ZERO : value;
        } catch (CellErrorException e) {
            return CellValue.error(e.getErrorCode());
        }
    }

    private Operand evaluateArgument(FormulaNode node) {
        try {
            return node.accept(this);
        } catch (CellErrorException e) {
            return CellValue.error(e.getErrorCode());
        }
    }

    @Override
    public CellAddress getCurrentCell() {
        return currentCell;
    }

    @Override
    public Operand resolveReference(String reference) {
        String sheet = currentCell == null ? null : currentCell.getSheetName();
        NamedRange named = reader.resolveName(reference, sheet);
        if (named != null) {
            return read(named.getStart(), named.getEnd());
        }
        CellAddress[] corners;
        try {
            corners = CellAddress.parseRange(reference);
        } catch (InvalidAddressException e) {
            throw new InvalidReferenceException("Not a reference: " + reference);
        }
        CellAddress start = corners[0].getSheetName() == null ? corners[0].withSheet(sheet) : corners[0];
        CellAddress end = corners[1].withSheet(start.getSheetName());
        return read(start, end);
    }

    private Operand read(CellAddress start, CellAddress end) {
        if (start.equals(end)) {
            return reader.read(start);
        }
        return readRange(start, end);
    }

    private RangeValue readRange(CellAddress first, CellAddress second) {
        int top = Math.min(first.getRow(), second.getRow());
        int left = Math.min(first.getColumn(), second.getColumn());
        int rows = Math.abs(first.getRow() - second.getRow()) + 1;
        int columns = Math.abs(first.getColumn() - second.getColumn()) + 1;
        if ((long) rows * columns > MAX_RANGE_CELLS) {
            throw new InvalidReferenceException("Range too large: " + rows + "x" + columns);
        }
        String sheet = first.getSheetName();
        CellValue[] values = new CellValue[rows * columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r * columns + c] = reader.read(new CellAddress(sheet, left + c, top + r));
            }
        }
        return new RangeValue(sheet, top, left, rows, columns, values);
    }

    @Override
    public Operand visitNumber(FormulaNode.NumberLiteral node) {
        return CellValue.of(node.getValue());
    }

    @Override
    public Operand visitString(FormulaNode.StringLiteral node) {
        return CellValue.text(node.getValue());
    }

    @Override
    public Operand visitBoolean(FormulaNode.BooleanLiteral node) {
        return CellValue.bool(node.getValue());
    }

    @Override
    public Operand visitError(FormulaNode.ErrorLiteral node) {
        return CellValue.error(node.getCode());
    }

    @Override
    public Operand visitMissing(FormulaNode.MissingArgument node) {
        return CellValue.EMPTY;
    }

    @Override
    public Operand visitCellReference(FormulaNode.CellReference node) {
        return reader.read(node.getAddress());
    }

    @Override
    public Operand visitRangeReference(FormulaNode.RangeReference node) {
        return readRange(node.getStart(), node.getEnd());
    }

    @Override
    public Operand visitFunctionCall(FormulaNode.FunctionCall node) {
        List<Operand> args = new ArrayList<>(node.getArguments().size());
        for (FormulaNode argument : node.getArguments()) {
            args.add(argument instanceof FormulaNode.CellReference
                    ? referenceArgument(((FormulaNode.CellReference) argument).getAddress())
                    : evaluateArgument(argument));
        }
        return registry.call(node.getName(), this, args);
    }

    // a referenced cell is passed as a one-cell range: SUM(A1) ignores text in A1, SUM("5") does not
    private Operand referenceArgument(CellAddress address) {
        try {
            return readRange(address, address);
        } catch (CellErrorException e) {
            return CellValue.error(e.getErrorCode());
        }
    }

    @Override
    public Operand visitBinary(FormulaNode.BinaryOp node) {
        Operand left = evaluateArgument(node.getLeft());
        Operand right = evaluateArgument(node.getRight());
        return registry.callBinary(node.getOperator(), this, left, right);
    }

    @Override
    public Operand visitUnary(FormulaNode.UnaryOp node) {
        return registry.callUnary(node.getOperator(), this, evaluateArgument(node.getOperand()));
    }
}
