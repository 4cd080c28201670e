package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Immutable formula syntax tree. Nodes are shared between cells through
 * the parse cache, so they must never be mutated after construction.
 */
public abstract class FormulaNode {

    public abstract <R> R accept(FormulaVisitor<R> visitor);

    /**
     * Formula text for this subtree, without the leading "=".
     */
    public abstract String toFormula();

    @Override
    public String toString() {
        return toFormula();
    }

    public static final class NumberLiteral extends FormulaNode {
        private final double value;

        public NumberLiteral(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public String toFormula() {
            return CellValue.formatNumber(value);
        }
    }

    public static final class StringLiteral extends FormulaNode {
        private final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitString(this);
        }

        @Override
        public String toFormula() {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
    }

    public static final class BooleanLiteral extends FormulaNode {
        private final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitBoolean(this);
        }

        @Override
        public String toFormula() {
            return value ? "TRUE" : "FALSE";
        }
    }

    /**
     * An error written into the formula ("=#N/A"), or a name that did not resolve.
     */
    public static final class ErrorLiteral extends FormulaNode {
        private final ErrorCode code;
        private final String source;

        public ErrorLiteral(ErrorCode code, String source) {
            this.code = code;
            this.source = source;
        }

        public ErrorLiteral(ErrorCode code) {
            this(code, code.getText());
        }

        public ErrorCode getCode() {
            return code;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitError(this);
        }

        @Override
        public String toFormula() {
            return source;
        }
    }

    /**
     * An omitted argument, as in IF(A1,,1).
     */
    public static final class MissingArgument extends FormulaNode {
        public static final MissingArgument INSTANCE = new MissingArgument();

        private MissingArgument() {
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitMissing(this);
        }

        @Override
        public String toFormula() {
            return "";
        }
    }

    /**
     * A single cell. The address is always sheet-qualified; unqualified
     * references are bound to the sheet the formula was parsed against.
     */
    public static final class CellReference extends FormulaNode {
        private final CellAddress address;

        public CellReference(CellAddress address) {
            if (address.getSheetName() == null) {
                throw new IllegalArgumentException("Cell reference must be sheet-qualified: " + address);
            }
            this.address = address;
        }

        public CellAddress getAddress() {
            return address;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitCellReference(this);
        }

        @Override
        public String toFormula() {
            return address.toString();
        }
    }

    /**
     * A rectangular range on one sheet. Corners are normalized to
     * top-left / bottom-right.
     */
    public static final class RangeReference extends FormulaNode {
        private final CellAddress start;
        private final CellAddress end;

        public RangeReference(CellAddress first, CellAddress second) {
            String sheet = first.getSheetName();
            if (sheet == null) {
                throw new IllegalArgumentException("Range reference must be sheet-qualified: " + first);
            }
            int top = Math.min(first.getRow(), second.getRow());
            int bottom = Math.max(first.getRow(), second.getRow());
            int left = Math.min(first.getColumn(), second.getColumn());
            int right = Math.max(first.getColumn(), second.getColumn());
            this.start = new CellAddress(sheet, left, top, first.isAbsoluteColumn(), first.isAbsoluteRow());
            this.end = new CellAddress(sheet, right, bottom, second.isAbsoluteColumn(), second.isAbsoluteRow());
        }

        public CellAddress getStart() {
            return start;
        }

        public CellAddress getEnd() {
            return end;
        }

        public String getSheetName() {
            return start.getSheetName();
        }

        public int getRowCount() {
            return end.getRow() - start.getRow() + 1;
        }

        public int getColumnCount() {
            return end.getColumn() - start.getColumn() + 1;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitRangeReference(this);
        }

        @Override
        public String toFormula() {
            String endText = end.toString();
            return start + ":" + endText.substring(endText.lastIndexOf('!') + 1);
        }
    }

    public static final class FunctionCall extends FormulaNode {
        private final String name;
        private final List<FormulaNode> arguments;

        public FunctionCall(String name, List<FormulaNode> arguments) {
            this.name = name.toUpperCase(Locale.ROOT);
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String getName() {
            return name;
        }

        public List<FormulaNode> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String toFormula() {
            return name + "(" + arguments.stream().map(FormulaNode::toFormula).collect(Collectors.joining(",")) + ")";
        }
    }

    public static final class BinaryOp extends FormulaNode {
        private final BinaryOperator operator;
        private final FormulaNode left;
        private final FormulaNode right;

        public BinaryOp(BinaryOperator operator, FormulaNode left, FormulaNode right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getLeft() {
            return left;
        }

        public FormulaNode getRight() {
            return right;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toFormula() {
            return "(" + left.toFormula() + operator.getSymbol() + right.toFormula() + ")";
        }
    }

    public static final class UnaryOp extends FormulaNode {
        private final UnaryOperator operator;
        private final FormulaNode operand;

        public UnaryOp(UnaryOperator operator, FormulaNode operand) {
            this.operator = operator;
            this.operand = operand;
        }

        public UnaryOperator getOperator() {
            return operator;
        }

        public FormulaNode getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(FormulaVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toFormula() {
            if (operator == UnaryOperator.PERCENT) {
                return operand.toFormula() + "%";
            }
            return operator.getSymbol() + operand.toFormula();
        }
    }
}
