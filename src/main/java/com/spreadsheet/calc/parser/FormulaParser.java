package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidAddressException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.NamedRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for Excel formulas.
 *
 * <p>Precedence, tightest first: range (:), unary -/+, percent (%),
 * exponent (^, right-associative), * and /, + and -, concatenation (&amp;),
 * comparisons. Unqualified references are bound to the sheet passed to
 * {@link #parse(String, String)}; named ranges are replaced by the
 * references they stand for.
 */
public class FormulaParser {

    private final char listSeparator;
    private final NameResolver nameResolver;

    public FormulaParser(char listSeparator, NameResolver nameResolver) {
        this.listSeparator = listSeparator;
        this.nameResolver = nameResolver == null ? NameResolver.NONE : nameResolver;
    }

    public FormulaParser() {
        this(',', NameResolver.NONE);
    }

    /**
     * Parses cell content. Text starting with "=" is a formula, anything else a literal.
     *
     * @throws FormulaParseException if the formula is malformed
     */
    public ParseResult parse(String text, String currentSheet) {
        if (text != null && text.startsWith("=") && text.length() > 1) {
            return ParseResult.formula(parseFormula(text.substring(1), currentSheet));
        }
        return ParseResult.value(parseLiteral(text));
    }

    /**
     * Parses a formula body (no leading "=").
     */
    public FormulaNode parseFormula(String body, String currentSheet) {
        List<Token> tokens = new FormulaLexer(body, listSeparator).tokenize();
        Cursor cursor = new Cursor(body, tokens, currentSheet);
        FormulaNode node = parseComparison(cursor);
        if (!cursor.peek().is(Token.Type.END)) {
            throw cursor.error("Unexpected '" + cursor.peek().getText() + "'");
        }
        return node;
    }

    /**
     * Interprets non-formula content: numbers (including "15%"), "quoted" text,
     * TRUE/FALSE, error codes, otherwise plain text.
     */
    public static CellValue parseLiteral(String text) {
        if (text == null || text.isEmpty()) {
            return CellValue.EMPTY;
        }
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return CellValue.text(trimmed.substring(1, trimmed.length() - 1));
        }
        if (trimmed.equalsIgnoreCase("TRUE")) {
            return CellValue.TRUE;
        }
        if (trimmed.equalsIgnoreCase("FALSE")) {
            return CellValue.FALSE;
        }
        ErrorCode code = ErrorCode.fromText(trimmed);
        if (code != null) {
            return CellValue.error(code);
        }
        Double number = parseNumber(trimmed);
        if (number != null) {
            return CellValue.of(number);
        }
        return CellValue.text(text);
    }

    /**
     * Parses numeric text the way Excel accepts it when typed into a cell; null if not numeric.
     */
    public static Double parseNumber(String text) {
        String s = text.trim();
        if (s.isEmpty()) {
            return null;
        }
        boolean percent = s.endsWith("%");
        if (percent) {
            s = s.substring(0, s.length() - 1).trim();
        }
        if (s.isEmpty() || !isNumericSyntax(s)) {
            return null;
        }
        try {
            double value = Double.parseDouble(s);
            return percent ? value / 100 : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isNumericSyntax(String s) {
        // Double.parseDouble also accepts "NaN", "Infinity", hex and trailing 'd'/'f'
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!(Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'e' || c == 'E')) {
                return false;
            }
        }
        return true;
    }

    // ----------------------------------------------------------------
    // Grammar
    // ----------------------------------------------------------------

    private FormulaNode parseComparison(Cursor cursor) {
        FormulaNode left = parseConcat(cursor);
        while (isComparison(cursor.peek())) {
            BinaryOperator op = BinaryOperator.fromSymbol(cursor.next().getText());
            left = new FormulaNode.BinaryOp(op, left, parseConcat(cursor));
        }
        return left;
    }

    private boolean isComparison(Token token) {
        if (!token.is(Token.Type.OPERATOR)) {
            return false;
        }
        switch (token.getText()) {
            case "=":
            case "<>":
            case "<":
            case "<=":
            case ">":
            case ">=":
                return true;
            default:
                return false;
        }
    }

    private FormulaNode parseConcat(Cursor cursor) {
        FormulaNode left = parseAdditive(cursor);
        while (cursor.peek().isOperator("&")) {
            cursor.next();
            left = new FormulaNode.BinaryOp(BinaryOperator.CONCAT, left, parseAdditive(cursor));
        }
        return left;
    }

    private FormulaNode parseAdditive(Cursor cursor) {
        FormulaNode left = parseMultiplicative(cursor);
        while (cursor.peek().isOperator("+") || cursor.peek().isOperator("-")) {
            BinaryOperator op = BinaryOperator.fromSymbol(cursor.next().getText());
            left = new FormulaNode.BinaryOp(op, left, parseMultiplicative(cursor));
        }
        return left;
    }

    private FormulaNode parseMultiplicative(Cursor cursor) {
        FormulaNode left = parsePower(cursor);
        while (cursor.peek().isOperator("*") || cursor.peek().isOperator("/")) {
            BinaryOperator op = BinaryOperator.fromSymbol(cursor.next().getText());
            left = new FormulaNode.BinaryOp(op, left, parsePower(cursor));
        }
        return left;
    }

    private FormulaNode parsePower(Cursor cursor) {
        FormulaNode base = parseUnary(cursor);
        if (cursor.peek().isOperator("^")) {
            cursor.next();
            return new FormulaNode.BinaryOp(BinaryOperator.POWER, base, parsePower(cursor));
        }
        return base;
    }

    private FormulaNode parseUnary(Cursor cursor) {
        if (cursor.peek().isOperator("-")) {
            cursor.next();
            return new FormulaNode.UnaryOp(UnaryOperator.NEGATE, parseUnary(cursor));
        }
        if (cursor.peek().isOperator("+")) {
            cursor.next();
            return new FormulaNode.UnaryOp(UnaryOperator.PLUS, parseUnary(cursor));
        }
        return parsePostfix(cursor);
    }

    private FormulaNode parsePostfix(Cursor cursor) {
        FormulaNode node = parsePrimary(cursor);
        while (cursor.peek().is(Token.Type.PERCENT)) {
            cursor.next();
            node = new FormulaNode.UnaryOp(UnaryOperator.PERCENT, node);
        }
        return node;
    }

    private FormulaNode parsePrimary(Cursor cursor) {
        Token token = cursor.next();
        switch (token.getType()) {
            case NUMBER:
                return new FormulaNode.NumberLiteral(Double.parseDouble(token.getText()));
            case STRING:
                return new FormulaNode.StringLiteral(token.getText());
            case ERROR:
                return new FormulaNode.ErrorLiteral(ErrorCode.fromText(token.getText()));
            case LEFT_PAREN: {
                FormulaNode inner = parseComparison(cursor);
                cursor.expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            }
            case SHEET_PREFIX:
                return parseQualified(cursor, token);
            case REFERENCE:
                return parseReference(cursor, cursor.currentSheet, token);
            case IDENTIFIER:
                if (cursor.peek().is(Token.Type.LEFT_PAREN)) {
                    return parseFunctionCall(cursor, token);
                }
                return parseName(cursor, token.getText(), cursor.currentSheet);
            case END:
                throw cursor.error("Unexpected end of formula");
            default:
                throw new FormulaParseException("Unexpected '" + token.getText() + "'", cursor.text, token.getPosition());
        }
    }

    private FormulaNode parseQualified(Cursor cursor, Token prefix) {
        String sheet = prefix.getText();
        Token target = cursor.next();
        if (target.is(Token.Type.REFERENCE)) {
            return parseReference(cursor, sheet, target);
        }
        if (target.is(Token.Type.IDENTIFIER)) {
            return parseName(cursor, target.getText(), sheet);
        }
        throw new FormulaParseException("Expected a reference after '" + sheet + "!'", cursor.text, target.getPosition());
    }

    private FormulaNode parseReference(Cursor cursor, String sheet, Token token) {
        CellAddress start = toAddress(cursor, sheet, token);
        if (!cursor.peek().is(Token.Type.COLON)) {
            return new FormulaNode.CellReference(start);
        }
        cursor.next();
        Token endToken = cursor.next();
        String endSheet = sheet;
        if (endToken.is(Token.Type.SHEET_PREFIX)) {
            endSheet = endToken.getText();
            if (!endSheet.equalsIgnoreCase(sheet)) {
                throw new FormulaParseException("Range spans two sheets", cursor.text, endToken.getPosition());
            }
            endToken = cursor.next();
        }
        if (!endToken.is(Token.Type.REFERENCE)) {
            throw new FormulaParseException("Expected the end of a range", cursor.text, endToken.getPosition());
        }
        CellAddress end = toAddress(cursor, endSheet, endToken);
        return new FormulaNode.RangeReference(start, end);
    }

    private CellAddress toAddress(Cursor cursor, String sheet, Token token) {
        try {
            return CellAddress.parse(token.getText()).withSheet(sheet);
        } catch (InvalidAddressException e) {
            throw new FormulaParseException(e.getMessage(), cursor.text, token.getPosition());
        }
    }

    private FormulaNode parseFunctionCall(Cursor cursor, Token name) {
        cursor.expect(Token.Type.LEFT_PAREN, "'('");
        List<FormulaNode> args = new ArrayList<>();
        if (cursor.peek().is(Token.Type.RIGHT_PAREN)) {
            cursor.next();
            return new FormulaNode.FunctionCall(name.getText(), args);
        }
        while (true) {
            Token next = cursor.peek();
            if (next.is(Token.Type.SEPARATOR) || next.is(Token.Type.RIGHT_PAREN)) {
                args.add(FormulaNode.MissingArgument.INSTANCE);
            } else {
                args.add(parseComparison(cursor));
            }
            Token after = cursor.next();
            if (after.is(Token.Type.RIGHT_PAREN)) {
                return new FormulaNode.FunctionCall(name.getText(), args);
            }
            if (!after.is(Token.Type.SEPARATOR)) {
                throw new FormulaParseException("Expected '" + listSeparator + "' or ')'", cursor.text, after.getPosition());
            }
        }
    }

    private FormulaNode parseName(Cursor cursor, String name, String sheet) {
        if (name.equalsIgnoreCase("TRUE")) {
            return new FormulaNode.BooleanLiteral(true);
        }
        if (name.equalsIgnoreCase("FALSE")) {
            return new FormulaNode.BooleanLiteral(false);
        }
        NamedRange range = nameResolver.resolve(name, sheet);
        if (range == null) {
            return new FormulaNode.ErrorLiteral(ErrorCode.NAME, name);
        }
        if (range.isSingleCell()) {
            return new FormulaNode.CellReference(range.getStart());
        }
        return new FormulaNode.RangeReference(range.getStart(), range.getEnd());
    }

    /**
     * Position in the token stream for one parse call.
     */
    private static final class Cursor {
        private final String text;
        private final List<Token> tokens;
        private final String currentSheet;
        private int index;

        Cursor(String text, List<Token> tokens, String currentSheet) {
            this.text = text;
            this.tokens = tokens;
            this.currentSheet = currentSheet;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            Token token = tokens.get(index);
            if (!token.is(Token.Type.END)) {
                index++;
            }
            return token;
        }

        void expect(Token.Type type, String description) {
            Token token = next();
            if (!token.is(type)) {
                throw new FormulaParseException("Expected " + description, text, token.getPosition());
            }
        }

        FormulaParseException error(String message) {
            return new FormulaParseException(message, text, peek().getPosition());
        }
    }
}
