package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.ErrorCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text (without the leading "=") into tokens.
 */
final class FormulaLexer {

    private final String formula;
    private final char listSeparator;
    private int pos;

    FormulaLexer(String formula, char listSeparator) {
        this.formula = formula;
        this.listSeparator = listSeparator;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= formula.length()) {
                tokens.add(new Token(Token.Type.END, "", pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char c = formula.charAt(pos);
        int start = pos;

        if (c == listSeparator) {
            pos++;
            return new Token(Token.Type.SEPARATOR, String.valueOf(c), start);
        }
        switch (c) {
            case '(':
                pos++;
                return new Token(Token.Type.LEFT_PAREN, "(", start);
            case ')':
                pos++;
                return new Token(Token.Type.RIGHT_PAREN, ")", start);
            case ':':
                pos++;
                return new Token(Token.Type.COLON, ":", start);
            case '%':
                pos++;
                return new Token(Token.Type.PERCENT, "%", start);
            case '"':
                return readString();
            case '#':
                return readError();
            case '\'':
                return readQuotedSheet();
            case '+':
            case '-':
            case '*':
            case '/':
            case '^':
            case '&':
            case '=':
                pos++;
                return new Token(Token.Type.OPERATOR, String.valueOf(c), start);
            case '<':
                pos++;
                if (pos < formula.length() && (formula.charAt(pos) == '=' || formula.charAt(pos) == '>')) {
                    pos++;
                }
                return new Token(Token.Type.OPERATOR, formula.substring(start, pos), start);
            case '>':
                pos++;
                if (pos < formula.length() && formula.charAt(pos) == '=') {
                    pos++;
                }
                return new Token(Token.Type.OPERATOR, formula.substring(start, pos), start);
            default:
                break;
        }
        if (Character.isDigit(c) || (c == '.' && pos + 1 < formula.length() && Character.isDigit(formula.charAt(pos + 1)))) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_' || c == '$' || c == '\\') {
            return readWord();
        }
        throw new FormulaParseException("Unexpected character '" + c + "'", formula, start);
    }

    private void skipWhitespace() {
        while (pos < formula.length() && Character.isWhitespace(formula.charAt(pos))) {
            pos++;
        }
    }

    private Token readNumber() {
        int start = pos;
        while (pos < formula.length() && Character.isDigit(formula.charAt(pos))) {
            pos++;
        }
        if (pos < formula.length() && formula.charAt(pos) == '.') {
            pos++;
            while (pos < formula.length() && Character.isDigit(formula.charAt(pos))) {
                pos++;
            }
        }
        if (pos < formula.length() && (formula.charAt(pos) == 'E' || formula.charAt(pos) == 'e')) {
            int mark = pos;
            pos++;
            if (pos < formula.length() && (formula.charAt(pos) == '+' || formula.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < formula.length() && Character.isDigit(formula.charAt(pos))) {
                while (pos < formula.length() && Character.isDigit(formula.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        return new Token(Token.Type.NUMBER, formula.substring(start, pos), start);
    }

    private Token readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < formula.length()) {
            char c = formula.charAt(pos);
            if (c == '"') {
                if (pos + 1 < formula.length() && formula.charAt(pos + 1) == '"') {
                    sb.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated string literal", formula, start);
    }

    private Token readError() {
        int start = pos;
        String rest = formula.substring(pos).toUpperCase();
        ErrorCode best = null;
        for (ErrorCode code : ErrorCode.values()) {
            if (rest.startsWith(code.getText()) && (best == null || code.getText().length() > best.getText().length())) {
                best = code;
            }
        }
        if (best == null) {
            throw new FormulaParseException("Unknown error literal", formula, start);
        }
        pos += best.getText().length();
        return new Token(Token.Type.ERROR, best.getText(), start);
    }

    private Token readQuotedSheet() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < formula.length()) {
            char c = formula.charAt(pos);
            if (c == '\'') {
                if (pos + 1 < formula.length() && formula.charAt(pos + 1) == '\'') {
                    sb.append('\'');
                    pos += 2;
                    continue;
                }
                pos++;
                if (pos < formula.length() && formula.charAt(pos) == '!') {
                    pos++;
                    return new Token(Token.Type.SHEET_PREFIX, sb.toString(), start);
                }
                throw new FormulaParseException("Quoted sheet name must be followed by '!'", formula, pos);
            }
            sb.append(c);
            pos++;
        }
        throw new FormulaParseException("Unterminated sheet name", formula, start);
    }

    private Token readWord() {
        int start = pos;
        while (pos < formula.length()) {
            char c = formula.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '\\') {
                pos++;
            } else {
                break;
            }
        }
        String word = formula.substring(start, pos);
        if (pos < formula.length() && formula.charAt(pos) == '!') {
            pos++;
            return new Token(Token.Type.SHEET_PREFIX, word, start);
        }
        if (peekNonSpace() == '(') {
            return new Token(Token.Type.IDENTIFIER, word, start);
        }
        if (CellAddress.isValidLocal(word)) {
            return new Token(Token.Type.REFERENCE, word, start);
        }
        return new Token(Token.Type.IDENTIFIER, word, start);
    }

    private char peekNonSpace() {
        int i = pos;
        while (i < formula.length() && Character.isWhitespace(formula.charAt(i))) {
            i++;
        }
        return i < formula.length() ? formula.charAt(i) : '\0';
    }
}
