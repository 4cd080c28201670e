package com.spreadsheet.calc.parser;

/**
 * A lexical token of a formula. position is the offset in the formula text
 * (the leading "=" excluded).
 */
final class Token {

    enum Type {
        NUMBER,
        STRING,
        ERROR,
        REFERENCE,
        IDENTIFIER,
        SHEET_PREFIX,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        SEPARATOR,
        COLON,
        PERCENT,
        END
    }

    private final Type type;
    private final String text;
    private final int position;

    Token(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    String getText() {
        return text;
    }

    int getPosition() {
        return position;
    }

    boolean is(Type type) {
        return this.type == type;
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
