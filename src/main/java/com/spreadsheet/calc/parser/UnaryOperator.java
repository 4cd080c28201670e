package com.spreadsheet.calc.parser;

public enum UnaryOperator {
    NEGATE("-"),
    PLUS("+"),
    PERCENT("%");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
