package com.cdlc.core.expr;

/**
 * Prefix operators.
 */
public enum UnaryOperator {
    MINUS("-"),
    PLUS("+"),
    NOT("not");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
