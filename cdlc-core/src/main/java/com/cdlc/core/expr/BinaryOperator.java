package com.cdlc.core.expr;

import java.util.Arrays;

/**
 * Infix operators permitted in CDL expressions.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("^"),
    LESS("<"),
    LESS_EQUAL("<="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    EQUAL("=="),
    NOT_EQUAL("<>"),
    AND("and"),
    OR("or");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its source symbol.
     *
     * @param symbol operator text, e.g. {@code "*"}
     * @return the operator
     * @throws IllegalArgumentException if the symbol is not an operator
     */
    public static BinaryOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
            .filter(op -> op.symbol.equals(symbol))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol));
    }

    boolean isArithmetic() {
        return this == ADD || this == SUBTRACT || this == MULTIPLY || this == DIVIDE || this == POWER;
    }

    boolean isLogical() {
        return this == AND || this == OR;
    }
}
