package com.discovery.generator.codedom;

/**
 * Operators supported by {@link BinaryOperatorExpression}.
 */
public enum BinaryOperator {
    /**
     * Reference identity ({@code ==}).
     */
    IDENTITY_EQUALITY("=="),

    /**
     * Reference non-identity ({@code !=}).
     */
    IDENTITY_INEQUALITY("!="),

    BOOLEAN_AND("&&"),
    BOOLEAN_OR("||");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
