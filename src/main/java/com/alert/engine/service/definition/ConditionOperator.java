package com.alert.engine.service.definition;

import java.util.Arrays;
import java.util.List;

/**
 * Comparison operators usable in trigger and auto-resolve conditions.
 */
public enum ConditionOperator {

    GREATER_THAN(">"),
    LESS_THAN("<"),
    EQUALS("=", "=="),
    NOT_EQUALS("!=", "≠"),
    GREATER_OR_EQUAL(">=", "≥"),
    LESS_OR_EQUAL("<=", "≤"),
    CONTAINS("contains"),
    REGEX("regex");

    private final List<String> symbols;

    ConditionOperator(String... symbols) {
        this.symbols = List.of(symbols);
    }

    public String getSymbol() {
        return symbols.get(0);
    }

    public boolean isOrdering() {
        return this == GREATER_THAN || this == LESS_THAN
                || this == GREATER_OR_EQUAL || this == LESS_OR_EQUAL;
    }

    /**
     * Parses an operator from its symbol ({@code >=}, {@code ≥}, {@code contains}) or constant name.
     *
     * @throws IllegalArgumentException for an unknown operator
     */
    public static ConditionOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Operator is required");
        }
        String trimmed = symbol.trim();
        return Arrays.stream(values())
                .filter(op -> op.symbols.contains(trimmed) || op.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown condition operator: " + symbol));
    }
}
