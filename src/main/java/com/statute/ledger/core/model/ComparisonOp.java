package com.statute.ledger.core.model;

/**
 * Comparison operators for {@code Compare} conditions.
 */
public enum ComparisonOp {
    EQUAL("=="),
    NOT_EQUAL("!="),
    GREATER_THAN(">"),
    GREATER_OR_EQUAL(">="),
    LESS_THAN("<"),
    LESS_OR_EQUAL("<=");

    private final String symbol;

    ComparisonOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether this operator needs an ordering between values (as opposed to equality only).
     */
    public boolean isOrdering() {
        return this != EQUAL && this != NOT_EQUAL;
    }

    /**
     * Applies this operator to the result of a {@code compareTo} call.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQUAL -> comparison == 0;
            case NOT_EQUAL -> comparison != 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_OR_EQUAL -> comparison >= 0;
            case LESS_THAN -> comparison < 0;
            case LESS_OR_EQUAL -> comparison <= 0;
        };
    }

    /**
     * Parses an operator from its symbol or a short alias.
     * <ul>
     *   <li>EQUAL: "=", "==", "eq"</li>
     *   <li>NOT_EQUAL: "!=", "ne"</li>
     *   <li>GREATER_THAN: "&gt;", "gt"</li>
     *   <li>GREATER_OR_EQUAL: "&gt;=", "gte"</li>
     *   <li>LESS_THAN: "&lt;", "lt"</li>
     *   <li>LESS_OR_EQUAL: "&lt;=", "lte"</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the value is not a known operator
     */
    public static ComparisonOp fromSymbol(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operator must not be blank");
        }
        return switch (value.trim().toLowerCase()) {
            case "=", "==", "eq" -> EQUAL;
            case "!=", "ne" -> NOT_EQUAL;
            case ">", "gt" -> GREATER_THAN;
            case ">=", "gte" -> GREATER_OR_EQUAL;
            case "<", "lt" -> LESS_THAN;
            case "<=", "lte" -> LESS_OR_EQUAL;
            default -> throw new IllegalArgumentException("Unknown comparison operator: " + value);
        };
    }
}
