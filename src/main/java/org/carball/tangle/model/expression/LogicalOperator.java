package org.carball.tangle.model.expression;

import java.util.Locale;

public enum LogicalOperator {
    AND("&&"),
    OR("||");

    private final String symbol;

    LogicalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Accepts the symbolic and the word forms in any case ("&&", "and", "OR").
     */
    public static LogicalOperator fromToken(String token) {
        if (token != null) {
            String value = token.trim().toLowerCase(Locale.ROOT);
            switch (value) {
                case "&&":
                case "and":
                    return AND;
                case "||":
                case "or":
                    return OR;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Unknown logical operator: " + token);
    }
}
