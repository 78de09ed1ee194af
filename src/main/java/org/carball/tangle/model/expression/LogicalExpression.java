package org.carball.tangle.model.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * A boolean expression as a flat sequence of operands joined by operators.
 * {@code operators.get(i)} sits between {@code operands.get(i)} and
 * {@code operands.get(i + 1)}.
 */
public record LogicalExpression(List<Operand> operands, List<LogicalOperator> operators) {

    public LogicalExpression {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        if (!operands.isEmpty() && operators.size() != operands.size() - 1) {
            throw new IllegalArgumentException("Expression with " + operands.size()
                    + " operands needs " + (operands.size() - 1) + " operators, got " + operators.size());
        }
        if (operands.isEmpty() && !operators.isEmpty()) {
            throw new IllegalArgumentException("Operators without operands");
        }
    }

    public static LogicalExpression single(String operand) {
        return new LogicalExpression(List.of(Operand.leaf(operand)), List.of());
    }

    /**
     * Builds an expression from alternating operands and operators, e.g.
     * {@code of("a", "&&", "b", "||", "c")}. Operands may be {@link String}s,
     * {@link Operand}s or nested {@link LogicalExpression}s (taken as groups).
     */
    public static LogicalExpression of(Object... tokens) {
        List<Operand> operands = new ArrayList<>();
        List<LogicalOperator> operators = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            Object token = tokens[i];
            if (i % 2 == 1) {
                operators.add(LogicalOperator.fromToken(String.valueOf(token)));
            } else if (token instanceof Operand operand) {
                operands.add(operand);
            } else if (token instanceof LogicalExpression group) {
                operands.add(Operand.group(group));
            } else {
                operands.add(Operand.leaf(String.valueOf(token)));
            }
        }
        return new LogicalExpression(operands, operators);
    }

    /**
     * Operator occurrences in this expression and all nested groups.
     */
    public int operatorCount() {
        int count = operators.size();
        for (Operand operand : operands) {
            if (operand.isGroup()) {
                count += operand.group().operatorCount();
            }
        }
        return count;
    }
}
