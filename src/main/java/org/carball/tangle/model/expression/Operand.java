package org.carball.tangle.model.expression;

/**
 * One operand of a boolean expression: either a leaf (text only) or a
 * parenthesized group. Negation is recorded but never breaks a run.
 */
public record Operand(String text, LogicalExpression group, boolean negated) {

    public static Operand leaf(String text) {
        return new Operand(text, null, false);
    }

    public static Operand group(LogicalExpression group) {
        return new Operand(null, group, false);
    }

    public boolean isGroup() {
        return group != null;
    }
}
