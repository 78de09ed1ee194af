package org.carball.tangle.model.construct;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.tangle.model.expression.LogicalExpression;

import java.util.List;
import java.util.Set;

/**
 * One control-flow relevant element of a function body. Children are kept in
 * source order; nesting is implied by tree depth.
 */
@Value
@Builder(toBuilder = true)
public class ConstructNode {

    ConstructKind kind;

    @Singular
    List<ConstructNode> children;

    @Builder.Default
    SourceLocation location = SourceLocation.unknown();

    @Singular
    Set<String> hints;

    /** Number of non-default case labels (SWITCH only). */
    int caseLabels;

    /** Operator occurrences inside a LOGICAL_RUN; zero means one. */
    int operators;

    /** Declared name of a nested function or lambda; operator symbol of a LOGICAL_RUN. */
    String name;

    /** Called function of a RECURSIVE_CALL; null means a direct self call. */
    String target;

    /** Raw boolean condition, resolved into LOGICAL_RUN children before scoring. */
    LogicalExpression condition;

    public static ConstructNode of(ConstructKind kind, ConstructNode... children) {
        return ConstructNode.builder().kind(kind).children(List.of(children)).build();
    }

    public Classification classification() {
        return kind.classification();
    }

    public boolean hasHint(String hint) {
        return hints.contains(hint);
    }

    public boolean hasCondition() {
        return condition != null;
    }

    /**
     * Operator occurrences this node stands for when it is a logical run.
     */
    public int operatorCount() {
        return Math.max(1, operators);
    }
}
