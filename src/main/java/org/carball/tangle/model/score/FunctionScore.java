package org.carball.tangle.model.score;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.tangle.model.construct.SourceLocation;

import java.util.List;

/**
 * Result of scoring one function unit. Nested functions and lambdas produce
 * their own {@code FunctionScore} with {@link #getParent()} set.
 */
@Value
@Builder
public class FunctionScore {

    String identifier;
    String language;
    SourceLocation location;
    Score score;
    int maxNesting;

    /** Participates in a recursion cycle and received the flat recursion increment. */
    boolean recursive;

    /** Muted by a compensation rule; contributes nothing and is never tiered. */
    boolean suppressed;

    /** Identifier of the enclosing unit, null for top-level functions. */
    String parent;

    @Singular
    List<Increment> increments;

    public int getCognitive() {
        return score.cognitive();
    }

    public int getCyclomatic() {
        return score.cyclomatic();
    }

    public boolean isNested() {
        return parent != null;
    }
}
