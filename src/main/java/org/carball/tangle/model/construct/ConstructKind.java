package org.carball.tangle.model.construct;

import org.carball.tangle.exception.UnmappedConstructException;

import java.util.Locale;

/**
 * The closed vocabulary of control-flow constructs every front end maps onto.
 * The classification of a kind is fixed and never inferred from context.
 */
public enum ConstructKind {
    IF(Classification.STRUCTURAL, true),
    TERNARY(Classification.STRUCTURAL, true),
    SWITCH(Classification.STRUCTURAL, true),
    FOR(Classification.STRUCTURAL, true),
    WHILE(Classification.STRUCTURAL, true),
    DO_WHILE(Classification.STRUCTURAL, true),
    CATCH(Classification.STRUCTURAL, true),

    ELSE_IF(Classification.HYBRID, true),
    ELSE(Classification.HYBRID, true),

    LOGICAL_RUN(Classification.FUNDAMENTAL, false),
    GOTO(Classification.FUNDAMENTAL, false),
    BREAK_LABEL(Classification.FUNDAMENTAL, false),
    CONTINUE_LABEL(Classification.FUNDAMENTAL, false),
    RECURSIVE_CALL(Classification.FUNDAMENTAL, false),

    TRY(Classification.IGNORED, false),
    FINALLY(Classification.IGNORED, false),
    BREAK_PLAIN(Classification.IGNORED, false),
    CONTINUE_PLAIN(Classification.IGNORED, false),

    // Nest for their contents, which are scored as separate function units
    LAMBDA(Classification.IGNORED, true),
    NESTED_FUNCTION(Classification.IGNORED, true);

    private final Classification classification;
    private final boolean nests;

    ConstructKind(Classification classification, boolean nests) {
        this.classification = classification;
        this.nests = nests;
    }

    public Classification classification() {
        return classification;
    }

    /**
     * Whether entering this construct increases the nesting depth of its body.
     */
    public boolean nests() {
        return nests;
    }

    /**
     * Whether this construct pays the current nesting depth as a penalty.
     */
    public boolean hasNestingPenalty() {
        return classification == Classification.STRUCTURAL;
    }

    public boolean isFunction() {
        return this == LAMBDA || this == NESTED_FUNCTION;
    }

    /**
     * Maps an adapter-supplied kind name onto the closed set. Matching ignores
     * case and '_' / '-' separators, so "ElseIf", "ELSE_IF" and "else-if" are
     * the same kind.
     *
     * @throws UnmappedConstructException if the name is not part of the model
     */
    public static ConstructKind fromName(String name, SourceLocation location) {
        if (name != null) {
            String wanted = normalize(name);
            for (ConstructKind kind : values()) {
                if (normalize(kind.name()).equals(wanted)) {
                    return kind;
                }
            }
        }
        throw new UnmappedConstructException(name, location);
    }

    private static String normalize(String name) {
        return name.replace("_", "").replace("-", "").trim().toLowerCase(Locale.ROOT);
    }
}
