package org.carball.tangle.compensation;

import org.carball.tangle.model.construct.ConstructKind;

import java.util.Set;

/**
 * One row of the compensation table: when a node of one of {@code kinds}, in
 * {@code language}, carrying {@code hint} (if set) satisfies {@code context},
 * apply {@code action}. An empty kind set matches every kind; language "*"
 * matches every language.
 */
public record CompensationRule(
        String name,
        String language,
        String hint,
        Set<ConstructKind> kinds,
        StructuralContext context,
        CompensationAction action
) {

    public static final String ANY_LANGUAGE = "*";

    public CompensationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Compensation rule needs a name");
        }
        if (action == null) {
            throw new IllegalArgumentException("Compensation rule '" + name + "' needs an action");
        }
        language = language == null || language.isBlank() ? ANY_LANGUAGE : language;
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
        context = context == null ? StructuralContext.ANY : context;
    }

    public static CompensationRule of(String name, Set<ConstructKind> kinds, StructuralContext context,
                                      CompensationAction action) {
        return new CompensationRule(name, ANY_LANGUAGE, null, kinds, context, action);
    }

    public boolean matches(CompensationContext ctx) {
        return languageMatches(ctx.language())
                && (hint == null || ctx.hasHint(hint))
                && (kinds.isEmpty() || kinds.contains(ctx.kind()))
                && context.matches(ctx);
    }

    private boolean languageMatches(String candidate) {
        return ANY_LANGUAGE.equals(language) || language.equalsIgnoreCase(candidate);
    }
}
