package org.carball.tangle.compensation;

import org.carball.tangle.model.construct.Classification;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.LanguageHints;

import java.util.List;

/**
 * Structural predicates a compensation rule can require. Each predicate also
 * accepts the matching adapter hint, so front ends that already know the
 * idiom do not depend on tree shape.
 */
public enum StructuralContext {

    ANY {
        @Override
        public boolean matches(CompensationContext ctx) {
            return true;
        }
    },

    /** An else whose body is a single if, optionally followed by that if's own else-if/else chain. */
    ELSE_WRAPPING_SOLE_IF {
        @Override
        public boolean matches(CompensationContext ctx) {
            return ctx.kind() == ConstructKind.ELSE
                    && (ctx.hasHint(LanguageHints.ELSE_ONLY_IF) || isSoleIfChain(ctx.body()));
        }
    },

    /** The leading if of an else that wraps nothing else. */
    SOLE_IF_INSIDE_ELSE {
        @Override
        public boolean matches(CompensationContext ctx) {
            ConstructNode parent = ctx.parent();
            if (ctx.kind() != ConstructKind.IF || parent == null || parent.getKind() != ConstructKind.ELSE) {
                return false;
            }
            List<ConstructNode> siblings = ctx.siblings();
            return !siblings.isEmpty() && siblings.get(0) == ctx.node()
                    && (parent.hasHint(LanguageHints.ELSE_ONLY_IF) || isSoleIfChain(siblings));
        }
    },

    /** A function holding nothing but nested declarations. */
    DECLARATION_ONLY_BODY {
        @Override
        public boolean matches(CompensationContext ctx) {
            if (!ctx.kind().isFunction()) {
                return false;
            }
            if (ctx.hasHint(LanguageHints.NAMESPACE_WRAPPER)) {
                return true;
            }
            List<ConstructNode> body = ctx.body();
            return body.stream().anyMatch(n -> n.getKind() == ConstructKind.NESTED_FUNCTION)
                    && body.stream().allMatch(StructuralContext::isDeclarationLike);
        }
    },

    /** A nested function that is its enclosing function's only content (decorator idiom). */
    SOLE_RETURNED_NESTED_FUNCTION {
        @Override
        public boolean matches(CompensationContext ctx) {
            if (!ctx.kind().isFunction() || ctx.node() == null) {
                return false;
            }
            return ctx.hasHint(LanguageHints.RETURNS_NESTED_FUNCTION)
                    || (ctx.topLevel() && ctx.siblings().size() == 1);
        }
    };

    public abstract boolean matches(CompensationContext ctx);

    static boolean isSoleIfChain(List<ConstructNode> nodes) {
        if (nodes.isEmpty() || nodes.get(0).getKind() != ConstructKind.IF) {
            return false;
        }
        for (int i = 1; i < nodes.size(); i++) {
            ConstructKind kind = nodes.get(i).getKind();
            boolean last = i == nodes.size() - 1;
            if (kind == ConstructKind.ELSE_IF || (kind == ConstructKind.ELSE && last)) {
                continue;
            }
            return false;
        }
        return true;
    }

    private static boolean isDeclarationLike(ConstructNode node) {
        if (node.getKind() == ConstructKind.NESTED_FUNCTION) {
            return true;
        }
        return node.getKind() != ConstructKind.LAMBDA
                && node.classification() == Classification.IGNORED
                && node.getChildren().stream().allMatch(StructuralContext::isDeclarationLike);
    }
}
