package org.carball.tangle.compensation;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.model.construct.ConstructKind;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, read-only table of compensation rules. The first matching rule
 * decides the action for a node; without a match the general scoring rules
 * apply unchanged.
 */
@Slf4j
public class CompensationRuleSet {

    public static final String ELSE_WRAPPING_IF = "else-wrapping-if";
    public static final String IF_INSIDE_ELSE_WRAPPER = "if-inside-else-wrapper";
    public static final String NAMESPACE_WRAPPER = "namespace-wrapper";
    public static final String DECORATOR_WRAPPER = "decorator-wrapper";

    private static final CompensationRuleSet NONE = new CompensationRuleSet(List.of());

    private final List<CompensationRule> rules;

    public CompensationRuleSet(List<CompensationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * The reference rules: else-wrapped ifs score like else-if chains,
     * namespace wrappers are muted, decorator-style wrappers do not add
     * nesting to the function they return.
     */
    public static CompensationRuleSet defaults() {
        return new CompensationRuleSet(List.of(
                CompensationRule.of(ELSE_WRAPPING_IF, Set.of(ConstructKind.ELSE),
                        StructuralContext.ELSE_WRAPPING_SOLE_IF, CompensationAction.SUPPRESS),
                CompensationRule.of(IF_INSIDE_ELSE_WRAPPER, Set.of(ConstructKind.IF),
                        StructuralContext.SOLE_IF_INSIDE_ELSE, CompensationAction.RECLASSIFY),
                CompensationRule.of(NAMESPACE_WRAPPER, Set.of(ConstructKind.NESTED_FUNCTION),
                        StructuralContext.DECLARATION_ONLY_BODY, CompensationAction.SUPPRESS),
                CompensationRule.of(DECORATOR_WRAPPER, Set.of(ConstructKind.NESTED_FUNCTION, ConstructKind.LAMBDA),
                        StructuralContext.SOLE_RETURNED_NESTED_FUNCTION, CompensationAction.RESET_BASELINE)
        ));
    }

    public static CompensationRuleSet none() {
        return NONE;
    }

    public Optional<CompensationRule> findMatch(CompensationContext ctx) {
        for (CompensationRule rule : rules) {
            if (rule.matches(ctx)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public CompensationAction evaluate(CompensationContext ctx) {
        Optional<CompensationRule> match = findMatch(ctx);
        match.ifPresent(rule -> log.trace("Rule '{}' -> {} for {}", rule.name(), rule.action(), ctx.kind()));
        return match.map(CompensationRule::action).orElse(CompensationAction.NO_OP);
    }

    public List<CompensationRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public int size() {
        return rules.size();
    }
}
