package org.carball.tangle.compensation;

import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.LanguageHints;
import org.carball.tangle.model.unit.FunctionUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CompensationRuleSetTest {

    private CompensationRuleSet rules;

    @BeforeEach
    void setUp() {
        rules = CompensationRuleSet.defaults();
    }

    @Test
    void shouldKeepReferenceRulesInOrder() {
        assertThat(rules.getRules()).extracting(CompensationRule::name).containsExactly(
                CompensationRuleSet.ELSE_WRAPPING_IF,
                CompensationRuleSet.IF_INSIDE_ELSE_WRAPPER,
                CompensationRuleSet.NAMESPACE_WRAPPER,
                CompensationRuleSet.DECORATOR_WRAPPER);
    }

    @Test
    void shouldSuppressElseWrappingSoleIfChain() {
        // Given
        ConstructNode innerIf = ConstructNode.of(ConstructKind.IF);
        ConstructNode elseNode = ConstructNode.of(ConstructKind.ELSE, innerIf,
                ConstructNode.of(ConstructKind.ELSE_IF), ConstructNode.of(ConstructKind.ELSE));

        // When
        CompensationAction elseAction = rules.evaluate(
                CompensationContext.forNode("java", elseNode, null, List.of(elseNode), true));
        CompensationAction ifAction = rules.evaluate(
                CompensationContext.forNode("java", innerIf, elseNode, elseNode.getChildren(), false));

        // Then
        assertThat(elseAction).isEqualTo(CompensationAction.SUPPRESS);
        assertThat(ifAction).isEqualTo(CompensationAction.RECLASSIFY);
    }

    @Test
    void shouldNotSuppressElseWithOtherStatements() {
        ConstructNode elseNode = ConstructNode.of(ConstructKind.ELSE,
                ConstructNode.of(ConstructKind.IF), ConstructNode.of(ConstructKind.FOR));

        CompensationAction action = rules.evaluate(
                CompensationContext.forNode("java", elseNode, null, List.of(elseNode), true));

        assertThat(action).isEqualTo(CompensationAction.NO_OP);
    }

    @Test
    void shouldRecognizeNamespaceWrapperUnit() {
        FunctionUnit namespace = FunctionUnit.of("Geometry",
                ConstructNode.builder().kind(ConstructKind.NESTED_FUNCTION).name("area").build(),
                ConstructNode.of(ConstructKind.TRY,
                        ConstructNode.builder().kind(ConstructKind.NESTED_FUNCTION).name("volume").build()));

        assertThat(rules.evaluate(CompensationContext.forUnit(namespace))).isEqualTo(CompensationAction.SUPPRESS);
    }

    @Test
    void shouldNotTreatFunctionReturningLambdaAsNamespace() {
        FunctionUnit factory = FunctionUnit.of("factory", ConstructNode.of(ConstructKind.LAMBDA));

        assertThat(rules.evaluate(CompensationContext.forUnit(factory))).isEqualTo(CompensationAction.NO_OP);
    }

    @Test
    void shouldResetBaselineForHintedDecorator() {
        ConstructNode wrapper = ConstructNode.builder()
                .kind(ConstructKind.LAMBDA)
                .hint(LanguageHints.RETURNS_NESTED_FUNCTION)
                .child(ConstructNode.of(ConstructKind.IF))
                .build();
        ConstructNode sibling = ConstructNode.of(ConstructKind.IF);

        CompensationAction action = rules.evaluate(
                CompensationContext.forNode("python", wrapper, null, List.of(sibling, wrapper), true));

        assertThat(action).isEqualTo(CompensationAction.RESET_BASELINE);
    }

    @Test
    void shouldApplyFirstMatchingRule() {
        // Given two rules that both match an ELSE
        CompensationRuleSet ordered = new CompensationRuleSet(List.of(
                CompensationRule.of("first", Set.of(ConstructKind.ELSE), StructuralContext.ANY,
                        CompensationAction.NO_OP),
                CompensationRule.of("second", Set.of(ConstructKind.ELSE), StructuralContext.ANY,
                        CompensationAction.SUPPRESS)));
        ConstructNode elseNode = ConstructNode.of(ConstructKind.ELSE);

        // When
        CompensationContext ctx = CompensationContext.forNode("go", elseNode, null, List.of(elseNode), true);

        // Then
        assertThat(ordered.findMatch(ctx)).hasValueSatisfying(rule -> assertThat(rule.name()).isEqualTo("first"));
        assertThat(ordered.evaluate(ctx)).isEqualTo(CompensationAction.NO_OP);
    }

    @Test
    void shouldRestrictRulesByLanguageAndHint() {
        CompensationRule rule = new CompensationRule("python-only", "Python", "walrus",
                Set.of(ConstructKind.IF), StructuralContext.ANY, CompensationAction.SUPPRESS);
        ConstructNode hinted = ConstructNode.builder().kind(ConstructKind.IF).hint("walrus").build();
        ConstructNode plain = ConstructNode.of(ConstructKind.IF);

        assertThat(rule.matches(CompensationContext.forNode("python", hinted, null, List.of(hinted), true))).isTrue();
        assertThat(rule.matches(CompensationContext.forNode("java", hinted, null, List.of(hinted), true))).isFalse();
        assertThat(rule.matches(CompensationContext.forNode("python", plain, null, List.of(plain), true))).isFalse();
    }

    @Test
    void shouldIgnoreUnknownHints() {
        ConstructNode node = ConstructNode.builder().kind(ConstructKind.FOR).hint("made-up").build();

        CompensationAction action = rules.evaluate(
                CompensationContext.forNode("java", node, null, List.of(node), true));

        assertThat(action).isEqualTo(CompensationAction.NO_OP);
    }

    @Test
    void shouldRejectRuleWithoutAction() {
        assertThatThrownBy(() -> CompensationRule.of("broken", Set.of(), StructuralContext.ANY, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("needs an action");
    }

    @Test
    void shouldMatchNothingWhenEmpty() {
        ConstructNode elseNode = ConstructNode.of(ConstructKind.ELSE, ConstructNode.of(ConstructKind.IF));

        assertThat(CompensationRuleSet.none().evaluate(
                CompensationContext.forNode("java", elseNode, null, List.of(elseNode), true)))
                .isEqualTo(CompensationAction.NO_OP);
    }
}
