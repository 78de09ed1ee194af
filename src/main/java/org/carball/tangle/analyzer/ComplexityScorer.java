package org.carball.tangle.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.compensation.CompensationAction;
import org.carball.tangle.compensation.CompensationContext;
import org.carball.tangle.compensation.CompensationRuleSet;
import org.carball.tangle.config.NestedFunctionMode;
import org.carball.tangle.model.construct.Classification;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.SourceLocation;
import org.carball.tangle.model.score.FunctionScore;
import org.carball.tangle.model.score.Increment;
import org.carball.tangle.model.score.Score;
import org.carball.tangle.model.unit.FunctionUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Computes cognitive and cyclomatic complexity for a function unit in one
 * depth-first pass. Nested functions and lambdas are scored as units of their
 * own and returned after their enclosing unit.
 *
 * <p>The scorer holds no state between calls; one instance can score any
 * number of units from any number of threads.
 */
@Slf4j
public class ComplexityScorer {

    private final CompensationRuleSet rules;
    private final NestedFunctionMode nestedFunctionMode;

    public ComplexityScorer() {
        this(CompensationRuleSet.defaults(), NestedFunctionMode.INDEPENDENT);
    }

    public ComplexityScorer(CompensationRuleSet rules, NestedFunctionMode nestedFunctionMode) {
        this.rules = rules;
        this.nestedFunctionMode = nestedFunctionMode;
    }

    /**
     * Scores a unit on its own. Only direct self calls and cycles among the
     * unit's nested functions count as recursion.
     */
    public List<FunctionScore> score(FunctionUnit unit) {
        return score(unit, CallGraph.build(List.of(unit)).findRecursiveUnits());
    }

    /**
     * Scores {@code unit} and every function nested in it.
     *
     * @param recursiveUnits identifiers of units that sit on a recursion cycle
     * @return the unit's score first, then nested units in source order
     */
    public List<FunctionScore> score(FunctionUnit unit, Set<String> recursiveUnits) {
        List<FunctionScore> results = new ArrayList<>();
        boolean muted = rules.evaluate(CompensationContext.forUnit(unit)) == CompensationAction.SUPPRESS;

        new Pass(unit.getIdentifier(), unit.getLanguage(), unit.getLocation(), 0, muted, null,
                recursiveUnits, results).run(unit.getBody());

        log.debug("Scored {} ({} unit(s)): cognitive={}, cyclomatic={}", unit.getIdentifier(), results.size(),
                results.get(0).getCognitive(), results.get(0).getCyclomatic());
        return results;
    }

    /**
     * Traversal state of a single function unit.
     */
    private final class Pass {
        private final String identifier;
        private final String language;
        private final SourceLocation location;
        private final boolean muted;
        private final String parent;
        private final Set<String> recursiveUnits;
        private final List<FunctionScore> results;
        private final NestingTracker nesting;
        private final NestedUnitNamer namer;
        private final List<Increment> increments = new ArrayList<>();

        private int cognitive = 0;
        private int cyclomatic = 1;
        private SourceLocation firstCallSite;

        private Pass(String identifier, String language, SourceLocation location, int baseline, boolean muted,
                     String parent, Set<String> recursiveUnits, List<FunctionScore> results) {
            this.identifier = identifier;
            this.language = language;
            this.location = location;
            this.muted = muted;
            this.parent = parent;
            this.recursiveUnits = recursiveUnits;
            this.results = results;
            this.nesting = new NestingTracker(baseline);
            this.namer = new NestedUnitNamer(identifier);
        }

        private void run(List<ConstructNode> body) {
            // Reserve the slot so the enclosing unit precedes its nested units
            int slot = results.size();
            results.add(null);

            visitAll(body, null, true);

            boolean recursive = recursiveUnits.contains(identifier);
            if (recursive) {
                addCognitive(ConstructKind.RECURSIVE_CALL, firstCallSite != null ? firstCallSite : location, 1, 0);
            }
            if (log.isTraceEnabled()) {
                increments.forEach(increment -> log.trace("{} at {}: {}",
                        identifier, increment.location(), increment.describe()));
            }

            results.set(slot, FunctionScore.builder()
                    .identifier(identifier)
                    .language(language)
                    .location(location)
                    .score(new Score(cognitive, cyclomatic))
                    .maxNesting(nesting.maxDepth() - nesting.baseline())
                    .recursive(recursive)
                    .suppressed(muted)
                    .parent(parent)
                    .increments(increments)
                    .build());
        }

        private void visitAll(List<ConstructNode> nodes, ConstructNode parentNode, boolean topLevel) {
            for (ConstructNode node : nodes) {
                visit(node, parentNode, nodes, topLevel);
            }
        }

        private void visit(ConstructNode node, ConstructNode parentNode, List<ConstructNode> siblings,
                           boolean topLevel) {
            CompensationAction action = rules.evaluate(
                    CompensationContext.forNode(language, node, parentNode, siblings, topLevel));
            ConstructKind kind = node.getKind();

            countCyclomatic(node);

            if (kind.isFunction()) {
                scoreNestedUnit(node, action);
                return;
            }
            if (kind == ConstructKind.RECURSIVE_CALL) {
                // Counted once per unit after the walk, never per call site
                if (firstCallSite == null) {
                    firstCallSite = node.getLocation();
                }
                visitAll(node.getChildren(), node, false);
                return;
            }

            int depth = nesting.depth();
            switch (effectiveClassification(node.classification(), action)) {
                case STRUCTURAL:
                    addCognitive(kind, node.getLocation(), 1 + depth, depth);
                    visitNested(node);
                    break;
                case HYBRID:
                    addCognitive(kind, node.getLocation(), 1, 0);
                    visitNested(node);
                    break;
                case FUNDAMENTAL:
                    addCognitive(kind, node.getLocation(), 1, 0);
                    visitAll(node.getChildren(), node, false);
                    break;
                case IGNORED:
                    visitAll(node.getChildren(), node, false);
                    break;
            }
        }

        private void visitNested(ConstructNode node) {
            nesting.push();
            visitAll(node.getChildren(), node, false);
            nesting.pop();
        }

        private void countCyclomatic(ConstructNode node) {
            switch (node.getKind()) {
                case IF:
                case ELSE_IF:
                case FOR:
                case WHILE:
                case DO_WHILE:
                case CATCH:
                case TERNARY:
                    cyclomatic++;
                    break;
                case SWITCH:
                    cyclomatic += Math.max(0, node.getCaseLabels());
                    break;
                case LOGICAL_RUN:
                    cyclomatic += node.operatorCount();
                    break;
                default:
                    break;
            }
        }

        private void scoreNestedUnit(ConstructNode node, CompensationAction action) {
            String nestedIdentifier = namer.next(node);
            int baseline = nestedBaseline(action);

            new Pass(nestedIdentifier, language, node.getLocation(), baseline,
                    action == CompensationAction.SUPPRESS, identifier, recursiveUnits, results)
                    .run(node.getChildren());
        }

        private int nestedBaseline(CompensationAction action) {
            if (action == CompensationAction.RESET_BASELINE) {
                return nesting.baseline();
            }
            if (nestedFunctionMode == NestedFunctionMode.INDEPENDENT) {
                return 0;
            }
            // A muted namespace wrapper does not add a level to what it declares
            return muted ? nesting.depth() : nesting.depth() + 1;
        }

        private void addCognitive(ConstructKind kind, SourceLocation at, int amount, int penalty) {
            if (muted) {
                return;
            }
            cognitive += amount;
            increments.add(new Increment(kind, at, amount, penalty));
        }
    }

    private static Classification effectiveClassification(Classification base, CompensationAction action) {
        switch (action) {
            case SUPPRESS:
                return Classification.IGNORED;
            case RECLASSIFY:
                return base == Classification.STRUCTURAL ? Classification.HYBRID : base;
            default:
                return base;
        }
    }
}
