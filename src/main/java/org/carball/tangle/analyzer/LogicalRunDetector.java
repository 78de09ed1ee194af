package org.carball.tangle.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.SourceLocation;
import org.carball.tangle.model.expression.LogicalExpression;
import org.carball.tangle.model.expression.LogicalOperator;
import org.carball.tangle.model.expression.Operand;
import org.carball.tangle.model.unit.FunctionUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses boolean operator sequences into LOGICAL_RUN nodes. A run is a
 * maximal sequence of identical consecutive operators within one group;
 * parenthesized groups are decomposed on their own and never merge with the
 * surrounding run.
 */
@Slf4j
public class LogicalRunDetector {

    /**
     * Returns one LOGICAL_RUN node per run, in the order their first operator
     * appears. A lone operand yields no runs.
     */
    public List<ConstructNode> detect(LogicalExpression expression, SourceLocation location) {
        List<RunBuilder> runs = new ArrayList<>();
        collectRuns(expression, runs);

        List<ConstructNode> nodes = new ArrayList<>(runs.size());
        for (RunBuilder run : runs) {
            nodes.add(ConstructNode.builder()
                    .kind(ConstructKind.LOGICAL_RUN)
                    .location(location)
                    .operators(run.count)
                    .name(run.operator.getSymbol())
                    .build());
        }
        return nodes;
    }

    /**
     * Rewrites every condition in the unit into LOGICAL_RUN children, placed
     * before the node's own children. The returned unit carries no raw
     * conditions.
     *
     * @throws IllegalArgumentException if a node has no kind
     */
    public FunctionUnit resolve(FunctionUnit unit) {
        List<ConstructNode> body = resolveAll(unit.getBody());
        return unit.toBuilder().clearBody().body(body).build();
    }

    private List<ConstructNode> resolveAll(List<ConstructNode> nodes) {
        List<ConstructNode> resolved = new ArrayList<>(nodes.size());
        for (ConstructNode node : nodes) {
            resolved.add(resolve(node));
        }
        return resolved;
    }

    private ConstructNode resolve(ConstructNode node) {
        if (node.getKind() == null) {
            throw new IllegalArgumentException("Construct without a kind at " + node.getLocation());
        }
        List<ConstructNode> children = new ArrayList<>();
        if (node.hasCondition()) {
            List<ConstructNode> runs = detect(node.getCondition(), node.getLocation());
            log.trace("Resolved condition at {} into {} logical run(s)", node.getLocation(), runs.size());
            children.addAll(runs);
        }
        children.addAll(resolveAll(node.getChildren()));

        return node.toBuilder()
                .condition(null)
                .clearChildren()
                .children(children)
                .build();
    }

    private void collectRuns(LogicalExpression expression, List<RunBuilder> runs) {
        RunBuilder current = null;
        List<Operand> operands = expression.operands();

        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                LogicalOperator operator = expression.operators().get(i - 1);
                if (current == null || current.operator != operator) {
                    current = new RunBuilder(operator);
                    runs.add(current);
                }
                current.count++;
            }
            Operand operand = operands.get(i);
            if (operand.isGroup()) {
                collectRuns(operand.group(), runs);
            }
        }
    }

    private static final class RunBuilder {
        private final LogicalOperator operator;
        private int count;

        private RunBuilder(LogicalOperator operator) {
            this.operator = operator;
        }
    }
}
