package org.carball.tangle.compensation;

import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.unit.FunctionUnit;

import java.util.List;
import java.util.Set;

/**
 * What a compensation rule may look at: the node, its body, its parent and
 * its siblings. A top-level function unit is presented as a NESTED_FUNCTION
 * with no parent.
 *
 * @param topLevel the node sits directly in its function's body
 */
public record CompensationContext(
        String language,
        ConstructKind kind,
        ConstructNode node,
        List<ConstructNode> body,
        Set<String> hints,
        ConstructNode parent,
        List<ConstructNode> siblings,
        boolean topLevel
) {

    public static CompensationContext forNode(String language, ConstructNode node, ConstructNode parent,
                                              List<ConstructNode> siblings, boolean topLevel) {
        return new CompensationContext(language, node.getKind(), node, node.getChildren(), node.getHints(),
                parent, siblings, topLevel);
    }

    public static CompensationContext forUnit(FunctionUnit unit) {
        return new CompensationContext(unit.getLanguage(), ConstructKind.NESTED_FUNCTION, null, unit.getBody(),
                Set.of(), null, List.of(), false);
    }

    public boolean hasHint(String hint) {
        return hints.contains(hint);
    }
}
