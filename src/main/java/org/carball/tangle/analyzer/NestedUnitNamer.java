package org.carball.tangle.analyzer;

import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Derives identifiers for the nested functions and lambdas of one unit, in
 * the order they are met. The call graph and the scorer walk bodies in the
 * same order, so both arrive at the same identifiers.
 */
class NestedUnitNamer {

    private final String parent;
    private final Map<String, Integer> seen = new HashMap<>();
    private int anonymous = 0;

    NestedUnitNamer(String parent) {
        this.parent = parent;
    }

    String next(ConstructNode node) {
        String name = node.getName();
        if (name == null || name.isBlank()) {
            String label = node.getKind() == ConstructKind.LAMBDA ? "lambda" : "function";
            name = "<" + label + "#" + (++anonymous) + ">";
        }
        String identifier = parent + "." + name;
        int occurrence = seen.merge(identifier, 1, Integer::sum);
        return occurrence == 1 ? identifier : identifier + "#" + occurrence;
    }

    static String simpleName(String identifier) {
        int dot = identifier.lastIndexOf('.');
        return dot >= 0 ? identifier.substring(dot + 1) : identifier;
    }
}
