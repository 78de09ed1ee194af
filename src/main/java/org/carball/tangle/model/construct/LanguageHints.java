package org.carball.tangle.model.construct;

/**
 * Well-known hint flags that front-end adapters may attach to a node.
 * Hints are free-form strings; any hint not referenced by a compensation
 * rule is simply ignored.
 */
public final class LanguageHints {

    /** The function exists only to group nested declarations. */
    public static final String NAMESPACE_WRAPPER = "namespace-wrapper";

    /** The else body holds nothing but a single if statement. */
    public static final String ELSE_ONLY_IF = "else-only-if";

    /** The nested function is returned by its enclosing function (decorator idiom). */
    public static final String RETURNS_NESTED_FUNCTION = "returns-nested-function";

    private LanguageHints() {
    }
}
