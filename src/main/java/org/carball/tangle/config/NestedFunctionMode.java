package org.carball.tangle.config;

/**
 * Where the nesting of a nested function or lambda body starts.
 */
public enum NestedFunctionMode {
    /** Every nested body is scored from depth zero. */
    INDEPENDENT,
    /** A nested body starts one level deeper than the point it is declared at. */
    INHERITED
}
