package org.carball.tangle.compensation;

public enum CompensationAction {
    /** Treat the node as ignored for this occurrence: no increment, no nesting. */
    SUPPRESS,
    /** Score a structural node as hybrid: +1 without nesting penalty. */
    RECLASSIFY,
    /** Start a nested function at its enclosing function's baseline. */
    RESET_BASELINE,
    NO_OP
}
