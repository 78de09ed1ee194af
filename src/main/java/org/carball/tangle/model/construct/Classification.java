package org.carball.tangle.model.construct;

/**
 * How a construct contributes to the cognitive score and how it interacts
 * with nesting.
 */
public enum Classification {
    /** +1 plus the current nesting depth; increases nesting for its body. */
    STRUCTURAL,
    /** +1 with no nesting penalty; still increases nesting for its body. */
    HYBRID,
    /** Flat +1, never affected by nesting. */
    FUNDAMENTAL,
    /** Contributes nothing by itself. */
    IGNORED
}
