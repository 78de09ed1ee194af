package org.carball.tangle.analyzer;

/**
 * Nesting depth of one function unit. Depth starts at the unit's baseline,
 * which is zero unless the unit inherits nesting from its enclosing function.
 */
public class NestingTracker {

    private final int baseline;
    private int depth;
    private int maxDepth;

    public NestingTracker() {
        this(0);
    }

    public NestingTracker(int baseline) {
        if (baseline < 0) {
            throw new IllegalArgumentException("Baseline cannot be negative: " + baseline);
        }
        this.baseline = baseline;
        this.depth = baseline;
        this.maxDepth = baseline;
    }

    public int depth() {
        return depth;
    }

    public int baseline() {
        return baseline;
    }

    /**
     * Deepest nesting reached so far.
     */
    public int maxDepth() {
        return maxDepth;
    }

    public void push() {
        depth++;
        maxDepth = Math.max(maxDepth, depth);
    }

    public void pop() {
        if (depth == baseline) {
            throw new IllegalStateException("Nesting underflow below baseline " + baseline);
        }
        depth--;
    }
}
