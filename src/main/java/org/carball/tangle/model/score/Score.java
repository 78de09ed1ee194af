package org.carball.tangle.model.score;

/**
 * Immutable pair of the two metrics computed for a function.
 */
public record Score(int cognitive, int cyclomatic) {

    public Score {
        if (cognitive < 0 || cyclomatic < 0) {
            throw new IllegalArgumentException("Scores cannot be negative: " + cognitive + "/" + cyclomatic);
        }
    }
}
