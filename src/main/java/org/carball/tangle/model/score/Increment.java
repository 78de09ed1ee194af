package org.carball.tangle.model.score;

import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.SourceLocation;

import java.util.Locale;

/**
 * One cognitive increment, kept so a score can be audited line by line.
 *
 * @param amount  total added, including the nesting penalty
 * @param nesting nesting penalty part of {@code amount}
 */
public record Increment(ConstructKind kind, SourceLocation location, int amount, int nesting) {

    public String describe() {
        String base = "+" + amount + " " + kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return nesting > 0 ? base + " (incl. " + nesting + " for nesting)" : base;
    }
}
