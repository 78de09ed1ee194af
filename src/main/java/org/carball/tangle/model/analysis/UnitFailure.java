package org.carball.tangle.model.analysis;

import org.carball.tangle.model.construct.SourceLocation;

/**
 * A function unit that was skipped because it could not be read or scored.
 */
public record UnitFailure(String identifier, SourceLocation location, FailureType type, String reason) {
}
