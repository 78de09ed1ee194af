package org.carball.tangle.model.analysis;

import org.carball.tangle.model.construct.SourceLocation;

/**
 * Non-fatal finding raised while analyzing a batch.
 */
public record Diagnostic(Severity severity, String code, String message, SourceLocation location) {

    public static final String CYCLE_DETECTION_FAILURE = "CYCLE_DETECTION_FAILURE";

    public enum Severity {
        WARNING
    }

    public static Diagnostic warning(String code, String message, SourceLocation location) {
        return new Diagnostic(Severity.WARNING, code, message, location);
    }
}
