package org.carball.tangle.exception;

import lombok.Getter;
import org.carball.tangle.model.construct.SourceLocation;

/**
 * A front end supplied a construct kind outside the closed construct model.
 * Fatal for the function unit being read, never for the whole batch.
 */
@Getter
public class UnmappedConstructException extends RuntimeException {

    private final String kind;
    private final SourceLocation location;

    public UnmappedConstructException(String kind, SourceLocation location) {
        super("Unmapped construct '" + kind + "' at " + location);
        this.kind = kind;
        this.location = location;
    }
}
