package org.carball.tangle.model.analysis;

public enum FailureType {
    UNMAPPED_CONSTRUCT,
    INVALID_UNIT,
    SCORING_ERROR,
    CANCELLED
}
