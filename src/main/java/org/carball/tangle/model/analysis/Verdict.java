package org.carball.tangle.model.analysis;

public enum Verdict {
    PASS,
    FAIL
}
