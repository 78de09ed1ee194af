package org.carball.tangle.model.analysis;

public enum Tier {
    OK,
    ACCEPTABLE,
    VIOLATION,
    SEVERE;

    public static Tier fromScore(int score, int okMax, int acceptableMax, int severeMin) {
        if (score >= severeMin) {
            return SEVERE;
        } else if (score > acceptableMax) {
            return VIOLATION;
        } else if (score > okMax) {
            return ACCEPTABLE;
        } else {
            return OK;
        }
    }

    public static Tier worst(Tier first, Tier second) {
        return first.ordinal() >= second.ordinal() ? first : second;
    }

    public boolean isViolation() {
        return this == VIOLATION || this == SEVERE;
    }
}
