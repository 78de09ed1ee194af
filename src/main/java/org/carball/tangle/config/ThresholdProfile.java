package org.carball.tangle.config;

import lombok.Getter;

@Getter
public enum ThresholdProfile {

    STRICT("strict", "Strict gate - small functions, fails the build on any violation",
            3, 7, 10, 4, 7, 10, true),

    DEFAULT("default", "Default thresholds for most codebases",
            5, 10, 15, 5, 10, 15, false),

    LENIENT("lenient", "Lenient thresholds for legacy code being brought under control",
            10, 15, 25, 10, 20, 30, false);

    private final String name;
    private final String description;
    private final int cognitiveOkMax;
    private final int cognitiveAcceptableMax;
    private final int cognitiveSevereMin;
    private final int cyclomaticOkMax;
    private final int cyclomaticAcceptableMax;
    private final int cyclomaticSevereMin;
    private final boolean failOnViolation;

    ThresholdProfile(String name, String description,
                     int cognitiveOkMax, int cognitiveAcceptableMax, int cognitiveSevereMin,
                     int cyclomaticOkMax, int cyclomaticAcceptableMax, int cyclomaticSevereMin,
                     boolean failOnViolation) {
        this.name = name;
        this.description = description;
        this.cognitiveOkMax = cognitiveOkMax;
        this.cognitiveAcceptableMax = cognitiveAcceptableMax;
        this.cognitiveSevereMin = cognitiveSevereMin;
        this.cyclomaticOkMax = cyclomaticOkMax;
        this.cyclomaticAcceptableMax = cyclomaticAcceptableMax;
        this.cyclomaticSevereMin = cyclomaticSevereMin;
        this.failOnViolation = failOnViolation;
    }

    public ComplexityThresholds buildThresholds() {
        return ComplexityThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .cognitiveOkMax(cognitiveOkMax)
                .cognitiveAcceptableMax(cognitiveAcceptableMax)
                .cognitiveSevereMin(cognitiveSevereMin)
                .cyclomaticOkMax(cyclomaticOkMax)
                .cyclomaticAcceptableMax(cyclomaticAcceptableMax)
                .cyclomaticSevereMin(cyclomaticSevereMin)
                .failOnViolation(failOnViolation)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static ThresholdProfile fromName(String name) {
        for (ThresholdProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown threshold profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ThresholdProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder("Available Threshold Profiles:\n\n");
        for (ThresholdProfile profile : values()) {
            help.append(String.format("  %-10s %s (cognitive %d/%d/%d, cyclomatic %d/%d/%d)%n",
                    profile.getName(), profile.getDescription(),
                    profile.cognitiveOkMax, profile.cognitiveAcceptableMax, profile.cognitiveSevereMin,
                    profile.cyclomaticOkMax, profile.cyclomaticAcceptableMax, profile.cyclomaticSevereMin));
        }
        return help.toString();
    }
}
