package org.carball.tangle.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.exception.ConfigurationException;
import org.carball.tangle.model.analysis.Tier;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ComplexityThresholds {

    // Cognitive complexity tiers
    @Builder.Default
    private int cognitiveOkMax = 5;

    @Builder.Default
    private int cognitiveAcceptableMax = 10;

    @Builder.Default
    private int cognitiveSevereMin = 15;

    // Cyclomatic complexity tiers
    @Builder.Default
    private int cyclomaticOkMax = 5;

    @Builder.Default
    private int cyclomaticAcceptableMax = 10;

    @Builder.Default
    private int cyclomaticSevereMin = 15;

    @Builder.Default
    private boolean failOnViolation = false;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Default thresholds";

    public static ComplexityThresholds defaults() {
        return ComplexityThresholds.builder().build();
    }

    /**
     * Rejects threshold sets whose tiers cannot be ordered and logs warnings
     * for values that are valid but probably unintended.
     *
     * @throws ConfigurationException if a value is negative or tiers overlap
     */
    public void validate() {
        validateMetric("cognitive", cognitiveOkMax, cognitiveAcceptableMax, cognitiveSevereMin);
        validateMetric("cyclomatic", cyclomaticOkMax, cyclomaticAcceptableMax, cyclomaticSevereMin);

        if (cyclomaticOkMax < 1) {
            log.warn("Cyclomatic ok max ({}) is below 1; every function starts at 1 and will never be ok",
                    cyclomaticOkMax);
        }

        log.debug("Using thresholds - Cognitive: {}/{}/{}, Cyclomatic: {}/{}/{}, Profile: {}",
                cognitiveOkMax, cognitiveAcceptableMax, cognitiveSevereMin,
                cyclomaticOkMax, cyclomaticAcceptableMax, cyclomaticSevereMin, profileName);
    }

    private void validateMetric(String metric, int okMax, int acceptableMax, int severeMin) {
        if (okMax < 0 || acceptableMax < 0 || severeMin < 0) {
            throw new ConfigurationException(String.format(
                    "%s thresholds cannot be negative (ok=%d, acceptable=%d, severe=%d)",
                    capitalize(metric), okMax, acceptableMax, severeMin));
        }
        if (okMax > acceptableMax) {
            throw new ConfigurationException(String.format(
                    "%s ok max (%d) must not exceed acceptable max (%d)", capitalize(metric), okMax, acceptableMax));
        }
        if (acceptableMax >= severeMin) {
            throw new ConfigurationException(String.format(
                    "%s severe min (%d) must be greater than acceptable max (%d)",
                    capitalize(metric), severeMin, acceptableMax));
        }

        if (okMax == acceptableMax) {
            log.warn("{} ok max and acceptable max are both {}; no function will be rated acceptable",
                    capitalize(metric), okMax);
        }
        if (severeMin == acceptableMax + 1) {
            log.warn("{} severe min ({}) directly follows acceptable max ({}); every violation will be severe",
                    capitalize(metric), severeMin, acceptableMax);
        }
    }

    public Tier cognitiveTier(int score) {
        return Tier.fromScore(score, cognitiveOkMax, cognitiveAcceptableMax, cognitiveSevereMin);
    }

    public Tier cyclomaticTier(int score) {
        return Tier.fromScore(score, cyclomaticOkMax, cyclomaticAcceptableMax, cyclomaticSevereMin);
    }

    /**
     * Returns a description of the current configuration for user feedback.
     */
    public String getConfigurationSummary() {
        return String.format("Profile: %s | Cognitive: %d/%d/%d | Cyclomatic: %d/%d/%d | Fail on violation: %s",
                profileName, cognitiveOkMax, cognitiveAcceptableMax, cognitiveSevereMin,
                cyclomaticOkMax, cyclomaticAcceptableMax, cyclomaticSevereMin, failOnViolation);
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
