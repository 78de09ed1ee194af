package org.carball.tangle.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ThresholdProfileTest {

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(ThresholdProfile.fromName("STRICT")).isEqualTo(ThresholdProfile.STRICT);
        assertThat(ThresholdProfile.fromName("lenient")).isEqualTo(ThresholdProfile.LENIENT);
    }

    @Test
    void shouldThrowForUnknownProfile() {
        assertThatThrownBy(() -> ThresholdProfile.fromName("paranoid"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown threshold profile: paranoid")
                .hasMessageContaining("strict, default, lenient");
    }

    @Test
    void shouldBuildValidThresholdsForEveryProfile() {
        for (ThresholdProfile profile : ThresholdProfile.values()) {
            ComplexityThresholds thresholds = profile.buildThresholds();

            thresholds.validate();
            assertThat(thresholds.getProfileName()).isEqualTo(profile.getName());
        }
    }

    @Test
    void shouldMatchBuiltInDefaultsForDefaultProfile() {
        ComplexityThresholds fromProfile = ThresholdProfile.DEFAULT.buildThresholds();
        ComplexityThresholds defaults = ComplexityThresholds.defaults();

        assertThat(fromProfile.getCognitiveOkMax()).isEqualTo(defaults.getCognitiveOkMax());
        assertThat(fromProfile.getCognitiveSevereMin()).isEqualTo(defaults.getCognitiveSevereMin());
        assertThat(fromProfile.getCyclomaticAcceptableMax()).isEqualTo(defaults.getCyclomaticAcceptableMax());
        assertThat(fromProfile.isFailOnViolation()).isFalse();
    }

    @Test
    void shouldFailOnViolationInStrictProfile() {
        assertThat(ThresholdProfile.STRICT.buildThresholds().isFailOnViolation()).isTrue();
    }

    @Test
    void shouldListProfilesInHelp() {
        assertThat(ThresholdProfile.getProfileHelp()).contains("strict", "default", "lenient");
    }
}
