package org.carball.tangle.config;

import org.carball.tangle.compensation.CompensationAction;
import org.carball.tangle.compensation.CompensationRule;
import org.carball.tangle.compensation.StructuralContext;
import org.carball.tangle.exception.ConfigurationException;
import org.carball.tangle.model.construct.ConstructKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        ComplexityThresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getCognitiveOkMax()).isEqualTo(5);
        assertThat(thresholds.getCyclomaticSevereMin()).isEqualTo(15);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldLoadSpecificProfile() {
        ComplexityThresholds thresholds = loader.loadProfile("lenient");

        assertThat(thresholds.getCognitiveOkMax()).isEqualTo(10);
        assertThat(thresholds.getCognitiveSevereMin()).isEqualTo(25);
        assertThat(thresholds.getProfileName()).isEqualTo("lenient");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(ConfigurationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown threshold profile: nonexistent");
    }

    @Test
    void shouldApplyProfileWithOverrides() {
        // Given
        String[] args = {"--thresholds.cognitive-ok", "4"};

        // When
        ComplexityThresholds thresholds = loader.loadConfigurationWithProfile("strict", args);

        // Then - CLI > env vars > profile > defaults
        assertThat(thresholds.getCognitiveOkMax()).isEqualTo(4);
        assertThat(thresholds.getCognitiveAcceptableMax()).isEqualTo(7);
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldPreferCliOverEnvironment() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "TANGLE_COGNITIVE_OK_MAX", "3",
                "TANGLE_COGNITIVE_ACCEPTABLE_MAX", "8"));
        String[] args = {"--thresholds.cognitive-ok", "2"};

        // When
        ComplexityThresholds thresholds = envLoader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getCognitiveOkMax()).isEqualTo(2);
        assertThat(thresholds.getCognitiveAcceptableMax()).isEqualTo(8);
    }

    @Test
    void shouldIgnoreInvalidNumericValues() {
        String[] args = {"--thresholds.cyclomatic-ok", "many"};

        ComplexityThresholds thresholds = loader.loadConfiguration(args);

        assertThat(thresholds.getCyclomaticOkMax()).isEqualTo(5);
    }

    @Test
    void shouldRejectOverridesThatBreakTierOrdering() {
        String[] args = {"--thresholds.cognitive-severe", "8"};

        assertThatThrownBy(() -> loader.loadConfiguration(args))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldLoadConfigFile() throws IOException {
        // Given
        Path file = tempDir.resolve("tangle.yml");
        Files.writeString(file, """
                profile: lenient
                thresholds:
                  cognitive_ok_max: 6
                  cyclomatic_severe_min: 40
                fail_on_violation: true
                nested_functions: inherited
                parallelism: 3
                """);

        // When
        AnalysisConfig config = loader.loadAnalysisConfig(null, file, new String[0]);

        // Then
        assertThat(config.getThresholds().getProfileName()).isEqualTo("lenient");
        assertThat(config.getThresholds().getCognitiveOkMax()).isEqualTo(6);
        assertThat(config.getThresholds().getCognitiveAcceptableMax()).isEqualTo(15);
        assertThat(config.getThresholds().getCyclomaticSevereMin()).isEqualTo(40);
        assertThat(config.getThresholds().isFailOnViolation()).isTrue();
        assertThat(config.getNestedFunctions()).isEqualTo(NestedFunctionMode.INHERITED);
        assertThat(config.getParallelism()).isEqualTo(3);
        assertThat(config.getCompensationRules().size()).isEqualTo(4);
    }

    @Test
    void shouldLayerEnvironmentAndCliOverConfigFile() throws IOException {
        // Given
        Path file = tempDir.resolve("tangle.yml");
        Files.writeString(file, """
                thresholds:
                  cognitive_ok_max: 6
                  cognitive_acceptable_max: 12
                parallelism: 2
                """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "TANGLE_COGNITIVE_OK_MAX", "7",
                "TANGLE_PARALLELISM", "6"));
        String[] args = {"units.json", "--parallelism", "8", "--fail-on-violation"};

        // When
        AnalysisConfig config = envLoader.loadAnalysisConfig("default", file, args);

        // Then
        assertThat(config.getThresholds().getCognitiveOkMax()).isEqualTo(7);
        assertThat(config.getThresholds().getCognitiveAcceptableMax()).isEqualTo(12);
        assertThat(config.getThresholds().isFailOnViolation()).isTrue();
        assertThat(config.getParallelism()).isEqualTo(8);
    }

    @Test
    void shouldReplaceCompensationRulesFromConfigFile() throws IOException {
        // Given
        Path file = tempDir.resolve("rules.yml");
        Files.writeString(file, """
                compensation_rules:
                  - name: kotlin-when
                    language: kotlin
                    kinds: [Switch]
                    context: any
                    action: reclassify
                  - name: else-wrapping-if
                    kinds: [else]
                    context: else-wrapping-sole-if
                    action: suppress
                """);

        // When
        AnalysisConfig config = loader.loadAnalysisConfig(null, file, new String[0]);

        // Then
        assertThat(config.getCompensationRules().getRules()).hasSize(2);
        CompensationRule first = config.getCompensationRules().getRules().get(0);
        assertThat(first.name()).isEqualTo("kotlin-when");
        assertThat(first.language()).isEqualTo("kotlin");
        assertThat(first.kinds()).containsExactly(ConstructKind.SWITCH);
        assertThat(first.context()).isEqualTo(StructuralContext.ANY);
        assertThat(first.action()).isEqualTo(CompensationAction.RECLASSIFY);
        assertThat(config.getCompensationRules().getRules().get(1).context())
                .isEqualTo(StructuralContext.ELSE_WRAPPING_SOLE_IF);
    }

    @Test
    void shouldDisableCompensationWithEmptyRuleList() throws IOException {
        Path file = tempDir.resolve("none.yml");
        Files.writeString(file, "compensation_rules: []\n");

        AnalysisConfig config = loader.loadAnalysisConfig(null, file, new String[0]);

        assertThat(config.getCompensationRules().size()).isZero();
    }

    @Test
    void shouldRejectRuleWithUnknownKind() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, """
                compensation_rules:
                  - name: odd
                    kinds: [Unless]
                    action: suppress
                """);

        assertThatThrownBy(() -> loader.loadAnalysisConfig(null, file, new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid compensation rule 'odd'");
    }

    @Test
    void shouldRejectMissingConfigFile() {
        Path missing = tempDir.resolve("missing.yml");

        assertThatThrownBy(() -> loader.loadAnalysisConfig(null, missing, new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    void shouldRejectUnknownConfigKeys() throws IOException {
        Path file = tempDir.resolve("typo.yml");
        Files.writeString(file, "treshold: 3\n");

        assertThatThrownBy(() -> loader.loadAnalysisConfig(null, file, new String[0]))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Failed to read config file");
    }

    @Test
    void shouldProvideThresholdHelp() {
        String help = ConfigurationLoader.getThresholdHelp();

        assertThat(help).contains("--thresholds.cognitive-ok");
        assertThat(help).contains("TANGLE_CYCLOMATIC_SEVERE_MIN");
        assertThat(help).contains("Priority Order");
    }
}
