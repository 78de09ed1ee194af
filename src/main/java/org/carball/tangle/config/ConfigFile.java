package org.carball.tangle.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * YAML configuration file. Every field is optional; absent values leave the
 * profile's settings untouched.
 *
 * <pre>
 * profile: strict
 * thresholds:
 *   cognitive_ok_max: 5
 * fail_on_violation: true
 * nested_functions: inherited
 * compensation_rules:
 *   - name: else-wrapping-if
 *     kinds: [Else]
 *     context: else_wrapping_sole_if
 *     action: suppress
 * </pre>
 *
 * An empty {@code compensation_rules} list disables compensation; leaving the
 * key out keeps the default rules.
 */
@Data
public class ConfigFile {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("thresholds")
    private Thresholds thresholds;

    @JsonProperty("fail_on_violation")
    private Boolean failOnViolation;

    @JsonProperty("nested_functions")
    private String nestedFunctions;

    @JsonProperty("parallelism")
    private Integer parallelism;

    @JsonProperty("compensation_rules")
    private List<RuleDefinition> compensationRules;

    @Data
    public static class Thresholds {
        @JsonProperty("cognitive_ok_max")
        private Integer cognitiveOkMax;

        @JsonProperty("cognitive_acceptable_max")
        private Integer cognitiveAcceptableMax;

        @JsonProperty("cognitive_severe_min")
        private Integer cognitiveSevereMin;

        @JsonProperty("cyclomatic_ok_max")
        private Integer cyclomaticOkMax;

        @JsonProperty("cyclomatic_acceptable_max")
        private Integer cyclomaticAcceptableMax;

        @JsonProperty("cyclomatic_severe_min")
        private Integer cyclomaticSevereMin;
    }

    @Data
    public static class RuleDefinition {
        @JsonProperty("name")
        private String name;

        @JsonProperty("language")
        private String language;

        @JsonProperty("hint")
        private String hint;

        @JsonProperty("kinds")
        private List<String> kinds;

        @JsonProperty("context")
        private String context;

        @JsonProperty("action")
        private String action;
    }
}
