package org.carball.tangle.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.compensation.CompensationAction;
import org.carball.tangle.compensation.CompensationRule;
import org.carball.tangle.compensation.CompensationRuleSet;
import org.carball.tangle.compensation.StructuralContext;
import org.carball.tangle.exception.ConfigurationException;
import org.carball.tangle.exception.UnmappedConstructException;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.SourceLocation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads thresholds using the hierarchy: CLI args > env vars > defaults
     */
    public ComplexityThresholds loadConfiguration(String[] args) {
        return loadConfigurationWithProfile(ThresholdProfile.DEFAULT.getName(), args);
    }

    /**
     * @throws ConfigurationException if no profile has that name
     */
    public ComplexityThresholds loadProfile(String profileName) {
        try {
            ThresholdProfile profile = ThresholdProfile.fromName(profileName);
            ComplexityThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * Loads and applies profile, then overlays with env vars and CLI args.
     */
    public ComplexityThresholds loadConfigurationWithProfile(String profileName, String[] args) {
        ComplexityThresholds.ComplexityThresholdsBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        ComplexityThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Builds the full analysis configuration. Priority, highest first: CLI
     * arguments, environment variables, the config file, the profile.
     *
     * @param profileName profile to start from; null uses the file's profile or "default"
     * @param configFile  YAML file, may be null
     * @throws ConfigurationException if the file cannot be read or the result is invalid
     */
    public AnalysisConfig loadAnalysisConfig(String profileName, Path configFile, String[] args) {
        ConfigFile file = configFile != null ? readConfigFile(configFile) : new ConfigFile();

        String profile = profileName != null ? profileName
                : file.getProfile() != null ? file.getProfile() : ThresholdProfile.DEFAULT.getName();
        ComplexityThresholds.ComplexityThresholdsBuilder builder = loadProfile(profile).toBuilder();
        AnalysisConfig config = AnalysisConfig.defaults();

        // 1. Config file
        applyConfigFile(builder, config, file);

        // 2. Environment variables
        applyEnvironmentVariables(builder);
        applyEnvironmentSettings(config);

        // 3. CLI arguments (highest priority)
        applyCLIArguments(builder, args);
        applyCLISettings(config, args);

        config.setThresholds(builder.build());
        config.validate();

        log.info("Configuration loaded: {}", config.getThresholds().getConfigurationSummary());
        return config;
    }

    public ConfigFile readConfigFile(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        try {
            ConfigFile file = yamlMapper.readValue(path.toFile(), ConfigFile.class);
            log.info("Loaded configuration file: {}", path);
            return file != null ? file : new ConfigFile();
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + path + ": " + e.getMessage(), e);
        }
    }

    private void applyConfigFile(ComplexityThresholds.ComplexityThresholdsBuilder builder, AnalysisConfig config,
                                 ConfigFile file) {
        ConfigFile.Thresholds thresholds = file.getThresholds();
        if (thresholds != null) {
            if (thresholds.getCognitiveOkMax() != null) {
                builder.cognitiveOkMax(thresholds.getCognitiveOkMax());
            }
            if (thresholds.getCognitiveAcceptableMax() != null) {
                builder.cognitiveAcceptableMax(thresholds.getCognitiveAcceptableMax());
            }
            if (thresholds.getCognitiveSevereMin() != null) {
                builder.cognitiveSevereMin(thresholds.getCognitiveSevereMin());
            }
            if (thresholds.getCyclomaticOkMax() != null) {
                builder.cyclomaticOkMax(thresholds.getCyclomaticOkMax());
            }
            if (thresholds.getCyclomaticAcceptableMax() != null) {
                builder.cyclomaticAcceptableMax(thresholds.getCyclomaticAcceptableMax());
            }
            if (thresholds.getCyclomaticSevereMin() != null) {
                builder.cyclomaticSevereMin(thresholds.getCyclomaticSevereMin());
            }
        }
        if (file.getFailOnViolation() != null) {
            builder.failOnViolation(file.getFailOnViolation());
        }
        if (file.getNestedFunctions() != null) {
            config.setNestedFunctions(parseNestedFunctionMode(file.getNestedFunctions()));
        }
        if (file.getParallelism() != null) {
            config.setParallelism(file.getParallelism());
        }
        if (file.getCompensationRules() != null) {
            config.setCompensationRules(buildRuleSet(file.getCompensationRules()));
        }
    }

    /**
     * Turns rule definitions from a config file into a rule set, keeping
     * their order.
     *
     * @throws ConfigurationException for unknown kinds, contexts or actions
     */
    public CompensationRuleSet buildRuleSet(List<ConfigFile.RuleDefinition> definitions) {
        List<CompensationRule> rules = new ArrayList<>();
        for (ConfigFile.RuleDefinition definition : definitions) {
            try {
                rules.add(new CompensationRule(
                        definition.getName(),
                        definition.getLanguage(),
                        definition.getHint(),
                        parseKinds(definition.getKinds()),
                        definition.getContext() != null ? parseEnum(StructuralContext.class, definition.getContext())
                                : StructuralContext.ANY,
                        definition.getAction() != null ? parseEnum(CompensationAction.class, definition.getAction())
                                : null));
            } catch (IllegalArgumentException | UnmappedConstructException e) {
                throw new ConfigurationException("Invalid compensation rule '" + definition.getName() + "': "
                        + e.getMessage(), e);
            }
        }
        if (rules.isEmpty()) {
            log.info("Compensation rules disabled by configuration");
        } else {
            log.debug("Loaded {} compensation rule(s) from configuration", rules.size());
        }
        return new CompensationRuleSet(rules);
    }

    private static Set<ConstructKind> parseKinds(List<String> names) {
        if (names == null || names.isEmpty()) {
            return Set.of();
        }
        Set<ConstructKind> kinds = EnumSet.noneOf(ConstructKind.class);
        for (String name : names) {
            kinds.add(ConstructKind.fromName(name, SourceLocation.unknown()));
        }
        return kinds;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    private static NestedFunctionMode parseNestedFunctionMode(String value) {
        try {
            return parseEnum(NestedFunctionMode.class, value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid nested function mode '" + value
                    + "'. Use: independent or inherited", e);
        }
    }

    private void applyEnvironmentVariables(ComplexityThresholds.ComplexityThresholdsBuilder builder) {
        Map<String, String> env = environment;

        if (env.containsKey("TANGLE_COGNITIVE_OK_MAX")) {
            parseInt("TANGLE_COGNITIVE_OK_MAX", env.get("TANGLE_COGNITIVE_OK_MAX"), builder::cognitiveOkMax);
        }
        if (env.containsKey("TANGLE_COGNITIVE_ACCEPTABLE_MAX")) {
            parseInt("TANGLE_COGNITIVE_ACCEPTABLE_MAX", env.get("TANGLE_COGNITIVE_ACCEPTABLE_MAX"),
                    builder::cognitiveAcceptableMax);
        }
        if (env.containsKey("TANGLE_COGNITIVE_SEVERE_MIN")) {
            parseInt("TANGLE_COGNITIVE_SEVERE_MIN", env.get("TANGLE_COGNITIVE_SEVERE_MIN"),
                    builder::cognitiveSevereMin);
        }
        if (env.containsKey("TANGLE_CYCLOMATIC_OK_MAX")) {
            parseInt("TANGLE_CYCLOMATIC_OK_MAX", env.get("TANGLE_CYCLOMATIC_OK_MAX"), builder::cyclomaticOkMax);
        }
        if (env.containsKey("TANGLE_CYCLOMATIC_ACCEPTABLE_MAX")) {
            parseInt("TANGLE_CYCLOMATIC_ACCEPTABLE_MAX", env.get("TANGLE_CYCLOMATIC_ACCEPTABLE_MAX"),
                    builder::cyclomaticAcceptableMax);
        }
        if (env.containsKey("TANGLE_CYCLOMATIC_SEVERE_MIN")) {
            parseInt("TANGLE_CYCLOMATIC_SEVERE_MIN", env.get("TANGLE_CYCLOMATIC_SEVERE_MIN"),
                    builder::cyclomaticSevereMin);
        }
        if (env.containsKey("TANGLE_FAIL_ON_VIOLATION")) {
            builder.failOnViolation(Boolean.parseBoolean(env.get("TANGLE_FAIL_ON_VIOLATION")));
        }
    }

    private void applyEnvironmentSettings(AnalysisConfig config) {
        if (environment.containsKey("TANGLE_PARALLELISM")) {
            parseInt("TANGLE_PARALLELISM", environment.get("TANGLE_PARALLELISM"), config::setParallelism);
        }
        if (environment.containsKey("TANGLE_NESTED_FUNCTIONS")) {
            config.setNestedFunctions(parseNestedFunctionMode(environment.get("TANGLE_NESTED_FUNCTIONS")));
        }
    }

    private void applyCLIArguments(ComplexityThresholds.ComplexityThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--fail-on-violation".equals(arg)) {
                builder.failOnViolation(true);
                continue;
            }
            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];

            switch (arg) {
                case "--thresholds.cognitive-ok":
                    parseInt(arg, value, builder::cognitiveOkMax);
                    break;
                case "--thresholds.cognitive-acceptable":
                    parseInt(arg, value, builder::cognitiveAcceptableMax);
                    break;
                case "--thresholds.cognitive-severe":
                    parseInt(arg, value, builder::cognitiveSevereMin);
                    break;
                case "--thresholds.cyclomatic-ok":
                    parseInt(arg, value, builder::cyclomaticOkMax);
                    break;
                case "--thresholds.cyclomatic-acceptable":
                    parseInt(arg, value, builder::cyclomaticAcceptableMax);
                    break;
                case "--thresholds.cyclomatic-severe":
                    parseInt(arg, value, builder::cyclomaticSevereMin);
                    break;
                default:
                    break;
            }
        }
    }

    private void applyCLISettings(AnalysisConfig config, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];
            if ("--parallelism".equals(arg)) {
                parseInt(arg, value, config::setParallelism);
            } else if ("--nested-functions".equals(arg)) {
                config.setNestedFunctions(parseNestedFunctionMode(value));
            }
        }
    }

    private static void parseInt(String source, String value, IntConsumer target) {
        try {
            target.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.cognitive-ok <num>          Highest cognitive score rated ok (default 5)
              --thresholds.cognitive-acceptable <num>  Highest cognitive score rated acceptable (default 10)
              --thresholds.cognitive-severe <num>      Lowest cognitive score rated severe (default 15)
              --thresholds.cyclomatic-ok <num>         Highest cyclomatic score rated ok (default 5)
              --thresholds.cyclomatic-acceptable <num> Highest cyclomatic score rated acceptable (default 10)
              --thresholds.cyclomatic-severe <num>     Lowest cyclomatic score rated severe (default 15)
              --fail-on-violation                      Fail when any function is rated violation or severe
              --parallelism <num>                      Worker threads used for scoring (default 1)
              --nested-functions <mode>                independent|inherited (default independent)

            Environment Variables:
              TANGLE_COGNITIVE_OK_MAX             Same as --thresholds.cognitive-ok
              TANGLE_COGNITIVE_ACCEPTABLE_MAX     Same as --thresholds.cognitive-acceptable
              TANGLE_COGNITIVE_SEVERE_MIN         Same as --thresholds.cognitive-severe
              TANGLE_CYCLOMATIC_OK_MAX            Same as --thresholds.cyclomatic-ok
              TANGLE_CYCLOMATIC_ACCEPTABLE_MAX    Same as --thresholds.cyclomatic-acceptable
              TANGLE_CYCLOMATIC_SEVERE_MIN        Same as --thresholds.cyclomatic-severe
              TANGLE_FAIL_ON_VIOLATION            Same as --fail-on-violation (true/false)
              TANGLE_PARALLELISM                  Same as --parallelism
              TANGLE_NESTED_FUNCTIONS             Same as --nested-functions

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Config file (--config)
              4. Profile defaults or built-in defaults
            """;
    }
}
