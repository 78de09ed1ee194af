package org.carball.tangle.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.analyzer.ComplexityAnalyzer;
import org.carball.tangle.config.AnalysisConfig;
import org.carball.tangle.config.ConfigurationLoader;
import org.carball.tangle.config.OutputFormat;
import org.carball.tangle.config.ThresholdProfile;
import org.carball.tangle.exception.ConfigurationException;
import org.carball.tangle.model.analysis.AnalysisResult;
import org.carball.tangle.model.analysis.FunctionRecord;
import org.carball.tangle.model.analysis.Tier;
import org.carball.tangle.output.ComplexityReport;
import org.carball.tangle.parser.ConstructTreeReader;
import org.carball.tangle.parser.ParsedBatch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Slf4j
public class TangleCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_FAILED_GATE = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════╗
        ║       Tangle Code Complexity Analyzer v%s   ║
        ╚═══════════════════════════════════════════════╝
        """;

    // Options whose value is consumed by ConfigurationLoader
    private static final Set<String> LOADER_OPTIONS_WITH_VALUE = Set.of(
            "--thresholds.cognitive-ok", "--thresholds.cognitive-acceptable", "--thresholds.cognitive-severe",
            "--thresholds.cyclomatic-ok", "--thresholds.cyclomatic-acceptable", "--thresholds.cyclomatic-severe",
            "--parallelism", "--nested-functions");

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_ERROR : EXIT_OK;
        }
        if (Arrays.asList(args).contains("--help-thresholds")) {
            System.out.println(ConfigurationLoader.getThresholdHelp());
            System.out.println(ThresholdProfile.getProfileHelp());
            return EXIT_OK;
        }

        try {
            AnalysisConfig config = parseArgs(args, new ConfigurationLoader());

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Input: " + config.getInputFile());
            System.out.println("   Output: " + describeOutputs(config));
            System.out.println("   " + config.getThresholds().getConfigurationSummary());
            System.out.println();

            System.out.print("📖 Reading construct trees... ");
            ParsedBatch batch = new ConstructTreeReader().read(config.getInputFile());
            System.out.println("✓");

            System.out.print("📊 Scoring functions... ");
            AnalysisResult result = new ComplexityAnalyzer(config).analyze(batch);
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            List<Path> written = outputResults(result, config);
            System.out.println("✓");

            printSummary(result, config);

            System.out.println(result.passed() ? "\n✅ Analysis complete!" : "\n❌ Complexity gate failed!");
            written.forEach(path -> System.out.println("   Output file: " + path));

            return result.passed() ? EXIT_OK : EXIT_FAILED_GATE;

        } catch (ConfigurationException | IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar tangle.jar <units.json> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  units.json          Construct trees exported by a language front end");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: complexity-report.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --config, -c        YAML configuration file (thresholds, compensation rules)");
        System.out.println("  --profile, -p       Threshold profile: " + ThresholdProfile.getAvailableProfiles());
        System.out.println("  --fail-on-violation Exit with code 2 when any function is a violation");
        System.out.println("  --parallelism <n>   Worker threads used for scoring (default: 1)");
        System.out.println("  --nested-functions  independent|inherited (default: independent)");
        System.out.println("  --thresholds.* <n>  Override a single threshold (see --help-thresholds)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Basic analysis");
        System.out.println("  java -jar tangle.jar units.json");
        System.out.println();
        System.out.println("  # CI gate with strict thresholds and a Markdown report");
        System.out.println("  java -jar tangle.jar units.json --profile strict --format both -o build/complexity");
        System.out.println();
        System.out.println("Exit codes:");
        System.out.println("  0  analysis passed");
        System.out.println("  1  configuration or I/O error");
        System.out.println("  2  complexity gate failed (--fail-on-violation)");
    }

    static AnalysisConfig parseArgs(String[] args, ConfigurationLoader loader) {
        String profileName = null;
        Path configFile = null;
        String outputFile = "complexity-report.json";
        OutputFormat outputFormat = OutputFormat.JSON;
        boolean verbose = false;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output":
                case "-o":
                    outputFile = requireValue(args, ++i, "Output file not specified");
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, ++i, "Output format not specified");
                    try {
                        outputFormat = OutputFormat.valueOf(format.toUpperCase(Locale.ROOT));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, or both");
                    }
                    break;

                case "--config":
                case "-c":
                    configFile = Paths.get(requireValue(args, ++i, "Config file not specified"));
                    break;

                case "--profile":
                case "-p":
                    profileName = requireValue(args, ++i, "Profile not specified");
                    break;

                case "--verbose":
                case "-v":
                    verbose = true;
                    break;

                case "--fail-on-violation":
                    // Boolean flag, applied by ConfigurationLoader
                    break;

                default:
                    if (LOADER_OPTIONS_WITH_VALUE.contains(arg)) {
                        requireValue(args, ++i, "Value not specified for " + arg);
                        break;
                    }
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        AnalysisConfig config = loader.loadAnalysisConfig(profileName, configFile, args);
        config.setInputFile(Paths.get(args[0]));
        config.setVerbose(verbose);
        config.setOutputFormat(outputFormat);

        String baseFileName = removeFileExtension(outputFile);
        config.setOutputFile(outputFormat == OutputFormat.MARKDOWN ? baseFileName + ".md" : baseFileName + ".json");

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(AnalysisConfig config) {
        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Input file not found: " + config.getInputFile());
        }
        if (Files.isDirectory(config.getInputFile())) {
            throw new IllegalArgumentException("Input must be a JSON file, not a directory");
        }

        Path outputDir = Paths.get(config.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static String describeOutputs(AnalysisConfig config) {
        if (config.getOutputFormat() == OutputFormat.BOTH) {
            String baseFileName = removeFileExtension(config.getOutputFile());
            return baseFileName + ".json, " + baseFileName + ".md";
        }
        return config.getOutputFile();
    }

    private static List<Path> outputResults(AnalysisResult result, AnalysisConfig config) throws IOException {
        ComplexityReport report = new ComplexityReport(result, config.getThresholds());
        String baseFileName = removeFileExtension(config.getOutputFile());
        OutputFormat format = config.getOutputFormat();

        Path jsonFile = null;
        Path markdownFile = null;
        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            jsonFile = Paths.get(format == OutputFormat.BOTH ? baseFileName + ".json" : config.getOutputFile());
            Files.writeString(jsonFile, report.toJson());
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            markdownFile = Paths.get(format == OutputFormat.BOTH ? baseFileName + ".md" : config.getOutputFile());
            Files.writeString(markdownFile, report.toMarkdown());
        }

        if (jsonFile != null && markdownFile != null) {
            return List.of(jsonFile, markdownFile);
        }
        return List.of(jsonFile != null ? jsonFile : markdownFile);
    }

    private static void printSummary(AnalysisResult result, AnalysisConfig config) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 COMPLEXITY SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nFunctions scored: " + result.records().size());
        System.out.println("Files: " + result.fileSummaries().size());
        System.out.println("Total cognitive complexity: " + result.totalCognitive());
        if (!result.failures().isEmpty()) {
            System.out.println("Skipped units: " + result.failures().size());
        }

        System.out.println("\nTier breakdown:");
        System.out.println("  🟢 OK: " + countTier(result, Tier.OK));
        System.out.println("  🟡 Acceptable: " + countTier(result, Tier.ACCEPTABLE));
        System.out.println("  🟠 Violation: " + countTier(result, Tier.VIOLATION));
        System.out.println("  🔴 Severe: " + countTier(result, Tier.SEVERE));

        System.out.println("\n🎯 Most Complex Functions:");
        System.out.println("-".repeat(60));
        result.records().stream()
                .filter(r -> !r.isSuppressed())
                .limit(config.isVerbose() ? 10 : 3)
                .forEach(record -> System.out.printf("%-40s cognitive %3d  cyclomatic %3d%n",
                        record.getIdentifier(), record.getCognitiveScore(), record.getCyclomaticScore()));

        if (config.isVerbose() && !result.diagnostics().isEmpty()) {
            System.out.println("\nDiagnostics:");
            result.diagnostics().forEach(d -> System.out.println("  ⚠️ " + d.message()));
        }
    }

    private static long countTier(AnalysisResult result, Tier tier) {
        return result.records().stream().map(FunctionRecord::getTier).filter(tier::equals).count();
    }
}
