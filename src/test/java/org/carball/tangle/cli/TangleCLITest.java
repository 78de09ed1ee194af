package org.carball.tangle.cli;

import org.carball.tangle.config.AnalysisConfig;
import org.carball.tangle.config.ConfigurationLoader;
import org.carball.tangle.config.NestedFunctionMode;
import org.carball.tangle.config.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TangleCLITest {

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("units.json");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/sample-units.json")) {
            Files.copy(in, input);
        }
    }

    @Test
    void shouldWriteJsonReportAndPass() {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = TangleCLI.run(new String[]{input.toString(), "-o", output.toString()});

        // Then
        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_OK);
        assertThat(output).exists();
    }

    @Test
    void shouldReturnGateFailureWhenViolationsAreFatal() {
        Path output = tempDir.resolve("report.json");

        int exitCode = TangleCLI.run(new String[]{input.toString(), "-o", output.toString(), "--fail-on-violation"});

        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_FAILED_GATE);
        assertThat(output).exists();
    }

    @Test
    void shouldWriteBothFormats() throws IOException {
        // Given
        Path output = tempDir.resolve("complexity.json");

        // When
        int exitCode = TangleCLI.run(new String[]{input.toString(), "-o", output.toString(), "--format", "both"});

        // Then
        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_OK);
        assertThat(tempDir.resolve("complexity.json")).exists();
        assertThat(Files.readString(tempDir.resolve("complexity.md"))).contains("# Code Complexity Report");
    }

    @Test
    void shouldReturnErrorForMissingInput() {
        int exitCode = TangleCLI.run(new String[]{tempDir.resolve("absent.json").toString()});

        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_ERROR);
    }

    @Test
    void shouldReturnErrorForUnknownOption() {
        int exitCode = TangleCLI.run(new String[]{input.toString(), "--colour"});

        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_ERROR);
    }

    @Test
    void shouldReturnErrorForUnknownProfile() {
        int exitCode = TangleCLI.run(new String[]{input.toString(), "--profile", "relaxed",
                "-o", tempDir.resolve("r.json").toString()});

        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_ERROR);
        assertThat(tempDir.resolve("r.json")).doesNotExist();
    }

    @Test
    void shouldReturnErrorForMalformedInput() throws IOException {
        Files.writeString(input, "{\"functions\": []}");

        int exitCode = TangleCLI.run(new String[]{input.toString(), "-o", tempDir.resolve("r.json").toString()});

        assertThat(exitCode).isEqualTo(TangleCLI.EXIT_ERROR);
    }

    @Test
    void shouldPrintUsageWithoutArguments() {
        assertThat(TangleCLI.run(new String[0])).isEqualTo(TangleCLI.EXIT_ERROR);
        assertThat(TangleCLI.run(new String[]{"--help"})).isEqualTo(TangleCLI.EXIT_OK);
    }

    @Test
    void shouldParseProfileAndLoaderOptions() {
        // Given
        String[] args = {input.toString(), "--profile", "strict", "--parallelism", "4",
                "--nested-functions", "inherited", "-f", "markdown", "-o", tempDir.resolve("out.txt").toString()};

        // When
        AnalysisConfig config = TangleCLI.parseArgs(args, new ConfigurationLoader(Map.of()));

        // Then
        assertThat(config.getThresholds().getProfileName()).isEqualTo("strict");
        assertThat(config.getThresholds().isFailOnViolation()).isTrue();
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getNestedFunctions()).isEqualTo(NestedFunctionMode.INHERITED);
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(config.getOutputFile()).endsWith("out.md");
    }

    @Test
    void shouldRejectInvalidFormat() {
        String[] args = {input.toString(), "--format", "xml"};

        assertThatThrownBy(() -> TangleCLI.parseArgs(args, new ConfigurationLoader(Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldRejectMissingOptionValue() {
        String[] args = {input.toString(), "--thresholds.cognitive-ok"};

        assertThatThrownBy(() -> TangleCLI.parseArgs(args, new ConfigurationLoader(Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--thresholds.cognitive-ok");
    }

    @Test
    void shouldRemoveOnlyTheFileExtension() {
        assertThat(TangleCLI.removeFileExtension("report.json")).isEqualTo("report");
        assertThat(TangleCLI.removeFileExtension("build/out.v2/report")).isEqualTo("build/out.v2/report");
        assertThat(TangleCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
        assertThat(TangleCLI.removeFileExtension("trailing.")).isEqualTo("trailing.");
    }
}
