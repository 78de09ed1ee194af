package org.carball.tangle.analyzer;

import org.carball.tangle.config.AnalysisConfig;
import org.carball.tangle.config.ComplexityThresholds;
import org.carball.tangle.exception.ConfigurationException;
import org.carball.tangle.model.analysis.AnalysisResult;
import org.carball.tangle.model.analysis.FailureType;
import org.carball.tangle.model.analysis.FunctionRecord;
import org.carball.tangle.model.analysis.Tier;
import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.analysis.Verdict;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.expression.LogicalExpression;
import org.carball.tangle.model.unit.FunctionUnit;
import org.carball.tangle.parser.ParsedBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class ComplexityAnalyzerTest {

    private AnalysisConfig config;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.defaults();
    }

    @Test
    void shouldScoreBatchAndResolveConditions() {
        // Given
        ConstructNode guarded = ConstructNode.builder()
                .kind(ConstructKind.IF)
                .condition(LogicalExpression.of("a", "&&", "b"))
                .build();

        // When
        AnalysisResult result = new ComplexityAnalyzer(config).analyze(List.of(FunctionUnit.of("check", guarded)));

        // Then
        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.getCognitiveScore()).isEqualTo(2);
            assertThat(record.getCyclomaticScore()).isEqualTo(3);
        });
        assertThat(result.verdict()).isEqualTo(Verdict.PASS);
    }

    @Test
    void shouldScoreMutualRecursionOncePerMember() {
        List<FunctionUnit> units = List.of(
                FunctionUnit.of("ping", call("pong"), call("pong"), call("pong")),
                FunctionUnit.of("pong", ConstructNode.of(ConstructKind.IF, call("ping"))));

        AnalysisResult result = new ComplexityAnalyzer(config).analyze(units);

        assertThat(result.records())
                .extracting(FunctionRecord::getIdentifier, FunctionRecord::getCognitiveScore,
                        FunctionRecord::isRecursive)
                .containsExactly(
                        tuple("pong", 2, true),
                        tuple("ping", 1, true));
    }

    @Test
    void shouldIsolateInvalidUnits() {
        // Given
        List<FunctionUnit> units = List.of(
                FunctionUnit.of("good", ConstructNode.of(ConstructKind.IF)),
                FunctionUnit.of(" ", ConstructNode.of(ConstructKind.IF)),
                FunctionUnit.of("broken", ConstructNode.builder().build()));

        // When
        AnalysisResult result = new ComplexityAnalyzer(config).analyze(units);

        // Then
        assertThat(result.records()).extracting(FunctionRecord::getIdentifier).containsExactly("good");
        assertThat(result.failures()).extracting(UnitFailure::type)
                .containsExactly(FailureType.INVALID_UNIT, FailureType.INVALID_UNIT);
    }

    @Test
    void shouldIsolateUnitNestedTooDeep() {
        // Given a try chain far deeper than any real function
        ConstructNode deep = ConstructNode.of(ConstructKind.TRY);
        for (int i = 0; i < 200_000; i++) {
            deep = ConstructNode.of(ConstructKind.TRY, deep);
        }
        List<FunctionUnit> units = List.of(
                FunctionUnit.of("generated", deep),
                FunctionUnit.of("ok", ConstructNode.of(ConstructKind.IF)));

        // When
        AnalysisResult result = new ComplexityAnalyzer(config).analyze(units);

        // Then
        assertThat(result.records()).extracting(FunctionRecord::getIdentifier).containsExactly("ok");
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.identifier()).isEqualTo("generated");
            assertThat(failure.type()).isEqualTo(FailureType.INVALID_UNIT);
            assertThat(failure.reason()).contains(String.valueOf(ComplexityAnalyzer.MAX_CONSTRUCT_DEPTH));
        });
    }

    @Test
    void shouldAcceptUnitAtMaximumDepth() {
        AnalysisResult result = new ComplexityAnalyzer(config)
                .analyze(List.of(FunctionUnit.of("deep", nestedIfs(ComplexityAnalyzer.MAX_CONSTRUCT_DEPTH))));

        assertThat(result.failures()).isEmpty();
        assertThat(result.records()).singleElement()
                .satisfies(record -> assertThat(record.getMaxNesting())
                        .isEqualTo(ComplexityAnalyzer.MAX_CONSTRUCT_DEPTH));
    }

    @Test
    void shouldCarryReaderFailuresIntoResult() {
        UnitFailure unreadable = new UnitFailure("legacy", null, FailureType.UNMAPPED_CONSTRUCT, "Unmapped construct");

        AnalysisResult result = new ComplexityAnalyzer(config)
                .analyze(new ParsedBatch(List.of(FunctionUnit.of("ok")), List.of(unreadable)));

        assertThat(result.records()).hasSize(1);
        assertThat(result.failures()).containsExactly(unreadable);
    }

    @Test
    void shouldProduceSameResultInParallel() {
        // Given
        List<FunctionUnit> units = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            units.add(FunctionUnit.of("fn" + i, nestedIfs(i % 7 + 1), ConstructNode.of(ConstructKind.LAMBDA,
                    ConstructNode.of(ConstructKind.WHILE))));
        }
        AnalysisConfig parallel = AnalysisConfig.defaults();
        parallel.setParallelism(4);

        // When
        AnalysisResult sequentialResult = new ComplexityAnalyzer(config).analyze(units);
        AnalysisResult parallelResult = new ComplexityAnalyzer(parallel).analyze(units);

        // Then
        assertThat(parallelResult.records()).hasSize(400);
        assertThat(parallelResult.records()).isEqualTo(sequentialResult.records());
        assertThat(parallelResult.failures()).isEmpty();
    }

    @Test
    void shouldReportUnscoredUnitsAsCancelled() {
        // Given
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(config);
        analyzer.cancel();

        // When
        AnalysisResult result = analyzer.analyze(List.of(FunctionUnit.of("a"), FunctionUnit.of("b")));

        // Then
        assertThat(analyzer.isCancelled()).isTrue();
        assertThat(result.records()).isEmpty();
        assertThat(result.failures()).extracting(UnitFailure::identifier, UnitFailure::type)
                .containsExactly(tuple("a", FailureType.CANCELLED), tuple("b", FailureType.CANCELLED));
    }

    @Test
    void shouldReportCancelledUnitsInParallelMode() {
        config.setParallelism(3);
        ComplexityAnalyzer analyzer = new ComplexityAnalyzer(config);
        analyzer.cancel();

        AnalysisResult result = analyzer.analyze(List.of(FunctionUnit.of("a"), FunctionUnit.of("b"),
                FunctionUnit.of("c")));

        assertThat(result.failures()).hasSize(3).allMatch(f -> f.type() == FailureType.CANCELLED);
    }

    @Test
    void shouldFailVerdictWhenConfiguredAndViolated() {
        // Given
        config.setThresholds(ComplexityThresholds.builder().failOnViolation(true).build());

        // When
        AnalysisResult result = new ComplexityAnalyzer(config)
                .analyze(List.of(FunctionUnit.of("deep", nestedIfs(5)), FunctionUnit.of("flat")));

        // Then
        assertThat(result.records().get(0).getTier()).isEqualTo(Tier.SEVERE);
        assertThat(result.verdict()).isEqualTo(Verdict.FAIL);
        assertThat(result.passed()).isFalse();
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        config.setParallelism(0);

        assertThatThrownBy(() -> new ComplexityAnalyzer(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Parallelism");
    }

    private static ConstructNode call(String target) {
        return ConstructNode.builder().kind(ConstructKind.RECURSIVE_CALL).target(target).build();
    }

    private static ConstructNode nestedIfs(int depth) {
        ConstructNode current = ConstructNode.of(ConstructKind.IF);
        for (int i = 1; i < depth; i++) {
            current = ConstructNode.of(ConstructKind.IF, current);
        }
        return current;
    }
}
