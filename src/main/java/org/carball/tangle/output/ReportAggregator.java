package org.carball.tangle.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.config.ComplexityThresholds;
import org.carball.tangle.model.analysis.AnalysisResult;
import org.carball.tangle.model.analysis.Diagnostic;
import org.carball.tangle.model.analysis.FileSummary;
import org.carball.tangle.model.analysis.FunctionRecord;
import org.carball.tangle.model.analysis.Tier;
import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.analysis.Verdict;
import org.carball.tangle.model.construct.SourceLocation;
import org.carball.tangle.model.score.FunctionScore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds function scores into the final {@link AnalysisResult}. Scores are
 * only tiered and counted here, never recomputed.
 *
 * <p>Not thread-safe: results are appended from a single thread.
 */
@Slf4j
public class ReportAggregator {

    static final String UNKNOWN_FILE = "<unknown>";

    public static final Comparator<FunctionRecord> REPORT_ORDER =
            Comparator.comparingInt(FunctionRecord::getCognitiveScore).reversed()
                    .thenComparing(Comparator.comparingInt(FunctionRecord::getCyclomaticScore).reversed())
                    .thenComparing(FunctionRecord::getLocation, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(FunctionRecord::getIdentifier);

    private final ComplexityThresholds thresholds;
    private final List<FunctionRecord> records = new ArrayList<>();
    private final List<UnitFailure> failures = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public ReportAggregator(ComplexityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public FunctionRecord add(FunctionScore score) {
        FunctionRecord record = toRecord(score);
        records.add(record);
        if (record.getTier().isViolation()) {
            log.debug("{} is rated {} (cognitive={}, cyclomatic={})", record.getIdentifier(), record.getTier(),
                    record.getCognitiveScore(), record.getCyclomaticScore());
        }
        return record;
    }

    public void addAll(Collection<FunctionScore> scores) {
        scores.forEach(this::add);
    }

    public void addFailure(UnitFailure failure) {
        failures.add(failure);
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addDiagnostics(Collection<Diagnostic> newDiagnostics) {
        diagnostics.addAll(newDiagnostics);
    }

    public AnalysisResult build() {
        List<FunctionRecord> ordered = new ArrayList<>(records);
        ordered.sort(REPORT_ORDER);

        Map<String, FileSummary> summaries = new TreeMap<>();
        for (FunctionRecord record : ordered) {
            summaries.computeIfAbsent(fileOf(record.getLocation()), FileSummary::new).addRecord(record);
        }

        Verdict verdict = verdictFor(ordered);
        log.info("Aggregated {} function(s) across {} file(s): {} violation(s), {} failure(s), verdict {}",
                ordered.size(), summaries.size(), ordered.stream().filter(r -> r.getTier().isViolation()).count(),
                failures.size(), verdict);

        return new AnalysisResult(List.copyOf(ordered), List.copyOf(summaries.values()),
                List.copyOf(failures), List.copyOf(diagnostics), verdict);
    }

    private FunctionRecord toRecord(FunctionScore score) {
        Tier cognitiveTier = score.isSuppressed() ? Tier.OK : thresholds.cognitiveTier(score.getCognitive());
        Tier cyclomaticTier = score.isSuppressed() ? Tier.OK : thresholds.cyclomaticTier(score.getCyclomatic());

        return FunctionRecord.builder()
                .identifier(score.getIdentifier())
                .location(score.getLocation())
                .language(score.getLanguage())
                .cognitiveScore(score.getCognitive())
                .cyclomaticScore(score.getCyclomatic())
                .maxNesting(score.getMaxNesting())
                .cognitiveTier(cognitiveTier)
                .cyclomaticTier(cyclomaticTier)
                .tier(Tier.worst(cognitiveTier, cyclomaticTier))
                .suppressed(score.isSuppressed())
                .recursive(score.isRecursive())
                .parent(score.getParent())
                .build();
    }

    private Verdict verdictFor(List<FunctionRecord> ordered) {
        if (!thresholds.isFailOnViolation()) {
            return Verdict.PASS;
        }
        boolean violated = ordered.stream().anyMatch(r -> r.getTier().isViolation());
        return violated ? Verdict.FAIL : Verdict.PASS;
    }

    private static String fileOf(SourceLocation location) {
        if (location == null || location.file() == null || location.file().isBlank()) {
            return UNKNOWN_FILE;
        }
        return location.file();
    }
}
