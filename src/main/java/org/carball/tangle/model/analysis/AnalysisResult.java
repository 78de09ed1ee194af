package org.carball.tangle.model.analysis;

import java.util.List;

public record AnalysisResult(
        List<FunctionRecord> records,
        List<FileSummary> fileSummaries,
        List<UnitFailure> failures,
        List<Diagnostic> diagnostics,
        Verdict verdict
) {

    public boolean passed() {
        return verdict == Verdict.PASS;
    }

    public long violationCount() {
        return records.stream().filter(r -> r.getTier().isViolation()).count();
    }

    public int totalCognitive() {
        return records.stream().filter(r -> !r.isSuppressed()).mapToInt(FunctionRecord::getCognitiveScore).sum();
    }
}
