package org.carball.tangle.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.config.ComplexityThresholds;
import org.carball.tangle.model.analysis.AnalysisResult;
import org.carball.tangle.model.analysis.Diagnostic;
import org.carball.tangle.model.analysis.FileSummary;
import org.carball.tangle.model.analysis.FunctionRecord;
import org.carball.tangle.model.analysis.Tier;
import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.construct.SourceLocation;

import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ComplexityReport {

    static final String TOOL_VERSION = "1.0.0";

    private final AnalysisResult analysisResult;
    private final ComplexityThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ComplexityReport(AnalysisResult analysisResult, ComplexityThresholds thresholds) {
        this(analysisResult, thresholds, LocalDateTime.now());
    }

    ComplexityReport(AnalysisResult analysisResult, ComplexityThresholds thresholds, LocalDateTime timestamp) {
        this.analysisResult = analysisResult;
        this.thresholds = thresholds;
        this.timestamp = timestamp;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        // Header
        md.append("# Code Complexity Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Tangle Version:** ").append(TOOL_VERSION).append("  \n");
        md.append("**Verdict:** ").append(analysisResult.passed() ? "✅ PASS" : "❌ FAIL").append("  \n\n");

        // Summary
        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Functions Analyzed | ").append(analysisResult.records().size()).append(" |\n");
        md.append("| Files | ").append(analysisResult.fileSummaries().size()).append(" |\n");
        md.append("| Total Cognitive Complexity | ").append(analysisResult.totalCognitive()).append(" |\n");
        md.append("| Violations | ").append(analysisResult.violationCount()).append(" |\n");
        md.append("| Unreadable or Failed Units | ").append(analysisResult.failures().size()).append(" |\n\n");

        // Thresholds
        md.append("### Thresholds\n\n");
        md.append("| Metric | OK | Acceptable | Severe |\n");
        md.append("|--------|----|------------|--------|\n");
        md.append("| Cognitive | ≤ ").append(thresholds.getCognitiveOkMax())
                .append(" | ≤ ").append(thresholds.getCognitiveAcceptableMax())
                .append(" | ≥ ").append(thresholds.getCognitiveSevereMin()).append(" |\n");
        md.append("| Cyclomatic | ≤ ").append(thresholds.getCyclomaticOkMax())
                .append(" | ≤ ").append(thresholds.getCyclomaticAcceptableMax())
                .append(" | ≥ ").append(thresholds.getCyclomaticSevereMin()).append(" |\n\n");

        // Violations first
        List<FunctionRecord> violations = analysisResult.records().stream()
                .filter(r -> r.getTier().isViolation())
                .collect(Collectors.toList());
        md.append("## Functions Needing Attention\n\n");
        if (violations.isEmpty()) {
            md.append("**No function exceeds the acceptable thresholds.**\n\n");
        } else {
            appendFunctionTable(md, violations);
        }

        md.append("## All Functions\n\n");
        if (analysisResult.records().isEmpty()) {
            md.append("*No functions were scored.*\n\n");
        } else {
            appendFunctionTable(md, analysisResult.records());
        }

        // Per file
        if (!analysisResult.fileSummaries().isEmpty()) {
            md.append("## Files\n\n");
            md.append("| File | Functions | Total Cognitive | Max Cognitive | Avg Cognitive | Violations |\n");
            md.append("|------|-----------|-----------------|---------------|---------------|------------|\n");
            for (FileSummary summary : analysisResult.fileSummaries()) {
                md.append("| ").append(summary.getFile())
                        .append(" | ").append(summary.getFunctionCount())
                        .append(" | ").append(summary.getTotalCognitive())
                        .append(" | ").append(summary.getMaxCognitive())
                        .append(" | ").append(String.format("%.1f", summary.getAverageCognitive()))
                        .append(" | ").append(summary.getViolationCount()).append(" |\n");
            }
            md.append("\n");
        }

        if (!analysisResult.failures().isEmpty()) {
            md.append("## Skipped Units\n\n");
            for (UnitFailure failure : analysisResult.failures()) {
                md.append("- **").append(failure.identifier() != null ? failure.identifier() : "(unnamed)")
                        .append("** (").append(failure.type()).append("): ").append(failure.reason()).append("\n");
            }
            md.append("\n");
        }

        if (!analysisResult.diagnostics().isEmpty()) {
            md.append("## Diagnostics\n\n");
            for (Diagnostic diagnostic : analysisResult.diagnostics()) {
                md.append("- ").append(diagnostic.severity()).append(" `").append(diagnostic.code()).append("`: ")
                        .append(diagnostic.message()).append("\n");
            }
            md.append("\n");
        }

        // Footer
        md.append("---\n\n");
        md.append("*Generated by Tangle complexity analyzer*\n");

        return md.toString();
    }

    private static void appendFunctionTable(StringBuilder md, List<FunctionRecord> records) {
        md.append("| Function | Location | Cognitive | Cyclomatic | Max Nesting | Tier |\n");
        md.append("|----------|----------|-----------|------------|-------------|------|\n");
        for (FunctionRecord record : records) {
            md.append("| `").append(record.getIdentifier()).append("`")
                    .append(record.isRecursive() ? " ↻" : "")
                    .append(" | ").append(record.getLocation())
                    .append(" | ").append(record.getCognitiveScore())
                    .append(" | ").append(record.getCyclomaticScore())
                    .append(" | ").append(record.getMaxNesting())
                    .append(" | ").append(tierLabel(record)).append(" |\n");
        }
        md.append("\n");
    }

    private static String tierLabel(FunctionRecord record) {
        if (record.isSuppressed()) {
            return "⚪ Suppressed";
        }
        switch (record.getTier()) {
            case SEVERE:
                return "🔴 **Severe**";
            case VIOLATION:
                return "🟠 **Violation**";
            case ACCEPTABLE:
                return "🟡 Acceptable";
            default:
                return "🟢 OK";
        }
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();

        report.setMetadata(new ReportMetadata(
                timestamp,
                TOOL_VERSION,
                thresholds.getProfileName(),
                analysisResult.verdict().name()
        ));

        Summary summary = new Summary();
        summary.setFunctionsAnalyzed(analysisResult.records().size());
        summary.setSuppressed((int) analysisResult.records().stream().filter(FunctionRecord::isSuppressed).count());
        summary.setTotalCognitive(analysisResult.totalCognitive());
        summary.setViolations(analysisResult.violationCount());
        summary.setFailures(analysisResult.failures().size());
        summary.setTierCounts(analysisResult.records().stream()
                .collect(Collectors.groupingBy(FunctionRecord::getTier, Collectors.counting())));
        report.setSummary(summary);

        report.setFunctions(analysisResult.records().stream()
                .map(ComplexityReport::toFunctionEntry)
                .collect(Collectors.toList()));
        report.setFiles(analysisResult.fileSummaries());
        report.setFailures(analysisResult.failures().stream()
                .map(f -> new FailureEntry(f.identifier(), locationText(f.location()), f.type().name(), f.reason()))
                .collect(Collectors.toList()));
        report.setDiagnostics(analysisResult.diagnostics().stream()
                .map(d -> new DiagnosticEntry(d.severity().name(), d.code(), d.message(), locationText(d.location())))
                .collect(Collectors.toList()));

        return report;
    }

    private static FunctionEntry toFunctionEntry(FunctionRecord record) {
        FunctionEntry entry = new FunctionEntry();
        entry.setIdentifier(record.getIdentifier());
        entry.setLocation(locationText(record.getLocation()));
        entry.setLanguage(record.getLanguage());
        entry.setCognitive(record.getCognitiveScore());
        entry.setCyclomatic(record.getCyclomaticScore());
        entry.setMaxNesting(record.getMaxNesting());
        entry.setCognitiveTier(record.getCognitiveTier().name());
        entry.setCyclomaticTier(record.getCyclomaticTier().name());
        entry.setTier(record.getTier().name());
        entry.setSuppressed(record.isSuppressed());
        entry.setRecursive(record.isRecursive());
        entry.setParent(record.getParent());
        return entry;
    }

    private static String locationText(SourceLocation location) {
        return location == null || location.isUnknown() ? null : location.toString();
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private Summary summary;
        private List<FunctionEntry> functions;
        private List<FileSummary> files;
        private List<FailureEntry> failures;
        private List<DiagnosticEntry> diagnostics;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String toolVersion;
        private String profile;
        private String verdict;
    }

    @lombok.Data
    private static class Summary {
        private int functionsAnalyzed;
        private int suppressed;
        private int totalCognitive;
        private long violations;
        private int failures;
        private Map<Tier, Long> tierCounts;
    }

    @lombok.Data
    private static class FunctionEntry {
        private String identifier;
        private String location;
        private String language;
        private int cognitive;
        private int cyclomatic;
        private int maxNesting;
        private String cognitiveTier;
        private String cyclomaticTier;
        private String tier;
        private boolean suppressed;
        private boolean recursive;
        private String parent;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class FailureEntry {
        private String identifier;
        private String location;
        private String type;
        private String reason;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class DiagnosticEntry {
        private String severity;
        private String code;
        private String message;
        private String location;
    }
}
