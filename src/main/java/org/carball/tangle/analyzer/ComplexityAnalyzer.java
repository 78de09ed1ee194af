package org.carball.tangle.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.config.AnalysisConfig;
import org.carball.tangle.model.analysis.AnalysisResult;
import org.carball.tangle.model.analysis.FailureType;
import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.score.FunctionScore;
import org.carball.tangle.model.unit.FunctionUnit;
import org.carball.tangle.output.ReportAggregator;
import org.carball.tangle.parser.ParsedBatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of function units through the scoring pipeline.
 *
 * <p>A batch is processed in two phases. Every unit is resolved and added to
 * the call graph first; only then are units scored, sequentially or on a
 * fixed pool when {@code parallelism > 1}. A unit that fails is recorded as a
 * {@link UnitFailure} and the rest of the batch carries on.
 */
@Slf4j
public class ComplexityAnalyzer {

    /** Deepest construct tree accepted; deeper units are reported as invalid. */
    static final int MAX_CONSTRUCT_DEPTH = 1_000;

    private final AnalysisConfig config;
    private final LogicalRunDetector runDetector;
    private final ComplexityScorer scorer;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ComplexityAnalyzer(AnalysisConfig config) {
        config.validate();
        this.config = config;
        this.runDetector = new LogicalRunDetector();
        this.scorer = new ComplexityScorer(config.getCompensationRules(), config.getNestedFunctions());

        log.info("Initialized ComplexityAnalyzer: {} rule(s), nested functions {}, parallelism {}",
                config.getCompensationRules().size(), config.getNestedFunctions(), config.getParallelism());
        log.info("Using thresholds: {}", config.getThresholds().getConfigurationSummary());
    }

    public AnalysisResult analyze(List<FunctionUnit> units) {
        return analyze(ParsedBatch.of(units));
    }

    public AnalysisResult analyze(ParsedBatch batch) {
        log.info("Starting complexity analysis of {} unit(s)", batch.units().size());
        ReportAggregator aggregator = new ReportAggregator(config.getThresholds());
        batch.failures().forEach(aggregator::addFailure);

        // Phase 1: resolve and build the call graph over the whole batch
        List<FunctionUnit> resolved = resolveUnits(batch.units(), aggregator);
        CallGraph callGraph = CallGraph.build(resolved);
        Set<String> recursiveUnits = callGraph.findRecursiveUnits();
        aggregator.addDiagnostics(callGraph.getDiagnostics());
        if (!recursiveUnits.isEmpty()) {
            log.info("Found {} unit(s) on recursion cycles", recursiveUnits.size());
        }

        // Phase 2: score
        if (config.getParallelism() > 1 && resolved.size() > 1) {
            scoreInParallel(resolved, recursiveUnits, aggregator);
        } else {
            scoreSequentially(resolved, recursiveUnits, aggregator);
        }

        AnalysisResult result = aggregator.build();
        log.info("Analysis complete. {} function(s) scored, {} violation(s), verdict {}",
                result.records().size(), result.violationCount(), result.verdict());
        return result;
    }

    /**
     * Stops dispatching further units. Units already being scored finish;
     * the rest are reported as cancelled. A cancelled analyzer stays
     * cancelled.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private List<FunctionUnit> resolveUnits(List<FunctionUnit> units, ReportAggregator aggregator) {
        List<FunctionUnit> resolved = new ArrayList<>(units.size());
        for (FunctionUnit unit : units) {
            if (unit.getIdentifier() == null || unit.getIdentifier().isBlank()) {
                log.warn("Skipping unit at {}: missing identifier", unit.getLocation());
                aggregator.addFailure(new UnitFailure(unit.getIdentifier(), unit.getLocation(),
                        FailureType.INVALID_UNIT, "Missing unit identifier"));
                continue;
            }
            if (exceedsMaxDepth(unit)) {
                log.warn("Skipping unit {}: construct tree deeper than {} levels",
                        unit.getIdentifier(), MAX_CONSTRUCT_DEPTH);
                aggregator.addFailure(new UnitFailure(unit.getIdentifier(), unit.getLocation(),
                        FailureType.INVALID_UNIT,
                        "Construct tree is nested deeper than " + MAX_CONSTRUCT_DEPTH + " levels"));
                continue;
            }
            try {
                resolved.add(runDetector.resolve(unit));
            } catch (RuntimeException e) {
                log.warn("Skipping unit {}: {}", unit.getIdentifier(), e.getMessage());
                aggregator.addFailure(new UnitFailure(unit.getIdentifier(), unit.getLocation(),
                        FailureType.INVALID_UNIT, e.getMessage()));
            }
        }
        return resolved;
    }

    // Iterative: a tree too deep for the recursive passes must still be measured
    private static boolean exceedsMaxDepth(FunctionUnit unit) {
        Deque<ConstructNode> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        for (ConstructNode node : unit.getBody()) {
            nodes.push(node);
            depths.push(1);
        }
        while (!nodes.isEmpty()) {
            ConstructNode node = nodes.pop();
            int depth = depths.pop();
            if (depth > MAX_CONSTRUCT_DEPTH) {
                return true;
            }
            for (ConstructNode child : node.getChildren()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return false;
    }

    private void scoreSequentially(List<FunctionUnit> units, Set<String> recursiveUnits,
                                   ReportAggregator aggregator) {
        for (FunctionUnit unit : units) {
            if (cancelled.get()) {
                aggregator.addFailure(cancelledFailure(unit));
                continue;
            }
            scoreUnit(unit, recursiveUnits).applyTo(aggregator);
        }
    }

    private void scoreInParallel(List<FunctionUnit> units, Set<String> recursiveUnits,
                                 ReportAggregator aggregator) {
        AtomicInteger workerIds = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism(), runnable -> {
            Thread thread = new Thread(runnable, "tangle-scorer-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Future<Outcome>> futures = new ArrayList<>(units.size());
            for (FunctionUnit unit : units) {
                // A queued unit that has not started by the time of cancellation counts as undispatched
                futures.add(executor.submit(() -> cancelled.get()
                        ? Outcome.failed(cancelledFailure(unit))
                        : scoreUnit(unit, recursiveUnits)));
            }

            // Results are appended in submission order from this thread only
            for (int i = 0; i < futures.size(); i++) {
                FunctionUnit unit = units.get(i);
                try {
                    futures.get(i).get().applyTo(aggregator);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Scoring failed for {}: {}", unit.getIdentifier(), cause.getMessage());
                    aggregator.addFailure(new UnitFailure(unit.getIdentifier(), unit.getLocation(),
                            FailureType.SCORING_ERROR, cause.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for scores; cancelling the remaining units");
                    cancel();
                    for (int j = i; j < units.size(); j++) {
                        aggregator.addFailure(cancelledFailure(units.get(j)));
                    }
                    break;
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private Outcome scoreUnit(FunctionUnit unit, Set<String> recursiveUnits) {
        try {
            return Outcome.scored(scorer.score(unit, recursiveUnits));
        } catch (RuntimeException e) {
            log.warn("Scoring failed for {}: {}", unit.getIdentifier(), e.getMessage());
            return Outcome.failed(new UnitFailure(unit.getIdentifier(), unit.getLocation(),
                    FailureType.SCORING_ERROR, String.valueOf(e.getMessage())));
        }
    }

    private static UnitFailure cancelledFailure(FunctionUnit unit) {
        return new UnitFailure(unit.getIdentifier(), unit.getLocation(), FailureType.CANCELLED,
                "Analysis was cancelled before this unit was scored");
    }

    private static final class Outcome {
        private final List<FunctionScore> scores;
        private final UnitFailure failure;

        private Outcome(List<FunctionScore> scores, UnitFailure failure) {
            this.scores = scores;
            this.failure = failure;
        }

        static Outcome scored(List<FunctionScore> scores) {
            return new Outcome(scores, null);
        }

        static Outcome failed(UnitFailure failure) {
            return new Outcome(List.of(), failure);
        }

        void applyTo(ReportAggregator aggregator) {
            if (failure != null) {
                aggregator.addFailure(failure);
            } else {
                aggregator.addAll(scores);
            }
        }
    }
}
