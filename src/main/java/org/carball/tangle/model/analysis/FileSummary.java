package org.carball.tangle.model.analysis;

import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class FileSummary {
    private final String file;
    private int functionCount = 0;
    private int suppressedCount = 0;
    private int totalCognitive = 0;
    private int maxCognitive = 0;
    private int totalCyclomatic = 0;
    private int maxCyclomatic = 0;
    private Map<Tier, Integer> tierCounts = new EnumMap<>(Tier.class);

    public FileSummary(String file) {
        this.file = file;
        for (Tier tier : Tier.values()) {
            tierCounts.put(tier, 0);
        }
    }

    public void addRecord(FunctionRecord record) {
        functionCount++;
        tierCounts.merge(record.getTier(), 1, Integer::sum);
        if (record.isSuppressed()) {
            suppressedCount++;
            return;
        }
        totalCognitive += record.getCognitiveScore();
        totalCyclomatic += record.getCyclomaticScore();
        maxCognitive = Math.max(maxCognitive, record.getCognitiveScore());
        maxCyclomatic = Math.max(maxCyclomatic, record.getCyclomaticScore());
    }

    public int getViolationCount() {
        return tierCounts.get(Tier.VIOLATION) + tierCounts.get(Tier.SEVERE);
    }

    public double getAverageCognitive() {
        int scored = functionCount - suppressedCount;
        return scored == 0 ? 0.0 : (double) totalCognitive / scored;
    }
}
