package org.carball.tangle.model.analysis;

import lombok.Builder;
import lombok.Value;
import org.carball.tangle.model.construct.SourceLocation;

/**
 * Per-function line of the final report.
 */
@Value
@Builder
public class FunctionRecord {
    String identifier;
    SourceLocation location;
    String language;
    int cognitiveScore;
    int cyclomaticScore;
    int maxNesting;
    Tier cognitiveTier;
    Tier cyclomaticTier;
    Tier tier;
    boolean suppressed;
    boolean recursive;
    String parent;
}
