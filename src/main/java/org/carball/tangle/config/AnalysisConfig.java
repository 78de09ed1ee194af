package org.carball.tangle.config;

import lombok.Data;
import org.carball.tangle.compensation.CompensationRuleSet;
import org.carball.tangle.exception.ConfigurationException;

import java.nio.file.Path;

@Data
public class AnalysisConfig {
    private Path inputFile;
    private String outputFile;
    private OutputFormat outputFormat = OutputFormat.JSON;
    private boolean verbose;
    private ComplexityThresholds thresholds = ComplexityThresholds.defaults();
    private CompensationRuleSet compensationRules = CompensationRuleSet.defaults();
    private NestedFunctionMode nestedFunctions = NestedFunctionMode.INDEPENDENT;
    private int parallelism = 1;

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public void validate() {
        thresholds.validate();
        if (parallelism < 1) {
            throw new ConfigurationException("Parallelism must be at least 1, got " + parallelism);
        }
    }
}
