package org.carball.tangle.parser;

import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.unit.FunctionUnit;

import java.util.List;

/**
 * Units read from one interchange document, plus the units that could not be
 * read and why.
 */
public record ParsedBatch(List<FunctionUnit> units, List<UnitFailure> failures) {

    public ParsedBatch {
        units = List.copyOf(units);
        failures = List.copyOf(failures);
    }

    public static ParsedBatch of(List<FunctionUnit> units) {
        return new ParsedBatch(units, List.of());
    }
}
