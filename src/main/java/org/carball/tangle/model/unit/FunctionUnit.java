package org.carball.tangle.model.unit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.SourceLocation;

import java.util.List;

/**
 * The scoring unit: one function or method with its normalized body.
 */
@Value
@Builder(toBuilder = true)
public class FunctionUnit {

    String identifier;

    @Builder.Default
    String language = "*";

    @Builder.Default
    SourceLocation location = SourceLocation.unknown();

    @Singular("node")
    List<ConstructNode> body;

    public static FunctionUnit of(String identifier, ConstructNode... body) {
        return FunctionUnit.builder().identifier(identifier).body(List.of(body)).build();
    }

    public boolean isEmpty() {
        return body.isEmpty();
    }
}
