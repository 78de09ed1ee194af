package org.carball.tangle.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.tangle.exception.UnmappedConstructException;
import org.carball.tangle.model.analysis.FailureType;
import org.carball.tangle.model.analysis.UnitFailure;
import org.carball.tangle.model.construct.ConstructKind;
import org.carball.tangle.model.construct.ConstructNode;
import org.carball.tangle.model.construct.SourceLocation;
import org.carball.tangle.model.expression.LogicalExpression;
import org.carball.tangle.model.expression.LogicalOperator;
import org.carball.tangle.model.expression.Operand;
import org.carball.tangle.model.unit.FunctionUnit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads function units from the JSON interchange format produced by language
 * front ends:
 *
 * <pre>
 * {"units": [{"id": "Parser.parse", "language": "java",
 *             "location": {"file": "Parser.java", "line": 10},
 *             "body": [{"kind": "If", "line": 11,
 *                       "condition": {"operands": ["a", "b"], "operators": ["&amp;&amp;"]},
 *                       "children": [...]}]}]}
 * </pre>
 *
 * A unit that cannot be read is reported as a {@link UnitFailure}; the other
 * units of the document are still returned.
 */
@Slf4j
public class ConstructTreeReader {

    private final ObjectMapper objectMapper;

    public ConstructTreeReader() {
        this(new ObjectMapper());
    }

    public ConstructTreeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedBatch read(Path file) throws IOException {
        log.info("Reading construct trees from {}", file);
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public ParsedBatch read(InputStream in) throws IOException {
        return read(objectMapper.readTree(in));
    }

    public ParsedBatch read(String json) throws IOException {
        return read(objectMapper.readTree(json));
    }

    private ParsedBatch read(JsonNode root) throws IOException {
        JsonNode unitsNode = root != null && root.isArray() ? root : root == null ? null : root.get("units");
        if (unitsNode == null || !unitsNode.isArray()) {
            throw new IOException("Expected a top-level 'units' array");
        }

        List<FunctionUnit> units = new ArrayList<>();
        List<UnitFailure> failures = new ArrayList<>();
        int position = 0;
        for (JsonNode unitNode : unitsNode) {
            position++;
            String identifier = text(unitNode, "id");
            SourceLocation location = location(unitNode.get("location"), "");
            try {
                if (identifier == null || identifier.isBlank()) {
                    throw new IllegalArgumentException("Unit #" + position + " has no 'id'");
                }
                units.add(readUnit(unitNode, identifier, location));
            } catch (UnmappedConstructException e) {
                log.warn("Skipping unit {}: {}", identifier, e.getMessage());
                failures.add(new UnitFailure(identifier, location, FailureType.UNMAPPED_CONSTRUCT, e.getMessage()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping unit {}: {}", identifier != null ? identifier : "#" + position, e.getMessage());
                failures.add(new UnitFailure(identifier, location, FailureType.INVALID_UNIT, e.getMessage()));
            }
        }

        log.info("Read {} unit(s), {} unreadable", units.size(), failures.size());
        return new ParsedBatch(units, failures);
    }

    private FunctionUnit readUnit(JsonNode unitNode, String identifier, SourceLocation location) {
        String language = text(unitNode, "language");
        return FunctionUnit.builder()
                .identifier(identifier)
                .language(language != null ? language : "*")
                .location(location)
                .body(readNodes(unitNode.get("body"), location.file()))
                .build();
    }

    private List<ConstructNode> readNodes(JsonNode array, String file) {
        List<ConstructNode> nodes = new ArrayList<>();
        if (array == null || array.isNull()) {
            return nodes;
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("Expected an array of constructs, got " + array.getNodeType());
        }
        for (JsonNode element : array) {
            nodes.add(readNode(element, file));
        }
        return nodes;
    }

    private ConstructNode readNode(JsonNode json, String file) {
        SourceLocation location = location(json, file);
        ConstructKind kind = ConstructKind.fromName(text(json, "kind"), location);

        ConstructNode.ConstructNodeBuilder builder = ConstructNode.builder()
                .kind(kind)
                .location(location)
                .caseLabels(json.path("caseLabels").asInt(0))
                .operators(json.path("operators").asInt(0))
                .name(text(json, "name"))
                .target(text(json, "target"))
                .children(readNodes(json.get("children"), location.file()));

        JsonNode hints = json.get("hints");
        if (hints != null && hints.isArray()) {
            hints.forEach(hint -> builder.hint(hint.asText()));
        }
        JsonNode condition = json.get("condition");
        if (condition != null && !condition.isNull()) {
            builder.condition(readExpression(condition));
        }
        return builder.build();
    }

    private LogicalExpression readExpression(JsonNode json) {
        // A bare string is a single-operand condition
        if (json.isTextual()) {
            return LogicalExpression.single(json.asText());
        }

        List<Operand> operands = new ArrayList<>();
        for (JsonNode operand : json.path("operands")) {
            operands.add(readOperand(operand));
        }
        List<LogicalOperator> operators = new ArrayList<>();
        for (JsonNode operator : json.path("operators")) {
            operators.add(LogicalOperator.fromToken(operator.asText()));
        }
        return new LogicalExpression(operands, operators);
    }

    private Operand readOperand(JsonNode json) {
        if (!json.isObject()) {
            return Operand.leaf(json.asText());
        }
        boolean negated = json.path("negated").asBoolean(false);
        JsonNode group = json.get("group");
        if (group != null && !group.isNull()) {
            return new Operand(null, readExpression(group), negated);
        }
        return new Operand(text(json, "text"), null, negated);
    }

    private static SourceLocation location(JsonNode json, String defaultFile) {
        if (json == null || json.isNull()) {
            return defaultFile.isEmpty() ? SourceLocation.unknown() : SourceLocation.of(defaultFile, 0);
        }
        String file = text(json, "file");
        return new SourceLocation(file != null ? file : defaultFile,
                json.path("line").asInt(0), json.path("column").asInt(0));
    }

    private static String text(JsonNode json, String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
