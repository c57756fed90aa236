package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionOperator;
import io.qlogic.core.logic.ConditionalNode;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.QuestionNode;
import io.qlogic.core.question.QuestionRef;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes `LogicNode` variants based on the `type` discriminator field.
///
/// Nested items and conditions are read manually from the `JsonNode` tree. Missing flags
/// default to false, a missing operator to `equals` and a missing depth to 0; depths are
/// normalized by the tree deserializer.
///
/// @see LogicNodeSerializer for the inverse operation
class LogicNodeDeserializer extends StdDeserializer<LogicNode> {

    @Serial private static final long serialVersionUID = -4766930190383417405L;

    LogicNodeDeserializer() {
        super(LogicNode.class);
    }

    @Override
    public LogicNode deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return readNode(root);
    }

    static LogicNode readNode(JsonNode node) throws IOException {
        String id = requiredText(node, "id");
        String type = requiredText(node, "type");
        int depth = node.path("depth").asInt(0);

        return switch (type) {
            case "question" -> new QuestionNode(id, readRef(node), depth, flag(node, "stopFlow"));
            case "conditional" -> {
                JsonNode conditional = node.get("conditional");
                if (conditional == null || !conditional.isObject()) {
                    throw new IOException("Conditional node " + id + " has no conditional body");
                }
                List<LogicNode> nested = new ArrayList<>();
                for (JsonNode item : conditional.path("nestedItems")) {
                    nested.add(readNode(item));
                }
                yield new ConditionalNode(
                        id,
                        readCondition(conditional),
                        nested,
                        depth,
                        flag(conditional, "endFlow"),
                        flag(conditional, "stopFlow"));
            }
            default -> throw new IOException("Unknown LogicNode type: " + type);
        };
    }

    private static QuestionRef readRef(JsonNode node) throws IOException {
        JsonNode questionId = node.get("questionId");
        if (questionId != null && !questionId.isNull()) {
            return new QuestionRef.Resolved(questionId.asText());
        }
        JsonNode localId = node.get("localId");
        if (localId != null && !localId.isNull()) {
            return new QuestionRef.Unresolved(localId.asText());
        }
        throw new IOException("Question node " + node.path("id").asText() + " has no question");
    }

    private static Condition readCondition(JsonNode conditional) throws IOException {
        JsonNode operator = conditional.get("operator");
        ConditionOperator parsed;
        try {
            parsed =
                    ConditionOperator.fromWire(
                            operator == null || operator.isNull() ? null : operator.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        return new Condition(
                text(conditional, "ifIdentifier"), parsed, text(conditional, "value"));
    }

    private static String requiredText(JsonNode node, String field) throws IOException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Logic node is missing '" + field + "'");
        }
        return value.asText();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static boolean flag(JsonNode node, String field) {
        return node.path(field).asBoolean(false);
    }
}
