package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionalNode;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.QuestionNode;
import io.qlogic.core.question.QuestionRef;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `LogicNode` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`QuestionNode`**: `{"id":"...","type":"question","depth":N,"questionId":"...",
///   "stopFlow":false}`, with `"localId"` instead of `"questionId"` while the question is
///   not persisted
/// - **`ConditionalNode`**: `{"id":"...","type":"conditional","depth":N,"conditional":
///   {"ifIdentifier":"...","operator":"equals","value":"...","nestedItems":[...],
///   "endFlow":false,"stopFlow":false}}`
///
/// @implNote Package-private. Registered by {@link QlogicJacksonModule}.
/// @see LogicNodeDeserializer for the inverse operation
class LogicNodeSerializer extends StdSerializer<LogicNode> {

    @Serial private static final long serialVersionUID = 3329075061735214117L;

    LogicNodeSerializer() {
        super(LogicNode.class);
    }

    @Override
    public void serialize(LogicNode node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", node.nodeId());

        if (node instanceof QuestionNode question) {
            gen.writeStringField("type", "question");
            gen.writeNumberField("depth", question.depth());
            if (question.ref() instanceof QuestionRef.Resolved resolved) {
                gen.writeStringField("questionId", resolved.persistedId());
            } else if (question.ref() instanceof QuestionRef.Unresolved unresolved) {
                gen.writeStringField("localId", unresolved.localId());
            }
            gen.writeBooleanField("stopFlow", question.stopFlow());
        } else {
            ConditionalNode conditional = (ConditionalNode) node;
            Condition condition = conditional.condition();
            gen.writeStringField("type", "conditional");
            gen.writeNumberField("depth", conditional.depth());
            gen.writeObjectFieldStart("conditional");
            gen.writeStringField("ifIdentifier", condition.ifIdentifier());
            gen.writeStringField("operator", condition.operator().wireName());
            gen.writeStringField("value", condition.value());
            gen.writeArrayFieldStart("nestedItems");
            for (LogicNode nested : conditional.nestedItems()) {
                serialize(nested, gen, provider);
            }
            gen.writeEndArray();
            gen.writeBooleanField("endFlow", conditional.endFlow());
            gen.writeBooleanField("stopFlow", conditional.stopFlow());
            gen.writeEndObject();
        }

        gen.writeEndObject();
    }
}
