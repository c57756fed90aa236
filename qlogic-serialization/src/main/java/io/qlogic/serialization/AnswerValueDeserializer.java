package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.qlogic.core.answer.AnswerValue;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes `AnswerValue` from its JSON shape.
///
/// Arrays become `Items`, objects become `Fields`, everything else becomes `Text`
/// (`null` as empty text, numbers and booleans as their text form).
///
/// @see AnswerValueSerializer for the inverse operation
class AnswerValueDeserializer extends StdDeserializer<AnswerValue> {

    @Serial private static final long serialVersionUID = 6203998015240743310L;

    AnswerValueDeserializer() {
        super(AnswerValue.class);
    }

    @Override
    public AnswerValue deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readValue(mapper.readTree(p));
    }

    @Override
    public AnswerValue getNullValue(DeserializationContext ctx) {
        return AnswerValue.empty();
    }

    static AnswerValue readValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return AnswerValue.empty();
        }
        if (node.isArray()) {
            List<AnswerValue> entries = new ArrayList<>();
            node.forEach(entry -> entries.add(readValue(entry)));
            return AnswerValue.items(entries);
        }
        if (node.isObject()) {
            Map<String, String> fields = new LinkedHashMap<>();
            node.fields()
                    .forEachRemaining(
                            field ->
                                    fields.put(
                                            field.getKey(),
                                            field.getValue().isNull()
                                                    ? ""
                                                    : field.getValue().asText()));
            return AnswerValue.fields(fields);
        }
        return AnswerValue.text(node.asText());
    }
}
