package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/// Deserializes an `AnswerSheet` from a flat JSON object keyed by question identifier.
class AnswerSheetJsonDeserializer extends StdDeserializer<AnswerSheet> {

    @Serial private static final long serialVersionUID = 2979404385960106511L;

    AnswerSheetJsonDeserializer() {
        super(AnswerSheet.class);
    }

    @Override
    public AnswerSheet deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || root.isNull()) {
            return AnswerSheet.empty();
        }
        if (!root.isObject()) {
            throw JsonMappingException.from(p, "Answer sheet must be a JSON object");
        }
        Map<String, AnswerValue> answers = new LinkedHashMap<>();
        root.fields()
                .forEachRemaining(
                        field ->
                                answers.put(
                                        field.getKey(),
                                        AnswerValueDeserializer.readValue(field.getValue())));
        return AnswerSheet.of(answers);
    }
}
