package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.qlogic.core.answer.AnswerValue;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes `AnswerValue` by its JSON shape rather than a discriminator.
///
/// - **`Text`**: JSON string
/// - **`Items`**: JSON array of entries
/// - **`Fields`**: JSON object of string fields
///
/// @implNote Package-private. Registered by {@link QlogicJacksonModule}.
/// @see AnswerValueDeserializer for the inverse operation
class AnswerValueSerializer extends StdSerializer<AnswerValue> {

    @Serial private static final long serialVersionUID = 1840046226950361427L;

    AnswerValueSerializer() {
        super(AnswerValue.class);
    }

    @Override
    public void serialize(AnswerValue value, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        if (value instanceof AnswerValue.Text text) {
            gen.writeString(text.value());
        } else if (value instanceof AnswerValue.Items items) {
            gen.writeStartArray();
            for (AnswerValue entry : items.entries()) {
                serialize(entry, gen, provider);
            }
            gen.writeEndArray();
        } else {
            Map<String, String> fields = ((AnswerValue.Fields) value).values();
            gen.writeStartObject();
            for (Map.Entry<String, String> field : fields.entrySet()) {
                gen.writeStringField(field.getKey(), field.getValue());
            }
            gen.writeEndObject();
        }
    }
}
