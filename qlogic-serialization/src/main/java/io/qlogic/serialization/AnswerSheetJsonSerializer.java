package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes an `AnswerSheet` as a flat JSON object keyed by question identifier.
///
/// @implNote Package-private. Registered by {@link QlogicJacksonModule}.
class AnswerSheetJsonSerializer extends StdSerializer<AnswerSheet> {

    @Serial private static final long serialVersionUID = -5139622402876524418L;

    private final AnswerValueSerializer valueSerializer = new AnswerValueSerializer();

    AnswerSheetJsonSerializer() {
        super(AnswerSheet.class);
    }

    @Override
    public void serialize(AnswerSheet sheet, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, AnswerValue> entry : sheet.answers().entrySet()) {
            gen.writeFieldName(entry.getKey());
            valueSerializer.serialize(entry.getValue(), gen, provider);
        }
        gen.writeEndObject();
    }
}
