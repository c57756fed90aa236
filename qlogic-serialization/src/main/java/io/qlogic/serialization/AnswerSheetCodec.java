package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts answers to and from the string-valued form kept by answer storage back ends.
///
/// Scalar answers are stored as their plain text. Repeatable and composite answers are
/// stored as JSON, so a stored value starting with `[` or `{` is parsed back into
/// `Items` or `Fields`. A value that looks like JSON but does not parse is kept as text.
///
/// The stored form carries no type marker, so a free-text answer that is itself valid JSON
/// (for example `["a","b"]`) comes back as `Items` or `Fields`, not as the text it was.
/// Callers that need free text to round-trip exactly must keep such values elsewhere.
///
/// ### Usage
/// {@snippet :
/// AnswerSheetCodec codec = new AnswerSheetCodec();
/// Map<String, String> row = codec.encode(sheet);
/// AnswerSheet restored = codec.decode(row);
/// }
///
/// @implNote Thread-safe. Holds one cached mapper.
public final class AnswerSheetCodec {

    private static final Logger logger = Logger.getLogger(AnswerSheetCodec.class.getName());

    private final ObjectMapper mapper;

    public AnswerSheetCodec() {
        this.mapper =
                LogicTreeSerializer.createMapper().disable(SerializationFeature.INDENT_OUTPUT);
    }

    /// Encodes one answer.
    ///
    /// @param value answer, not null
    /// @return plain text for `Text`, compact JSON otherwise, never null
    /// @throws IllegalArgumentException if serialization fails
    public String encodeValue(AnswerValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof AnswerValue.Text text) {
            return text.value();
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize answer: " + e.getMessage(), e);
        }
    }

    /// Decodes one stored answer.
    ///
    /// @param stored stored string, may be null
    /// @return decoded answer, empty text for null, never null
    public AnswerValue decodeValue(String stored) {
        if (stored == null) {
            return AnswerValue.empty();
        }
        String trimmed = stored.trim();
        if (!trimmed.startsWith("[") && !trimmed.startsWith("{")) {
            return AnswerValue.text(stored);
        }
        try {
            return mapper.readValue(trimmed, AnswerValue.class);
        } catch (JsonProcessingException e) {
            logger.fine("Stored answer is not JSON, keeping it as text: " + e.getMessage());
            return AnswerValue.text(stored);
        }
    }

    /// Encodes every answer of a sheet.
    ///
    /// @param sheet answers, not null
    /// @return identifier to stored string, in identifier order, never null
    public Map<String, String> encode(AnswerSheet sheet) {
        Objects.requireNonNull(sheet, "sheet must not be null");
        Map<String, String> encoded = new LinkedHashMap<>();
        sheet.answers().forEach((identifier, value) -> encoded.put(identifier, encodeValue(value)));
        return encoded;
    }

    /// Decodes a stored row of answers.
    ///
    /// @param stored identifier to stored string, not null
    /// @return answer sheet, never null
    public AnswerSheet decode(Map<String, String> stored) {
        Objects.requireNonNull(stored, "stored must not be null");
        Map<String, AnswerValue> answers = new LinkedHashMap<>();
        stored.forEach((identifier, value) -> answers.put(identifier, decodeValue(value)));
        return AnswerSheet.of(answers);
    }
}
