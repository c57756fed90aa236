package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.LogicTreeCodec;
import java.util.Objects;

/// `LogicTreeCodec` backed by Jackson, producing the compact single-line form sent to
/// persistence with every structural save.
///
/// @implNote Thread-safe. Holds one cached mapper.
public final class JacksonLogicTreeCodec implements LogicTreeCodec {

    private final ObjectMapper mapper;

    public JacksonLogicTreeCodec() {
        this(LogicTreeSerializer.createMapper().disable(SerializationFeature.INDENT_OUTPUT));
    }

    /// Creates a codec using a caller-configured mapper.
    ///
    /// @param mapper mapper with {@link QlogicJacksonModule} registered, not null
    public JacksonLogicTreeCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String encode(LogicTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize logic tree: " + e.getMessage(), e);
        }
    }

    @Override
    public LogicTree decode(String serialized) {
        if (serialized == null || serialized.isBlank()) {
            return LogicTree.empty();
        }
        try {
            return mapper.readValue(serialized, LogicTree.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize logic tree: " + e.getMessage(), e);
        }
    }
}
