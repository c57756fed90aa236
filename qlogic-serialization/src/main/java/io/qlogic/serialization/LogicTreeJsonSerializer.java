package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import java.io.IOException;
import java.io.Serial;

/// Serializes a `LogicTree` as a JSON array of its root nodes.
///
/// @implNote Package-private. Registered by {@link QlogicJacksonModule}.
/// @see LogicTreeJsonDeserializer for the inverse operation
class LogicTreeJsonSerializer extends StdSerializer<LogicTree> {

    @Serial private static final long serialVersionUID = 7516350962236064082L;

    private final LogicNodeSerializer nodeSerializer = new LogicNodeSerializer();

    LogicTreeJsonSerializer() {
        super(LogicTree.class);
    }

    @Override
    public void serialize(LogicTree tree, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartArray();
        for (LogicNode root : tree.roots()) {
            nodeSerializer.serialize(root, gen, provider);
        }
        gen.writeEndArray();
    }
}
