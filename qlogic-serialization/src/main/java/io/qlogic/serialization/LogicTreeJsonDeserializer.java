package io.qlogic.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.qlogic.core.logic.LogicNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.TreePath;
import io.qlogic.core.logic.TreeStructureException;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

/// Deserializes a `LogicTree` from a JSON array of root nodes.
///
/// Depths are recomputed from the nesting, so trees written without or with stale depth
/// values load correctly. Trees nested deeper than `LogicTree.MAX_DEPTH` or repeating a
/// node id are rejected.
///
/// @see LogicTreeJsonSerializer for the inverse operation
class LogicTreeJsonDeserializer extends StdDeserializer<LogicTree> {

    @Serial private static final long serialVersionUID = -2212868370338466201L;

    LogicTreeJsonDeserializer() {
        super(LogicTree.class);
    }

    @Override
    public LogicTree deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        if (root == null || root.isNull()) {
            return LogicTree.empty();
        }
        if (!root.isArray()) {
            throw JsonMappingException.from(p, "Logic tree must be a JSON array");
        }
        List<LogicNode> roots = new ArrayList<>();
        for (JsonNode node : root) {
            roots.add(LogicNodeDeserializer.readNode(node));
        }
        try {
            LogicTree tree = LogicTree.empty().replaceListAt(TreePath.root(), roots);
            tree.validate();
            return tree;
        } catch (TreeStructureException e) {
            throw JsonMappingException.from(p, "Invalid logic tree: " + e.getMessage(), e);
        }
    }
}
