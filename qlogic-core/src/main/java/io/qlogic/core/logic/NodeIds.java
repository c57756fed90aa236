package io.qlogic.core.logic;

import java.util.UUID;

/// Generates logic tree node ids.
public final class NodeIds {

    private NodeIds() {}

    /// Returns a new random node id.
    ///
    /// @return unique id prefixed with `node-`, never null
    public static String next() {
        return "node-" + UUID.randomUUID();
    }
}
