package io.qlogic.core.logic;

import java.io.Serial;

/// Thrown when a structural edit would break the logic tree.
///
/// Signals a programming error rather than an authoring problem: an unknown node or path,
/// an index out of range, or nesting deeper than {@link LogicTree#MAX_DEPTH}.
public class TreeStructureException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1893056623040197718L;

    /// Creates exception with message.
    ///
    /// @param message description of the invalid edit
    public TreeStructureException(String message) {
        super(message);
    }
}
