package io.qlogic.core.logic;

/// Sealed interface for nodes of a logic tree.
///
/// ### Permitted Implementations
/// - {@link QuestionNode} - displays one question
/// - {@link ConditionalNode} - shows its nested nodes when its condition holds
///
/// @implNote Implementations are immutable records. Structural edits build new nodes.
///
/// @see LogicTree for the containing structure
public sealed interface LogicNode permits QuestionNode, ConditionalNode {

    /// Returns the node's stable id, unique within its tree.
    ///
    /// @return node id, never null
    String nodeId();

    /// Returns the nesting level, 0 for root nodes.
    ///
    /// @return depth between 0 and {@link LogicTree#MAX_DEPTH}
    int depth();

    /// Returns a copy placed at another nesting level.
    ///
    /// Conditionals re-depth their whole subtree.
    ///
    /// @param depth new nesting level
    /// @return node at the given depth, never null
    LogicNode withDepth(int depth);
}
