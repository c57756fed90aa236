package io.qlogic.core.logic;

import java.util.List;
import java.util.Objects;

/// Logic tree node whose nested nodes are shown only when its condition holds.
///
/// Nested nodes always sit exactly one level deeper than the conditional.
///
/// @param nodeId stable node id, not null
/// @param condition predicate over a single answer, not null
/// @param nestedItems ordered nested nodes, not null
/// @param depth nesting level
/// @param endFlow if true and the condition holds, evaluation ends after the nested nodes
/// @param stopFlow same effect as `endFlow`, kept as a separate authoring flag
public record ConditionalNode(
        String nodeId,
        Condition condition,
        List<LogicNode> nestedItems,
        int depth,
        boolean endFlow,
        boolean stopFlow)
        implements LogicNode {

    public ConditionalNode {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        nestedItems = nestedItems != null ? List.copyOf(nestedItems) : List.of();
    }

    /// Creates a conditional without flow flags.
    ///
    /// @param nodeId stable node id, not null
    /// @param condition predicate, not null
    /// @param nestedItems nested nodes, not null
    /// @param depth nesting level
    /// @return new node, never null
    public static ConditionalNode of(
            String nodeId, Condition condition, List<LogicNode> nestedItems, int depth) {
        return new ConditionalNode(nodeId, condition, nestedItems, depth, false, false);
    }

    /// Returns whether a true condition ends evaluation after this subtree.
    ///
    /// @return true if either flow flag is set
    public boolean stopsFlow() {
        return endFlow || stopFlow;
    }

    @Override
    public ConditionalNode withDepth(int depth) {
        List<LogicNode> nested = nestedItems.stream().map(n -> n.withDepth(depth + 1)).toList();
        return new ConditionalNode(nodeId, condition, nested, depth, endFlow, stopFlow);
    }

    public ConditionalNode withNestedItems(List<LogicNode> nestedItems) {
        return new ConditionalNode(nodeId, condition, nestedItems, depth, endFlow, stopFlow);
    }

    public ConditionalNode withCondition(Condition condition) {
        return new ConditionalNode(nodeId, condition, nestedItems, depth, endFlow, stopFlow);
    }

    public ConditionalNode withFlowFlags(boolean endFlow, boolean stopFlow) {
        return new ConditionalNode(nodeId, condition, nestedItems, depth, endFlow, stopFlow);
    }
}
