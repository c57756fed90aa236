package io.qlogic.core.logic;

import io.qlogic.core.question.QuestionRef;
import java.util.Objects;

/// Logic tree node displaying one question.
///
/// @param nodeId stable node id, not null
/// @param ref reference to the displayed question, not null
/// @param depth nesting level
/// @param stopFlow if true, evaluation ends after this question is shown
public record QuestionNode(String nodeId, QuestionRef ref, int depth, boolean stopFlow)
        implements LogicNode {

    public QuestionNode {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(ref, "ref must not be null");
    }

    /// Creates a node that does not stop the flow.
    ///
    /// @param nodeId stable node id, not null
    /// @param ref reference to the displayed question, not null
    /// @param depth nesting level
    /// @return new node, never null
    public static QuestionNode of(String nodeId, QuestionRef ref, int depth) {
        return new QuestionNode(nodeId, ref, depth, false);
    }

    @Override
    public QuestionNode withDepth(int depth) {
        return new QuestionNode(nodeId, ref, depth, stopFlow);
    }

    public QuestionNode withRef(QuestionRef ref) {
        return new QuestionNode(nodeId, ref, depth, stopFlow);
    }

    public QuestionNode withStopFlow(boolean stopFlow) {
        return new QuestionNode(nodeId, ref, depth, stopFlow);
    }
}
