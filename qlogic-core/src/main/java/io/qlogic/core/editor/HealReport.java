package io.qlogic.core.editor;

import java.util.List;

/// Outcome of {@link TreeEditor#healDanglingReferences()}.
///
/// @param relinkedNodeIds nodes whose local reference was rewritten to a persisted id
/// @param danglingNodeIds nodes that still reference no known question; kept but not shown
/// @param reattachedQuestionLocalIds questions that had no node and were appended at the root
public record HealReport(
        List<String> relinkedNodeIds,
        List<String> danglingNodeIds,
        List<String> reattachedQuestionLocalIds) {

    public HealReport {
        relinkedNodeIds = List.copyOf(relinkedNodeIds);
        danglingNodeIds = List.copyOf(danglingNodeIds);
        reattachedQuestionLocalIds = List.copyOf(reattachedQuestionLocalIds);
    }

    /// Returns whether healing changed nothing and found nothing wrong.
    ///
    /// @return true if all three lists are empty
    public boolean isClean() {
        return relinkedNodeIds.isEmpty()
                && danglingNodeIds.isEmpty()
                && reattachedQuestionLocalIds.isEmpty();
    }

    /// Returns whether healing changed the tree.
    ///
    /// @return true if a node was relinked or a question reattached
    public boolean changedTree() {
        return !relinkedNodeIds.isEmpty() || !reattachedQuestionLocalIds.isEmpty();
    }
}
