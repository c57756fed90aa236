package io.qlogic.core.repeatable;

import io.qlogic.core.logic.FlatNode;
import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.question.QuestionCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Groups consecutive sibling repeatable questions into repeatable sets.
///
/// A set is a maximal run of repeatable questions that share a parent list and depth and
/// occupy adjacent positions in that list. A question whose `repeatableGroupId` is set and
/// differs from the run's id starts a new set; questions without an id join the run.
///
/// ### Example
/// ```
/// [x*, y*, z, w*]   ->  {start 0, [x, y]}, {start 3, [w]}
/// ```
///
/// @implNote Stateless and thread-safe.
public final class RepeatableSetResolver {

    /// Resolves sets over a flattened question list.
    ///
    /// @param questions questions in depth-first order, not null
    /// @return sets in list order, `startIndex` relative to `questions`, never null
    public List<RepeatableSet> resolveSets(List<FlatQuestion> questions) {
        Objects.requireNonNull(questions, "questions must not be null");

        List<RepeatableSet> sets = new ArrayList<>();
        List<String> run = new ArrayList<>();
        int runStart = -1;
        String runGroupId = null;
        FlatQuestion previous = null;

        for (int i = 0; i < questions.size(); i++) {
            FlatQuestion current = questions.get(i);
            if (!current.question().isRepeatable()) {
                closeRun(sets, runStart, run);
                previous = null;
                continue;
            }
            String groupId = current.question().getRepeatableGroupId();
            boolean sameLineage =
                    runGroupId == null || groupId == null || runGroupId.equals(groupId);
            boolean continues =
                    previous != null && isAdjacentSibling(previous, current) && sameLineage;
            if (!continues) {
                closeRun(sets, runStart, run);
                runStart = i;
                runGroupId = null;
            }
            if (runGroupId == null) {
                runGroupId = groupId;
            }
            run.add(current.question().getLocalId());
            previous = current;
        }
        closeRun(sets, runStart, run);
        return List.copyOf(sets);
    }

    /// Resolves sets over every question of a tree, ignoring conditions.
    ///
    /// Dangling references are left out, so `startIndex` is relative to the resolved list.
    ///
    /// @param tree logic tree, not null
    /// @param catalog questions of the group, not null
    /// @return sets in depth-first order, never null
    public List<RepeatableSet> resolveSets(LogicTree tree, QuestionCatalog catalog) {
        List<FlatQuestion> flat = new ArrayList<>();
        for (FlatNode node : tree.flatten()) {
            catalog.resolve(node.node().ref())
                    .ifPresent(
                            q ->
                                    flat.add(
                                            new FlatQuestion(
                                                    q,
                                                    node.depth(),
                                                    node.parentPath(),
                                                    node.siblingIndex())));
        }
        return resolveSets(flat);
    }

    private static boolean isAdjacentSibling(FlatQuestion previous, FlatQuestion current) {
        return previous.depth() == current.depth()
                && previous.parentPath().equals(current.parentPath())
                && current.siblingIndex() == previous.siblingIndex() + 1;
    }

    private static void closeRun(List<RepeatableSet> sets, int start, List<String> run) {
        if (!run.isEmpty()) {
            sets.add(new RepeatableSet(start, run));
            run.clear();
        }
    }
}
