package io.qlogic.core.session;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.evaluation.ConditionEvaluator;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Ordered routing of the question groups of a session.
///
/// Steps are processed in order. A group step adds its group; a branch whose condition
/// holds adds its target group, then processes its nested steps. Each group is listed once,
/// at its first position.
///
/// @param steps ordered steps, not null
public record GroupFlow(List<GroupStep> steps) {

    public GroupFlow {
        steps = List.copyOf(Objects.requireNonNull(steps, "steps must not be null"));
    }

    /// Creates a flow visiting groups in a fixed order.
    ///
    /// @param groupIds groups in visiting order, not null
    /// @return flow of plain group steps, never null
    public static GroupFlow sequential(List<String> groupIds) {
        List<GroupStep> steps = new ArrayList<>();
        groupIds.forEach(id -> steps.add(new GroupStep.Group(id)));
        return new GroupFlow(steps);
    }

    /// Returns the groups to visit for the current answers.
    ///
    /// @param answers current session answers, not null
    /// @param evaluator predicate evaluator for branch conditions, not null
    /// @return group ids in visiting order, never null
    public List<String> orderedGroupIds(AnswerSheet answers, ConditionEvaluator evaluator) {
        Set<String> ordered = new LinkedHashSet<>();
        process(steps, answers, evaluator, ordered);
        return List.copyOf(ordered);
    }

    private static void process(
            List<GroupStep> steps,
            AnswerSheet answers,
            ConditionEvaluator evaluator,
            Set<String> ordered) {
        for (GroupStep step : steps) {
            if (step instanceof GroupStep.Group group) {
                ordered.add(group.groupId());
            } else {
                GroupStep.Branch branch = (GroupStep.Branch) step;
                if (!evaluator.test(branch.condition(), answers)) {
                    continue;
                }
                if (branch.targetGroupId() != null && !branch.targetGroupId().isBlank()) {
                    ordered.add(branch.targetGroupId());
                }
                process(branch.nestedSteps(), answers, evaluator, ordered);
            }
        }
    }
}
