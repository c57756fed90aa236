package io.qlogic.core.session;

import io.qlogic.core.logic.Condition;
import java.util.List;
import java.util.Objects;

/// Sealed interface for the steps of a {@link GroupFlow}.
///
/// ### Permitted Implementations
/// - {@link Group} - always includes a group
/// - {@link Branch} - includes a target group and nested steps when its condition holds
public sealed interface GroupStep permits GroupStep.Group, GroupStep.Branch {

    /// Step including one group.
    ///
    /// @param groupId group to include, not null
    record Group(String groupId) implements GroupStep {
        public Group {
            Objects.requireNonNull(groupId, "groupId must not be null");
        }
    }

    /// Step that routes to more groups when a condition on the answers holds.
    ///
    /// @param condition predicate over the session answers, not null
    /// @param targetGroupId group included when the condition holds, may be null
    /// @param nestedSteps steps processed when the condition holds, not null
    record Branch(Condition condition, String targetGroupId, List<GroupStep> nestedSteps)
            implements GroupStep {
        public Branch {
            Objects.requireNonNull(condition, "condition must not be null");
            nestedSteps = nestedSteps != null ? List.copyOf(nestedSteps) : List.of();
        }
    }
}
