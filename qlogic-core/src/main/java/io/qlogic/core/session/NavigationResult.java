package io.qlogic.core.session;

import io.qlogic.core.evaluation.FlowEvaluation;
import java.util.List;
import java.util.Objects;

/// Result of {@link QuestionnaireSession#next()} or {@link QuestionnaireSession#previous()}.
///
/// @param outcome what happened, not null
/// @param groupId group shown after navigation, not null
/// @param missingRequired identifiers that blocked navigation, empty unless BLOCKED
/// @param evaluation evaluation of the page shown after navigation, not null
public record NavigationResult(
        NavigationOutcome outcome,
        String groupId,
        List<String> missingRequired,
        FlowEvaluation evaluation) {

    public NavigationResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        missingRequired = List.copyOf(missingRequired);
    }

    public boolean isBlocked() {
        return outcome == NavigationOutcome.BLOCKED;
    }
}
