package io.qlogic.core.evaluation;

import io.qlogic.core.answer.AnswerSheet;
import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.logic.Condition;
import io.qlogic.core.logic.ConditionOperator;
import java.util.Objects;
import java.util.Optional;

/// Tests conditional predicates against session answers.
///
/// ### Rules
/// - no identifier: false
/// - `EQUALS` / `NOT_EQUALS`: exact text comparison; a missing or empty answer makes both
///   false. Repeatable answers match `EQUALS` when any instance matches and `NOT_EQUALS`
///   when none does. Structured answers never equal a text value.
/// - `COUNT_*`: number of non-empty entries (missing answer counts 0) compared with the
///   integer value; a non-integer value makes the condition false
///
/// @implNote Stateless and thread-safe.
public final class ConditionEvaluator {

    /// Tests a condition.
    ///
    /// @param condition predicate to test, not null
    /// @param answers current answers, not null
    /// @return true if the conditional's nested nodes should be shown
    public boolean test(Condition condition, AnswerSheet answers) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(answers, "answers must not be null");

        if (!condition.hasIdentifier()) {
            return false;
        }
        Optional<AnswerValue> answer = answers.lookup(condition.ifIdentifier());

        if (condition.operator().isCount()) {
            return testCount(condition, answer.map(AnswerValue::nonEmptyCount).orElse(0));
        }
        if (answer.isEmpty() || answer.get().isEmpty()) {
            return false;
        }
        boolean matches = matchesAny(answer.get(), condition.value());
        ConditionOperator operator = condition.operator();
        return switch (operator) {
            case EQUALS -> matches;
            case NOT_EQUALS -> !matches;
            default -> throw new IllegalStateException("Unexpected operator " + operator);
        };
    }

    private static boolean testCount(Condition condition, int count) {
        int threshold;
        try {
            threshold = Integer.parseInt(condition.value().trim());
        } catch (NumberFormatException e) {
            return false;
        }
        ConditionOperator operator = condition.operator();
        return switch (operator) {
            case COUNT_GREATER_THAN -> count > threshold;
            case COUNT_EQUALS -> count == threshold;
            case COUNT_LESS_THAN -> count < threshold;
            default -> throw new IllegalStateException("Unexpected operator " + operator);
        };
    }

    private static boolean matchesAny(AnswerValue answer, String expected) {
        if (answer instanceof AnswerValue.Items items) {
            return items.entries().stream().anyMatch(e -> matchesAny(e, expected));
        }
        return answer.scalar().map(expected::equals).orElse(false);
    }
}
