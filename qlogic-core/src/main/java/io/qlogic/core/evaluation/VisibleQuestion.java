package io.qlogic.core.evaluation;

import io.qlogic.core.answer.AnswerValue;
import io.qlogic.core.question.Question;
import java.util.Objects;
import java.util.Optional;

/// Question the flow evaluator decided to show.
///
/// Members of a repeatable set appear once per instance, each carrying that instance's
/// answer and its {@link RepeatSlot}.
///
/// @param question the shown question, not null
/// @param depth nesting level of its node
/// @param answer current answer of this question or instance, empty if unanswered, not null
/// @param slot repeatable position, null for questions outside a repeatable set
public record VisibleQuestion(Question question, int depth, AnswerValue answer, RepeatSlot slot) {

    public VisibleQuestion {
        Objects.requireNonNull(question, "question must not be null");
        answer = answer != null ? answer : AnswerValue.empty();
    }

    public String identifier() {
        return question.getIdentifier().displayIdentifier();
    }

    public boolean isAnswered() {
        return !answer.isEmpty();
    }

    /// Returns whether the question is required and has no answer.
    ///
    /// @return true if navigation forward must be blocked
    public boolean isMissingRequiredAnswer() {
        return question.isRequired() && !isAnswered();
    }

    public Optional<RepeatSlot> repeatSlot() {
        return Optional.ofNullable(slot);
    }
}
