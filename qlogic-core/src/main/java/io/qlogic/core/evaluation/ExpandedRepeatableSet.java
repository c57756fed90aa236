package io.qlogic.core.evaluation;

import io.qlogic.core.question.Question;
import java.util.List;

/// Visible repeatable set expanded into its instances.
///
/// @param setIndex position among the evaluation's sets
/// @param questions member questions in block order, not empty
/// @param instances at least one instance
public record ExpandedRepeatableSet(
        int setIndex, List<Question> questions, List<RepeatableInstance> instances) {

    public ExpandedRepeatableSet {
        questions = List.copyOf(questions);
        instances = List.copyOf(instances);
    }

    public int instanceCount() {
        return instances.size();
    }

    /// Returns whether a question belongs to this set.
    ///
    /// @param identifier bare or qualified identifier, may be null
    /// @return true if a member question matches
    public boolean contains(String identifier) {
        return questions.stream().anyMatch(q -> q.getIdentifier().matches(identifier));
    }
}
