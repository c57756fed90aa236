package io.qlogic.core.repeatable;

import java.util.List;
import java.util.Objects;

/// Run of consecutive sibling repeatable questions that repeat together.
///
/// @param startIndex position of the first question in the list the set was resolved from
/// @param questionIds local ids of the member questions, in order, not empty
public record RepeatableSet(int startIndex, List<String> questionIds) {

    public RepeatableSet {
        questionIds = List.copyOf(Objects.requireNonNull(questionIds, "questionIds"));
        if (questionIds.isEmpty()) {
            throw new IllegalArgumentException("A repeatable set needs at least one question");
        }
    }

    public int length() {
        return questionIds.size();
    }

    /// Returns the position after the last member.
    ///
    /// @return exclusive end index
    public int endIndex() {
        return startIndex + questionIds.size();
    }

    /// Returns whether a list position falls inside this set.
    ///
    /// @param index list position
    /// @return true if `startIndex <= index < endIndex()`
    public boolean covers(int index) {
        return index >= startIndex && index < endIndex();
    }
}
