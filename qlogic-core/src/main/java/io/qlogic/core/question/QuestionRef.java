package io.qlogic.core.question;

import java.util.Objects;

/// Reference from a logic tree node to the question it displays.
///
/// A question that has not been persisted yet is only known by its client-side `localId`.
/// Once the persistence collaborator assigns an id, every unresolved reference to that
/// question is rewritten to a resolved one in a single commit step.
///
/// ### Permitted Implementations
/// - {@link Unresolved} - local handle of a not-yet-persisted question
/// - {@link Resolved} - persisted question id
public sealed interface QuestionRef permits QuestionRef.Unresolved, QuestionRef.Resolved {

    /// Returns the reference to use for a question in its current persistence state.
    ///
    /// @param question the referenced question, not null
    /// @return resolved reference if the question has an id, unresolved otherwise
    static QuestionRef of(Question question) {
        return question.isPersisted()
                ? new Resolved(question.getId())
                : new Unresolved(question.getLocalId());
    }

    /// Returns whether this reference points at a persisted id.
    ///
    /// @return true for {@link Resolved}
    boolean isResolved();

    /// Reference by client-side handle, used until the question is persisted.
    ///
    /// @param localId stable client-side handle, not null
    record Unresolved(String localId) implements QuestionRef {
        public Unresolved {
            Objects.requireNonNull(localId, "localId must not be null");
        }

        @Override
        public boolean isResolved() {
            return false;
        }
    }

    /// Reference by persisted question id.
    ///
    /// @param persistedId id assigned by the persistence collaborator, not null
    record Resolved(String persistedId) implements QuestionRef {
        public Resolved {
            Objects.requireNonNull(persistedId, "persistedId must not be null");
        }

        @Override
        public boolean isResolved() {
            return true;
        }
    }
}
