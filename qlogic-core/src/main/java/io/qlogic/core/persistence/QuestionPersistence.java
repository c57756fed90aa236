package io.qlogic.core.persistence;

import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionEdit;
import java.util.concurrent.CompletableFuture;

/// Persistence collaborator for questions and logic trees of one backend.
///
/// Every call is asynchronous. Implementations report failures by completing the returned
/// future exceptionally; the editor wraps them in {@link PersistenceFailureException}.
/// Retry and backoff are the implementation's concern.
///
/// ### Contracts
/// - `createQuestion` never receives a draft (blank or malformed identifier)
/// - `updateQuestion` receives the complete current content of a question
/// - `saveLogicTree` receives the tree encoded by the configured `LogicTreeCodec`
///
/// @implNote Implementations must be thread-safe; calls may come from scheduler threads.
/// @see InMemoryQuestionPersistence for the default implementation
public interface QuestionPersistence {

    /// Creates a question record.
    ///
    /// @param groupId owning question group, not null
    /// @param question question content without persisted id, not null
    /// @return future completing with the assigned persisted id
    CompletableFuture<String> createQuestion(String groupId, Question question);

    /// Updates a persisted question.
    ///
    /// @param persistedId id returned by {@link #createQuestion}, not null
    /// @param edit content to apply, not null
    /// @return future completing when the update is stored
    CompletableFuture<Void> updateQuestion(String persistedId, QuestionEdit edit);

    /// Deletes a persisted question.
    ///
    /// @param persistedId id returned by {@link #createQuestion}, not null
    /// @return future completing when the record is gone
    CompletableFuture<Void> deleteQuestion(String persistedId);

    /// Stores the serialized logic tree of a group, replacing the previous one.
    ///
    /// @param groupId owning question group, not null
    /// @param serializedTree encoded tree, not null
    /// @return future completing when the tree is stored
    CompletableFuture<Void> saveLogicTree(String groupId, String serializedTree);

    /// Checks whether no other persisted question of the group uses an identifier.
    ///
    /// Comparison is case-insensitive.
    ///
    /// @param identifier qualified identifier to check, not null
    /// @param groupId owning question group, not null
    /// @param excludingQuestionId persisted id of the question being edited, may be null
    /// @return future completing with true if the identifier is free
    CompletableFuture<Boolean> checkIdentifierUnique(
            String identifier, String groupId, String excludingQuestionId);
}
