package io.qlogic.core.persistence;

import io.qlogic.core.answer.AnswerSheet;
import java.util.concurrent.CompletableFuture;

/// Persistence collaborator for the answers of questionnaire sessions.
///
/// @see InMemoryAnswerStore for the default implementation
public interface AnswerStore {

    /// Loads every persisted answer of a session.
    ///
    /// @param sessionId session to load, not null
    /// @return future completing with the stored answers, empty if none
    CompletableFuture<AnswerSheet> loadAnswers(String sessionId);

    /// Stores changed answers of a session.
    ///
    /// Entries in `changes` replace stored values with the same identifier; other stored
    /// answers are kept.
    ///
    /// @param sessionId session to update, not null
    /// @param changes answers to store, not null
    /// @return future completing when the answers are stored
    CompletableFuture<Void> saveAnswers(String sessionId, AnswerSheet changes);
}
