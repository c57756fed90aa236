package io.qlogic.core.persistence;

import io.qlogic.core.answer.AnswerSheet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory answer store (default implementation).
///
/// Thread-safe, no external dependencies. Every call completes immediately.
///
/// @implNote Uses ConcurrentHashMap with atomic merges per session.
/// @see AnswerStore for contract
public final class InMemoryAnswerStore implements AnswerStore {

    private final Map<String, AnswerSheet> sessions = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<AnswerSheet> loadAnswers(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return CompletableFuture.completedFuture(
                sessions.getOrDefault(sessionId, AnswerSheet.empty()));
    }

    @Override
    public CompletableFuture<Void> saveAnswers(String sessionId, AnswerSheet changes) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(changes, "changes must not be null");

        sessions.merge(sessionId, changes, AnswerSheet::withAll);
        return CompletableFuture.completedFuture(null);
    }

    /// Clears all data (useful for testing).
    public void clear() {
        sessions.clear();
    }
}
