package io.qlogic.core.persistence;

import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionEdit;
import io.qlogic.core.question.QuestionIdentifier;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/// In-memory question persistence (default implementation).
///
/// Thread-safe, no external dependencies. Every call completes immediately. Stores
/// questions indexed by persisted id and the latest serialized tree per group.
///
/// ### Identifier Uniqueness
/// Identifiers are compared by their bare form, case-insensitively, among questions of the
/// same group.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
/// @see QuestionPersistence for contract
public final class InMemoryQuestionPersistence implements QuestionPersistence {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, StoredQuestion> questions = new ConcurrentHashMap<>();
    private final Map<String, String> trees = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<String> createQuestion(String groupId, Question question) {
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(question, "question must not be null");

        String id = "q-" + sequence.incrementAndGet();
        questions.put(id, new StoredQuestion(groupId, question.withId(id)));
        return CompletableFuture.completedFuture(id);
    }

    @Override
    public CompletableFuture<Void> updateQuestion(String persistedId, QuestionEdit edit) {
        Objects.requireNonNull(persistedId, "persistedId must not be null");
        Objects.requireNonNull(edit, "edit must not be null");

        StoredQuestion stored = questions.get(persistedId);
        if (stored == null) {
            return CompletableFuture.failedFuture(
                    new PersistenceFailureException("Question not found: " + persistedId));
        }
        String groupIdentifier = namespaceOf(stored.question());
        Question updated = edit.applyTo(stored.question(), groupIdentifier);
        questions.put(persistedId, new StoredQuestion(stored.groupId(), updated));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteQuestion(String persistedId) {
        Objects.requireNonNull(persistedId, "persistedId must not be null");

        if (questions.remove(persistedId) == null) {
            return CompletableFuture.failedFuture(
                    new PersistenceFailureException("Question not found: " + persistedId));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> saveLogicTree(String groupId, String serializedTree) {
        Objects.requireNonNull(groupId, "groupId must not be null");
        Objects.requireNonNull(serializedTree, "serializedTree must not be null");

        trees.put(groupId, serializedTree);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Boolean> checkIdentifierUnique(
            String identifier, String groupId, String excludingQuestionId) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(groupId, "groupId must not be null");

        String key = QuestionIdentifier.of(null, identifier).uniquenessKey();
        boolean taken =
                questions.entrySet().stream()
                        .filter(e -> e.getValue().groupId().equals(groupId))
                        .filter(e -> !e.getKey().equals(excludingQuestionId))
                        .anyMatch(
                                e ->
                                        e.getValue()
                                                .question()
                                                .getIdentifier()
                                                .uniquenessKey()
                                                .equals(key));
        return CompletableFuture.completedFuture(!taken);
    }

    /// Finds a stored question.
    ///
    /// @param persistedId id to look up, not null
    /// @return the stored question, or empty if absent
    public Optional<Question> findQuestion(String persistedId) {
        StoredQuestion stored = questions.get(persistedId);
        return stored != null ? Optional.of(stored.question()) : Optional.empty();
    }

    /// Returns every stored question of a group.
    ///
    /// @param groupId owning group, not null
    /// @return unmodifiable list, never null
    public List<Question> findQuestions(String groupId) {
        return questions.values().stream()
                .filter(s -> s.groupId().equals(groupId))
                .map(StoredQuestion::question)
                .toList();
    }

    /// Returns the latest serialized tree of a group.
    ///
    /// @param groupId owning group, not null
    /// @return serialized tree, or empty if never saved
    public Optional<String> findLogicTree(String groupId) {
        return Optional.ofNullable(trees.get(groupId));
    }

    /// Clears all data (useful for testing).
    public void clear() {
        questions.clear();
        trees.clear();
    }

    private static String namespaceOf(Question question) {
        String qualified = question.getIdentifier().qualifiedIdentifier();
        int dot = qualified.indexOf('.');
        return dot >= 0 ? qualified.substring(0, dot) : null;
    }

    private record StoredQuestion(String groupId, Question question) {}
}
