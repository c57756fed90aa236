package io.qlogic.core.question;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable, consistent view of the questions of one group.
///
/// The flow evaluator and the repeatable-set resolver read questions only through a catalog,
/// so an evaluation never observes a registry mid-update.
///
/// @implNote Immutable and thread-safe.
/// @see QuestionRegistry#snapshot()
public final class QuestionCatalog {

    private static final QuestionCatalog EMPTY = new QuestionCatalog(List.of());

    private final List<Question> questions;
    private final Map<String, Question> byLocalId;
    private final Map<String, Question> byId;

    private QuestionCatalog(Collection<Question> questions) {
        Map<String, Question> local = new LinkedHashMap<>();
        Map<String, Question> persisted = new LinkedHashMap<>();
        for (Question question : questions) {
            Objects.requireNonNull(question, "question must not be null");
            local.put(question.getLocalId(), question);
            if (question.isPersisted()) {
                persisted.put(question.getId(), question);
            }
        }
        this.questions = List.copyOf(local.values());
        this.byLocalId = Map.copyOf(local);
        this.byId = Map.copyOf(persisted);
    }

    /// Creates a catalog from questions.
    ///
    /// A later question with the same local id replaces an earlier one.
    ///
    /// @param questions questions of the group, not null
    /// @return catalog, never null
    public static QuestionCatalog of(Collection<Question> questions) {
        return new QuestionCatalog(questions);
    }

    /// Creates a catalog from questions.
    ///
    /// @param questions questions of the group, not null
    /// @return catalog, never null
    public static QuestionCatalog of(Question... questions) {
        return new QuestionCatalog(List.of(questions));
    }

    public static QuestionCatalog empty() {
        return EMPTY;
    }

    /// Resolves a tree reference.
    ///
    /// @param ref reference held by a question node, not null
    /// @return referenced question, or empty if the reference dangles
    public Optional<Question> resolve(QuestionRef ref) {
        Objects.requireNonNull(ref, "ref must not be null");
        if (ref instanceof QuestionRef.Resolved resolved) {
            return Optional.ofNullable(byId.get(resolved.persistedId()));
        }
        return Optional.ofNullable(byLocalId.get(((QuestionRef.Unresolved) ref).localId()));
    }

    public Optional<Question> findByLocalId(String localId) {
        return Optional.ofNullable(byLocalId.get(localId));
    }

    public Optional<Question> findById(String persistedId) {
        return Optional.ofNullable(byId.get(persistedId));
    }

    /// Finds a question by identifier in either form.
    ///
    /// @param raw bare or qualified identifier, may be null
    /// @return first matching question, or empty
    public Optional<Question> findByIdentifier(String raw) {
        return questions.stream().filter(q -> q.getIdentifier().matches(raw)).findFirst();
    }

    /// Returns every question in registration order.
    ///
    /// @return unmodifiable list, never null
    public List<Question> all() {
        return questions;
    }

    public int size() {
        return questions.size();
    }
}
