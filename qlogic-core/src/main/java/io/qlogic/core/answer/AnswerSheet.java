package io.qlogic.core.answer;

import io.qlogic.core.question.QuestionIdentifier;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/// Immutable answers of a session, keyed by question identifier.
///
/// Keys are stored as given, bare or qualified. Lookups tolerate both forms because
/// conditionals and older answers may use either.
///
/// ### Lookup Order
/// 1. exact key
/// 2. bare form of the requested identifier
///
/// A key qualified with another namespace never matches, so groups sharing a bare
/// identifier keep their answers apart.
///
/// @param answers answers by identifier, not null
/// @implNote Immutable and thread-safe. Keys are kept sorted so lookups are deterministic.
public record AnswerSheet(Map<String, AnswerValue> answers) {

    private static final AnswerSheet EMPTY = new AnswerSheet(Map.of());

    public AnswerSheet {
        Objects.requireNonNull(answers, "answers must not be null");
        answers = Collections.unmodifiableMap(new TreeMap<>(answers));
    }

    public static AnswerSheet empty() {
        return EMPTY;
    }

    public static AnswerSheet of(Map<String, AnswerValue> answers) {
        return answers.isEmpty() ? EMPTY : new AnswerSheet(answers);
    }

    /// Returns the answer stored under an exact key.
    ///
    /// @param identifier key as stored, not null
    /// @return answer, or empty if absent
    public Optional<AnswerValue> get(String identifier) {
        return Optional.ofNullable(answers.get(identifier));
    }

    /// Looks up an answer by bare or qualified identifier.
    ///
    /// @param raw identifier in either form, may be null
    /// @return answer, or empty if none matches
    public Optional<AnswerValue> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        AnswerValue exact = answers.get(raw);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(answers.get(QuestionIdentifier.strip(raw)));
    }

    /// Looks up the answer of a question, preferring its qualified identifier.
    ///
    /// @param identifier question identifier, not null
    /// @return answer, or empty if none matches
    public Optional<AnswerValue> lookup(QuestionIdentifier identifier) {
        if (identifier.isBlank()) {
            return Optional.empty();
        }
        AnswerValue qualified = answers.get(identifier.qualifiedIdentifier());
        return qualified != null
                ? Optional.of(qualified)
                : lookup(identifier.displayIdentifier());
    }

    /// Returns a sheet with one answer set.
    ///
    /// @param identifier key, not null
    /// @param value answer, not null
    /// @return new sheet, never null
    public AnswerSheet with(String identifier, AnswerValue value) {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Map<String, AnswerValue> copy = new TreeMap<>(answers);
        copy.put(identifier, value);
        return new AnswerSheet(copy);
    }

    /// Returns a sheet with every answer of another sheet set.
    ///
    /// @param other answers that take precedence, not null
    /// @return merged sheet, never null
    public AnswerSheet withAll(AnswerSheet other) {
        if (other.answers.isEmpty()) {
            return this;
        }
        Map<String, AnswerValue> copy = new TreeMap<>(answers);
        copy.putAll(other.answers);
        return new AnswerSheet(copy);
    }

    /// Returns a sheet without one key.
    ///
    /// @param identifier exact key to drop, not null
    /// @return new sheet, or this sheet if the key is absent
    public AnswerSheet without(String identifier) {
        if (!answers.containsKey(identifier)) {
            return this;
        }
        Map<String, AnswerValue> copy = new TreeMap<>(answers);
        copy.remove(identifier);
        return new AnswerSheet(copy);
    }

    /// Returns only the given keys.
    ///
    /// @param identifiers exact keys to keep, not null
    /// @return sheet restricted to the keys present, never null
    public AnswerSheet only(Set<String> identifiers) {
        Map<String, AnswerValue> copy = new TreeMap<>(answers);
        copy.keySet().retainAll(identifiers);
        return new AnswerSheet(copy);
    }

    public Set<String> identifiers() {
        return answers.keySet();
    }

    public boolean isEmpty() {
        return answers.isEmpty();
    }

    public int size() {
        return answers.size();
    }
}
