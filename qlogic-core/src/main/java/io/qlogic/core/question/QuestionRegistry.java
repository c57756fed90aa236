package io.qlogic.core.question;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Mutable registry of the questions of one group, keyed by local id.
///
/// Owns question content and identifier uniqueness. The logic tree only references
/// questions; everything the evaluator needs is read from an immutable
/// {@link #snapshot()}.
///
/// ### Identifier Uniqueness
/// Identifiers are unique case-insensitively within the group. The in-memory check is
/// synchronous and authoritative for duplicates; persisted state is consulted through the
/// optional {@link IdentifierUniquenessChecker}. Blank identifiers are allowed for drafts.
///
/// ### Persisted Ids
/// {@link #commitPersistedId(String, String)} is the single step that attaches a persisted
/// id to a question. It is idempotent for the same id.
///
/// @implNote Thread-safe. All state is guarded by this registry's monitor; remote checks
/// complete on scheduler threads.
/// @see QuestionCatalog for the read-only view
public final class QuestionRegistry {

    private static final Logger logger = Logger.getLogger(QuestionRegistry.class.getName());

    private final String groupId;
    private final String groupIdentifier;
    private final IdentifierUniquenessChecker checker;
    private final Map<String, Question> questions = new LinkedHashMap<>();

    /// Creates a registry without remote identifier checks.
    ///
    /// @param groupId owning group id, not null
    /// @param groupIdentifier namespace of the group's identifiers, may be null
    public QuestionRegistry(String groupId, String groupIdentifier) {
        this(groupId, groupIdentifier, null);
    }

    /// Creates a registry.
    ///
    /// @param groupId owning group id, not null
    /// @param groupIdentifier namespace of the group's identifiers, may be null
    /// @param checker remote uniqueness checker, may be null for local checks only
    public QuestionRegistry(
            String groupId, String groupIdentifier, IdentifierUniquenessChecker checker) {
        this.groupId = Objects.requireNonNull(groupId, "groupId must not be null");
        this.groupIdentifier = groupIdentifier;
        this.checker = checker;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getGroupIdentifier() {
        return groupIdentifier;
    }

    /// Registers several questions, typically the persisted questions of a loaded group.
    ///
    /// @param loaded questions to register, not null
    /// @throws DuplicateIdentifierException if two questions share an identifier
    public synchronized void createAll(Collection<Question> loaded)
            throws DuplicateIdentifierException {
        for (Question question : loaded) {
            create(question);
        }
    }

    /// Registers a question.
    ///
    /// The identifier is re-qualified with this group's namespace.
    ///
    /// @param question question to add, not null
    /// @return the registered question, never null
    /// @throws DuplicateIdentifierException if another question of the group uses the
    ///     identifier
    /// @throws IllegalArgumentException if the local id is already registered
    public synchronized Question create(Question question) throws DuplicateIdentifierException {
        Objects.requireNonNull(question, "question must not be null");
        if (questions.containsKey(question.getLocalId())) {
            throw new IllegalArgumentException(
                    "Question already registered: " + question.getLocalId());
        }
        String display = question.getIdentifier().displayIdentifier();
        QuestionIdentifier identifier = QuestionIdentifier.of(groupIdentifier, display);
        if (isTaken(identifier, null)) {
            throw new DuplicateIdentifierException(identifier.displayIdentifier());
        }
        Question registered = question.toBuilder().identifier(identifier).build();
        questions.put(registered.getLocalId(), registered);
        logger.fine(() -> "Registered question " + registered);
        return registered;
    }

    /// Applies a content edit.
    ///
    /// Nothing is applied when the new identifier collides.
    ///
    /// @param localId question to edit, not null
    /// @param edit content changes, not null
    /// @return the updated question, never null
    /// @throws DuplicateIdentifierException if the new identifier is used by another question
    /// @throws IllegalArgumentException if no question has the local id
    public synchronized Question update(String localId, QuestionEdit edit)
            throws DuplicateIdentifierException {
        Question current = require(localId);
        if (edit.changesIdentifier()) {
            QuestionIdentifier identifier =
                    QuestionIdentifier.of(groupIdentifier, edit.getIdentifier());
            if (isTaken(identifier, localId)) {
                throw new DuplicateIdentifierException(identifier.displayIdentifier());
            }
        }
        return store(edit.applyTo(current, groupIdentifier));
    }

    /// Applies every field of an edit except the identifier.
    ///
    /// Used to keep content changes when a rename was rejected.
    ///
    /// @param localId question to edit, not null
    /// @param edit content changes, not null
    /// @return the updated question, never null
    /// @throws IllegalArgumentException if no question has the local id
    public synchronized Question updateContent(String localId, QuestionEdit edit) {
        Question current = require(localId);
        return store(edit.withoutIdentifier().applyTo(current, groupIdentifier));
    }

    /// Removes a question from the registry only.
    ///
    /// @param localId question to remove, not null
    /// @return the removed question, or empty if unknown
    public synchronized Optional<Question> remove(String localId) {
        Question removed = questions.remove(localId);
        if (removed != null && checker != null) {
            checker.cancel(localId);
        }
        return Optional.ofNullable(removed);
    }

    /// Removes the question a tree reference points at.
    ///
    /// @param ref reference held by a question node, not null
    /// @return the removed question, or empty if the reference dangles
    public synchronized Optional<Question> remove(QuestionRef ref) {
        return resolve(ref).flatMap(q -> remove(q.getLocalId()));
    }

    /// Attaches the id assigned by persistence to a question.
    ///
    /// @param localId question that was created, not null
    /// @param persistedId id returned by persistence, not null
    /// @return the persisted question, or empty if it was removed while the create was in
    ///     flight
    /// @throws IllegalStateException if the question already carries a different id
    public synchronized Optional<Question> commitPersistedId(String localId, String persistedId) {
        Objects.requireNonNull(persistedId, "persistedId must not be null");
        Question current = questions.get(localId);
        if (current == null) {
            return Optional.empty();
        }
        if (current.isPersisted()) {
            if (!current.getId().equals(persistedId)) {
                throw new IllegalStateException(
                        "Question "
                                + localId
                                + " already persisted as "
                                + current.getId()
                                + ", got "
                                + persistedId);
            }
            return Optional.of(current);
        }
        return Optional.of(store(current.withId(persistedId)));
    }

    /// Checks an identifier for a question.
    ///
    /// Blank or malformed identifiers are {@link IdentifierStatus#INVALID}; collisions with
    /// questions in memory are {@link IdentifierStatus#DUPLICATE} at once. Otherwise the
    /// remote check is scheduled and the status is {@link IdentifierStatus#CHECKING}, or
    /// {@link IdentifierStatus#UNIQUE} when no remote checker is configured.
    ///
    /// @param rawIdentifier bare or qualified identifier, may be null
    /// @param excludingLocalId question being edited, may be null for a new question
    /// @return check result, never null
    public synchronized IdentifierCheck checkIdentifierUnique(
            String rawIdentifier, String excludingLocalId) {
        QuestionIdentifier identifier = QuestionIdentifier.of(groupIdentifier, rawIdentifier);
        if (identifier.isBlank() || !identifier.isWellFormed()) {
            return IdentifierCheck.completed(IdentifierStatus.INVALID);
        }
        if (isTaken(identifier, excludingLocalId)) {
            return IdentifierCheck.completed(IdentifierStatus.DUPLICATE);
        }
        if (checker == null) {
            return IdentifierCheck.completed(IdentifierStatus.UNIQUE);
        }
        Question editing = excludingLocalId != null ? questions.get(excludingLocalId) : null;
        String excludingPersistedId = editing != null ? editing.getId() : null;
        String checkKey = excludingLocalId != null ? excludingLocalId : "new:" + groupId;
        return IdentifierCheck.pending(
                checker.check(checkKey, identifier.qualifiedIdentifier(), excludingPersistedId));
    }

    /// Returns whether no other in-memory question uses an identifier.
    ///
    /// @param rawIdentifier bare or qualified identifier, may be null
    /// @param excludingLocalId question being edited, may be null
    /// @return true if the identifier is free among registered questions
    public synchronized boolean isLocallyUnique(String rawIdentifier, String excludingLocalId) {
        return !isTaken(QuestionIdentifier.of(groupIdentifier, rawIdentifier), excludingLocalId);
    }

    public synchronized Optional<Question> get(String localId) {
        return Optional.ofNullable(questions.get(localId));
    }

    /// Resolves a tree reference against the current state.
    ///
    /// @param ref reference held by a question node, not null
    /// @return referenced question, or empty if the reference dangles
    public synchronized Optional<Question> resolve(QuestionRef ref) {
        if (ref instanceof QuestionRef.Unresolved unresolved) {
            return Optional.ofNullable(questions.get(unresolved.localId()));
        }
        String persistedId = ((QuestionRef.Resolved) ref).persistedId();
        return questions.values().stream()
                .filter(q -> persistedId.equals(q.getId()))
                .findFirst();
    }

    /// Returns an immutable view of all questions.
    ///
    /// @return consistent catalog, never null
    public synchronized QuestionCatalog snapshot() {
        return QuestionCatalog.of(questions.values());
    }

    /// Returns the persisted id of every persisted question.
    ///
    /// @return unmodifiable map from local id to persisted id, never null
    public synchronized Map<String, String> persistedIdsByLocalId() {
        Map<String, String> ids = new LinkedHashMap<>();
        questions.values().stream()
                .filter(Question::isPersisted)
                .forEach(q -> ids.put(q.getLocalId(), q.getId()));
        return Map.copyOf(ids);
    }

    public synchronized int size() {
        return questions.size();
    }

    private boolean isTaken(QuestionIdentifier identifier, String excludingLocalId) {
        if (identifier.isBlank()) {
            return false;
        }
        String key = identifier.uniquenessKey();
        return questions.values().stream()
                .filter(q -> !q.getLocalId().equals(excludingLocalId))
                .anyMatch(q -> q.getIdentifier().uniquenessKey().equals(key));
    }

    private Question require(String localId) {
        Question current = questions.get(localId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown question: " + localId);
        }
        return current;
    }

    private Question store(Question question) {
        questions.put(question.getLocalId(), question);
        return question;
    }
}
