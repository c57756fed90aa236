package io.qlogic.core.editor;

import io.qlogic.core.persistence.PersistenceFailureException;
import io.qlogic.core.persistence.QuestionPersistence;
import io.qlogic.core.question.IdentifierStatus;
import io.qlogic.core.question.Question;
import io.qlogic.core.question.QuestionEdit;
import io.qlogic.core.question.QuestionRegistry;
import io.qlogic.core.util.Debouncer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Debounced, versioned content autosave for the questions of one editor.
///
/// ### Per-question Protocol
/// - every edit bumps the question's version and restarts its debounce timer
/// - when the timer fires, the complete current content is sent: a create for a question
///   without persisted id, an update otherwise
/// - at most one save per question is in flight; edits made meanwhile are sent after it
/// - a response only marks the question {@link SaveStatus#SAVED} or
///   {@link SaveStatus#FAILED} if no newer edit exists; a newer edit is sent either way
/// - a save waits for the question's pending identifier check and is blocked if the check
///   reports a duplicate
///
/// A question removed while its create is in flight is deleted as soon as the create
/// returns its id.
///
/// @implNote Thread-safe. Shares the editor's monitor; collaborator calls are made outside
/// of it.
final class ContentAutosaver {

    private static final Logger logger = Logger.getLogger(ContentAutosaver.class.getName());

    private final Object lock;
    private final String groupId;
    private final QuestionRegistry registry;
    private final QuestionPersistence persistence;
    private final Debouncer<String> debouncer;
    private final PendingSaves pendingSaves;
    private final BiConsumer<String, String> onCreated;
    private final Map<String, Slot> slots = new HashMap<>();

    ContentAutosaver(
            Object lock,
            String groupId,
            QuestionRegistry registry,
            QuestionPersistence persistence,
            Debouncer<String> debouncer,
            PendingSaves pendingSaves,
            BiConsumer<String, String> onCreated) {
        this.lock = Objects.requireNonNull(lock);
        this.groupId = Objects.requireNonNull(groupId);
        this.registry = Objects.requireNonNull(registry);
        this.persistence = Objects.requireNonNull(persistence);
        this.debouncer = Objects.requireNonNull(debouncer);
        this.pendingSaves = Objects.requireNonNull(pendingSaves);
        this.onCreated = Objects.requireNonNull(onCreated);
    }

    /// Records an edit and schedules a debounced save.
    ///
    /// @param localId edited question, not null
    /// @param identifierCheck pending check of a new identifier, null if the edit kept it
    void schedule(String localId, CompletableFuture<IdentifierStatus> identifierCheck) {
        synchronized (lock) {
            Slot slot = slots.computeIfAbsent(localId, id -> new Slot());
            slot.version++;
            if (identifierCheck != null) {
                slot.identifierCheck = identifierCheck;
            }
            Optional<Question> question = registry.get(localId);
            if (question.isEmpty()) {
                return;
            }
            if (!question.get().isPersistable()) {
                debouncer.cancel(localId);
                slot.status = SaveStatus.DRAFT;
                return;
            }
            slot.status = SaveStatus.PENDING;
        }
        debouncer.submit(localId, () -> dispatch(localId));
    }

    /// Marks a question as blocked by a duplicate identifier and drops its pending save.
    ///
    /// @param localId question whose rename was rejected, not null
    void block(String localId) {
        debouncer.cancel(localId);
        synchronized (lock) {
            Slot slot = slots.computeIfAbsent(localId, id -> new Slot());
            slot.version++;
            slot.status = SaveStatus.BLOCKED_DUPLICATE;
        }
    }

    /// Stops saving a removed question.
    ///
    /// @param localId removed question, not null
    /// @return true if its create is in flight and it will be deleted once created
    boolean forget(String localId) {
        debouncer.cancel(localId);
        synchronized (lock) {
            Slot slot = slots.remove(localId);
            return slot != null && slot.inFlight && slot.creating;
        }
    }

    /// Returns the save state of a question.
    ///
    /// @param question registered question, not null
    /// @return status, derived from the question for never-edited questions
    SaveStatus status(Question question) {
        synchronized (lock) {
            Slot slot = slots.get(question.getLocalId());
            if (slot != null && slot.status != null) {
                return slot.status;
            }
            return question.isPersisted() ? SaveStatus.SAVED : SaveStatus.DRAFT;
        }
    }

    /// Sends every debounced save now.
    void flush() {
        debouncer.flushAll();
    }

    private void dispatch(String localId) {
        Question question;
        long version;
        synchronized (lock) {
            Slot slot = slots.get(localId);
            if (slot == null) {
                return;
            }
            if (slot.inFlight) {
                slot.redispatch = true;
                return;
            }
            CompletableFuture<IdentifierStatus> check = slot.identifierCheck;
            if (check != null && !check.isDone()) {
                pendingSaves.track(check.whenComplete((status, error) -> dispatch(localId)));
                return;
            }
            if (check != null && !gatePasses(localId, slot, check.join())) {
                return;
            }
            Optional<Question> current = registry.get(localId);
            if (current.isEmpty() || !current.get().isPersistable()) {
                return;
            }
            question = current.get();
            version = slot.version;
            slot.inFlight = true;
            slot.creating = !question.isPersisted();
            slot.redispatch = false;
        }
        if (question.isPersisted()) {
            QuestionEdit content = QuestionEdit.fullContentOf(question);
            CompletableFuture<Void> update =
                    call(() -> persistence.updateQuestion(question.getId(), content));
            pendingSaves.track(
                    update.whenComplete((v, error) -> completed(localId, version, null, error)));
        } else {
            CompletableFuture<String> create =
                    call(() -> persistence.createQuestion(groupId, question));
            pendingSaves.track(
                    create.whenComplete((id, error) -> completed(localId, version, id, error)));
        }
    }

    private boolean gatePasses(String localId, Slot slot, IdentifierStatus check) {
        switch (check) {
            case UNIQUE:
                slot.identifierCheck = null;
                return true;
            case DUPLICATE:
                slot.status = SaveStatus.BLOCKED_DUPLICATE;
                return false;
            case UNKNOWN:
                logger.warning(
                        "Identifier of question "
                                + localId
                                + " could not be confirmed; save skipped");
                slot.status = SaveStatus.FAILED;
                slot.identifierCheck = null;
                return false;
            default:
                // Superseded or still checking: a newer edit scheduled its own save
                return false;
        }
    }

    private void completed(String localId, long version, String createdId, Throwable error) {
        boolean again = false;
        boolean orphanCreated = false;
        synchronized (lock) {
            Slot slot = slots.get(localId);
            if (slot == null) {
                orphanCreated = createdId != null;
            } else {
                slot.inFlight = false;
                if (slot.version != version) {
                    again = slot.redispatch;
                } else {
                    slot.status = error != null ? SaveStatus.FAILED : SaveStatus.SAVED;
                }
            }
        }
        if (error != null) {
            logger.log(
                    Level.WARNING,
                    "Content save failed for question " + localId,
                    new PersistenceFailureException("Question save failed", error));
            if (again) {
                dispatch(localId);
            }
            return;
        }
        if (createdId != null) {
            if (orphanCreated || registry.commitPersistedId(localId, createdId).isEmpty()) {
                logger.info(
                        "Question "
                                + localId
                                + " was removed while being created; deleting "
                                + createdId);
                pendingSaves.track(call(() -> persistence.deleteQuestion(createdId)))
                        .whenComplete((v, e) -> logDeleteFailure(createdId, e));
                return;
            }
            onCreated.accept(localId, createdId);
        }
        if (again) {
            dispatch(localId);
        }
    }

    private static void logDeleteFailure(String persistedId, Throwable error) {
        if (error != null) {
            logger.log(Level.WARNING, "Delete failed for question " + persistedId, error);
        }
    }

    private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /// Save state of one question.
    private static final class Slot {
        private long version;
        private SaveStatus status;
        private boolean inFlight;
        private boolean creating;
        private boolean redispatch;
        private CompletableFuture<IdentifierStatus> identifierCheck;
    }
}
