package io.qlogic.core.editor;

import io.qlogic.core.logic.LogicTree;
import io.qlogic.core.logic.LogicTreeCodec;
import io.qlogic.core.persistence.PersistenceFailureException;
import io.qlogic.core.persistence.QuestionPersistence;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Single-slot queue serializing logic tree saves of one group.
///
/// At most one save is in flight. Trees submitted meanwhile coalesce: when the in-flight
/// save completes, only the latest submitted tree is sent. A failed save leaves the
/// in-memory tree untouched and marks the queue {@link StructuralSaveStatus#FAILED}; the
/// next submit retries with the latest tree.
///
/// @implNote Thread-safe. Guarded by its own monitor, never by the editor's, so completion
/// callbacks on collaborator threads cannot deadlock with editor calls.
final class StructuralSaveQueue {

    private static final Logger logger = Logger.getLogger(StructuralSaveQueue.class.getName());

    private final String groupId;
    private final QuestionPersistence persistence;
    private final LogicTreeCodec codec;
    private final PendingSaves pendingSaves;

    private LogicTree latest;
    private boolean inFlight;
    private boolean dirty;
    private StructuralSaveStatus status = StructuralSaveStatus.IDLE;

    StructuralSaveQueue(
            String groupId,
            QuestionPersistence persistence,
            LogicTreeCodec codec,
            PendingSaves pendingSaves) {
        this.groupId = Objects.requireNonNull(groupId, "groupId must not be null");
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.pendingSaves = Objects.requireNonNull(pendingSaves, "pendingSaves must not be null");
    }

    /// Submits a tree snapshot for saving.
    ///
    /// @param tree snapshot to save, not null
    void submit(LogicTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        synchronized (this) {
            latest = tree;
            if (inFlight) {
                dirty = true;
                return;
            }
            inFlight = true;
            status = StructuralSaveStatus.IN_FLIGHT;
        }
        send(tree);
    }

    synchronized StructuralSaveStatus status() {
        return status;
    }

    private void send(LogicTree tree) {
        CompletableFuture<Void> save;
        try {
            save = persistence.saveLogicTree(groupId, codec.encode(tree));
        } catch (RuntimeException e) {
            save = CompletableFuture.failedFuture(e);
        }
        pendingSaves.track(save.whenComplete((result, error) -> onComplete(error)));
    }

    private void onComplete(Throwable error) {
        LogicTree next = null;
        synchronized (this) {
            if (dirty) {
                dirty = false;
                next = latest;
            } else {
                inFlight = false;
                status = error != null ? StructuralSaveStatus.FAILED : StructuralSaveStatus.IDLE;
            }
        }
        if (error != null) {
            logger.log(
                    Level.WARNING,
                    "Logic tree save failed for group " + groupId,
                    new PersistenceFailureException("saveLogicTree failed", error));
        } else {
            logger.fine(() -> "Saved logic tree of group " + groupId);
        }
        if (next != null) {
            send(next);
        }
    }
}
