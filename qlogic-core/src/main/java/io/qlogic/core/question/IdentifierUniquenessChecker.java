package io.qlogic.core.question;

import io.qlogic.core.persistence.QuestionPersistence;
import io.qlogic.core.util.Debouncer;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Debounced remote identifier uniqueness checks for one question group.
///
/// Each question has at most one outstanding check. Starting a new check for a question
/// completes the previous one with {@link IdentifierStatus#SUPERSEDED}, so a late remote
/// answer for an old identifier can never confirm a newer one.
///
/// ### Outcomes
/// - collaborator answers true: {@link IdentifierStatus#UNIQUE}
/// - collaborator answers false: {@link IdentifierStatus#DUPLICATE}
/// - collaborator fails: {@link IdentifierStatus#UNKNOWN}
///
/// @implNote Thread-safe. Remote calls are issued from the debouncer's scheduler thread.
/// @see QuestionRegistry#checkIdentifierUnique(String, String)
public final class IdentifierUniquenessChecker {

    private static final Logger logger =
            Logger.getLogger(IdentifierUniquenessChecker.class.getName());

    private final QuestionPersistence persistence;
    private final String groupId;
    private final Debouncer<String> debouncer;
    private final Map<String, CompletableFuture<IdentifierStatus>> outstanding = new HashMap<>();

    /// Creates a checker.
    ///
    /// @param persistence collaborator answering remote checks, not null
    /// @param groupId group whose identifiers are checked, not null
    /// @param debouncer debouncer keyed by question local id, not null
    public IdentifierUniquenessChecker(
            QuestionPersistence persistence, String groupId, Debouncer<String> debouncer) {
        this.persistence = Objects.requireNonNull(persistence, "persistence must not be null");
        this.groupId = Objects.requireNonNull(groupId, "groupId must not be null");
        this.debouncer = Objects.requireNonNull(debouncer, "debouncer must not be null");
    }

    /// Schedules a remote check, superseding any outstanding check for the same question.
    ///
    /// @param localId question being edited, not null
    /// @param qualifiedIdentifier identifier to check, not null
    /// @param excludingQuestionId persisted id of the question being edited, may be null
    /// @return future completing with the final status, never null
    public CompletableFuture<IdentifierStatus> check(
            String localId, String qualifiedIdentifier, String excludingQuestionId) {
        CompletableFuture<IdentifierStatus> result = new CompletableFuture<>();
        CompletableFuture<IdentifierStatus> previous;
        synchronized (outstanding) {
            previous = outstanding.put(localId, result);
        }
        if (previous != null) {
            previous.complete(IdentifierStatus.SUPERSEDED);
        }
        debouncer.submit(
                localId, () -> dispatch(localId, qualifiedIdentifier, excludingQuestionId, result));
        return result;
    }

    /// Cancels the outstanding check of a question, completing it as superseded.
    ///
    /// @param localId question whose check is dropped, not null
    public void cancel(String localId) {
        debouncer.cancel(localId);
        CompletableFuture<IdentifierStatus> previous;
        synchronized (outstanding) {
            previous = outstanding.remove(localId);
        }
        if (previous != null) {
            previous.complete(IdentifierStatus.SUPERSEDED);
        }
    }

    private void dispatch(
            String localId,
            String qualifiedIdentifier,
            String excludingQuestionId,
            CompletableFuture<IdentifierStatus> result) {
        CompletableFuture<Boolean> remote;
        try {
            remote =
                    persistence.checkIdentifierUnique(
                            qualifiedIdentifier, groupId, excludingQuestionId);
        } catch (RuntimeException e) {
            remote = CompletableFuture.failedFuture(e);
        }
        remote.whenComplete(
                (unique, error) -> {
                    IdentifierStatus status;
                    if (error != null) {
                        logger.log(
                                Level.WARNING,
                                "Identifier check failed for '" + qualifiedIdentifier + "'",
                                error);
                        status = IdentifierStatus.UNKNOWN;
                    } else {
                        status =
                                Boolean.TRUE.equals(unique)
                                        ? IdentifierStatus.UNIQUE
                                        : IdentifierStatus.DUPLICATE;
                    }
                    synchronized (outstanding) {
                        outstanding.remove(localId, result);
                    }
                    if (result.complete(status)) {
                        logger.fine(() -> "Identifier '" + qualifiedIdentifier + "' is " + status);
                    }
                });
    }
}
