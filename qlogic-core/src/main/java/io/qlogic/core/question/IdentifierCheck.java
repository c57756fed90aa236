package io.qlogic.core.question;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/// Result of starting an identifier uniqueness check.
///
/// The local check is synchronous: {@link #status()} is final unless it is
/// {@link IdentifierStatus#CHECKING}, in which case {@link #result()} completes once the
/// debounced remote check answers.
///
/// @param status status known right now, not null
/// @param result final status, already complete unless `status` is CHECKING, not null
public record IdentifierCheck(IdentifierStatus status, CompletableFuture<IdentifierStatus> result) {

    public IdentifierCheck {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    /// Creates a check whose outcome is already known.
    ///
    /// @param status final status, not null
    /// @return completed check, never null
    public static IdentifierCheck completed(IdentifierStatus status) {
        return new IdentifierCheck(status, CompletableFuture.completedFuture(status));
    }

    /// Creates a check waiting for the remote answer.
    ///
    /// @param result future completing with the final status, not null
    /// @return pending check, never null
    public static IdentifierCheck pending(CompletableFuture<IdentifierStatus> result) {
        return new IdentifierCheck(IdentifierStatus.CHECKING, result);
    }
}
