package io.qlogic.core.persistence;

import java.io.Serial;

/// Thrown when a persistence collaborator call fails.
///
/// Wraps the collaborator's own failure. Content saves record the failure in the question's
/// save status and retry on the next edit; structural saves keep the in-memory tree and retry
/// on the next structural edit.
public class PersistenceFailureException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127734096022356190L;

    /// Creates exception with message.
    ///
    /// @param message description of the failed call
    public PersistenceFailureException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the failed call
    /// @param cause the collaborator's failure
    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
