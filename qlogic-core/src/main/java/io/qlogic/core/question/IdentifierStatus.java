package io.qlogic.core.question;

/// Outcome of an identifier uniqueness check.
public enum IdentifierStatus {
    /// Confirmed free both locally and by persistence.
    UNIQUE,
    /// Used by another question of the group.
    DUPLICATE,
    /// Free locally; the remote check has not answered yet.
    CHECKING,
    /// Blank or not made of letters, digits and underscores.
    INVALID,
    /// Replaced by a newer check for the same question before it answered.
    SUPERSEDED,
    /// The remote check failed; uniqueness is not confirmed.
    UNKNOWN;

    /// Returns whether this status confirms the identifier may be saved.
    ///
    /// @return true only for {@link #UNIQUE}
    public boolean confirmsUnique() {
        return this == UNIQUE;
    }
}
