package io.qlogic.core.editor;

/// Content save state of one question.
public enum SaveStatus {
    /// Not persistable yet: identifier, text or options are missing or invalid.
    DRAFT,
    /// Edits are waiting for the debounce delay or an in-flight save.
    PENDING,
    /// The latest content is stored.
    SAVED,
    /// The last save failed; the next edit retries.
    FAILED,
    /// The identifier collides with another question; saves wait for a rename.
    BLOCKED_DUPLICATE
}
