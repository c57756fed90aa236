package io.qlogic.core.editor;

/// State of the logic tree save queue.
public enum StructuralSaveStatus {
    /// No save in flight and the last one succeeded.
    IDLE,
    /// A tree save is in flight.
    IN_FLIGHT,
    /// The last tree save failed; the in-memory tree is kept and the next edit retries.
    FAILED
}
