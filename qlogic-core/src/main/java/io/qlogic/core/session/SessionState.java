package io.qlogic.core.session;

/// Lifecycle of a questionnaire session.
public enum SessionState {
    /// Persisted answers are being loaded.
    LOADING,
    /// Answers can be edited and pages navigated.
    ACTIVE,
    /// The last page of the last group was passed.
    COMPLETED
}
