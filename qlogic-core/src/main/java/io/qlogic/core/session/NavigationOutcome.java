package io.qlogic.core.session;

/// What a navigation request did.
public enum NavigationOutcome {
    ADVANCED_PAGE,
    ADVANCED_GROUP,
    /// Answers were saved and the session completed.
    COMPLETED,
    /// The session completed without a save because nothing had changed.
    EXITED,
    RETREATED_PAGE,
    RETREATED_GROUP,
    /// Already on the first page of the first group.
    AT_START,
    /// Required questions on the page are unanswered; nothing was saved.
    BLOCKED
}
