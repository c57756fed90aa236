package io.qlogic.core.util;

/// Handle to a task scheduled by a {@link Scheduler}.
public interface ScheduledTask {

    /// Cancels the task if it has not started yet.
    ///
    /// @return true if the task will not run
    boolean cancel();
}
