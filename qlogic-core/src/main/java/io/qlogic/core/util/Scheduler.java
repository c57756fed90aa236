package io.qlogic.core.util;

import java.time.Duration;

/// Schedules delayed tasks for debounced saves and checks.
///
/// Abstracts the timer so debounce behavior can be driven deterministically in tests.
///
/// @see ExecutorScheduler for the default implementation
/// @see Debouncer for keyed debouncing on top of a scheduler
public interface Scheduler {

    /// Schedules a task to run once after a delay.
    ///
    /// @param task the task to run, not null
    /// @param delay how long to wait before running, not null
    /// @return handle that can cancel the task before it runs, never null
    ScheduledTask schedule(Runnable task, Duration delay);
}
