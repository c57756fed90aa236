package io.qlogic.core.util;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/// {@link Scheduler} backed by a `ScheduledExecutorService`.
///
/// Task failures are logged rather than silently swallowed by the executor.
///
/// @implNote Thread-safe. Owns the executor: {@link #close()} shuts it down.
public final class ExecutorScheduler implements Scheduler, AutoCloseable {

    private static final Logger logger = Logger.getLogger(ExecutorScheduler.class.getName());

    private final ScheduledExecutorService executor;

    /// Creates a scheduler on top of an executor.
    ///
    /// @param executor the executor that runs scheduled tasks, not null
    public ExecutorScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future =
                executor.schedule(() -> runLogged(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    private void runLogged(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Scheduled task failed", e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
