package io.qlogic.core.util;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Keyed debouncer: runs only the last task submitted for a key once the key has been quiet
/// for the configured delay.
///
/// Used for per-question content autosave and per-question identifier checks, so rapid
/// typing results in one collaborator call per question instead of one per keystroke.
///
/// ### Usage
/// {@snippet :
/// Debouncer<String> debouncer = new Debouncer<>(scheduler, Duration.ofSeconds(1));
/// debouncer.submit(question.getLocalId(), () -> save(question));
/// }
///
/// @param <K> key type, one pending task per key
/// @implNote Thread-safe. Tasks run on the scheduler's thread, outside the debouncer's lock.
public final class Debouncer<K> {

    private final Scheduler scheduler;
    private final Duration delay;
    private final Map<K, Pending> pending = new HashMap<>();
    private long sequence;

    /// Creates a debouncer.
    ///
    /// @param scheduler timer used to delay tasks, not null
    /// @param delay quiet period before a task runs, not null
    public Debouncer(Scheduler scheduler, Duration delay) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.delay = Objects.requireNonNull(delay, "delay must not be null");
    }

    /// Schedules a task for a key, replacing any task still pending for that key.
    ///
    /// @param key debounce key, not null
    /// @param task task to run after the quiet period, not null
    public void submit(K key, Runnable task) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(task, "task must not be null");
        synchronized (pending) {
            Pending previous = pending.remove(key);
            if (previous != null) {
                previous.handle.cancel();
            }
            long token = ++sequence;
            ScheduledTask handle = scheduler.schedule(() -> fire(key, token), delay);
            pending.put(key, new Pending(token, task, handle));
        }
    }

    /// Runs the pending task for a key immediately.
    ///
    /// @param key debounce key, not null
    /// @return true if a task was pending and has run
    public boolean flush(K key) {
        Pending entry;
        synchronized (pending) {
            entry = pending.remove(key);
        }
        if (entry == null) {
            return false;
        }
        entry.handle.cancel();
        entry.task.run();
        return true;
    }

    /// Runs every pending task immediately.
    public void flushAll() {
        List<K> keys;
        synchronized (pending) {
            keys = List.copyOf(pending.keySet());
        }
        keys.forEach(this::flush);
    }

    /// Drops the pending task for a key without running it.
    ///
    /// @param key debounce key, not null
    /// @return true if a task was pending
    public boolean cancel(K key) {
        Pending entry;
        synchronized (pending) {
            entry = pending.remove(key);
        }
        if (entry == null) {
            return false;
        }
        entry.handle.cancel();
        return true;
    }

    /// Drops every pending task without running it.
    public void cancelAll() {
        List<K> keys;
        synchronized (pending) {
            keys = List.copyOf(pending.keySet());
        }
        keys.forEach(this::cancel);
    }

    /// Returns whether a task is waiting for a key.
    ///
    /// @param key debounce key, not null
    /// @return true if a task is pending
    public boolean isPending(K key) {
        synchronized (pending) {
            return pending.containsKey(key);
        }
    }

    private void fire(K key, long token) {
        Pending entry;
        synchronized (pending) {
            entry = pending.get(key);
            // A newer submit replaced this task after the timer fired
            if (entry == null || entry.token != token) {
                return;
            }
            pending.remove(key);
        }
        entry.task.run();
    }

    private record Pending(long token, Runnable task, ScheduledTask handle) {}
}
