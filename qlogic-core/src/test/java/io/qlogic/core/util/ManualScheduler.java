package io.qlogic.core.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/// Deterministic scheduler for tests: tasks run only when the clock is advanced.
public final class ManualScheduler implements Scheduler {

    private final List<Entry> entries = new ArrayList<>();
    private long now;
    private long sequence;

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        Entry entry = new Entry(now + delay.toMillis(), ++sequence, task);
        entries.add(entry);
        return () -> {
            synchronized (ManualScheduler.this) {
                return entries.remove(entry);
            }
        };
    }

    /// Moves the clock forward and runs every task that has become due, in due order.
    public void advance(Duration duration) {
        long target;
        synchronized (this) {
            target = now + duration.toMillis();
        }
        while (true) {
            Entry next;
            synchronized (this) {
                next =
                        entries.stream()
                                .filter(e -> e.dueAt <= target)
                                .min(Comparator.comparingLong(Entry::dueAt)
                                        .thenComparingLong(Entry::sequence))
                                .orElse(null);
                if (next == null) {
                    now = target;
                    return;
                }
                entries.remove(next);
                now = Math.max(now, next.dueAt);
            }
            next.task.run();
        }
    }

    /// Runs every pending task, including tasks scheduled while running.
    public void runAll() {
        advance(Duration.ofDays(1));
    }

    public synchronized int pendingCount() {
        return entries.size();
    }

    private record Entry(long dueAt, long sequence, Runnable task) {}
}
