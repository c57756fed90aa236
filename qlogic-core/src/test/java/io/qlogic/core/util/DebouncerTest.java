package io.qlogic.core.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebouncerTest {

    private ManualScheduler scheduler;
    private Debouncer<String> debouncer;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        scheduler = new ManualScheduler();
        debouncer = new Debouncer<>(scheduler, Duration.ofMillis(100));
        fired = new ArrayList<>();
    }

    @Test
    void shouldRunOnlyLatestTaskPerKey() {
        debouncer.submit("a", () -> fired.add("a1"));
        scheduler.advance(Duration.ofMillis(50));
        debouncer.submit("a", () -> fired.add("a2"));
        scheduler.advance(Duration.ofMillis(60));

        assertThat(fired).isEmpty();

        scheduler.advance(Duration.ofMillis(40));

        assertThat(fired).containsExactly("a2");
        assertThat(debouncer.isPending("a")).isFalse();
    }

    @Test
    void shouldKeepKeysIndependent() {
        debouncer.submit("a", () -> fired.add("a"));
        debouncer.submit("b", () -> fired.add("b"));

        scheduler.runAll();

        assertThat(fired).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void shouldRunImmediatelyOnFlush() {
        debouncer.submit("a", () -> fired.add("a"));

        assertThat(debouncer.flush("a")).isTrue();
        assertThat(fired).containsExactly("a");

        scheduler.runAll();
        assertThat(fired).containsExactly("a");
        assertThat(debouncer.flush("a")).isFalse();
    }

    @Test
    void shouldFlushAllPendingKeys() {
        debouncer.submit("a", () -> fired.add("a"));
        debouncer.submit("b", () -> fired.add("b"));

        debouncer.flushAll();

        assertThat(fired).containsExactlyInAnyOrder("a", "b");
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void shouldDropCancelledTask() {
        debouncer.submit("a", () -> fired.add("a"));

        assertThat(debouncer.cancel("a")).isTrue();
        scheduler.runAll();

        assertThat(fired).isEmpty();
        assertThat(debouncer.cancel("a")).isFalse();
    }

    @Test
    void shouldCancelAllKeys() {
        debouncer.submit("a", () -> fired.add("a"));
        debouncer.submit("b", () -> fired.add("b"));

        debouncer.cancelAll();
        scheduler.runAll();

        assertThat(fired).isEmpty();
    }
}
