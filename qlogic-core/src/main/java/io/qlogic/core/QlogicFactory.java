package io.qlogic.core;

import io.qlogic.core.evaluation.FlowEvaluator;
import io.qlogic.core.logic.LogicTreeCodec;
import io.qlogic.core.persistence.AnswerStore;
import io.qlogic.core.persistence.InMemoryAnswerStore;
import io.qlogic.core.persistence.InMemoryQuestionPersistence;
import io.qlogic.core.persistence.QuestionPersistence;
import io.qlogic.core.util.ExecutorScheduler;
import io.qlogic.core.util.Scheduler;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Factory for creating and wiring qlogic environments.
///
/// ### Usage
/// {@snippet :
/// try (QlogicEnvironment env =
///         QlogicFactory.createEnvironment(QlogicConfig.builder().pageSize(10).build(), codec)) {
///     TreeEditor editor = env.openEditor("group-1", "household", LogicTree.empty(), List.of());
/// }
/// }
///
/// @implNote Utility class with only static methods. All dependencies are wired explicitly
/// via constructor injection.
///
/// @see QlogicEnvironment
/// @see QlogicConfig
public final class QlogicFactory {

    private QlogicFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment backed by in-memory collaborators.
    ///
    /// @param config configuration options, not null
    /// @param codec logic tree codec, not null
    /// @return a fully-configured environment, never null
    public static QlogicEnvironment createEnvironment(QlogicConfig config, LogicTreeCodec codec) {
        return createEnvironment(
                config, codec, new InMemoryQuestionPersistence(), new InMemoryAnswerStore());
    }

    /// Creates an environment with explicit collaborators and a scheduler thread pool sized
    /// by the configuration.
    ///
    /// @apiNote **Side effects**: creates a scheduled thread pool owned by the environment.
    ///
    /// @param config configuration options, not null
    /// @param codec logic tree codec, not null
    /// @param persistence question persistence collaborator, not null
    /// @param answerStore answer store collaborator, not null
    /// @return a fully-configured environment, never null
    public static QlogicEnvironment createEnvironment(
            QlogicConfig config,
            LogicTreeCodec codec,
            QuestionPersistence persistence,
            AnswerStore answerStore) {
        ScheduledExecutorService executor =
                Executors.newScheduledThreadPool(
                        Math.max(1, config.getSchedulerThreads()), daemonThreads());
        return createEnvironment(
                config, codec, persistence, answerStore, new ExecutorScheduler(executor));
    }

    /// Creates an environment with a caller-supplied scheduler.
    ///
    /// Useful for tests driving debounce timers manually.
    ///
    /// @param config configuration options, not null
    /// @param codec logic tree codec, not null
    /// @param persistence question persistence collaborator, not null
    /// @param answerStore answer store collaborator, not null
    /// @param scheduler timer for debounced work, not null
    /// @return a fully-configured environment, never null
    public static QlogicEnvironment createEnvironment(
            QlogicConfig config,
            LogicTreeCodec codec,
            QuestionPersistence persistence,
            AnswerStore answerStore,
            Scheduler scheduler) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(codec, "codec must not be null");
        Objects.requireNonNull(persistence, "persistence must not be null");
        Objects.requireNonNull(answerStore, "answerStore must not be null");
        Objects.requireNonNull(scheduler, "scheduler must not be null");

        FlowEvaluator evaluator = new FlowEvaluator(config.getPageSize());
        return new QlogicEnvironment(config, codec, persistence, answerStore, evaluator, scheduler);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "qlogic-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
