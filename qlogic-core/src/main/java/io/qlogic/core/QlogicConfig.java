package io.qlogic.core;

import java.time.Duration;

/// Configuration options for the qlogic editing and session environment.
///
/// Controls debounce timing, paging and the scheduler thread pool. Use the {@link Builder}
/// for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `autosaveDelay`: 1000ms (content autosave debounce per question)
/// - `identifierCheckDelay`: 500ms (remote identifier check debounce per question)
/// - `pageSize`: 5 questions per session page
/// - `schedulerThreads`: 1
///
/// @implNote **Not thread-safe**. Configure before passing to {@link QlogicFactory}; do not
/// modify after environment creation.
///
/// @see QlogicFactory#createEnvironment(QlogicConfig, io.qlogic.core.logic.LogicTreeCodec)
public class QlogicConfig {
    private Duration autosaveDelay = Duration.ofMillis(1000);
    private Duration identifierCheckDelay = Duration.ofMillis(500);
    private int pageSize = 5;
    private int schedulerThreads = 1;

    /// Creates a configuration with default values.
    public QlogicConfig() {}

    /// Returns how long a question must be left unedited before its content is saved.
    ///
    /// @return debounce delay, never null
    public Duration getAutosaveDelay() {
        return autosaveDelay;
    }

    public void setAutosaveDelay(Duration autosaveDelay) {
        this.autosaveDelay = autosaveDelay;
    }

    /// Returns how long an identifier must be left unedited before it is checked remotely.
    ///
    /// @return debounce delay, never null
    public Duration getIdentifierCheckDelay() {
        return identifierCheckDelay;
    }

    public void setIdentifierCheckDelay(Duration identifierCheckDelay) {
        this.identifierCheckDelay = identifierCheckDelay;
    }

    /// Returns the number of questions per session page.
    ///
    /// @return page size, positive
    public int getPageSize() {
        return pageSize;
    }

    /// Sets the number of questions per session page.
    ///
    /// ### Contracts
    /// - **Precondition**: `pageSize` should be positive
    ///
    /// @param pageSize questions per page
    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link QlogicConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final QlogicConfig config = new QlogicConfig();

        public Builder autosaveDelay(Duration autosaveDelay) {
            config.autosaveDelay = autosaveDelay;
            return this;
        }

        public Builder identifierCheckDelay(Duration identifierCheckDelay) {
            config.identifierCheckDelay = identifierCheckDelay;
            return this;
        }

        public Builder pageSize(int pageSize) {
            config.pageSize = pageSize;
            return this;
        }

        public Builder schedulerThreads(int schedulerThreads) {
            config.schedulerThreads = schedulerThreads;
            return this;
        }

        /// Builds and returns the configured {@link QlogicConfig} instance.
        ///
        /// @return the configured instance, never null
        public QlogicConfig build() {
            return config;
        }
    }
}
