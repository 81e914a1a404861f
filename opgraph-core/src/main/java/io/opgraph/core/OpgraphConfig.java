package io.opgraph.core;

import java.time.Duration;

/// Configuration options for the graph engine.
///
/// ### Default Values
/// - `historyCapacity`: `1000` mutation records kept per variable store
/// - `historyReadLimit`: `50` entries returned when no limit is requested
/// - `iterationParallelism`: `1` (sequential iteration)
/// - `retryAttempts`: `1` attempt per body node, `retryBackoff` `200ms`, `retryMultiplier` `2.0`
/// - `renumberUpdateAttempts`: `3` attempts per store update while renumbering
///
/// @implNote **Not thread-safe**. Configure before passing to {@link OpgraphFactory} and do not
/// modify afterwards.
///
/// @see OpgraphFactory#createEnvironment(OpgraphConfig)
public class OpgraphConfig {
    private int historyCapacity = 1000;
    private int historyReadLimit = 50;
    private int iterationParallelism = 1;
    private int retryAttempts = 1;
    private Duration retryBackoff = Duration.ofMillis(200);
    private double retryMultiplier = 2.0;
    private int renumberUpdateAttempts = 3;

    /// Creates a configuration with default values.
    public OpgraphConfig() {}

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getHistoryReadLimit() {
        return historyReadLimit;
    }

    public void setHistoryReadLimit(int historyReadLimit) {
        this.historyReadLimit = historyReadLimit;
    }

    /// Returns how many iterations of a loop may run at once.
    ///
    /// @return `1` for strictly sequential loops, otherwise the batch size
    public int getIterationParallelism() {
        return iterationParallelism;
    }

    public void setIterationParallelism(int iterationParallelism) {
        this.iterationParallelism = iterationParallelism;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public void setRetryAttempts(int retryAttempts) {
        this.retryAttempts = retryAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    public void setRetryBackoff(Duration retryBackoff) {
        this.retryBackoff = retryBackoff;
    }

    public double getRetryMultiplier() {
        return retryMultiplier;
    }

    public void setRetryMultiplier(double retryMultiplier) {
        this.retryMultiplier = retryMultiplier;
    }

    public int getRenumberUpdateAttempts() {
        return renumberUpdateAttempts;
    }

    public void setRenumberUpdateAttempts(int renumberUpdateAttempts) {
        this.renumberUpdateAttempts = renumberUpdateAttempts;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link OpgraphConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final OpgraphConfig config = new OpgraphConfig();

        public Builder historyCapacity(int historyCapacity) {
            config.historyCapacity = historyCapacity;
            return this;
        }

        public Builder historyReadLimit(int historyReadLimit) {
            config.historyReadLimit = historyReadLimit;
            return this;
        }

        /// Sets the iteration batch size.
        ///
        /// @param iterationParallelism iterations run at once, must be positive
        /// @return this builder for chaining, never null
        public Builder iterationParallelism(int iterationParallelism) {
            config.iterationParallelism = iterationParallelism;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            config.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryBackoff(Duration retryBackoff) {
            config.retryBackoff = retryBackoff;
            return this;
        }

        public Builder retryMultiplier(double retryMultiplier) {
            config.retryMultiplier = retryMultiplier;
            return this;
        }

        public Builder renumberUpdateAttempts(int renumberUpdateAttempts) {
            config.renumberUpdateAttempts = renumberUpdateAttempts;
            return this;
        }

        /// Builds and returns the configured {@link OpgraphConfig} instance.
        ///
        /// @return the configuration, never null
        public OpgraphConfig build() {
            return config;
        }
    }
}
