package io.pipewright.core;

import io.pipewright.core.execution.StatePersistence;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Configuration options for the pipeline execution engine.
///
/// Controls how many stages of one run may execute concurrently and when
/// successful stage outputs are written to the state store. Use the
/// {@link Builder} for fluent configuration, {@link #fromProperties(Map)} for
/// externally supplied settings, or construct directly with setters.
///
/// ### Default Values
/// - `maxParallelism`: `4`
/// - `statePersistence`: {@link StatePersistence#IMMEDIATE}
///
/// ### Property Keys
/// - `pipewright.engine.max-parallelism`
/// - `pipewright.engine.state-persistence` (`immediate` or `on-run-success`)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link PipewrightFactory}.
/// Do not modify after environment creation.
///
/// @see PipewrightFactory#createEnvironment(EngineConfig)
public class EngineConfig {

    public static final String MAX_PARALLELISM_KEY = "pipewright.engine.max-parallelism";
    public static final String STATE_PERSISTENCE_KEY = "pipewright.engine.state-persistence";

    private int maxParallelism = 4;
    private StatePersistence statePersistence = StatePersistence.IMMEDIATE;

    /// Creates a configuration with default values.
    public EngineConfig() {}

    /// Returns the maximum number of stages of one run executing at once.
    ///
    /// @return positive parallelism bound
    public int getMaxParallelism() {
        return maxParallelism;
    }

    /// Sets the maximum number of stages of one run executing at once.
    ///
    /// @param maxParallelism the bound, must be positive
    /// @throws IllegalArgumentException if `maxParallelism` is not positive
    public void setMaxParallelism(int maxParallelism) {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException(
                    "maxParallelism must be positive, got " + maxParallelism);
        }
        this.maxParallelism = maxParallelism;
    }

    /// Returns when stage outputs are written to the state store.
    ///
    /// @return persistence policy, never null
    public StatePersistence getStatePersistence() {
        return statePersistence;
    }

    /// Sets when stage outputs are written to the state store.
    ///
    /// @param statePersistence persistence policy, not null
    public void setStatePersistence(StatePersistence statePersistence) {
        this.statePersistence =
                Objects.requireNonNull(statePersistence, "statePersistence must not be null");
    }

    /// Reads a configuration from `pipewright.engine.*` properties.
    ///
    /// Unknown keys are ignored and absent keys keep their default.
    ///
    /// @param properties flat key/value settings, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static EngineConfig fromProperties(Map<String, String> properties) {
        EngineConfig config = new EngineConfig();
        String parallelism = properties.get(MAX_PARALLELISM_KEY);
        if (parallelism != null) {
            try {
                config.setMaxParallelism(Integer.parseInt(parallelism.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Invalid " + MAX_PARALLELISM_KEY + ": '" + parallelism + "'", e);
            }
        }
        String persistence = properties.get(STATE_PERSISTENCE_KEY);
        if (persistence != null) {
            String constant = persistence.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            try {
                config.setStatePersistence(StatePersistence.valueOf(constant));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid " + STATE_PERSISTENCE_KEY + ": '" + persistence + "'", e);
            }
        }
        return config;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link EngineConfig} instances.
    public static class Builder {
        private final EngineConfig config = new EngineConfig();

        /// Sets the maximum number of concurrently executing stages.
        ///
        /// @param maxParallelism the bound, must be positive
        /// @return this builder for chaining, never null
        public Builder maxParallelism(int maxParallelism) {
            config.setMaxParallelism(maxParallelism);
            return this;
        }

        /// Sets the state persistence policy.
        ///
        /// @param statePersistence policy, not null
        /// @return this builder for chaining, never null
        public Builder statePersistence(StatePersistence statePersistence) {
            config.setStatePersistence(statePersistence);
            return this;
        }

        /// Returns the configured instance.
        ///
        /// @return the configured instance, never null
        public EngineConfig build() {
            return config;
        }
    }
}
