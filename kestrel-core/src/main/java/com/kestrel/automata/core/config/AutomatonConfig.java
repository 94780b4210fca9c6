package com.kestrel.automata.core.config;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runtime settings shared by frozen automata.
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * AUTOMATON_CLOSURE_CACHE_SIZE=50000
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AutomatonConfig config = AutomatonConfig.builder()
 *     .closureCacheSize(1_000)
 *     .build();
 *
 * AutomatonBuilder<String, Character, DiscreteDistribution<Character>> builder =
 *     AutomatonBuilder.zero(Alphabets.strings(), config);
 * }</pre>
 */
public final class AutomatonConfig {
    private static final Logger logger = Logger.getLogger(AutomatonConfig.class.getName());

    public static final String ENV_CLOSURE_CACHE_SIZE = "AUTOMATON_CLOSURE_CACHE_SIZE";

    public static final long DEFAULT_CLOSURE_CACHE_SIZE = 10_000;

    private static volatile AutomatonConfig defaults;

    private final long closureCacheSize;

    private AutomatonConfig(Builder builder) {
        this.closureCacheSize = builder.closureCacheSize;
        validate();
    }

    /**
     * Returns the process-wide default configuration, read from the environment once.
     */
    public static AutomatonConfig defaults() {
        AutomatonConfig result = defaults;
        if (result == null) {
            synchronized (AutomatonConfig.class) {
                result = defaults;
                if (result == null) {
                    result = fromEnvironment();
                    defaults = result;
                }
            }
        }
        return result;
    }

    /**
     * Creates configuration from environment variables, falling back to defaults.
     */
    public static AutomatonConfig fromEnvironment() {
        Builder builder = builder();
        getEnv(ENV_CLOSURE_CACHE_SIZE).ifPresent(val -> {
            try {
                builder.closureCacheSize(Long.parseLong(val));
            } catch (NumberFormatException e) {
                logger.warning("Invalid long value for " + ENV_CLOSURE_CACHE_SIZE + ": " + val
                        + ", using default: " + DEFAULT_CLOSURE_CACHE_SIZE);
            }
        });
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().closureCacheSize(closureCacheSize);
    }

    /**
     * Maximum number of epsilon closures cached per automaton.
     */
    public long getClosureCacheSize() {
        return closureCacheSize;
    }

    private void validate() {
        if (closureCacheSize <= 0) {
            throw new IllegalArgumentException("closureCacheSize must be positive: " + closureCacheSize);
        }
    }

    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded env var: " + key + "=" + value);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "AutomatonConfig{closureCacheSize=" + closureCacheSize + '}';
    }

    public static final class Builder {
        private long closureCacheSize = DEFAULT_CLOSURE_CACHE_SIZE;

        private Builder() {
        }

        public Builder closureCacheSize(long closureCacheSize) {
            this.closureCacheSize = closureCacheSize;
            return this;
        }

        public AutomatonConfig build() {
            return new AutomatonConfig(this);
        }
    }
}
