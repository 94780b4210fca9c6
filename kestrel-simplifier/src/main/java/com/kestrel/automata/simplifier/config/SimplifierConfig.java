/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.simplifier.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings for automaton simplification.
 *
 * <p><b>Properties file ({@code simplifier.properties}):</b>
 * <pre>
 * simplifier.prune.log.weight=-20.0
 * simplifier.max.state.count=200
 * </pre>
 *
 * <p><b>Environment Variable Override:</b>
 * <pre>
 * SIMPLIFIER_PRUNE_LOG_WEIGHT=-20.0
 * SIMPLIFIER_MAX_STATE_COUNT=500
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * SimplifierConfig config = SimplifierConfig.builder()
 *     .pruneLogWeightThreshold(-15.0)
 *     .maxStateCountBeforeSimplification(1_000)
 *     .build();
 *
 * AutomatonSimplifier simplifier = new AutomatonSimplifier(tracer, config);
 * }</pre>
 */
public final class SimplifierConfig {
    private static final Logger logger = Logger.getLogger(SimplifierConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_FILE = "simplifier.properties";

    public static final String ENV_PRUNE_LOG_WEIGHT = "SIMPLIFIER_PRUNE_LOG_WEIGHT";
    public static final String ENV_MAX_STATE_COUNT = "SIMPLIFIER_MAX_STATE_COUNT";

    public static final String PROP_PRUNE_LOG_WEIGHT = "simplifier.prune.log.weight";
    public static final String PROP_MAX_STATE_COUNT = "simplifier.max.state.count";

    public static final int DEFAULT_MAX_STATE_COUNT = 200;

    private final Double pruneLogWeightThreshold;
    private final int maxStateCountBeforeSimplification;

    private SimplifierConfig(Builder builder) {
        this.pruneLogWeightThreshold = builder.pruneLogWeightThreshold;
        this.maxStateCountBeforeSimplification = builder.maxStateCountBeforeSimplification;
        validate();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimplifierConfig defaults() {
        return builder().build();
    }

    /**
     * Creates configuration from environment variables, falling back to defaults.
     */
    public static SimplifierConfig fromEnvironment() {
        Builder builder = builder();
        applyEnvironment(builder);
        return builder.build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE}, then applies environment overrides.
     */
    public static SimplifierConfig load() {
        Builder builder = loadFromProperties(DEFAULT_PROPERTIES_FILE).toBuilder();
        applyEnvironment(builder);
        return builder.build();
    }

    /**
     * Loads configuration from a properties file, looked up on the classpath
     * first and on the file system second. Defaults apply when neither exists.
     *
     * @param propertiesPath Resource name or file path
     */
    public static SimplifierConfig loadFromProperties(String propertiesPath) {
        Properties props = readClasspathResource(propertiesPath)
                .or(() -> readFile(Path.of(propertiesPath)))
                .orElseGet(() -> {
                    logger.warning("No simplifier properties found at " + propertiesPath + ", using defaults");
                    return new Properties();
                });
        return fromProperties(props);
    }

    private static Optional<Properties> readClasspathResource(String resource) {
        try (InputStream in = SimplifierConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            Properties props = new Properties();
            props.load(in);
            logger.info("Simplifier settings: " + props.size() + " properties from classpath resource " + resource);
            return Optional.of(props);
        } catch (IOException e) {
            logger.warning("Failed to read classpath resource " + resource + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<Properties> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            logger.info("Simplifier settings: " + props.size() + " properties from file " + file);
            return Optional.of(props);
        } catch (IOException e) {
            logger.warning("Failed to read " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Creates configuration from already loaded properties. Missing keys keep their defaults.
     */
    public static SimplifierConfig fromProperties(Properties props) {
        Builder builder = builder();

        String pruneLogWeight = props.getProperty(PROP_PRUNE_LOG_WEIGHT);
        if (pruneLogWeight != null && !pruneLogWeight.trim().isEmpty()) {
            builder.pruneLogWeightThreshold(Double.parseDouble(pruneLogWeight.trim()));
        }

        String maxStateCount = props.getProperty(PROP_MAX_STATE_COUNT);
        if (maxStateCount != null && !maxStateCount.trim().isEmpty()) {
            builder.maxStateCountBeforeSimplification(Integer.parseInt(maxStateCount.trim()));
        }

        return builder.build();
    }

    private static void applyEnvironment(Builder builder) {
        getEnv(ENV_PRUNE_LOG_WEIGHT).ifPresent(val -> {
            try {
                builder.pruneLogWeightThreshold(Double.parseDouble(val));
            } catch (NumberFormatException e) {
                logger.warning("Invalid double value for " + ENV_PRUNE_LOG_WEIGHT + ": " + val
                        + ", pruning stays " + (builder.pruneLogWeightThreshold == null ? "disabled" : "at "
                        + builder.pruneLogWeightThreshold));
            }
        });
        getEnv(ENV_MAX_STATE_COUNT).ifPresent(val -> {
            try {
                builder.maxStateCountBeforeSimplification(Integer.parseInt(val));
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + ENV_MAX_STATE_COUNT + ": " + val
                        + ", using: " + builder.maxStateCountBeforeSimplification);
            }
        });
    }

    public Builder toBuilder() {
        return new Builder()
                .pruneLogWeightThreshold(pruneLogWeightThreshold)
                .maxStateCountBeforeSimplification(maxStateCountBeforeSimplification);
    }

    /**
     * Minimum normalized log weight a sequence needs to survive simplification,
     * or {@code null} when pruning is disabled.
     */
    public Double getPruneLogWeightThreshold() {
        return pruneLogWeightThreshold;
    }

    public boolean isPruningEnabled() {
        return pruneLogWeightThreshold != null;
    }

    /**
     * State count above which {@code simplifyIfNeeded} simplifies.
     */
    public int getMaxStateCountBeforeSimplification() {
        return maxStateCountBeforeSimplification;
    }

    private void validate() {
        if (pruneLogWeightThreshold != null && Double.isNaN(pruneLogWeightThreshold)) {
            throw new IllegalArgumentException("pruneLogWeightThreshold must not be NaN");
        }
        if (maxStateCountBeforeSimplification <= 0) {
            throw new IllegalArgumentException(
                    "maxStateCountBeforeSimplification must be positive: " + maxStateCountBeforeSimplification);
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
        return "SimplifierConfig{" +
                "pruneLogWeightThreshold=" + pruneLogWeightThreshold +
                ", maxStateCountBeforeSimplification=" + maxStateCountBeforeSimplification +
                '}';
    }

    public static final class Builder {
        private Double pruneLogWeightThreshold;
        private int maxStateCountBeforeSimplification = DEFAULT_MAX_STATE_COUNT;

        private Builder() {
        }

        /**
         * @param pruneLogWeightThreshold Threshold, or {@code null} to disable pruning
         */
        public Builder pruneLogWeightThreshold(Double pruneLogWeightThreshold) {
            this.pruneLogWeightThreshold = pruneLogWeightThreshold;
            return this;
        }

        public Builder maxStateCountBeforeSimplification(int maxStateCountBeforeSimplification) {
            this.maxStateCountBeforeSimplification = maxStateCountBeforeSimplification;
            return this;
        }

        public SimplifierConfig build() {
            return new SimplifierConfig(this);
        }
    }
}
