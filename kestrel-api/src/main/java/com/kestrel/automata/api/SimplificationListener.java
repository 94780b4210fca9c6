/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.api;

import java.util.Map;

/**
 * Callback interface for simplification phase events.
 * Allows monitoring code to track how much an automaton shrinks and where time goes.
 *
 * <p>A full simplification runs these phases:
 * <ol>
 *   <li>MERGE_PARALLEL - Merge transitions sharing source, destination and group</li>
 *   <li>LABEL - Find the generalized-tree part of the automaton</li>
 *   <li>EXTRACT - Collect the accepted generalized sequences of the tree part</li>
 *   <li>REBUILD - Copy the non-tree part and reinsert the sequences as a trie</li>
 * </ol>
 * Dead-state removal and weight pruning report a single phase each.
 *
 * <h2>Usage</h2>
 * <pre>
 * SimplificationListener listener = new SimplificationListener() {
 *     {@literal @}Override
 *     public void onPhaseStart(String phaseName, int stateCount) {
 *         System.out.printf("Starting %s on %d states%n", phaseName, stateCount);
 *     }
 *
 *     {@literal @}Override
 *     public void onPhaseComplete(String phaseName, PhaseResult result) {
 *         System.out.printf("Completed %s in %d us%n", phaseName, result.durationMicros());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String phaseName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", phaseName, error.getMessage());
 *     }
 * };
 *
 * AutomatonSimplifier simplifier = new AutomatonSimplifier(tracer, config);
 * simplifier.setSimplificationListener(listener);
 * </pre>
 */
public interface SimplificationListener {

    /**
     * Called when a phase starts.
     *
     * @param phaseName Name of the phase (e.g., "LABEL", "REBUILD")
     * @param stateCount Number of states before the phase runs
     */
    void onPhaseStart(String phaseName, int stateCount);

    /**
     * Called when a phase completes successfully.
     *
     * @param phaseName Name of the phase
     * @param result Result containing duration and phase-specific metrics
     */
    void onPhaseComplete(String phaseName, PhaseResult result);

    /**
     * Called when a phase fails.
     *
     * @param phaseName Name of the phase that failed
     * @param error The exception that occurred
     */
    void onError(String phaseName, Exception error);

    /**
     * Result of a single simplification phase.
     *
     * @param phaseName Name of the phase
     * @param durationNanos Duration in nanoseconds
     * @param changed Whether the phase modified the automaton
     * @param metrics Phase-specific metrics (e.g., "stateCountAfter", "sequenceCount")
     */
    record PhaseResult(
        String phaseName,
        long durationNanos,
        boolean changed,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        /**
         * Returns the duration in microseconds.
         */
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
