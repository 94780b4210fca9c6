/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.simplifier;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.SimplificationListener;
import com.kestrel.automata.core.builder.AutomatonBuilder;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.simplifier.config.SimplifierConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Simplifies frozen automata by running a {@link Simplification} on a private
 * builder copy.
 *
 * <p>Every operation is traced with its own span carrying the state counts
 * before and after, and reports its phases to the optional
 * {@link SimplificationListener}. The input automaton is never modified; when
 * an operation changes nothing the input is returned as is.
 *
 * <p>Instances are thread-safe as long as the listener is set before use.
 */
public class AutomatonSimplifier implements IAutomatonSimplifier {
    private static final Logger logger = Logger.getLogger(AutomatonSimplifier.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.kestrel.automata";

    private final Tracer tracer;
    private final SimplifierConfig config;
    private volatile SimplificationListener listener;

    public AutomatonSimplifier() {
        this(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME), SimplifierConfig.load());
    }

    public AutomatonSimplifier(Tracer tracer) {
        this(tracer, SimplifierConfig.load());
    }

    public AutomatonSimplifier(Tracer tracer, SimplifierConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "tracer cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public SimplifierConfig getConfig() {
        return config;
    }

    @Override
    public void setSimplificationListener(SimplificationListener listener) {
        this.listener = listener;
    }

    @Override
    public <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> simplify(Automaton<S, E, D> automaton) {
        return run("simplify-automaton", automaton, Simplification::simplify);
    }

    @Override
    public <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> simplifyIfNeeded(
            Automaton<S, E, D> automaton) {
        return run("simplify-automaton", automaton, Simplification::simplifyIfNeeded);
    }

    @Override
    public <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> removeDeadStates(
            Automaton<S, E, D> automaton) {
        return run("remove-dead-states", automaton, Simplification::removeDeadStates);
    }

    @Override
    public <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> removeTransitionsWithSmallWeights(
            Automaton<S, E, D> automaton, double logWeightThreshold) {
        return run("prune-transitions", automaton,
                simplification -> simplification.removeTransitionsWithSmallWeights(logWeightThreshold));
    }

    @FunctionalInterface
    private interface Operation<S, E, D extends ElementDistribution<E, D>> {
        boolean apply(Simplification<S, E, D> simplification);
    }

    private <S, E, D extends ElementDistribution<E, D>> Automaton<S, E, D> run(
            String spanName, Automaton<S, E, D> automaton, Operation<S, E, D> operation) {
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            Objects.requireNonNull(automaton, "automaton cannot be null");
            span.setAttribute("stateCountBefore", automaton.getStateCount());

            AutomatonBuilder<S, E, D> builder = AutomatonBuilder.fromAutomaton(automaton);
            Simplification<S, E, D> simplification = new Simplification<>(builder, config);
            simplification.setListener(listener);

            long startTime = System.nanoTime();
            boolean changed = operation.apply(simplification);
            Automaton<S, E, D> result = changed ? builder.getAutomaton() : automaton;
            long durationMicros = (System.nanoTime() - startTime) / 1_000;

            span.setAttribute("stateCountAfter", result.getStateCount());
            span.setAttribute("sequenceCount", simplification.getLastSequenceCount());
            span.setAttribute("changed", changed);

            if (changed) {
                logger.info(String.format("%s: %d -> %d states in %d us",
                        spanName, automaton.getStateCount(), result.getStateCount(), durationMicros));
            } else {
                logger.fine(spanName + ": automaton with " + automaton.getStateCount() + " states left unchanged");
            }
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
