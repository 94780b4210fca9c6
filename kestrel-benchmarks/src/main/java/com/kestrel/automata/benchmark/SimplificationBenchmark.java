package com.kestrel.automata.benchmark;

import com.kestrel.automata.api.Weight;
import com.kestrel.automata.core.builder.AutomatonBuilder;
import com.kestrel.automata.core.distributions.DiscreteDistribution;
import com.kestrel.automata.core.model.Alphabets;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.simplifier.AutomatonSimplifier;
import com.kestrel.automata.simplifier.config.SimplifierConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Simplification and composition benchmark.
 * <p>
 * Builds a dictionary automaton of random words with one epsilon branch per
 * word, then measures trie simplification, appending a looping suffix
 * automaton, and dead-state removal.
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer and shorter iterations
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class SimplificationBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final Tracer NOOP_TRACER = OpenTelemetry.noop().getTracer("benchmark");

    @Param({"100", "1000"})
    private int wordCount;

    private Automaton<String, Character, DiscreteDistribution<Character>> dictionary;
    private Automaton<String, Character, DiscreteDistribution<Character>> suffix;
    private AutomatonSimplifier simplifier;

    @Setup(Level.Trial)
    public void setupTrial() {
        // Suppress logs for clean output
        java.util.logging.Logger.getLogger("com.kestrel.automata").setLevel(java.util.logging.Level.WARNING);

        List<String> words = EvaluationBenchmark.randomWords(new Random(42), wordCount, 8);
        var builder = AutomatonBuilder.zero(Alphabets.strings());
        for (String word : words) {
            builder.getStart()
                    .addEpsilonTransition(Weight.fromValue(1.0 / wordCount))
                    .addTransitionsForSequence(word)
                    .setEndWeight(Weight.ONE);
        }
        dictionary = builder.getAutomaton();

        var suffixBuilder = AutomatonBuilder.zero(Alphabets.strings());
        suffixBuilder.getStart().addSelfTransition('s', Weight.fromValue(0.5));
        suffixBuilder.getStart().setEndWeight(Weight.fromValue(0.5));
        suffix = suffixBuilder.getAutomaton();

        simplifier = new AutomatonSimplifier(NOOP_TRACER, SimplifierConfig.defaults());
    }

    @Benchmark
    public Automaton<String, Character, DiscreteDistribution<Character>> simplify() {
        return simplifier.simplify(dictionary);
    }

    @Benchmark
    public Automaton<String, Character, DiscreteDistribution<Character>> appendAndSimplify() {
        var builder = AutomatonBuilder.fromAutomaton(dictionary);
        builder.append(suffix);
        return simplifier.simplify(builder.getAutomaton());
    }

    @Benchmark
    public Automaton<String, Character, DiscreteDistribution<Character>> removeDeadStates() {
        return simplifier.removeDeadStates(dictionary);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(SimplificationBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();

        new Runner(opt).run();
    }
}
