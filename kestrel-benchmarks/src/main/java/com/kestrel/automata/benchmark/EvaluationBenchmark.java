package com.kestrel.automata.benchmark;

import com.kestrel.automata.api.Weight;
import com.kestrel.automata.core.builder.AutomatonBuilder;
import com.kestrel.automata.core.distributions.DiscreteDistribution;
import com.kestrel.automata.core.model.Alphabets;
import com.kestrel.automata.core.model.Automaton;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Sequence evaluation benchmark.
 * <p>
 * Measures {@code Automaton.getLogValue} over a random dictionary automaton,
 * once in its epsilon-rich composed form and once epsilon-free, so the cost
 * of epsilon closures shows up as the difference between the two.
 * <p>
 * USAGE:
 * mvn clean package -pl kestrel-benchmarks -am -DskipTests
 * java -cp kestrel-benchmarks/target/classes:... com.kestrel.automata.benchmark.EvaluationBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : fewer and shorter iterations
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 3)
public class EvaluationBenchmark {

    private static final boolean QUICK_MODE = Boolean.getBoolean("bench.quick");
    private static final String ALPHABET = "abcdefghij";

    @Param({"100", "1000"})
    private int wordCount;

    @Param({"8"})
    private int maxWordLength;

    private Automaton<String, Character, DiscreteDistribution<Character>> withEpsilons;
    private Automaton<String, Character, DiscreteDistribution<Character>> epsilonFree;
    private List<String> queries;
    private int queryIndex;

    @Setup(Level.Trial)
    public void setupTrial() {
        // Suppress logs for clean output
        java.util.logging.Logger.getLogger("com.kestrel.automata").setLevel(java.util.logging.Level.WARNING);

        Random rand = new Random(42);
        List<String> words = randomWords(rand, wordCount, maxWordLength);

        var branching = AutomatonBuilder.zero(Alphabets.strings());
        var chains = AutomatonBuilder.zero(Alphabets.strings());
        for (String word : words) {
            Weight weight = Weight.fromValue(1.0 / wordCount);
            branching.getStart().addEpsilonTransition(weight).addTransitionsForSequence(word).setEndWeight(Weight.ONE);
            chains.getStart().addTransitionsForSequence(word).setEndWeight(weight);
        }
        withEpsilons = branching.getAutomaton();
        epsilonFree = chains.getAutomaton();

        // Half known words, half random strings
        queries = new ArrayList<>(words.subList(0, Math.min(words.size(), 500)));
        queries.addAll(randomWords(rand, queries.size(), maxWordLength));
    }

    @Benchmark
    public double evaluate_withEpsilons() {
        return withEpsilons.getLogValue(nextQuery());
    }

    @Benchmark
    public double evaluate_epsilonFree() {
        return epsilonFree.getLogValue(nextQuery());
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public void evaluate_allQueries(Blackhole bh) {
        for (String query : queries) {
            bh.consume(withEpsilons.getLogValue(query));
        }
    }

    private String nextQuery() {
        String query = queries.get(queryIndex);
        queryIndex = (queryIndex + 1) % queries.size();
        return query;
    }

    static List<String> randomWords(Random rand, int count, int maxLength) {
        List<String> words = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int length = 1 + rand.nextInt(maxLength);
            StringBuilder sb = new StringBuilder(length);
            for (int j = 0; j < length; j++) {
                sb.append(ALPHABET.charAt(rand.nextInt(ALPHABET.length())));
            }
            words.add(sb.toString());
        }
        return words;
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(EvaluationBenchmark.class.getSimpleName())
                .warmupIterations(QUICK_MODE ? 2 : 5)
                .warmupTime(TimeValue.seconds(QUICK_MODE ? 1 : 2))
                .measurementIterations(QUICK_MODE ? 3 : 10)
                .measurementTime(TimeValue.seconds(QUICK_MODE ? 1 : 3))
                .shouldFailOnError(true)
                .build();

        new Runner(opt).run();
    }
}
