package com.kestrel.automata.simplifier;

import com.kestrel.automata.api.Weight;
import com.kestrel.automata.core.builder.AutomatonBuilder;
import com.kestrel.automata.core.distributions.DiscreteDistribution;
import com.kestrel.automata.core.model.Alphabet;
import com.kestrel.automata.core.model.Alphabets;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.Transition;
import com.kestrel.automata.simplifier.config.SimplifierConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimplificationTest {

    private static final Alphabet<String, Character, DiscreteDistribution<Character>> STRINGS = Alphabets.strings();

    private static AutomatonBuilder<String, Character, DiscreteDistribution<Character>> emptyBuilder() {
        return AutomatonBuilder.zero(STRINGS);
    }

    private static Simplification<String, Character, DiscreteDistribution<Character>> simplification(
            AutomatonBuilder<String, Character, DiscreteDistribution<Character>> builder) {
        return new Simplification<>(builder, SimplifierConfig.defaults());
    }

    private static long countTransitionsOn(
            Automaton<String, Character, DiscreteDistribution<Character>> automaton, int stateIndex, char symbol) {
        return automaton.getState(stateIndex).getTransitions().stream()
                .filter(t -> !t.isEpsilon() && t.elementDistribution().equals(DiscreteDistribution.pointMass(symbol)))
                .count();
    }

    @Nested
    @DisplayName("simplify")
    class Simplify {

        @Test
        @DisplayName("Should collapse duplicate branches into one path with summed end weight")
        void shouldMergeIdenticalSequences() {
            var builder = emptyBuilder();
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.fromValue(0.3));
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.fromValue(0.3));

            boolean changed = simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(changed).isTrue();
            assertThat(result.getStateCount()).isEqualTo(3);
            assertThat(result.getTransitionCount()).isEqualTo(2);
            assertThat(result.getLogValue("ab")).isCloseTo(Math.log(0.6), within(1e-12));
        }

        @Test
        @DisplayName("Should share common prefixes")
        void shouldSharePrefixes() {
            var builder = emptyBuilder();
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.fromValue(0.5));
            builder.getStart().addTransitionsForSequence("ac").setEndWeight(Weight.fromValue(0.25));

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(result.getStateCount()).isEqualTo(4);
            assertThat(countTransitionsOn(result, result.getStartStateIndex(), 'a')).isEqualTo(1);
            assertThat(result.getLogValue("ab")).isCloseTo(Math.log(0.5), within(1e-12));
            assertThat(result.getLogValue("ac")).isCloseTo(Math.log(0.25), within(1e-12));
        }

        @Test
        @DisplayName("Should branch instead of sharing a state whose self-loop differs")
        void shouldNotShareStatesWithDifferentSelfLoops() {
            var builder = emptyBuilder();
            var first = builder.getStart().addTransition('a', Weight.ONE);
            first.addSelfTransition('x', Weight.fromValue(0.5));
            first.addTransition('b', Weight.ONE).setEndWeight(Weight.ONE);
            var second = builder.getStart().addTransition('a', Weight.ONE);
            second.addSelfTransition('y', Weight.fromValue(0.5));
            second.addTransition('c', Weight.ONE).setEndWeight(Weight.ONE);

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(result.getStateCount()).isEqualTo(5);
            assertThat(countTransitionsOn(result, result.getStartStateIndex(), 'a')).isEqualTo(2);
            assertThat(result.getLogValue("ab")).isCloseTo(0.0, within(1e-12));
            assertThat(result.getLogValue("axxb")).isCloseTo(Math.log(0.25), within(1e-12));
            assertThat(result.getLogValue("ayc")).isCloseTo(Math.log(0.5), within(1e-12));
            assertThat(result.getLogValue("axc")).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @Test
        @DisplayName("Should share a state whose self-loop matches")
        void shouldShareMatchingSelfLoops() {
            var builder = emptyBuilder();
            var first = builder.getStart().addTransition('a', Weight.ONE);
            first.addSelfTransition('x', Weight.fromValue(0.5));
            first.addTransition('b', Weight.ONE).setEndWeight(Weight.ONE);
            var second = builder.getStart().addTransition('a', Weight.ONE);
            second.addSelfTransition('x', Weight.fromValue(0.5));
            second.addTransition('c', Weight.ONE).setEndWeight(Weight.ONE);

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(result.getStateCount()).isEqualTo(4);
            assertThat(result.getLogValue("axb")).isCloseTo(Math.log(0.5), within(1e-12));
            assertThat(result.getLogValue("axxc")).isCloseTo(Math.log(0.25), within(1e-12));
        }

        @Test
        @DisplayName("Should split the start state when a sequence cannot be merged at the root")
        void shouldBranchStartState() {
            var builder = emptyBuilder();
            builder.getStart().setEndWeight(Weight.fromValue(0.2));
            var looping = builder.getStart().addEpsilonTransition(Weight.ONE);
            looping.addSelfTransition('x', Weight.fromValue(0.5));
            looping.setEndWeight(Weight.ONE);

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(result.getStateCount()).isEqualTo(3);
            assertThat(result.getStartStateIndex()).isEqualTo(1);
            assertThat(result.getLogValue("")).isCloseTo(Math.log(1.2), within(1e-12));
            assertThat(result.getLogValue("xx")).isCloseTo(Math.log(0.25), within(1e-12));
        }

        @Test
        @DisplayName("Should fold epsilon transitions of the tree part into sequence weights")
        void shouldRemoveEpsilonTransitionsFromTreePart() {
            var builder = emptyBuilder();
            builder.getStart().addEpsilonTransition(Weight.fromValue(0.5))
                    .addTransition('a', Weight.ONE)
                    .setEndWeight(Weight.ONE);

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(result.getStateCount()).isEqualTo(2);
            assertThat(result.isEpsilonFree()).isTrue();
            assertThat(result.getLogValue("a")).isCloseTo(Math.log(0.5), within(1e-12));
        }

        @Test
        @DisplayName("Should copy shared states and only rebuild the tree part")
        void shouldCopyNonTreePart() {
            var builder = emptyBuilder();
            var start = builder.getStart();
            var viaA = start.addTransition('a', Weight.ONE);
            var shared = viaA.addTransition('b', Weight.ONE);
            shared.setEndWeight(Weight.ONE);
            start.addTransition('c', Weight.ONE).addTransition('b', Weight.ONE, shared.getIndex(), 0);
            builder.getStart().addTransitionsForSequence("de").setEndWeight(Weight.fromValue(0.5));
            builder.getStart().addTransitionsForSequence("df").setEndWeight(Weight.fromValue(0.25));
            var before = builder.getAutomaton();

            simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(countTransitionsOn(result, result.getStartStateIndex(), 'd')).isEqualTo(1);
            for (String sequence : new String[] { "ab", "cb", "de", "df" }) {
                assertThat(result.getLogValue(sequence))
                        .as(sequence)
                        .isCloseTo(before.getLogValue(sequence), within(1e-12));
            }
            assertThat(result.getLogValue("d")).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @Test
        @DisplayName("Should keep states with several self-loops as they are")
        void shouldCopyStatesWithSeveralSelfLoops() {
            var builder = emptyBuilder();
            var looping = builder.getStart().addTransition('a', Weight.ONE);
            looping.addSelfTransition('x', Weight.fromValue(0.5), 1);
            looping.addSelfTransition('y', Weight.fromValue(0.5), 2);
            looping.setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(changed).isTrue();
            assertThat(result.getStateCount()).isEqualTo(2);
            assertThat(result.getLogValue("axy")).isCloseTo(Math.log(0.25), within(1e-12));
        }

        @Test
        @DisplayName("Should refuse automata with loops over several transitions")
        void shouldRefuseNonTrivialLoops() {
            var builder = emptyBuilder();
            var second = builder.getStart().addTransition('a', Weight.ONE);
            second.addTransition('b', Weight.ONE, builder.getStartStateIndex(), 0);
            second.setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).simplify();

            assertThat(changed).isFalse();
            assertThat(builder.getStatesCount()).isEqualTo(2);
            assertThat(builder.getAutomaton().getLogValue("aba")).isCloseTo(0.0, within(1e-12));
        }

        @Test
        @DisplayName("Should refuse a start state with several self-loops")
        void shouldRefuseStartWithSeveralSelfLoops() {
            var builder = emptyBuilder();
            builder.getStart().addSelfTransition('x', Weight.fromValue(0.5), 1);
            builder.getStart().addSelfTransition('y', Weight.fromValue(0.5), 2);
            builder.getStart().setEndWeight(Weight.ONE);

            assertThat(simplification(builder).simplify()).isFalse();
        }

        @Test
        @DisplayName("Should leave parallel transitions unmerged when refusing an automaton with loops")
        void shouldNotMergeWhenRefusing() {
            var builder = emptyBuilder();
            var second = builder.getStart().addTransition('a', Weight.fromValue(0.5));
            builder.getStart().addTransition('c', Weight.fromValue(0.5), second.getIndex(), 0);
            second.addTransition('b', Weight.ONE, builder.getStartStateIndex(), 0);
            second.setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(changed).isFalse();
            assertThat(result.getTransitionCount()).isEqualTo(3);
            assertThat(countTransitionsOn(result, result.getStartStateIndex(), 'a')).isEqualTo(1);
            assertThat(countTransitionsOn(result, result.getStartStateIndex(), 'c')).isEqualTo(1);
        }

        @Test
        @DisplayName("Should simplify when the start self-loops merge into one")
        void shouldSimplifyStartWithMergeableSelfLoops() {
            var builder = emptyBuilder();
            builder.getStart().addSelfTransition('x', Weight.fromValue(0.25));
            builder.getStart().addSelfTransition('y', Weight.fromValue(0.25));
            builder.getStart().setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).simplify();
            var result = builder.getAutomaton();

            assertThat(changed).isTrue();
            assertThat(result.getStateCount()).isEqualTo(1);
            assertThat(result.getTransitionCount()).isEqualTo(1);
            assertThat(result.getLogValue("xy")).isCloseTo(Math.log(0.0625), within(1e-12));
        }

        @Test
        @DisplayName("Should drop sequences below the normalized pruning threshold")
        void shouldPruneLightSequences() {
            var builder = emptyBuilder();
            builder.getStart().addTransition('a', Weight.fromValue(0.9)).setEndWeight(Weight.ONE);
            builder.getStart().addTransition('b', Weight.fromValue(0.1)).setEndWeight(Weight.ONE);

            var simplification = new Simplification<>(builder, Math.log(0.5), 200);
            simplification.simplify();
            var result = builder.getAutomaton();

            assertThat(simplification.getLastSequenceCount()).isEqualTo(1);
            assertThat(result.getStateCount()).isEqualTo(2);
            assertThat(result.getLogValue("a")).isCloseTo(Math.log(0.9), within(1e-12));
            assertThat(result.getLogValue("b")).isEqualTo(Double.NEGATIVE_INFINITY);
        }
    }

    @Nested
    @DisplayName("simplifyIfNeeded")
    class SimplifyIfNeeded {

        @Test
        @DisplayName("Should leave small automata alone")
        void shouldSkipSmallAutomata() {
            var builder = emptyBuilder();
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.ONE);
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.ONE);

            boolean changed = new Simplification<>(builder, null, 200).simplifyIfNeeded();

            assertThat(changed).isFalse();
            assertThat(builder.getStatesCount()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should simplify automata above the state limit")
        void shouldSimplifyLargeAutomata() {
            var builder = emptyBuilder();
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.ONE);
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.ONE);

            boolean changed = new Simplification<>(builder, null, 4).simplifyIfNeeded();

            assertThat(changed).isTrue();
            assertThat(builder.getStatesCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should always simplify when pruning is configured")
        void shouldSimplifyWhenPruning() {
            var builder = emptyBuilder();
            builder.getStart().addTransitionsForSequence("ab").setEndWeight(Weight.ONE);

            assertThat(new Simplification<>(builder, -100.0, 200).simplifyIfNeeded()).isTrue();
        }
    }

    @Nested
    @DisplayName("mergeParallelTransitions")
    class MergeParallelTransitions {

        @Test
        @DisplayName("Should add the weights of parallel transitions on the same symbol")
        void shouldMergeSameSymbol() {
            var builder = emptyBuilder();
            var end = builder.getStart().addTransition('a', Weight.fromValue(0.2));
            end.setEndWeight(Weight.ONE);
            builder.getStart().addTransition('a', Weight.fromValue(0.3), end.getIndex(), 0);

            int merged = simplification(builder).mergeParallelTransitions();
            var result = builder.getAutomaton();

            assertThat(merged).isEqualTo(1);
            assertThat(result.getTransitionCount()).isEqualTo(1);
            assertThat(result.getStart().getTransitions().get(0).weight().getValue()).isCloseTo(0.5, within(1e-12));
            assertThat(result.getLogValue("a")).isCloseTo(Math.log(0.5), within(1e-12));
        }

        @Test
        @DisplayName("Should mix distributions of parallel transitions on different symbols")
        void shouldMixDifferentSymbols() {
            var builder = emptyBuilder();
            var end = builder.getStart().addTransition('a', Weight.fromValue(0.25));
            end.setEndWeight(Weight.ONE);
            builder.getStart().addTransition('b', Weight.fromValue(0.75), end.getIndex(), 0);

            simplification(builder).mergeParallelTransitions();
            var result = builder.getAutomaton();
            Transition<DiscreteDistribution<Character>> merged = result.getStart().getTransitions().get(0);

            assertThat(result.getTransitionCount()).isEqualTo(1);
            assertThat(merged.weight().getValue()).isCloseTo(1.0, within(1e-12));
            assertThat(merged.elementDistribution().getProb('a')).isCloseTo(0.25, within(1e-12));
            assertThat(merged.elementDistribution().getProb('b')).isCloseTo(0.75, within(1e-12));
            assertThat(result.getLogValue("b")).isCloseTo(Math.log(0.75), within(1e-12));
        }

        @Test
        @DisplayName("Should add epsilon weights but keep transitions of different kinds or groups apart")
        void shouldRespectKindsAndGroups() {
            var builder = emptyBuilder();
            var end = builder.getStart().addEpsilonTransition(Weight.fromValue(0.1));
            end.setEndWeight(Weight.ONE);
            builder.getStart().addEpsilonTransition(Weight.fromValue(0.2), end.getIndex());
            builder.getStart().addTransition('a', Weight.ONE, end.getIndex(), 0);
            builder.getStart().addTransition('a', Weight.ONE, end.getIndex(), 3);

            int merged = simplification(builder).mergeParallelTransitions();
            var result = builder.getAutomaton();

            assertThat(merged).isEqualTo(1);
            assertThat(result.getTransitionCount()).isEqualTo(3);
            assertThat(result.getLogValue("")).isCloseTo(Math.log(0.3), within(1e-12));
        }
    }

    @Nested
    @DisplayName("removeDeadStates")
    class RemoveDeadStates {

        @Test
        @DisplayName("Should remove unreachable and non-accepting branches")
        void shouldRemoveDeadStates() {
            var builder = emptyBuilder();
            builder.getStart().addTransition('a', Weight.ONE).setEndWeight(Weight.ONE);
            builder.getStart().addTransition('b', Weight.ONE);
            builder.addState().setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).removeDeadStates();
            var result = builder.getAutomaton();

            assertThat(changed).isTrue();
            assertThat(result.getStateCount()).isEqualTo(2);
            assertThat(result.getLogValue("a")).isCloseTo(0.0, within(1e-12));
        }

        @Test
        @DisplayName("Should keep the start state even if nothing is accepted")
        void shouldKeepStartState() {
            var builder = emptyBuilder();
            builder.getStart().addTransition('a', Weight.ONE);

            boolean changed = simplification(builder).removeDeadStates();

            assertThat(changed).isTrue();
            assertThat(builder.getStatesCount()).isEqualTo(1);
            assertThat(builder.getAutomaton().isZero()).isTrue();
        }

        @Test
        @DisplayName("Should report no change when every state is live")
        void shouldReportNoChange() {
            var builder = AutomatonBuilder.constantOn(STRINGS, Weight.ONE, "abc");

            assertThat(simplification(builder).removeDeadStates()).isFalse();
            assertThat(builder.getStatesCount()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("removeTransitionsWithSmallWeights")
    class RemoveTransitionsWithSmallWeights {

        @Test
        @DisplayName("Should drop light transitions and the states they alone reached")
        void shouldPruneLightTransitions() {
            var builder = emptyBuilder();
            builder.getStart().addTransition('a', Weight.fromValue(0.9)).setEndWeight(Weight.ONE);
            builder.getStart().addTransition('b', Weight.fromValue(0.001))
                    .addTransition('c', Weight.ONE)
                    .setEndWeight(Weight.ONE);

            boolean changed = simplification(builder).removeTransitionsWithSmallWeights(Math.log(0.01));
            var result = builder.getAutomaton();

            assertThat(changed).isTrue();
            assertThat(result.getStateCount()).isEqualTo(2);
            assertThat(result.getLogValue("a")).isCloseTo(Math.log(0.9), within(1e-12));
            assertThat(result.getLogValue("bc")).isEqualTo(Double.NEGATIVE_INFINITY);
        }

        @Test
        @DisplayName("Should report no change when all weights pass")
        void shouldReportNoChange() {
            var builder = AutomatonBuilder.constantOn(STRINGS, Weight.ONE, "ab");

            assertThat(simplification(builder).removeTransitionsWithSmallWeights(-1.0)).isFalse();
            assertThat(builder.getStatesCount()).isEqualTo(3);
        }
    }
}
