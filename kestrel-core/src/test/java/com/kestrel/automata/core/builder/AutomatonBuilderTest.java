package com.kestrel.automata.core.builder;

import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.InvalidAutomatonStateException;
import com.kestrel.automata.core.distributions.DiscreteDistribution;
import com.kestrel.automata.core.model.Alphabets;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.State;
import com.kestrel.automata.core.model.Transition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AutomatonBuilderTest {

    private AutomatonBuilder<String, Character, DiscreteDistribution<Character>> builder;

    @BeforeEach
    void setUp() {
        builder = AutomatonBuilder.zero(Alphabets.strings());
    }

    @Test
    @DisplayName("New states should have zero end weight and no transitions")
    void shouldAddEmptyStates() {
        var state = builder.addState();

        assertThat(state.getIndex()).isEqualTo(1);
        assertThat(state.canEnd()).isFalse();
        assertThat(state.getEndWeight()).isEqualTo(Weight.ZERO);
        assertThat(state.hasTransitions()).isFalse();
        assertThat(builder.getStatesCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Adding a transition without destination should create a new state")
    void shouldCreateDestinationState() {
        var destination = builder.getStart().addTransition('a', Weight.ONE);

        assertThat(destination.getIndex()).isEqualTo(1);
        assertThat(builder.getStatesCount()).isEqualTo(2);
        assertThat(builder.getTransitionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Transitions should keep insertion order")
    void shouldAppendTransitionsAtTail() {
        var start = builder.getStart();
        var target = builder.addState();
        start.addTransition('a', Weight.ONE, target.getIndex(), 0);
        start.addTransition('b', Weight.ONE, target.getIndex(), 0);
        start.addEpsilonTransition(Weight.ONE, target.getIndex());

        Automaton<String, Character, DiscreteDistribution<Character>> automaton = builder.getAutomaton();
        List<Transition<DiscreteDistribution<Character>>> transitions = automaton.getStart().getTransitions();

        assertThat(transitions).hasSize(3);
        assertThat(transitions.get(0).elementDistribution()).isEqualTo(DiscreteDistribution.pointMass('a'));
        assertThat(transitions.get(1).elementDistribution()).isEqualTo(DiscreteDistribution.pointMass('b'));
        assertThat(transitions.get(2).isEpsilon()).isTrue();
        assertThat(automaton.isEpsilonFree()).isFalse();
    }

    @Test
    @DisplayName("Sequence transitions should form a unit-weight chain")
    void shouldAddTransitionsForSequence() {
        var last = builder.getStart().addTransitionsForSequence("cat");
        last.setEndWeight(Weight.fromValue(2.0));

        Automaton<String, Character, DiscreteDistribution<Character>> automaton = builder.getAutomaton();

        assertThat(automaton.getStateCount()).isEqualTo(4);
        assertThat(automaton.getTransitionCount()).isEqualTo(3);
        assertThat(automaton.isEpsilonFree()).isTrue();
        for (State<String, Character, DiscreteDistribution<Character>> state : automaton.getStates()) {
            for (Transition<DiscreteDistribution<Character>> transition : state.getTransitions()) {
                assertThat(transition.weight()).isEqualTo(Weight.ONE);
            }
        }
        assertThat(automaton.getLogValue("cat")).isCloseTo(Math.log(2.0), within(1e-12));
        assertThat(automaton.getLogValue("dog")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("Sequence transitions should end at an explicit destination")
    void shouldEndSequenceAtDestination() {
        var target = builder.addState();
        target.setEndWeight(Weight.ONE);

        var last = builder.getStart().addTransitionsForSequence("ab", target.getIndex(), 3);

        assertThat(last.getIndex()).isEqualTo(target.getIndex());
        assertThat(builder.getStatesCount()).isEqualTo(3);
        assertThat(builder.getAutomaton().getLogValue("ab")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Round trip through a builder should preserve the automaton")
    void shouldRoundTrip() {
        var start = builder.getStart();
        var middle = start.addTransition('a', Weight.fromValue(0.5));
        middle.addSelfTransition('b', Weight.fromValue(0.25), 2);
        middle.addEpsilonTransition(Weight.fromValue(0.1)).setEndWeight(Weight.fromValue(3.0));
        start.addDistributionTransition(
                DiscreteDistribution.uniform(List.of('x', 'y')), Weight.ONE, middle.getIndex(), 1);
        middle.setEndWeight(Weight.fromValue(0.7));

        Automaton<String, Character, DiscreteDistribution<Character>> original = builder.getAutomaton();
        Automaton<String, Character, DiscreteDistribution<Character>> copy =
                AutomatonBuilder.fromAutomaton(original).getAutomaton();

        assertThat(copy.getStartStateIndex()).isEqualTo(original.getStartStateIndex());
        assertThat(copy.getStateCount()).isEqualTo(original.getStateCount());
        assertThat(copy.isEpsilonFree()).isEqualTo(original.isEpsilonFree());
        for (int i = 0; i < original.getStateCount(); i++) {
            assertThat(copy.getState(i).getEndWeight()).isEqualTo(original.getState(i).getEndWeight());
            assertThat(new ArrayList<>(copy.getState(i).getTransitions()))
                    .containsExactlyElementsOf(original.getState(i).getTransitions());
        }
        assertThat(copy.getLogValue("abb")).isCloseTo(original.getLogValue("abb"), within(1e-12));
    }

    @Test
    @DisplayName("Removing a state should drop its transitions and renumber the rest")
    void shouldRemoveStateAndReindex() {
        // 0 -a-> 1 -b-> 2 -c-> 3, 0 -d-> 3
        var s1 = builder.getStart().addTransition('a', Weight.ONE);
        var s2 = s1.addTransition('b', Weight.ONE);
        var s3 = s2.addTransition('c', Weight.ONE);
        s3.setEndWeight(Weight.ONE);
        builder.getStart().addTransition('d', Weight.ONE, s3.getIndex(), 0);

        builder.removeState(1);
        Automaton<String, Character, DiscreteDistribution<Character>> automaton = builder.getAutomaton();

        assertThat(automaton.getStateCount()).isEqualTo(3);
        assertThat(automaton.getTransitionCount()).isEqualTo(2);
        for (State<String, Character, DiscreteDistribution<Character>> state : automaton.getStates()) {
            for (Transition<DiscreteDistribution<Character>> transition : state.getTransitions()) {
                assertThat(transition.destinationStateIndex()).isLessThan(3);
            }
        }
        assertThat(automaton.getLogValue("d")).isCloseTo(0.0, within(1e-12));
        assertThat(automaton.getLogValue("abc")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(automaton.getState(1).getTransitions().get(0).destinationStateIndex()).isEqualTo(2);
    }

    @Test
    @DisplayName("Removing a state before the start state should shift the start index")
    void shouldAdjustStartIndexOnRemoval() {
        var other = builder.addState();
        var newStart = builder.addState();
        newStart.addTransition('a', Weight.ONE, other.getIndex(), 0);
        other.setEndWeight(Weight.ONE);
        builder.setStartStateIndex(newStart.getIndex());

        builder.removeState(0);

        assertThat(builder.getStartStateIndex()).isEqualTo(1);
        assertThat(builder.getAutomaton().getLogValue("a")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Removing the start state should be rejected")
    void shouldRejectRemovingStartState() {
        builder.addState();

        assertThatThrownBy(() -> builder.removeState(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("start state");
    }

    @Test
    @DisplayName("Bulk removal should match repeated single removals")
    void shouldRemoveSeveralStates() {
        var s1 = builder.getStart().addTransition('a', Weight.ONE);
        var s2 = builder.getStart().addTransition('b', Weight.ONE);
        var s3 = builder.getStart().addTransition('c', Weight.ONE);
        var s4 = s2.addTransition('d', Weight.ONE);
        s1.setEndWeight(Weight.ONE);
        s3.setEndWeight(Weight.ONE);
        s4.setEndWeight(Weight.ONE);

        boolean[] toRemove = new boolean[builder.getStatesCount()];
        toRemove[s1.getIndex()] = true;
        toRemove[s2.getIndex()] = true;
        int removed = builder.removeStates(toRemove);
        Automaton<String, Character, DiscreteDistribution<Character>> automaton = builder.getAutomaton();

        assertThat(removed).isEqualTo(2);
        assertThat(automaton.getStateCount()).isEqualTo(3);
        assertThat(automaton.getTransitionCount()).isEqualTo(1);
        assertThat(automaton.getLogValue("c")).isCloseTo(0.0, within(1e-12));
        assertThat(automaton.getLogValue("a")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(automaton.getLogValue("bd")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("Bulk removal should validate its flags")
    void shouldValidateRemovalFlags() {
        builder.addState();

        assertThatThrownBy(() -> builder.removeStates(new boolean[1]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.removeStates(new boolean[] { true, false }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("start state");
        assertThat(builder.removeStates(new boolean[2])).isZero();
    }

    @Test
    @DisplayName("Transition iterator should skip tombstoned transitions")
    void shouldSkipTombstones() {
        var start = builder.getStart();
        start.addTransition('a', Weight.ONE);
        start.addTransition('b', Weight.ONE);
        start.addTransition('c', Weight.ONE);

        var it = start.transitionIterator();
        it.next();
        it.markRemoved();

        List<Character> remaining = new ArrayList<>();
        for (var cursor = start.transitionIterator(); cursor.ok(); cursor.next()) {
            remaining.add(cursor.value().elementDistribution().getPoint());
        }

        assertThat(remaining).containsExactly('a', 'c');
        assertThat(builder.getTransitionCount()).isEqualTo(2);
        assertThat(builder.getAutomaton().getTransitionCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Tombstoning the same transition twice should count once")
    void shouldCountTombstonesOnce() {
        builder.getStart().addTransition('a', Weight.ONE);

        var it = builder.getStart().transitionIterator();
        it.markRemoved();
        it.markRemoved();

        assertThat(builder.getTransitionCount()).isZero();
        assertThat(builder.getStart().hasTransitions()).isFalse();
        assertThat(builder.getAutomaton().getTransitionCount()).isZero();
    }

    @Test
    @DisplayName("Iterator copies should advance independently")
    void shouldCopyIterator() {
        var start = builder.getStart();
        start.addTransition('a', Weight.ONE);
        start.addTransition('b', Weight.ONE);

        var it = start.transitionIterator();
        var copy = it.copy();
        it.next();

        assertThat(copy.value().elementDistribution().getPoint()).isEqualTo('a');
        assertThat(it.value().elementDistribution().getPoint()).isEqualTo('b');
    }

    @Test
    @DisplayName("Setting a transition value should rewrite it in place")
    void shouldSetTransitionValue() {
        builder.getStart().addTransition('a', Weight.ONE).setEndWeight(Weight.ONE);

        var it = builder.getStart().transitionIterator();
        it.setValue(it.value().withWeight(Weight.fromValue(0.5)));

        assertThat(builder.getAutomaton().getLogValue("a")).isCloseTo(Math.log(0.5), within(1e-12));
    }

    @Test
    @DisplayName("Compaction should reject an invalid start state")
    void shouldRejectInvalidStartState() {
        builder.setStartStateIndex(5);

        assertThatThrownBy(() -> builder.getAutomaton())
                .isInstanceOf(InvalidAutomatonStateException.class)
                .hasMessageContaining("StartStateIndex = 5");
    }

    @Test
    @DisplayName("Compaction should reject transitions to missing states")
    void shouldRejectDanglingDestination() {
        builder.getStart().addTransition(Transition.epsilon(Weight.ONE, 7));

        assertThatThrownBy(() -> builder.getAutomaton())
                .isInstanceOf(InvalidAutomatonStateException.class);
    }

    @Test
    @DisplayName("Frozen automata should not change when the builder does")
    void shouldCopyOnCompact() {
        builder.getStart().addTransition('a', Weight.ONE).setEndWeight(Weight.ONE);
        Automaton<String, Character, DiscreteDistribution<Character>> automaton = builder.getAutomaton();

        builder.getStart().transitionIterator().setValue(Transition.epsilon(Weight.ONE, 0));
        builder.getStart().addTransition('b', Weight.ONE);

        assertThat(automaton.getTransitionCount()).isEqualTo(1);
        assertThat(automaton.getStateCount()).isEqualTo(2);
        assertThat(automaton.getLogValue("a")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Constant automaton should accept exactly one sequence")
    void shouldBuildConstant() {
        Automaton<String, Character, DiscreteDistribution<Character>> automaton =
                AutomatonBuilder.constantOn(Alphabets.strings(), Weight.fromValue(0.3), "hi").getAutomaton();

        assertThat(automaton.getLogValue("hi")).isCloseTo(Math.log(0.3), within(1e-12));
        assertThat(automaton.getLogValue("h")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(automaton.getLogValue("")).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("Adding a state collection should offset its destinations")
    void shouldOffsetCopiedStates() {
        Automaton<String, Character, DiscreteDistribution<Character>> other =
                AutomatonBuilder.constantOn(Alphabets.strings(), Weight.ONE, "xy").getAutomaton();
        builder.addState();

        builder.addStates(other.getStates());
        builder.setStartStateIndex(2);

        assertThat(builder.getStatesCount()).isEqualTo(5);
        assertThat(builder.getAutomaton().getLogValue("xy")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    @DisplayName("Clear should leave an empty builder")
    void shouldClear() {
        builder.getStart().addTransitionsForSequence("abc");

        builder.clear();

        assertThat(builder.getStatesCount()).isZero();
        assertThat(builder.getTransitionCount()).isZero();
        assertThat(builder.getStartStateIndex()).isZero();
        assertThatThrownBy(() -> builder.getAutomaton()).isInstanceOf(InvalidAutomatonStateException.class);
    }

    @Test
    @DisplayName("Replacing a builder's content should copy the other builder")
    void shouldReplaceContent() {
        var other = AutomatonBuilder.constantOn(Alphabets.strings(), Weight.ONE, "q");

        builder.replaceWith(other);

        assertThat(builder.getStatesCount()).isEqualTo(2);
        assertThat(builder.getAutomaton().getLogValue("q")).isCloseTo(0.0, within(1e-12));
    }
}
