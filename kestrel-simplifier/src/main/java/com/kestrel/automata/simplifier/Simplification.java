/*
 * Copyright (c) 2025 Kestrel Automata
 * Licensed under the Apache License, Version 2.0
 */
package com.kestrel.automata.simplifier;

import com.kestrel.automata.api.ElementDistribution;
import com.kestrel.automata.api.SimplificationListener;
import com.kestrel.automata.api.Weight;
import com.kestrel.automata.api.exceptions.AutomatonInvariantException;
import com.kestrel.automata.core.builder.AutomatonBuilder;
import com.kestrel.automata.core.model.Automaton;
import com.kestrel.automata.core.model.Transition;
import com.kestrel.automata.core.model.TransitionList;
import com.kestrel.automata.simplifier.config.SimplifierConfig;
import com.kestrel.automata.simplifier.sequence.GeneralizedElement;
import com.kestrel.automata.simplifier.sequence.GeneralizedSequence;
import com.kestrel.automata.simplifier.sequence.WeightedSequence;
import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Structural simplification of an automaton held in a builder.
 *
 * <p>{@link #simplify()} finds the part of the automaton that is a generalized
 * tree (a tree whose nodes may carry one self-loop each), lists the weighted
 * generalized sequences it accepts, drops it and inserts those sequences again
 * the way strings are inserted into a trie, so that common prefixes and
 * matching self-loops are shared. States reachable through more than one path
 * are copied unchanged.
 *
 * <p>The builder is modified in place and must not be used by anyone else
 * while an operation runs.
 *
 * @param <S> Sequence type
 * @param <E> Element type
 * @param <D> Element distribution type
 */
public final class Simplification<S, E, D extends ElementDistribution<E, D>> {
    private static final Logger logger = Logger.getLogger(Simplification.class.getName());

    public static final String PHASE_MERGE_PARALLEL = "MERGE_PARALLEL";
    public static final String PHASE_LABEL = "LABEL";
    public static final String PHASE_EXTRACT = "EXTRACT";
    public static final String PHASE_REBUILD = "REBUILD";
    public static final String PHASE_REMOVE_DEAD_STATES = "REMOVE_DEAD_STATES";
    public static final String PHASE_PRUNE_TRANSITIONS = "PRUNE_TRANSITIONS";

    private final AutomatonBuilder<S, E, D> builder;
    private final Double pruneLogWeightThreshold;
    private final int maxStateCountBeforeSimplification;

    private SimplificationListener listener;
    private int lastSequenceCount;

    public Simplification(AutomatonBuilder<S, E, D> builder, SimplifierConfig config) {
        this(builder, config.getPruneLogWeightThreshold(), config.getMaxStateCountBeforeSimplification());
    }

    /**
     * @param pruneLogWeightThreshold Minimum normalized log weight of a kept sequence, {@code null} to keep all
     * @param maxStateCountBeforeSimplification State count above which {@link #simplifyIfNeeded()} runs
     */
    public Simplification(
            AutomatonBuilder<S, E, D> builder, Double pruneLogWeightThreshold, int maxStateCountBeforeSimplification) {
        this.builder = Objects.requireNonNull(builder, "builder cannot be null");
        this.pruneLogWeightThreshold = pruneLogWeightThreshold;
        this.maxStateCountBeforeSimplification = maxStateCountBeforeSimplification;
    }

    public void setListener(SimplificationListener listener) {
        this.listener = listener;
    }

    /**
     * Number of generalized sequences reinserted by the last successful {@link #simplify()}.
     */
    public int getLastSequenceCount() {
        return lastSequenceCount;
    }

    /**
     * Simplifies only when the builder holds more than the configured number of
     * states, or when pruning is configured.
     *
     * @return Whether the automaton was changed
     */
    public boolean simplifyIfNeeded() {
        if (builder.getStatesCount() > maxStateCountBeforeSimplification || pruneLogWeightThreshold != null) {
            return simplify();
        }
        return false;
    }

    /**
     * Rewrites the generalized-tree part of the automaton as a trie.
     *
     * <p>The builder is left untouched when {@code false} is returned.
     *
     * @return {@code false} when the automaton has loops over more than one
     *         transition, or a start state keeping several self-loops after
     *         merging, {@code true} otherwise
     */
    public boolean simplify() {
        Automaton<S, E, D> original = builder.getAutomaton();
        if (original.hasNonTrivialLoops()) {
            logger.warning("Skipping simplification: automaton with " + original.getStateCount()
                    + " states has non-trivial loops");
            return false;
        }
        if (countSelfLoopsAfterMerge(original, original.getStartStateIndex()) > 1) {
            logger.fine("Skipping simplification: start state has several self-loops");
            return false;
        }

        boolean merged = runPhase(PHASE_MERGE_PARALLEL, metrics -> {
            int mergedCount = mergeParallelTransitions();
            metrics.put("mergedTransitions", mergedCount);
            return mergedCount > 0;
        });
        Automaton<S, E, D> snapshot = merged ? builder.getAutomaton() : original;

        RoaringBitmap[] labels = new RoaringBitmap[1];
        runPhase(PHASE_LABEL, metrics -> {
            labels[0] = labelStatesForSimplification(snapshot);
            metrics.put("treeStateCount", labels[0].getCardinality());
            return false;
        });
        RoaringBitmap treeStates = labels[0];

        List<WeightedSequence<E, D>> sequences = new ArrayList<>();
        runPhase(PHASE_EXTRACT, metrics -> {
            sequences.addAll(buildAcceptedSequenceList(snapshot, treeStates));
            int extracted = sequences.size();
            if (pruneLogWeightThreshold != null) {
                prune(snapshot, sequences);
            }
            metrics.put("sequenceCount", extracted);
            metrics.put("prunedSequenceCount", extracted - sequences.size());
            return false;
        });

        runPhase(PHASE_REBUILD, metrics -> {
            AutomatonBuilder<S, E, D> result = copyNonSimplifiable(snapshot, treeStates);
            int firstAllowedStateIndex = result.getStatesCount();
            for (WeightedSequence<E, D> sequence : sequences) {
                addGeneralizedSequence(result, firstAllowedStateIndex, sequence.sequence(), sequence.weight());
            }
            builder.replaceWith(result);
            metrics.put("copiedStateCount", firstAllowedStateIndex);
            metrics.put("stateCountAfter", builder.getStatesCount());
            return true;
        });

        lastSequenceCount = sequences.size();
        logger.fine("Simplified " + snapshot.getStateCount() + " states into " + builder.getStatesCount()
                + " using " + lastSequenceCount + " sequences");
        return true;
    }

    /**
     * Merges transitions of one state that share destination and group. Two
     * epsilon transitions are merged by adding their weights. Two symbol
     * transitions are merged into one whose distribution is the mixture of both,
     * weighted by the transition weights. An epsilon transition is never merged
     * with a symbol transition.
     *
     * @return The number of removed transitions
     */
    public int mergeParallelTransitions() {
        int merged = 0;
        for (int state = 0; state < builder.getStatesCount(); state++) {
            for (AutomatonBuilder<S, E, D>.TransitionIterator first = builder.get(state).transitionIterator();
                 first.ok(); first.next()) {
                AutomatonBuilder<S, E, D>.TransitionIterator second = first.copy();
                for (second.next(); second.ok(); second.next()) {
                    Transition<D> transition1 = first.value();
                    Transition<D> transition2 = second.value();
                    if (transition1.destinationStateIndex() != transition2.destinationStateIndex()
                            || transition1.group() != transition2.group()
                            || transition1.isEpsilon() != transition2.isEpsilon()) {
                        continue;
                    }

                    Weight weight = Weight.sum(transition1.weight(), transition2.weight());
                    if (transition1.isEpsilon()) {
                        first.setValue(transition1.withWeight(weight));
                    } else {
                        D mixture = mix(transition1, transition2, weight);
                        first.setValue(transition1.withElementDistribution(mixture).withWeight(weight));
                    }
                    second.markRemoved();
                    merged++;
                }
            }
        }
        if (merged > 0) {
            logger.fine("Merged " + merged + " parallel transitions");
        }
        return merged;
    }

    private D mix(Transition<D> transition1, Transition<D> transition2, Weight total) {
        D distribution1 = transition1.elementDistribution();
        D distribution2 = transition2.elementDistribution();
        if (total.isZero()) {
            return distribution1;
        }
        if (total.isInfinity()) {
            return distribution1.weightedSum(
                    transition1.weight().isInfinity() ? 1.0 : 0.0,
                    distribution2,
                    transition2.weight().isInfinity() ? 1.0 : 0.0);
        }
        // Relative weights keep tiny log weights from underflowing to zero
        return distribution1.weightedSum(
                Math.exp(transition1.weight().getLogValue() - total.getLogValue()),
                distribution2,
                Math.exp(transition2.weight().getLogValue() - total.getLogValue()));
    }

    /**
     * Removes states that are unreachable from the start state or from which no
     * accepting state can be reached. The start state is always kept.
     *
     * @return Whether any state was removed
     */
    public boolean removeDeadStates() {
        return runPhase(PHASE_REMOVE_DEAD_STATES, this::doRemoveDeadStates);
    }

    private boolean doRemoveDeadStates(Map<String, Object> metrics) {
        Automaton<S, E, D> snapshot = builder.getAutomaton();
        RoaringBitmap reachable = findReachableStates(snapshot);
        RoaringBitmap productive = findProductiveStates(snapshot);

        boolean[] dead = new boolean[snapshot.getStateCount()];
        for (int i = 0; i < dead.length; i++) {
            dead[i] = i != snapshot.getStartStateIndex() && !(reachable.contains(i) && productive.contains(i));
        }
        int removed = builder.removeStates(dead);
        metrics.put("removedStates", removed);
        if (removed > 0) {
            logger.fine("Removed " + removed + " dead states");
        }
        return removed > 0;
    }

    /**
     * Removes transitions whose log weight is below {@code logWeightThreshold},
     * then the states that are no longer reachable from the start state.
     *
     * @return Whether any transition or state was removed
     */
    public boolean removeTransitionsWithSmallWeights(double logWeightThreshold) {
        return runPhase(PHASE_PRUNE_TRANSITIONS, metrics -> doRemoveTransitions(logWeightThreshold, metrics));
    }

    private boolean doRemoveTransitions(double logWeightThreshold, Map<String, Object> metrics) {
        int removedTransitions = 0;
        for (int state = 0; state < builder.getStatesCount(); state++) {
            for (AutomatonBuilder<S, E, D>.TransitionIterator it = builder.get(state).transitionIterator();
                 it.ok(); it.next()) {
                if (it.value().weight().getLogValue() < logWeightThreshold) {
                    it.markRemoved();
                    removedTransitions++;
                }
            }
        }

        Automaton<S, E, D> snapshot = builder.getAutomaton();
        RoaringBitmap reachable = findReachableStates(snapshot);
        boolean[] orphans = new boolean[snapshot.getStateCount()];
        for (int i = 0; i < orphans.length; i++) {
            orphans[i] = !reachable.contains(i);
        }
        int removedStates = builder.removeStates(orphans);
        metrics.put("removedTransitions", removedTransitions);
        metrics.put("removedStates", removedStates);

        logger.fine("Pruned " + removedTransitions + " transitions and " + removedStates
                + " states below log weight " + logWeightThreshold);
        return removedTransitions > 0 || removedStates > 0;
    }

    // ------------------------------------------------------------------
    // Labeling
    // ------------------------------------------------------------------

    /**
     * Labels the states reachable from the start state. A state is a tree state
     * when it is reached along a single path, has at most one self-loop and all
     * of its children are tree states. Self-loops do not make a state shared.
     *
     * @return The set of tree states
     */
    RoaringBitmap labelStatesForSimplification(Automaton<S, E, D> automaton) {
        RoaringBitmap visited = new RoaringBitmap();
        RoaringBitmap treeStates = new RoaringBitmap();

        IntArrayList stateStack = new IntArrayList();
        IntArrayList positionStack = new IntArrayList();
        BooleanArrayList resultStack = new BooleanArrayList();

        int start = automaton.getStartStateIndex();
        visited.add(start);
        stateStack.add(start);
        positionStack.add(0);
        resultStack.add(countSelfLoops(automaton, start) <= 1);

        while (!stateStack.isEmpty()) {
            int top = stateStack.size() - 1;
            int current = stateStack.getInt(top);
            int position = positionStack.getInt(top);
            TransitionList<D> transitions = automaton.getState(current).getTransitions();

            if (position == transitions.size()) {
                boolean isTree = resultStack.getBoolean(top);
                if (isTree) {
                    treeStates.add(current);
                }
                stateStack.removeInt(top);
                positionStack.removeInt(top);
                resultStack.removeBoolean(top);
                if (top > 0 && !isTree) {
                    resultStack.set(top - 1, false);
                }
                continue;
            }

            positionStack.set(top, position + 1);
            int destination = transitions.get(position).destinationStateIndex();
            if (destination == current) {
                continue;
            }
            if (visited.contains(destination)) {
                // Second path into this state
                resultStack.set(top, false);
                continue;
            }
            visited.add(destination);
            stateStack.add(destination);
            positionStack.add(0);
            resultStack.add(countSelfLoops(automaton, destination) <= 1);
        }
        return treeStates;
    }

    // Parallel self-loops collapse per (group, kind) when merged
    private static <S, E, D extends ElementDistribution<E, D>> int countSelfLoopsAfterMerge(
            Automaton<S, E, D> automaton, int stateIndex) {
        LongOpenHashSet kinds = new LongOpenHashSet();
        for (Transition<D> transition : automaton.getState(stateIndex).getTransitions()) {
            if (transition.destinationStateIndex() == stateIndex) {
                kinds.add(((long) transition.group() << 1) | (transition.isEpsilon() ? 1L : 0L));
            }
        }
        return kinds.size();
    }

    private static <S, E, D extends ElementDistribution<E, D>> int countSelfLoops(
            Automaton<S, E, D> automaton, int stateIndex) {
        int count = 0;
        for (Transition<D> transition : automaton.getState(stateIndex).getTransitions()) {
            if (transition.destinationStateIndex() == stateIndex) {
                count++;
            }
        }
        return count;
    }

    // ------------------------------------------------------------------
    // Sequence extraction
    // ------------------------------------------------------------------

    private interface StackItem {
    }

    /** Pushes {@code element} onto the current sequence, or pops the last element when it is null. */
    private record ElementItem<E, D extends ElementDistribution<E, D>>(GeneralizedElement<E, D> element)
            implements StackItem {
    }

    private record StateWeight(int stateIndex, Weight weight) implements StackItem {
    }

    /**
     * Lists the generalized sequences accepted through tree states, walking from
     * the start state with an explicit work stack.
     */
    @SuppressWarnings("unchecked")
    List<WeightedSequence<E, D>> buildAcceptedSequenceList(Automaton<S, E, D> automaton, RoaringBitmap treeStates) {
        List<WeightedSequence<E, D>> result = new ArrayList<>();
        List<GeneralizedElement<E, D>> currentElements = new ArrayList<>();
        ObjectArrayList<StackItem> stack = new ObjectArrayList<>();
        stack.push(new StateWeight(automaton.getStartStateIndex(), Weight.ONE));

        while (!stack.isEmpty()) {
            StackItem item = stack.pop();
            if (item instanceof ElementItem) {
                GeneralizedElement<E, D> element = ((ElementItem<E, D>) item).element();
                if (element != null) {
                    currentElements.add(element);
                } else {
                    currentElements.remove(currentElements.size() - 1);
                }
                continue;
            }

            StateWeight stateWeight = (StateWeight) item;
            int stateIndex = stateWeight.stateIndex();
            Weight currentWeight = stateWeight.weight();
            TransitionList<D> transitions = automaton.getState(stateIndex).getTransitions();

            for (Transition<D> transition : transitions) {
                if (transition.destinationStateIndex() == stateIndex) {
                    currentElements.add(GeneralizedElement.selfLoop(
                            transition.elementDistribution(), transition.group(), transition.weight()));
                    stack.push(new ElementItem<E, D>(null));
                    break;
                }
            }

            Weight endWeight = automaton.getState(stateIndex).getEndWeight();
            if (!endWeight.isZero() && treeStates.contains(stateIndex)) {
                result.add(new WeightedSequence<>(
                        new GeneralizedSequence<>(currentElements), Weight.product(currentWeight, endWeight)));
            }

            // Reverse order, so children are visited in transition order
            for (int i = transitions.size() - 1; i >= 0; i--) {
                Transition<D> transition = transitions.get(i);
                int destination = transition.destinationStateIndex();
                if (destination == stateIndex || !treeStates.contains(destination)) {
                    continue;
                }
                if (!transition.isEpsilon()) {
                    stack.push(new ElementItem<E, D>(null));
                }
                stack.push(new StateWeight(destination, Weight.product(currentWeight, transition.weight())));
                if (!transition.isEpsilon()) {
                    stack.push(new ElementItem<>(
                            GeneralizedElement.symbol(transition.elementDistribution(), transition.group())));
                }
            }
        }
        return result;
    }

    private void prune(Automaton<S, E, D> automaton, List<WeightedSequence<E, D>> sequences) {
        double logNormalizer = automaton.getLogNormalizer();
        if (Double.isInfinite(logNormalizer)) {
            logger.fine("Skipping pruning: log normalizer is " + logNormalizer);
            return;
        }
        double threshold = pruneLogWeightThreshold;
        sequences.removeIf(sequence -> sequence.weight().getLogValue() - logNormalizer < threshold);
    }

    // ------------------------------------------------------------------
    // Copying the shared part
    // ------------------------------------------------------------------

    /**
     * Copies the start state and, below it, every child that is not a tree
     * state together with everything reachable from that child.
     */
    AutomatonBuilder<S, E, D> copyNonSimplifiable(Automaton<S, E, D> automaton, RoaringBitmap treeStates) {
        AutomatonBuilder<S, E, D> result = AutomatonBuilder.zero(automaton.getAlphabet(), automaton.getConfig());
        int start = automaton.getStartStateIndex();
        if (treeStates.contains(start)) {
            return result;
        }

        result.clear();
        Int2IntOpenHashMap copied = new Int2IntOpenHashMap();
        copied.defaultReturnValue(-1);

        // Pass 1: create the copies, pass 2: copy transitions in the original order
        IntArrayList order = new IntArrayList();
        IntArrayList stack = new IntArrayList();
        copied.put(start, result.addState().getIndex());
        order.add(start);
        stack.add(start);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            for (Transition<D> transition : automaton.getState(current).getTransitions()) {
                int destination = transition.destinationStateIndex();
                if (copied.containsKey(destination)
                        || (current == start && treeStates.contains(destination))) {
                    continue;
                }
                copied.put(destination, result.addState().getIndex());
                order.add(destination);
                stack.add(destination);
            }
        }

        for (int i = 0; i < order.size(); i++) {
            int original = order.getInt(i);
            AutomatonBuilder<S, E, D>.StateBuilder copy = result.get(copied.get(original));
            copy.setEndWeight(automaton.getState(original).getEndWeight());
            for (Transition<D> transition : automaton.getState(original).getTransitions()) {
                if (original == start && transition.destinationStateIndex() != start
                        && treeStates.contains(transition.destinationStateIndex())) {
                    continue;
                }
                copy.addTransition(transition.withDestination(copied.get(transition.destinationStateIndex())));
            }
        }
        result.setStartStateIndex(copied.get(start));
        return result;
    }

    // ------------------------------------------------------------------
    // Trie insertion
    // ------------------------------------------------------------------

    /**
     * Increases the value of {@code result} on {@code sequence} by {@code weight},
     * reusing existing states created at or after {@code firstAllowedStateIndex}
     * where possible. If the sequence cannot be merged in below the current start
     * state, the start state is split into two epsilon branches.
     */
    void addGeneralizedSequence(
            AutomatonBuilder<S, E, D> result, int firstAllowedStateIndex,
            GeneralizedSequence<E, D> sequence, Weight weight) {
        boolean isFreshStartState = result.getStatesCount() == 1
                && !result.getStart().hasTransitions()
                && !result.getStart().canEnd();
        if (doAddGeneralizedSequence(result, result.getStartStateIndex(), isFreshStartState, false,
                firstAllowedStateIndex, 0, sequence, weight)) {
            return;
        }

        int oldStart = result.getStartStateIndex();
        AutomatonBuilder<S, E, D>.StateBuilder newStart = result.addState();
        AutomatonBuilder<S, E, D>.StateBuilder otherBranch = result.addState();
        newStart.addEpsilonTransition(Weight.ONE, oldStart);
        newStart.addEpsilonTransition(Weight.ONE, otherBranch.getIndex());
        result.setStartStateIndex(newStart.getIndex());

        if (!doAddGeneralizedSequence(result, otherBranch.getIndex(), true, false,
                firstAllowedStateIndex, 0, sequence, weight)) {
            throw new AutomatonInvariantException("Could not insert " + sequence + " into a fresh branch");
        }
    }

    private boolean doAddGeneralizedSequence(
            AutomatonBuilder<S, E, D> result, int stateIndex, boolean isNewState, boolean selfLoopAlreadyMatched,
            int firstAllowedStateIndex, int position, GeneralizedSequence<E, D> sequence, Weight weight) {
        AutomatonBuilder<S, E, D>.StateBuilder state = result.get(stateIndex);
        List<Transition<D>> transitions = liveTransitions(state);

        if (position == sequence.size()) {
            if (!selfLoopAlreadyMatched) {
                for (Transition<D> transition : transitions) {
                    if (transition.destinationStateIndex() == stateIndex) {
                        // Ending here would also accept repetitions of the loop
                        return false;
                    }
                }
            }
            state.setEndWeight(Weight.sum(state.getEndWeight(), weight));
            return true;
        }

        GeneralizedElement<E, D> element = sequence.get(position);
        if (element.isSelfLoop()) {
            return addSelfLoopElement(result, stateIndex, transitions, isNewState, selfLoopAlreadyMatched,
                    firstAllowedStateIndex, position, sequence, weight);
        }

        for (Transition<D> transition : transitions) {
            int destination = transition.destinationStateIndex();
            if (isUsableEpsilon(transition, stateIndex, firstAllowedStateIndex)
                    && doAddGeneralizedSequence(result, destination, false, false, firstAllowedStateIndex,
                    position, sequence, divide(weight, transition.weight()))) {
                return true;
            }

            if (destination == stateIndex) {
                if (selfLoopAlreadyMatched) {
                    continue;
                }
                // Passing by an unmatched self-loop would accept extra sequences
                return false;
            }

            if (destination < firstAllowedStateIndex
                    || transition.isEpsilon()
                    || transition.group() != element.getGroup()
                    || !transition.elementDistribution().equals(element.getElementDistribution())) {
                continue;
            }

            // Fails when the next element is a self-loop the destination cannot take
            if (doAddGeneralizedSequence(result, destination, false, false, firstAllowedStateIndex,
                    position + 1, sequence, divide(weight, transition.weight()))) {
                return true;
            }
        }

        AutomatonBuilder<S, E, D>.StateBuilder child = state.addDistributionTransition(
                element.getElementDistribution(), Weight.ONE, null, element.getGroup());
        return mustSucceed(doAddGeneralizedSequence(result, child.getIndex(), true, false,
                firstAllowedStateIndex, position + 1, sequence, weight), sequence);
    }

    private boolean addSelfLoopElement(
            AutomatonBuilder<S, E, D> result, int stateIndex, List<Transition<D>> transitions,
            boolean isNewState, boolean selfLoopAlreadyMatched, int firstAllowedStateIndex,
            int position, GeneralizedSequence<E, D> sequence, Weight weight) {
        AutomatonBuilder<S, E, D>.StateBuilder state = result.get(stateIndex);
        GeneralizedElement<E, D> element = sequence.get(position);

        if (selfLoopAlreadyMatched) {
            // Two loops in a row need two states
            for (Transition<D> transition : transitions) {
                if (isUsableEpsilon(transition, stateIndex, firstAllowedStateIndex)
                        && doAddGeneralizedSequence(result, transition.destinationStateIndex(), false, false,
                        firstAllowedStateIndex, position, sequence, divide(weight, transition.weight()))) {
                    return true;
                }
            }
            AutomatonBuilder<S, E, D>.StateBuilder destination = state.addEpsilonTransition(Weight.ONE);
            return mustSucceed(doAddGeneralizedSequence(result, destination.getIndex(), true, false,
                    firstAllowedStateIndex, position, sequence, weight), sequence);
        }

        for (Transition<D> transition : transitions) {
            if (isUsableEpsilon(transition, stateIndex, firstAllowedStateIndex)
                    && doAddGeneralizedSequence(result, transition.destinationStateIndex(), false, false,
                    firstAllowedStateIndex, position, sequence, divide(weight, transition.weight()))) {
                return true;
            }

            if (transition.destinationStateIndex() == stateIndex) {
                if (selfLoopMatches(transition, element)) {
                    return mustSucceed(doAddGeneralizedSequence(result, stateIndex, false, true,
                            firstAllowedStateIndex, position + 1, sequence, weight), sequence);
                }
                return false;
            }
        }

        if (!isNewState) {
            // A new loop on an existing state would change what that state accepts
            return false;
        }

        state.addSelfDistributionTransition(
                element.getElementDistribution(), element.getLoopWeight(), element.getGroup());
        return mustSucceed(doAddGeneralizedSequence(result, stateIndex, false, true,
                firstAllowedStateIndex, position + 1, sequence, weight), sequence);
    }

    private static boolean isUsableEpsilon(Transition<?> transition, int stateIndex, int firstAllowedStateIndex) {
        return transition.isEpsilon()
                && transition.destinationStateIndex() != stateIndex
                && transition.destinationStateIndex() >= firstAllowedStateIndex;
    }

    private boolean selfLoopMatches(Transition<D> transition, GeneralizedElement<E, D> element) {
        if (!transition.weight().equals(element.getLoopWeight()) || transition.group() != element.getGroup()) {
            return false;
        }
        if (transition.isEpsilon()) {
            return element.isEpsilonSelfLoop();
        }
        return !element.isEpsilonSelfLoop()
                && transition.elementDistribution().equals(element.getElementDistribution());
    }

    private static Weight divide(Weight weight, Weight by) {
        return Weight.product(weight, Weight.inverse(by));
    }

    private static boolean mustSucceed(boolean success, GeneralizedSequence<?, ?> sequence) {
        if (!success) {
            throw new AutomatonInvariantException("Insertion of " + sequence + " into a new state failed");
        }
        return true;
    }

    private List<Transition<D>> liveTransitions(AutomatonBuilder<S, E, D>.StateBuilder state) {
        List<Transition<D>> transitions = new ArrayList<>();
        for (AutomatonBuilder<S, E, D>.TransitionIterator it = state.transitionIterator(); it.ok(); it.next()) {
            transitions.add(it.value());
        }
        return transitions;
    }

    // ------------------------------------------------------------------
    // Reachability
    // ------------------------------------------------------------------

    private static <S, E, D extends ElementDistribution<E, D>> RoaringBitmap findReachableStates(
            Automaton<S, E, D> automaton) {
        RoaringBitmap reachable = new RoaringBitmap();
        IntArrayList stack = new IntArrayList();
        reachable.add(automaton.getStartStateIndex());
        stack.add(automaton.getStartStateIndex());
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            for (Transition<D> transition : automaton.getState(current).getTransitions()) {
                int destination = transition.destinationStateIndex();
                if (!reachable.contains(destination)) {
                    reachable.add(destination);
                    stack.add(destination);
                }
            }
        }
        return reachable;
    }

    /**
     * States from which an accepting state can be reached.
     */
    private static <S, E, D extends ElementDistribution<E, D>> RoaringBitmap findProductiveStates(
            Automaton<S, E, D> automaton) {
        int stateCount = automaton.getStateCount();
        IntArrayList[] predecessors = new IntArrayList[stateCount];
        for (int i = 0; i < stateCount; i++) {
            predecessors[i] = new IntArrayList();
        }
        RoaringBitmap productive = new RoaringBitmap();
        IntArrayList stack = new IntArrayList();
        for (int i = 0; i < stateCount; i++) {
            for (Transition<D> transition : automaton.getState(i).getTransitions()) {
                predecessors[transition.destinationStateIndex()].add(i);
            }
            if (automaton.getState(i).canEnd()) {
                productive.add(i);
                stack.add(i);
            }
        }
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            for (int i = 0; i < predecessors[current].size(); i++) {
                int predecessor = predecessors[current].getInt(i);
                if (!productive.contains(predecessor)) {
                    productive.add(predecessor);
                    stack.add(predecessor);
                }
            }
        }
        return productive;
    }

    // ------------------------------------------------------------------
    // Listener plumbing
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface PhaseBody {
        boolean run(Map<String, Object> metrics);
    }

    private boolean runPhase(String phaseName, PhaseBody body) {
        if (listener == null) {
            return body.run(new HashMap<>());
        }
        listener.onPhaseStart(phaseName, builder.getStatesCount());
        long start = System.nanoTime();
        try {
            Map<String, Object> metrics = new HashMap<>();
            boolean changed = body.run(metrics);
            listener.onPhaseComplete(phaseName,
                    new SimplificationListener.PhaseResult(phaseName, System.nanoTime() - start, changed, metrics));
            return changed;
        } catch (RuntimeException e) {
            listener.onError(phaseName, e);
            throw e;
        }
    }
}
