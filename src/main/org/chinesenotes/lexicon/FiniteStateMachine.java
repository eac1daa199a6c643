package org.chinesenotes.lexicon;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 *  Represents a non-deterministic finite state machine over Unicode code points.
 *
 *  It is non-deterministic to allow for easier construction and for early rejection when a transition leads to an
 *  empty set of next states. Recognition, however, follows a single path: a transition that leads to more than one
 *  state makes {@link #recognizes(String)} throw {@link NonDeterministicTransitionException} rather than pick one.
 *  Transitions on the empty symbol are not allowed.
 *
 *  The machine is not synchronized. Multi-thread access is safe only after construction is complete: once no more
 *  states or transitions are added, any number of threads may query it without locking.
 */
public class FiniteStateMachine {

    /**
     * All states, indexed by id.
     */
    private final List<State> states = new ArrayList<>();

    /**
     * The set of symbols that transitions have been added on.
     */
    private final Set<String> alphabet = new LinkedHashSet<>();

    private final TransitionTable transitionTable = new TransitionTable();

    /**
     * The start state of recognition, always id 0.
     */
    private final State start;

    public FiniteStateMachine() {
        start = newState(false);
    }

    /**
     * Creates a new non-accepting state and adds it to the machine.
     *
     * @return the new state
     */
    public State newState() {
        return newState(false);
    }

    /**
     * Creates a new state and adds it to the machine. Ids are allocated sequentially.
     *
     * @param accepting true if the state is accepting
     * @return the new state
     */
    public State newState(boolean accepting) {
        State state = new State(states.size(), accepting);
        states.add(state);
        return state;
    }

    /**
     * Adds a transition from a state to a single next state.
     *
     * @param from   the state the transition leaves from
     * @param symbol the input symbol, must not be empty
     * @param to     the next state
     * @throws EmptySymbolException if symbol is empty
     */
    public void addTransition(@Nonnull State from, @Nonnull String symbol, @Nonnull State to) {
        Objects.requireNonNull(to, "to");
        addTransitions(from, symbol, Collections.singleton(to));
    }

    /**
     * Adds a transition from a state to a set of next states. If a transition for the state and symbol already
     * exists, the next states are added to it.
     *
     * @param from   the state the transition leaves from
     * @param symbol the input symbol, must not be empty
     * @param to     the next states
     * @throws EmptySymbolException if symbol is empty
     */
    public void addTransitions(@Nonnull State from, @Nonnull String symbol, @Nonnull Set<State> to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(to, "to");
        if (symbol.isEmpty()) {
            throw new EmptySymbolException(from);
        }
        transitionTable.add(from, symbol, to);
        alphabet.add(symbol);
    }

    /**
     * Reads an input symbol in the given state.
     *
     * @param state  the current state
     * @param symbol the input symbol
     * @return the next states, empty if there is no transition
     */
    public Set<State> transition(@Nonnull State state, String symbol) {
        return transitionTable.get(state, symbol);
    }

    /**
     * Tests whether the machine recognizes the given text. Rejects as soon as part of the text has no transition.
     *
     * @param text the text to test
     * @return true if the walk over the whole text ends in an accepting state
     * @throws NonDeterministicTransitionException if a transition on the walk leads to more than one state
     */
    public boolean recognizes(@Nonnull String text) {
        State state = readPrefix(text);
        return state != null && state.isAccepting();
    }

    /**
     * Follows the machine from the start state over the given prefix.
     *
     * @param prefix the text to follow
     * @return the state reached, or {@code null} if part of the prefix has no transition
     * @throws NonDeterministicTransitionException if a transition on the walk leads to more than one state
     */
    @Nullable
    protected State readPrefix(@Nonnull String prefix) {
        State state = start;
        int i = 0;
        while (i < prefix.length()) {
            int next = prefix.offsetByCodePoints(i, 1);
            String symbol = prefix.substring(i, next);
            state = singleNextState(state, symbol);
            if (state == null) {
                return null;
            }
            i = next;
        }
        return state;
    }

    /**
     * Gets the only next state for a state and symbol.
     *
     * @return the next state, or {@code null} if there is no transition
     * @throws NonDeterministicTransitionException if there is more than one next state
     */
    @Nullable
    State singleNextState(State state, String symbol) {
        Set<State> nextStates = transition(state, symbol);
        if (nextStates.isEmpty()) {
            return null;
        }
        if (nextStates.size() > 1) {
            throw new NonDeterministicTransitionException(state, symbol, nextStates);
        }
        return nextStates.iterator().next();
    }

    public State getStart() {
        return start;
    }

    /**
     * Returns all states of the machine.
     *
     * @return an unmodifiable view of the states, ordered by id
     */
    public List<State> getStates() {
        return Collections.unmodifiableList(states);
    }

    /**
     * Returns the accepting states. O(states).
     *
     * @return a new set holding the states that are currently accepting
     */
    public Set<State> getAcceptingStates() {
        Set<State> accepting = new HashSet<>();
        for (State state : states) {
            if (state.isAccepting()) {
                accepting.add(state);
            }
        }
        return accepting;
    }

    /**
     * Returns the symbols transitions have been added on.
     *
     * @return an unmodifiable view of the alphabet
     */
    public Set<String> getAlphabet() {
        return Collections.unmodifiableSet(alphabet);
    }

    /**
     * Returns all transitions of the machine.
     *
     * @return a snapshot of the transition table
     */
    public List<Transition> getTransitions() {
        return transitionTable.getTransitions();
    }

    TransitionTable getTransitionTable() {
        return transitionTable;
    }

    /**
     * Describes the machine as JSON: alphabet, states, start state, accepting states, and transition table.
     *
     * @return a new JSON object describing the machine
     */
    public ObjectNode describe() {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        ObjectNode root = factory.objectNode();

        ArrayNode alphabetNode = root.putArray("alphabet");
        alphabet.forEach(alphabetNode::add);

        ArrayNode statesNode = root.putArray("states");
        ArrayNode acceptingNode = factory.arrayNode();
        for (State state : states) {
            statesNode.add(state.getId());
            if (state.isAccepting()) {
                acceptingNode.add(state.getId());
            }
        }
        root.put("start", start.getId());
        root.set("accepting", acceptingNode);

        List<Transition> transitions = transitionTable.getTransitions();
        transitions.sort(Comparator.comparingInt((Transition t) -> t.getStart().getId())
                .thenComparing(Transition::getSymbol));
        ArrayNode transitionsNode = root.putArray("transitions");
        for (Transition transition : transitions) {
            ObjectNode node = transitionsNode.addObject();
            node.put("from", transition.getStart().getId());
            node.put("symbol", transition.getSymbol());
            ArrayNode to = node.putArray("to");
            transition.getNextStates().stream().mapToInt(State::getId).sorted().forEach(to::add);
        }
        return root;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + describe();
    }
}
