package org.chinesenotes.lexicon;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Represents a transition (on a particular input symbol) from a state to a set of states. The set usually holds a
 * single state, but more than one is allowed, meaning this is an NFA transition as opposed to a DFA transition.
 */
public final class Transition {

    private final State start;
    private final String symbol;
    private final Set<State> nextStates;

    Transition(State start, String symbol, Set<State> nextStates) {
        this.start = start;
        this.symbol = symbol;
        this.nextStates = new HashSet<>(nextStates);
    }

    public State getStart() {
        return start;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the states this transition leads to.
     *
     * @return an unmodifiable view of the next states
     */
    public Set<State> getNextStates() {
        return Collections.unmodifiableSet(nextStates);
    }

    /**
     * Adds the given states to the states this transition leads to.
     *
     * @param states the states to add
     * @return {@code true} if any of the given states was not already a next state
     */
    boolean addNextStates(Set<State> states) {
        return nextStates.addAll(states);
    }

    @Override
    public String toString() {
        return start + " --" + symbol + "-> " + nextStates;
    }
}
