package org.chinesenotes.lexicon;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Thrown when a walk that expects a single next state finds more than one. A correctly built trie never has more
 * than one next state per state and symbol, so this indicates a construction bug rather than a missing term.
 */
public class NonDeterministicTransitionException extends AutomatonException {

    private final State state;
    private final String symbol;
    private final Set<State> nextStates;

    public NonDeterministicTransitionException(State state, String symbol, Set<State> nextStates) {
        super("Encountered multiple states for state " + state + ", symbol " + symbol + ", next: " + nextStates);
        this.state = state;
        this.symbol = symbol;
        this.nextStates = Collections.unmodifiableSet(new HashSet<>(nextStates));
    }

    public State getState() {
        return state;
    }

    public String getSymbol() {
        return symbol;
    }

    public Set<State> getNextStates() {
        return nextStates;
    }
}
