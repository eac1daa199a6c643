package org.chinesenotes.lexicon;

/**
 * Thrown when a transition is added on the empty input symbol. Such transitions would make the length of a traversal
 * ambiguous, so the machine does not allow them.
 */
public class EmptySymbolException extends AutomatonException {

    private final State state;

    public EmptySymbolException(State state) {
        super("Transitions based on empty strings are not allowed, state: " + state);
        this.state = state;
    }

    public State getState() {
        return state;
    }
}
