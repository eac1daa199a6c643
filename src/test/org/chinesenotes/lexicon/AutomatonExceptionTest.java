package org.chinesenotes.lexicon;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AutomatonExceptionTest {

    @Test
    public void testGetMessage() {
        String msg = "kaboom";
        AutomatonException e = new AutomatonException(msg);
        assertEquals(msg, e.getMessage());
    }

    @Test
    public void emptySymbolExceptionShouldNameTheState() {
        State state = new State(7, false);
        EmptySymbolException e = new EmptySymbolException(state);

        assertSame(state, e.getState());
        assertEquals("Transitions based on empty strings are not allowed, state: S7", e.getMessage());
    }

    @Test
    public void nonDeterministicTransitionExceptionShouldNameStateSymbolAndNextStates() {
        State state = new State(0, false);
        State next1 = new State(1, true);
        State next2 = new State(2, true);
        NonDeterministicTransitionException e =
                new NonDeterministicTransitionException(state, "x", new HashSet<>(Arrays.asList(next1, next2)));

        assertSame(state, e.getState());
        assertEquals("x", e.getSymbol());
        assertEquals(new HashSet<>(Arrays.asList(next1, next2)), e.getNextStates());
        assertTrue(e.getMessage().startsWith("Encountered multiple states for state S0, symbol x, next: "));
        assertTrue(e instanceof AutomatonException);
    }
}
