package org.chinesenotes.lexicon;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recognizes a set of dictionary terms by following prefixes in a finite state machine.
 *
 * Terms that share a prefix share the path of states for that prefix, so every state is reached by exactly one path
 * from the start state and the machine is an acyclic tree. That is what makes {@link #findWithPrefix(String)}
 * terminate and what keeps every transition deterministic.
 *
 * Example:
 * <pre>
 * {@code
 *   Trie trie = new Trie();
 *   trie.build(Arrays.asList("zha", "zhang", "zhan", "zhao", "fang"));
 *   trie.findWithPrefix("zh");  // zha, zhan, zhao, zhang in some order
 * }
 * </pre>
 *
 * Build first, then query. Queries never modify the trie, so once building is done the trie can be shared between
 * threads without locking.
 */
public class Trie extends FiniteStateMachine {

    private static final Logger log = Logger.getLogger(Trie.class.getName());

    /**
     * Length in code points of the longest accepted term.
     */
    private int maxTermLength = 0;

    /**
     * Set while {@link #build(Iterable)} adds the transitions of a term, whose length it tracks itself.
     */
    private boolean addingTerm = false;

    public Trie() {
    }

    /**
     * Adds the given terms. Adding a term that is already present changes nothing.
     *
     * @param terms the dictionary terms
     * @throws NonDeterministicTransitionException if the machine already has a transition leading to more than one
     *                                             state on the path of a term
     */
    public void build(@Nonnull Iterable<String> terms) {
        int added = 0;
        int before = getStates().size();
        for (String term : terms) {
            addTerm(Objects.requireNonNull(term, "term"));
            added++;
        }
        int count = added;
        log.fine(() -> "Built " + count + " terms into " + (getStates().size() - before) + " new states, "
                + getStates().size() + " states in total");
    }

    private void addTerm(String term) {
        State state = getStart();
        List<String> symbols = Symbols.of(term);
        for (String symbol : symbols) {
            State next = singleNextState(state, symbol);
            if (next == null) {
                next = newState(false);
                addingTerm = true;
                try {
                    addTransition(state, symbol, next);
                } finally {
                    addingTerm = false;
                }
            }
            state = next;
        }
        state.setAccepting(true);
        if (symbols.size() > maxTermLength) {
            maxTermLength = symbols.size();
        }
    }

    /**
     * Adds a transition. Transitions added directly rather than through {@link #build(Iterable)} can create accepting
     * paths of any length, so the longest term length is worked out again from the states and transitions.
     */
    @Override
    public void addTransitions(@Nonnull State from, @Nonnull String symbol, @Nonnull Set<State> to) {
        super.addTransitions(from, symbol, to);
        if (!addingTerm) {
            maxTermLength = longestAcceptedLength();
            log.fine(() -> "Transition added outside build, longest term length is now " + maxTermLength);
        }
    }

    /**
     * Gets the length of the longest path from the start state to an accepting state, walking the machine one symbol
     * at a time. A walk still going after more steps than there are states has hit a cycle, in which case there is no
     * bound and {@link Integer#MAX_VALUE} is returned.
     */
    private int longestAcceptedLength() {
        int limit = getStates().size();
        int longest = 0;
        Set<State> frontier = Collections.singleton(getStart());
        for (int depth = 0; !frontier.isEmpty(); depth++) {
            if (depth > limit) {
                return Integer.MAX_VALUE;
            }
            Set<State> next = new HashSet<>();
            for (State state : frontier) {
                if (state.isAccepting()) {
                    longest = depth;
                }
                for (Transition transition : getTransitionTable().from(state).values()) {
                    next.addAll(transition.getNextStates());
                }
            }
            frontier = next;
        }
        return longest;
    }

    /**
     * Finds all the terms that start with the given prefix, including the prefix itself if it is a term.
     *
     * @param prefix the prefix
     * @return the terms with the prefix in no particular order, empty if there are none
     * @throws NonDeterministicTransitionException if a transition on the prefix leads to more than one state
     */
    public List<String> findWithPrefix(@Nonnull String prefix) {
        List<String> terms = new ArrayList<>();
        State prefixState = readPrefix(prefix);
        if (prefixState == null) {
            return terms;
        }
        if (prefixState.isAccepting()) {
            terms.add(prefix);
        }

        // Depth first, without recursion. Terminates because the trie has no cycles.
        Deque<Candidate> stack = new ArrayDeque<>();
        stack.push(new Candidate(prefixState, prefix));
        while (!stack.isEmpty()) {
            Candidate candidate = stack.pop();
            for (Map.Entry<String, Transition> entry : getTransitionTable().from(candidate.state).entrySet()) {
                String nextTerm = candidate.term + entry.getKey();
                for (State nextState : entry.getValue().getNextStates()) {
                    if (nextState.isAccepting()) {
                        terms.add(nextTerm);
                    }
                    stack.push(new Candidate(nextState, nextTerm));
                }
            }
        }
        return terms;
    }

    /**
     * Tests whether the given text is a term of this trie.
     *
     * @param term the text to test
     * @return true if the text was added as a term
     */
    public boolean contains(@Nonnull String term) {
        return recognizes(term);
    }

    /**
     * Returns the length of the longest term, counted in code points. This covers terms wired in with
     * {@link #addTransition(State, String, State)} as well as those added by {@link #build(Iterable)}.
     *
     * @return the longest term length, 0 if no terms have been added, {@link Integer#MAX_VALUE} if the accepted
     *         terms have no longest one
     */
    public int getMaxTermLength() {
        return maxTermLength;
    }

    /**
     * Returns the number of distinct terms, which is the number of accepting states.
     *
     * @return the number of terms
     */
    public int size() {
        return getAcceptingStates().size();
    }

    private static final class Candidate {
        private final State state;
        private final String term;

        Candidate(State state, String term) {
            this.state = state;
            this.term = term;
        }
    }
}
