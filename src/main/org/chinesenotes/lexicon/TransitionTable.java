package org.chinesenotes.lexicon;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Maps (state, input symbol) pairs to transitions. Designed for the constraint that most states have a very small
 * number of outgoing transitions: the outer map is keyed on the primitive state id, and each state gets its own small
 * symbol map only once it has an outgoing transition.
 */
class TransitionTable {

    private static final Logger log = Logger.getLogger(TransitionTable.class.getName());

    private final Int2ObjectMap<Map<String, Transition>> table = new Int2ObjectOpenHashMap<>();

    private int size = 0;

    /**
     * Registers a transition. If a transition already exists for the state and symbol, the given next states are
     * added to the existing ones rather than replacing them.
     *
     * @param start      the state the transition leaves from
     * @param symbol     the non-empty input symbol
     * @param nextStates the states the transition leads to
     * @return {@code true} if a new entry was created, {@code false} if an existing entry was merged into
     */
    boolean add(@Nonnull State start, @Nonnull String symbol, @Nonnull Set<State> nextStates) {
        Map<String, Transition> bySymbol = table.get(start.getId());
        if (bySymbol == null) {
            bySymbol = new HashMap<>(4);
            table.put(start.getId(), bySymbol);
        }

        Transition existing = bySymbol.get(symbol);
        if (existing != null) {
            log.fine(() -> "Transition from state " + start + " with " + symbol + " already exists, merging "
                    + nextStates);
            existing.addNextStates(nextStates);
            return false;
        }
        bySymbol.put(symbol, new Transition(start, symbol, nextStates));
        size++;
        return true;
    }

    /**
     * Returns the states reached from the given state on the given symbol.
     *
     * @param start  the current state
     * @param symbol the input symbol
     * @return the next states, empty if there is no entry for the state and symbol
     */
    Set<State> get(@Nonnull State start, String symbol) {
        Map<String, Transition> bySymbol = table.get(start.getId());
        if (bySymbol == null) {
            return Collections.emptySet();
        }
        Transition transition = bySymbol.get(symbol);
        return transition == null ? Collections.emptySet() : transition.getNextStates();
    }

    /**
     * Returns the transitions leaving the given state.
     *
     * @param start the state
     * @return the state's transitions keyed by symbol, empty if the state has none
     */
    Map<String, Transition> from(@Nonnull State start) {
        Map<String, Transition> bySymbol = table.get(start.getId());
        return bySymbol == null ? Collections.emptyMap() : Collections.unmodifiableMap(bySymbol);
    }

    /**
     * Gets all transitions in this table.
     *
     * @return a snapshot of all transitions
     */
    List<Transition> getTransitions() {
        List<Transition> result = new ArrayList<>(size);
        for (Map<String, Transition> bySymbol : table.values()) {
            result.addAll(bySymbol.values());
        }
        return result;
    }

    /**
     * Returns the number of (state, symbol) entries.
     *
     * @return the number of entries
     */
    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    @Override
    public String toString() {
        return "TransitionTable{" + getTransitions() + '}';
    }
}
