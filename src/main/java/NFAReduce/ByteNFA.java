package NFAReduce;

import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.automaton.concept.FiniteRepresentation;

import java.util.function.IntConsumer;

/**
 * Mutable NFA over the byte alphabet [0,255] with a single initial state.
 * <p>
 * States are non-negative integers and are created implicitly by every call that references them.
 * The transition table maps state -> symbol -> destinations; a symbol key is only present while it has
 * at least one destination. All containers are sorted, so every iteration order is deterministic.
 * <p>
 * Not thread-safe. Views handed out by this class and by {@link NFAGraph} are snapshots of the current
 * table: recompute them after every mutation.
 */
public class ByteNFA implements FiniteRepresentation {
    public static final int ALPHABET_SIZE = 256;
    public static final int NO_STATE = -1;

    private Int2ObjectSortedMap<Int2ObjectSortedMap<IntSortedSet>> transitions = new Int2ObjectRBTreeMap<>();
    private int initialState = NO_STATE;
    private IntSortedSet finalStates = new IntRBTreeSet();

    public void addState(int state) {
        if (state < 0) {
            throw new IllegalArgumentException("Invalid state: " + state);
        }
        if (!transitions.containsKey(state)) {
            transitions.put(state, new Int2ObjectRBTreeMap<>());
        }
    }

    /**
     * Add the rule {@code pState --symbol--> qState}.
     * @throws InvalidSymbolException if symbol is not in [0,255]; nothing is recorded in that case.
     */
    public void addRule(int pState, int qState, int symbol) {
        if (symbol < 0 || symbol >= ALPHABET_SIZE) {
            throw new InvalidSymbolException(symbol);
        }
        addState(pState);
        addState(qState);
        final Int2ObjectSortedMap<IntSortedSet> rules = transitions.get(pState);
        IntSortedSet destinations = rules.get(symbol);
        if (destinations == null) {
            destinations = new IntRBTreeSet();
            rules.put(symbol, destinations);
        }
        destinations.add(qState);
    }

    public void setInitial(int state) {
        addState(state);
        initialState = state;
    }

    public void addFinal(int state) {
        addState(state);
        finalStates.add(state);
    }

    /**
     * Replace every rule of the state with a self-loop, on every symbol.
     */
    public void addSelfLoop(int state) {
        addState(state);
        final Int2ObjectSortedMap<IntSortedSet> rules = transitions.get(state);
        for (int a = 0; a < ALPHABET_SIZE; a++) {
            final IntSortedSet loop = new IntRBTreeSet();
            loop.add(state);
            rules.put(a, loop);
        }
    }

    /**
     * Make every final state accepting for any suffix.
     */
    public void selfLoopToFinals() {
        for (int f : new IntRBTreeSet(finalStates)) {
            addSelfLoop(f);
        }
    }

    public int stateCount() {
        return transitions.size();
    }

    @Override
    public int size() {
        return stateCount();
    }

    public int transitionCount() {
        int count = 0;
        for (Int2ObjectSortedMap<IntSortedSet> rules : transitions.values()) {
            for (IntSortedSet destinations : rules.values()) {
                count += destinations.size();
            }
        }
        return count;
    }

    public boolean isState(int state) {
        return transitions.containsKey(state);
    }

    public IntSortedSet getStates() {
        return IntSortedSets.unmodifiable(transitions.keySet());
    }

    public int getInitialState() {
        return initialState;
    }

    public boolean hasInitialState() {
        return initialState != NO_STATE;
    }

    public IntSortedSet getFinalStates() {
        return IntSortedSets.unmodifiable(finalStates);
    }

    public boolean isAccepting(int state) {
        return finalStates.contains(state);
    }

    /**
     * @return symbols on which the state has at least one rule; empty for unknown states.
     */
    public IntSortedSet getSymbols(int state) {
        final Int2ObjectSortedMap<IntSortedSet> rules = transitions.get(state);
        if (rules == null) {
            return IntSortedSets.EMPTY_SET;
        }
        return IntSortedSets.unmodifiable(rules.keySet());
    }

    public IntSortedSet getTransitions(int state, int symbol) {
        final Int2ObjectSortedMap<IntSortedSet> rules = transitions.get(state);
        if (rules == null) {
            return IntSortedSets.EMPTY_SET;
        }
        final IntSortedSet destinations = rules.get(symbol);
        if (destinations == null) {
            return IntSortedSets.EMPTY_SET;
        }
        return IntSortedSets.unmodifiable(destinations);
    }

    /**
     * Simulate the automaton on a word.
     * @param word - input bytes, each read as a symbol in [0,255]
     * @param visitor - called for every state active after each consumed byte (the initial state is not reported)
     * @return the states active after the whole word
     */
    public IntSortedSet run(byte[] word, IntConsumer visitor) {
        requireInitialState();
        IntSortedSet active = new IntRBTreeSet();
        active.add(initialState);
        for (byte b : word) {
            final int symbol = b & 0xFF;
            final IntSortedSet next = new IntRBTreeSet();
            for (int p : active) {
                final IntSortedSet destinations = transitions.get(p).get(symbol);
                if (destinations != null) {
                    next.addAll(destinations);
                }
            }
            for (int q : next) {
                visitor.accept(q);
            }
            active = next;
            if (active.isEmpty()) {
                break;
            }
        }
        return active;
    }

    public boolean accepts(byte[] word) {
        final IntSortedSet active = run(word, q -> {});
        for (int q : active) {
            if (finalStates.contains(q)) {
                return true;
            }
        }
        return false;
    }

    void requireInitialState() {
        if (!hasInitialState()) {
            throw new IllegalStateException("NFA has no initial state");
        }
    }

    // Internal mutation primitives. Callers keep the table consistent.

    Int2ObjectSortedMap<IntSortedSet> rulesOf(int state) {
        return transitions.get(state);
    }

    void removeDestination(int pState, int symbol, int qState) {
        final Int2ObjectSortedMap<IntSortedSet> rules = transitions.get(pState);
        final IntSortedSet destinations = rules.get(symbol);
        if (destinations != null && destinations.remove(qState) && destinations.isEmpty()) {
            rules.remove(symbol);
        }
    }

    void removeFinal(int state) {
        finalStates.remove(state);
    }

    void removeState(int state) {
        transitions.remove(state);
        finalStates.remove(state);
        if (initialState == state) {
            initialState = NO_STATE;
        }
    }

    /**
     * Bulk replace of the whole automaton. No validation is done here.
     */
    void rebuild(int initial, Int2ObjectSortedMap<Int2ObjectSortedMap<IntSortedSet>> table, IntSortedSet finals) {
        this.initialState = initial;
        this.transitions = table;
        this.finalStates = finals;
    }
}
