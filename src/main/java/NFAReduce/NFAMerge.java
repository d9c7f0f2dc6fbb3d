package NFAReduce;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * State quotienting on a {@link ByteNFA}.
 */
public class NFAMerge {
    public static boolean DEBUG = false;

    /**
     * Fold qState into pState: outgoing rules are united, incoming rules of qState are redirected to pState,
     * and finality (and initiality) moves to pState. qState is deleted.
     * <p>
     * No equivalence check is made here; the caller must know that the merge preserves the language.
     * @param nfa - NFA to alter
     * @param pState - surviving state
     * @param qState - state removed by the merge
     */
    public static void mergeStates(ByteNFA nfa, int pState, int qState) {
        if (pState == qState) {
            throw new IllegalArgumentException("Cannot merge state " + pState + " into itself");
        }
        if (!nfa.isState(pState) || !nfa.isState(qState)) {
            throw new IllegalArgumentException("Cannot merge unknown states: " + pState + ", " + qState);
        }

        // rules with qState on the left side are copied to pState
        for (Int2ObjectMap.Entry<IntSortedSet> rule : nfa.rulesOf(qState).int2ObjectEntrySet()) {
            for (int t : rule.getValue()) {
                nfa.addRule(pState, t, rule.getIntKey());
            }
        }

        // rules with qState on the right side now point to pState, including the ones just copied
        for (int p : NFAGraph.predecessors(nfa).get(qState)) {
            if (p == qState) {
                continue;
            }
            for (int a : symbolsTo(nfa, p, qState)) {
                nfa.removeDestination(p, a, qState);
                nfa.addRule(p, pState, a);
            }
        }

        if (nfa.isAccepting(qState)) {
            nfa.removeFinal(qState);
            nfa.addFinal(pState);
        }
        final boolean wasInitial = nfa.getInitialState() == qState;
        nfa.removeState(qState);
        if (wasInitial) {
            nfa.setInitial(pState);
        }
    }

    /**
     * True iff state1 moves to state2, and only to state2, on every symbol of the alphabet.
     */
    public static boolean hasPathOverAlphabet(ByteNFA nfa, int state1, int state2) {
        for (int a = 0; a < ByteNFA.ALPHABET_SIZE; a++) {
            final IntSortedSet destinations = nfa.getTransitions(state1, a);
            if (destinations.size() != 1 || destinations.firstInt() != state2) {
                return false;
            }
        }
        return true;
    }

    /**
     * Find the state the initial state enters on every symbol, and only that state, when it also loops on every
     * symbol. Such a state must be the only successor of the initial state, so there is at most one.
     * @return the state, or {@link ByteNFA#NO_STATE}
     */
    public static int findSameState(ByteNFA nfa) {
        nfa.requireInitialState();
        final int init = nfa.getInitialState();
        for (int s : NFAGraph.successors(nfa).get(init)) {
            if (hasPathOverAlphabet(nfa, init, s) && hasPathOverAlphabet(nfa, s, s)) {
                return s;
            }
        }
        return ByteNFA.NO_STATE;
    }

    /**
     * Same-state reduction. Several same states would be collapsed into one, but {@link #findSameState} shows at
     * most one exists, so the pass keeps that state as is and removes the unreachable states, which renumbers the
     * automaton.
     * @return number of removed states
     */
    public static int removeSameStates(ByteNFA nfa) {
        final int same = findSameState(nfa);
        if (DEBUG && same != ByteNFA.NO_STATE) {
            System.out.println("DEBUG: same state " + same);
        }
        return NFATrim.removeUnreachable(nfa);
    }

    private static IntList symbolsTo(ByteNFA nfa, int pState, int qState) {
        final IntList symbols = new IntArrayList();
        for (Int2ObjectMap.Entry<IntSortedSet> rule : nfa.rulesOf(pState).int2ObjectEntrySet()) {
            if (rule.getValue().contains(qState)) {
                symbols.add(rule.getIntKey());
            }
        }
        return symbols;
    }
}
