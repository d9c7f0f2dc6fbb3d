package NFAReduce;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Adjacency views derived from the transition table of a {@link ByteNFA}.
 * Every call computes a fresh snapshot; nothing is cached across mutations.
 */
public class NFAGraph {
    public static final int UNREACHABLE = -1;

    /**
     * @return for each state, the union of its destinations over all symbols
     */
    public static Int2ObjectSortedMap<IntSortedSet> successors(ByteNFA nfa) {
        final Int2ObjectSortedMap<IntSortedSet> succ = new Int2ObjectRBTreeMap<>();
        for (int p : nfa.getStates()) {
            final IntSortedSet out = new IntRBTreeSet();
            for (int a : nfa.getSymbols(p)) {
                out.addAll(nfa.getTransitions(p, a));
            }
            succ.put(p, out);
        }
        return succ;
    }

    /**
     * @return for each state, the states that reach it in exactly one step
     */
    public static Int2ObjectSortedMap<IntSortedSet> predecessors(ByteNFA nfa) {
        final Int2ObjectSortedMap<IntSortedSet> pred = new Int2ObjectRBTreeMap<>();
        for (int p : nfa.getStates()) {
            pred.put(p, new IntRBTreeSet());
        }
        for (int p : nfa.getStates()) {
            for (int a : nfa.getSymbols(p)) {
                for (int q : nfa.getTransitions(p, a)) {
                    pred.get(q).add(p);
                }
            }
        }
        return pred;
    }

    /**
     * BFS layering from the initial state. A state gets the length of its shortest path from the initial state.
     * @return depth per reached state; unreached states are absent and {@code get} returns {@link #UNREACHABLE}
     */
    public static Int2IntMap stateDepth(ByteNFA nfa) {
        nfa.requireInitialState();
        final Int2ObjectSortedMap<IntSortedSet> succ = successors(nfa);
        final Int2IntMap depth = new Int2IntRBTreeMap();
        depth.defaultReturnValue(UNREACHABLE);

        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        depth.put(nfa.getInitialState(), 0);
        queue.enqueue(nfa.getInitialState());
        while (!queue.isEmpty()) {
            final int p = queue.dequeueInt();
            final int next = depth.get(p) + 1;
            for (int q : succ.get(p)) {
                if (!depth.containsKey(q)) {
                    depth.put(q, next);
                    queue.enqueue(q);
                }
            }
        }
        return depth;
    }

    /**
     * @return states reachable from the initial state, in BFS discovery order
     */
    public static IntLinkedOpenHashSet reachableStates(ByteNFA nfa) {
        nfa.requireInitialState();
        final Int2ObjectSortedMap<IntSortedSet> succ = successors(nfa);
        final IntLinkedOpenHashSet reached = new IntLinkedOpenHashSet();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        reached.add(nfa.getInitialState());
        queue.enqueue(nfa.getInitialState());
        while (!queue.isEmpty()) {
            final int p = queue.dequeueInt();
            for (int q : succ.get(p)) {
                if (reached.add(q)) {
                    queue.enqueue(q);
                }
            }
        }
        return reached;
    }
}
