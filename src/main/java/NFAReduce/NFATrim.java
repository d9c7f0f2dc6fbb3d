package NFAReduce;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

public class NFATrim {
    /**
     * Remove all states that are not reachable from the initial state, in place.
     * Surviving states are renumbered to [0, reachable) in BFS discovery order, so the initial state becomes 0.
     * @param nfa - NFA with an initial state
     * @return number of removed states
     */
    public static int removeUnreachable(ByteNFA nfa) {
        final int prevSize = nfa.stateCount();
        final IntLinkedOpenHashSet reached = NFAGraph.reachableStates(nfa);

        final Int2IntMap stateMap = new Int2IntOpenHashMap(reached.size());
        stateMap.defaultReturnValue(ByteNFA.NO_STATE);
        int cnt = 0;
        for (int q : reached) {
            stateMap.put(q, cnt++);
        }

        final Int2ObjectSortedMap<Int2ObjectSortedMap<IntSortedSet>> table = new Int2ObjectRBTreeMap<>();
        for (int q : reached) {
            final Int2ObjectSortedMap<IntSortedSet> rules = new Int2ObjectRBTreeMap<>();
            for (Int2ObjectMap.Entry<IntSortedSet> rule : nfa.rulesOf(q).int2ObjectEntrySet()) {
                final IntSortedSet destinations = new IntRBTreeSet();
                for (int t : rule.getValue()) {
                    // every successor of a reached state is reached as well
                    destinations.add(stateMap.get(t));
                }
                rules.put(rule.getIntKey(), destinations);
            }
            table.put(stateMap.get(q), rules);
        }

        final IntSortedSet finals = new IntRBTreeSet();
        for (int f : nfa.getFinalStates()) {
            if (stateMap.containsKey(f)) {
                finals.add(stateMap.get(f));
            }
        }

        nfa.rebuild(stateMap.get(nfa.getInitialState()), table, finals);
        return prevSize - nfa.stateCount();
    }
}
