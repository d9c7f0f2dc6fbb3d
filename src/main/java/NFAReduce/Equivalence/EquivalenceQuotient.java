package NFAReduce.Equivalence;

import NFAReduce.ByteNFA;
import NFAReduce.NFAMerge;
import NFAReduce.NFATrim;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIntPair;

import java.util.Set;

/**
 * Quotient a {@link ByteNFA} by bounded forward equivalence.
 */
public class EquivalenceQuotient {

	/**
	 * Merge every class of equivalent states (at the given depth) into its smallest member, then remove
	 * unreachable states. Only states that agree on acceptance are merged.
	 * The equivalence is computed once, on the automaton as passed in.
	 * @param nfa - NFA to alter
	 * @param depth - lookahead of the equivalence check
	 * @return number of merged states
	 */
	public static int quotient(ByteNFA nfa, int depth) {
		final Set<IntIntPair> relEq = ForwardEquivalence.equivalentPairs(nfa, depth);
		if (relEq.isEmpty()) {
			return 0;
		}
		final int[] states = nfa.getStates().toIntArray();
		final int[] origToRep = findRepresentatives(nfa, relEq, states);

		int merged = 0;
		for (int i = 0; i < states.length; i++) {
			if (origToRep[i] != i) {
				NFAMerge.mergeStates(nfa, states[origToRep[i]], states[i]);
				merged++;
			}
		}
		NFATrim.removeUnreachable(nfa);
		return merged;
	}

	/**
	 * From equivalent pairs, map each state index to the smallest index of its class.
	 * Pairs whose states disagree on acceptance are ignored.
	 * @param nfa - NFA
	 * @param relEq - equivalent state pairs
	 * @param states - sorted states; positions in this array are the indices used
	 * @return representative index per state index
	 */
	static int[] findRepresentatives(ByteNFA nfa, Set<IntIntPair> relEq, int[] states) {
		final Int2IntMap index = new Int2IntOpenHashMap(states.length);
		for (int i = 0; i < states.length; i++) {
			index.put(states[i], i);
		}

		final int[] representativeArray = new int[states.length];
		for (int i = 0; i < states.length; i++) {
			representativeArray[i] = i;
		}

		for (IntIntPair pair : relEq) {
			if (nfa.isAccepting(pair.leftInt()) != nfa.isAccepting(pair.rightInt())) {
				continue;
			}
			final int repA = findRepresentative(representativeArray, index.get(pair.leftInt()));
			final int repB = findRepresentative(representativeArray, index.get(pair.rightInt()));
			if (repA != repB) {
				// the smaller index stays representative
				representativeArray[Math.max(repA, repB)] = Math.min(repA, repB);
			}
		}

		for (int i = 0; i < states.length; i++) {
			representativeArray[i] = findRepresentative(representativeArray, i);
		}
		return representativeArray;
	}

	// path compression
	static int findRepresentative(int[] representativeArray, int x) {
		if (representativeArray[x] != x) {
			representativeArray[x] = findRepresentative(representativeArray, representativeArray[x]);
		}
		return representativeArray[x];
	}
}
