package NFAReduce.Equivalence;

import NFAReduce.ByteNFA;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Bounded forward language equivalence: states are compared on their transition structure up to a fixed lookahead.
 * This is a cheap heuristic, not exact minimization. Acceptance is not part of the comparison.
 * <p>
 * The cost of a pairwise check grows with the branching factor to the power of the depth, and the grouping pass
 * compares all pairs of states, so keep the depth small for anything but tiny automata.
 */
public final class ForwardEquivalence {

  private ForwardEquivalence() {
  }

  /**
   * One-directional bounded check: both states have rules on the same symbols, and every destination of state1
   * has a destination of state2 on the same symbol that is equivalent at depth - 1.
   * @param nfa - NFA
   * @param state1 - state whose destinations must be matched
   * @param state2 - state providing the matches
   * @param depth - lookahead; 0 never distinguishes states
   * @return whether state2 matches state1 up to the given depth
   */
  public static boolean forwardLanguageEquivalence(ByteNFA nfa, int state1, int state2, int depth) {
    if (depth < 0) {
      throw new IllegalArgumentException("Negative depth: " + depth);
    }
    if (depth == 0) {
      return true;
    }

    final IntSortedSet symbols = nfa.getSymbols(state1);
    if (!symbols.equals(nfa.getSymbols(state2))) {
      return false;
    }

    for (int a : symbols) {
      final IntSortedSet targets2 = nfa.getTransitions(state2, a);
      for (int p1 : nfa.getTransitions(state1, a)) {
        if (!hasMatch(nfa, p1, targets2, depth - 1)) {
          return false;
        }
      }
    }
    return true;
  }

  private static boolean hasMatch(ByteNFA nfa, int p1, IntSortedSet targets2, int depth) {
    for (int p2 : targets2) {
      if (forwardLanguageEquivalence(nfa, p1, p2, depth)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Symmetric version of {@link #forwardLanguageEquivalence}: the check must hold in both directions.
   */
  public static boolean isEquivalent(ByteNFA nfa, int state1, int state2, int depth) {
    return forwardLanguageEquivalence(nfa, state1, state2, depth)
        && forwardLanguageEquivalence(nfa, state2, state1, depth);
  }

  /**
   * Pairwise comparison of all states.
   * @param nfa - NFA
   * @param depth - lookahead
   * @return for every state, the states equivalent to it (itself included)
   */
  public static Int2ObjectSortedMap<IntSortedSet> forwardLanguageEquivalenceGroups(ByteNFA nfa, int depth) {
    final Int2ObjectSortedMap<IntSortedSet> groups = new Int2ObjectRBTreeMap<>();
    for (int p : nfa.getStates()) {
      final IntSortedSet group = new IntRBTreeSet();
      group.add(p);
      groups.put(p, group);
    }
    for (IntIntPair pair : equivalentPairs(nfa, depth)) {
      groups.get(pair.leftInt()).add(pair.rightInt());
      groups.get(pair.rightInt()).add(pair.leftInt());
    }
    return groups;
  }

  /**
   * @return unordered pairs of distinct equivalent states, each with left < right
   */
  public static Set<IntIntPair> equivalentPairs(ByteNFA nfa, int depth) {
    final Set<IntIntPair> pairs = new LinkedHashSet<>();
    final int[] states = nfa.getStates().toIntArray();
    for (int i = 0; i < states.length; i++) {
      for (int j = i + 1; j < states.length; j++) {
        if (isEquivalent(nfa, states[i], states[j], depth)) {
          pairs.add(new IntIntImmutablePair(states[i], states[j]));
        }
      }
    }
    return pairs;
  }
}
