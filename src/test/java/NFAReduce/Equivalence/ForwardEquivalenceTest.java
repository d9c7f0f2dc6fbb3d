package NFAReduce.Equivalence;

import NFAReduce.ByteNFA;
import NFAReduce.TabakovVardiRandomNFA;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class ForwardEquivalenceTest {
  // 0 -a-> {1, 2}, 1 -b-> 3, 2 -b-> 3; 1 and 2 only differ by name
  static ByteNFA twins() {
    ByteNFA nfa = new ByteNFA();
    nfa.setInitial(0);
    nfa.addRule(0, 1, 0x61);
    nfa.addRule(0, 2, 0x61);
    nfa.addRule(1, 3, 0x62);
    nfa.addRule(2, 3, 0x62);
    nfa.addFinal(3);
    return nfa;
  }

  @Test
  void testSelfEquivalence() {
    for (int seed = 0; seed < 10; seed++) {
      ByteNFA nfa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 6);
      for (int q : nfa.getStates()) {
        for (int depth = 0; depth < 4; depth++) {
          Assertions.assertTrue(ForwardEquivalence.forwardLanguageEquivalence(nfa, q, q, depth));
        }
      }
    }
  }

  @Test
  void testDepthZeroAndOne() {
    ByteNFA nfa = twins();
    Assertions.assertTrue(ForwardEquivalence.forwardLanguageEquivalence(nfa, 0, 3, 0));
    // depth 1 compares symbol sets only
    Assertions.assertFalse(ForwardEquivalence.forwardLanguageEquivalence(nfa, 0, 3, 1));
    Assertions.assertFalse(ForwardEquivalence.forwardLanguageEquivalence(nfa, 0, 1, 1));
    Assertions.assertTrue(ForwardEquivalence.forwardLanguageEquivalence(nfa, 1, 2, 1));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ForwardEquivalence.forwardLanguageEquivalence(nfa, 0, 0, -1));
  }

  @Test
  void testOneDirectionalCheck() {
    ByteNFA nfa = new ByteNFA();
    nfa.setInitial(0);
    nfa.addRule(1, 4, 0x61);
    nfa.addRule(2, 4, 0x61);
    nfa.addRule(2, 5, 0x61);
    nfa.addRule(5, 4, 0x62);

    // every destination of 1 is matched by 2, but 5 has no counterpart under 1
    Assertions.assertTrue(ForwardEquivalence.forwardLanguageEquivalence(nfa, 1, 2, 2));
    Assertions.assertFalse(ForwardEquivalence.forwardLanguageEquivalence(nfa, 2, 1, 2));
    Assertions.assertFalse(ForwardEquivalence.isEquivalent(nfa, 1, 2, 2));
    Assertions.assertFalse(ForwardEquivalence.forwardLanguageEquivalenceGroups(nfa, 2).get(1).contains(2));
    // at depth 1 only the symbol sets count
    Assertions.assertTrue(ForwardEquivalence.isEquivalent(nfa, 1, 2, 1));
  }

  @Test
  void testGroups() {
    Int2ObjectSortedMap<IntSortedSet> groups = ForwardEquivalence.forwardLanguageEquivalenceGroups(twins(), 3);
    Assertions.assertEquals(4, groups.size());
    Assertions.assertEquals(Set.of(0), groups.get(0));
    Assertions.assertEquals(Set.of(1, 2), groups.get(1));
    Assertions.assertEquals(Set.of(1, 2), groups.get(2));
    Assertions.assertEquals(Set.of(3), groups.get(3));

    Set<IntIntPair> pairs = ForwardEquivalence.equivalentPairs(twins(), 3);
    Assertions.assertEquals(Set.of(new IntIntImmutablePair(1, 2)), pairs);
  }

  @Test
  void testGroupsAreSymmetric() {
    for (int seed = 0; seed < 20; seed++) {
      ByteNFA nfa = TabakovVardiRandomNFA.getRandomAutomaton(seed, 7);
      Int2ObjectSortedMap<IntSortedSet> groups = ForwardEquivalence.forwardLanguageEquivalenceGroups(nfa, 2);
      for (int p : nfa.getStates()) {
        Assertions.assertTrue(groups.get(p).contains(p));
        for (int q : groups.get(p)) {
          Assertions.assertTrue(groups.get(q).contains(p), "seed " + seed);
        }
      }
    }
  }

  @Test
  void testSparseStateIds() {
    ByteNFA nfa = new ByteNFA();
    nfa.setInitial(100);
    nfa.addRule(100, 200, 0x61);
    nfa.addRule(100, 300, 0x61);
    Int2ObjectSortedMap<IntSortedSet> groups = ForwardEquivalence.forwardLanguageEquivalenceGroups(nfa, 1);
    Assertions.assertEquals(Set.of(200, 300), groups.get(300));
    Assertions.assertEquals(Set.of(100), groups.get(100));
  }
}
