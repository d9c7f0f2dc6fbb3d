package NFAReduce.Equivalence;

import NFAReduce.ByteNFA;
import NFAReduce.LanguageUtils;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

public class EquivalenceQuotientTest {
  @Test
  void testQuotientTwins() {
    ByteNFA nfa = ForwardEquivalenceTest.twins();
    ByteNFA orig = LanguageUtils.copy(nfa);

    Assertions.assertEquals(1, EquivalenceQuotient.quotient(nfa, 3));
    Assertions.assertEquals(3, nfa.stateCount());
    Assertions.assertEquals(Set.of(1), nfa.getTransitions(0, 0x61));
    Assertions.assertEquals(Set.of(2), nfa.getTransitions(1, 0x62));
    Assertions.assertEquals(Set.of(2), nfa.getFinalStates());
    Assertions.assertTrue(LanguageUtils.sameLanguage(orig, nfa));
  }

  @Test
  void testNothingToMerge() {
    ByteNFA nfa = new ByteNFA();
    nfa.setInitial(0);
    nfa.addRule(0, 1, 0x61);
    nfa.addFinal(1);
    Assertions.assertEquals(0, EquivalenceQuotient.quotient(nfa, 2));
    Assertions.assertEquals(2, nfa.stateCount());
  }

  @Test
  void testAcceptanceIsRespected() {
    // 1 and 2 have the same structure, only 2 accepts
    ByteNFA nfa = new ByteNFA();
    nfa.setInitial(0);
    nfa.addRule(0, 1, 0x61);
    nfa.addRule(0, 2, 0x62);
    nfa.addFinal(2);
    Assertions.assertTrue(ForwardEquivalence.isEquivalent(nfa, 1, 2, 5));

    ByteNFA orig = LanguageUtils.copy(nfa);
    Assertions.assertEquals(0, EquivalenceQuotient.quotient(nfa, 5));
    Assertions.assertEquals(3, nfa.stateCount());
    Assertions.assertTrue(LanguageUtils.sameLanguage(orig, nfa));
  }

  @Test
  void testFindRepresentatives() {
    ByteNFA nfa = new ByteNFA();
    for (int q = 0; q < 6; q++) {
      nfa.addState(q * 10);
    }
    nfa.addFinal(40);
    nfa.addFinal(50);
    Set<IntIntPair> relEq = new HashSet<>();
    relEq.add(new IntIntImmutablePair(10, 20));
    relEq.add(new IntIntImmutablePair(20, 30));
    relEq.add(new IntIntImmutablePair(40, 50));
    relEq.add(new IntIntImmutablePair(0, 40)); // acceptance differs, ignored
    int[] origToRep = EquivalenceQuotient.findRepresentatives(nfa, relEq, nfa.getStates().toIntArray());
    Assertions.assertArrayEquals(new int[]{0, 1, 1, 1, 4, 4}, origToRep);
  }
}
