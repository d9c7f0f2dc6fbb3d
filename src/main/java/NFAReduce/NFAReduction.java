package NFAReduce;

import NFAReduce.Equivalence.EquivalenceQuotient;
import NFAReduce.Model.ReductionStep;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToIntFunction;

public class NFAReduction {
    public static boolean DEBUG = false;
    public static final int DEFAULT_DEPTH = 3;

    /**
     * Reduce with the default lookahead.
     */
    public static List<ReductionStep> reduce(ByteNFA nfa) {
        return reduce(nfa, DEFAULT_DEPTH);
    }

    /**
     * Run all reductions in place: unreachable states, same states, then bounded equivalence quotienting.
     * The last pass is a heuristic and may enlarge the accepted language when depth is small.
     * @param nfa - NFA with an initial state
     * @param depth - lookahead of the equivalence check; 0 skips quotienting
     * @return one record per pass that ran
     */
    public static List<ReductionStep> reduce(ByteNFA nfa, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative depth: " + depth);
        }
        final List<ReductionStep> steps = new ArrayList<>(3);
        long before = System.currentTimeMillis();

        steps.add(runStep("unreachable", nfa, NFATrim::removeUnreachable));
        steps.add(runStep("same states", nfa, NFAMerge::removeSameStates));
        if (depth > 0) {
            steps.add(runStep("equivalence depth " + depth, nfa, n -> EquivalenceQuotient.quotient(n, depth)));
        }

        long after = System.currentTimeMillis();
        final int origSize = steps.get(0).before();
        System.out.println("Reduction: " + nfa.stateCount() + "/" + origSize + " states");
        if (DEBUG) {
            System.out.println("DEBUG: reduction time: " + ((after - before) / 1000f) + "s");
        }
        return steps;
    }

    private static ReductionStep runStep(String name, ByteNFA nfa, ToIntFunction<ByteNFA> pass) {
        final int prevSize = nfa.stateCount();
        final int changed = pass.applyAsInt(nfa);
        final ReductionStep step = new ReductionStep(name, prevSize, nfa.stateCount());
        if (step.removed() > 0) {
            System.out.println("Reduced by " + name + " to: " + step.after());
        }
        if (DEBUG) {
            System.out.println("DEBUG: " + name + " pass changed " + changed + " states");
        }
        return step;
    }
}
