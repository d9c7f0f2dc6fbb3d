package NFAReduce.Model;

/**
 * State counts before and after one reduction pass.
 */
public record ReductionStep(String name, int before, int after) {
    public int removed() {
        return before - after;
    }
}
