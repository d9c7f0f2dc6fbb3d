package NFAReduce;

/**
 * Thrown when a rule is labelled with a symbol outside the byte alphabet [0,255].
 */
public class InvalidSymbolException extends IllegalArgumentException {
    private final int symbol;

    public InvalidSymbolException(int symbol) {
        super("Invalid rule symbol: " + symbol + ", expected a value in [0," + (ByteNFA.ALPHABET_SIZE - 1) + "]");
        this.symbol = symbol;
    }

    public int getSymbol() {
        return symbol;
    }
}
