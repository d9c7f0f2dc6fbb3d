package NFAReduce;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.regex.Pattern;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

/**
 * Line-oriented FA format:
 * <pre>
 * initial
 * source destination symbol   (zero or more)
 * final                       (zero or more)
 * </pre>
 * Symbols are read with base detection ({@code 0x61}, {@code 0o141}, {@code 0b1100001}, {@code 97}, prefixes in
 * either case, single underscores between digits) and written in lower-case hexadecimal. A decimal symbol may not
 * start with 0 unless it is zero. States are decimal and may contain the same underscores.
 */
public class FAFormat {
    private static final Pattern TRANSITION = Pattern.compile("^\\w+\\s+\\w+\\s+\\w+$");
    private static final Pattern STATE = Pattern.compile("^\\w+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // single underscores between digits; a leading zero only in a zero literal
    private static final Pattern DECIMAL = Pattern.compile("[0-9]+(_[0-9]+)*");
    private static final Pattern LITERAL = Pattern.compile(
            "(?i)0x(_?[0-9a-f])+|0o(_?[0-7])+|0b(_?[01])+|[1-9](_?[0-9])*|0(_?0)*");

    private enum Section { INITIAL, RULES, FINALS }

    public static ByteNFA parse(Reader reader) throws IOException, FormatException {
        final ByteNFA out = new ByteNFA();
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        Section section = Section.INITIAL;
        String line;
        // readLine() strips the line terminator
        while ((line = in.readLine()) != null) {
            switch (section) {
                case INITIAL -> {
                    if (!STATE.matcher(line).matches()) {
                        throw invalidSyntax(line);
                    }
                    out.setInitial(parseState(line, line));
                    section = Section.RULES;
                }
                case RULES -> {
                    if (TRANSITION.matcher(line).matches()) {
                        final String[] tokens = WHITESPACE.split(line);
                        out.addRule(parseState(tokens[0], line), parseState(tokens[1], line), parseSymbol(tokens[2], line));
                    } else if (STATE.matcher(line).matches()) {
                        out.addFinal(parseState(line, line));
                        section = Section.FINALS;
                    } else {
                        throw invalidSyntax(line);
                    }
                }
                case FINALS -> {
                    if (!STATE.matcher(line).matches()) {
                        throw invalidSyntax(line);
                    }
                    out.addFinal(parseState(line, line));
                }
            }
        }
        if (section == Section.INITIAL) {
            throw new FormatException("missing initial state");
        }
        return out;
    }

    public static ByteNFA parse(String text) throws FormatException {
        try {
            return parse(new StringReader(text));
        } catch (IOException e) {
            // a StringReader does not fail
            throw new UncheckedIOException(e);
        }
    }

    public static ByteNFA readFile(Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    private static int parseState(String token, String line) throws FormatException {
        if (!DECIMAL.matcher(token).matches()) {
            throw invalidSyntax(line);
        }
        return parseDigits(token.replace("_", ""), 10, line);
    }

    private static int parseSymbol(String token, String line) throws FormatException {
        if (!LITERAL.matcher(token).matches()) {
            throw invalidSyntax(line);
        }
        final String digits = token.replace("_", "");
        if (digits.length() > 1 && digits.charAt(0) == '0' && Character.isLetter(digits.charAt(1))) {
            final int radix = switch (Character.toLowerCase(digits.charAt(1))) {
                case 'x' -> 16;
                case 'o' -> 8;
                default -> 2;
            };
            return parseDigits(digits.substring(2), radix, line);
        }
        return parseDigits(digits, 10, line);
    }

    private static int parseDigits(String digits, int radix, String line) throws FormatException {
        try {
            return Integer.parseInt(digits, radix);
        } catch (NumberFormatException e) {
            throw invalidSyntax(line);
        }
    }

    private static FormatException invalidSyntax(String line) {
        return new FormatException("invalid syntax: \"" + line + "\"");
    }

    public static void write(ByteNFA nfa, Writer out) throws IOException {
        nfa.requireInitialState();
        out.write(nfa.getInitialState() + "\n");
        for (int p : nfa.getStates()) {
            for (int a : nfa.getSymbols(p)) {
                for (int q : nfa.getTransitions(p, a)) {
                    out.write(p + " " + q + " 0x" + Integer.toHexString(a) + "\n");
                }
            }
        }
        for (int f : nfa.getFinalStates()) {
            out.write(f + "\n");
        }
        out.flush();
    }

    public static String toString(ByteNFA nfa) {
        final StringWriter out = new StringWriter();
        try {
            write(nfa, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public static void writeFile(ByteNFA nfa, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(nfa, out);
        }
    }

    /**
     * Convert to an AutomataLib NFA over {@code [0,255]}. States are renumbered densely in ascending order.
     */
    public static CompactNFA<Integer> toCompactNFA(ByteNFA nfa) {
        final Alphabet<Integer> alphabet = Alphabets.integers(0, ByteNFA.ALPHABET_SIZE - 1);
        final CompactNFA<Integer> out = new CompactNFA<>(alphabet, nfa.stateCount());
        final Int2IntMap stateMap = new Int2IntOpenHashMap(nfa.stateCount());
        for (int q : nfa.getStates()) {
            final int qOut = out.addIntState(nfa.isAccepting(q));
            out.setInitial(qOut, q == nfa.getInitialState());
            stateMap.put(q, qOut);
        }
        for (int p : nfa.getStates()) {
            for (int a : nfa.getSymbols(p)) {
                for (int q : nfa.getTransitions(p, a)) {
                    out.addTransition(stateMap.get(p), a, stateMap.get(q));
                }
            }
        }
        return out;
    }

    /**
     * Convert from an AutomataLib NFA with a single initial state and integer symbols in {@code [0,255]}.
     */
    public static ByteNFA fromCompactNFA(CompactNFA<Integer> automaton) {
        final Set<Integer> initialStates = automaton.getInitialStates();
        if (initialStates.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one initial state, got " + initialStates.size());
        }
        final Alphabet<Integer> alphabet = automaton.getInputAlphabet();
        final ByteNFA out = new ByteNFA();
        out.setInitial(initialStates.iterator().next());
        for (int q : automaton.getStates()) {
            out.addState(q);
            if (automaton.isAccepting(q)) {
                out.addFinal(q);
            }
            for (int a = 0; a < alphabet.size(); a++) {
                final int symbol = alphabet.getSymbol(a);
                for (int t : automaton.getTransitions(q, a)) {
                    out.addRule(q, t, symbol);
                }
            }
        }
        return out;
    }
}
