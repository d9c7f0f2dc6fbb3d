package NFAReduce;

import net.automatalib.exception.FormatException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2LongMap;
import it.unimi.dsi.fastutil.ints.Int2LongRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2LongSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Per-state word frequencies: how many input words enter each state, and the label file that stores them.
 * <p>
 * Label file lines are {@code state frequency [depth]}. Text after {@code #} is a comment and blank lines are
 * skipped; anything after the second field is ignored, so a written file reads back.
 */
public class NFALabels {
    public static boolean DEBUG = false;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Run every word and count, per state, the words that enter it. A state counts at most once per word.
     * The initial state is counted once more for every word, as every run starts there.
     * @param nfa - NFA with an initial state
     * @param words - input words
     * @return frequency of every state, zero for states no word enters
     */
    public static Int2LongSortedMap labelStates(ByteNFA nfa, Iterable<byte[]> words) {
        nfa.requireInitialState();
        final Int2LongSortedMap freq = new Int2LongRBTreeMap();
        for (int q : nfa.getStates()) {
            freq.put(q, 0L);
        }
        long total = 0;
        for (byte[] word : words) {
            final IntSortedSet visited = new IntRBTreeSet();
            nfa.run(word, visited::add);
            for (int q : visited) {
                freq.put(q, freq.get(q) + 1);
            }
            final int init = nfa.getInitialState();
            freq.put(init, freq.get(init) + 1);
            total++;
        }
        if (DEBUG) {
            System.out.println("DEBUG: labelled " + nfa.stateCount() + " states with " + total + " words");
        }
        return freq;
    }

    public static Int2LongSortedMap readLabels(ByteNFA nfa, Reader reader) throws IOException, FormatException {
        final Int2LongSortedMap labels = new Int2LongRBTreeMap();
        final BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        while ((line = in.readLine()) != null) {
            final int comment = line.indexOf('#');
            final String content = (comment < 0 ? line : line.substring(0, comment)).strip();
            if (content.isEmpty()) {
                continue;
            }
            final String[] tokens = WHITESPACE.split(content);
            if (tokens.length < 2) {
                throw invalidSyntax(line);
            }
            final int state;
            final long label;
            try {
                state = Integer.parseInt(tokens[0]);
                label = Long.parseLong(tokens[1]);
            } catch (NumberFormatException e) {
                throw invalidSyntax(line);
            }
            if (label < 0) {
                throw invalidSyntax(line);
            }
            if (!nfa.isState(state)) {
                throw new FormatException("invalid NFA state: " + state);
            }
            labels.put(state, label);
        }
        return labels;
    }

    public static Int2LongSortedMap readFile(ByteNFA nfa, Path path) throws IOException, FormatException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readLabels(nfa, reader);
        }
    }

    private static FormatException invalidSyntax(String line) {
        return new FormatException("invalid state labels syntax: \"" + line + "\"");
    }

    /**
     * Write a {@code # Total words} header, then {@code state frequency depth} for every state in ascending order.
     * Depth is the BFS depth from the initial state, {@link NFAGraph#UNREACHABLE} for unreached states.
     * States without a label are written with frequency 0.
     */
    public static void writeLabels(ByteNFA nfa, Int2LongMap labels, long total, Writer out) throws IOException {
        final Int2IntMap depth = NFAGraph.stateDepth(nfa);
        out.write("# Total words : " + total + "\n");
        for (int q : nfa.getStates()) {
            final long freq = labels.containsKey(q) ? labels.get(q) : 0L;
            out.write(q + " " + freq + " " + depth.get(q) + "\n");
        }
        out.flush();
    }

    public static void writeFile(ByteNFA nfa, Int2LongMap labels, long total, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writeLabels(nfa, labels, total, out);
        }
    }
}
