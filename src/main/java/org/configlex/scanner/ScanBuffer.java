package org.configlex.scanner;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The output of a scan run: the decoded source and, for every emitted token, its kind,
 * start offset, length and line.
 * <p>
 * The four token columns always have the same size; they grow together, one entry per token.
 * Offsets and lengths are measured in Unicode code points, not in {@code char}s or bytes.
 * A buffer is filled by exactly one run and is not thread-safe.
 */
public final class ScanBuffer {

    private int[] source = new int[0];
    private final List<Token> tokens = new ArrayList<>();
    private final IntArrayList starts = new IntArrayList();
    private final IntArrayList lengths = new IntArrayList();
    private final IntArrayList lines = new IntArrayList();

    /**
     * @return The number of tokens in this buffer.
     */
    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Token token(int index) {
        return tokens.get(index);
    }

    /**
     * @param index The token index.
     * @return The code point offset of the token's first character.
     */
    public int start(int index) {
        return starts.getInt(index);
    }

    /**
     * @param index The token index.
     * @return The token's span length in code points, delimiters included.
     */
    public int length(int index) {
        return lengths.getInt(index);
    }

    /**
     * @param index The token index.
     * @return The 1-based line of the token's first character.
     */
    public int line(int index) {
        return lines.getInt(index);
    }

    /**
     * @return An unmodifiable view of the emitted tokens in source order.
     */
    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Returns the source text covered by a token. The span of an unterminated string literal
     * reaches one position past the end of the source; the result is clamped to the source.
     *
     * @param index The token index.
     * @return The lexeme of the token.
     */
    public String lexeme(int index) {
        int from = Math.min(start(index), source.length);
        int to = Math.min(start(index) + length(index), source.length);
        return new String(source, from, to - from);
    }

    /**
     * @return The number of code points in the decoded source.
     */
    public int sourceLength() {
        return source.length;
    }

    /**
     * @return A copy of the decoded source as code points.
     */
    public int[] source() {
        return source.clone();
    }

    /**
     * @return The decoded source as a string.
     */
    public String sourceText() {
        return new String(source, 0, source.length);
    }

    void reset(int[] decodedSource) {
        if (!tokens.isEmpty()) {
            throw new IllegalArgumentException("A scan run needs an empty buffer, but this one holds " + tokens.size() + " tokens.");
        }
        this.source = decodedSource;
    }

    void append(Token token, int start, int length, int line) {
        tokens.add(token);
        starts.add(start);
        lengths.add(length);
        lines.add(line);
    }
}
