package org.configlex.scanner;

/**
 * Mutable position state of a single scan run. Created at the start of a run and
 * discarded when it ends; never shared.
 */
final class Cursor {

    private final int[] source;
    /** Offset of the token currently being accumulated. */
    int start = 0;
    /** Offset of the next unconsumed code point. */
    int current = 0;
    /** Line of {@link #current}. */
    int line = 1;
    /** Line of {@link #start}. */
    int startLine = 1;

    Cursor(int[] source) {
        this.source = source;
    }

    boolean isAtEnd() {
        return current >= source.length;
    }

    int length() {
        return source.length;
    }

    /**
     * @return The code point at the current position, or -1 at the end of the input.
     */
    int peek() {
        return peek(0);
    }

    /**
     * @param offset Distance from the current position.
     * @return The code point at {@code current + offset}, or -1 outside the input.
     */
    int peek(int offset) {
        int index = current + offset;
        if (index < 0 || index >= source.length) return -1;
        return source[index];
    }

    /**
     * Checks whether the input at the current position starts with the given code points.
     */
    boolean matches(int[] candidate) {
        if (candidate.length > source.length - current) return false;
        for (int i = 0; i < candidate.length; i++) {
            if (source[current + i] != candidate[i]) return false;
        }
        return true;
    }

    /**
     * Moves the pending token start to the current position.
     */
    void markStart() {
        start = current;
        startLine = line;
    }

    /**
     * @return The source text from the pending start to the current position.
     */
    String text() {
        return text(start, current);
    }

    String text(int from, int to) {
        return new String(source, from, to - from);
    }
}
