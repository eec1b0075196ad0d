package org.configlex.scanner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable description of the vocabulary a {@link Scanner} recognizes: an ordered keyword list,
 * an ordered symbol list and optional comment markers.
 * <p>
 * Keywords and symbols are tried in list order and the first match wins, so a longer candidate
 * must be listed before any shorter candidate that is a prefix of it (for example {@code ".."}
 * before {@code "."}). Use {@link #sortedLongestFirst()} to establish that order automatically.
 * <p>
 * Instances are safe to share between threads and between concurrent scan runs.
 */
public final class LanguageConfig {

    private final List<String> keywords;
    private final List<String> symbols;
    private final String singleLineComment;
    private final String multiLineCommentStart;
    private final String multiLineCommentEnd;

    // Code point views of the above, used for matching.
    private final int[][] keywordCodePoints;
    private final int[][] symbolCodePoints;
    private final int[] singleLineCommentCodePoints;
    private final int[] multiLineCommentStartCodePoints;
    private final int[] multiLineCommentEndCodePoints;

    private LanguageConfig(Builder builder) {
        this.keywords = List.copyOf(builder.keywords);
        this.symbols = List.copyOf(builder.symbols);
        this.singleLineComment = builder.singleLineComment;
        this.multiLineCommentStart = builder.multiLineCommentStart;
        this.multiLineCommentEnd = builder.multiLineCommentEnd;

        validateEntries("keyword", keywords);
        validateEntries("symbol", symbols);
        validateMarker("single-line comment", singleLineComment);
        validateMarker("multi-line comment start", multiLineCommentStart);
        validateMarker("multi-line comment end", multiLineCommentEnd);
        if ((multiLineCommentStart == null) != (multiLineCommentEnd == null)) {
            throw new IllegalArgumentException("Multi-line comment start and end markers must be configured together.");
        }

        this.keywordCodePoints = toCodePoints(keywords);
        this.symbolCodePoints = toCodePoints(symbols);
        this.singleLineCommentCodePoints = singleLineComment == null ? null : singleLineComment.codePoints().toArray();
        this.multiLineCommentStartCodePoints = multiLineCommentStart == null ? null : multiLineCommentStart.codePoints().toArray();
        this.multiLineCommentEndCodePoints = multiLineCommentEnd == null ? null : multiLineCommentEnd.codePoints().toArray();
    }

    /**
     * @return A new, empty builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The keywords in match order (unmodifiable).
     */
    public List<String> keywords() {
        return keywords;
    }

    /**
     * @return The symbols in match order (unmodifiable).
     */
    public List<String> symbols() {
        return symbols;
    }

    public Optional<String> singleLineComment() {
        return Optional.ofNullable(singleLineComment);
    }

    public Optional<String> multiLineCommentStart() {
        return Optional.ofNullable(multiLineCommentStart);
    }

    public Optional<String> multiLineCommentEnd() {
        return Optional.ofNullable(multiLineCommentEnd);
    }

    /**
     * Returns a copy of this configuration whose keyword and symbol lists are sorted by descending
     * length in code points. Candidates of equal length keep their relative order.
     *
     * @return A configuration with greedy longest-match ordering.
     */
    public LanguageConfig sortedLongestFirst() {
        Comparator<String> longestFirst = Comparator.comparingInt((String s) -> s.codePointCount(0, s.length())).reversed();
        List<String> sortedKeywords = new ArrayList<>(keywords);
        sortedKeywords.sort(longestFirst);
        List<String> sortedSymbols = new ArrayList<>(symbols);
        sortedSymbols.sort(longestFirst);
        return toBuilder().keywords(sortedKeywords).symbols(sortedSymbols).build();
    }

    /**
     * @return A builder pre-populated with the values of this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .keywords(keywords)
                .symbols(symbols)
                .singleLineComment(singleLineComment)
                .multiLineComment(multiLineCommentStart, multiLineCommentEnd);
    }

    int[][] keywordCodePoints() {
        return keywordCodePoints;
    }

    int[][] symbolCodePoints() {
        return symbolCodePoints;
    }

    int[] singleLineCommentCodePoints() {
        return singleLineCommentCodePoints;
    }

    int[] multiLineCommentStartCodePoints() {
        return multiLineCommentStartCodePoints;
    }

    int[] multiLineCommentEndCodePoints() {
        return multiLineCommentEndCodePoints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LanguageConfig other)) return false;
        return keywords.equals(other.keywords)
                && symbols.equals(other.symbols)
                && Objects.equals(singleLineComment, other.singleLineComment)
                && Objects.equals(multiLineCommentStart, other.multiLineCommentStart)
                && Objects.equals(multiLineCommentEnd, other.multiLineCommentEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keywords, symbols, singleLineComment, multiLineCommentStart, multiLineCommentEnd);
    }

    @Override
    public String toString() {
        return String.format("LanguageConfig[keywords=%d, symbols=%d, singleLineComment=%s, multiLineComment=%s..%s]",
                keywords.size(), symbols.size(), singleLineComment, multiLineCommentStart, multiLineCommentEnd);
    }

    private static void validateEntries(String kind, List<String> entries) {
        for (String entry : entries) {
            if (entry.isEmpty()) {
                throw new IllegalArgumentException("Empty " + kind + " is not allowed.");
            }
        }
    }

    private static void validateMarker(String kind, String marker) {
        if (marker != null && marker.isEmpty()) {
            throw new IllegalArgumentException("The " + kind + " marker must not be empty.");
        }
    }

    private static int[][] toCodePoints(List<String> entries) {
        int[][] result = new int[entries.size()][];
        for (int i = 0; i < entries.size(); i++) {
            result[i] = entries.get(i).codePoints().toArray();
        }
        return result;
    }

    /**
     * Builder for {@link LanguageConfig}. Not thread-safe.
     */
    public static final class Builder {
        private List<String> keywords = List.of();
        private List<String> symbols = List.of();
        private String singleLineComment;
        private String multiLineCommentStart;
        private String multiLineCommentEnd;

        private Builder() {
        }

        public Builder keywords(List<String> keywords) {
            this.keywords = Objects.requireNonNull(keywords, "keywords");
            return this;
        }

        public Builder keywords(String... keywords) {
            return keywords(List.of(keywords));
        }

        public Builder symbols(List<String> symbols) {
            this.symbols = Objects.requireNonNull(symbols, "symbols");
            return this;
        }

        public Builder symbols(String... symbols) {
            return symbols(List.of(symbols));
        }

        /**
         * @param marker The marker starting a comment that runs to the end of the line, or {@code null} for none.
         * @return This builder.
         */
        public Builder singleLineComment(String marker) {
            this.singleLineComment = marker;
            return this;
        }

        /**
         * @param start The marker opening a (nestable) multi-line comment, or {@code null} for none.
         * @param end The marker closing it, or {@code null} for none.
         * @return This builder.
         */
        public Builder multiLineComment(String start, String end) {
            this.multiLineCommentStart = start;
            this.multiLineCommentEnd = end;
            return this;
        }

        /**
         * @return The configuration.
         * @throws IllegalArgumentException if an entry or marker is empty, or only one multi-line marker is set.
         * @throws NullPointerException if a keyword or symbol list contains {@code null}.
         */
        public LanguageConfig build() {
            return new LanguageConfig(this);
        }
    }
}
