package org.configlex.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The Scanner (also known as Lexer or Tokenizer) converts source text into a flat sequence of
 * tokens, driven by a {@link LanguageConfig}.
 * <p>
 * At every position the input is classified in a fixed order, and the first match wins:
 * end of input, comment, newline, whitespace, symbol, keyword, string literal, identifier,
 * number literal. Comments come before symbols so that a comment marker built from symbol
 * characters is not split into symbols. Keywords come before identifiers and only match when
 * the next character is not a letter, digit or underscore.
 * <p>
 * A Scanner holds no per-run state. One instance may serve any number of concurrent runs,
 * as long as every run has its own {@link ScanBuffer}.
 */
public final class Scanner {

    private static final Logger LOG = LoggerFactory.getLogger(Scanner.class);

    /**
     * Scans the whole source and appends every token to the buffer.
     * <p>
     * On failure, the tokens recognized up to that point stay in the buffer. For an
     * unterminated string literal or multi-line comment the incomplete token is appended too.
     *
     * @param source The source text.
     * @param config The language to scan.
     * @param buffer An empty buffer receiving the decoded source and the tokens.
     * @throws ScanException on the first unknown token or unexpected end of input.
     * @throws IllegalArgumentException if the buffer already holds tokens.
     */
    public void run(String source, LanguageConfig config, ScanBuffer buffer) throws ScanException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(buffer, "buffer");

        int[] decoded = source.codePoints().toArray();
        buffer.reset(decoded);
        Cursor cursor = new Cursor(decoded);

        try {
            Token token;
            while ((token = scanToken(cursor, config, buffer)) != Marker.EOF) {
                if (!(token instanceof Marker)) {
                    addToken(token, cursor, buffer);
                }
                cursor.markStart();
            }
        } catch (ScanException e) {
            LOG.debug("Scan stopped with '{}' after {} tokens", e.getMessage(), buffer.size());
            throw e;
        }
        LOG.debug("Scanned {} tokens from {} code points on {} lines", buffer.size(), decoded.length, cursor.line);
    }

    /**
     * Convenience variant of {@link #run(String, LanguageConfig, ScanBuffer)} using a fresh buffer.
     *
     * @param source The source text.
     * @param config The language to scan.
     * @return The filled buffer.
     * @throws ScanException on the first unknown token or unexpected end of input.
     */
    public ScanBuffer scan(String source, LanguageConfig config) throws ScanException {
        ScanBuffer buffer = new ScanBuffer();
        run(source, config, buffer);
        return buffer;
    }

    private void addToken(Token token, Cursor cursor, ScanBuffer buffer) {
        buffer.append(token, cursor.start, cursor.current - cursor.start, cursor.startLine);
        if (LOG.isTraceEnabled()) {
            LOG.trace("[#{} line {}] {} at {}+{}", buffer.size() - 1, cursor.startLine, token, cursor.start,
                    cursor.current - cursor.start);
        }
    }

    private Token scanToken(Cursor cursor, LanguageConfig config, ScanBuffer buffer) throws ScanException {
        if (cursor.isAtEnd()) {
            return Marker.EOF;
        }
        Token token = CommentScanner.scan(cursor, config, buffer);
        if (token != null) return token;

        if (cursor.peek() == '\n') {
            cursor.current++;
            cursor.line++;
            return Marker.NEW_LINE;
        }
        if (Chars.isSpace(cursor.peek())) {
            while (Chars.isSpace(cursor.peek())) cursor.current++;
            return Marker.IGNORE;
        }

        token = symbol(cursor, config);
        if (token != null) return token;
        token = keyword(cursor, config);
        if (token != null) return token;
        token = StringScanner.scan(cursor, buffer);
        if (token != null) return token;
        token = identifier(cursor);
        if (token != null) return token;
        token = NumberScanner.scan(cursor);
        if (token != null) return token;

        throw new ScanException(ScanError.UNKNOWN_TOKEN, cursor.line, cursor.current);
    }

    private Token symbol(Cursor cursor, LanguageConfig config) {
        int[][] candidates = config.symbolCodePoints();
        for (int i = 0; i < candidates.length; i++) {
            if (cursor.matches(candidates[i])) {
                cursor.current += candidates[i].length;
                return new Token.Symbol(config.symbols().get(i));
            }
        }
        return null;
    }

    private Token keyword(Cursor cursor, LanguageConfig config) {
        int[][] candidates = config.keywordCodePoints();
        for (int i = 0; i < candidates.length; i++) {
            int[] candidate = candidates[i];
            if (cursor.matches(candidate) && !Chars.isAlphaNumeric(cursor.peek(candidate.length))) {
                cursor.current += candidate.length;
                return new Token.Keyword(config.keywords().get(i));
            }
        }
        return null;
    }

    private Token identifier(Cursor cursor) {
        if (!Chars.isAlpha(cursor.peek())) {
            return null;
        }
        while (Chars.isAlphaNumeric(cursor.peek())) {
            cursor.current++;
        }
        return new Token.Identifier(cursor.text());
    }
}
