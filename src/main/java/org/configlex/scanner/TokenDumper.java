package org.configlex.scanner;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes a human-readable listing of a {@link ScanBuffer}, one line per token:
 * <pre>
 * [#000 line 1] Keyword(function)
 * [#001 line 1] Identifier(test)
 * [#002 line 1] NumberLiteral(0x1F, 31.0)
 * </pre>
 * This is a debugging aid, not a stable format.
 */
public final class TokenDumper {

    private TokenDumper() {}

    /**
     * @param buffer The scanned tokens.
     * @param out The sink to write to.
     * @throws UncheckedIOException if the sink fails.
     */
    public static void dump(ScanBuffer buffer, Appendable out) {
        try {
            for (int i = 0; i < buffer.size(); i++) {
                out.append(String.format("[#%03d line %d] %s%n", i, buffer.line(i), describe(buffer.token(i))));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write token dump", e);
        }
    }

    /**
     * @param token A token.
     * @return The token kind followed by its payload, e.g. {@code Symbol(..)}.
     */
    public static String describe(Token token) {
        String kind = token.getClass().getSimpleName();
        if (token instanceof Token.NumberLiteral number) {
            return kind + "(" + number.text() + ", " + number.value() + ")";
        }
        return kind + "(" + escape(token.text()) + ")";
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }
}
