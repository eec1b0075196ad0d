package org.configlex.scanner;

/**
 * A classified token produced by the {@link Scanner}.
 * <p>
 * The set of token kinds is closed. Position information (start offset, length, line)
 * is not part of the token itself; it is recorded alongside it in the {@link ScanBuffer}.
 */
public sealed interface Token permits Token.Symbol, Token.Identifier, Token.StringLiteral,
        Token.NumberLiteral, Token.Keyword, Token.Comment, Marker {

    /**
     * Returns the textual payload of this token. For string literals this is the unescaped
     * content without the surrounding quotes.
     * @return The token text.
     */
    String text();

    /**
     * A symbol from the configured symbol list, such as {@code ..} or {@code (}.
     * @param text The symbol as configured.
     */
    record Symbol(String text) implements Token {}

    /**
     * An ASCII identifier.
     * @param text The identifier name.
     */
    record Identifier(String text) implements Token {}

    /**
     * A double-quoted string literal.
     * @param text The unescaped content, quotes excluded.
     */
    record StringLiteral(String text) implements Token {}

    /**
     * A decimal, hexadecimal or binary number literal. Hexadecimal and binary literals carry
     * a normalized {@code 0x}/{@code 0b} prefix in their text.
     * @param text The literal text.
     * @param value The numeric value.
     */
    record NumberLiteral(String text, double value) implements Token {}

    /**
     * A keyword from the configured keyword list.
     * @param text The keyword as configured.
     */
    record Keyword(String text) implements Token {}

    /**
     * A single-line or multi-line comment, comment markers included.
     * @param text The comment text.
     */
    record Comment(String text) implements Token {}
}
