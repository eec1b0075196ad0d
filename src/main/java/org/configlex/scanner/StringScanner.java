package org.configlex.scanner;

/**
 * Recognizes double-quoted string literals with {@code \n} and {@code \t} escapes.
 */
final class StringScanner {

    private StringScanner() {}

    /**
     * Scans a string literal at the current position.
     * <p>
     * If the input ends before the closing quote, the partial literal is appended to the
     * buffer with a span that counts the missing quote, and the run fails.
     *
     * @return The literal, or {@code null} if the current character is not a double quote.
     * @throws ScanException with {@link ScanError#UNEXPECTED_EOF} for an unterminated literal.
     */
    static Token scan(Cursor cursor, ScanBuffer buffer) throws ScanException {
        if (cursor.peek() != '"') {
            return null;
        }
        cursor.current++;
        StringBuilder content = new StringBuilder();
        boolean escape = false;
        while (!cursor.isAtEnd()) {
            int c = cursor.peek();
            if (c == '\\' && !escape) {
                escape = true;
            } else {
                if (c == '"' && !escape) {
                    cursor.current++;
                    return new Token.StringLiteral(content.toString());
                }
                if (escape && c == 'n') {
                    content.append('\n');
                } else if (escape && c == 't') {
                    content.append('\t');
                } else {
                    content.appendCodePoint(c);
                    if (c == '\n') {
                        cursor.line++;
                    }
                }
                escape = false;
            }
            cursor.current++;
        }
        int length = cursor.length() - cursor.start + 1;
        buffer.append(new Token.StringLiteral(content.toString()), cursor.start, length, cursor.startLine);
        throw new ScanException(ScanError.UNEXPECTED_EOF, cursor.startLine, cursor.start);
    }
}
