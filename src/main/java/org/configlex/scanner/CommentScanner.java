package org.configlex.scanner;

/**
 * Recognizes single-line and nestable multi-line comments.
 */
final class CommentScanner {

    private CommentScanner() {}

    /**
     * Scans a comment at the current position. The multi-line marker is tried first because
     * it commonly extends the single-line marker ({@code --[[} vs. {@code --}).
     *
     * @return The comment, or {@code null} if no comment starts here.
     * @throws ScanException if the input ends inside a multi-line comment.
     */
    static Token scan(Cursor cursor, LanguageConfig config, ScanBuffer buffer) throws ScanException {
        int[] multiLineStart = config.multiLineCommentStartCodePoints();
        if (multiLineStart != null && cursor.matches(multiLineStart)) {
            return scanMultiLine(cursor, multiLineStart, config.multiLineCommentEndCodePoints(), buffer);
        }
        int[] singleLine = config.singleLineCommentCodePoints();
        if (singleLine != null && cursor.matches(singleLine)) {
            return scanSingleLine(cursor);
        }
        return null;
    }

    // The terminating line feed is left to the newline classifier.
    private static Token scanSingleLine(Cursor cursor) {
        while (!cursor.isAtEnd() && cursor.peek() != '\n') {
            cursor.current++;
        }
        return new Token.Comment(cursor.text());
    }

    private static Token scanMultiLine(Cursor cursor, int[] start, int[] end, ScanBuffer buffer) throws ScanException {
        cursor.current += start.length;
        int depth = 1;
        boolean inString = false;
        boolean escape = false;
        while (!cursor.isAtEnd()) {
            int c = cursor.peek();
            // A backslash only keeps the next quote from toggling the in-string state.
            boolean escaped = escape;
            escape = false;
            if (c == '\n') {
                cursor.line++;
            } else if (c == '\\' && !escaped) {
                escape = true;
            } else if (c == '"' && !escaped) {
                inString = !inString;
            } else if (!inString) {
                // End marker first, so identical start and end markers close the comment.
                if (cursor.matches(end)) {
                    cursor.current += end.length;
                    if (--depth == 0) {
                        return new Token.Comment(cursor.text());
                    }
                    continue;
                }
                if (cursor.matches(start)) {
                    cursor.current += start.length;
                    depth++;
                    continue;
                }
            }
            cursor.current++;
        }
        buffer.append(new Token.Comment(cursor.text()), cursor.start, cursor.current - cursor.start, cursor.startLine);
        throw new ScanException(ScanError.UNEXPECTED_EOF, cursor.startLine, cursor.start);
    }
}
