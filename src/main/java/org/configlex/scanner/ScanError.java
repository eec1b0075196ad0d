package org.configlex.scanner;

/**
 * The kinds of failure a scan run can end with.
 */
public enum ScanError {
    /** No classifier matched at the current position. */
    UNKNOWN_TOKEN("unknown token"),
    /** The input ended inside an unterminated string literal or multi-line comment. */
    UNEXPECTED_EOF("unexpected end of file");

    private final String description;

    ScanError(String description) {
        this.description = description;
    }

    /**
     * @return A short, lower-case description used in error messages.
     */
    public String description() {
        return description;
    }
}
