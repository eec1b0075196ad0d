package org.configlex.scanner;

/**
 * Dispatch results that steer the run loop but are never stored in a {@link ScanBuffer}.
 */
enum Marker implements Token {
    /** A run of spaces, tabs or carriage returns. */
    IGNORE,
    /** A single line feed. */
    NEW_LINE,
    /** The end of the input. */
    EOF;

    @Override
    public String text() {
        return "";
    }
}
