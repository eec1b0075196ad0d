package org.configlex.scanner;

/**
 * Thrown when a scan run stops on its first error.
 * <p>
 * All tokens recognized before the failure remain in the {@link ScanBuffer} passed to the run.
 * For {@link ScanError#UNEXPECTED_EOF} the incomplete token is part of that buffer as well.
 */
public class ScanException extends Exception {

    private final ScanError error;
    private final int line;
    private final int offset;

    /**
     * Constructs a new scan exception.
     * @param error The kind of failure.
     * @param line The 1-based line of the failing position.
     * @param offset The code point offset of the failing position from the start of the source.
     */
    public ScanException(ScanError error, int line, int offset) {
        super(String.format("%d:%d : %s", line, offset, error.description()));
        this.error = error;
        this.line = line;
        this.offset = offset;
    }

    public ScanError error() {
        return error;
    }

    public int line() {
        return line;
    }

    public int offset() {
        return offset;
    }
}
