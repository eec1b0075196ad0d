package org.configlex.scanner;

/**
 * ASCII character classes shared by the sub-scanners. All methods accept -1 (end of input)
 * and return {@code false} or -1 for it.
 */
final class Chars {

    private Chars() {}

    static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAlpha(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isAlphaNumeric(int c) {
        return isAlpha(c) || isDigit(c);
    }

    static boolean isSpace(int c) {
        return c == ' ' || c == '\t' || c == '\r';
    }

    /**
     * @return The value of {@code c} as a digit in the given radix (2, 10 or 16), or -1.
     */
    static int digitValue(int c, int radix) {
        int value;
        if (isDigit(c)) {
            value = c - '0';
        } else if (c >= 'a' && c <= 'f') {
            value = c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
            value = c - 'A' + 10;
        } else {
            return -1;
        }
        return value < radix ? value : -1;
    }
}
