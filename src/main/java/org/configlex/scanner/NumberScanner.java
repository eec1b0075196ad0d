package org.configlex.scanner;

/**
 * Recognizes decimal, hexadecimal ({@code 0x}) and binary ({@code 0b}) number literals.
 * Every value is a {@code double}; there is no exponent notation.
 */
final class NumberScanner {

    private NumberScanner() {}

    /**
     * @return The literal, or {@code null} if the current character is not a digit.
     */
    static Token scan(Cursor cursor) {
        int c = cursor.peek();
        if (!Chars.isDigit(c)) {
            return null;
        }
        if (c == '0') {
            int prefix = cursor.peek(1);
            if ((prefix == 'x' || prefix == 'X') && Chars.digitValue(cursor.peek(2), 16) >= 0) {
                cursor.current += 2;
                return scanRadix(cursor, 16, "0x");
            }
            if ((prefix == 'b' || prefix == 'B') && Chars.digitValue(cursor.peek(2), 2) >= 0) {
                cursor.current += 2;
                return scanRadix(cursor, 2, "0b");
            }
        }
        return scanDecimal(cursor);
    }

    private static Token scanDecimal(Cursor cursor) {
        StringBuilder text = new StringBuilder();
        double value = 0.0;
        while (Chars.isDigit(cursor.peek())) {
            int c = cursor.peek();
            text.appendCodePoint(c);
            value = value * 10.0 + (c - '0');
            cursor.current++;
        }
        if (cursor.peek() == '.' && Chars.isDigit(cursor.peek(1))) {
            text.append('.');
            cursor.current++;
            double divisor = 1.0;
            while (Chars.isDigit(cursor.peek())) {
                int c = cursor.peek();
                text.appendCodePoint(c);
                value = value * 10.0 + (c - '0');
                divisor *= 10.0;
                cursor.current++;
            }
            value /= divisor;
        }
        return new Token.NumberLiteral(text.toString(), value);
    }

    private static Token scanRadix(Cursor cursor, int radix, String prefix) {
        StringBuilder text = new StringBuilder(prefix);
        double value = 0.0;
        int digit;
        while ((digit = Chars.digitValue(cursor.peek(), radix)) >= 0) {
            text.appendCodePoint(cursor.peek());
            value = value * radix + digit;
            cursor.current++;
        }
        return new Token.NumberLiteral(text.toString(), value);
    }
}
