package io.keyexpr.core.parse;

/** Single-character lookahead and escaping helpers shared by the expression and path parsers. */
final class ExpressionScanner {

    /** Returned by {@link #peek} when there is no next character. */
    static final int NONE = -1;

    private ExpressionScanner() {}

    /** Returns the character after {@code idx}, or {@link #NONE} at the end of input. */
    static int peek(String input, int idx) {
        if (idx + 1 < input.length()) {
            return input.charAt(idx + 1);
        }
        return NONE;
    }

    /**
     * Whether a field or generator delimited by {@code delimiter} starts at {@code idx}: the
     * character is the delimiter and is followed by something other than a second delimiter.
     */
    static boolean opensReference(String input, int idx, char delimiter) {
        int next = peek(input, idx);
        return next != NONE && input.charAt(idx) == delimiter && next != delimiter;
    }

    /** Collapses every doubled delimiter into a single one. */
    static String unescape(String input, char... delimiters) {
        String result = input;
        for (char d : delimiters) {
            result = result.replace(String.valueOf(new char[] {d, d}), String.valueOf(d));
        }
        return result;
    }

    /** Reason used when a field or generator is opened by the last character of an expression. */
    static String startAtEndReason(char current, char generatorDelimiter) {
        if (current == generatorDelimiter) {
            return "start of generator at end of expression";
        }
        return "start of field at end of expression";
    }
}
