package io.keyexpr.core.error;

/**
 * Thrown when a key expression has invalid syntax. Carries the character index at which the
 * problem was detected and a short reason, rendered as {@code error in key expression at char
 * <index>, <reason>}.
 */
public class KeyExpressionException extends KeyCompileException {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final String reason;

    public KeyExpressionException(int index, String reason) {
        super(String.format("error in key expression at char %d, %s", index, reason));
        this.index = index;
        this.reason = reason;
    }

    /** For subclasses that do not point at a position in the expression. */
    protected KeyExpressionException(String message) {
        super(message);
        this.index = 0;
        this.reason = message;
    }

    /** The character index reported for the error, or {@code 0} if there is no position. */
    public int index() {
        return index;
    }

    /** The reason without the position prefix. */
    public String reason() {
        return reason;
    }
}
