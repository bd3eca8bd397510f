package io.keyexpr.core.error;

/** Thrown when the caller supplies an empty (or {@code null}) key expression. */
public final class EmptyExpressionException extends KeyExpressionException {

    private static final long serialVersionUID = 1L;

    public static final String MESSAGE = "key generator contains an empty expression";

    public EmptyExpressionException() {
        super(MESSAGE);
    }
}
