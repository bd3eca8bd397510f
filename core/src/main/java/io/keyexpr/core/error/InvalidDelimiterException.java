package io.keyexpr.core.error;

/** Thrown when a field/generator delimiter pair is unusable (zero, '.', '`' or equal). */
public final class InvalidDelimiterException extends KeyCompileException {

    private static final long serialVersionUID = 1L;

    public InvalidDelimiterException(String message) {
        super(message);
    }
}
