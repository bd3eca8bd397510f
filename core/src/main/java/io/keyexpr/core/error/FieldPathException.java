package io.keyexpr.core.error;

/**
 * Thrown when a field path is malformed: unbalanced backticks, an empty nested segment or a
 * leading period. Raised by the field-path grammar whether it is reached through an expression or
 * called directly.
 */
public final class FieldPathException extends KeyCompileException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public FieldPathException(String reason, String path) {
        super(reason);
        this.path = path;
    }

    /** The path that failed to parse. */
    public String path() {
        return path;
    }

    /** Alias for {@link #getMessage()}. */
    public String reason() {
        return getMessage();
    }
}
