package io.keyexpr.core.error;

/**
 * Abstract base for all key-expression exceptions. Never thrown directly; use the concrete
 * subclasses under {@link KeyCompileException} or {@link KeyResultException}.
 */
public abstract class KeyGenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        EVALUATION
    }

    private final Phase phase;

    protected KeyGenException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected KeyGenException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
