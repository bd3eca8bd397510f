package io.keyexpr.core.error;

/**
 * Thrown when generating a key for one document fails: the referenced field is missing, null or
 * not a scalar, or the generated key is empty or too long. These are routine outcomes for bad
 * documents; batch callers should catch them per document and carry on.
 */
public final class KeyResultException extends KeyGenException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public KeyResultException(String reason) {
        super("key generation for document failed, " + reason, Phase.EVALUATION);
        this.reason = reason;
    }

    public KeyResultException(String reason, Throwable cause) {
        super("key generation for document failed, " + reason, cause, Phase.EVALUATION);
        this.reason = reason;
    }

    /** The reason without the message prefix. */
    public String reason() {
        return reason;
    }
}
