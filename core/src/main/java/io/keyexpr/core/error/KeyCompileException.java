package io.keyexpr.core.error;

/**
 * Abstract parent for compile-time errors. Thrown while turning an expression (or a standalone
 * field path) into a {@link io.keyexpr.core.engine.KeyGenerator}. These are permanent for the
 * given input: the caller has to fix the expression and compile again.
 */
public abstract class KeyCompileException extends KeyGenException {

    private static final long serialVersionUID = 1L;

    protected KeyCompileException(String message) {
        super(message, Phase.COMPILE);
    }

    protected KeyCompileException(String message, Throwable cause) {
        super(message, cause, Phase.COMPILE);
    }
}
