package io.github.eutro.gotoj.core.error;

/**
 * Thrown when a required child is missing, an arity is wrong, or a payload cannot be parsed.
 */
public class MalformedTreeException extends StructuralException {
    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
