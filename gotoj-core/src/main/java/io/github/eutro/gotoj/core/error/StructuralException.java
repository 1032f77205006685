package io.github.eutro.gotoj.core.error;

/**
 * Thrown when an irep tree does not have the shape that is expected of it.
 */
public class StructuralException extends GotoException {
    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
