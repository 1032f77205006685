package io.github.eutro.gotoj.core.error;

/**
 * Thrown when an irep id is not a recognised discriminator where it is read,
 * or is outside the known vocabulary when it is written.
 */
public class UnknownTagException extends StructuralException {
    public UnknownTagException(String message) {
        super(message);
    }

    public UnknownTagException(String message, Throwable cause) {
        super(message, cause);
    }
}
