package io.github.eutro.gotoj.core.error;

/**
 * Thrown when a serialized program does not start with a header this reader understands.
 */
public class FormatVersionException extends GotoException {
    public FormatVersionException(String message) {
        super(message);
    }

    public FormatVersionException(String message, Throwable cause) {
        super(message, cause);
    }
}
