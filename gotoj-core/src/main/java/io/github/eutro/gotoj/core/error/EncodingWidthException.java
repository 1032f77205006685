package io.github.eutro.gotoj.core.error;

/**
 * Thrown when a literal does not fit, or disagrees with, the width of its type.
 */
public class EncodingWidthException extends GotoException {
    public EncodingWidthException(String message) {
        super(message);
    }

    public EncodingWidthException(String message, Throwable cause) {
        super(message, cause);
    }
}
