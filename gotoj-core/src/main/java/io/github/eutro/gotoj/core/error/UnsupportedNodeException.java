package io.github.eutro.gotoj.core.error;

/**
 * Thrown by a pass that encounters a node it has no rule for.
 */
public class UnsupportedNodeException extends GotoException {
    public UnsupportedNodeException(String message) {
        super(message);
    }
}
