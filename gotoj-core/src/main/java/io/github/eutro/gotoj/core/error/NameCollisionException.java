package io.github.eutro.gotoj.core.error;

/**
 * Thrown when a symbol is inserted into a table that already has a symbol of the same name,
 * or whose name is reserved for the machine model.
 */
public class NameCollisionException extends GotoException {
    public NameCollisionException(String message) {
        super(message);
    }
}
