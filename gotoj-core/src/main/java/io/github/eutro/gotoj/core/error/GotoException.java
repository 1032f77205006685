package io.github.eutro.gotoj.core.error;

import io.github.eutro.gotoj.core.model.Location;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The base of all errors raised while building, converting, transforming or
 * encoding goto programs.
 * <p>
 * Where it is known, the exception carries the name of the symbol and the
 * {@link Location} of the node that caused it. Both may be filled in after
 * construction by a caller with more context, but never overwritten.
 */
public class GotoException extends RuntimeException {
    @Nullable
    private String symbolName;
    @Nullable
    private Location location;

    public GotoException(String message) {
        super(message);
    }

    public GotoException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Get the name of the symbol in which this error occurred, if known.
     *
     * @return The symbol name, or null.
     */
    public @Nullable String getSymbolName() {
        return symbolName;
    }

    /**
     * Get the location of the node at which this error occurred, if known.
     *
     * @return The location, or null.
     */
    public @Nullable Location getLocation() {
        return location;
    }

    /**
     * Record the symbol this error occurred in, if none has been recorded yet.
     *
     * @param symbolName The symbol name.
     * @return This, for chaining.
     */
    public GotoException withSymbolName(@Nullable String symbolName) {
        if (this.symbolName == null) this.symbolName = symbolName;
        return this;
    }

    /**
     * Record the location this error occurred at, if none has been recorded yet.
     * An unknown location is not recorded.
     *
     * @param location The location.
     * @return This, for chaining.
     */
    public GotoException withLocation(@Nullable Location location) {
        if (this.location == null && location != null && !location.isNone()) {
            this.location = location;
        }
        return this;
    }

    /**
     * Get the message without symbol or location context.
     *
     * @return The bare message.
     */
    public @NotNull String getBareMessage() {
        String message = super.getMessage();
        return message == null ? "" : message;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(getBareMessage());
        if (symbolName != null) {
            sb.append(" (in symbol ").append(symbolName).append(')');
        }
        if (location != null) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
