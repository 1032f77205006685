package io.github.eutro.gotoj.api.events;

/**
 * Base class of events which announce something that listeners may veto.
 * Once cancelled, the event reaches no further listeners.
 */
public abstract class CancellableEvent {
    private boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        cancelled = true;
    }
}
