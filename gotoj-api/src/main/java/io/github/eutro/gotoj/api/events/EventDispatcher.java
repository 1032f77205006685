package io.github.eutro.gotoj.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Something that fires events of type {@code S}, which listeners can subscribe to.
 * Listeners are keyed by the exact class of the event.
 *
 * @param <S> The type of events fired.
 */
public interface EventDispatcher<S> {
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);

    /**
     * Collect every future event of the given class into a queue.
     *
     * @param eventClass The event class.
     * @param <T>        The event type.
     * @return The queue, which is unbounded.
     */
    default <T extends S> BlockingQueue<T> queue(Class<T> eventClass) {
        BlockingQueue<T> queue = new LinkedBlockingQueue<>();
        listen(eventClass, queue::add);
        return queue;
    }
}
