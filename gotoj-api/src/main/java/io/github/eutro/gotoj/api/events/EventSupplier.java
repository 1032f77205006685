package io.github.eutro.gotoj.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * The firing side of an {@link EventDispatcher}.
 * <p>
 * Listeners run in the order they were added, and one listener added twice runs twice.
 * Listeners added during a dispatch only see later events.
 *
 * @param <S> The type of events fired.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private static final Logger LOGGER = Logger.getLogger(EventSupplier.class.getName());

    private final Map<Class<?>, List<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, k -> new CopyOnWriteArrayList<>()).add(listener);
    }

    /**
     * Fire an event at the listeners of its exact class.
     * A {@link CancellableEvent} stops at the first listener that cancels it.
     *
     * @param event The event.
     * @param <T>   The type of the event.
     * @return The event, after every listener has seen it.
     */
    public <T extends S> T dispatch(@NotNull T event) {
        List<Consumer<?>> forClass = listeners.getOrDefault(event.getClass(), Collections.emptyList());
        LOGGER.finer(() -> "Dispatching " + event.getClass().getSimpleName() + " to " + forClass.size() + " listeners");
        for (Consumer<?> listener : forClass) {
            @SuppressWarnings("unchecked")
            Consumer<T> typed = (Consumer<T>) listener;
            typed.accept(event);
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) break;
        }
        return event;
    }
}
