package io.github.eutro.gotoj.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A named, typed fact that a pass can record on a {@link ExtHolder}.
 * <p>
 * Names are unique, and exts sort by name.
 *
 * @param <T> The type of the recorded value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final Map<String, Ext<?>> BY_NAME = new ConcurrentHashMap<>();

    private final String name;
    private final Class<?> valueClass;

    private Ext(String name, Class<?> valueClass) {
        this.name = name;
        this.valueClass = valueClass;
    }

    /**
     * Declare an ext.
     * <p>
     * {@code valueClass} may be the raw class of a generic {@code R}, such as {@code Map.class}
     * for an {@code Ext<Map<String, String>>}.
     *
     * @param valueClass The class of the values.
     * @param name       The unique name.
     * @param <T>        The class of the values.
     * @param <R>        The type of the values.
     * @return The ext.
     * @throws IllegalArgumentException If the name is taken.
     */
    public static <T, R extends T> Ext<R> create(Class<T> valueClass, String name) {
        Ext<R> ext = new Ext<>(name, valueClass);
        if (BY_NAME.putIfAbsent(name, ext) != null) {
            throw new IllegalArgumentException("ext " + name + " already exists");
        }
        return ext;
    }

    public String getName() {
        return name;
    }

    @SuppressWarnings("unchecked")
    T cast(Object value) {
        return (T) valueClass.cast(value);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name + " (" + valueClass.getSimpleName() + ")";
    }
}
