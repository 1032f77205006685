package io.github.eutro.gotoj.core.ext;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Something exts can be recorded on. Values are never null; attaching
 * an ext twice replaces its value.
 */
public abstract class ExtHolder {
    private final SortedMap<Ext<?>, Object> exts = new TreeMap<>();

    public <T> void attachExt(@NotNull Ext<T> ext, @NotNull T value) {
        exts.put(ext, ext.cast(value));
    }

    public void removeExt(@NotNull Ext<?> ext) {
        exts.remove(ext);
    }

    public <T> @Nullable T getNullable(@NotNull Ext<T> ext) {
        Object value = exts.get(ext);
        return value == null ? null : ext.cast(value);
    }

    public <T> Optional<T> getExt(@NotNull Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get a fact that an earlier pass must have recorded.
     *
     * @param ext The ext.
     * @param <T> The type of its value.
     * @return The value.
     * @throws IllegalStateException If nothing was recorded.
     */
    public <T> T getExtOrThrow(@NotNull Ext<T> ext) {
        T value = getNullable(ext);
        if (value == null) throw new IllegalStateException("missing " + ext);
        return value;
    }

    /**
     * The exts recorded here, in name order.
     *
     * @return A read-only view.
     */
    public Set<Ext<?>> extKeys() {
        return Collections.unmodifiableSet(exts.keySet());
    }

    /**
     * Carry every fact recorded on {@code from} over to this holder, sharing the values.
     *
     * @param from The holder to copy from.
     */
    protected void copyExtsFrom(@NotNull ExtHolder from) {
        exts.putAll(from.exts);
    }
}
