package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A field of a struct or union type, or padding between fields.
 */
public final class DatatypeComponent {
    @NotNull
    private final String name;
    @NotNull
    private final Type type;
    private final boolean padding;

    private DatatypeComponent(@NotNull String name, @NotNull Type type, boolean padding) {
        this.name = name;
        this.type = type;
        this.padding = padding;
    }

    public static DatatypeComponent field(@NotNull String name, @NotNull Type type) {
        return new DatatypeComponent(name, type, false);
    }

    /**
     * Padding of the given number of bits, modelled as an unsigned bit-vector.
     *
     * @param name The name of the padding, which must still be unique in the aggregate.
     * @param bits The size in bits.
     * @return The component.
     */
    public static DatatypeComponent padding(@NotNull String name, int bits) {
        return new DatatypeComponent(name, Type.unsignedInt(bits), true);
    }

    public static DatatypeComponent of(@NotNull String name, @NotNull Type type, boolean padding) {
        return new DatatypeComponent(name, type, padding);
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Type getType() {
        return type;
    }

    public boolean isPadding() {
        return padding;
    }

    public DatatypeComponent withType(@NotNull Type type) {
        return new DatatypeComponent(name, type, padding);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatatypeComponent that = (DatatypeComponent) o;
        return padding == that.padding && name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, padding);
    }

    @Override
    public String toString() {
        return (padding ? "<padding> " : "") + type + " " + name;
    }
}
