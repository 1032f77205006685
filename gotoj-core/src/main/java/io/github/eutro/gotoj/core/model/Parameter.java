package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A formal parameter of a {@link Type.Code} type.
 */
public final class Parameter {
    @NotNull
    private final Type type;
    @Nullable
    private final String identifier;
    @Nullable
    private final String baseName;

    public Parameter(@NotNull Type type, @Nullable String identifier, @Nullable String baseName) {
        this.type = type;
        this.identifier = identifier;
        this.baseName = baseName;
    }

    /**
     * An unnamed parameter, as in a function declaration.
     *
     * @param type The type of the parameter.
     * @return The parameter.
     */
    public static Parameter anonymous(@NotNull Type type) {
        return new Parameter(type, null, null);
    }

    public @NotNull Type getType() {
        return type;
    }

    /**
     * The full name of the symbol the parameter is bound to in the body.
     *
     * @return The identifier, or null if unnamed.
     */
    public @Nullable String getIdentifier() {
        return identifier;
    }

    public @Nullable String getBaseName() {
        return baseName;
    }

    public Parameter withType(@NotNull Type type) {
        return new Parameter(type, identifier, baseName);
    }

    public Parameter withIdentifier(@Nullable String identifier) {
        return new Parameter(type, identifier, baseName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameter that = (Parameter) o;
        return type.equals(that.type)
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(baseName, that.baseName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, identifier, baseName);
    }

    @Override
    public String toString() {
        return identifier == null ? type.toString() : type + " " + identifier;
    }
}
