package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A declared entity of a program: a function, a variable, or a type definition.
 * <p>
 * Symbols are immutable; passes that change a symbol make a new one with {@link #toBuilder()}.
 * Empty strings for the optional names are treated as absent.
 */
public final class Symbol {
    @NotNull
    private final String name;
    @NotNull
    private final Type type;
    @NotNull
    private final SymbolValue value;
    @NotNull
    private final Location location;
    @Nullable
    private final String module;
    @Nullable
    private final String baseName;
    @Nullable
    private final String prettyName;
    @NotNull
    private final Mode mode;
    @NotNull
    private final Set<SymbolFlag> flags;

    private Symbol(Builder b) {
        this.name = b.name;
        this.type = b.type;
        this.value = b.value;
        this.location = b.location;
        this.module = b.module;
        this.baseName = b.baseName;
        this.prettyName = b.prettyName;
        this.mode = b.mode;
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(b.flags));
    }

    @Contract(pure = true)
    public static Builder builder(@NotNull String name, @NotNull Type type) {
        return new Builder(name, type);
    }

    /**
     * A function, with a body if it is defined.
     *
     * @param name The name.
     * @param type The function type.
     * @param body The body, or null for a declaration.
     * @param loc  The location.
     * @return The symbol.
     */
    public static Symbol function(@NotNull String name, @NotNull Type type, @Nullable Stmt body, @NotNull Location loc) {
        if (!type.isCode()) throw new IllegalArgumentException("function " + name + " of type " + type);
        return builder(name, type)
                .setValue(body == null ? SymbolValue.none() : SymbolValue.of(body))
                .setLocation(loc)
                .setBaseName(name)
                .setPrettyName(name)
                .build();
    }

    /**
     * A local variable.
     *
     * @param name     The full name.
     * @param baseName The name in the source.
     * @param type     The type.
     * @param loc      The location.
     * @return The symbol.
     */
    public static Symbol variable(@NotNull String name, @NotNull String baseName, @NotNull Type type, @NotNull Location loc) {
        return builder(name, type)
                .setLocation(loc)
                .setBaseName(baseName)
                .setPrettyName(baseName)
                .addFlag(SymbolFlag.LVALUE)
                .addFlag(SymbolFlag.STATE_VAR)
                .build();
    }

    public static Symbol staticVariable(@NotNull String name, @NotNull String baseName, @NotNull Type type,
                                        @Nullable Expr init, @NotNull Location loc) {
        return variable(name, baseName, type, loc).toBuilder()
                .setValue(init == null ? SymbolValue.none() : SymbolValue.of(init))
                .addFlag(SymbolFlag.STATIC_LIFETIME)
                .build();
    }

    /**
     * The definition of a struct or union type, complete or not.
     *
     * @param type The aggregate type.
     * @param loc  The location.
     * @return The symbol, named {@code tag-<tag>}.
     */
    public static Symbol aggregate(@NotNull Type type, @NotNull Location loc) {
        String tag;
        if (type instanceof Type.Struct) tag = ((Type.Struct) type).getTag();
        else if (type instanceof Type.Union) tag = ((Type.Union) type).getTag();
        else if (type instanceof Type.IncompleteStruct) tag = ((Type.IncompleteStruct) type).getTag();
        else if (type instanceof Type.IncompleteUnion) tag = ((Type.IncompleteUnion) type).getTag();
        else throw new IllegalArgumentException("not an aggregate type: " + type);
        return builder(Type.aggregateTag(tag), type)
                .setLocation(loc)
                .setBaseName(tag)
                .setPrettyName(tag)
                .addFlag(SymbolFlag.TYPE)
                .build();
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull Type getType() {
        return type;
    }

    public @NotNull SymbolValue getValue() {
        return value;
    }

    public @NotNull Location getLocation() {
        return location;
    }

    public @Nullable String getModule() {
        return module;
    }

    public @Nullable String getBaseName() {
        return baseName;
    }

    public @Nullable String getPrettyName() {
        return prettyName;
    }

    public @NotNull Mode getMode() {
        return mode;
    }

    public @NotNull Set<SymbolFlag> getFlags() {
        return flags;
    }

    public boolean is(SymbolFlag flag) {
        return flags.contains(flag);
    }

    public boolean isType() {
        return is(SymbolFlag.TYPE);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name, type);
        b.value = value;
        b.location = location;
        b.module = module;
        b.baseName = baseName;
        b.prettyName = prettyName;
        b.mode = mode;
        b.flags.addAll(flags);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return name.equals(symbol.name)
                && type.equals(symbol.type)
                && value.equals(symbol.value)
                && location.equals(symbol.location)
                && Objects.equals(module, symbol.module)
                && Objects.equals(baseName, symbol.baseName)
                && Objects.equals(prettyName, symbol.prettyName)
                && mode == symbol.mode
                && flags.equals(symbol.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, value, location, module, baseName, prettyName, mode, flags);
    }

    @Override
    public String toString() {
        return "Symbol{" + name + ": " + type + "}";
    }

    /**
     * The language a symbol comes from.
     */
    public enum Mode {
        C("C"),
        RUST("Rust"),
        ;

        private final String text;

        Mode(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }

        public static @Nullable Mode fromText(String text) {
            for (Mode mode : values()) {
                if (mode.text.equals(text)) return mode;
            }
            return null;
        }
    }

    public static class Builder {
        private String name;
        private Type type;
        private SymbolValue value = SymbolValue.none();
        private Location location = Location.NONE;
        private String module;
        private String baseName;
        private String prettyName;
        private Mode mode = Mode.C;
        private final EnumSet<SymbolFlag> flags = EnumSet.noneOf(SymbolFlag.class);

        private Builder(@NotNull String name, @NotNull Type type) {
            this.name = name;
            this.type = type;
        }

        public Builder setName(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder setType(@NotNull Type type) {
            this.type = type;
            return this;
        }

        public Builder setValue(@NotNull SymbolValue value) {
            this.value = value;
            return this;
        }

        public Builder setLocation(@NotNull Location location) {
            this.location = location;
            return this;
        }

        public Builder setModule(@Nullable String module) {
            this.module = emptyToNull(module);
            return this;
        }

        public Builder setBaseName(@Nullable String baseName) {
            this.baseName = emptyToNull(baseName);
            return this;
        }

        public Builder setPrettyName(@Nullable String prettyName) {
            this.prettyName = emptyToNull(prettyName);
            return this;
        }

        public Builder setMode(@NotNull Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder addFlag(@NotNull SymbolFlag flag) {
            flags.add(flag);
            return this;
        }

        public Builder removeFlag(@NotNull SymbolFlag flag) {
            flags.remove(flag);
            return this;
        }

        public Builder setFlags(@NotNull Set<SymbolFlag> flags) {
            this.flags.clear();
            this.flags.addAll(flags);
            return this;
        }

        public Symbol build() {
            return new Symbol(this);
        }

        private static @Nullable String emptyToNull(@Nullable String s) {
            return s == null || s.isEmpty() ? null : s;
        }
    }
}
