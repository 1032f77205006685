package io.github.eutro.gotoj.core.irep;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A symbol as it is serialized: its type, value and location as {@link Irep}s,
 * and its names and flags.
 * <p>
 * Absent strings are empty, and an absent value or location is {@link Irep#nil() nil}.
 */
public final class IrepSymbol {
    private final Irep type;
    private final Irep value;
    private final Irep location;
    private final String name;
    private final String module;
    private final String baseName;
    private final String prettyName;
    private final String mode;
    private final Set<SymbolFlag> flags;

    public IrepSymbol(@NotNull Irep type, @NotNull Irep value, @NotNull Irep location,
                      @NotNull String name, @NotNull String module, @NotNull String baseName,
                      @NotNull String prettyName, @NotNull String mode, @NotNull Set<SymbolFlag> flags) {
        this.type = type;
        this.value = value;
        this.location = location;
        this.name = name;
        this.module = module;
        this.baseName = baseName;
        this.prettyName = prettyName;
        this.mode = mode;
        EnumSet<SymbolFlag> copy = EnumSet.noneOf(SymbolFlag.class);
        copy.addAll(flags);
        this.flags = Collections.unmodifiableSet(copy);
    }

    public Irep getType() {
        return type;
    }

    public Irep getValue() {
        return value;
    }

    public Irep getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public String getModule() {
        return module;
    }

    public String getBaseName() {
        return baseName;
    }

    public String getPrettyName() {
        return prettyName;
    }

    public String getMode() {
        return mode;
    }

    public Set<SymbolFlag> getFlags() {
        return flags;
    }

    public boolean is(SymbolFlag flag) {
        return flags.contains(flag);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IrepSymbol that = (IrepSymbol) o;
        return name.equals(that.name)
                && module.equals(that.module)
                && baseName.equals(that.baseName)
                && prettyName.equals(that.prettyName)
                && mode.equals(that.mode)
                && flags.equals(that.flags)
                && type.equals(that.type)
                && value.equals(that.value)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, module, baseName, prettyName, mode, flags, type, value, location);
    }

    @Override
    public String toString() {
        return "IrepSymbol{" + name + "}";
    }
}
