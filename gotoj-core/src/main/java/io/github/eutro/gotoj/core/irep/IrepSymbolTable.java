package io.github.eutro.gotoj.core.irep;

import io.github.eutro.gotoj.core.error.NameCollisionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A symbol table in serialized form, as read and written by the codecs.
 * Symbols are kept in name order.
 */
public final class IrepSymbolTable {
    private final Map<String, IrepSymbol> symbols = new TreeMap<>();

    /**
     * Add a symbol.
     *
     * @param symbol The symbol.
     * @throws NameCollisionException If a symbol with the same name is present.
     */
    public void add(@NotNull IrepSymbol symbol) {
        IrepSymbol existing = symbols.putIfAbsent(symbol.getName(), symbol);
        if (existing != null) {
            NameCollisionException e = new NameCollisionException("duplicate symbol " + symbol.getName());
            e.withSymbolName(symbol.getName());
            throw e;
        }
    }

    public @Nullable IrepSymbol get(@NotNull String name) {
        return symbols.get(name);
    }

    public Collection<IrepSymbol> symbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return symbols.equals(((IrepSymbolTable) o).symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "IrepSymbolTable" + symbols.keySet();
    }
}
