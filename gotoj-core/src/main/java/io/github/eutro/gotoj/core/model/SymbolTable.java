package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.error.NameCollisionException;
import io.github.eutro.gotoj.core.ext.ExtHolder;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The symbols of a compilation unit, by name, and the {@link MachineModel} they are laid out for.
 * <p>
 * Symbols are iterated in name order. A table is built up by {@link #insert(Symbol) inserting}
 * symbols, and is then handed to passes, each of which {@link #consume() consumes} it and
 * produces a new table. A consumed table can no longer be used.
 * <p>
 * Passes may leave metadata on a table as {@link io.github.eutro.gotoj.core.ext.Ext exts};
 * these are not part of the program, and are ignored by {@link #equals(Object)}.
 */
public final class SymbolTable extends ExtHolder {
    private final Map<String, Symbol> symbols = new TreeMap<>();
    @NotNull
    private MachineModel machineModel;
    private boolean consumed;

    public SymbolTable(@NotNull MachineModel machineModel) {
        this.machineModel = machineModel;
    }

    /**
     * Create an empty table for the given machine.
     *
     * @param machineModel The machine model.
     * @return The new table.
     */
    @Contract(pure = true)
    public static SymbolTable withMachineModel(@NotNull MachineModel machineModel) {
        return new SymbolTable(machineModel);
    }

    public @NotNull MachineModel getMachineModel() {
        checkLive();
        return machineModel;
    }

    /**
     * Change the machine model. This is only possible while the table is empty.
     *
     * @param machineModel The new machine model.
     * @throws IllegalStateException If any symbol has been inserted.
     */
    public void setMachineModel(@NotNull MachineModel machineModel) {
        checkLive();
        if (!symbols.isEmpty()) {
            throw new IllegalStateException("cannot change the machine model of a table with symbols in it");
        }
        this.machineModel = machineModel;
    }

    /**
     * Insert a symbol into the table.
     *
     * @param symbol The symbol.
     * @throws NameCollisionException If there is already a symbol of the same name, or the name is
     *                                one of the {@link MachineModel#SYMBOL_NAMES machine model's};
     *                                in either case the table is unchanged.
     */
    public void insert(@NotNull Symbol symbol) {
        checkLive();
        if (MachineModel.SYMBOL_NAMES.contains(symbol.getName())) {
            NameCollisionException e = new NameCollisionException("the name " + symbol.getName()
                    + " is reserved for the machine model");
            e.withSymbolName(symbol.getName()).withLocation(symbol.getLocation());
            throw e;
        }
        Symbol existing = symbols.putIfAbsent(symbol.getName(), symbol);
        if (existing != null) {
            NameCollisionException e = new NameCollisionException("a symbol named " + symbol.getName()
                    + " is already declared at " + existing.getLocation());
            e.withSymbolName(symbol.getName()).withLocation(symbol.getLocation());
            throw e;
        }
    }

    public Optional<Symbol> lookup(@NotNull String name) {
        return Optional.ofNullable(get(name));
    }

    public @Nullable Symbol get(@NotNull String name) {
        checkLive();
        return symbols.get(name);
    }

    public boolean contains(@NotNull String name) {
        checkLive();
        return symbols.containsKey(name);
    }

    /**
     * Get every symbol, in name order.
     *
     * @return The symbols.
     */
    public Collection<Symbol> symbols() {
        checkLive();
        return Collections.unmodifiableCollection(symbols.values());
    }

    public Set<String> names() {
        checkLive();
        return Collections.unmodifiableSet(symbols.keySet());
    }

    public int size() {
        checkLive();
        return symbols.size();
    }

    /**
     * Create an empty table with the same machine model and exts as this one.
     *
     * @return The new table.
     */
    public SymbolTable emptyCopy() {
        checkLive();
        SymbolTable table = new SymbolTable(machineModel);
        table.copyExtsFrom(this);
        return table;
    }

    /**
     * Mark this table as consumed, after which any use of it throws.
     *
     * @throws IllegalStateException If it was already consumed.
     */
    public void consume() {
        checkLive();
        consumed = true;
    }

    public boolean isConsumed() {
        return consumed;
    }

    private void checkLive() {
        if (consumed) {
            throw new IllegalStateException("symbol table has already been consumed by a pass");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SymbolTable that = (SymbolTable) o;
        checkLive();
        that.checkLive();
        return machineModel.equals(that.machineModel) && symbols.equals(that.symbols);
    }

    @Override
    public int hashCode() {
        return 31 * machineModel.hashCode() + symbols.hashCode();
    }

    @Override
    public String toString() {
        if (consumed) return "SymbolTable<consumed>";
        return "SymbolTable{" + machineModel + ", " + symbols.keySet() + "}";
    }
}
