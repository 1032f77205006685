package io.github.eutro.gotoj.core.passes.convert;

import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.model.MachineModel;
import io.github.eutro.gotoj.core.model.Symbol;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.IRPass;

/**
 * Converts a {@link SymbolTable} to its serialized form, including the
 * {@link MachineModelSymbols machine model symbols}.
 * <p>
 * The input table is only read, and remains usable afterwards.
 */
public class GotoToIrep implements IRPass<SymbolTable, IrepSymbolTable> {
    /**
     * A singleton instance of this pass.
     */
    public static final GotoToIrep INSTANCE = new GotoToIrep();

    @Override
    public IrepSymbolTable run(SymbolTable table) {
        MachineModel mm = table.getMachineModel();
        ToIrep toIrep = new ToIrep(mm);
        IrepSymbolTable out = new IrepSymbolTable();
        MachineModelSymbols.toSymbols(mm).forEach(out::add);
        for (Symbol symbol : table.symbols()) {
            out.add(toIrep.symbol(symbol));
        }
        return out;
    }
}
