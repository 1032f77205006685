package io.github.eutro.gotoj.core.passes.convert;

import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.model.MachineModel;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.IRPass;
import org.jetbrains.annotations.NotNull;

import java.util.logging.Logger;

/**
 * Reads a {@link SymbolTable} back from its serialized form.
 * <p>
 * The machine model is read from the {@link MachineModelSymbols machine model symbols},
 * which are not included in the result. If the table has none of them, the fallback
 * model is used instead.
 */
public class IrepToGoto implements IRPass<IrepSymbolTable, SymbolTable> {
    private static final Logger LOGGER = Logger.getLogger(IrepToGoto.class.getName());

    /**
     * An instance of this pass which falls back to {@link MachineModel#X86_64}.
     */
    public static final IrepToGoto INSTANCE = new IrepToGoto(MachineModel.X86_64);

    private final MachineModel fallback;

    public IrepToGoto(@NotNull MachineModel fallback) {
        this.fallback = fallback;
    }

    @Override
    public SymbolTable run(IrepSymbolTable table) {
        MachineModel mm = MachineModelSymbols.fromSymbols(table);
        if (mm == null) {
            LOGGER.warning("No machine model symbols in table, assuming " + fallback.getArchitecture());
            mm = fallback;
        }
        FromIrep fromIrep = new FromIrep(mm);
        SymbolTable out = SymbolTable.withMachineModel(mm);
        for (IrepSymbol symbol : table.symbols()) {
            if (MachineModelSymbols.isMachineModelSymbol(symbol.getName())) continue;
            out.insert(fromIrep.symbol(symbol));
        }
        return out;
    }
}
