package io.github.eutro.gotoj.core.passes.misc;

import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.Transformer;

/**
 * A pass which changes nothing, but still consumes its input and rebuilds every symbol.
 */
public class Identity implements IRPass<SymbolTable, SymbolTable> {
    /**
     * A singleton instance of this pass.
     */
    public static final Identity INSTANCE = new Identity();

    @Override
    public SymbolTable run(SymbolTable table) {
        return new Transformer(table) {
        }.transform();
    }
}
