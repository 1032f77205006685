package io.github.eutro.gotoj.core.passes.meta;

import io.github.eutro.gotoj.core.error.StructuralException;
import io.github.eutro.gotoj.core.model.Symbol;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.model.Type;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.Transformer;

/**
 * Checks that every struct and union tag refers to a type symbol named
 * {@code tag-<tag>} that defines an aggregate of the same kind.
 * The program itself is unchanged.
 */
public class ValidateTags implements IRPass<SymbolTable, SymbolTable> {
    /**
     * A singleton instance of this pass.
     */
    public static final ValidateTags INSTANCE = new ValidateTags();

    @Override
    public SymbolTable run(SymbolTable table) {
        return new Validator(table).transform();
    }

    private static class Validator extends Transformer {
        Validator(SymbolTable table) {
            super(table);
        }

        @Override
        public Type visitStructTag(Type.StructTag t) {
            check(t.getIdentifier(), true);
            return t;
        }

        @Override
        public Type visitUnionTag(Type.UnionTag t) {
            check(t.getIdentifier(), false);
            return t;
        }

        private void check(String name, boolean struct) {
            Symbol symbol = inputSymbol(name);
            if (symbol == null) {
                throw new StructuralException("no aggregate defined for tag " + name);
            }
            Type type = symbol.getType();
            boolean isStruct = type instanceof Type.Struct || type instanceof Type.IncompleteStruct;
            boolean isUnion = type instanceof Type.Union || type instanceof Type.IncompleteUnion;
            if (!symbol.isType() || (struct ? !isStruct : !isUnion)) {
                throw new StructuralException(name + " does not define a " + (struct ? "struct" : "union")
                        + ", it has type " + type);
            }
        }
    }
}
