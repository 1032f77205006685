package io.github.eutro.gotoj.core.passes;

import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.model.SymbolTable;

/**
 * A step from one representation of a goto program to another.
 * <p>
 * Most passes take a {@link SymbolTable} to a new {@link SymbolTable}, consuming the input.
 * The conversion passes move between the typed model and an {@link IrepSymbolTable}.
 *
 * @param <A> The representation consumed.
 * @param <B> The representation produced.
 */
@FunctionalInterface
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Feed the output of this pass into {@code next}.
     *
     * @param next The pass to run on the output.
     * @param <C>  What {@code next} produces.
     * @return A pass running both.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        IRPass<A, B> first = this;
        return a -> next.run(first.run(a));
    }
}
