package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.ProgramCompilation;
import io.github.eutro.gotoj.core.model.SymbolTable;
import org.jetbrains.annotations.NotNull;

/**
 * Fired after each pass of a program compilation's pipeline.
 * <p>
 * The table will be consumed by the next pass, so listeners must not keep it.
 *
 * @see ProgramCompilation
 */
public class PassCompletedEvent implements ProgramCompileEvent {
    /**
     * The name of the pass that ran.
     */
    @NotNull
    public final String pass;
    /**
     * The table it produced.
     */
    @NotNull
    public final SymbolTable table;

    public PassCompletedEvent(@NotNull String pass, @NotNull SymbolTable table) {
        this.pass = pass;
        this.table = table;
    }
}
