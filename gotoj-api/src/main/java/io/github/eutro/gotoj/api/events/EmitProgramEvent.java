package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.ProgramCompilation;
import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.model.SymbolTable;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a compiled program should be emitted.
 *
 * @see ProgramCompilation
 */
public class EmitProgramEvent extends CancellableEvent implements ProgramCompileEvent {
    /**
     * The name of the program.
     */
    @NotNull
    public final String name;
    /**
     * The final symbol table.
     */
    @NotNull
    public final SymbolTable table;
    /**
     * The format {@link #bytes} are encoded in.
     */
    @NotNull
    public final GotoFormat format;
    /**
     * The encoded table.
     */
    public final byte @NotNull [] bytes;

    /**
     * Construct a new program emit event.
     *
     * @param name   The name of the program.
     * @param table  The table.
     * @param format The format it was encoded in.
     * @param bytes  The encoded table.
     */
    public EmitProgramEvent(@NotNull String name, @NotNull SymbolTable table,
                            @NotNull GotoFormat format, byte @NotNull [] bytes) {
        this.name = name;
        this.table = table;
        this.format = format;
        this.bytes = bytes;
    }
}
