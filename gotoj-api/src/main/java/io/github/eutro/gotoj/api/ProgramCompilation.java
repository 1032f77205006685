package io.github.eutro.gotoj.api;

import io.github.eutro.gotoj.api.events.*;
import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.PassRegistry;
import io.github.eutro.gotoj.core.passes.Pipeline;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Represents the compilation of a single program, given as a symbol table.
 * <p>
 * Compilation, performed when {@link #run()} is called, takes place as follows:
 * <ol>
 *     <li>{@link RunProgramCompilationEvent} is fired on the {@link GotoCompiler compiler}.</li>
 *     <li>{@link ModifyPipelineEvent} is fired.</li>
 *     <li>The pass names are {@link PassRegistry#resolve(List) resolved}. If any is unknown,
 *     compilation stops here and the table is left untouched.</li>
 *     <li>Each pass is run, and {@link PassCompletedEvent} is fired after it.</li>
 *     <li>The final table is encoded in the output format.</li>
 *     <li>{@link EmitProgramEvent} is fired.</li>
 * </ol>
 */
public class ProgramCompilation extends EventSupplier<ProgramCompileEvent> {
    private final GotoCompiler cc;

    /**
     * The program being compiled.
     */
    @NotNull
    public SymbolTable table;
    @NotNull
    private String name = "a";
    @NotNull
    private GotoFormat format = GotoFormat.BINARY;

    /**
     * Construct a new program compilation in the given compiler for the given table.
     *
     * @param cc    The compiler.
     * @param table The program being compiled.
     */
    ProgramCompilation(GotoCompiler cc, @NotNull SymbolTable table) {
        this.cc = cc;
        this.table = table;
    }

    /**
     * Run the compilation.
     * <p>
     * See the documentation of this class for details.
     *
     * @return The final symbol table.
     * @throws io.github.eutro.gotoj.core.error.PipelineConfigException If the pipeline names an unknown pass.
     * @throws io.github.eutro.gotoj.core.error.GotoException          If a pass or the encoder fails.
     */
    public SymbolTable run() {
        cc.dispatch(new RunProgramCompilationEvent(this));
        List<String> names = dispatch(new ModifyPipelineEvent(new ArrayList<>(PassRegistry.DEFAULT_PIPELINE)))
                .passes;
        Pipeline pipeline = cc.getRegistry().resolve(names);

        SymbolTable result = pipeline.run(table, (pass, out) ->
                dispatch(new PassCompletedEvent(pass, out)));

        byte[] bytes = format.encode(result);
        dispatch(new EmitProgramEvent(name, result, format, bytes));
        return result;
    }

    /**
     * Set the passes to run, replacing the default pipeline, by
     * {@link ModifyPipelineEvent modifying the pipeline}.
     *
     * @param passes The names of the passes.
     * @return This, for convenience.
     */
    public ProgramCompilation setPipeline(List<String> passes) {
        List<String> copy = new ArrayList<>(passes);
        listen(ModifyPipelineEvent.class, evt -> evt.passes = new ArrayList<>(copy));
        return this;
    }

    /**
     * Set the name of the emitted program.
     *
     * @param name The name.
     * @return This, for convenience.
     */
    public ProgramCompilation setName(@NotNull String name) {
        this.name = name;
        return this;
    }

    public @NotNull String getName() {
        return name;
    }

    /**
     * Set the format the program is emitted in.
     *
     * @param format The format.
     * @return This, for convenience.
     */
    public ProgramCompilation setFormat(@NotNull GotoFormat format) {
        this.format = format;
        return this;
    }

    public @NotNull GotoFormat getFormat() {
        return format;
    }
}
