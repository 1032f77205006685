package io.github.eutro.gotoj.api;

import io.github.eutro.gotoj.api.bits.Bit;
import io.github.eutro.gotoj.api.events.*;
import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.PassRegistry;
import io.github.eutro.gotoj.core.passes.convert.IrepToGoto;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * The entrypoint to the API. Symbol tables are submitted to a compiler, which
 * prepares them for the verifier by running them through a pipeline of passes.
 */
public class GotoCompiler extends EventSupplier<CompilerEvent> {
    private final PassRegistry registry;

    /**
     * Construct a compiler which knows the {@link PassRegistry#defaults() default passes}.
     */
    public GotoCompiler() {
        this(PassRegistry.defaults());
    }

    /**
     * Construct a compiler which resolves pipelines in the given registry.
     *
     * @param registry The registry.
     */
    public GotoCompiler(@NotNull PassRegistry registry) {
        this.registry = registry;
    }

    public PassRegistry getRegistry() {
        return registry;
    }

    /**
     * Submit a symbol table for compilation. The table will be consumed when the compilation is run.
     *
     * @param table The table.
     * @return The compilation.
     */
    @Contract(pure = true)
    public ProgramCompilation submit(@NotNull SymbolTable table) {
        return newCompilation(table);
    }

    /**
     * Read a symbol table and submit it for compilation.
     *
     * @param stream The stream to read from.
     * @param format The format of the table.
     * @return The compilation.
     * @throws IOException If reading fails.
     */
    @Contract(pure = true)
    public ProgramCompilation submit(InputStream stream, GotoFormat format) throws IOException {
        return submit(IrepToGoto.INSTANCE.run(format.read(stream)));
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    private ProgramCompilation newCompilation(SymbolTable table) {
        return new ProgramCompilation(this, table);
    }

    /**
     * Get a dispatcher on which listeners for the events of every compilation can be registered.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<ProgramCompileEvent> lift() {
        return new EventDispatcher<ProgramCompileEvent>() {
            @Override
            public <T extends ProgramCompileEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                GotoCompiler.this.listen(RunProgramCompilationEvent.class, evt ->
                        evt.compilation.listen(eventClass, listener));
            }
        };
    }

    /**
     * Collect the programs emitted by every compilation into a queue.
     *
     * @return The queue.
     */
    public BlockingQueue<EmitProgramEvent> outputsAsQueue() {
        return lift().queue(EmitProgramEvent.class);
    }

    public <R> R add(Bit<R> bit) {
        return bit.addTo(this);
    }
}
