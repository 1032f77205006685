package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.GotoCompiler;
import io.github.eutro.gotoj.api.ProgramCompilation;
import org.jetbrains.annotations.NotNull;

/**
 * Fired when a program compilation is started.
 *
 * @see GotoCompiler
 * @see ProgramCompilation
 */
public class RunProgramCompilationEvent implements CompilerEvent {
    /**
     * The program compilation.
     */
    @NotNull
    public ProgramCompilation compilation;

    /**
     * Construct a new program compilation event.
     *
     * @param compilation The compilation.
     */
    public RunProgramCompilationEvent(@NotNull ProgramCompilation compilation) {
        this.compilation = compilation;
    }
}
