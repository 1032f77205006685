package io.github.eutro.gotoj.api.events;

import io.github.eutro.gotoj.api.ProgramCompilation;
import io.github.eutro.gotoj.core.passes.PassRegistry;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Fired before the pipeline of a program compilation is resolved.
 * <p>
 * Listeners may edit the list of pass names, which starts out as
 * {@link PassRegistry#DEFAULT_PIPELINE}. Names are checked only after every listener has run.
 *
 * @see ProgramCompilation
 */
public class ModifyPipelineEvent implements ProgramCompileEvent {
    /**
     * The names of the passes to run, in order.
     */
    @NotNull
    public List<String> passes;

    /**
     * Construct a new modify-pipeline event with the given pass names.
     *
     * @param passes The mutable list of pass names.
     */
    public ModifyPipelineEvent(@NotNull List<String> passes) {
        this.passes = passes;
    }
}
