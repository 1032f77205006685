package io.github.eutro.gotoj.core.passes;

import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.model.SymbolTable;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * An ordered sequence of named passes, as {@link PassRegistry#resolve(List) resolved} from a list of names.
 * <p>
 * Running a pipeline runs each pass on the result of the previous one, recording the
 * names of the passes run in {@link CommonExts#PASS_TRACE}. An empty pipeline returns its
 * input as is.
 */
public final class Pipeline implements IRPass<SymbolTable, SymbolTable> {
    private static final Logger LOGGER = Logger.getLogger(Pipeline.class.getName());

    private final List<String> names;
    private final List<IRPass<SymbolTable, SymbolTable>> passes;

    Pipeline(List<String> names, List<IRPass<SymbolTable, SymbolTable>> passes) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.passes = Collections.unmodifiableList(new ArrayList<>(passes));
    }

    /**
     * Get the names of the passes in this pipeline, in order.
     *
     * @return The names.
     */
    public List<String> getNames() {
        return names;
    }

    @Override
    public SymbolTable run(SymbolTable table) {
        return run(table, null);
    }

    /**
     * Run the pipeline, notifying a listener after each pass.
     *
     * @param table    The input table, which is consumed.
     * @param listener The listener, or null.
     * @return The output table.
     */
    public SymbolTable run(@NotNull SymbolTable table, @Nullable Listener listener) {
        SymbolTable current = table;
        for (int i = 0; i < passes.size(); i++) {
            current = step(names.get(i), passes.get(i), current, listener);
        }
        return current;
    }

    private static SymbolTable step(
            String name,
            IRPass<SymbolTable, SymbolTable> pass,
            SymbolTable table,
            @Nullable Listener listener
    ) {
        List<String> trace = new ArrayList<>(table.getExt(CommonExts.PASS_TRACE).orElse(Collections.emptyList()));
        int before = table.size();
        LOGGER.fine(() -> "Running pass " + name + " on " + before + " symbols");
        SymbolTable out;
        try {
            out = pass.run(table);
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("in pass " + name));
            throw e;
        }
        trace.add(name);
        out.attachExt(CommonExts.PASS_TRACE, Collections.unmodifiableList(trace));
        LOGGER.fine(() -> "Pass " + name + " produced " + out.size() + " symbols");
        if (listener != null) listener.passCompleted(name, out);
        return out;
    }

    @Override
    public String toString() {
        return "Pipeline" + names;
    }

    /**
     * Notified of the result of each pass of a pipeline.
     */
    public interface Listener {
        /**
         * Called after a pass has run.
         *
         * @param name   The name of the pass.
         * @param result The table it produced, which the next pass will consume.
         */
        void passCompleted(String name, SymbolTable result);
    }
}
