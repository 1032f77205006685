package io.github.eutro.gotoj.core.passes;

import io.github.eutro.gotoj.core.error.PipelineConfigException;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.form.ExprRewrite;
import io.github.eutro.gotoj.core.passes.form.NameCleanup;
import io.github.eutro.gotoj.core.passes.form.NondetIntrinsics;
import io.github.eutro.gotoj.core.passes.form.NondetSubstitution;
import io.github.eutro.gotoj.core.passes.meta.ValidateTags;
import io.github.eutro.gotoj.core.passes.misc.Identity;
import org.jetbrains.annotations.NotNull;

import java.util.*;
import java.util.logging.Logger;

/**
 * The passes that may be named in a {@link Pipeline}.
 * <p>
 * A pass may be registered as {@link #registerLast(String, IRPass) last}, in which case a pipeline
 * may only name it as its final pass.
 */
public final class PassRegistry {
    private static final Logger LOGGER = Logger.getLogger(PassRegistry.class.getName());

    public static final String IDENTITY = "identity";
    public static final String EXPR_REWRITE = "expr-rewrite";
    public static final String NONDET_SUBSTITUTION = "nondet-substitution";
    public static final String NAME_CLEANUP = "name-cleanup";
    public static final String VALIDATE_TAGS = "validate-tags";

    /**
     * The pipeline that prepares a program for the verifier.
     */
    public static final List<String> DEFAULT_PIPELINE = Collections.unmodifiableList(Arrays.asList(
            EXPR_REWRITE,
            NONDET_SUBSTITUTION,
            NAME_CLEANUP
    ));

    private final Map<String, IRPass<SymbolTable, SymbolTable>> passes = new LinkedHashMap<>();
    private final Set<String> last = new HashSet<>();

    /**
     * Create a registry of the built-in passes, using the default intrinsics.
     *
     * @return The registry.
     */
    public static PassRegistry defaults() {
        return withIntrinsics(NondetIntrinsics.DEFAULT);
    }

    /**
     * Create a registry of the built-in passes, recognising the given nondeterminism intrinsics.
     *
     * @param intrinsics The intrinsics.
     * @return The registry.
     */
    public static PassRegistry withIntrinsics(@NotNull NondetIntrinsics intrinsics) {
        return new PassRegistry()
                .register(IDENTITY, Identity.INSTANCE)
                .register(EXPR_REWRITE, ExprRewrite.INSTANCE)
                .register(NONDET_SUBSTITUTION, new NondetSubstitution(intrinsics))
                .register(VALIDATE_TAGS, ValidateTags.INSTANCE)
                .registerLast(NAME_CLEANUP, new NameCleanup(intrinsics));
    }

    /**
     * Register a pass.
     *
     * @param name The name of the pass.
     * @param pass The pass.
     * @return This.
     * @throws IllegalArgumentException If a pass with that name is already registered.
     */
    public PassRegistry register(@NotNull String name, @NotNull IRPass<SymbolTable, SymbolTable> pass) {
        if (passes.putIfAbsent(name, pass) != null) {
            throw new IllegalArgumentException("pass " + name + " is already registered");
        }
        return this;
    }

    /**
     * Register a pass which must be the last in any pipeline it is part of.
     *
     * @param name The name of the pass.
     * @param pass The pass.
     * @return This.
     */
    public PassRegistry registerLast(@NotNull String name, @NotNull IRPass<SymbolTable, SymbolTable> pass) {
        register(name, pass);
        last.add(name);
        return this;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(passes.keySet());
    }

    /**
     * Resolve a list of pass names into a pipeline.
     * <p>
     * Every name is checked before anything is run.
     *
     * @param names The names of the passes, in order.
     * @return The pipeline.
     * @throws PipelineConfigException If a name is unknown, or a pass that must be last is not.
     */
    public Pipeline resolve(@NotNull List<String> names) {
        List<IRPass<SymbolTable, SymbolTable>> resolved = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            IRPass<SymbolTable, SymbolTable> pass = passes.get(name);
            if (pass == null) {
                throw new PipelineConfigException("unknown pass '" + name + "' in pipeline " + names
                        + ", known passes are " + passes.keySet());
            }
            if (last.contains(name) && i != names.size() - 1) {
                throw new PipelineConfigException("pass '" + name + "' must be last in pipeline " + names);
            }
            resolved.add(pass);
        }
        LOGGER.config(() -> "Resolved pipeline " + names);
        return new Pipeline(names, resolved);
    }
}
