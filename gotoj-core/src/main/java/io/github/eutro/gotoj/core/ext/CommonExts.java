package io.github.eutro.gotoj.core.ext;

import io.github.eutro.gotoj.core.model.SymbolTable;

import java.util.List;
import java.util.Map;

/**
 * Exts which may be attached to a {@link SymbolTable} by passes.
 */
public class CommonExts {
    /**
     * Set once expressions have been lowered to the forms the verifier understands.
     *
     * @see io.github.eutro.gotoj.core.passes.form.ExprRewrite
     */
    public static final Ext<Boolean> LOWERED = Ext.create(Boolean.class, "lowered");

    /**
     * Set once nondeterminism intrinsics have been replaced.
     *
     * @see io.github.eutro.gotoj.core.passes.form.NondetSubstitution
     */
    public static final Ext<Boolean> NONDET_SUBSTITUTED = Ext.create(Boolean.class, "nondet_substituted");

    /**
     * The renaming performed by name cleanup, from old names to new names.
     * Only names that changed are present.
     *
     * @see io.github.eutro.gotoj.core.passes.form.NameCleanup
     */
    public static final Ext<Map<String, String>> RENAMED = Ext.create(Map.class, "renamed");

    /**
     * The names of the passes which have been run to produce a table, in order.
     */
    public static final Ext<List<String>> PASS_TRACE = Ext.create(List.class, "pass_trace");
}
