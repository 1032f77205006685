package io.github.eutro.gotoj.core.passes.form;

import io.github.eutro.gotoj.core.model.Expr;
import io.github.eutro.gotoj.core.model.ExprValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The functions which stand for an unconstrained value of their return type,
 * recognised by name.
 */
public final class NondetIntrinsics {
    /**
     * The intrinsics of the common verification front ends.
     */
    public static final NondetIntrinsics DEFAULT = new NondetIntrinsics(
            Arrays.asList("__VERIFIER_nondet_", "__nondet_", "nondet_"),
            Collections.singletonList("kani::any"));

    private final Set<String> prefixes;
    private final Set<String> names;

    /**
     * @param prefixes Prefixes of intrinsic names.
     * @param names    Exact intrinsic names.
     */
    public NondetIntrinsics(@NotNull Collection<String> prefixes, @NotNull Collection<String> names) {
        this.prefixes = Collections.unmodifiableSet(new LinkedHashSet<>(prefixes));
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public boolean isIntrinsic(@NotNull String name) {
        if (names.contains(name)) return true;
        for (String prefix : prefixes) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    /**
     * Get the name of the intrinsic a function expression refers to.
     *
     * @param function The function being called.
     * @return The intrinsic's name, or null if the function is not a reference to an intrinsic.
     */
    public @Nullable String intrinsicCalled(@NotNull Expr function) {
        if (!(function.getValue() instanceof ExprValue.SymbolRef)) return null;
        String name = ((ExprValue.SymbolRef) function.getValue()).getIdentifier();
        return isIntrinsic(name) ? name : null;
    }

    public Set<String> getPrefixes() {
        return prefixes;
    }

    public Set<String> getNames() {
        return names;
    }
}
