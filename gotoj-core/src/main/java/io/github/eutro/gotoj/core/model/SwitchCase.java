package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@code case} of a {@link StmtBody.Switch}. Control falls through to the
 * next case unless the body breaks.
 */
public final class SwitchCase {
    @NotNull
    private final Expr value;
    @NotNull
    private final Stmt body;

    public SwitchCase(@NotNull Expr value, @NotNull Stmt body) {
        this.value = value;
        this.body = body;
    }

    public @NotNull Expr getValue() {
        return value;
    }

    public @NotNull Stmt getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SwitchCase that = (SwitchCase) o;
        return value.equals(that.value) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, body);
    }

    @Override
    public String toString() {
        return "case " + value + ": " + body;
    }
}
