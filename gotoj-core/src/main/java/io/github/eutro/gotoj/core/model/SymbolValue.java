package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * The value of a {@link Symbol}: nothing, an initialiser expression,
 * or the body of a function.
 */
public final class SymbolValue {
    private static final SymbolValue NONE = new SymbolValue(null, null);

    @Nullable
    private final Expr expr;
    @Nullable
    private final Stmt stmt;

    private SymbolValue(@Nullable Expr expr, @Nullable Stmt stmt) {
        this.expr = expr;
        this.stmt = stmt;
    }

    public static SymbolValue none() {
        return NONE;
    }

    public static SymbolValue of(@NotNull Expr expr) {
        return new SymbolValue(expr, null);
    }

    public static SymbolValue of(@NotNull Stmt stmt) {
        return new SymbolValue(null, stmt);
    }

    public boolean isNone() {
        return expr == null && stmt == null;
    }

    public @Nullable Expr getExpr() {
        return expr;
    }

    public @Nullable Stmt getStmt() {
        return stmt;
    }

    /**
     * Get the location of the value, if it has one.
     *
     * @return The location.
     */
    public Location getLocation() {
        if (expr != null) return expr.getLocation();
        if (stmt != null) return stmt.getLocation();
        return Location.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SymbolValue that = (SymbolValue) o;
        return Objects.equals(expr, that.expr) && Objects.equals(stmt, that.stmt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expr, stmt);
    }

    @Override
    public String toString() {
        if (expr != null) return expr.toString();
        if (stmt != null) return stmt.toString();
        return "<none>";
    }
}
