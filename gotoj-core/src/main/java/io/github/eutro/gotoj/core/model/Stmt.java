package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A statement: a {@link StmtBody} at a {@link Location}.
 */
public final class Stmt {
    @NotNull
    private final StmtBody body;
    @NotNull
    private final Location location;

    public Stmt(@NotNull StmtBody body, @NotNull Location location) {
        this.body = body;
        this.location = location;
    }

    public @NotNull StmtBody getBody() {
        return body;
    }

    public @NotNull Location getLocation() {
        return location;
    }

    public <R> R accept(StmtBody.Visitor<R> visitor) {
        return body.accept(visitor, this);
    }

    @Contract(pure = true)
    public Stmt withLocation(@NotNull Location location) {
        return new Stmt(body, location);
    }

    @Contract(pure = true)
    public Stmt withBody(@NotNull StmtBody body) {
        return new Stmt(body, location);
    }

    /**
     * Label this statement, so it can be the target of a {@code goto}.
     *
     * @param label The label.
     * @return The labelled statement.
     */
    public Stmt withLabel(@NotNull String label) {
        return new Stmt(new StmtBody.Label(label, this), location);
    }

    public static Stmt assign(@NotNull Expr lhs, @NotNull Expr rhs, @NotNull Location loc) {
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException("assigning " + rhs.getType() + " to " + lhs.getType());
        }
        return new Stmt(new StmtBody.Assign(lhs, rhs), loc);
    }

    public static Stmt assertion(@NotNull Expr condition, @NotNull Location loc) {
        return new Stmt(new StmtBody.Assert(condition), loc);
    }

    public static Stmt assume(@NotNull Expr condition, @NotNull Location loc) {
        return new Stmt(new StmtBody.Assume(condition), loc);
    }

    public static Stmt atomicBlock(@NotNull List<Stmt> statements, @NotNull Location loc) {
        return new Stmt(new StmtBody.AtomicBlock(statements), loc);
    }

    public static Stmt block(@NotNull List<Stmt> statements, @NotNull Location loc) {
        return new Stmt(new StmtBody.Block(statements), loc);
    }

    public static Stmt breakStmt(@NotNull Location loc) {
        return new Stmt(new StmtBody.Break(), loc);
    }

    public static Stmt continueStmt(@NotNull Location loc) {
        return new Stmt(new StmtBody.Continue(), loc);
    }

    public static Stmt dead(@NotNull Expr symbol, @NotNull Location loc) {
        return new Stmt(new StmtBody.Dead(symbol), loc);
    }

    public static Stmt decl(@NotNull Expr lhs, @Nullable Expr value, @NotNull Location loc) {
        if (!(lhs.getValue() instanceof ExprValue.SymbolRef)) {
            throw new IllegalArgumentException("can only declare symbols, not " + lhs);
        }
        return new Stmt(new StmtBody.Decl(lhs, value), loc);
    }

    public static Stmt expression(@NotNull Expr expr, @NotNull Location loc) {
        return new Stmt(new StmtBody.Expression(expr), loc);
    }

    public static Stmt forLoop(@NotNull Stmt init, @NotNull Expr condition, @NotNull Stmt update,
                               @NotNull Stmt body, @NotNull Location loc) {
        return new Stmt(new StmtBody.For(init, condition, update, body), loc);
    }

    public static Stmt functionCall(@Nullable Expr lhs, @NotNull Expr function, @NotNull List<Expr> arguments,
                                    @NotNull Location loc) {
        return new Stmt(new StmtBody.FunctionCall(lhs, function, arguments), loc);
    }

    public static Stmt gotoLabel(@NotNull String label, @NotNull Location loc) {
        return new Stmt(new StmtBody.Goto(label), loc);
    }

    public static Stmt ifThenElse(@NotNull Expr condition, @NotNull Stmt then, @Nullable Stmt otherwise,
                                  @NotNull Location loc) {
        return new Stmt(new StmtBody.IfThenElse(condition, then, otherwise), loc);
    }

    public static Stmt returnStmt(@Nullable Expr value, @NotNull Location loc) {
        return new Stmt(new StmtBody.Return(value), loc);
    }

    public static Stmt skip(@NotNull Location loc) {
        return new Stmt(new StmtBody.Skip(), loc);
    }

    public static Stmt switchStmt(@NotNull Expr control, @NotNull List<SwitchCase> cases, @Nullable Stmt defaultCase,
                                  @NotNull Location loc) {
        return new Stmt(new StmtBody.Switch(control, cases, defaultCase), loc);
    }

    public static Stmt whileLoop(@NotNull Expr condition, @NotNull Stmt body, @NotNull Location loc) {
        return new Stmt(new StmtBody.While(condition, body), loc);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Stmt stmt = (Stmt) o;
        return body.equals(stmt.body) && location.equals(stmt.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, location);
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
