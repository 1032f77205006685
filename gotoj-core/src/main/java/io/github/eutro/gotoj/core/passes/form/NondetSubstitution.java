package io.github.eutro.gotoj.core.passes.form;

import io.github.eutro.gotoj.core.error.UnsupportedNodeException;
import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.Transformer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Replaces calls to {@link NondetIntrinsics nondeterminism intrinsics} with {@code nondet}
 * expressions, which the verifier treats as unconstrained, and drops the intrinsics' declarations.
 * <p>
 * This pass expects expressions to have been {@link CommonExts#LOWERED lowered} already, and
 * fails with {@link UnsupportedNodeException} otherwise.
 */
public class NondetSubstitution implements IRPass<SymbolTable, SymbolTable> {
    /**
     * An instance of this pass using the {@link NondetIntrinsics#DEFAULT default intrinsics}.
     */
    public static final NondetSubstitution INSTANCE = new NondetSubstitution(NondetIntrinsics.DEFAULT);

    private final NondetIntrinsics intrinsics;

    public NondetSubstitution(@NotNull NondetIntrinsics intrinsics) {
        this.intrinsics = intrinsics;
    }

    @Override
    public SymbolTable run(SymbolTable table) {
        if (!table.getExt(CommonExts.LOWERED).orElse(false)) {
            throw new UnsupportedNodeException("nondeterminism substitution needs lowered expressions, "
                    + "but expression rewriting has not run");
        }
        SymbolTable out = new Substituter(table).transform();
        out.attachExt(CommonExts.NONDET_SUBSTITUTED, true);
        return out;
    }

    private class Substituter extends Transformer {
        Substituter(SymbolTable table) {
            super(table);
        }

        @Override
        protected @Nullable Symbol transformSymbol(@NotNull Symbol symbol) {
            if (symbol.getType().isCode() && intrinsics.isIntrinsic(symbol.getName())) return null;
            return super.transformSymbol(symbol);
        }

        @Override
        public Expr visitFunctionCall(Expr expr, ExprValue.FunctionCall value) {
            if (intrinsics.intrinsicCalled(value.getFunction()) == null) return super.visitFunctionCall(expr, value);
            return rebuild(expr, new ExprValue.Nondet());
        }

        @Override
        public Stmt visitFunctionCall(Stmt stmt, StmtBody.FunctionCall body) {
            if (intrinsics.intrinsicCalled(body.getFunction()) == null) return super.visitFunctionCall(stmt, body);
            Location loc = transformLocation(stmt.getLocation());
            if (body.getLhs() == null) return Stmt.skip(loc);
            Expr lhs = transformExpr(body.getLhs());
            return Stmt.assign(lhs, Expr.nondet(lhs.getType()), loc);
        }
    }
}
