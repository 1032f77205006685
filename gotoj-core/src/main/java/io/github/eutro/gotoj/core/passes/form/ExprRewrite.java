package io.github.eutro.gotoj.core.passes.form;

import io.github.eutro.gotoj.core.error.UnsupportedNodeException;
import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.Transformer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Lowers expressions the verifier has no direct form for.
 * <ul>
 *     <li>{@code a => b} becomes {@code !a || b}.</li>
 *     <li>{@code x++}, {@code --x} and the like become statement expressions,
 *     storing the old value in a fresh temporary where it is the result. If evaluating
 *     the operand has side effects, its address is taken once into a pointer temporary.</li>
 *     <li>{@code v[i]} on a vector {@code v} becomes {@code ((T *) &v)[i]}.</li>
 *     <li>Integer constants wider than 64 bits are built from two 64-bit halves.</li>
 * </ul>
 * Calls to nondeterminism intrinsics are left for {@link NondetSubstitution}.
 * The result is marked {@link CommonExts#LOWERED}.
 */
public class ExprRewrite implements IRPass<SymbolTable, SymbolTable> {
    /**
     * A singleton instance of this pass.
     */
    public static final ExprRewrite INSTANCE = new ExprRewrite();

    /**
     * The prefix of the temporaries this pass introduces.
     */
    public static final String TEMP_PREFIX = "__gotoj_tmp_";

    private static final Type U128 = Type.unsignedInt(128);
    private static final BigInteger LOW_MASK = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    @Override
    public SymbolTable run(SymbolTable table) {
        SymbolTable out = new Rewriter(table).transform();
        out.attachExt(CommonExts.LOWERED, true);
        return out;
    }

    private static class Rewriter extends Transformer {
        private int nextTemp = 0;

        Rewriter(SymbolTable table) {
            super(table);
        }

        private Expr freshTemp(Type type, Location loc) {
            String name;
            do {
                name = TEMP_PREFIX + nextTemp++;
            } while (!isFreeName(name));
            addSymbol(Symbol.variable(name, name, type, loc));
            return Expr.symbol(name, type);
        }

        @Override
        public Expr visitBinOp(Expr expr, ExprValue.BinOp value) {
            if (value.getOp() != BinaryOperator.IMPLIES) return super.visitBinOp(expr, value);
            Expr lhs = transformExpr(value.getLhs());
            Expr rhs = transformExpr(value.getRhs());
            return lhs.not().or(rhs).withLocation(transformLocation(expr.getLocation()));
        }

        @Override
        public Expr visitSelfOp(Expr expr, ExprValue.SelfOp value) {
            SelfOperator op = value.getOp();
            Expr target = transformExpr(value.getE());
            Type type = target.getType();
            Location loc = transformLocation(expr.getLocation());
            Expr delta = one(type);
            List<Stmt> stmts = new ArrayList<>();
            Expr place = target;
            if (!isSideEffectFree(target)) {
                Expr pointer = freshTemp(type.toPointer(), loc);
                stmts.add(Stmt.decl(pointer, target.address(), loc));
                place = pointer.dereference();
            }
            Expr updated = place.binop(op.isIncrement() ? BinaryOperator.PLUS : BinaryOperator.MINUS, delta);
            if (op.isPrefix()) {
                stmts.add(Stmt.assign(place, updated, loc));
                stmts.add(Stmt.expression(place, loc));
            } else {
                Expr temp = freshTemp(type, loc);
                stmts.add(Stmt.decl(temp, place, loc));
                stmts.add(Stmt.assign(place, updated, loc));
                stmts.add(Stmt.expression(temp, loc));
            }
            return Expr.statementExpression(stmts, type).withLocation(loc);
        }

        @Override
        public Expr visitIndex(Expr expr, ExprValue.Index value) {
            Expr array = transformExpr(value.getArray());
            Expr index = transformExpr(value.getIndex());
            Type arrayType = array.getType().unwrapTypedef();
            if (!(arrayType instanceof Type.Vector)) return rebuild(expr, new ExprValue.Index(array, index));
            Type element = ((Type.Vector) arrayType).getElementType();
            return array.address()
                    .cast(element.toPointer())
                    .index(index)
                    .withLocation(transformLocation(expr.getLocation()));
        }

        // conservative: anything not listed may have side effects
        private static boolean isSideEffectFree(Expr expr) {
            ExprValue v = expr.getValue();
            if (v instanceof ExprValue.SymbolRef
                    || v instanceof ExprValue.IntConstant
                    || v instanceof ExprValue.BoolConstant
                    || v instanceof ExprValue.CBoolConstant
                    || v instanceof ExprValue.PointerConstant) {
                return true;
            }
            if (v instanceof ExprValue.Member) return isSideEffectFree(((ExprValue.Member) v).getLhs());
            if (v instanceof ExprValue.Dereference) return isSideEffectFree(((ExprValue.Dereference) v).getE());
            if (v instanceof ExprValue.AddressOf) return isSideEffectFree(((ExprValue.AddressOf) v).getE());
            if (v instanceof ExprValue.Typecast) return isSideEffectFree(((ExprValue.Typecast) v).getE());
            if (v instanceof ExprValue.UnOp) return isSideEffectFree(((ExprValue.UnOp) v).getE());
            if (v instanceof ExprValue.Index) {
                ExprValue.Index index = (ExprValue.Index) v;
                return isSideEffectFree(index.getArray()) && isSideEffectFree(index.getIndex());
            }
            if (v instanceof ExprValue.BinOp) {
                ExprValue.BinOp binOp = (ExprValue.BinOp) v;
                return isSideEffectFree(binOp.getLhs()) && isSideEffectFree(binOp.getRhs());
            }
            return false;
        }

        private Expr one(Type type) {
            Type t = type.unwrapTypedef();
            if (type.isInteger()) return Expr.intConstant(1, type);
            if (t instanceof Type.Pointer) return Expr.intConstant(1, Type.ssizeT());
            if (t instanceof Type.Float) return Expr.floatConstant(1);
            if (t instanceof Type.Double) return Expr.doubleConstant(1);
            throw new UnsupportedNodeException("cannot increment or decrement a value of type " + type);
        }

        @Override
        public Expr visitIntConstant(Expr expr, ExprValue.IntConstant value) {
            Type type = transformType(expr.getType());
            int width = type.bitWidth(mm);
            BigInteger v = value.getValue();
            if (width <= 64 || v.signum() >= 0 && v.bitLength() <= 64) return super.visitIntConstant(expr, value);
            BigInteger bits = v.signum() < 0 ? v.add(BigInteger.ONE.shiftLeft(width)) : v;
            if (bits.signum() < 0 || bits.bitLength() > 128) {
                // doesn't fit, let the encoder report it
                return super.visitIntConstant(expr, value);
            }
            Expr hi = Expr.intConstant(bits.shiftRight(64), U128);
            Expr lo = Expr.intConstant(bits.and(LOW_MASK), U128);
            return hi.binop(BinaryOperator.SHL, Expr.intConstant(64, U128))
                    .binop(BinaryOperator.BITOR, lo)
                    .cast(type)
                    .withLocation(transformLocation(expr.getLocation()));
        }
    }
}
