package io.github.eutro.gotoj.core.passes.convert;

import io.github.eutro.gotoj.core.error.EncodingWidthException;
import io.github.eutro.gotoj.core.error.GotoException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.model.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the typed model to {@link Irep}s, in the shape the verifier expects.
 * <p>
 * The machine model determines the widths of C integer types and pointers,
 * and the endianness of byte extracts.
 *
 * @see FromIrep
 */
public class ToIrep {
    private final MachineModel mm;
    private final TypeConverter types = new TypeConverter();
    private final ExprConverter exprs = new ExprConverter();
    private final StmtConverter stmts = new StmtConverter();
    private final LocationConverter locations = new LocationConverter();

    public ToIrep(@NotNull MachineModel mm) {
        this.mm = mm;
    }

    public Irep type(@NotNull Type type) {
        return type.accept(types);
    }

    /**
     * Convert an expression.
     *
     * @param expr The expression.
     * @return The irep.
     * @throws EncodingWidthException If a constant does not fit in its type.
     */
    public Irep expr(@NotNull Expr expr) {
        return expr.accept(exprs)
                .named(IrepId.TYPE, type(expr.getType()))
                .namedOpt(IrepId.C_SOURCE_LOCATION, locationOpt(expr.getLocation()))
                .build();
    }

    public Irep stmt(@NotNull Stmt stmt) {
        return stmt.accept(stmts)
                .namedOpt(IrepId.C_SOURCE_LOCATION, locationOpt(stmt.getLocation()))
                .build();
    }

    public Irep location(@NotNull Location location) {
        return location.accept(locations);
    }

    /**
     * Convert a symbol, attributing any error to it.
     *
     * @param symbol The symbol.
     * @return The serialized symbol.
     */
    public IrepSymbol symbol(@NotNull Symbol symbol) {
        try {
            SymbolValue value = symbol.getValue();
            Irep valueIrep;
            if (value.getExpr() != null) valueIrep = expr(value.getExpr());
            else if (value.getStmt() != null) valueIrep = stmt(value.getStmt());
            else valueIrep = Irep.nil();
            return new IrepSymbol(
                    type(symbol.getType()),
                    valueIrep,
                    location(symbol.getLocation()),
                    symbol.getName(),
                    orEmpty(symbol.getModule()),
                    orEmpty(symbol.getBaseName()),
                    orEmpty(symbol.getPrettyName()),
                    symbol.getMode().text(),
                    symbol.getFlags()
            );
        } catch (GotoException e) {
            e.withSymbolName(symbol.getName()).withLocation(symbol.getLocation());
            throw e;
        }
    }

    private static String orEmpty(@Nullable String s) {
        return s == null ? "" : s;
    }

    private @Nullable Irep locationOpt(Location location) {
        return location.isNone() ? null : location(location);
    }

    private List<Irep> exprList(List<Expr> list) {
        List<Irep> ireps = new ArrayList<>(list.size());
        for (Expr expr : list) ireps.add(expr(expr));
        return ireps;
    }

    private List<Irep> stmtList(List<Stmt> list) {
        List<Irep> ireps = new ArrayList<>(list.size());
        for (Stmt stmt : list) ireps.add(stmt(stmt));
        return ireps;
    }

    private Irep sizeConstant(long size) {
        return expr(Expr.intConstant(size, Type.ssizeT()));
    }

    private Irep.Builder constant(IrepId value) {
        return Irep.builder(IrepId.CONSTANT).named(IrepId.VALUE, value);
    }

    private static Irep.Builder sideEffect(IrepId statement) {
        return Irep.builder(IrepId.SIDE_EFFECT).named(IrepId.STATEMENT, statement);
    }

    private static Irep.Builder code(IrepId statement) {
        return Irep.builder(IrepId.CODE).named(IrepId.STATEMENT, statement);
    }

    private static Irep leaf(String text) {
        return Irep.justString(text);
    }

    /**
     * Get the bit pattern of an integer constant, checking that it fits in its type.
     */
    private IrepId intBits(BigInteger value, Type type, Expr at) {
        int width = type.bitWidth(mm);
        boolean signed = type.isSigned(mm);
        BigInteger min = signed ? BigInteger.ONE.shiftLeft(width - 1).negate() : BigInteger.ZERO;
        BigInteger max = (signed ? BigInteger.ONE.shiftLeft(width - 1) : BigInteger.ONE.shiftLeft(width))
                .subtract(BigInteger.ONE);
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            EncodingWidthException e = new EncodingWidthException("constant " + value + " does not fit in "
                    + width + "-bit " + (signed ? "signed" : "unsigned") + " type " + type);
            e.withLocation(at.getLocation());
            throw e;
        }
        return IrepId.fromBitPattern(value, width);
    }

    class TypeConverter implements Type.Visitor<Irep> {
        @Override
        public Irep visitArray(Type.Array t) {
            return Irep.builder(IrepId.ARRAY)
                    .sub(type(t.getElementType()))
                    .named(IrepId.SIZE, sizeConstant(t.getSize()))
                    .build();
        }

        @Override
        public Irep visitBool(Type.Bool t) {
            return Irep.just(IrepId.BOOL);
        }

        @Override
        public Irep visitCBitField(Type.CBitField t) {
            return Irep.builder(IrepId.C_BIT_FIELD)
                    .sub(type(t.getType()))
                    .namedInt(IrepId.WIDTH, t.getWidth())
                    .build();
        }

        @Override
        public Irep visitCInteger(Type.CInteger t) {
            CIntType kind = t.getKind();
            if (kind == CIntType.BOOL) {
                return Irep.builder(IrepId.C_BOOL).namedInt(IrepId.WIDTH, mm.getBoolWidth()).build();
            }
            IrepId cType = kind.cType();
            assert cType != null;
            return Irep.builder(kind.isSigned(mm) ? IrepId.SIGNEDBV : IrepId.UNSIGNEDBV)
                    .namedInt(IrepId.WIDTH, kind.width(mm))
                    .named(IrepId.C_C_TYPE, cType)
                    .build();
        }

        @Override
        public Irep visitCode(Type.Code t) {
            List<Irep> params = new ArrayList<>();
            for (Parameter p : t.getParameters()) {
                params.add(Irep.builder(IrepId.PARAMETER)
                        .named(IrepId.TYPE, type(p.getType()))
                        .namedOpt(IrepId.C_IDENTIFIER, p.getIdentifier() == null ? null : leaf(p.getIdentifier()))
                        .namedOpt(IrepId.C_BASE_NAME, p.getBaseName() == null ? null : leaf(p.getBaseName()))
                        .build());
            }
            return Irep.builder(IrepId.CODE)
                    .named(IrepId.PARAMETERS, Irep.builder(IrepId.EMPTY_STRING)
                            .subs(params)
                            .flag(IrepId.ELLIPSIS, t.isVariadic())
                            .build())
                    .named(IrepId.RETURN_TYPE, type(t.getReturnType()))
                    .build();
        }

        @Override
        public Irep visitConstructor(Type.Constructor t) {
            return Irep.just(IrepId.CONSTRUCTOR);
        }

        @Override
        public Irep visitDouble(Type.Double t) {
            return Irep.builder(IrepId.FLOATBV)
                    .namedInt(IrepId.F, 52)
                    .namedInt(IrepId.WIDTH, 64)
                    .named(IrepId.C_C_TYPE, IrepId.DOUBLE)
                    .build();
        }

        @Override
        public Irep visitEmpty(Type.Empty t) {
            return Irep.just(IrepId.EMPTY);
        }

        @Override
        public Irep visitFlexibleArray(Type.FlexibleArray t) {
            return Irep.builder(IrepId.ARRAY)
                    .sub(type(t.getElementType()))
                    .named(IrepId.SIZE, Irep.zero())
                    .build();
        }

        @Override
        public Irep visitFloat(Type.Float t) {
            return Irep.builder(IrepId.FLOATBV)
                    .namedInt(IrepId.F, 23)
                    .namedInt(IrepId.WIDTH, 32)
                    .named(IrepId.C_C_TYPE, IrepId.FLOAT)
                    .build();
        }

        @Override
        public Irep visitIncompleteStruct(Type.IncompleteStruct t) {
            return incomplete(IrepId.STRUCT, t.getTag());
        }

        @Override
        public Irep visitIncompleteUnion(Type.IncompleteUnion t) {
            return incomplete(IrepId.UNION, t.getTag());
        }

        private Irep incomplete(IrepId id, String tag) {
            return Irep.builder(id)
                    .named(IrepId.TAG, leaf(tag))
                    .flag(IrepId.INCOMPLETE, true)
                    .build();
        }

        @Override
        public Irep visitInfiniteArray(Type.InfiniteArray t) {
            return Irep.builder(IrepId.ARRAY)
                    .sub(type(t.getElementType()))
                    .named(IrepId.SIZE, Irep.builder(IrepId.INFINITY)
                            .named(IrepId.TYPE, type(Type.ssizeT()))
                            .build())
                    .build();
        }

        @Override
        public Irep visitPointer(Type.Pointer t) {
            return Irep.builder(IrepId.POINTER)
                    .sub(type(t.getPointee()))
                    .namedInt(IrepId.WIDTH, mm.getPointerWidth())
                    .build();
        }

        @Override
        public Irep visitSignedbv(Type.Signedbv t) {
            return Irep.builder(IrepId.SIGNEDBV).namedInt(IrepId.WIDTH, t.getWidth()).build();
        }

        @Override
        public Irep visitStruct(Type.Struct t) {
            return aggregate(IrepId.STRUCT, t.getTag(), t.getComponents());
        }

        @Override
        public Irep visitUnion(Type.Union t) {
            return aggregate(IrepId.UNION, t.getTag(), t.getComponents());
        }

        private Irep aggregate(IrepId id, String tag, List<DatatypeComponent> components) {
            List<Irep> ireps = new ArrayList<>();
            for (DatatypeComponent c : components) {
                ireps.add(Irep.builder(IrepId.EMPTY_STRING)
                        .named(IrepId.NAME, leaf(c.getName()))
                        .named(IrepId.PRETTY_NAME, leaf(c.getName()))
                        .named(IrepId.TYPE, type(c.getType()))
                        .flag(IrepId.C_IS_PADDING, c.isPadding())
                        .build());
            }
            return Irep.builder(id)
                    .named(IrepId.TAG, leaf(tag))
                    .named(IrepId.COMPONENTS, Irep.justSub(ireps))
                    .build();
        }

        @Override
        public Irep visitStructTag(Type.StructTag t) {
            return Irep.builder(IrepId.STRUCT_TAG).named(IrepId.IDENTIFIER, leaf(t.getIdentifier())).build();
        }

        @Override
        public Irep visitUnionTag(Type.UnionTag t) {
            return Irep.builder(IrepId.UNION_TAG).named(IrepId.IDENTIFIER, leaf(t.getIdentifier())).build();
        }

        @Override
        public Irep visitTypeDef(Type.TypeDef t) {
            return type(t.getType()).with(IrepId.C_TYPEDEF, leaf(t.getName()));
        }

        @Override
        public Irep visitUnsignedbv(Type.Unsignedbv t) {
            return Irep.builder(IrepId.UNSIGNEDBV).namedInt(IrepId.WIDTH, t.getWidth()).build();
        }

        @Override
        public Irep visitVector(Type.Vector t) {
            return Irep.builder(IrepId.VECTOR)
                    .sub(type(t.getElementType()))
                    .named(IrepId.SIZE, sizeConstant(t.getSize()))
                    .build();
        }
    }

    class ExprConverter implements ExprValue.Visitor<Irep.Builder> {
        @Override
        public Irep.Builder visitAddressOf(Expr expr, ExprValue.AddressOf value) {
            return Irep.builder(IrepId.ADDRESS_OF).sub(expr(value.getE()));
        }

        @Override
        public Irep.Builder visitArray(Expr expr, ExprValue.Array value) {
            return Irep.builder(IrepId.ARRAY).subs(exprList(value.getElements()));
        }

        @Override
        public Irep.Builder visitArrayOf(Expr expr, ExprValue.ArrayOf value) {
            return Irep.builder(IrepId.ARRAY_OF).sub(expr(value.getElement()));
        }

        @Override
        public Irep.Builder visitAssign(Expr expr, ExprValue.Assign value) {
            return sideEffect(IrepId.ASSIGN).sub(expr(value.getLhs())).sub(expr(value.getRhs()));
        }

        @Override
        public Irep.Builder visitBinOp(Expr expr, ExprValue.BinOp value) {
            return Irep.builder(value.getOp().id()).sub(expr(value.getLhs())).sub(expr(value.getRhs()));
        }

        @Override
        public Irep.Builder visitBoolConstant(Expr expr, ExprValue.BoolConstant value) {
            return constant(value.getValue() ? IrepId.TRUE : IrepId.FALSE);
        }

        @Override
        public Irep.Builder visitByteExtract(Expr expr, ExprValue.ByteExtract value) {
            return Irep.builder(mm.isBigEndian() ? IrepId.BYTE_EXTRACT_BIG_ENDIAN : IrepId.BYTE_EXTRACT_LITTLE_ENDIAN)
                    .sub(expr(value.getE()))
                    .sub(sizeConstant(value.getOffset()));
        }

        @Override
        public Irep.Builder visitCBoolConstant(Expr expr, ExprValue.CBoolConstant value) {
            return constant(IrepId.fromBitPattern(value.getValue() ? BigInteger.ONE : BigInteger.ZERO, mm.getBoolWidth()));
        }

        @Override
        public Irep.Builder visitDereference(Expr expr, ExprValue.Dereference value) {
            return Irep.builder(IrepId.DEREFERENCE).sub(expr(value.getE()));
        }

        @Override
        public Irep.Builder visitDoubleConstant(Expr expr, ExprValue.DoubleConstant value) {
            long bits = java.lang.Double.doubleToRawLongBits(value.getValue());
            return constant(IrepId.fromBitPattern(BigInteger.valueOf(bits), 64));
        }

        @Override
        public Irep.Builder visitEmptyUnion(Expr expr, ExprValue.EmptyUnion value) {
            return Irep.builder(IrepId.EMPTY_UNION);
        }

        @Override
        public Irep.Builder visitFloatConstant(Expr expr, ExprValue.FloatConstant value) {
            int bits = java.lang.Float.floatToRawIntBits(value.getValue());
            return constant(IrepId.fromBitPattern(BigInteger.valueOf(bits), 32));
        }

        @Override
        public Irep.Builder visitFunctionCall(Expr expr, ExprValue.FunctionCall value) {
            return sideEffect(IrepId.FUNCTION_CALL)
                    .sub(expr(value.getFunction()))
                    .sub(Irep.builder(IrepId.ARGUMENTS).subs(exprList(value.getArguments())).build());
        }

        @Override
        public Irep.Builder visitIf(Expr expr, ExprValue.If value) {
            return Irep.builder(IrepId.IF)
                    .sub(expr(value.getCondition()))
                    .sub(expr(value.getThen()))
                    .sub(expr(value.getOtherwise()));
        }

        @Override
        public Irep.Builder visitIndex(Expr expr, ExprValue.Index value) {
            return Irep.builder(IrepId.INDEX).sub(expr(value.getArray())).sub(expr(value.getIndex()));
        }

        @Override
        public Irep.Builder visitIntConstant(Expr expr, ExprValue.IntConstant value) {
            return constant(intBits(value.getValue(), expr.getType(), expr));
        }

        @Override
        public Irep.Builder visitMember(Expr expr, ExprValue.Member value) {
            return Irep.builder(IrepId.MEMBER)
                    .sub(expr(value.getLhs()))
                    .named(IrepId.COMPONENT_NAME, leaf(value.getField()))
                    .named(IrepId.C_LVALUE, Irep.one());
        }

        @Override
        public Irep.Builder visitNondet(Expr expr, ExprValue.Nondet value) {
            return sideEffect(IrepId.NONDET);
        }

        @Override
        public Irep.Builder visitPointerConstant(Expr expr, ExprValue.PointerConstant value) {
            BigInteger address = value.getAddress();
            if (address.signum() == 0) return constant(IrepId.NULL);
            int width = mm.getPointerWidth();
            if (address.signum() < 0 || address.bitLength() > width) {
                EncodingWidthException e = new EncodingWidthException("address " + address
                        + " does not fit in a " + width + "-bit pointer");
                e.withLocation(expr.getLocation());
                throw e;
            }
            return constant(IrepId.fromBitPattern(address, width));
        }

        @Override
        public Irep.Builder visitQuantified(Expr expr, ExprValue.Quantified value) {
            IrepId id = value.getQuantifier() == ExprValue.Quantifier.FORALL ? IrepId.FORALL : IrepId.EXISTS;
            return Irep.builder(id)
                    .sub(Irep.builder(IrepId.TUPLE).sub(expr(value.getVariable())).build())
                    .sub(expr(value.getBody()));
        }

        @Override
        public Irep.Builder visitSelfOp(Expr expr, ExprValue.SelfOp value) {
            return sideEffect(value.getOp().id()).sub(expr(value.getE()));
        }

        @Override
        public Irep.Builder visitStatementExpression(Expr expr, ExprValue.StatementExpression value) {
            return sideEffect(IrepId.STATEMENT_EXPRESSION)
                    .sub(stmt(Stmt.block(value.getStatements(), expr.getLocation())));
        }

        @Override
        public Irep.Builder visitStringConstant(Expr expr, ExprValue.StringConstant value) {
            return Irep.builder(IrepId.STRING_CONSTANT).named(IrepId.VALUE, leaf(value.getValue()));
        }

        @Override
        public Irep.Builder visitStruct(Expr expr, ExprValue.Struct value) {
            return Irep.builder(IrepId.STRUCT).subs(exprList(value.getValues()));
        }

        @Override
        public Irep.Builder visitSymbolRef(Expr expr, ExprValue.SymbolRef value) {
            return Irep.builder(IrepId.SYMBOL).named(IrepId.IDENTIFIER, leaf(value.getIdentifier()));
        }

        @Override
        public Irep.Builder visitTypecast(Expr expr, ExprValue.Typecast value) {
            return Irep.builder(IrepId.TYPECAST).sub(expr(value.getE()));
        }

        @Override
        public Irep.Builder visitUnion(Expr expr, ExprValue.Union value) {
            return Irep.builder(IrepId.UNION)
                    .sub(expr(value.getValue()))
                    .named(IrepId.COMPONENT_NAME, leaf(value.getField()));
        }

        @Override
        public Irep.Builder visitUnOp(Expr expr, ExprValue.UnOp value) {
            Irep.Builder b = Irep.builder(value.getOp().id()).sub(expr(value.getE()));
            if (value.getOp() == UnaryOperator.BSWAP) b.namedInt(IrepId.BITS_PER_BYTE, 8);
            return b;
        }

        @Override
        public Irep.Builder visitVector(Expr expr, ExprValue.Vector value) {
            return Irep.builder(IrepId.VECTOR).subs(exprList(value.getElements()));
        }
    }

    class StmtConverter implements StmtBody.Visitor<Irep.Builder> {
        @Override
        public Irep.Builder visitAssign(Stmt stmt, StmtBody.Assign body) {
            return code(IrepId.ASSIGN).sub(expr(body.getLhs())).sub(expr(body.getRhs()));
        }

        @Override
        public Irep.Builder visitAssert(Stmt stmt, StmtBody.Assert body) {
            return code(IrepId.ASSERT).sub(expr(body.getCondition()));
        }

        @Override
        public Irep.Builder visitAssume(Stmt stmt, StmtBody.Assume body) {
            return code(IrepId.ASSUME).sub(expr(body.getCondition()));
        }

        @Override
        public Irep.Builder visitAtomicBlock(Stmt stmt, StmtBody.AtomicBlock body) {
            return code(IrepId.BLOCK)
                    .sub(code(IrepId.ATOMIC_BEGIN).build())
                    .subs(stmtList(body.getStatements()))
                    .sub(code(IrepId.ATOMIC_END).build());
        }

        @Override
        public Irep.Builder visitBlock(Stmt stmt, StmtBody.Block body) {
            return code(IrepId.BLOCK).subs(stmtList(body.getStatements()));
        }

        @Override
        public Irep.Builder visitBreak(Stmt stmt, StmtBody.Break body) {
            return code(IrepId.BREAK);
        }

        @Override
        public Irep.Builder visitContinue(Stmt stmt, StmtBody.Continue body) {
            return code(IrepId.CONTINUE);
        }

        @Override
        public Irep.Builder visitDead(Stmt stmt, StmtBody.Dead body) {
            return code(IrepId.DEAD).sub(expr(body.getSymbol()));
        }

        @Override
        public Irep.Builder visitDecl(Stmt stmt, StmtBody.Decl body) {
            Irep.Builder b = code(IrepId.DECL).sub(expr(body.getLhs()));
            if (body.getValue() != null) b.sub(expr(body.getValue()));
            return b;
        }

        @Override
        public Irep.Builder visitExpression(Stmt stmt, StmtBody.Expression body) {
            return code(IrepId.EXPRESSION).sub(expr(body.getExpr()));
        }

        @Override
        public Irep.Builder visitFor(Stmt stmt, StmtBody.For body) {
            return code(IrepId.FOR)
                    .sub(stmt(body.getInit()))
                    .sub(expr(body.getCondition()))
                    .sub(stmt(body.getUpdate()))
                    .sub(stmt(body.getBody()));
        }

        @Override
        public Irep.Builder visitFunctionCall(Stmt stmt, StmtBody.FunctionCall body) {
            return code(IrepId.FUNCTION_CALL)
                    .sub(body.getLhs() == null ? Irep.nil() : expr(body.getLhs()))
                    .sub(expr(body.getFunction()))
                    .sub(Irep.builder(IrepId.ARGUMENTS).subs(exprList(body.getArguments())).build());
        }

        @Override
        public Irep.Builder visitGoto(Stmt stmt, StmtBody.Goto body) {
            return code(IrepId.GOTO).named(IrepId.DESTINATION, leaf(body.getLabel()));
        }

        @Override
        public Irep.Builder visitIfThenElse(Stmt stmt, StmtBody.IfThenElse body) {
            return code(IrepId.IFTHENELSE)
                    .sub(expr(body.getCondition()))
                    .sub(stmt(body.getThen()))
                    .sub(body.getOtherwise() == null ? Irep.nil() : stmt(body.getOtherwise()));
        }

        @Override
        public Irep.Builder visitLabel(Stmt stmt, StmtBody.Label body) {
            return code(IrepId.LABEL)
                    .sub(stmt(body.getBody()))
                    .named(IrepId.LABEL, leaf(body.getLabel()));
        }

        @Override
        public Irep.Builder visitReturn(Stmt stmt, StmtBody.Return body) {
            return code(IrepId.RETURN).sub(body.getValue() == null ? Irep.nil() : expr(body.getValue()));
        }

        @Override
        public Irep.Builder visitSkip(Stmt stmt, StmtBody.Skip body) {
            return code(IrepId.SKIP);
        }

        @Override
        public Irep.Builder visitSwitch(Stmt stmt, StmtBody.Switch body) {
            Irep.Builder cases = code(IrepId.BLOCK);
            for (SwitchCase c : body.getCases()) {
                cases.sub(switchCase(expr(c.getValue()), c.getBody(), false));
            }
            if (body.getDefaultCase() != null) {
                cases.sub(switchCase(Irep.nil(), body.getDefaultCase(), true));
            }
            return code(IrepId.SWITCH)
                    .sub(expr(body.getControl()))
                    .sub(cases.namedOpt(IrepId.C_SOURCE_LOCATION, locationOpt(stmt.getLocation())).build());
        }

        private Irep switchCase(Irep value, Stmt body, boolean isDefault) {
            return code(IrepId.SWITCH_CASE)
                    .sub(value)
                    .sub(stmt(body))
                    .flag(IrepId.DEFAULT, isDefault)
                    .namedOpt(IrepId.C_SOURCE_LOCATION, locationOpt(body.getLocation()))
                    .build();
        }

        @Override
        public Irep.Builder visitWhile(Stmt stmt, StmtBody.While body) {
            return code(IrepId.WHILE).sub(expr(body.getCondition())).sub(stmt(body.getBody()));
        }
    }

    static class LocationConverter implements Location.Visitor<Irep> {
        @Override
        public Irep visitNone(Location.None loc) {
            return Irep.nil();
        }

        @Override
        public Irep visitBuiltin(Location.Builtin loc) {
            Irep.Builder b = Irep.builder(IrepId.EMPTY_STRING)
                    .named(IrepId.FILE, leaf(loc.getFile()))
                    .named(IrepId.FUNCTION, leaf(loc.getName()));
            if (loc.getLine() != null) b.namedInt(IrepId.LINE, loc.getLine());
            return b.build();
        }

        @Override
        public Irep visitSource(Location.Source loc) {
            return source(loc.getFile(), loc.getFunction(), loc.getLine(), loc.getColumn()).build();
        }

        @Override
        public Irep visitProperty(Location.Property loc) {
            return source(loc.getFile(), loc.getFunction(), loc.getLine(), loc.getColumn())
                    .named(IrepId.COMMENT, leaf(loc.getComment()))
                    .named(IrepId.PROPERTY_CLASS, leaf(loc.getPropertyClass()))
                    .build();
        }

        private static Irep.Builder source(String file, @Nullable String function, int line, @Nullable Integer column) {
            Irep.Builder b = Irep.builder(IrepId.EMPTY_STRING)
                    .named(IrepId.FILE, leaf(file))
                    .namedInt(IrepId.LINE, line);
            if (column != null) b.namedInt(IrepId.COLUMN, column);
            if (function != null) b.named(IrepId.FUNCTION, leaf(function));
            return b;
        }
    }
}
