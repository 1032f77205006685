package io.github.eutro.gotoj.core.passes.convert;

import io.github.eutro.gotoj.core.error.EncodingWidthException;
import io.github.eutro.gotoj.core.error.GotoException;
import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.error.UnknownTagException;
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
 * Reads the typed model back from {@link Irep}s produced by {@link ToIrep}.
 * <p>
 * Every conversion checks the shape of the tree it is given. Unknown node ids raise
 * {@link UnknownTagException}, missing or ill-formed children raise {@link MalformedTreeException},
 * and widths that disagree with the machine model raise {@link EncodingWidthException}.
 */
public class FromIrep {
    private final MachineModel mm;

    public FromIrep(@NotNull MachineModel mm) {
        this.mm = mm;
    }

    // region Types
    public Type type(@NotNull Irep irep) {
        try {
            return readType(irep);
        } catch (IllegalArgumentException e) {
            throw malformed(irep, e);
        }
    }

    private Type readType(Irep irep) {
        Irep typedef = irep.get(IrepId.C_TYPEDEF);
        if (typedef != null) {
            return new Type.TypeDef(typedef.id().text(), type(irep.without(IrepId.C_TYPEDEF)));
        }
        IrepId id = irep.id();
        if (id == IrepId.BOOL) return Type.bool();
        if (id == IrepId.C_BOOL) {
            checkWidth(irep, mm.getBoolWidth());
            return Type.cBool();
        }
        if (id == IrepId.SIGNEDBV || id == IrepId.UNSIGNEDBV) return bitvector(irep);
        if (id == IrepId.FLOATBV) return floating(irep);
        if (id == IrepId.EMPTY) return Type.empty();
        if (id == IrepId.CONSTRUCTOR) return Type.constructor();
        if (id == IrepId.ARRAY) return array(irep);
        if (id == IrepId.POINTER) {
            checkWidth(irep, mm.getPointerWidth());
            return new Type.Pointer(type(irep.expectArity(1).sub(0)));
        }
        if (id == IrepId.CODE) return code(irep);
        if (id == IrepId.STRUCT || id == IrepId.UNION) return aggregate(irep);
        if (id == IrepId.STRUCT_TAG) return new Type.StructTag(tagOf(irep));
        if (id == IrepId.UNION_TAG) return new Type.UnionTag(tagOf(irep));
        if (id == IrepId.VECTOR) {
            return new Type.Vector(type(irep.expectArity(1).sub(0)), sizeOf(irep.require(IrepId.SIZE)));
        }
        if (id == IrepId.C_BIT_FIELD) {
            return new Type.CBitField(type(irep.expectArity(1).sub(0)), intLeaf(irep.require(IrepId.WIDTH)));
        }
        throw new UnknownTagException("unknown type '" + id + "'");
    }

    private Type bitvector(Irep irep) {
        boolean signed = irep.id() == IrepId.SIGNEDBV;
        int width = intLeaf(irep.require(IrepId.WIDTH));
        Irep cTypeIrep = irep.get(IrepId.C_C_TYPE);
        if (cTypeIrep == null) return signed ? Type.signedInt(width) : Type.unsignedInt(width);
        CIntType kind = CIntType.fromCType(cTypeIrep.id());
        if (kind == null) throw new UnknownTagException("unknown C integer type '" + cTypeIrep.id() + "'");
        if (kind.width(mm) != width || kind.isSigned(mm) != signed) {
            throw new EncodingWidthException("C type " + cTypeIrep.id() + " encoded as " + width + "-bit "
                    + irep.id() + ", machine model " + mm.getArchitecture() + " expects " + kind.width(mm)
                    + "-bit " + (kind.isSigned(mm) ? IrepId.SIGNEDBV : IrepId.UNSIGNEDBV));
        }
        return new Type.CInteger(kind);
    }

    private Type floating(Irep irep) {
        int f = intLeaf(irep.require(IrepId.F));
        int width = intLeaf(irep.require(IrepId.WIDTH));
        if (f == 23 && width == 32) return Type.floatType();
        if (f == 52 && width == 64) return Type.doubleType();
        throw new UnknownTagException("unsupported floating point format with " + f
                + " fraction bits and width " + width);
    }

    private Type array(Irep irep) {
        Type element = type(irep.expectArity(1).sub(0));
        Irep size = irep.require(IrepId.SIZE);
        if (size.id() == IrepId.INFINITY) return new Type.InfiniteArray(element);
        if (size.id() == IrepId.ID0 && size.isLeaf()) return new Type.FlexibleArray(element);
        return new Type.Array(element, sizeOf(size));
    }

    private long sizeOf(Irep size) {
        Expr expr = expr(size);
        if (!(expr.getValue() instanceof ExprValue.IntConstant)) {
            throw new MalformedTreeException("size must be an integer constant, got '" + size.id() + "'");
        }
        BigInteger value = ((ExprValue.IntConstant) expr.getValue()).getValue();
        if (value.signum() < 0 || value.bitLength() >= 64) {
            throw new EncodingWidthException("size " + value + " out of range");
        }
        return value.longValue();
    }

    private Type code(Irep irep) {
        Irep params = irep.require(IrepId.PARAMETERS);
        List<Parameter> parameters = new ArrayList<>(params.sub().size());
        for (Irep param : params.sub()) {
            if (param.id() != IrepId.PARAMETER) {
                throw new MalformedTreeException("expected '" + IrepId.PARAMETER + "', got '" + param.id() + "'");
            }
            parameters.add(new Parameter(
                    type(param.require(IrepId.TYPE)),
                    textOpt(param.get(IrepId.C_IDENTIFIER)),
                    textOpt(param.get(IrepId.C_BASE_NAME))
            ));
        }
        return new Type.Code(parameters, type(irep.require(IrepId.RETURN_TYPE)), flag(params, IrepId.ELLIPSIS));
    }

    private Type aggregate(Irep irep) {
        boolean isStruct = irep.id() == IrepId.STRUCT;
        String tag = irep.require(IrepId.TAG).id().text();
        if (flag(irep, IrepId.INCOMPLETE)) {
            return isStruct ? new Type.IncompleteStruct(tag) : new Type.IncompleteUnion(tag);
        }
        List<DatatypeComponent> components = new ArrayList<>();
        for (Irep component : irep.require(IrepId.COMPONENTS).sub()) {
            components.add(DatatypeComponent.of(
                    component.require(IrepId.NAME).id().text(),
                    type(component.require(IrepId.TYPE)),
                    flag(component, IrepId.C_IS_PADDING)
            ));
        }
        return isStruct ? new Type.Struct(tag, components) : new Type.Union(tag, components);
    }

    private static String tagOf(Irep irep) {
        String identifier = irep.require(IrepId.IDENTIFIER).id().text();
        if (!identifier.startsWith(Type.TAG_PREFIX)) {
            throw new MalformedTreeException("'" + irep.id() + "' identifier must start with '"
                    + Type.TAG_PREFIX + "', got '" + identifier + "'");
        }
        return identifier.substring(Type.TAG_PREFIX.length());
    }

    private static void checkWidth(Irep irep, int expected) {
        int width = intLeaf(irep.require(IrepId.WIDTH));
        if (width != expected) {
            throw new EncodingWidthException("'" + irep.id() + "' has width " + width + ", machine model expects " + expected);
        }
    }
    // endregion

    // region Expressions
    /**
     * Convert an irep to an expression.
     *
     * @param irep The irep.
     * @return The expression.
     */
    public Expr expr(@NotNull Irep irep) {
        Type type = type(irep.require(IrepId.TYPE));
        Location location = locationOpt(irep.get(IrepId.C_SOURCE_LOCATION));
        try {
            return new Expr(exprValue(irep, type), type, location);
        } catch (IllegalArgumentException e) {
            throw malformed(irep, e);
        }
    }

    private ExprValue exprValue(Irep irep, Type type) {
        IrepId id = irep.id();
        if (id == IrepId.CONSTANT) return constant(irep, type);
        if (id == IrepId.SYMBOL) return new ExprValue.SymbolRef(irep.require(IrepId.IDENTIFIER).id().text());
        if (id == IrepId.SIDE_EFFECT) return sideEffect(irep);
        if (id == IrepId.ADDRESS_OF) return new ExprValue.AddressOf(unary(irep));
        if (id == IrepId.ARRAY_OF) return new ExprValue.ArrayOf(unary(irep));
        if (id == IrepId.ARRAY) return new ExprValue.Array(exprList(irep.sub()));
        if (id == IrepId.DEREFERENCE) return new ExprValue.Dereference(unary(irep));
        if (id == IrepId.EMPTY_UNION) return new ExprValue.EmptyUnion();
        if (id == IrepId.IF) {
            irep.expectArity(3);
            return new ExprValue.If(expr(irep.sub(0)), expr(irep.sub(1)), expr(irep.sub(2)));
        }
        if (id == IrepId.INDEX) {
            irep.expectArity(2);
            return new ExprValue.Index(expr(irep.sub(0)), expr(irep.sub(1)));
        }
        if (id == IrepId.MEMBER) {
            return new ExprValue.Member(unary(irep), irep.require(IrepId.COMPONENT_NAME).id().text());
        }
        if (id == IrepId.STRING_CONSTANT) return new ExprValue.StringConstant(irep.require(IrepId.VALUE).id().text());
        if (id == IrepId.STRUCT) return new ExprValue.Struct(exprList(irep.sub()));
        if (id == IrepId.TYPECAST) return new ExprValue.Typecast(unary(irep));
        if (id == IrepId.UNION) {
            return new ExprValue.Union(irep.require(IrepId.COMPONENT_NAME).id().text(), unary(irep));
        }
        if (id == IrepId.VECTOR) return new ExprValue.Vector(exprList(irep.sub()));
        if (id == IrepId.BYTE_EXTRACT_LITTLE_ENDIAN || id == IrepId.BYTE_EXTRACT_BIG_ENDIAN) {
            if ((id == IrepId.BYTE_EXTRACT_BIG_ENDIAN) != mm.isBigEndian()) {
                throw new MalformedTreeException("'" + id + "' does not match the endianness of " + mm.getArchitecture());
            }
            irep.expectArity(2);
            return new ExprValue.ByteExtract(expr(irep.sub(0)), sizeOf(irep.sub(1)));
        }
        if (id == IrepId.FORALL || id == IrepId.EXISTS) {
            irep.expectArity(2);
            Irep tuple = irep.sub(0);
            if (tuple.id() != IrepId.TUPLE) {
                throw new MalformedTreeException("expected '" + IrepId.TUPLE + "', got '" + tuple.id() + "'");
            }
            return new ExprValue.Quantified(
                    id == IrepId.FORALL ? ExprValue.Quantifier.FORALL : ExprValue.Quantifier.EXISTS,
                    expr(tuple.expectArity(1).sub(0)),
                    expr(irep.sub(1)));
        }
        BinaryOperator binOp = BinaryOperator.fromId(id);
        if (binOp != null) {
            irep.expectArity(2);
            return new ExprValue.BinOp(binOp, expr(irep.sub(0)), expr(irep.sub(1)));
        }
        UnaryOperator unOp = UnaryOperator.fromId(id);
        if (unOp != null) return new ExprValue.UnOp(unOp, unary(irep));
        throw new UnknownTagException("unknown expression '" + id + "'");
    }

    private Expr unary(Irep irep) {
        return expr(irep.expectArity(1).sub(0));
    }

    private ExprValue sideEffect(Irep irep) {
        IrepId statement = irep.require(IrepId.STATEMENT).id();
        if (statement == IrepId.ASSIGN) {
            irep.expectArity(2);
            return new ExprValue.Assign(expr(irep.sub(0)), expr(irep.sub(1)));
        }
        if (statement == IrepId.FUNCTION_CALL) {
            irep.expectArity(2);
            return new ExprValue.FunctionCall(expr(irep.sub(0)), arguments(irep.sub(1)));
        }
        if (statement == IrepId.NONDET) return new ExprValue.Nondet();
        if (statement == IrepId.STATEMENT_EXPRESSION) {
            Stmt block = stmt(irep.expectArity(1).sub(0));
            if (!(block.getBody() instanceof StmtBody.Block)) {
                throw new MalformedTreeException("statement expression must contain a block");
            }
            return new ExprValue.StatementExpression(((StmtBody.Block) block.getBody()).getStatements());
        }
        SelfOperator selfOp = SelfOperator.fromId(statement);
        if (selfOp != null) return new ExprValue.SelfOp(selfOp, unary(irep));
        throw new UnknownTagException("unknown side effect '" + statement + "'");
    }

    private List<Expr> arguments(Irep irep) {
        if (irep.id() != IrepId.ARGUMENTS) {
            throw new MalformedTreeException("expected '" + IrepId.ARGUMENTS + "', got '" + irep.id() + "'");
        }
        return exprList(irep.sub());
    }

    private List<Expr> exprList(List<Irep> ireps) {
        List<Expr> exprs = new ArrayList<>(ireps.size());
        for (Irep irep : ireps) exprs.add(expr(irep));
        return exprs;
    }

    private ExprValue constant(Irep irep, Type type) {
        IrepId value = irep.require(IrepId.VALUE).id();
        Type t = type.unwrapTypedef();
        if (t instanceof Type.Bool) {
            if (value == IrepId.TRUE) return new ExprValue.BoolConstant(true);
            if (value == IrepId.FALSE) return new ExprValue.BoolConstant(false);
            throw new MalformedTreeException("bad bool constant '" + value + "'");
        }
        if (t instanceof Type.Pointer && value == IrepId.NULL) return new ExprValue.PointerConstant(BigInteger.ZERO);
        BigInteger bits = bitPattern(value);
        if (t instanceof Type.CInteger && ((Type.CInteger) t).getKind() == CIntType.BOOL) {
            checkBits(bits, mm.getBoolWidth(), type);
            return new ExprValue.CBoolConstant(bits.signum() != 0);
        }
        if (t instanceof Type.Pointer) {
            checkBits(bits, mm.getPointerWidth(), type);
            return new ExprValue.PointerConstant(bits);
        }
        if (t instanceof Type.Float) {
            checkBits(bits, 32, type);
            return new ExprValue.FloatConstant(java.lang.Float.intBitsToFloat(bits.intValue()));
        }
        if (t instanceof Type.Double) {
            checkBits(bits, 64, type);
            return new ExprValue.DoubleConstant(java.lang.Double.longBitsToDouble(bits.longValue()));
        }
        if (t.isInteger()) {
            int width = t.bitWidth(mm);
            checkBits(bits, width, type);
            if (t.isSigned(mm) && bits.testBit(width - 1)) bits = bits.subtract(BigInteger.ONE.shiftLeft(width));
            return new ExprValue.IntConstant(bits);
        }
        throw new MalformedTreeException("constant of unsupported type " + type);
    }

    private static BigInteger bitPattern(IrepId value) {
        try {
            return value.bitPatternValue();
        } catch (NumberFormatException e) {
            throw new MalformedTreeException("bad constant '" + value + "'", e);
        }
    }

    private static void checkBits(BigInteger bits, int width, Type type) {
        if (bits.bitLength() > width) {
            throw new EncodingWidthException("constant " + bits.toString(16).toUpperCase()
                    + " does not fit in " + width + " bits of " + type);
        }
    }
    // endregion

    // region Statements
    /**
     * Convert an irep to a statement.
     *
     * @param irep The irep.
     * @return The statement.
     */
    public Stmt stmt(@NotNull Irep irep) {
        if (irep.id() != IrepId.CODE) {
            throw new MalformedTreeException("expected '" + IrepId.CODE + "' statement, got '" + irep.id() + "'");
        }
        Location location = locationOpt(irep.get(IrepId.C_SOURCE_LOCATION));
        try {
            return new Stmt(stmtBody(irep), location);
        } catch (IllegalArgumentException e) {
            throw malformed(irep, e).withLocation(location);
        }
    }

    private StmtBody stmtBody(Irep irep) {
        IrepId statement = irep.require(IrepId.STATEMENT).id();
        if (statement == IrepId.ASSIGN) {
            irep.expectArity(2);
            return new StmtBody.Assign(expr(irep.sub(0)), expr(irep.sub(1)));
        }
        if (statement == IrepId.ASSERT) return new StmtBody.Assert(unary(irep));
        if (statement == IrepId.ASSUME) return new StmtBody.Assume(unary(irep));
        if (statement == IrepId.BLOCK) return block(irep);
        if (statement == IrepId.BREAK) return new StmtBody.Break();
        if (statement == IrepId.CONTINUE) return new StmtBody.Continue();
        if (statement == IrepId.DEAD) return new StmtBody.Dead(unary(irep));
        if (statement == IrepId.DECL) {
            int arity = irep.sub().size();
            if (arity != 1 && arity != 2) {
                throw new MalformedTreeException("expected 1 or 2 children in 'decl', got " + arity);
            }
            return new StmtBody.Decl(expr(irep.sub(0)), arity == 2 ? expr(irep.sub(1)) : null);
        }
        if (statement == IrepId.EXPRESSION) return new StmtBody.Expression(unary(irep));
        if (statement == IrepId.FOR) {
            irep.expectArity(4);
            return new StmtBody.For(stmt(irep.sub(0)), expr(irep.sub(1)), stmt(irep.sub(2)), stmt(irep.sub(3)));
        }
        if (statement == IrepId.FUNCTION_CALL) {
            irep.expectArity(3);
            Irep lhs = irep.sub(0);
            return new StmtBody.FunctionCall(lhs.isNil() ? null : expr(lhs), expr(irep.sub(1)), arguments(irep.sub(2)));
        }
        if (statement == IrepId.GOTO) return new StmtBody.Goto(irep.require(IrepId.DESTINATION).id().text());
        if (statement == IrepId.IFTHENELSE) {
            irep.expectArity(3);
            Irep otherwise = irep.sub(2);
            return new StmtBody.IfThenElse(expr(irep.sub(0)), stmt(irep.sub(1)), otherwise.isNil() ? null : stmt(otherwise));
        }
        if (statement == IrepId.LABEL) {
            return new StmtBody.Label(irep.require(IrepId.LABEL).id().text(), stmt(irep.expectArity(1).sub(0)));
        }
        if (statement == IrepId.RETURN) {
            Irep value = irep.expectArity(1).sub(0);
            return new StmtBody.Return(value.isNil() ? null : expr(value));
        }
        if (statement == IrepId.SKIP) return new StmtBody.Skip();
        if (statement == IrepId.SWITCH) return switchStmt(irep);
        if (statement == IrepId.WHILE) {
            irep.expectArity(2);
            return new StmtBody.While(expr(irep.sub(0)), stmt(irep.sub(1)));
        }
        throw new UnknownTagException("unknown statement '" + statement + "'");
    }

    private StmtBody block(Irep irep) {
        List<Irep> subs = irep.sub();
        int n = subs.size();
        if (n >= 2 && isCode(subs.get(0), IrepId.ATOMIC_BEGIN) && isCode(subs.get(n - 1), IrepId.ATOMIC_END)) {
            return new StmtBody.AtomicBlock(stmtList(subs.subList(1, n - 1)));
        }
        return new StmtBody.Block(stmtList(subs));
    }

    private static boolean isCode(Irep irep, IrepId statement) {
        Irep s = irep.get(IrepId.STATEMENT);
        return irep.id() == IrepId.CODE && s != null && s.id() == statement;
    }

    private StmtBody switchStmt(Irep irep) {
        irep.expectArity(2);
        Expr control = expr(irep.sub(0));
        Irep block = irep.sub(1);
        if (!isCode(block, IrepId.BLOCK)) throw new MalformedTreeException("switch body must be a block");
        List<SwitchCase> cases = new ArrayList<>();
        Stmt defaultCase = null;
        for (Irep c : block.sub()) {
            if (!isCode(c, IrepId.SWITCH_CASE)) {
                throw new MalformedTreeException("switch block may only contain cases");
            }
            c.expectArity(2);
            if (flag(c, IrepId.DEFAULT)) {
                if (defaultCase != null) throw new MalformedTreeException("switch has more than one default case");
                defaultCase = stmt(c.sub(1));
            } else {
                cases.add(new SwitchCase(expr(c.sub(0)), stmt(c.sub(1))));
            }
        }
        return new StmtBody.Switch(control, cases, defaultCase);
    }

    private List<Stmt> stmtList(List<Irep> ireps) {
        List<Stmt> stmts = new ArrayList<>(ireps.size());
        for (Irep irep : ireps) stmts.add(stmt(irep));
        return stmts;
    }
    // endregion

    // region Locations
    public Location location(@NotNull Irep irep) {
        try {
            return readLocation(irep);
        } catch (IllegalArgumentException e) {
            throw malformed(irep, e);
        }
    }

    private Location readLocation(Irep irep) {
        if (irep.isNil()) return Location.NONE;
        String file = irep.require(IrepId.FILE).id().text();
        String function = textOpt(irep.get(IrepId.FUNCTION));
        Irep lineIrep = irep.get(IrepId.LINE);
        if (file.startsWith(Location.BUILTIN_PREFIX)) {
            String name = function != null
                    ? function
                    : file.substring(Location.BUILTIN_PREFIX.length(), file.length() - (file.endsWith(">") ? 1 : 0));
            return lineIrep == null ? Location.builtin(name) : Location.builtin(name, intLeaf(lineIrep));
        }
        int line = intLeaf(irep.require(IrepId.LINE));
        Irep columnIrep = irep.get(IrepId.COLUMN);
        Location.Source source = (Location.Source) Location.source(file, function, line,
                columnIrep == null ? null : intLeaf(columnIrep));
        Irep propertyClass = irep.get(IrepId.PROPERTY_CLASS);
        if (propertyClass == null) return source;
        return Location.property(source, propertyClass.id().text(), irep.require(IrepId.COMMENT).id().text());
    }

    private Location locationOpt(@Nullable Irep irep) {
        return irep == null ? Location.NONE : location(irep);
    }
    // endregion

    /**
     * Convert a serialized symbol, attributing any error to it.
     *
     * @param symbol The serialized symbol.
     * @return The symbol.
     */
    public Symbol symbol(@NotNull IrepSymbol symbol) {
        try {
            Symbol.Mode mode = Symbol.Mode.fromText(symbol.getMode());
            if (mode == null) throw new UnknownTagException("unknown mode '" + symbol.getMode() + "'");
            Location location = location(symbol.getLocation());
            Irep valueIrep = symbol.getValue();
            SymbolValue value;
            if (valueIrep.isNil()) value = SymbolValue.none();
            else if (valueIrep.id() == IrepId.CODE) value = SymbolValue.of(stmt(valueIrep));
            else value = SymbolValue.of(expr(valueIrep));
            return Symbol.builder(symbol.getName(), type(symbol.getType()))
                    .setValue(value)
                    .setLocation(location)
                    .setModule(symbol.getModule())
                    .setBaseName(symbol.getBaseName())
                    .setPrettyName(symbol.getPrettyName())
                    .setMode(mode)
                    .setFlags(symbol.getFlags())
                    .build();
        } catch (GotoException e) {
            e.withSymbolName(symbol.getName());
            throw e;
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException("bad symbol: " + e.getMessage(), e).withSymbolName(symbol.getName());
        }
    }

    private static boolean flag(Irep irep, IrepId key) {
        Irep value = irep.get(key);
        return value != null && value.id() == IrepId.ID1;
    }

    private static @Nullable String textOpt(@Nullable Irep irep) {
        return irep == null ? null : irep.id().text();
    }

    private static MalformedTreeException malformed(Irep irep, IllegalArgumentException e) {
        return new MalformedTreeException("bad '" + irep.id() + "': " + e.getMessage(), e);
    }

    private static int intLeaf(Irep irep) {
        try {
            return Integer.parseInt(irep.id().text());
        } catch (NumberFormatException e) {
            throw new MalformedTreeException("expected an integer, got '" + irep.id() + "'", e);
        }
    }
}
