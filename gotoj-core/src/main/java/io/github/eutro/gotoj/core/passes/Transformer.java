package io.github.eutro.gotoj.core.passes;

import io.github.eutro.gotoj.core.error.GotoException;
import io.github.eutro.gotoj.core.model.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A rewrite of a whole {@link SymbolTable}, one symbol at a time.
 * <p>
 * Every {@code visit} method rebuilds its node from the transformed children, so a
 * transformer which overrides nothing produces a table equal to its input. Subclasses
 * override the methods for the nodes they rewrite, and call back into
 * {@link #transformType(Type)}, {@link #transformExpr(Expr)} and {@link #transformStmt(Stmt)}
 * for the children they keep.
 * <p>
 * A transformer is used once. Constructing it consumes the input table; {@link #transform()}
 * then produces the output. Symbols which define types are transformed first, then the rest,
 * each in name order.
 * <p>
 * A {@link GotoException} thrown while transforming a symbol is given the symbol's name, and
 * the location of the innermost located node that was being transformed.
 */
public abstract class Transformer implements
        Type.Visitor<Type>,
        ExprValue.Visitor<Expr>,
        StmtBody.Visitor<Stmt> {
    protected final MachineModel mm;
    private final Map<String, Symbol> input = new TreeMap<>();
    private final SymbolTable output;
    private boolean done;

    protected Transformer(@NotNull SymbolTable table) {
        mm = table.getMachineModel();
        output = table.emptyCopy();
        for (Symbol symbol : table.symbols()) input.put(symbol.getName(), symbol);
        table.consume();
    }

    /**
     * Transform every symbol of the input table.
     *
     * @return The new table.
     * @throws IllegalStateException If this transformer has already been run.
     */
    public SymbolTable transform() {
        if (done) throw new IllegalStateException("transformer already run");
        done = true;
        List<Symbol> types = new ArrayList<>();
        List<Symbol> rest = new ArrayList<>();
        for (Symbol symbol : input.values()) {
            (symbol.isType() ? types : rest).add(symbol);
        }
        types.addAll(rest);
        for (Symbol symbol : types) {
            Symbol result;
            try {
                result = transformSymbol(symbol);
            } catch (GotoException e) {
                e.withSymbolName(symbol.getName()).withLocation(symbol.getLocation());
                throw e;
            }
            if (result != null) output.insert(result);
        }
        finish(output);
        return output;
    }

    /**
     * Called once every symbol has been transformed, to add to or annotate the output.
     *
     * @param output The output table.
     */
    protected void finish(SymbolTable output) {
    }

    /**
     * Get a symbol of the input table.
     *
     * @param name The name.
     * @return The symbol, or null if there is none.
     */
    protected @Nullable Symbol inputSymbol(@NotNull String name) {
        return input.get(name);
    }

    protected Map<String, Symbol> inputSymbols() {
        return Collections.unmodifiableMap(input);
    }

    /**
     * Add a new symbol to the output, such as a temporary introduced by this pass.
     *
     * @param symbol The symbol.
     */
    protected void addSymbol(@NotNull Symbol symbol) {
        output.insert(symbol);
    }

    /**
     * Get whether a name is free in both the input and the output.
     *
     * @param name The name.
     * @return Whether it is unused.
     */
    protected boolean isFreeName(@NotNull String name) {
        return !input.containsKey(name) && !output.contains(name);
    }

    /**
     * Transform a symbol.
     *
     * @param symbol The symbol.
     * @return The new symbol, or null to drop it.
     */
    protected @Nullable Symbol transformSymbol(@NotNull Symbol symbol) {
        return symbol.toBuilder()
                .setType(transformType(symbol.getType()))
                .setValue(transformValue(symbol.getValue()))
                .setLocation(transformLocation(symbol.getLocation()))
                .build();
    }

    protected SymbolValue transformValue(@NotNull SymbolValue value) {
        if (value.getExpr() != null) return SymbolValue.of(transformExpr(value.getExpr()));
        if (value.getStmt() != null) return SymbolValue.of(transformStmt(value.getStmt()));
        return value;
    }

    protected Location transformLocation(@NotNull Location location) {
        return location;
    }

    public Type transformType(@NotNull Type type) {
        return type.accept(this);
    }

    public Expr transformExpr(@NotNull Expr expr) {
        try {
            return expr.accept(this);
        } catch (GotoException e) {
            e.withLocation(expr.getLocation());
            throw e;
        }
    }

    public Stmt transformStmt(@NotNull Stmt stmt) {
        try {
            return stmt.accept(this);
        } catch (GotoException e) {
            e.withLocation(stmt.getLocation());
            throw e;
        }
    }

    protected @Nullable Expr transformExprOpt(@Nullable Expr expr) {
        return expr == null ? null : transformExpr(expr);
    }

    protected @Nullable Stmt transformStmtOpt(@Nullable Stmt stmt) {
        return stmt == null ? null : transformStmt(stmt);
    }

    protected List<Expr> transformExprs(@NotNull List<Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        for (Expr expr : exprs) result.add(transformExpr(expr));
        return result;
    }

    protected List<Stmt> transformStmts(@NotNull List<Stmt> stmts) {
        List<Stmt> result = new ArrayList<>(stmts.size());
        for (Stmt stmt : stmts) result.add(transformStmt(stmt));
        return result;
    }

    /**
     * Build an expression like {@code expr}, with a new value, and its type and location transformed.
     *
     * @param expr  The original expression.
     * @param value The new value.
     * @return The new expression.
     */
    protected Expr rebuild(Expr expr, ExprValue value) {
        return new Expr(value, transformType(expr.getType()), transformLocation(expr.getLocation()));
    }

    protected Stmt rebuild(Stmt stmt, StmtBody body) {
        return new Stmt(body, transformLocation(stmt.getLocation()));
    }

    // region Types
    @Override
    public Type visitArray(Type.Array t) {
        return new Type.Array(transformType(t.getElementType()), t.getSize());
    }

    @Override
    public Type visitBool(Type.Bool t) {
        return t;
    }

    @Override
    public Type visitCBitField(Type.CBitField t) {
        return new Type.CBitField(transformType(t.getType()), t.getWidth());
    }

    @Override
    public Type visitCInteger(Type.CInteger t) {
        return t;
    }

    @Override
    public Type visitCode(Type.Code t) {
        List<Parameter> parameters = new ArrayList<>(t.getParameters().size());
        for (Parameter parameter : t.getParameters()) {
            parameters.add(transformParameter(parameter));
        }
        return new Type.Code(parameters, transformType(t.getReturnType()), t.isVariadic());
    }

    protected Parameter transformParameter(Parameter parameter) {
        return parameter.withType(transformType(parameter.getType()));
    }

    @Override
    public Type visitConstructor(Type.Constructor t) {
        return t;
    }

    @Override
    public Type visitDouble(Type.Double t) {
        return t;
    }

    @Override
    public Type visitEmpty(Type.Empty t) {
        return t;
    }

    @Override
    public Type visitFlexibleArray(Type.FlexibleArray t) {
        return new Type.FlexibleArray(transformType(t.getElementType()));
    }

    @Override
    public Type visitFloat(Type.Float t) {
        return t;
    }

    @Override
    public Type visitIncompleteStruct(Type.IncompleteStruct t) {
        return t;
    }

    @Override
    public Type visitIncompleteUnion(Type.IncompleteUnion t) {
        return t;
    }

    @Override
    public Type visitInfiniteArray(Type.InfiniteArray t) {
        return new Type.InfiniteArray(transformType(t.getElementType()));
    }

    @Override
    public Type visitPointer(Type.Pointer t) {
        return new Type.Pointer(transformType(t.getPointee()));
    }

    @Override
    public Type visitSignedbv(Type.Signedbv t) {
        return t;
    }

    @Override
    public Type visitStruct(Type.Struct t) {
        return new Type.Struct(t.getTag(), transformComponents(t.getComponents()));
    }

    @Override
    public Type visitStructTag(Type.StructTag t) {
        return t;
    }

    @Override
    public Type visitTypeDef(Type.TypeDef t) {
        return new Type.TypeDef(t.getName(), transformType(t.getType()));
    }

    @Override
    public Type visitUnion(Type.Union t) {
        return new Type.Union(t.getTag(), transformComponents(t.getComponents()));
    }

    @Override
    public Type visitUnionTag(Type.UnionTag t) {
        return t;
    }

    @Override
    public Type visitUnsignedbv(Type.Unsignedbv t) {
        return t;
    }

    @Override
    public Type visitVector(Type.Vector t) {
        return new Type.Vector(transformType(t.getElementType()), t.getSize());
    }

    protected List<DatatypeComponent> transformComponents(List<DatatypeComponent> components) {
        List<DatatypeComponent> result = new ArrayList<>(components.size());
        for (DatatypeComponent component : components) {
            result.add(component.withType(transformType(component.getType())));
        }
        return result;
    }
    // endregion

    // region Expressions
    @Override
    public Expr visitAddressOf(Expr expr, ExprValue.AddressOf value) {
        return rebuild(expr, new ExprValue.AddressOf(transformExpr(value.getE())));
    }

    @Override
    public Expr visitArray(Expr expr, ExprValue.Array value) {
        return rebuild(expr, new ExprValue.Array(transformExprs(value.getElements())));
    }

    @Override
    public Expr visitArrayOf(Expr expr, ExprValue.ArrayOf value) {
        return rebuild(expr, new ExprValue.ArrayOf(transformExpr(value.getElement())));
    }

    @Override
    public Expr visitAssign(Expr expr, ExprValue.Assign value) {
        return rebuild(expr, new ExprValue.Assign(transformExpr(value.getLhs()), transformExpr(value.getRhs())));
    }

    @Override
    public Expr visitBinOp(Expr expr, ExprValue.BinOp value) {
        return rebuild(expr, new ExprValue.BinOp(value.getOp(),
                transformExpr(value.getLhs()),
                transformExpr(value.getRhs())));
    }

    @Override
    public Expr visitBoolConstant(Expr expr, ExprValue.BoolConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitByteExtract(Expr expr, ExprValue.ByteExtract value) {
        return rebuild(expr, new ExprValue.ByteExtract(transformExpr(value.getE()), value.getOffset()));
    }

    @Override
    public Expr visitCBoolConstant(Expr expr, ExprValue.CBoolConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitDereference(Expr expr, ExprValue.Dereference value) {
        return rebuild(expr, new ExprValue.Dereference(transformExpr(value.getE())));
    }

    @Override
    public Expr visitDoubleConstant(Expr expr, ExprValue.DoubleConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitEmptyUnion(Expr expr, ExprValue.EmptyUnion value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitFloatConstant(Expr expr, ExprValue.FloatConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitFunctionCall(Expr expr, ExprValue.FunctionCall value) {
        return rebuild(expr, new ExprValue.FunctionCall(
                transformExpr(value.getFunction()),
                transformExprs(value.getArguments())));
    }

    @Override
    public Expr visitIf(Expr expr, ExprValue.If value) {
        return rebuild(expr, new ExprValue.If(
                transformExpr(value.getCondition()),
                transformExpr(value.getThen()),
                transformExpr(value.getOtherwise())));
    }

    @Override
    public Expr visitIndex(Expr expr, ExprValue.Index value) {
        return rebuild(expr, new ExprValue.Index(transformExpr(value.getArray()), transformExpr(value.getIndex())));
    }

    @Override
    public Expr visitIntConstant(Expr expr, ExprValue.IntConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitMember(Expr expr, ExprValue.Member value) {
        return rebuild(expr, new ExprValue.Member(transformExpr(value.getLhs()), value.getField()));
    }

    @Override
    public Expr visitNondet(Expr expr, ExprValue.Nondet value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitPointerConstant(Expr expr, ExprValue.PointerConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitQuantified(Expr expr, ExprValue.Quantified value) {
        return rebuild(expr, new ExprValue.Quantified(value.getQuantifier(),
                transformExpr(value.getVariable()),
                transformExpr(value.getBody())));
    }

    @Override
    public Expr visitSelfOp(Expr expr, ExprValue.SelfOp value) {
        return rebuild(expr, new ExprValue.SelfOp(value.getOp(), transformExpr(value.getE())));
    }

    @Override
    public Expr visitStatementExpression(Expr expr, ExprValue.StatementExpression value) {
        return rebuild(expr, new ExprValue.StatementExpression(transformStmts(value.getStatements())));
    }

    @Override
    public Expr visitStringConstant(Expr expr, ExprValue.StringConstant value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitStruct(Expr expr, ExprValue.Struct value) {
        return rebuild(expr, new ExprValue.Struct(transformExprs(value.getValues())));
    }

    @Override
    public Expr visitSymbolRef(Expr expr, ExprValue.SymbolRef value) {
        return rebuild(expr, value);
    }

    @Override
    public Expr visitTypecast(Expr expr, ExprValue.Typecast value) {
        return rebuild(expr, new ExprValue.Typecast(transformExpr(value.getE())));
    }

    @Override
    public Expr visitUnion(Expr expr, ExprValue.Union value) {
        return rebuild(expr, new ExprValue.Union(value.getField(), transformExpr(value.getValue())));
    }

    @Override
    public Expr visitUnOp(Expr expr, ExprValue.UnOp value) {
        return rebuild(expr, new ExprValue.UnOp(value.getOp(), transformExpr(value.getE())));
    }

    @Override
    public Expr visitVector(Expr expr, ExprValue.Vector value) {
        return rebuild(expr, new ExprValue.Vector(transformExprs(value.getElements())));
    }
    // endregion

    // region Statements
    @Override
    public Stmt visitAssign(Stmt stmt, StmtBody.Assign body) {
        return rebuild(stmt, new StmtBody.Assign(transformExpr(body.getLhs()), transformExpr(body.getRhs())));
    }

    @Override
    public Stmt visitAssert(Stmt stmt, StmtBody.Assert body) {
        return rebuild(stmt, new StmtBody.Assert(transformExpr(body.getCondition())));
    }

    @Override
    public Stmt visitAssume(Stmt stmt, StmtBody.Assume body) {
        return rebuild(stmt, new StmtBody.Assume(transformExpr(body.getCondition())));
    }

    @Override
    public Stmt visitAtomicBlock(Stmt stmt, StmtBody.AtomicBlock body) {
        return rebuild(stmt, new StmtBody.AtomicBlock(transformStmts(body.getStatements())));
    }

    @Override
    public Stmt visitBlock(Stmt stmt, StmtBody.Block body) {
        return rebuild(stmt, new StmtBody.Block(transformStmts(body.getStatements())));
    }

    @Override
    public Stmt visitBreak(Stmt stmt, StmtBody.Break body) {
        return rebuild(stmt, body);
    }

    @Override
    public Stmt visitContinue(Stmt stmt, StmtBody.Continue body) {
        return rebuild(stmt, body);
    }

    @Override
    public Stmt visitDead(Stmt stmt, StmtBody.Dead body) {
        return rebuild(stmt, new StmtBody.Dead(transformExpr(body.getSymbol())));
    }

    @Override
    public Stmt visitDecl(Stmt stmt, StmtBody.Decl body) {
        return rebuild(stmt, new StmtBody.Decl(transformExpr(body.getLhs()), transformExprOpt(body.getValue())));
    }

    @Override
    public Stmt visitExpression(Stmt stmt, StmtBody.Expression body) {
        return rebuild(stmt, new StmtBody.Expression(transformExpr(body.getExpr())));
    }

    @Override
    public Stmt visitFor(Stmt stmt, StmtBody.For body) {
        return rebuild(stmt, new StmtBody.For(
                transformStmt(body.getInit()),
                transformExpr(body.getCondition()),
                transformStmt(body.getUpdate()),
                transformStmt(body.getBody())));
    }

    @Override
    public Stmt visitFunctionCall(Stmt stmt, StmtBody.FunctionCall body) {
        return rebuild(stmt, new StmtBody.FunctionCall(
                transformExprOpt(body.getLhs()),
                transformExpr(body.getFunction()),
                transformExprs(body.getArguments())));
    }

    @Override
    public Stmt visitGoto(Stmt stmt, StmtBody.Goto body) {
        return rebuild(stmt, body);
    }

    @Override
    public Stmt visitIfThenElse(Stmt stmt, StmtBody.IfThenElse body) {
        return rebuild(stmt, new StmtBody.IfThenElse(
                transformExpr(body.getCondition()),
                transformStmt(body.getThen()),
                transformStmtOpt(body.getOtherwise())));
    }

    @Override
    public Stmt visitLabel(Stmt stmt, StmtBody.Label body) {
        return rebuild(stmt, new StmtBody.Label(body.getLabel(), transformStmt(body.getBody())));
    }

    @Override
    public Stmt visitReturn(Stmt stmt, StmtBody.Return body) {
        return rebuild(stmt, new StmtBody.Return(transformExprOpt(body.getValue())));
    }

    @Override
    public Stmt visitSkip(Stmt stmt, StmtBody.Skip body) {
        return rebuild(stmt, body);
    }

    @Override
    public Stmt visitSwitch(Stmt stmt, StmtBody.Switch body) {
        List<SwitchCase> cases = new ArrayList<>(body.getCases().size());
        for (SwitchCase c : body.getCases()) {
            cases.add(new SwitchCase(transformExpr(c.getValue()), transformStmt(c.getBody())));
        }
        return rebuild(stmt, new StmtBody.Switch(
                transformExpr(body.getControl()),
                cases,
                transformStmtOpt(body.getDefaultCase())));
    }

    @Override
    public Stmt visitWhile(Stmt stmt, StmtBody.While body) {
        return rebuild(stmt, new StmtBody.While(transformExpr(body.getCondition()), transformStmt(body.getBody())));
    }
    // endregion
}
