package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression: an {@link ExprValue}, with its {@link Type} and {@link Location}.
 * <p>
 * Expressions are immutable; the builder methods here return new expressions,
 * checking the typing rules that would otherwise produce a program the verifier rejects.
 */
public final class Expr {
    @NotNull
    private final ExprValue value;
    @NotNull
    private final Type type;
    @NotNull
    private final Location location;

    public Expr(@NotNull ExprValue value, @NotNull Type type, @NotNull Location location) {
        this.value = value;
        this.type = type;
        this.location = location;
    }

    public Expr(@NotNull ExprValue value, @NotNull Type type) {
        this(value, type, Location.NONE);
    }

    public @NotNull ExprValue getValue() {
        return value;
    }

    public @NotNull Type getType() {
        return type;
    }

    public @NotNull Location getLocation() {
        return location;
    }

    public <R> R accept(ExprValue.Visitor<R> visitor) {
        return value.accept(visitor, this);
    }

    @Contract(pure = true)
    public Expr withLocation(@NotNull Location location) {
        return new Expr(value, type, location);
    }

    @Contract(pure = true)
    public Expr withValue(@NotNull ExprValue value) {
        return new Expr(value, type, location);
    }

    @Contract(pure = true)
    public Expr withType(@NotNull Type type) {
        return new Expr(value, type, location);
    }

    // region Constants
    public static Expr intConstant(long value, @NotNull Type type) {
        return intConstant(BigInteger.valueOf(value), type);
    }

    /**
     * An integer constant. Whether the value fits in the type is only checked when
     * the expression is encoded, since the width may depend on the machine model.
     *
     * @param value The value.
     * @param type  The type, which must be an integer type.
     * @return The constant.
     */
    public static Expr intConstant(@NotNull BigInteger value, @NotNull Type type) {
        if (!type.isInteger()) throw new IllegalArgumentException("integer constant of type " + type);
        return new Expr(new ExprValue.IntConstant(value), type);
    }

    public static Expr boolConstant(boolean value) {
        return new Expr(new ExprValue.BoolConstant(value), Type.bool());
    }

    public static Expr cBoolConstant(boolean value) {
        return new Expr(new ExprValue.CBoolConstant(value), Type.cBool());
    }

    public static Expr floatConstant(float value) {
        return new Expr(new ExprValue.FloatConstant(value), Type.floatType());
    }

    public static Expr doubleConstant(double value) {
        return new Expr(new ExprValue.DoubleConstant(value), Type.doubleType());
    }

    public static Expr nullPointer(@NotNull Type pointerType) {
        return pointerConstant(BigInteger.ZERO, pointerType);
    }

    public static Expr pointerConstant(@NotNull BigInteger address, @NotNull Type pointerType) {
        if (!(pointerType.unwrapTypedef() instanceof Type.Pointer)) {
            throw new IllegalArgumentException("pointer constant of type " + pointerType);
        }
        return new Expr(new ExprValue.PointerConstant(address), pointerType);
    }

    /**
     * A string literal, of type {@code char[n + 1]} where {@code n} is its length in UTF-8.
     *
     * @param value The string.
     * @return The literal.
     */
    public static Expr stringConstant(@NotNull String value) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        return new Expr(new ExprValue.StringConstant(value), Type.cChar().arrayOf(length + 1L));
    }
    // endregion

    public static Expr symbol(@NotNull String identifier, @NotNull Type type) {
        return new Expr(new ExprValue.SymbolRef(identifier), type);
    }

    public static Expr nondet(@NotNull Type type) {
        return new Expr(new ExprValue.Nondet(), type);
    }

    public static Expr emptyUnion(@NotNull Type type) {
        return new Expr(new ExprValue.EmptyUnion(), type);
    }

    public static Expr structExpr(@NotNull List<Expr> values, @NotNull Type structTagType) {
        return new Expr(new ExprValue.Struct(values), structTagType);
    }

    public static Expr unionExpr(@NotNull String field, @NotNull Expr value, @NotNull Type unionTagType) {
        return new Expr(new ExprValue.Union(field, value), unionTagType);
    }

    public static Expr arrayExpr(@NotNull List<Expr> elements, @NotNull Type arrayType) {
        return new Expr(new ExprValue.Array(elements), arrayType);
    }

    public static Expr vectorExpr(@NotNull List<Expr> elements, @NotNull Type vectorType) {
        return new Expr(new ExprValue.Vector(elements), vectorType);
    }

    public static Expr statementExpression(@NotNull List<Stmt> statements, @NotNull Type type) {
        return new Expr(new ExprValue.StatementExpression(statements), type);
    }

    public static Expr forall(@NotNull Expr variable, @NotNull Expr body) {
        return quantified(ExprValue.Quantifier.FORALL, variable, body);
    }

    public static Expr exists(@NotNull Expr variable, @NotNull Expr body) {
        return quantified(ExprValue.Quantifier.EXISTS, variable, body);
    }

    private static Expr quantified(ExprValue.Quantifier q, Expr variable, Expr body) {
        if (!(variable.getValue() instanceof ExprValue.SymbolRef)) {
            throw new IllegalArgumentException("quantified variable must be a symbol, got " + variable);
        }
        return new Expr(new ExprValue.Quantified(q, variable, body), Type.bool());
    }

    // region Builders
    public Expr address() {
        return new Expr(new ExprValue.AddressOf(this), type.toPointer());
    }

    public Expr dereference() {
        return new Expr(new ExprValue.Dereference(this), type.pointee());
    }

    public Expr member(@NotNull String field, @NotNull Type fieldType) {
        return new Expr(new ExprValue.Member(this, field), fieldType);
    }

    /**
     * Index into an array, vector or pointer.
     *
     * @param index The index.
     * @return The element.
     */
    public Expr index(@NotNull Expr index) {
        Type t = type.unwrapTypedef();
        Type element;
        if (t instanceof Type.Array) element = ((Type.Array) t).getElementType();
        else if (t instanceof Type.Vector) element = ((Type.Vector) t).getElementType();
        else if (t instanceof Type.FlexibleArray) element = ((Type.FlexibleArray) t).getElementType();
        else if (t instanceof Type.InfiniteArray) element = ((Type.InfiniteArray) t).getElementType();
        else if (t instanceof Type.Pointer) element = ((Type.Pointer) t).getPointee();
        else throw new IllegalArgumentException("cannot index into " + type);
        return new Expr(new ExprValue.Index(this, index), element);
    }

    public Expr cast(@NotNull Type to) {
        if (to.equals(type)) return this;
        return new Expr(new ExprValue.Typecast(this), to);
    }

    /**
     * Call this function-typed expression.
     *
     * @param arguments The arguments.
     * @return The call, of the function's return type.
     */
    public Expr call(@NotNull List<Expr> arguments) {
        Type t = type.unwrapTypedef();
        if (!(t instanceof Type.Code)) throw new IllegalArgumentException("cannot call " + this + " of type " + type);
        Type.Code code = (Type.Code) t;
        int params = code.getParameters().size();
        if (arguments.size() < params || !code.isVariadic() && arguments.size() != params) {
            throw new IllegalArgumentException("expected " + params + " arguments to " + this + ", got " + arguments.size());
        }
        return new Expr(new ExprValue.FunctionCall(this, arguments), code.getReturnType());
    }

    public Expr call() {
        return call(Collections.<Expr>emptyList());
    }

    public Expr assign(@NotNull Expr rhs) {
        return new Expr(new ExprValue.Assign(this, rhs), type);
    }

    public Expr binop(@NotNull BinaryOperator op, @NotNull Expr rhs) {
        return new Expr(new ExprValue.BinOp(op, this, rhs), op.producesBool() ? Type.bool() : type);
    }

    public Expr plus(@NotNull Expr rhs) {
        return binop(BinaryOperator.PLUS, rhs);
    }

    public Expr minus(@NotNull Expr rhs) {
        return binop(BinaryOperator.MINUS, rhs);
    }

    public Expr eq(@NotNull Expr rhs) {
        return binop(BinaryOperator.EQUAL, rhs);
    }

    public Expr neq(@NotNull Expr rhs) {
        return binop(BinaryOperator.NOTEQUAL, rhs);
    }

    public Expr lt(@NotNull Expr rhs) {
        return binop(BinaryOperator.LT, rhs);
    }

    public Expr and(@NotNull Expr rhs) {
        return binop(BinaryOperator.AND, rhs);
    }

    public Expr or(@NotNull Expr rhs) {
        return binop(BinaryOperator.OR, rhs);
    }

    public Expr implies(@NotNull Expr rhs) {
        return binop(BinaryOperator.IMPLIES, rhs);
    }

    public Expr unop(@NotNull UnaryOperator op) {
        return new Expr(new ExprValue.UnOp(op, this), op == UnaryOperator.NOT ? Type.bool() : type);
    }

    public Expr not() {
        return unop(UnaryOperator.NOT);
    }

    public Expr selfOp(@NotNull SelfOperator op) {
        return new Expr(new ExprValue.SelfOp(op, this), type);
    }

    public Expr ternary(@NotNull Expr then, @NotNull Expr otherwise) {
        return new Expr(new ExprValue.If(this, then, otherwise), then.type);
    }

    public Expr byteExtract(@NotNull Type to, long offset) {
        return new Expr(new ExprValue.ByteExtract(this, offset), to);
    }
    // endregion

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Expr expr = (Expr) o;
        return value.equals(expr.value) && type.equals(expr.type) && location.equals(expr.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, type, location);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
