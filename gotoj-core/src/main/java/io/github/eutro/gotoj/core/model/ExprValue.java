package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What an {@link Expr} computes, independent of its type and location.
 * <p>
 * The subclasses of this class are a closed set, enumerated by {@link Visitor}.
 */
public abstract class ExprValue {
    private static final Object[] NO_PARTS = new Object[0];

    ExprValue() {
    }

    public abstract <R> R accept(Visitor<R> visitor, Expr expr);

    abstract Object[] parts();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(parts(), ((ExprValue) o).parts());
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getSimpleName().hashCode() + Arrays.hashCode(parts());
    }

    private static String join(List<?> list) {
        return list.stream().map(Object::toString).collect(Collectors.joining(", "));
    }

    public enum Quantifier {
        FORALL,
        EXISTS,
    }

    /**
     * A visitor over every kind of expression.
     * <p>
     * Each method receives both the whole expression and its value.
     *
     * @param <R> The result of visiting.
     */
    public interface Visitor<R> {
        R visitAddressOf(Expr expr, AddressOf value);

        R visitArray(Expr expr, Array value);

        R visitArrayOf(Expr expr, ArrayOf value);

        R visitAssign(Expr expr, Assign value);

        R visitBinOp(Expr expr, BinOp value);

        R visitBoolConstant(Expr expr, BoolConstant value);

        R visitByteExtract(Expr expr, ByteExtract value);

        R visitCBoolConstant(Expr expr, CBoolConstant value);

        R visitDereference(Expr expr, Dereference value);

        R visitDoubleConstant(Expr expr, DoubleConstant value);

        R visitEmptyUnion(Expr expr, EmptyUnion value);

        R visitFloatConstant(Expr expr, FloatConstant value);

        R visitFunctionCall(Expr expr, FunctionCall value);

        R visitIf(Expr expr, If value);

        R visitIndex(Expr expr, Index value);

        R visitIntConstant(Expr expr, IntConstant value);

        R visitMember(Expr expr, Member value);

        R visitNondet(Expr expr, Nondet value);

        R visitPointerConstant(Expr expr, PointerConstant value);

        R visitQuantified(Expr expr, Quantified value);

        R visitSelfOp(Expr expr, SelfOp value);

        R visitStatementExpression(Expr expr, StatementExpression value);

        R visitStringConstant(Expr expr, StringConstant value);

        R visitStruct(Expr expr, Struct value);

        R visitSymbolRef(Expr expr, SymbolRef value);

        R visitTypecast(Expr expr, Typecast value);

        R visitUnion(Expr expr, Union value);

        R visitUnOp(Expr expr, UnOp value);

        R visitVector(Expr expr, Vector value);
    }

    /**
     * {@code &e}.
     */
    public static final class AddressOf extends ExprValue {
        private final Expr e;

        public AddressOf(@NotNull Expr e) {
            this.e = e;
        }

        public Expr getE() {
            return e;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitAddressOf(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{e};
        }

        @Override
        public String toString() {
            return "&" + e;
        }
    }

    /**
     * An array literal.
     */
    public static final class Array extends ExprValue {
        private final List<Expr> elements;

        public Array(@NotNull List<Expr> elements) {
            this.elements = Type.listOf(elements);
        }

        public List<Expr> getElements() {
            return elements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitArray(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elements};
        }

        @Override
        public String toString() {
            return "{" + join(elements) + "}";
        }
    }

    /**
     * An array with every element equal to {@code element}.
     */
    public static final class ArrayOf extends ExprValue {
        private final Expr element;

        public ArrayOf(@NotNull Expr element) {
            this.element = element;
        }

        public Expr getElement() {
            return element;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitArrayOf(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{element};
        }

        @Override
        public String toString() {
            return "array_of(" + element + ")";
        }
    }

    /**
     * An assignment used as an expression.
     */
    public static final class Assign extends ExprValue {
        private final Expr lhs;
        private final Expr rhs;

        public Assign(@NotNull Expr lhs, @NotNull Expr rhs) {
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public Expr getLhs() {
            return lhs;
        }

        public Expr getRhs() {
            return rhs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitAssign(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{lhs, rhs};
        }

        @Override
        public String toString() {
            return lhs + " = " + rhs;
        }
    }

    public static final class BinOp extends ExprValue {
        private final BinaryOperator op;
        private final Expr lhs;
        private final Expr rhs;

        public BinOp(@NotNull BinaryOperator op, @NotNull Expr lhs, @NotNull Expr rhs) {
            this.op = op;
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public BinaryOperator getOp() {
            return op;
        }

        public Expr getLhs() {
            return lhs;
        }

        public Expr getRhs() {
            return rhs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitBinOp(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{op, lhs, rhs};
        }

        @Override
        public String toString() {
            return "(" + lhs + " " + op.id() + " " + rhs + ")";
        }
    }

    public static final class BoolConstant extends ExprValue {
        private final boolean value;

        public BoolConstant(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitBoolConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{value};
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * Reinterpret the bytes of {@code e} starting at {@code offset} as the type of the expression.
     */
    public static final class ByteExtract extends ExprValue {
        private final Expr e;
        private final long offset;

        public ByteExtract(@NotNull Expr e, long offset) {
            this.e = e;
            this.offset = offset;
        }

        public Expr getE() {
            return e;
        }

        public long getOffset() {
            return offset;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitByteExtract(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{e, offset};
        }

        @Override
        public String toString() {
            return "byte_extract(" + e + ", " + offset + ")";
        }
    }

    public static final class CBoolConstant extends ExprValue {
        private final boolean value;

        public CBoolConstant(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitCBoolConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{value};
        }

        @Override
        public String toString() {
            return "(_Bool) " + value;
        }
    }

    public static final class Dereference extends ExprValue {
        private final Expr e;

        public Dereference(@NotNull Expr e) {
            this.e = e;
        }

        public Expr getE() {
            return e;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitDereference(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{e};
        }

        @Override
        public String toString() {
            return "*" + e;
        }
    }

    public static final class DoubleConstant extends ExprValue {
        private final double value;

        public DoubleConstant(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitDoubleConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{Double.doubleToLongBits(value)};
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class EmptyUnion extends ExprValue {
        public EmptyUnion() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitEmptyUnion(expr, this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "{}";
        }
    }

    public static final class FloatConstant extends ExprValue {
        private final float value;

        public FloatConstant(float value) {
            this.value = value;
        }

        public float getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitFloatConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{Float.floatToIntBits(value)};
        }

        @Override
        public String toString() {
            return value + "f";
        }
    }

    public static final class FunctionCall extends ExprValue {
        private final Expr function;
        private final List<Expr> arguments;

        public FunctionCall(@NotNull Expr function, @NotNull List<Expr> arguments) {
            this.function = function;
            this.arguments = Type.listOf(arguments);
        }

        public Expr getFunction() {
            return function;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitFunctionCall(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{function, arguments};
        }

        @Override
        public String toString() {
            return function + "(" + join(arguments) + ")";
        }
    }

    /**
     * {@code c ? t : e}.
     */
    public static final class If extends ExprValue {
        private final Expr condition;
        private final Expr then;
        private final Expr otherwise;

        public If(@NotNull Expr condition, @NotNull Expr then, @NotNull Expr otherwise) {
            this.condition = condition;
            this.then = then;
            this.otherwise = otherwise;
        }

        public Expr getCondition() {
            return condition;
        }

        public Expr getThen() {
            return then;
        }

        public Expr getOtherwise() {
            return otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitIf(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{condition, then, otherwise};
        }

        @Override
        public String toString() {
            return "(" + condition + " ? " + then + " : " + otherwise + ")";
        }
    }

    public static final class Index extends ExprValue {
        private final Expr array;
        private final Expr index;

        public Index(@NotNull Expr array, @NotNull Expr index) {
            this.array = array;
            this.index = index;
        }

        public Expr getArray() {
            return array;
        }

        public Expr getIndex() {
            return index;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitIndex(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{array, index};
        }

        @Override
        public String toString() {
            return array + "[" + index + "]";
        }
    }

    public static final class IntConstant extends ExprValue {
        private final BigInteger value;

        public IntConstant(@NotNull BigInteger value) {
            this.value = value;
        }

        public BigInteger getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitIntConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{value};
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * {@code lhs.field}.
     */
    public static final class Member extends ExprValue {
        private final Expr lhs;
        private final String field;

        public Member(@NotNull Expr lhs, @NotNull String field) {
            this.lhs = lhs;
            this.field = field;
        }

        public Expr getLhs() {
            return lhs;
        }

        public String getField() {
            return field;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitMember(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{lhs, field};
        }

        @Override
        public String toString() {
            return lhs + "." + field;
        }
    }

    /**
     * An unconstrained value.
     */
    public static final class Nondet extends ExprValue {
        public Nondet() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitNondet(expr, this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "nondet()";
        }
    }

    /**
     * A pointer with a constant address; zero is the null pointer.
     */
    public static final class PointerConstant extends ExprValue {
        private final BigInteger address;

        public PointerConstant(@NotNull BigInteger address) {
            this.address = address;
        }

        public BigInteger getAddress() {
            return address;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitPointerConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{address};
        }

        @Override
        public String toString() {
            return address.signum() == 0 ? "NULL" : "(void *) 0x" + address.toString(16);
        }
    }

    /**
     * A quantified boolean expression, {@code forall}ing or {@code exists}ing over {@code variable}.
     */
    public static final class Quantified extends ExprValue {
        private final Quantifier quantifier;
        private final Expr variable;
        private final Expr body;

        public Quantified(@NotNull Quantifier quantifier, @NotNull Expr variable, @NotNull Expr body) {
            this.quantifier = quantifier;
            this.variable = variable;
            this.body = body;
        }

        public Quantifier getQuantifier() {
            return quantifier;
        }

        public Expr getVariable() {
            return variable;
        }

        public Expr getBody() {
            return body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitQuantified(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{quantifier, variable, body};
        }

        @Override
        public String toString() {
            return quantifier.name().toLowerCase() + " " + variable + ". " + body;
        }
    }

    public static final class SelfOp extends ExprValue {
        private final SelfOperator op;
        private final Expr e;

        public SelfOp(@NotNull SelfOperator op, @NotNull Expr e) {
            this.op = op;
            this.e = e;
        }

        public SelfOperator getOp() {
            return op;
        }

        public Expr getE() {
            return e;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitSelfOp(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{op, e};
        }

        @Override
        public String toString() {
            return op.name().toLowerCase() + "(" + e + ")";
        }
    }

    /**
     * A GNU statement expression, whose value is that of its last statement.
     */
    public static final class StatementExpression extends ExprValue {
        private final List<Stmt> statements;

        public StatementExpression(@NotNull List<Stmt> statements) {
            this.statements = Type.listOf(statements);
        }

        public List<Stmt> getStatements() {
            return statements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitStatementExpression(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{statements};
        }

        @Override
        public String toString() {
            return "({ " + statements.size() + " statements })";
        }
    }

    public static final class StringConstant extends ExprValue {
        private final String value;

        public StringConstant(@NotNull String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitStringConstant(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{value};
        }

        @Override
        public String toString() {
            return "\"" + value + "\"";
        }
    }

    /**
     * A struct literal, with a value for every component, padding included.
     */
    public static final class Struct extends ExprValue {
        private final List<Expr> values;

        public Struct(@NotNull List<Expr> values) {
            this.values = Type.listOf(values);
        }

        public List<Expr> getValues() {
            return values;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitStruct(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{values};
        }

        @Override
        public String toString() {
            return "{" + join(values) + "}";
        }
    }

    /**
     * A reference to a symbol by name.
     */
    public static final class SymbolRef extends ExprValue {
        private final String identifier;

        public SymbolRef(@NotNull String identifier) {
            this.identifier = identifier;
        }

        public String getIdentifier() {
            return identifier;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitSymbolRef(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{identifier};
        }

        @Override
        public String toString() {
            return identifier;
        }
    }

    public static final class Typecast extends ExprValue {
        private final Expr e;

        public Typecast(@NotNull Expr e) {
            this.e = e;
        }

        public Expr getE() {
            return e;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitTypecast(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{e};
        }

        @Override
        public String toString() {
            return "(cast) " + e;
        }
    }

    /**
     * A union literal which initialises {@code field}.
     */
    public static final class Union extends ExprValue {
        private final String field;
        private final Expr value;

        public Union(@NotNull String field, @NotNull Expr value) {
            this.field = field;
            this.value = value;
        }

        public String getField() {
            return field;
        }

        public Expr getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitUnion(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{field, value};
        }

        @Override
        public String toString() {
            return "{." + field + " = " + value + "}";
        }
    }

    public static final class UnOp extends ExprValue {
        private final UnaryOperator op;
        private final Expr e;

        public UnOp(@NotNull UnaryOperator op, @NotNull Expr e) {
            this.op = op;
            this.e = e;
        }

        public UnaryOperator getOp() {
            return op;
        }

        public Expr getE() {
            return e;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitUnOp(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{op, e};
        }

        @Override
        public String toString() {
            return op.id() + "(" + e + ")";
        }
    }

    public static final class Vector extends ExprValue {
        private final List<Expr> elements;

        public Vector(@NotNull List<Expr> elements) {
            this.elements = Type.listOf(elements);
        }

        public List<Expr> getElements() {
            return elements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Expr expr) {
            return visitor.visitVector(expr, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elements};
        }

        @Override
        public String toString() {
            return "<" + join(elements) + ">";
        }
    }
}
