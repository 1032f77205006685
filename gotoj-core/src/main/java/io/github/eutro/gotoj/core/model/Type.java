package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A type in a goto program.
 * <p>
 * The subclasses of this class are a closed set, enumerated by {@link Visitor}.
 * Struct and union types are defined once, by a {@link Symbol} named after their
 * {@link #aggregateTag(String) tag}, and referred to elsewhere by {@link StructTag} and {@link UnionTag},
 * so recursive aggregates need no cycles.
 * <p>
 * Types are immutable, and equal when structurally equal.
 */
public abstract class Type {
    /**
     * The prefix of the names of symbols which define aggregates.
     */
    public static final String TAG_PREFIX = "tag-";

    Type() {
    }

    /**
     * Get the name of the symbol which defines the aggregate with the given tag.
     *
     * @param tag The tag.
     * @return The symbol name.
     */
    public static String aggregateTag(String tag) {
        return TAG_PREFIX + tag;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    abstract Object[] parts();

    // region Factories
    public static Type bool() {
        return Bool.INSTANCE;
    }

    public static Type cBool() {
        return new CInteger(CIntType.BOOL);
    }

    public static Type cChar() {
        return new CInteger(CIntType.CHAR);
    }

    public static Type cInt() {
        return new CInteger(CIntType.INT);
    }

    public static Type cLongInt() {
        return new CInteger(CIntType.LONG_INT);
    }

    public static Type sizeT() {
        return new CInteger(CIntType.SIZE_T);
    }

    public static Type ssizeT() {
        return new CInteger(CIntType.SSIZE_T);
    }

    public static Type signedInt(int width) {
        return new Signedbv(width);
    }

    public static Type unsignedInt(int width) {
        return new Unsignedbv(width);
    }

    public static Type floatType() {
        return Float.INSTANCE;
    }

    public static Type doubleType() {
        return Double.INSTANCE;
    }

    public static Type empty() {
        return Empty.INSTANCE;
    }

    public static Type constructor() {
        return Constructor.INSTANCE;
    }

    public static Type code(List<Parameter> parameters, Type returnType) {
        return new Code(parameters, returnType, false);
    }

    public static Type variadicCode(List<Parameter> parameters, Type returnType) {
        return new Code(parameters, returnType, true);
    }

    public static Type structTag(String tag) {
        return new StructTag(tag);
    }

    public static Type unionTag(String tag) {
        return new UnionTag(tag);
    }

    public Type toPointer() {
        return new Pointer(this);
    }

    public Type arrayOf(long size) {
        return new Array(this, size);
    }

    public Type infiniteArrayOf() {
        return new InfiniteArray(this);
    }

    public Type flexibleArrayOf() {
        return new FlexibleArray(this);
    }

    public Type typedef(String name) {
        return new TypeDef(name, this);
    }
    // endregion

    // region Queries
    /**
     * Strip any {@link TypeDef} wrapping this type.
     *
     * @return The underlying type.
     */
    public Type unwrapTypedef() {
        Type t = this;
        while (t instanceof TypeDef) t = ((TypeDef) t).getType();
        return t;
    }

    /**
     * Get whether an integer constant may have this type.
     *
     * @return Whether this is an integer type, other than {@code _Bool}.
     */
    public boolean isInteger() {
        Type t = unwrapTypedef();
        return t instanceof Signedbv
                || t instanceof Unsignedbv
                || t instanceof CInteger && ((CInteger) t).getKind() != CIntType.BOOL;
    }

    /**
     * Get whether an integer type is signed.
     *
     * @param mm The machine model.
     * @return Whether the type is signed.
     * @throws IllegalStateException If this is not an integer type.
     */
    public boolean isSigned(MachineModel mm) {
        Type t = unwrapTypedef();
        if (t instanceof Signedbv) return true;
        if (t instanceof Unsignedbv) return false;
        if (t instanceof CInteger) return ((CInteger) t).getKind().isSigned(mm);
        throw new IllegalStateException("not an integer type: " + this);
    }

    /**
     * Get the width of a scalar type in bits.
     *
     * @param mm The machine model.
     * @return The width.
     * @throws IllegalStateException If this type has no fixed scalar width.
     */
    public int bitWidth(MachineModel mm) {
        Type t = unwrapTypedef();
        if (t instanceof Signedbv) return ((Signedbv) t).getWidth();
        if (t instanceof Unsignedbv) return ((Unsignedbv) t).getWidth();
        if (t instanceof CInteger) return ((CInteger) t).getKind().width(mm);
        if (t instanceof CBitField) return ((CBitField) t).getWidth();
        if (t instanceof Pointer) return mm.getPointerWidth();
        if (t instanceof Float) return mm.getSingleWidth();
        if (t instanceof Double) return mm.getDoubleWidth();
        throw new IllegalStateException("type has no scalar width: " + this);
    }

    public boolean isCode() {
        return unwrapTypedef() instanceof Code;
    }

    /**
     * Get the return type of a code type.
     *
     * @return The return type.
     * @throws IllegalStateException If this is not a code type.
     */
    public Type returnType() {
        Type t = unwrapTypedef();
        if (!(t instanceof Code)) throw new IllegalStateException("not a code type: " + this);
        return ((Code) t).getReturnType();
    }

    /**
     * Get the type pointed to by a pointer type.
     *
     * @return The pointee.
     * @throws IllegalStateException If this is not a pointer type.
     */
    public Type pointee() {
        Type t = unwrapTypedef();
        if (!(t instanceof Pointer)) throw new IllegalStateException("not a pointer type: " + this);
        return ((Pointer) t).getPointee();
    }
    // endregion

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(parts(), ((Type) o).parts());
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getSimpleName().hashCode() + Arrays.hashCode(parts());
    }

    private static final Object[] NO_PARTS = new Object[0];

    private static int checkWidth(int width) {
        if (width <= 0) throw new IllegalArgumentException("width must be positive, got " + width);
        return width;
    }

    /**
     * A visitor over every kind of type.
     *
     * @param <R> The result of visiting.
     */
    public interface Visitor<R> {
        R visitArray(Array t);

        R visitBool(Bool t);

        R visitCBitField(CBitField t);

        R visitCInteger(CInteger t);

        R visitCode(Code t);

        R visitConstructor(Constructor t);

        R visitDouble(Double t);

        R visitEmpty(Empty t);

        R visitFlexibleArray(FlexibleArray t);

        R visitFloat(Float t);

        R visitIncompleteStruct(IncompleteStruct t);

        R visitIncompleteUnion(IncompleteUnion t);

        R visitInfiniteArray(InfiniteArray t);

        R visitPointer(Pointer t);

        R visitSignedbv(Signedbv t);

        R visitStruct(Struct t);

        R visitStructTag(StructTag t);

        R visitTypeDef(TypeDef t);

        R visitUnion(Union t);

        R visitUnionTag(UnionTag t);

        R visitUnsignedbv(Unsignedbv t);

        R visitVector(Vector t);
    }

    /**
     * {@code T[size]}.
     */
    public static final class Array extends Type {
        private final Type elementType;
        private final long size;

        public Array(@NotNull Type elementType, long size) {
            if (size < 0) throw new IllegalArgumentException("negative array size " + size);
            this.elementType = elementType;
            this.size = size;
        }

        public Type getElementType() {
            return elementType;
        }

        public long getSize() {
            return size;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elementType, size};
        }

        @Override
        public String toString() {
            return elementType + "[" + size + "]";
        }
    }

    /**
     * The verifier's single-bit boolean.
     */
    public static final class Bool extends Type {
        static final Bool INSTANCE = new Bool();

        private Bool() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "bool";
        }
    }

    public static final class CBitField extends Type {
        private final Type type;
        private final int width;

        public CBitField(@NotNull Type type, int width) {
            this.type = type;
            this.width = checkWidth(width);
        }

        public Type getType() {
            return type;
        }

        public int getWidth() {
            return width;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCBitField(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{type, width};
        }

        @Override
        public String toString() {
            return type + " : " + width;
        }
    }

    /**
     * A C integer type, whose width is given by the machine model.
     */
    public static final class CInteger extends Type {
        private final CIntType kind;

        public CInteger(@NotNull CIntType kind) {
            this.kind = kind;
        }

        public CIntType getKind() {
            return kind;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCInteger(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{kind};
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase();
        }
    }

    /**
     * A function type. Variadic functions accept arguments beyond their parameters.
     */
    public static final class Code extends Type {
        private final List<Parameter> parameters;
        private final Type returnType;
        private final boolean variadic;

        public Code(@NotNull List<Parameter> parameters, @NotNull Type returnType, boolean variadic) {
            this.parameters = listOf(parameters);
            this.returnType = returnType;
            this.variadic = variadic;
        }

        public List<Parameter> getParameters() {
            return parameters;
        }

        public Type getReturnType() {
            return returnType;
        }

        public boolean isVariadic() {
            return variadic;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCode(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{parameters, returnType, variadic};
        }

        @Override
        public String toString() {
            String params = parameters.stream().map(Parameter::toString).collect(Collectors.joining(", "));
            if (variadic) params = params.isEmpty() ? "..." : params + ", ...";
            return returnType + "(" + params + ")";
        }
    }

    public static final class Constructor extends Type {
        static final Constructor INSTANCE = new Constructor();

        private Constructor() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstructor(this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "constructor";
        }
    }

    public static final class Double extends Type {
        static final Double INSTANCE = new Double();

        private Double() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDouble(this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "double";
        }
    }

    /**
     * {@code void}.
     */
    public static final class Empty extends Type {
        static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmpty(this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "void";
        }
    }

    /**
     * {@code T[]}, as the last member of a struct.
     */
    public static final class FlexibleArray extends Type {
        private final Type elementType;

        public FlexibleArray(@NotNull Type elementType) {
            this.elementType = elementType;
        }

        public Type getElementType() {
            return elementType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFlexibleArray(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elementType};
        }

        @Override
        public String toString() {
            return elementType + "[]";
        }
    }

    public static final class Float extends Type {
        static final Float INSTANCE = new Float();

        private Float() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFloat(this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "float";
        }
    }

    public static final class IncompleteStruct extends Type {
        private final String tag;

        public IncompleteStruct(@NotNull String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIncompleteStruct(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag};
        }

        @Override
        public String toString() {
            return "struct " + tag + " /* incomplete */";
        }
    }

    public static final class IncompleteUnion extends Type {
        private final String tag;

        public IncompleteUnion(@NotNull String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIncompleteUnion(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag};
        }

        @Override
        public String toString() {
            return "union " + tag + " /* incomplete */";
        }
    }

    /**
     * An array of unbounded size, used to model memory.
     */
    public static final class InfiniteArray extends Type {
        private final Type elementType;

        public InfiniteArray(@NotNull Type elementType) {
            this.elementType = elementType;
        }

        public Type getElementType() {
            return elementType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInfiniteArray(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elementType};
        }

        @Override
        public String toString() {
            return elementType + "[__CPROVER_infinity()]";
        }
    }

    public static final class Pointer extends Type {
        private final Type pointee;

        public Pointer(@NotNull Type pointee) {
            this.pointee = pointee;
        }

        public Type getPointee() {
            return pointee;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPointer(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{pointee};
        }

        @Override
        public String toString() {
            return pointee + "*";
        }
    }

    public static final class Signedbv extends Type {
        private final int width;

        public Signedbv(int width) {
            this.width = checkWidth(width);
        }

        public int getWidth() {
            return width;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSignedbv(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{width};
        }

        @Override
        public String toString() {
            return "i" + width;
        }
    }

    /**
     * The definition of a struct. Only ever the type of the symbol named
     * {@link #aggregateTag(String) tag-<i>tag</i>}.
     */
    public static final class Struct extends Type {
        private final String tag;
        private final List<DatatypeComponent> components;

        public Struct(@NotNull String tag, @NotNull List<DatatypeComponent> components) {
            this.tag = tag;
            this.components = listOf(components);
        }

        public String getTag() {
            return tag;
        }

        public List<DatatypeComponent> getComponents() {
            return components;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStruct(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag, components};
        }

        @Override
        public String toString() {
            return "struct " + tag + " " + components;
        }
    }

    /**
     * A reference to a struct by its tag.
     */
    public static final class StructTag extends Type {
        private final String tag;

        public StructTag(@NotNull String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        /**
         * Get the name of the symbol that defines the referenced struct.
         *
         * @return The symbol name.
         */
        public String getIdentifier() {
            return aggregateTag(tag);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStructTag(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag};
        }

        @Override
        public String toString() {
            return "struct " + tag;
        }
    }

    /**
     * A named alias of another type. Typedefs do not nest.
     */
    public static final class TypeDef extends Type {
        private final String name;
        private final Type type;

        public TypeDef(@NotNull String name, @NotNull Type type) {
            if (type instanceof TypeDef) {
                throw new IllegalArgumentException("typedef " + name + " of typedef " + ((TypeDef) type).name);
            }
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public Type getType() {
            return type;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeDef(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{name, type};
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Union extends Type {
        private final String tag;
        private final List<DatatypeComponent> components;

        public Union(@NotNull String tag, @NotNull List<DatatypeComponent> components) {
            this.tag = tag;
            this.components = listOf(components);
        }

        public String getTag() {
            return tag;
        }

        public List<DatatypeComponent> getComponents() {
            return components;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnion(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag, components};
        }

        @Override
        public String toString() {
            return "union " + tag + " " + components;
        }
    }

    public static final class UnionTag extends Type {
        private final String tag;

        public UnionTag(@NotNull String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        public String getIdentifier() {
            return aggregateTag(tag);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnionTag(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{tag};
        }

        @Override
        public String toString() {
            return "union " + tag;
        }
    }

    public static final class Unsignedbv extends Type {
        private final int width;

        public Unsignedbv(int width) {
            this.width = checkWidth(width);
        }

        public int getWidth() {
            return width;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnsignedbv(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{width};
        }

        @Override
        public String toString() {
            return "u" + width;
        }
    }

    /**
     * A SIMD vector.
     */
    public static final class Vector extends Type {
        private final Type elementType;
        private final long size;

        public Vector(@NotNull Type elementType, long size) {
            if (size < 0) throw new IllegalArgumentException("negative vector size " + size);
            this.elementType = elementType;
            this.size = size;
        }

        public Type getElementType() {
            return elementType;
        }

        public long getSize() {
            return size;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVector(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{elementType, size};
        }

        @Override
        public String toString() {
            return "vector(" + elementType + ", " + size + ")";
        }
    }

    static <T> List<T> listOf(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
