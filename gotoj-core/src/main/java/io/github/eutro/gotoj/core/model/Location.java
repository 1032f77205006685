package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;

/**
 * Where a symbol, expression or statement came from.
 * <p>
 * Lines and columns are 1-based. Locations are immutable.
 */
public abstract class Location {
    /**
     * The file prefix the verifier uses for {@link Builtin} locations.
     */
    public static final String BUILTIN_PREFIX = "<builtin-library-";

    /**
     * The unknown location.
     */
    public static final Location NONE = new None();

    Location() {
    }

    public static Location builtin(@NotNull String name) {
        return new Builtin(name, null);
    }

    public static Location builtin(@NotNull String name, int line) {
        return new Builtin(name, line);
    }

    public static Location source(@NotNull String file, @Nullable String function, int line, @Nullable Integer column) {
        return new Source(file, function, line, column);
    }

    /**
     * A location that a verification property is checked at.
     *
     * @param at            The source location of the check.
     * @param propertyClass The class of property, such as {@code "assertion"}.
     * @param comment       A description of the property.
     * @return The location.
     */
    public static Location property(@NotNull Source at, @NotNull String propertyClass, @NotNull String comment) {
        return new Property(at.file, at.function, at.line, at.column, propertyClass, comment);
    }

    public boolean isNone() {
        return this == NONE;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    abstract Object[] parts();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(parts(), ((Location) o).parts());
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getSimpleName().hashCode() + Arrays.hashCode(parts());
    }

    private static void checkPositive(String what, @Nullable Integer n) {
        if (n != null && n < 1) throw new IllegalArgumentException(what + " must be at least 1, got " + n);
    }

    private static void checkNotBuiltin(String file) {
        if (file.startsWith(BUILTIN_PREFIX)) {
            throw new IllegalArgumentException("source file may not be named like a builtin: " + file);
        }
    }

    public interface Visitor<R> {
        R visitNone(None loc);

        R visitBuiltin(Builtin loc);

        R visitSource(Source loc);

        R visitProperty(Property loc);
    }

    public static final class None extends Location {
        private None() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNone(this);
        }

        @Override
        Object[] parts() {
            return new Object[0];
        }

        @Override
        public String toString() {
            return "<none>";
        }
    }

    /**
     * A location in code injected by the compiler, which has no position in the source.
     */
    public static final class Builtin extends Location {
        private final String name;
        @Nullable
        private final Integer line;

        Builtin(@NotNull String name, @Nullable Integer line) {
            checkPositive("line", line);
            this.name = name;
            this.line = line;
        }

        public String getName() {
            return name;
        }

        public @Nullable Integer getLine() {
            return line;
        }

        public String getFile() {
            return BUILTIN_PREFIX + name + ">";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBuiltin(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{name, line};
        }

        @Override
        public String toString() {
            return getFile() + (line == null ? "" : ":" + line);
        }
    }

    public static final class Source extends Location {
        final String file;
        @Nullable
        final String function;
        final int line;
        @Nullable
        final Integer column;

        Source(@NotNull String file, @Nullable String function, int line, @Nullable Integer column) {
            checkNotBuiltin(file);
            checkPositive("line", line);
            checkPositive("column", column);
            this.file = file;
            this.function = function;
            this.line = line;
            this.column = column;
        }

        public String getFile() {
            return file;
        }

        public @Nullable String getFunction() {
            return function;
        }

        public int getLine() {
            return line;
        }

        public @Nullable Integer getColumn() {
            return column;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSource(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{file, function, line, column};
        }

        @Override
        public String toString() {
            return file + ":" + line + (column == null ? "" : ":" + column)
                    + (function == null ? "" : " in " + function);
        }
    }

    public static final class Property extends Location {
        private final String file;
        @Nullable
        private final String function;
        private final int line;
        @Nullable
        private final Integer column;
        private final String propertyClass;
        private final String comment;

        Property(@NotNull String file, @Nullable String function, int line, @Nullable Integer column,
                 @NotNull String propertyClass, @NotNull String comment) {
            checkNotBuiltin(file);
            checkPositive("line", line);
            checkPositive("column", column);
            this.file = file;
            this.function = function;
            this.line = line;
            this.column = column;
            this.propertyClass = propertyClass;
            this.comment = comment;
        }

        public String getFile() {
            return file;
        }

        public @Nullable String getFunction() {
            return function;
        }

        public int getLine() {
            return line;
        }

        public @Nullable Integer getColumn() {
            return column;
        }

        public String getPropertyClass() {
            return propertyClass;
        }

        public String getComment() {
            return comment;
        }

        /**
         * Get the source location of this property, without the property itself.
         *
         * @return The source location.
         */
        public Source toSource() {
            return new Source(file, function, line, column);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProperty(this);
        }

        @Override
        Object[] parts() {
            return new Object[]{file, function, line, column, propertyClass, comment};
        }

        @Override
        public String toString() {
            return toSource() + " [" + propertyClass + "] " + comment;
        }
    }
}
