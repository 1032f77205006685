package io.github.eutro.gotoj.core.irep;

import io.github.eutro.gotoj.core.error.MalformedTreeException;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An irep, the untyped tree that every part of a goto program is serialized as.
 * <p>
 * An irep has an {@link IrepId id}, an ordered list of unnamed children, a map of
 * named children, and a map of comments. Comments are named children whose keys
 * start with {@code #}; they are kept apart since the verifier does not consider them
 * part of a node's meaning, but they are serialized all the same.
 * <p>
 * Ireps are immutable, and own their children outright.
 */
public final class Irep {
    private static final Irep NIL = new Irep(IrepId.NIL, Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap());

    private final IrepId id;
    private final List<Irep> sub;
    private final Map<IrepId, Irep> namedSub;
    private final Map<IrepId, Irep> comments;
    private int hash;

    private Irep(IrepId id, List<Irep> sub, Map<IrepId, Irep> namedSub, Map<IrepId, Irep> comments) {
        this.id = id;
        this.sub = sub;
        this.namedSub = namedSub;
        this.comments = comments;
    }

    /**
     * Start building an irep with the given id.
     *
     * @param id The id.
     * @return The builder.
     */
    @Contract(pure = true)
    public static Builder builder(@NotNull IrepId id) {
        return new Builder(id);
    }

    public static Irep nil() {
        return NIL;
    }

    public static Irep just(@NotNull IrepId id) {
        return id == IrepId.NIL ? NIL : builder(id).build();
    }

    public static Irep justString(@NotNull String text) {
        return just(IrepId.intern(text));
    }

    public static Irep justInt(long value) {
        return just(IrepId.fromInt(value));
    }

    public static Irep one() {
        return just(IrepId.ID1);
    }

    public static Irep zero() {
        return just(IrepId.ID0);
    }

    /**
     * Create an irep with an empty id and the given unnamed children.
     *
     * @param sub The children.
     * @return The irep.
     */
    public static Irep justSub(@NotNull List<Irep> sub) {
        return builder(IrepId.EMPTY_STRING).subs(sub).build();
    }

    public @NotNull IrepId id() {
        return id;
    }

    public @NotNull List<Irep> sub() {
        return sub;
    }

    public @NotNull Map<IrepId, Irep> namedSub() {
        return namedSub;
    }

    public @NotNull Map<IrepId, Irep> comments() {
        return comments;
    }

    public boolean isNil() {
        return id == IrepId.NIL;
    }

    /**
     * Get whether this irep has no children of any kind.
     *
     * @return Whether this is a leaf.
     */
    public boolean isLeaf() {
        return sub.isEmpty() && namedSub.isEmpty() && comments.isEmpty();
    }

    /**
     * Look up a named child or comment.
     *
     * @param key The key.
     * @return The child, or null if absent.
     */
    public @Nullable Irep get(@NotNull IrepId key) {
        return key.isComment() ? comments.get(key) : namedSub.get(key);
    }

    /**
     * Look up a named child or comment that must be present.
     *
     * @param key The key.
     * @return The child.
     * @throws MalformedTreeException If it is absent.
     */
    public @NotNull Irep require(@NotNull IrepId key) {
        Irep irep = get(key);
        if (irep == null) {
            throw new MalformedTreeException("missing named child '" + key + "' in '" + id + "' node");
        }
        return irep;
    }

    /**
     * Get an unnamed child which must be present.
     *
     * @param i The index.
     * @return The child.
     * @throws MalformedTreeException If there is no such child.
     */
    public @NotNull Irep sub(int i) {
        if (i >= sub.size()) {
            throw new MalformedTreeException("expected at least " + (i + 1) + " children in '" + id
                    + "' node, got " + sub.size());
        }
        return sub.get(i);
    }

    /**
     * Check that this irep has exactly {@code n} unnamed children.
     *
     * @param n The arity.
     * @return This.
     * @throws MalformedTreeException If it does not.
     */
    public Irep expectArity(int n) {
        if (sub.size() != n) {
            throw new MalformedTreeException("expected " + n + " children in '" + id + "' node, got " + sub.size());
        }
        return this;
    }

    /**
     * Get a copy of this irep with the given named child or comment replaced.
     *
     * @param key   The key.
     * @param value The new child.
     * @return The new irep.
     */
    @Contract(pure = true)
    public Irep with(@NotNull IrepId key, @NotNull Irep value) {
        return toBuilder().named(key, value).build();
    }

    /**
     * Get a copy of this irep without the given named child or comment.
     *
     * @param key The key.
     * @return The new irep.
     */
    @Contract(pure = true)
    public Irep without(@NotNull IrepId key) {
        if (get(key) == null) return this;
        Builder b = toBuilder();
        (key.isComment() ? b.comments : b.namedSub).remove(key);
        return b.build();
    }

    /**
     * Get a builder pre-populated with the contents of this irep.
     *
     * @return The builder.
     */
    public Builder toBuilder() {
        Builder b = builder(id).subs(sub);
        b.namedSub.putAll(namedSub);
        b.comments.putAll(comments);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Irep)) return false;
        Irep irep = (Irep) o;
        return id == irep.id
                && hashCode() == irep.hashCode()
                && sub.equals(irep.sub)
                && namedSub.equals(irep.namedSub)
                && comments.equals(irep.comments);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(id.text(), sub, namedSub, comments);
            if (h == 0) h = 1;
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    private void print(StringBuilder sb, int indent) {
        sb.append(id.text().isEmpty() ? "\"\"" : id.text());
        if (isLeaf()) return;
        sb.append(" {");
        for (Irep irep : sub) {
            newline(sb, indent + 1);
            sb.append("* ");
            irep.print(sb, indent + 1);
        }
        printNamed(sb, indent, namedSub);
        printNamed(sb, indent, comments);
        newline(sb, indent);
        sb.append('}');
    }

    private static void printNamed(StringBuilder sb, int indent, Map<IrepId, Irep> map) {
        for (Map.Entry<IrepId, Irep> entry : map.entrySet()) {
            newline(sb, indent + 1);
            sb.append(entry.getKey()).append(": ");
            entry.getValue().print(sb, indent + 1);
        }
    }

    private static void newline(StringBuilder sb, int indent) {
        sb.append('\n');
        for (int i = 0; i < indent; i++) sb.append("  ");
    }

    /**
     * A builder for {@link Irep}s.
     */
    public static class Builder {
        private final IrepId id;
        private final List<Irep> sub = new ArrayList<>();
        private final Map<IrepId, Irep> namedSub = new LinkedHashMap<>();
        private final Map<IrepId, Irep> comments = new LinkedHashMap<>();

        private Builder(IrepId id) {
            this.id = id;
        }

        public Builder sub(@NotNull Irep irep) {
            sub.add(irep);
            return this;
        }

        public Builder subs(@NotNull Collection<Irep> ireps) {
            sub.addAll(ireps);
            return this;
        }

        /**
         * Add a named child, or a comment if the key is a comment key.
         *
         * @param key   The key.
         * @param value The child.
         * @return This.
         */
        public Builder named(@NotNull IrepId key, @NotNull Irep value) {
            (key.isComment() ? comments : namedSub).put(key, value);
            return this;
        }

        public Builder named(@NotNull IrepId key, @NotNull IrepId value) {
            return named(key, just(value));
        }

        public Builder namedInt(@NotNull IrepId key, long value) {
            return named(key, justInt(value));
        }

        /**
         * Add a named child, unless it is null.
         *
         * @param key   The key.
         * @param value The child, or null.
         * @return This.
         */
        public Builder namedOpt(@NotNull IrepId key, @Nullable Irep value) {
            if (value != null) named(key, value);
            return this;
        }

        /**
         * Add a {@code 1} flag if {@code flag} is set.
         *
         * @param key  The key.
         * @param flag The flag.
         * @return This.
         */
        public Builder flag(@NotNull IrepId key, boolean flag) {
            if (flag) named(key, one());
            return this;
        }

        public Irep build() {
            if (id == IrepId.NIL && sub.isEmpty() && namedSub.isEmpty() && comments.isEmpty()) return NIL;
            return new Irep(
                    id,
                    sub.isEmpty() ? Collections.<Irep>emptyList() : Collections.unmodifiableList(new ArrayList<>(sub)),
                    namedSub.isEmpty() ? Collections.<IrepId, Irep>emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(namedSub)),
                    comments.isEmpty() ? Collections.<IrepId, Irep>emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(comments))
            );
        }
    }
}
