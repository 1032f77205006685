package io.github.eutro.gotoj.core.passes.form;

import io.github.eutro.gotoj.core.error.UnsupportedNodeException;
import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.Transformer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Renames every symbol to a name made only of letters, digits, {@code _} and {@code $},
 * which does not start with a digit, keeping names unique. Names that are already clean are kept.
 * <p>
 * Scope separators ({@code ::}) become {@code _}, and the {@code tag-} prefix of aggregate
 * definitions is kept, along with the tags that refer to them. The renaming of symbols is recorded in
 * {@link CommonExts#RENAMED}.
 * <p>
 * Base and pretty names of symbols and parameters are cleaned too. Aggregate components share one
 * renaming with the member and union expressions that name them, and labels share one with the
 * gotos that jump to them.
 * <p>
 * This pass must run last: it fails with {@link UnsupportedNodeException} if any call to a
 * {@link NondetIntrinsics nondeterminism intrinsic} remains.
 */
public class NameCleanup implements IRPass<SymbolTable, SymbolTable> {
    /**
     * An instance of this pass using the {@link NondetIntrinsics#DEFAULT default intrinsics}.
     */
    public static final NameCleanup INSTANCE = new NameCleanup(NondetIntrinsics.DEFAULT);

    private final NondetIntrinsics intrinsics;

    public NameCleanup(@NotNull NondetIntrinsics intrinsics) {
        this.intrinsics = intrinsics;
    }

    @Override
    public SymbolTable run(SymbolTable table) {
        Map<String, String> renames = computeRenames(table.names());
        Set<String> fields = new LinkedHashSet<>();
        for (Symbol symbol : table.symbols()) {
            collectFields(symbol.getType(), fields);
        }
        SymbolTable out = new Renamer(table, renames, computeRenames(fields)).transform();
        Map<String, String> changed = new TreeMap<>();
        for (Map.Entry<String, String> entry : renames.entrySet()) {
            if (!entry.getKey().equals(entry.getValue())) changed.put(entry.getKey(), entry.getValue());
        }
        out.attachExt(CommonExts.RENAMED, Collections.unmodifiableMap(changed));
        return out;
    }

    private static void collectFields(Type type, Set<String> fields) {
        List<DatatypeComponent> components;
        if (type instanceof Type.Struct) {
            components = ((Type.Struct) type).getComponents();
        } else if (type instanceof Type.Union) {
            components = ((Type.Union) type).getComponents();
        } else {
            return;
        }
        for (DatatypeComponent component : components) {
            fields.add(component.getName());
            collectFields(component.getType(), fields);
        }
    }

    /**
     * Compute a clean name for each of the given names. Clean names map to themselves,
     * and others get the first free name derived from their {@link #clean(String) cleaned} form.
     *
     * @param names The names.
     * @return The renaming, from old to new.
     */
    static Map<String, String> computeRenames(Collection<String> names) {
        Map<String, String> renames = new TreeMap<>();
        Set<String> taken = new HashSet<>();
        for (String name : names) {
            if (clean(name).equals(name)) {
                renames.put(name, name);
                taken.add(name);
            }
        }
        for (String name : names) {
            if (renames.containsKey(name)) continue;
            String base = clean(name);
            String candidate = base;
            for (int i = 1; taken.contains(candidate); i++) {
                candidate = base + "_" + i;
            }
            renames.put(name, candidate);
            taken.add(candidate);
        }
        return renames;
    }

    /**
     * Clean a name, without regard to collisions.
     *
     * @param name The name.
     * @return The clean name.
     */
    public static String clean(@NotNull String name) {
        if (name.startsWith(Type.TAG_PREFIX)) {
            return Type.TAG_PREFIX + clean(name.substring(Type.TAG_PREFIX.length()));
        }
        String flat = name.replace("::", "_");
        StringBuilder sb = new StringBuilder(flat.length() + 1);
        for (int i = 0; i < flat.length(); i++) {
            char c = flat.charAt(i);
            boolean ok = c < 128 && (Character.isLetterOrDigit(c) || c == '_' || c == '$');
            sb.append(ok ? c : '_');
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) sb.insert(0, '_');
        return sb.toString();
    }

    private static String fresh(String name, Map<String, String> mapped, Set<String> taken) {
        String renamed = mapped.get(name);
        if (renamed != null) return renamed;
        String base = clean(name);
        String candidate = base;
        for (int i = 1; taken.contains(candidate); i++) {
            candidate = base + "_" + i;
        }
        mapped.put(name, candidate);
        taken.add(candidate);
        return candidate;
    }

    private class Renamer extends Transformer {
        private final Map<String, String> renames;
        private final Map<String, String> fields;
        private final Set<String> takenFields;
        private final Map<String, String> labels = new HashMap<>();
        private final Set<String> takenLabels = new HashSet<>();

        Renamer(SymbolTable table, Map<String, String> renames, Map<String, String> fields) {
            super(table);
            this.renames = renames;
            this.fields = new HashMap<>(fields);
            this.takenFields = new HashSet<>(fields.values());
        }

        private String rename(String name) {
            String renamed = renames.get(name);
            return renamed == null ? name : renamed;
        }

        private String renameField(String field) {
            return fresh(field, fields, takenFields);
        }

        private String renameLabel(String label) {
            return fresh(label, labels, takenLabels);
        }

        private String cleanOpt(@Nullable String name) {
            return name == null ? null : clean(name);
        }

        private String renameTag(String tag) {
            return rename(Type.aggregateTag(tag)).substring(Type.TAG_PREFIX.length());
        }

        @Override
        protected @Nullable Symbol transformSymbol(@NotNull Symbol symbol) {
            Symbol transformed = super.transformSymbol(symbol);
            if (transformed == null) return null;
            String pretty = transformed.getPrettyName();
            return transformed.toBuilder()
                    .setName(rename(symbol.getName()))
                    .setBaseName(cleanOpt(transformed.getBaseName()))
                    .setPrettyName(pretty == null ? null : renames.containsKey(pretty) ? rename(pretty) : clean(pretty))
                    .build();
        }

        @Override
        protected Parameter transformParameter(Parameter parameter) {
            Parameter p = super.transformParameter(parameter);
            String identifier = p.getIdentifier();
            return new Parameter(p.getType(),
                    identifier == null ? null : rename(identifier),
                    cleanOpt(p.getBaseName()));
        }

        @Override
        protected List<DatatypeComponent> transformComponents(List<DatatypeComponent> components) {
            List<DatatypeComponent> result = new ArrayList<>(components.size());
            for (DatatypeComponent component : components) {
                result.add(DatatypeComponent.of(
                        renameField(component.getName()),
                        transformType(component.getType()),
                        component.isPadding()));
            }
            return result;
        }

        @Override
        public Expr visitMember(Expr expr, ExprValue.Member value) {
            return rebuild(expr, new ExprValue.Member(transformExpr(value.getLhs()), renameField(value.getField())));
        }

        @Override
        public Expr visitUnion(Expr expr, ExprValue.Union value) {
            return rebuild(expr, new ExprValue.Union(renameField(value.getField()), transformExpr(value.getValue())));
        }

        @Override
        public Stmt visitGoto(Stmt stmt, StmtBody.Goto body) {
            return rebuild(stmt, new StmtBody.Goto(renameLabel(body.getLabel())));
        }

        @Override
        public Stmt visitLabel(Stmt stmt, StmtBody.Label body) {
            return rebuild(stmt, new StmtBody.Label(renameLabel(body.getLabel()), transformStmt(body.getBody())));
        }

        @Override
        public Type visitStruct(Type.Struct t) {
            return new Type.Struct(renameTag(t.getTag()), transformComponents(t.getComponents()));
        }

        @Override
        public Type visitUnion(Type.Union t) {
            return new Type.Union(renameTag(t.getTag()), transformComponents(t.getComponents()));
        }

        @Override
        public Type visitIncompleteStruct(Type.IncompleteStruct t) {
            return new Type.IncompleteStruct(renameTag(t.getTag()));
        }

        @Override
        public Type visitIncompleteUnion(Type.IncompleteUnion t) {
            return new Type.IncompleteUnion(renameTag(t.getTag()));
        }

        @Override
        public Type visitStructTag(Type.StructTag t) {
            return new Type.StructTag(renameTag(t.getTag()));
        }

        @Override
        public Type visitUnionTag(Type.UnionTag t) {
            return new Type.UnionTag(renameTag(t.getTag()));
        }

        @Override
        public Expr visitSymbolRef(Expr expr, ExprValue.SymbolRef value) {
            return rebuild(expr, new ExprValue.SymbolRef(rename(value.getIdentifier())));
        }

        @Override
        public Expr visitFunctionCall(Expr expr, ExprValue.FunctionCall value) {
            checkNotIntrinsic(value.getFunction());
            return super.visitFunctionCall(expr, value);
        }

        @Override
        public Stmt visitFunctionCall(Stmt stmt, StmtBody.FunctionCall body) {
            checkNotIntrinsic(body.getFunction());
            return super.visitFunctionCall(stmt, body);
        }

        private void checkNotIntrinsic(Expr function) {
            String intrinsic = intrinsics.intrinsicCalled(function);
            if (intrinsic != null) {
                throw new UnsupportedNodeException("call to nondeterminism intrinsic " + intrinsic
                        + " was not substituted before name cleanup");
            }
        }
    }
}
