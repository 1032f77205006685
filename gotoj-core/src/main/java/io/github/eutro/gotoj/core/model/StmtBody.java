package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * What a {@link Stmt} does, independent of its location.
 * <p>
 * The subclasses of this class are a closed set, enumerated by {@link Visitor}.
 */
public abstract class StmtBody {
    private static final Object[] NO_PARTS = new Object[0];

    StmtBody() {
    }

    public abstract <R> R accept(Visitor<R> visitor, Stmt stmt);

    abstract Object[] parts();

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(parts(), ((StmtBody) o).parts());
    }

    @Override
    public final int hashCode() {
        return 31 * getClass().getSimpleName().hashCode() + Arrays.hashCode(parts());
    }

    /**
     * A visitor over every kind of statement.
     *
     * @param <R> The result of visiting.
     */
    public interface Visitor<R> {
        R visitAssign(Stmt stmt, Assign body);

        R visitAssert(Stmt stmt, Assert body);

        R visitAssume(Stmt stmt, Assume body);

        R visitAtomicBlock(Stmt stmt, AtomicBlock body);

        R visitBlock(Stmt stmt, Block body);

        R visitBreak(Stmt stmt, Break body);

        R visitContinue(Stmt stmt, Continue body);

        R visitDead(Stmt stmt, Dead body);

        R visitDecl(Stmt stmt, Decl body);

        R visitExpression(Stmt stmt, Expression body);

        R visitFor(Stmt stmt, For body);

        R visitFunctionCall(Stmt stmt, FunctionCall body);

        R visitGoto(Stmt stmt, Goto body);

        R visitIfThenElse(Stmt stmt, IfThenElse body);

        R visitLabel(Stmt stmt, Label body);

        R visitReturn(Stmt stmt, Return body);

        R visitSkip(Stmt stmt, Skip body);

        R visitSwitch(Stmt stmt, Switch body);

        R visitWhile(Stmt stmt, While body);
    }

    public static final class Assign extends StmtBody {
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
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitAssign(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{lhs, rhs};
        }

        @Override
        public String toString() {
            return lhs + " = " + rhs + ";";
        }
    }

    /**
     * A property to check. The statement's location is normally a {@link Location.Property}.
     */
    public static final class Assert extends StmtBody {
        private final Expr condition;

        public Assert(@NotNull Expr condition) {
            this.condition = condition;
        }

        public Expr getCondition() {
            return condition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitAssert(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{condition};
        }

        @Override
        public String toString() {
            return "assert(" + condition + ");";
        }
    }

    public static final class Assume extends StmtBody {
        private final Expr condition;

        public Assume(@NotNull Expr condition) {
            this.condition = condition;
        }

        public Expr getCondition() {
            return condition;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitAssume(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{condition};
        }

        @Override
        public String toString() {
            return "__CPROVER_assume(" + condition + ");";
        }
    }

    /**
     * A block executed without interleaving with other threads.
     */
    public static final class AtomicBlock extends StmtBody {
        private final List<Stmt> statements;

        public AtomicBlock(@NotNull List<Stmt> statements) {
            this.statements = Type.listOf(statements);
        }

        public List<Stmt> getStatements() {
            return statements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitAtomicBlock(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{statements};
        }

        @Override
        public String toString() {
            return "atomic { " + statements.size() + " statements }";
        }
    }

    public static final class Block extends StmtBody {
        private final List<Stmt> statements;

        public Block(@NotNull List<Stmt> statements) {
            this.statements = Type.listOf(statements);
        }

        public List<Stmt> getStatements() {
            return statements;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitBlock(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{statements};
        }

        @Override
        public String toString() {
            return "{ " + statements.size() + " statements }";
        }
    }

    public static final class Break extends StmtBody {
        public Break() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitBreak(stmt, this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "break;";
        }
    }

    public static final class Continue extends StmtBody {
        public Continue() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitContinue(stmt, this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return "continue;";
        }
    }

    /**
     * Marks the end of the lifetime of a local variable.
     */
    public static final class Dead extends StmtBody {
        private final Expr symbol;

        public Dead(@NotNull Expr symbol) {
            this.symbol = symbol;
        }

        public Expr getSymbol() {
            return symbol;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitDead(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{symbol};
        }

        @Override
        public String toString() {
            return "dead " + symbol + ";";
        }
    }

    public static final class Decl extends StmtBody {
        private final Expr lhs;
        @Nullable
        private final Expr value;

        public Decl(@NotNull Expr lhs, @Nullable Expr value) {
            this.lhs = lhs;
            this.value = value;
        }

        public Expr getLhs() {
            return lhs;
        }

        public @Nullable Expr getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitDecl(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{lhs, value};
        }

        @Override
        public String toString() {
            return lhs.getType() + " " + lhs + (value == null ? "" : " = " + value) + ";";
        }
    }

    /**
     * An expression evaluated for its side effects.
     */
    public static final class Expression extends StmtBody {
        private final Expr expr;

        public Expression(@NotNull Expr expr) {
            this.expr = expr;
        }

        public Expr getExpr() {
            return expr;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitExpression(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{expr};
        }

        @Override
        public String toString() {
            return expr + ";";
        }
    }

    public static final class For extends StmtBody {
        private final Stmt init;
        private final Expr condition;
        private final Stmt update;
        private final Stmt body;

        public For(@NotNull Stmt init, @NotNull Expr condition, @NotNull Stmt update, @NotNull Stmt body) {
            this.init = init;
            this.condition = condition;
            this.update = update;
            this.body = body;
        }

        public Stmt getInit() {
            return init;
        }

        public Expr getCondition() {
            return condition;
        }

        public Stmt getUpdate() {
            return update;
        }

        public Stmt getBody() {
            return body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitFor(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{init, condition, update, body};
        }

        @Override
        public String toString() {
            return "for (" + init + " " + condition + "; " + update + ") " + body;
        }
    }

    /**
     * A call whose result, if {@code lhs} is present, is assigned to {@code lhs}.
     */
    public static final class FunctionCall extends StmtBody {
        @Nullable
        private final Expr lhs;
        private final Expr function;
        private final List<Expr> arguments;

        public FunctionCall(@Nullable Expr lhs, @NotNull Expr function, @NotNull List<Expr> arguments) {
            this.lhs = lhs;
            this.function = function;
            this.arguments = Type.listOf(arguments);
        }

        public @Nullable Expr getLhs() {
            return lhs;
        }

        public Expr getFunction() {
            return function;
        }

        public List<Expr> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitFunctionCall(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{lhs, function, arguments};
        }

        @Override
        public String toString() {
            return (lhs == null ? "" : lhs + " = ") + function + "(" + arguments.size() + " arguments);";
        }
    }

    public static final class Goto extends StmtBody {
        private final String label;

        public Goto(@NotNull String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitGoto(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{label};
        }

        @Override
        public String toString() {
            return "goto " + label + ";";
        }
    }

    public static final class IfThenElse extends StmtBody {
        private final Expr condition;
        private final Stmt then;
        @Nullable
        private final Stmt otherwise;

        public IfThenElse(@NotNull Expr condition, @NotNull Stmt then, @Nullable Stmt otherwise) {
            this.condition = condition;
            this.then = then;
            this.otherwise = otherwise;
        }

        public Expr getCondition() {
            return condition;
        }

        public Stmt getThen() {
            return then;
        }

        public @Nullable Stmt getOtherwise() {
            return otherwise;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitIfThenElse(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{condition, then, otherwise};
        }

        @Override
        public String toString() {
            return "if (" + condition + ") " + then + (otherwise == null ? "" : " else " + otherwise);
        }
    }

    public static final class Label extends StmtBody {
        private final String label;
        private final Stmt body;

        public Label(@NotNull String label, @NotNull Stmt body) {
            this.label = label;
            this.body = body;
        }

        public String getLabel() {
            return label;
        }

        public Stmt getBody() {
            return body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitLabel(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{label, body};
        }

        @Override
        public String toString() {
            return label + ": " + body;
        }
    }

    public static final class Return extends StmtBody {
        @Nullable
        private final Expr value;

        public Return(@Nullable Expr value) {
            this.value = value;
        }

        public @Nullable Expr getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitReturn(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{value};
        }

        @Override
        public String toString() {
            return value == null ? "return;" : "return " + value + ";";
        }
    }

    public static final class Skip extends StmtBody {
        public Skip() {
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitSkip(stmt, this);
        }

        @Override
        Object[] parts() {
            return NO_PARTS;
        }

        @Override
        public String toString() {
            return ";";
        }
    }

    public static final class Switch extends StmtBody {
        private final Expr control;
        private final List<SwitchCase> cases;
        @Nullable
        private final Stmt defaultCase;

        public Switch(@NotNull Expr control, @NotNull List<SwitchCase> cases, @Nullable Stmt defaultCase) {
            this.control = control;
            this.cases = Type.listOf(cases);
            this.defaultCase = defaultCase;
        }

        public Expr getControl() {
            return control;
        }

        public List<SwitchCase> getCases() {
            return cases;
        }

        public @Nullable Stmt getDefaultCase() {
            return defaultCase;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitSwitch(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{control, cases, defaultCase};
        }

        @Override
        public String toString() {
            return "switch (" + control + ") { " + cases.size() + " cases }";
        }
    }

    public static final class While extends StmtBody {
        private final Expr condition;
        private final Stmt body;

        public While(@NotNull Expr condition, @NotNull Stmt body) {
            this.condition = condition;
            this.body = body;
        }

        public Expr getCondition() {
            return condition;
        }

        public Stmt getBody() {
            return body;
        }

        @Override
        public <R> R accept(Visitor<R> visitor, Stmt stmt) {
            return visitor.visitWhile(stmt, this);
        }

        @Override
        Object[] parts() {
            return new Object[]{condition, body};
        }

        @Override
        public String toString() {
            return "while (" + condition + ") " + body;
        }
    }
}
