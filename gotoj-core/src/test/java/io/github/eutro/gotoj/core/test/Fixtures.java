package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.model.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

public class Fixtures {
    public static final String FILE = "main.c";

    public static Location.Source loc(int line) {
        return (Location.Source) Location.source(FILE, "main", line, null);
    }

    public static Location.Source loc(int line, int column) {
        return (Location.Source) Location.source(FILE, "main", line, column);
    }

    public static Type voidFn() {
        return Type.code(Collections.<Parameter>emptyList(), Type.empty());
    }

    public static Type intFn() {
        return Type.code(Collections.<Parameter>emptyList(), Type.cInt());
    }

    /**
     * {@code void main() { assert(false); }}, with the assertion at line 3.
     */
    public static SymbolTable mainWithAssertFalse() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Location assertLoc = Location.property(loc(3), "assertion", "assertion false");
        Stmt body = Stmt.block(Collections.singletonList(
                Stmt.assertion(Expr.boolConstant(false), assertLoc)
        ), loc(2));
        table.insert(Symbol.function("main", voidFn(), body, loc(1)));
        return table;
    }

    /**
     * {@code int main() { int x = __VERIFIER_nondet_int(); return x; }}
     */
    public static SymbolTable nondetProgram() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        table.insert(Symbol.function("__VERIFIER_nondet_int", intFn(), null, Location.builtin("nondet")));
        Expr x = Expr.symbol("main::1::x", Type.cInt());
        Expr call = Expr.symbol("__VERIFIER_nondet_int", intFn()).call();
        Stmt body = Stmt.block(Arrays.asList(
                Stmt.decl(x.withLocation(loc(2)), call.withLocation(loc(2)), loc(2)),
                Stmt.returnStmt(x, loc(3))
        ), loc(1));
        table.insert(Symbol.variable("main::1::x", "x", Type.cInt(), loc(2)));
        table.insert(Symbol.function("main", intFn(), body, loc(1)));
        return table;
    }

    /**
     * A table using a broad selection of types, expressions and statements.
     */
    public static SymbolTable richTable() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);

        Type.Struct point = new Type.Struct("point", Arrays.asList(
                DatatypeComponent.field("x", Type.cInt()),
                DatatypeComponent.padding("$pad0", 32),
                DatatypeComponent.field("next", Type.structTag("point").toPointer())
        ));
        Type.Union number = new Type.Union("number", Arrays.asList(
                DatatypeComponent.field("i", Type.signedInt(64)),
                DatatypeComponent.field("d", Type.doubleType())
        ));
        table.insert(Symbol.aggregate(point, loc(1)));
        table.insert(Symbol.aggregate(number, loc(5)));
        table.insert(Symbol.aggregate(new Type.IncompleteStruct("opaque"), Location.NONE));

        Type pointTag = Type.structTag("point");
        Type bytes = Type.unsignedInt(8).arrayOf(16);
        table.insert(Symbol.staticVariable("buffer", "buffer", bytes,
                Expr.arrayExpr(Collections.nCopies(16, Expr.intConstant(0xff, Type.unsignedInt(8))), bytes),
                loc(9)));
        table.insert(Symbol.staticVariable("big", "big", Type.unsignedInt(128),
                Expr.intConstant(BigInteger.ONE.shiftLeft(100), Type.unsignedInt(128)), loc(10)));
        table.insert(Symbol.staticVariable("greeting", "greeting", Type.cChar().toPointer(),
                Expr.stringConstant("héllo\\0").address().cast(Type.cChar().toPointer()), loc(11)));
        table.insert(Symbol.staticVariable("half", "half", Type.doubleType(), Expr.doubleConstant(0.5), loc(12)));
        table.insert(Symbol.staticVariable("flag", "flag", Type.cBool(), Expr.cBoolConstant(true), loc(13)));
        table.insert(Symbol.staticVariable("neg", "neg", Type.signedInt(16), Expr.intConstant(-2, Type.signedInt(16)), loc(14)));
        table.insert(Symbol.staticVariable("tail", "tail", Type.cInt().flexibleArrayOf(), null, loc(15)));
        table.insert(Symbol.staticVariable("heap", "heap", Type.unsignedInt(8).infiniteArrayOf(), null, loc(16)));
        table.insert(Symbol.staticVariable("nothing", "nothing", pointTag.toPointer(),
                Expr.nullPointer(pointTag.toPointer()), loc(17)));
        table.insert(Symbol.staticVariable("size", "size", Type.sizeT().typedef("size_t"),
                null, Location.builtin("stddef", 4)));

        Parameter p = new Parameter(pointTag.toPointer(), "walk::p", "p");
        Type walkType = Type.code(Collections.singletonList(p), Type.cInt());
        Expr pExpr = Expr.symbol("walk::p", pointTag.toPointer());
        Expr i = Expr.symbol("walk::1::i", Type.cInt());
        Stmt body = Stmt.block(Arrays.asList(
                Stmt.decl(i, Expr.intConstant(0, Type.cInt()), loc(21)),
                Stmt.whileLoop(pExpr.neq(Expr.nullPointer(pointTag.toPointer())), Stmt.block(Arrays.asList(
                        Stmt.assign(i, i.plus(pExpr.dereference().member("x", Type.cInt())), loc(23)),
                        Stmt.assign(pExpr, pExpr.dereference().member("next", pointTag.toPointer()), loc(24)),
                        Stmt.ifThenElse(i.lt(Expr.intConstant(0, Type.cInt())),
                                Stmt.breakStmt(loc(25)), null, loc(25))
                ), loc(22)), loc(22)),
                Stmt.switchStmt(i, Arrays.asList(
                        new SwitchCase(Expr.intConstant(1, Type.cInt()), Stmt.skip(loc(27))),
                        new SwitchCase(Expr.intConstant(2, Type.cInt()), Stmt.gotoLabel("out", loc(28)))
                ), Stmt.breakStmt(loc(29)), loc(26)),
                Stmt.atomicBlock(Collections.singletonList(
                        Stmt.assume(i.eq(i), loc(30))
                ), loc(30)),
                Stmt.assertion(i.lt(Expr.intConstant(100, Type.cInt())).implies(Expr.boolConstant(true)),
                        Location.property(loc(31, 5), "assertion", "i is small")),
                Stmt.returnStmt(i, loc(32)).withLabel("out"),
                Stmt.dead(i, loc(33))
        ), loc(20));
        table.insert(Symbol.function("walk", walkType, body, loc(20)));
        table.insert(Symbol.variable("walk::p", "p", pointTag.toPointer(), loc(20)).toBuilder()
                .addFlag(io.github.eutro.gotoj.core.irep.SymbolFlag.PARAMETER)
                .build());
        table.insert(Symbol.variable("walk::1::i", "i", Type.cInt(), loc(21)));
        table.insert(Symbol.function("puts", Type.variadicCode(Collections.singletonList(
                Parameter.anonymous(Type.cChar().toPointer())), Type.cInt()), null, Location.NONE)
                .toBuilder().setModule("libc").setMode(Symbol.Mode.C).build());
        return table;
    }
}
