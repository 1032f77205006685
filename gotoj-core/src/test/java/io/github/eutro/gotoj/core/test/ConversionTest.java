package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.error.EncodingWidthException;
import io.github.eutro.gotoj.core.error.GotoException;
import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.error.UnknownTagException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.convert.FromIrep;
import io.github.eutro.gotoj.core.passes.convert.ToIrep;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.gotoj.core.test.Fixtures.loc;
import static org.junit.jupiter.api.Assertions.*;

public class ConversionTest {
    private final ToIrep to = new ToIrep(MachineModel.X86_64);
    private final FromIrep from = new FromIrep(MachineModel.X86_64);

    private void roundTrip(Type type) {
        assertEquals(type, from.type(to.type(type)), () -> "type " + type);
    }

    private void roundTrip(Expr expr) {
        assertEquals(expr, from.expr(to.expr(expr)), () -> "expr " + expr);
    }

    private void roundTrip(Stmt stmt) {
        assertEquals(stmt, from.stmt(to.stmt(stmt)), () -> "stmt " + stmt);
    }

    @Test
    void types() {
        roundTrip(Type.bool());
        roundTrip(Type.cBool());
        roundTrip(Type.cChar());
        roundTrip(Type.cInt());
        roundTrip(Type.cLongInt());
        roundTrip(Type.sizeT());
        roundTrip(Type.ssizeT());
        roundTrip(Type.signedInt(7));
        roundTrip(Type.unsignedInt(128));
        roundTrip(Type.floatType());
        roundTrip(Type.doubleType());
        roundTrip(Type.empty());
        roundTrip(Type.constructor());
        roundTrip(new Type.CBitField(Type.unsignedInt(32), 3));
        roundTrip(Type.cInt().toPointer().toPointer());
        roundTrip(Type.cInt().arrayOf(0));
        roundTrip(Type.cInt().arrayOf(10));
        roundTrip(Type.cInt().flexibleArrayOf());
        roundTrip(Type.cInt().infiniteArrayOf());
        roundTrip(new Type.Vector(Type.floatType(), 4));
        roundTrip(Fixtures.voidFn());
        roundTrip(Type.variadicCode(Arrays.asList(
                new Parameter(Type.cInt(), "f::a", "a"),
                Parameter.anonymous(Type.cChar().toPointer())
        ), Type.cInt()));
        roundTrip(new Type.Struct("s", Arrays.asList(
                DatatypeComponent.field("a", Type.cInt()),
                DatatypeComponent.padding("$pad", 32))));
        roundTrip(new Type.Union("u", Collections.singletonList(DatatypeComponent.field("b", Type.bool()))));
        roundTrip(new Type.IncompleteStruct("s"));
        roundTrip(new Type.IncompleteUnion("u"));
        roundTrip(Type.structTag("s"));
        roundTrip(Type.unionTag("u"));
        roundTrip(Type.cInt().typedef("myint"));
        roundTrip(Type.structTag("s").typedef("s_t").toPointer());
    }

    @Test
    void constants() {
        roundTrip(Expr.intConstant(0, Type.cInt()));
        roundTrip(Expr.intConstant(-1, Type.cInt()));
        roundTrip(Expr.intConstant(Integer.MIN_VALUE, Type.cInt()));
        roundTrip(Expr.intConstant(255, Type.unsignedInt(8)));
        roundTrip(Expr.intConstant(BigInteger.ONE.shiftLeft(127).negate(), Type.signedInt(128)));
        roundTrip(Expr.intConstant(1, Type.cInt().typedef("myint")));
        roundTrip(Expr.boolConstant(true));
        roundTrip(Expr.boolConstant(false));
        roundTrip(Expr.cBoolConstant(true));
        roundTrip(Expr.floatConstant(-1.5f));
        roundTrip(Expr.doubleConstant(Double.NaN));
        roundTrip(Expr.doubleConstant(-0.0));
        roundTrip(Expr.nullPointer(Type.cInt().toPointer()));
        roundTrip(Expr.pointerConstant(BigInteger.valueOf(0x1000), Type.cInt().toPointer()));
        roundTrip(Expr.stringConstant("hello, world\n"));
    }

    @Test
    void expressions() {
        Expr x = Expr.symbol("x", Type.cInt()).withLocation(loc(4, 2));
        Expr p = Expr.symbol("p", Type.cInt().toPointer());
        Type s = Type.structTag("s");
        Expr f = Expr.symbol("f", Type.code(Collections.singletonList(Parameter.anonymous(Type.cInt())), Type.cInt()));
        roundTrip(x);
        roundTrip(x.address());
        roundTrip(p.dereference());
        roundTrip(Expr.symbol("v", s).member("a", Type.cInt()));
        roundTrip(p.index(x));
        roundTrip(x.cast(Type.cLongInt()));
        roundTrip(f.call(Collections.singletonList(x)));
        roundTrip(x.assign(Expr.intConstant(3, Type.cInt())));
        for (BinaryOperator op : BinaryOperator.values()) {
            roundTrip(x.binop(op, x));
        }
        for (UnaryOperator op : UnaryOperator.values()) {
            roundTrip(x.unop(op));
        }
        for (SelfOperator op : SelfOperator.values()) {
            roundTrip(x.selfOp(op));
        }
        roundTrip(Expr.boolConstant(true).ternary(x, x));
        roundTrip(Expr.structExpr(Collections.singletonList(x), s));
        roundTrip(Expr.unionExpr("b", Expr.boolConstant(true), Type.unionTag("u")));
        roundTrip(Expr.emptyUnion(Type.unionTag("u")));
        roundTrip(Expr.arrayExpr(Arrays.asList(x, x), Type.cInt().arrayOf(2)));
        roundTrip(Expr.vectorExpr(Arrays.asList(x, x), new Type.Vector(Type.cInt(), 2)));
        roundTrip(new Expr(new ExprValue.ArrayOf(x), Type.cInt().arrayOf(8)));
        roundTrip(Expr.nondet(Type.cInt()));
        roundTrip(x.byteExtract(Type.unsignedInt(8), 2));
        roundTrip(Expr.forall(x, x.eq(x)));
        roundTrip(Expr.exists(x, x.lt(x)));
        roundTrip(Expr.statementExpression(Arrays.asList(
                Stmt.assign(x, Expr.intConstant(1, Type.cInt()), loc(5)),
                Stmt.expression(x, loc(5))
        ), Type.cInt()).withLocation(loc(5)));
    }

    @Test
    void statements() {
        Expr x = Expr.symbol("x", Type.cInt());
        Expr cond = x.lt(Expr.intConstant(10, Type.cInt()));
        Expr f = Expr.symbol("f", Fixtures.intFn());
        roundTrip(Stmt.assign(x, Expr.intConstant(1, Type.cInt()), loc(1)));
        roundTrip(Stmt.assertion(cond, Location.property(loc(2), "assertion", "x < 10")));
        roundTrip(Stmt.assume(cond, loc(3)));
        roundTrip(Stmt.atomicBlock(Collections.singletonList(Stmt.skip(loc(4))), loc(4)));
        roundTrip(Stmt.atomicBlock(Collections.<Stmt>emptyList(), Location.NONE));
        roundTrip(Stmt.block(Arrays.asList(Stmt.breakStmt(loc(5)), Stmt.continueStmt(loc(6))), Location.NONE));
        roundTrip(Stmt.dead(x, loc(7)));
        roundTrip(Stmt.decl(x, null, loc(8)));
        roundTrip(Stmt.decl(x, Expr.intConstant(0, Type.cInt()), loc(8)));
        roundTrip(Stmt.expression(x, loc(9)));
        roundTrip(Stmt.forLoop(Stmt.skip(loc(10)), cond, Stmt.skip(loc(10)), Stmt.skip(loc(11)), loc(10)));
        roundTrip(Stmt.functionCall(x, f, Collections.<Expr>emptyList(), loc(12)));
        roundTrip(Stmt.functionCall(null, f, Collections.<Expr>emptyList(), loc(12)));
        roundTrip(Stmt.gotoLabel("end", loc(13)));
        roundTrip(Stmt.ifThenElse(cond, Stmt.skip(loc(14)), null, loc(14)));
        roundTrip(Stmt.ifThenElse(cond, Stmt.skip(loc(14)), Stmt.skip(loc(15)), loc(14)));
        roundTrip(Stmt.skip(loc(16)).withLabel("end"));
        roundTrip(Stmt.returnStmt(null, loc(17)));
        roundTrip(Stmt.returnStmt(x, loc(17)));
        roundTrip(Stmt.switchStmt(x, Collections.singletonList(
                new SwitchCase(Expr.intConstant(1, Type.cInt()), Stmt.breakStmt(loc(19)))), null, loc(18)));
        roundTrip(Stmt.switchStmt(x, Collections.<SwitchCase>emptyList(), Stmt.skip(loc(20)), loc(18)));
        roundTrip(Stmt.whileLoop(cond, Stmt.skip(loc(21)), loc(21)));
    }

    @Test
    void locations() {
        Location[] locations = {
                Location.NONE,
                Location.builtin("memcpy"),
                Location.builtin("memcpy", 12),
                Location.source("a.c", null, 1, null),
                Location.source("a.c", "f", 1, 7),
                Location.property(loc(3, 4), "overflow", "arithmetic overflow"),
        };
        for (Location location : locations) {
            assertEquals(location, from.location(to.location(location)));
        }
    }

    @Test
    void symbols() {
        for (Symbol symbol : Fixtures.richTable().symbols()) {
            IrepSymbol irep = to.symbol(symbol);
            assertEquals(symbol, from.symbol(irep));
        }
    }

    @Test
    void constantsMustFitTheirType() {
        EncodingWidthException e = assertThrows(EncodingWidthException.class,
                () -> to.expr(Expr.intConstant(256, Type.unsignedInt(8)).withLocation(loc(6))));
        assertEquals(loc(6), e.getLocation());
        assertThrows(EncodingWidthException.class, () -> to.expr(Expr.intConstant(-1, Type.sizeT())));
        assertThrows(EncodingWidthException.class, () -> to.expr(Expr.pointerConstant(
                BigInteger.ONE.shiftLeft(64), Type.cInt().toPointer())));
    }

    @Test
    void widthsMustMatchTheMachineModel() {
        Irep narrowInt = Irep.builder(IrepId.SIGNEDBV)
                .namedInt(IrepId.WIDTH, 16)
                .named(IrepId.C_C_TYPE, IrepId.SIGNED_INT)
                .build();
        assertThrows(EncodingWidthException.class, () -> from.type(narrowInt));
        Irep narrowPointer = Irep.builder(IrepId.POINTER)
                .sub(Irep.just(IrepId.BOOL))
                .namedInt(IrepId.WIDTH, 32)
                .build();
        assertThrows(EncodingWidthException.class, () -> from.type(narrowPointer));
        Irep wideConstant = Irep.builder(IrepId.CONSTANT)
                .named(IrepId.VALUE, Irep.justString("1FF"))
                .named(IrepId.TYPE, to.type(Type.unsignedInt(8)))
                .build();
        assertThrows(EncodingWidthException.class, () -> from.expr(wideConstant));
    }

    @Test
    void unknownTagsAreRejected() {
        assertThrows(UnknownTagException.class, () -> from.type(Irep.justString("quaternion")));
        Irep weird = Irep.builder(IrepId.intern("frobnicate"))
                .named(IrepId.TYPE, Irep.just(IrepId.BOOL))
                .build();
        assertThrows(UnknownTagException.class, () -> from.expr(weird));
        Irep weirdStmt = Irep.builder(IrepId.CODE).named(IrepId.STATEMENT, Irep.justString("frobnicate")).build();
        assertThrows(UnknownTagException.class, () -> from.stmt(weirdStmt));
    }

    @Test
    void malformedTreesAreRejected() {
        Irep noWidth = Irep.builder(IrepId.SIGNEDBV).build();
        assertThrows(MalformedTreeException.class, () -> from.type(noWidth));
        Irep badWidth = Irep.builder(IrepId.SIGNEDBV).named(IrepId.WIDTH, Irep.justString("wide")).build();
        assertThrows(MalformedTreeException.class, () -> from.type(badWidth));
        Irep noChildren = Irep.builder(IrepId.PLUS).named(IrepId.TYPE, to.type(Type.cInt())).build();
        assertThrows(MalformedTreeException.class, () -> from.expr(noChildren));
        Irep badTag = Irep.builder(IrepId.STRUCT_TAG).named(IrepId.IDENTIFIER, Irep.justString("s")).build();
        assertThrows(MalformedTreeException.class, () -> from.type(badTag));
        assertThrows(MalformedTreeException.class, () -> from.stmt(to.expr(Expr.boolConstant(true))));
    }

    @Test
    void outOfRangeFieldsAreMalformed() {
        Irep zeroWidth = Irep.builder(IrepId.SIGNEDBV).namedInt(IrepId.WIDTH, 0).build();
        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> from.type(zeroWidth));
        assertTrue(e.getCause() instanceof IllegalArgumentException);

        Irep lineZero = to.location(loc(3)).with(IrepId.LINE, Irep.justInt(0));
        assertThrows(MalformedTreeException.class, () -> from.location(lineZero));
    }

    @Test
    void symbolErrorsNameTheSymbol() {
        Symbol bad = Symbol.staticVariable("counter", "counter", Type.unsignedInt(8),
                Expr.intConstant(1000, Type.unsignedInt(8)), loc(40));
        GotoException e = assertThrows(EncodingWidthException.class, () -> to.symbol(bad));
        assertEquals("counter", e.getSymbolName());
        assertEquals(loc(40), e.getLocation());
        assertTrue(e.getMessage().contains("counter"));
    }
}
