package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.error.GotoException;
import io.github.eutro.gotoj.core.error.PipelineConfigException;
import io.github.eutro.gotoj.core.error.StructuralException;
import io.github.eutro.gotoj.core.error.UnsupportedNodeException;
import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.PassRegistry;
import io.github.eutro.gotoj.core.passes.Pipeline;
import io.github.eutro.gotoj.core.passes.Transformer;
import io.github.eutro.gotoj.core.passes.form.ExprRewrite;
import io.github.eutro.gotoj.core.passes.form.NameCleanup;
import io.github.eutro.gotoj.core.passes.form.NondetSubstitution;
import io.github.eutro.gotoj.core.passes.meta.ValidateTags;
import io.github.eutro.gotoj.core.passes.misc.Identity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.gotoj.core.test.Fixtures.loc;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    private final PassRegistry registry = PassRegistry.defaults();

    private SymbolTable run(SymbolTable table, String... passes) {
        return registry.resolve(Arrays.asList(passes)).run(table);
    }

    private static Stmt body(SymbolTable table, String function) {
        Symbol symbol = table.get(function);
        assertNotNull(symbol, function);
        Stmt stmt = symbol.getValue().getStmt();
        assertNotNull(stmt, function);
        return stmt;
    }

    private static List<Stmt> statements(Stmt block) {
        return ((StmtBody.Block) block.getBody()).getStatements();
    }

    @Test
    void identityKeepsEverything() {
        SymbolTable input = Fixtures.richTable();
        SymbolTable output = Identity.INSTANCE.run(input);
        assertTrue(input.isConsumed());
        assertEquals(Fixtures.richTable(), output);
    }

    @Test
    void assertionLocationSurvivesIdentityAndBinary() {
        SymbolTable afterIdentity = run(Fixtures.mainWithAssertFalse(), PassRegistry.IDENTITY);
        SymbolTable decoded = GotoFormat.BINARY.decode(GotoFormat.BINARY.encode(afterIdentity));
        Stmt assertion = statements(body(decoded, "main")).get(0);
        assertTrue(assertion.getBody() instanceof StmtBody.Assert);
        Location.Property location = (Location.Property) assertion.getLocation();
        assertEquals("main.c", location.getFile());
        assertEquals(3, location.getLine());
        assertEquals("assertion", location.getPropertyClass());
    }

    @Test
    void nameCleanupRejectsUnsubstitutedNondet() {
        UnsupportedNodeException e = assertThrows(UnsupportedNodeException.class,
                () -> run(Fixtures.nondetProgram(), PassRegistry.EXPR_REWRITE, PassRegistry.NAME_CLEANUP));
        assertEquals("main", e.getSymbolName());
        assertEquals(loc(2), e.getLocation());
        assertTrue(e.getMessage().contains("__VERIFIER_nondet_int"));
    }

    @Test
    void defaultPipelineSubstitutesNondet() {
        SymbolTable out = registry.resolve(PassRegistry.DEFAULT_PIPELINE).run(Fixtures.nondetProgram());
        assertFalse(out.contains("__VERIFIER_nondet_int"));
        assertFalse(out.contains("main::1::x"));
        assertTrue(out.contains("main_1_x"));

        Stmt decl = statements(body(out, "main")).get(0);
        Expr init = ((StmtBody.Decl) decl.getBody()).getValue();
        assertNotNull(init);
        assertTrue(init.getValue() instanceof ExprValue.Nondet);
        assertEquals(loc(2), init.getLocation());
        assertEquals(Expr.symbol("main_1_x", Type.cInt()).withLocation(loc(2)),
                ((StmtBody.Decl) decl.getBody()).getLhs());

        assertEquals(Collections.singletonMap("main::1::x", "main_1_x"), out.getExtOrThrow(CommonExts.RENAMED));
        assertEquals(PassRegistry.DEFAULT_PIPELINE, out.getExtOrThrow(CommonExts.PASS_TRACE));
        assertTrue(out.getExt(CommonExts.LOWERED).orElse(false));
        assertTrue(out.getExt(CommonExts.NONDET_SUBSTITUTED).orElse(false));
    }

    @Test
    void pipelinesAreDeterministic() {
        byte[] first = GotoFormat.BINARY.encode(registry.resolve(PassRegistry.DEFAULT_PIPELINE).run(Fixtures.richTable()));
        byte[] second = GotoFormat.BINARY.encode(registry.resolve(PassRegistry.DEFAULT_PIPELINE).run(Fixtures.richTable()));
        assertArrayEquals(first, second);
    }

    @Test
    void nondetSubstitutionNeedsLowering() {
        SymbolTable table = Fixtures.nondetProgram();
        assertThrows(UnsupportedNodeException.class, () -> NondetSubstitution.INSTANCE.run(table));
        assertFalse(table.isConsumed());
    }

    @Test
    void nondetCallStatements() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Expr nondet = Expr.symbol("nondet_bool", Type.code(Collections.<Parameter>emptyList(), Type.bool()));
        Expr b = Expr.symbol("f::b", Type.bool());
        table.insert(Symbol.function("nondet_bool", nondet.getType(), null, Location.NONE));
        table.insert(Symbol.variable("f::b", "b", Type.bool(), loc(1)));
        table.insert(Symbol.function("f", Fixtures.voidFn(), Stmt.block(Arrays.asList(
                Stmt.functionCall(b, nondet, Collections.<Expr>emptyList(), loc(2)),
                Stmt.functionCall(null, nondet, Collections.<Expr>emptyList(), loc(3))
        ), loc(1)), loc(1)));
        SymbolTable out = run(table, PassRegistry.EXPR_REWRITE, PassRegistry.NONDET_SUBSTITUTION);
        List<Stmt> stmts = statements(body(out, "f"));
        assertEquals(Stmt.assign(b, Expr.nondet(Type.bool()), loc(2)), stmts.get(0));
        assertEquals(Stmt.skip(loc(3)), stmts.get(1));
        assertFalse(out.contains("nondet_bool"));
    }

    @Test
    void impliesIsLowered() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Expr a = Expr.symbol("a", Type.bool());
        Expr b = Expr.symbol("b", Type.bool());
        table.insert(Symbol.staticVariable("c", "c", Type.bool(), a.implies(b), loc(1)));
        SymbolTable out = ExprRewrite.INSTANCE.run(table);
        assertEquals(a.not().or(b), out.get("c").getValue().getExpr());
        assertTrue(out.getExt(CommonExts.LOWERED).orElse(false));
    }

    @Test
    void postIncrementUsesATemporary() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Expr x = Expr.symbol("f::x", Type.cInt());
        table.insert(Symbol.variable("f::x", "x", Type.cInt(), loc(1)));
        table.insert(Symbol.function("f", Fixtures.voidFn(), Stmt.block(Arrays.asList(
                Stmt.expression(x.selfOp(SelfOperator.POSTINCREMENT).withLocation(loc(2)), loc(2)),
                Stmt.expression(x.selfOp(SelfOperator.PREDECREMENT).withLocation(loc(3)), loc(3))
        ), loc(1)), loc(1)));
        SymbolTable out = ExprRewrite.INSTANCE.run(table);

        String temp = ExprRewrite.TEMP_PREFIX + "0";
        assertTrue(out.contains(temp));
        assertFalse(out.contains(ExprRewrite.TEMP_PREFIX + "1"));
        Expr t = Expr.symbol(temp, Type.cInt());
        Expr one = Expr.intConstant(1, Type.cInt());

        List<Stmt> stmts = statements(body(out, "f"));
        Expr post = ((StmtBody.Expression) stmts.get(0).getBody()).getExpr();
        assertEquals(Expr.statementExpression(Arrays.asList(
                Stmt.decl(t, x, loc(2)),
                Stmt.assign(x, x.plus(one), loc(2)),
                Stmt.expression(t, loc(2))
        ), Type.cInt()).withLocation(loc(2)), post);

        Expr pre = ((StmtBody.Expression) stmts.get(1).getBody()).getExpr();
        assertEquals(Expr.statementExpression(Arrays.asList(
                Stmt.assign(x, x.minus(one), loc(3)),
                Stmt.expression(x, loc(3))
        ), Type.cInt()).withLocation(loc(3)), pre);
    }

    @Test
    void wideConstantsAreSplit() {
        SymbolTable out = ExprRewrite.INSTANCE.run(Fixtures.richTable());
        Expr big = out.get("big").getValue().getExpr();
        assertNotNull(big);
        assertTrue(big.getValue() instanceof ExprValue.Typecast);
        assertEquals(Type.unsignedInt(128), big.getType());
    }

    @Test
    void failuresNameTheSymbolAndLocation() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Expr flag = Expr.symbol("g::flag", Type.bool());
        table.insert(Symbol.variable("g::flag", "flag", Type.bool(), loc(10)));
        table.insert(Symbol.function("g", Fixtures.voidFn(), Stmt.block(Collections.singletonList(
                Stmt.expression(flag.selfOp(SelfOperator.POSTINCREMENT).withLocation(loc(12, 5)), loc(12))
        ), loc(11)), loc(11)));
        GotoException e = assertThrows(UnsupportedNodeException.class,
                () -> run(table, PassRegistry.IDENTITY, PassRegistry.EXPR_REWRITE));
        assertEquals("g", e.getSymbolName());
        assertEquals(loc(12, 5), e.getLocation());
        assertTrue(e.getMessage().contains("in symbol g"));
        assertTrue(e.getMessage().contains("main.c:12:5"));
    }

    @Test
    void validateTags() {
        SymbolTable ok = ValidateTags.INSTANCE.run(Fixtures.richTable());
        assertEquals(Fixtures.richTable(), ok);

        SymbolTable bad = SymbolTable.withMachineModel(MachineModel.X86_64);
        bad.insert(Symbol.variable("p", "p", Type.structTag("missing").toPointer(), loc(1)));
        StructuralException e = assertThrows(StructuralException.class, () -> ValidateTags.INSTANCE.run(bad));
        assertEquals("p", e.getSymbolName());

        SymbolTable wrongKind = SymbolTable.withMachineModel(MachineModel.X86_64);
        wrongKind.insert(Symbol.aggregate(new Type.IncompleteStruct("s"), Location.NONE));
        wrongKind.insert(Symbol.variable("u", "u", Type.unionTag("s"), loc(1)));
        assertThrows(StructuralException.class, () -> run(wrongKind, PassRegistry.VALIDATE_TAGS));
    }

    @Test
    void unknownPassesAreRejectedBeforeRunning() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        assertThrows(PipelineConfigException.class,
                () -> registry.resolve(Arrays.asList(PassRegistry.IDENTITY, "frobnicate")));
        assertThrows(PipelineConfigException.class,
                () -> registry.resolve(Arrays.asList(PassRegistry.NAME_CLEANUP, PassRegistry.IDENTITY)));
        assertFalse(table.isConsumed());
        assertEquals(Fixtures.mainWithAssertFalse(), table);
    }

    @Test
    void emptyPipelineReturnsItsInput() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        assertSame(table, registry.resolve(Collections.<String>emptyList()).run(table));
    }

    @Test
    void listenerSeesEveryPass() {
        List<String> seen = new ArrayList<>();
        Pipeline pipeline = registry.resolve(Arrays.asList(PassRegistry.IDENTITY, PassRegistry.VALIDATE_TAGS,
                PassRegistry.NAME_CLEANUP));
        SymbolTable out = pipeline.run(Fixtures.richTable(), (name, result) -> {
            seen.add(name);
            assertFalse(result.isConsumed());
        });
        assertEquals(pipeline.getNames(), seen);
        assertEquals(pipeline.getNames(), out.getExtOrThrow(CommonExts.PASS_TRACE));
    }

    @Test
    void registeringTwiceFails() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(PassRegistry.IDENTITY, Identity.INSTANCE));
    }

    @Test
    void cleanNames() {
        assertEquals("main_1_x", NameCleanup.clean("main::1::x"));
        assertEquals("_1abc", NameCleanup.clean("1abc"));
        assertEquals("tag-a_b", NameCleanup.clean("tag-a::b"));
        assertEquals("_", NameCleanup.clean(""));
        assertEquals("caf_", NameCleanup.clean("café"));
        assertEquals("$ok_name", NameCleanup.clean("$ok_name"));
    }

    @Test
    void cleanNamesStayUnique() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        table.insert(Symbol.variable("a_b", "a_b", Type.cInt(), loc(1)));
        table.insert(Symbol.variable("a::b", "b", Type.cInt(), loc(2)));
        table.insert(Symbol.variable("a.b", "b", Type.cInt(), loc(3)));
        SymbolTable out = NameCleanup.INSTANCE.run(table);
        Map<String, String> renamed = out.getExtOrThrow(CommonExts.RENAMED);
        assertEquals(2, renamed.size());
        assertEquals("a_b_1", renamed.get("a.b"));
        assertEquals("a_b_2", renamed.get("a::b"));
        assertTrue(out.contains("a_b"));
        assertEquals(loc(1), out.get("a_b").getLocation());
    }

    @Test
    void tagsAreRenamedWithTheirDefinitions() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        table.insert(Symbol.aggregate(new Type.IncompleteStruct("ns::s"), Location.NONE));
        table.insert(Symbol.variable("p", "p", Type.structTag("ns::s").toPointer(), loc(1)));
        SymbolTable out = ValidateTags.INSTANCE.run(run(table, PassRegistry.NAME_CLEANUP));
        assertTrue(out.contains("tag-ns_s"));
        assertEquals(Type.structTag("ns_s").toPointer(), out.get("p").getType());
    }

    @Test
    void componentsLabelsAndBaseNamesAreCleaned() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        table.insert(Symbol.aggregate(new Type.Struct("s", Arrays.asList(
                DatatypeComponent.field("a::b", Type.cInt()),
                DatatypeComponent.padding("pad::0", 32)
        )), loc(1)));
        table.insert(Symbol.variable("f::1::v", "v::1", Type.structTag("s"), loc(2)));
        Expr v = Expr.symbol("f::1::v", Type.structTag("s"));
        Type fnType = Type.code(Collections.singletonList(new Parameter(Type.cInt(), "ns::f::p", "p::0")), Type.empty());
        table.insert(Symbol.function("ns::f", fnType, Stmt.block(Arrays.asList(
                Stmt.gotoLabel("bb::0", loc(3)),
                Stmt.assign(v.member("a::b", Type.cInt()), Expr.intConstant(1, Type.cInt()), loc(4)).withLabel("bb::0")
        ), loc(2)), loc(2)));
        SymbolTable out = NameCleanup.INSTANCE.run(table);

        Type.Struct s = (Type.Struct) out.get("tag-s").getType();
        assertEquals("a_b", s.getComponents().get(0).getName());
        assertEquals("pad_0", s.getComponents().get(1).getName());
        assertTrue(s.getComponents().get(1).isPadding());

        Symbol f = out.get("ns_f");
        assertNotNull(f);
        assertEquals("ns_f", f.getPrettyName());
        Parameter p = ((Type.Code) f.getType()).getParameters().get(0);
        assertEquals("ns_f_p", p.getIdentifier());
        assertEquals("p_0", p.getBaseName());
        assertEquals("v_1", out.get("f_1_v").getBaseName());
        assertEquals("v_1", out.get("f_1_v").getPrettyName());

        List<Stmt> stmts = statements(body(out, "ns_f"));
        assertEquals("bb_0", ((StmtBody.Goto) stmts.get(0).getBody()).getLabel());
        StmtBody.Label label = (StmtBody.Label) stmts.get(1).getBody();
        assertEquals("bb_0", label.getLabel());
        Expr lhs = ((StmtBody.Assign) label.getBody().getBody()).getLhs();
        assertEquals(new ExprValue.Member(Expr.symbol("f_1_v", Type.structTag("s")), "a_b"), lhs.getValue());
        ValidateTags.INSTANCE.run(out);
    }

    @Test
    void selfOpTargetIsEvaluatedOnce() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Type array = Type.cInt().arrayOf(4);
        Expr a = Expr.symbol("main::1::a", array);
        Expr i = Expr.symbol("main::1::i", Type.cInt());
        table.insert(Symbol.variable("main::1::a", "a", array, loc(1)));
        table.insert(Symbol.variable("main::1::i", "i", Type.cInt(), loc(1)));
        Expr incremented = a.index(i.selfOp(SelfOperator.POSTINCREMENT)).selfOp(SelfOperator.POSTINCREMENT);
        table.insert(Symbol.function("main", Fixtures.voidFn(), Stmt.block(Collections.singletonList(
                Stmt.expression(incremented.withLocation(loc(2)), loc(2))
        ), loc(1)), loc(1)));
        SymbolTable out = ExprRewrite.INSTANCE.run(table);

        Map<Expr, Integer> assigned = new HashMap<>();
        new Transformer(out) {
            @Override
            public Stmt visitAssign(Stmt stmt, StmtBody.Assign body) {
                assigned.merge(body.getLhs(), 1, Integer::sum);
                return super.visitAssign(stmt, body);
            }
        }.transform();
        assertEquals(Integer.valueOf(1), assigned.get(i));
        assertEquals(2, assigned.size());
        assertTrue(out.get(ExprRewrite.TEMP_PREFIX + "1").getType() instanceof Type.Pointer);
    }

    @Test
    void vectorIndexingGoesThroughAPointer() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Type vector = new Type.Vector(Type.cInt(), 4);
        Expr v = Expr.symbol("v", vector);
        Expr i = Expr.symbol("i", Type.cInt());
        table.insert(Symbol.variable("v", "v", vector, loc(1)));
        table.insert(Symbol.variable("i", "i", Type.cInt(), loc(1)));
        table.insert(Symbol.function("main", Fixtures.voidFn(), Stmt.block(Collections.singletonList(
                Stmt.expression(v.index(i).withLocation(loc(2)), loc(2))
        ), loc(1)), loc(1)));
        SymbolTable out = ExprRewrite.INSTANCE.run(table);

        Expr lowered = ((StmtBody.Expression) statements(body(out, "main")).get(0).getBody()).getExpr();
        assertEquals(v.address().cast(Type.cInt().toPointer()).index(i).withLocation(loc(2)), lowered);
    }
}
