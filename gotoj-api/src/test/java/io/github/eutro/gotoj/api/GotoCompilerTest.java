package io.github.eutro.gotoj.api;

import io.github.eutro.gotoj.api.bits.OutputsToDirectory;
import io.github.eutro.gotoj.api.events.EmitProgramEvent;
import io.github.eutro.gotoj.api.events.PassCompletedEvent;
import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.error.PipelineConfigException;
import io.github.eutro.gotoj.core.model.*;
import io.github.eutro.gotoj.core.passes.PassRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.*;

public class GotoCompilerTest {
    private static Location loc(int line) {
        return Location.source("main.c", "main", line, null);
    }

    /**
     * {@code int main() { int x = nondet_int(); assert(x == x); return x; }}
     */
    private static SymbolTable program() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Type intFn = Type.code(Collections.<Parameter>emptyList(), Type.cInt());
        Expr x = Expr.symbol("main::1::x", Type.cInt());
        table.insert(Symbol.function("nondet_int", intFn, null, Location.NONE));
        table.insert(Symbol.variable("main::1::x", "x", Type.cInt(), loc(2)));
        table.insert(Symbol.function("main", intFn, Stmt.block(Arrays.asList(
                Stmt.decl(x, Expr.symbol("nondet_int", intFn).call(), loc(2)),
                Stmt.assertion(x.eq(x), loc(3)),
                Stmt.returnStmt(x, loc(4))
        ), loc(1)), loc(1)));
        return table;
    }

    @Test
    void emitsAfterEveryPass() throws InterruptedException {
        GotoCompiler cc = new GotoCompiler();
        BlockingQueue<EmitProgramEvent> outputs = cc.outputsAsQueue();
        List<String> passes = new ArrayList<>();
        cc.lift().listen(PassCompletedEvent.class, evt -> passes.add(evt.pass));

        SymbolTable result = cc.submit(program()).setName("prog").run();
        assertEquals(PassRegistry.DEFAULT_PIPELINE, passes);
        assertTrue(result.contains("main_1_x"));
        assertFalse(result.contains("nondet_int"));

        EmitProgramEvent evt = outputs.take();
        assertEquals("prog", evt.name);
        assertEquals(GotoFormat.BINARY, evt.format);
        assertSame(result, evt.table);
        assertEquals(result, GotoFormat.BINARY.decode(evt.bytes));
        assertTrue(outputs.isEmpty());
    }

    @Test
    void unknownPassLeavesTheTableAlone() {
        GotoCompiler cc = new GotoCompiler();
        BlockingQueue<EmitProgramEvent> outputs = cc.outputsAsQueue();
        SymbolTable table = program();
        ProgramCompilation compilation = cc.submit(table)
                .setPipeline(Arrays.asList(PassRegistry.IDENTITY, "optimise"));
        assertThrows(PipelineConfigException.class, compilation::run);
        assertFalse(table.isConsumed());
        assertSame(table, compilation.table);
        assertTrue(outputs.isEmpty());
    }

    @Test
    void customPipelineAndFormat() throws IOException {
        GotoCompiler cc = new GotoCompiler();
        BlockingQueue<EmitProgramEvent> outputs = cc.outputsAsQueue();
        byte[] json = GotoFormat.JSON.encode(program());
        cc.submit(new ByteArrayInputStream(json), GotoFormat.JSON)
                .setPipeline(Collections.singletonList(PassRegistry.IDENTITY))
                .setFormat(GotoFormat.JSON)
                .run();
        EmitProgramEvent evt = outputs.remove();
        assertArrayEquals(json, evt.bytes);
    }

    @Test
    void writesToDirectory(@TempDir Path dir) throws IOException {
        GotoCompiler cc = new GotoCompiler();
        cc.add(new OutputsToDirectory(dir.resolve("out")));
        cc.submit(program()).setName("first").run();
        cc.submit(program()).setName("second").setFormat(GotoFormat.JSON).run();

        Path first = dir.resolve("out").resolve("first.goto");
        Path second = dir.resolve("out").resolve("second.json");
        assertTrue(Files.isRegularFile(first));
        assertTrue(Files.isRegularFile(second));
        assertEquals(GotoFormat.BINARY.decode(Files.readAllBytes(first)),
                GotoFormat.JSON.decode(Files.readAllBytes(second)));
    }

    @Test
    void cancelledOutputsAreNotWritten(@TempDir Path dir) throws IOException {
        GotoCompiler cc = new GotoCompiler();
        cc.lift().listen(EmitProgramEvent.class, evt -> {
            if (evt.name.startsWith("tmp")) evt.cancel();
        });
        cc.add(new OutputsToDirectory(dir));
        cc.submit(program()).setName("tmp").run();
        cc.submit(program()).setName("kept").run();
        assertFalse(Files.exists(dir.resolve("tmp.goto")));
        assertTrue(Files.exists(dir.resolve("kept.goto")));
    }

    @Test
    void namesMayNotLeaveTheDirectory(@TempDir Path dir) throws IOException {
        GotoCompiler cc = new GotoCompiler();
        Path out = dir.resolve("out");
        cc.add(new OutputsToDirectory(out));
        for (String name : Arrays.asList("../escaped", "..", "a/b", "a\\b", "")) {
            assertThrows(IllegalArgumentException.class, () -> cc.submit(program()).setName(name).run(), name);
        }
        assertFalse(Files.exists(dir.resolve("escaped.goto")));
        assertFalse(Files.exists(out.resolve("a").resolve("b.goto")));
        cc.submit(program()).setName("..hidden").run();
        assertTrue(Files.isRegularFile(out.resolve("..hidden.goto")));
    }
}
