package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.codec.GotoBinaryReader;
import io.github.eutro.gotoj.core.codec.GotoFormat;
import io.github.eutro.gotoj.core.error.FormatVersionException;
import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.error.UnknownTagException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import io.github.eutro.gotoj.core.model.Expr;
import io.github.eutro.gotoj.core.model.Location;
import io.github.eutro.gotoj.core.model.MachineModel;
import io.github.eutro.gotoj.core.model.Symbol;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.convert.GotoToIrep;
import io.github.eutro.gotoj.core.passes.convert.IrepToGoto;
import io.github.eutro.gotoj.core.passes.convert.FromIrep;
import io.github.eutro.gotoj.core.passes.convert.MachineModelSymbols;
import io.github.eutro.gotoj.core.passes.convert.ToIrep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class CodecTest {
    @ParameterizedTest
    @EnumSource(GotoFormat.class)
    void roundTrip(GotoFormat format) {
        byte[] bytes = format.encode(Fixtures.richTable());
        assertEquals(Fixtures.richTable(), format.decode(bytes));
    }

    @ParameterizedTest
    @EnumSource(GotoFormat.class)
    void encodingIsDeterministic(GotoFormat format) {
        assertArrayEquals(format.encode(Fixtures.richTable()), format.encode(Fixtures.richTable()));
    }

    @Test
    void binaryToJsonAndBack() {
        byte[] binary = GotoFormat.BINARY.encode(Fixtures.richTable());
        byte[] json = GotoFormat.convert(binary, GotoFormat.BINARY, GotoFormat.JSON);
        assertEquals(Fixtures.richTable(), GotoFormat.JSON.decode(json));
        assertArrayEquals(binary, GotoFormat.convert(json, GotoFormat.JSON, GotoFormat.BINARY));
    }

    @Test
    void jsonLayout() {
        String json = new String(GotoFormat.JSON.encode(Fixtures.mainWithAssertFalse()), StandardCharsets.UTF_8);
        assertTrue(json.startsWith("{\n \"symbolTable\": {"), json);
        assertTrue(json.contains("\"main\": {"));
        assertTrue(json.contains("\"isStaticLifetime\""));
    }

    @Test
    void encodingDoesNotConsume() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        GotoFormat.BINARY.encode(table);
        assertFalse(table.isConsumed());
        assertTrue(table.contains("main"));
    }

    @Test
    void badMagic() {
        byte[] bytes = GotoFormat.BINARY.encode(Fixtures.mainWithAssertFalse());
        bytes[1] = 'X';
        assertThrows(FormatVersionException.class, () -> GotoFormat.BINARY.decode(bytes));
    }

    @Test
    void wrongVersion() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(GotoBinaryReader.MAGIC, 0, GotoBinaryReader.MAGIC.length);
        out.write(GotoBinaryReader.VERSION - 1);
        out.write(0);
        out.write(0);
        assertThrows(FormatVersionException.class, () -> GotoFormat.BINARY.decodeIreps(out.toByteArray()));
    }

    @Test
    void emptyInput() {
        assertThrows(FormatVersionException.class, () -> GotoFormat.BINARY.decodeIreps(new byte[0]));
        assertThrows(FormatVersionException.class, () -> GotoFormat.JSON.decodeIreps(new byte[0]));
    }

    @Test
    void truncatedInput() {
        byte[] header = Arrays.copyOf(GotoBinaryReader.MAGIC, GotoBinaryReader.MAGIC.length + 1);
        header[header.length - 1] = (byte) GotoBinaryReader.VERSION;
        assertThrows(MalformedTreeException.class, () -> GotoFormat.BINARY.decodeIreps(header));

        byte[] full = GotoFormat.BINARY.encode(Fixtures.mainWithAssertFalse());
        byte[] cut = Arrays.copyOf(full, full.length / 2);
        assertThrows(MalformedTreeException.class, () -> GotoFormat.BINARY.decodeIreps(cut));
    }

    private static byte[] binary(Object... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(GotoBinaryReader.MAGIC, 0, GotoBinaryReader.MAGIC.length);
        out.write(GotoBinaryReader.VERSION);
        for (Object part : parts) {
            if (part instanceof String) {
                byte[] text = ((String) part).getBytes(StandardCharsets.UTF_8);
                out.write(text, 0, text.length);
                out.write(0);
            } else if (part instanceof Character) {
                out.write((Character) part);
            } else {
                out.write((Integer) part);
            }
        }
        return out.toByteArray();
    }

    @Test
    void subtreesComeBeforeNamedSubtrees() {
        byte[] ordered = binary(1, 0, 0, "signedbv", 'N', 1, "width", 1, 2, "8", 0, 'S');
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
                () -> GotoFormat.BINARY.decodeIreps(ordered));
        assertTrue(e.getMessage().contains("after a named subtree"), e.getMessage());
    }

    @Test
    void newNumbersAreSequential() {
        MalformedTreeException irep = assertThrows(MalformedTreeException.class,
                () -> GotoFormat.BINARY.decodeIreps(binary(1, 3, 0, "bool", 0)));
        assertTrue(irep.getMessage().contains("irep number 0"), irep.getMessage());
        MalformedTreeException string = assertThrows(MalformedTreeException.class,
                () -> GotoFormat.BINARY.decodeIreps(binary(1, 0, 2, "bool", 0)));
        assertTrue(string.getMessage().contains("string number 0"), string.getMessage());
    }

    @Test
    void trailingBytes() {
        byte[] full = GotoFormat.BINARY.encode(Fixtures.mainWithAssertFalse());
        byte[] longer = Arrays.copyOf(full, full.length + 1);
        assertThrows(MalformedTreeException.class, () -> GotoFormat.BINARY.decodeIreps(longer));
    }

    @Test
    void badJson() {
        assertThrows(FormatVersionException.class, () -> decodeJson("{\"foo\": 1}"));
        assertThrows(FormatVersionException.class, () -> decodeJson("{\"symbolTable\": ["));
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
                () -> decodeJson("{\"symbolTable\": {\"x\": {\"name\": \"x\"}}}"));
        assertEquals("x", e.getSymbolName());
        assertThrows(MalformedTreeException.class,
                () -> decodeJson("{\"symbolTable\": {\"x\": 3}}"));
    }

    @Test
    void duplicateJsonKeysAreMalformed() {
        String json = new String(GotoFormat.JSON.encode(Fixtures.mainWithAssertFalse()), StandardCharsets.UTF_8);
        assertEquals(Fixtures.mainWithAssertFalse(), GotoFormat.JSON.decode(json.getBytes(StandardCharsets.UTF_8)));
        String twice = json.replaceFirst("\"namedSub\"\\s*:\\s*\\{", "$0\"width\": {\"id\": \"8\"}, \"width\": {\"id\": \"8\"}}, \"extra\": {");
        assertNotEquals(json, twice);
        MalformedTreeException e = assertThrows(MalformedTreeException.class,
                () -> decodeJson(twice));
        assertTrue(e.getMessage().contains("duplicate key"), e.getMessage());
        assertThrows(MalformedTreeException.class,
                () -> decodeJson("{\"symbolTable\": {\"x\": {\"name\": \"x\", \"name\": \"y\"}}}"));
    }

    @Test
    void jsonReadFailuresAreNotFormatErrors() {
        InputStream failing = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("device gone");
            }
        };
        IOException e = assertThrows(IOException.class, () -> GotoFormat.JSON.read(failing));
        assertEquals("device gone", e.getMessage());
        assertThrows(FormatVersionException.class, () -> decodeJson("{\"symbolTable\": {}} {}"));
    }

    private static IrepSymbolTable decodeJson(String json) {
        return GotoFormat.JSON.decodeIreps(json.getBytes(StandardCharsets.UTF_8));
    }

    @ParameterizedTest
    @EnumSource(GotoFormat.class)
    void unknownTagsAreRejectedOnEncode(GotoFormat format) {
        IrepSymbolTable table = new IrepSymbolTable();
        table.add(new IrepSymbol(
                Irep.builder(IrepId.intern("frobnicate")).sub(Irep.just(IrepId.BOOL)).build(),
                Irep.nil(),
                Irep.nil(),
                "x", "", "x", "x", Symbol.Mode.C.text(),
                EnumSet.noneOf(SymbolFlag.class)));
        assertThrows(UnknownTagException.class, () -> format.encodeIreps(table));
    }

    @Test
    void leafTextIsNotATag() {
        IrepSymbolTable table = new IrepSymbolTable();
        table.add(new IrepSymbol(
                Irep.just(IrepId.BOOL),
                Irep.nil(),
                Irep.nil(),
                "frobnicate", "", "", "", Symbol.Mode.C.text(),
                EnumSet.of(SymbolFlag.LVALUE)));
        assertEquals(table, GotoFormat.BINARY.decodeIreps(GotoFormat.BINARY.encodeIreps(table)));
    }

    @Test
    void machineModelIsPreserved() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.AARCH64);
        table.insert(Symbol.variable("c", "c", io.github.eutro.gotoj.core.model.Type.cChar(), Location.NONE));
        SymbolTable decoded = GotoFormat.BINARY.decode(GotoFormat.BINARY.encode(table));
        assertEquals(MachineModel.AARCH64, decoded.getMachineModel());
        assertEquals(1, decoded.size());
    }

    @Test
    void missingMachineModelFallsBack() {
        IrepSymbolTable ireps = GotoToIrep.INSTANCE.run(Fixtures.mainWithAssertFalse());
        IrepSymbolTable stripped = new IrepSymbolTable();
        for (IrepSymbol symbol : ireps.symbols()) {
            if (!MachineModelSymbols.isMachineModelSymbol(symbol.getName())) stripped.add(symbol);
        }
        SymbolTable decoded = new IrepToGoto(MachineModel.AARCH64).run(stripped);
        assertEquals(MachineModel.AARCH64, decoded.getMachineModel());
        assertEquals(MachineModel.X86_64, IrepToGoto.INSTANCE.run(stripped).getMachineModel());
    }

    @Test
    void partialMachineModelIsMalformed() {
        IrepSymbolTable ireps = GotoToIrep.INSTANCE.run(Fixtures.mainWithAssertFalse());
        IrepSymbolTable partial = new IrepSymbolTable();
        for (IrepSymbol symbol : ireps.symbols()) {
            if (!symbol.getName().equals(MachineModelSymbols.PREFIX + "int_width")) partial.add(symbol);
        }
        assertThrows(MalformedTreeException.class, () -> IrepToGoto.INSTANCE.run(partial));
    }

    @Test
    void zeroWidthsAreMalformed() {
        IrepSymbolTable ireps = GotoToIrep.INSTANCE.run(Fixtures.mainWithAssertFalse());
        IrepSymbolTable broken = new IrepSymbolTable();
        for (IrepSymbol symbol : ireps.symbols()) {
            if (symbol.getName().equals(MachineModelSymbols.PREFIX + "int_width")) {
                io.github.eutro.gotoj.core.model.Type type = new FromIrep(MachineModel.X86_64).type(symbol.getType());
                Irep zero = new ToIrep(MachineModel.X86_64).expr(Expr.intConstant(0, type));
                symbol = new IrepSymbol(symbol.getType(), zero, symbol.getLocation(), symbol.getName(),
                        symbol.getModule(), symbol.getBaseName(), symbol.getPrettyName(), symbol.getMode(),
                        symbol.getFlags());
            }
            broken.add(symbol);
        }
        byte[] bytes = GotoFormat.BINARY.encodeIreps(broken);
        assertThrows(MalformedTreeException.class, () -> GotoFormat.BINARY.decode(bytes));

        IrepSymbolTable zeroWidth = new IrepSymbolTable();
        zeroWidth.add(new IrepSymbol(
                Irep.builder(IrepId.SIGNEDBV).namedInt(IrepId.WIDTH, 0).build(),
                Irep.nil(),
                Irep.nil(),
                "x", "", "x", "x", Symbol.Mode.C.text(),
                EnumSet.of(SymbolFlag.LVALUE)));
        byte[] encoded = GotoFormat.BINARY.encodeIreps(zeroWidth);
        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> GotoFormat.BINARY.decode(encoded));
        assertEquals("x", e.getSymbolName());
    }
}
