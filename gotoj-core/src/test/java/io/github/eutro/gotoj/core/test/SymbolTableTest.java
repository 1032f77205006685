package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.error.NameCollisionException;
import io.github.eutro.gotoj.core.ext.CommonExts;
import io.github.eutro.gotoj.core.ext.Ext;
import io.github.eutro.gotoj.core.model.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.gotoj.core.test.Fixtures.loc;
import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {
    @Test
    void duplicateInsertKeepsTheFirst() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        Symbol first = Symbol.variable("x", "x", Type.cInt(), loc(1));
        Symbol second = Symbol.variable("x", "x", Type.bool(), loc(2));
        table.insert(first);
        NameCollisionException e = assertThrows(NameCollisionException.class, () -> table.insert(second));
        assertEquals("x", e.getSymbolName());
        assertEquals(loc(2), e.getLocation());
        assertEquals(1, table.size());
        assertSame(first, table.lookup("x").orElse(null));
    }

    @Test
    void machineModelNamesAreReserved() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        for (String name : Arrays.asList("__CPROVER_rounding_mode", "__CPROVER_architecture_int_width")) {
            NameCollisionException e = assertThrows(NameCollisionException.class,
                    () -> table.insert(Symbol.variable(name, name, Type.cInt(), loc(7))));
            assertEquals(name, e.getSymbolName());
            assertFalse(table.contains(name));
        }
        assertEquals(Fixtures.mainWithAssertFalse(), table);
        assertTrue(MachineModel.SYMBOL_NAMES.contains("__CPROVER_architecture_pointer_width"));
        assertEquals(21, MachineModel.SYMBOL_NAMES.size());
    }

    @Test
    void lookupOfAbsentName() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        assertFalse(table.lookup("y").isPresent());
        assertNull(table.get("y"));
        assertFalse(table.contains("y"));
    }

    @Test
    void symbolsAreInNameOrder() {
        SymbolTable table = SymbolTable.withMachineModel(MachineModel.X86_64);
        table.insert(Symbol.variable("b", "b", Type.cInt(), Location.NONE));
        table.insert(Symbol.variable("a", "a", Type.cInt(), Location.NONE));
        table.insert(Symbol.variable("c", "c", Type.cInt(), Location.NONE));
        assertArrayEquals(new Object[]{"a", "b", "c"}, table.names().toArray());
    }

    @Test
    void consumedTablesCannotBeUsed() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        SymbolTable copy = table.emptyCopy();
        table.consume();
        assertTrue(table.isConsumed());
        assertThrows(IllegalStateException.class, () -> table.lookup("main"));
        assertThrows(IllegalStateException.class, () -> table.insert(Symbol.variable("y", "y", Type.cInt(), loc(1))));
        assertThrows(IllegalStateException.class, table::consume);
        assertEquals(0, copy.size());
        assertEquals(MachineModel.X86_64, copy.getMachineModel());
    }

    @Test
    void extsFollowCopies() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        table.attachExt(CommonExts.PASS_TRACE, Collections.singletonList("identity"));
        table.attachExt(CommonExts.LOWERED, true);
        assertEquals(Arrays.asList(CommonExts.LOWERED, CommonExts.PASS_TRACE), Arrays.asList(table.extKeys().toArray()));

        SymbolTable copy = table.emptyCopy();
        assertEquals(true, copy.getExtOrThrow(CommonExts.LOWERED));
        copy.removeExt(CommonExts.LOWERED);
        assertFalse(copy.getExt(CommonExts.LOWERED).isPresent());
        assertTrue(table.getExt(CommonExts.LOWERED).isPresent());
        assertThrows(IllegalStateException.class, () -> copy.getExtOrThrow(CommonExts.RENAMED));
        assertThrows(IllegalArgumentException.class, () -> Ext.create(Boolean.class, "lowered"));
    }

    @Test
    void machineModelIsFixedOnceSymbolsArePresent() {
        SymbolTable table = Fixtures.mainWithAssertFalse();
        assertThrows(IllegalStateException.class, () -> table.setMachineModel(MachineModel.AARCH64));
    }

    @Test
    void machineModelsDiffer() {
        assertNotEquals(MachineModel.X86_64, MachineModel.AARCH64);
        assertTrue(Type.cChar().isSigned(MachineModel.X86_64));
        assertFalse(Type.cChar().isSigned(MachineModel.AARCH64));
        assertEquals(64, Type.sizeT().bitWidth(MachineModel.AARCH64));
    }
}
