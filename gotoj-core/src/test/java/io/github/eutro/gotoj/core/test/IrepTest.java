package io.github.eutro.gotoj.core.test;

import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class IrepTest {
    @Test
    void internIsIdempotent() {
        assertSame(IrepId.intern("some_identifier"), IrepId.intern("some_identifier"));
        assertSame(IrepId.BOOL, IrepId.intern("bool"));
        assertTrue(IrepId.BOOL.isVocabulary());
        assertFalse(IrepId.intern("some_identifier").isVocabulary());
        assertTrue(IrepId.C_SOURCE_LOCATION.isComment());
        assertFalse(IrepId.TYPE.isComment());
    }

    @Test
    void commentsAreKeptApart() {
        Irep irep = Irep.builder(IrepId.SYMBOL)
                .named(IrepId.IDENTIFIER, Irep.justString("x"))
                .named(IrepId.C_LVALUE, Irep.one())
                .build();
        assertEquals(1, irep.namedSub().size());
        assertEquals(1, irep.comments().size());
        assertEquals(Irep.one(), irep.require(IrepId.C_LVALUE));
        Irep stripped = irep.without(IrepId.C_LVALUE);
        assertTrue(stripped.comments().isEmpty());
        assertNotEquals(irep, stripped);
        assertSame(stripped, stripped.without(IrepId.C_LVALUE));
    }

    @Test
    void structuralEquality() {
        Irep a = Irep.builder(IrepId.POINTER).sub(Irep.just(IrepId.BOOL)).namedInt(IrepId.WIDTH, 64).build();
        Irep b = Irep.builder(IrepId.POINTER).sub(Irep.just(IrepId.BOOL)).namedInt(IrepId.WIDTH, 64).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, a.with(IrepId.WIDTH, Irep.justInt(32)));
        assertSame(Irep.nil(), Irep.just(IrepId.NIL));
    }

    @Test
    void missingChildrenAreMalformed() {
        Irep irep = Irep.just(IrepId.POINTER);
        assertThrows(MalformedTreeException.class, () -> irep.require(IrepId.WIDTH));
        assertThrows(MalformedTreeException.class, () -> irep.sub(0));
        assertThrows(MalformedTreeException.class, () -> irep.expectArity(1));
    }

    @Test
    void flagsPackMostSignificantFirst() {
        assertEquals(1 << 16, SymbolFlag.pack(EnumSet.of(SymbolFlag.WEAK)));
        assertEquals(1 << 15 | 1, SymbolFlag.pack(EnumSet.of(SymbolFlag.TYPE, SymbolFlag.VOLATILE)));
        assertEquals(EnumSet.of(SymbolFlag.LVALUE, SymbolFlag.STATE_VAR), SymbolFlag.unpack(1 << 5 | 1 << 9));
        EnumSet<SymbolFlag> all = EnumSet.allOf(SymbolFlag.class);
        assertEquals(all, SymbolFlag.unpack(SymbolFlag.pack(all)));
    }

    @Test
    void unknownFlagBitsAreMalformed() {
        assertThrows(MalformedTreeException.class, () -> SymbolFlag.unpack(1 << 6));
        assertThrows(MalformedTreeException.class, () -> SymbolFlag.unpack(1L << 17));
    }
}
