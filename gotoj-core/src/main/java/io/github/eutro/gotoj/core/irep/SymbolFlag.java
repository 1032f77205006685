package io.github.eutro.gotoj.core.irep;

import io.github.eutro.gotoj.core.error.MalformedTreeException;

import java.util.EnumSet;
import java.util.Set;

/**
 * The boolean classification flags of a symbol.
 * <p>
 * Each flag knows its bit in the packed binary representation, and its key in JSON.
 * Bit 6 is reserved for the verifier's {@code binding} flag, which is always clear.
 */
public enum SymbolFlag {
    WEAK(16, "isWeak"),
    /**
     * The symbol defines a type, rather than a value.
     */
    TYPE(15, "isType"),
    PROPERTY(14, "isProperty"),
    MACRO(13, "isMacro"),
    EXPORTED(12, "isExported"),
    INPUT(11, "isInput"),
    OUTPUT(10, "isOutput"),
    STATE_VAR(9, "isStateVar"),
    PARAMETER(8, "isParameter"),
    /**
     * The symbol was generated by the compiler.
     */
    AUXILIARY(7, "isAuxiliary"),
    LVALUE(5, "isLvalue"),
    STATIC_LIFETIME(4, "isStaticLifetime"),
    THREAD_LOCAL(3, "isThreadLocal"),
    FILE_LOCAL(2, "isFileLocal"),
    EXTERN(1, "isExtern"),
    VOLATILE(0, "isVolatile"),
    ;

    private static final int BINDING_BIT = 6;
    private static final int FLAG_BITS = 17;

    private final int bit;
    private final String jsonKey;

    SymbolFlag(int bit, String jsonKey) {
        this.bit = bit;
        this.jsonKey = jsonKey;
    }

    public int bit() {
        return bit;
    }

    public String jsonKey() {
        return jsonKey;
    }

    public static int pack(Set<SymbolFlag> flags) {
        int packed = 0;
        for (SymbolFlag flag : flags) {
            packed |= 1 << flag.bit;
        }
        return packed;
    }

    /**
     * Unpack flags from their binary representation.
     *
     * @param packed The packed flags.
     * @return The flags.
     * @throws MalformedTreeException If any bit that is not a flag is set.
     */
    public static EnumSet<SymbolFlag> unpack(long packed) {
        if ((packed >>> FLAG_BITS) != 0 || (packed & (1L << BINDING_BIT)) != 0) {
            throw new MalformedTreeException("invalid symbol flags 0x" + Long.toHexString(packed));
        }
        EnumSet<SymbolFlag> flags = EnumSet.noneOf(SymbolFlag.class);
        for (SymbolFlag flag : values()) {
            if ((packed & (1L << flag.bit)) != 0) flags.add(flag);
        }
        return flags;
    }
}
