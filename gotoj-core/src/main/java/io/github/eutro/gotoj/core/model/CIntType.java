package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.irep.IrepId;
import org.jetbrains.annotations.Nullable;

/**
 * The C integer types whose width depends on the {@link MachineModel}.
 */
public enum CIntType {
    /**
     * {@code _Bool}, encoded as a {@code c_bool}.
     */
    BOOL(null),
    /**
     * {@code char}, whose signedness depends on the machine.
     */
    CHAR(IrepId.CHAR),
    INT(IrepId.SIGNED_INT),
    LONG_INT(IrepId.SIGNED_LONG_INT),
    SIZE_T(IrepId.SIZE_T),
    SSIZE_T(IrepId.SSIZE_T),
    ;

    @Nullable
    private final IrepId cType;

    CIntType(@Nullable IrepId cType) {
        this.cType = cType;
    }

    /**
     * Get the {@code #c_type} this type is annotated with in an irep.
     *
     * @return The C type, or null for {@link #BOOL}.
     */
    public @Nullable IrepId cType() {
        return cType;
    }

    public static @Nullable CIntType fromCType(IrepId cType) {
        for (CIntType value : values()) {
            if (value.cType == cType) return value;
        }
        return null;
    }

    public int width(MachineModel mm) {
        switch (this) {
            case BOOL:
                return mm.getBoolWidth();
            case CHAR:
                return mm.getCharWidth();
            case INT:
                return mm.getIntWidth();
            case LONG_INT:
                return mm.getLongIntWidth();
            case SIZE_T:
            case SSIZE_T:
                return mm.getPointerWidth();
            default:
                throw new AssertionError(this);
        }
    }

    public boolean isSigned(MachineModel mm) {
        switch (this) {
            case BOOL:
            case SIZE_T:
                return false;
            case CHAR:
                return !mm.isCharUnsigned();
            case INT:
            case LONG_INT:
            case SSIZE_T:
                return true;
            default:
                throw new AssertionError(this);
        }
    }
}
