package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.irep.IrepId;
import org.jetbrains.annotations.Nullable;

/**
 * The unary operators of {@link ExprValue.UnOp}.
 */
public enum UnaryOperator {
    BITNOT(IrepId.BITNOT),
    BITREVERSE(IrepId.BITREVERSE),
    BSWAP(IrepId.BSWAP),
    COUNT_LEADING_ZEROS(IrepId.COUNT_LEADING_ZEROS),
    COUNT_TRAILING_ZEROS(IrepId.COUNT_TRAILING_ZEROS),
    IS_DYNAMIC_OBJECT(IrepId.IS_DYNAMIC_OBJECT),
    NOT(IrepId.NOT),
    OBJECT_SIZE(IrepId.OBJECT_SIZE),
    POINTER_OBJECT(IrepId.POINTER_OBJECT),
    POINTER_OFFSET(IrepId.POINTER_OFFSET),
    POPCOUNT(IrepId.POPCOUNT),
    UNARY_MINUS(IrepId.UNARY_MINUS),
    ;

    private final IrepId id;

    UnaryOperator(IrepId id) {
        this.id = id;
    }

    public IrepId id() {
        return id;
    }

    public static @Nullable UnaryOperator fromId(IrepId id) {
        for (UnaryOperator op : values()) {
            if (op.id == id) return op;
        }
        return null;
    }
}
