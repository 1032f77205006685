package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.irep.IrepId;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * The binary operators of {@link ExprValue.BinOp}.
 */
public enum BinaryOperator {
    AND(IrepId.AND, Kind.LOGICAL),
    ASHR(IrepId.ASHR, Kind.ARITHMETIC),
    BITAND(IrepId.BITAND, Kind.ARITHMETIC),
    BITNAND(IrepId.BITNAND, Kind.ARITHMETIC),
    BITOR(IrepId.BITOR, Kind.ARITHMETIC),
    BITXOR(IrepId.BITXOR, Kind.ARITHMETIC),
    DIV(IrepId.DIV, Kind.ARITHMETIC),
    EQUAL(IrepId.EQUAL, Kind.RELATIONAL),
    GE(IrepId.GE, Kind.RELATIONAL),
    GT(IrepId.GT, Kind.RELATIONAL),
    IEEE_FLOAT_EQUAL(IrepId.IEEE_FLOAT_EQUAL, Kind.RELATIONAL),
    IEEE_FLOAT_NOTEQUAL(IrepId.IEEE_FLOAT_NOTEQUAL, Kind.RELATIONAL),
    IMPLIES(IrepId.IMPLIES, Kind.LOGICAL),
    LE(IrepId.LE, Kind.RELATIONAL),
    LSHR(IrepId.LSHR, Kind.ARITHMETIC),
    LT(IrepId.LT, Kind.RELATIONAL),
    MINUS(IrepId.MINUS, Kind.ARITHMETIC),
    MOD(IrepId.MOD, Kind.ARITHMETIC),
    MULT(IrepId.MULT, Kind.ARITHMETIC),
    NOTEQUAL(IrepId.NOTEQUAL, Kind.RELATIONAL),
    OR(IrepId.OR, Kind.LOGICAL),
    OVERFLOW_MINUS(IrepId.OVERFLOW_MINUS, Kind.RELATIONAL),
    OVERFLOW_MULT(IrepId.OVERFLOW_MULT, Kind.RELATIONAL),
    OVERFLOW_PLUS(IrepId.OVERFLOW_PLUS, Kind.RELATIONAL),
    PLUS(IrepId.PLUS, Kind.ARITHMETIC),
    ROL(IrepId.ROL, Kind.ARITHMETIC),
    ROR(IrepId.ROR, Kind.ARITHMETIC),
    SHL(IrepId.SHL, Kind.ARITHMETIC),
    XOR(IrepId.XOR, Kind.LOGICAL),
    ;

    private static final Map<IrepId, BinaryOperator> BY_ID = new HashMap<>();

    static {
        for (BinaryOperator op : values()) BY_ID.put(op.id, op);
    }

    private final IrepId id;
    private final Kind kind;

    BinaryOperator(IrepId id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    public IrepId id() {
        return id;
    }

    /**
     * Get whether the result of this operator is a boolean, regardless of its operands.
     *
     * @return Whether this operator produces a boolean.
     */
    public boolean producesBool() {
        return kind != Kind.ARITHMETIC;
    }

    public static @Nullable BinaryOperator fromId(IrepId id) {
        return BY_ID.get(id);
    }

    private enum Kind {
        ARITHMETIC,
        LOGICAL,
        RELATIONAL,
    }
}
