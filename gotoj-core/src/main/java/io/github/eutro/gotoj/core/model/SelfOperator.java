package io.github.eutro.gotoj.core.model;

import io.github.eutro.gotoj.core.irep.IrepId;
import org.jetbrains.annotations.Nullable;

/**
 * Operators that update their operand, as in {@code x++}.
 */
public enum SelfOperator {
    POSTDECREMENT(IrepId.POSTDECREMENT, false, false),
    POSTINCREMENT(IrepId.POSTINCREMENT, true, false),
    PREDECREMENT(IrepId.PREDECREMENT, false, true),
    PREINCREMENT(IrepId.PREINCREMENT, true, true),
    ;

    private final IrepId id;
    private final boolean increment;
    private final boolean prefix;

    SelfOperator(IrepId id, boolean increment, boolean prefix) {
        this.id = id;
        this.increment = increment;
        this.prefix = prefix;
    }

    public IrepId id() {
        return id;
    }

    public boolean isIncrement() {
        return increment;
    }

    /**
     * Get whether the expression evaluates to the updated value, rather than the original one.
     *
     * @return Whether this is a prefix operator.
     */
    public boolean isPrefix() {
        return prefix;
    }

    public static @Nullable SelfOperator fromId(IrepId id) {
        for (SelfOperator op : values()) {
            if (op.id == id) return op;
        }
        return null;
    }
}
