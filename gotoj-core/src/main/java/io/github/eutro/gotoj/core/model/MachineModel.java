package io.github.eutro.gotoj.core.model;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The properties of the target machine that the layout and encoding of a program depend on.
 * <p>
 * Widths are in bits. Instances are immutable; use {@link #builder()} or
 * {@link #toBuilder()} to make new ones.
 */
public final class MachineModel {
    /**
     * A 64-bit x86 machine, as on Linux.
     */
    public static final MachineModel X86_64 = builder()
            .setArchitecture("x86_64")
            .setAlignment(1)
            .setBoolWidth(8)
            .setCharIsUnsigned(false)
            .setCharWidth(8)
            .setDoubleWidth(64)
            .setFloatWidth(32)
            .setIntWidth(32)
            .setBigEndian(false)
            .setLongDoubleWidth(128)
            .setLongIntWidth(64)
            .setLongLongIntWidth(64)
            .setMemoryOperandSize(4)
            .setNullIsZero(true)
            .setPointerWidth(64)
            .setRoundingMode(RoundingMode.TO_NEAREST)
            .setShortIntWidth(16)
            .setSingleWidth(32)
            .setWcharTIsUnsigned(false)
            .setWcharTWidth(32)
            .setWordSize(32)
            .build();

    /**
     * A 64-bit ARM machine running Linux.
     */
    public static final MachineModel AARCH64 = X86_64.toBuilder()
            .setArchitecture("arm64")
            .setCharIsUnsigned(true)
            .setWcharTIsUnsigned(true)
            .build();

    /**
     * The names of the symbols a machine model is stored in when a table is serialized.
     * No other symbol may have one of these names.
     */
    public static final Set<String> SYMBOL_NAMES = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(
            "__CPROVER_architecture_alignment",
            "__CPROVER_architecture_arch",
            "__CPROVER_architecture_bool_width",
            "__CPROVER_architecture_char_is_unsigned",
            "__CPROVER_architecture_char_width",
            "__CPROVER_architecture_double_width",
            "__CPROVER_architecture_float_width",
            "__CPROVER_architecture_int_width",
            "__CPROVER_architecture_is_big_endian",
            "__CPROVER_architecture_long_double_width",
            "__CPROVER_architecture_long_int_width",
            "__CPROVER_architecture_long_long_int_width",
            "__CPROVER_architecture_memory_operand_size",
            "__CPROVER_architecture_NULL_is_zero",
            "__CPROVER_architecture_pointer_width",
            "__CPROVER_architecture_short_int_width",
            "__CPROVER_architecture_single_width",
            "__CPROVER_architecture_wchar_t_is_unsigned",
            "__CPROVER_architecture_wchar_t_width",
            "__CPROVER_architecture_word_size",
            "__CPROVER_rounding_mode"
    )));

    private final String architecture;
    private final int alignment;
    private final int boolWidth;
    private final boolean charIsUnsigned;
    private final int charWidth;
    private final int doubleWidth;
    private final int floatWidth;
    private final int intWidth;
    private final boolean bigEndian;
    private final int longDoubleWidth;
    private final int longIntWidth;
    private final int longLongIntWidth;
    private final int memoryOperandSize;
    private final boolean nullIsZero;
    private final int pointerWidth;
    private final RoundingMode roundingMode;
    private final int shortIntWidth;
    private final int singleWidth;
    private final boolean wcharTIsUnsigned;
    private final int wcharTWidth;
    private final int wordSize;

    private MachineModel(Builder b) {
        architecture = b.architecture;
        alignment = b.alignment;
        boolWidth = b.boolWidth;
        charIsUnsigned = b.charIsUnsigned;
        charWidth = b.charWidth;
        doubleWidth = b.doubleWidth;
        floatWidth = b.floatWidth;
        intWidth = b.intWidth;
        bigEndian = b.bigEndian;
        longDoubleWidth = b.longDoubleWidth;
        longIntWidth = b.longIntWidth;
        longLongIntWidth = b.longLongIntWidth;
        memoryOperandSize = b.memoryOperandSize;
        nullIsZero = b.nullIsZero;
        pointerWidth = b.pointerWidth;
        roundingMode = b.roundingMode;
        shortIntWidth = b.shortIntWidth;
        singleWidth = b.singleWidth;
        wcharTIsUnsigned = b.wcharTIsUnsigned;
        wcharTWidth = b.wcharTWidth;
        wordSize = b.wordSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.architecture = architecture;
        b.alignment = alignment;
        b.boolWidth = boolWidth;
        b.charIsUnsigned = charIsUnsigned;
        b.charWidth = charWidth;
        b.doubleWidth = doubleWidth;
        b.floatWidth = floatWidth;
        b.intWidth = intWidth;
        b.bigEndian = bigEndian;
        b.longDoubleWidth = longDoubleWidth;
        b.longIntWidth = longIntWidth;
        b.longLongIntWidth = longLongIntWidth;
        b.memoryOperandSize = memoryOperandSize;
        b.nullIsZero = nullIsZero;
        b.pointerWidth = pointerWidth;
        b.roundingMode = roundingMode;
        b.shortIntWidth = shortIntWidth;
        b.singleWidth = singleWidth;
        b.wcharTIsUnsigned = wcharTIsUnsigned;
        b.wcharTWidth = wcharTWidth;
        b.wordSize = wordSize;
        return b;
    }

    public String getArchitecture() {
        return architecture;
    }

    public int getAlignment() {
        return alignment;
    }

    public int getBoolWidth() {
        return boolWidth;
    }

    public boolean isCharUnsigned() {
        return charIsUnsigned;
    }

    public int getCharWidth() {
        return charWidth;
    }

    public int getDoubleWidth() {
        return doubleWidth;
    }

    public int getFloatWidth() {
        return floatWidth;
    }

    public int getIntWidth() {
        return intWidth;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }

    public int getLongDoubleWidth() {
        return longDoubleWidth;
    }

    public int getLongIntWidth() {
        return longIntWidth;
    }

    public int getLongLongIntWidth() {
        return longLongIntWidth;
    }

    public int getMemoryOperandSize() {
        return memoryOperandSize;
    }

    public boolean isNullZero() {
        return nullIsZero;
    }

    public int getPointerWidth() {
        return pointerWidth;
    }

    public RoundingMode getRoundingMode() {
        return roundingMode;
    }

    public int getShortIntWidth() {
        return shortIntWidth;
    }

    public int getSingleWidth() {
        return singleWidth;
    }

    public boolean isWcharTUnsigned() {
        return wcharTIsUnsigned;
    }

    public int getWcharTWidth() {
        return wcharTWidth;
    }

    public int getWordSize() {
        return wordSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MachineModel that = (MachineModel) o;
        return architecture.equals(that.architecture) &&
                alignment == that.alignment &&
                boolWidth == that.boolWidth &&
                charIsUnsigned == that.charIsUnsigned &&
                charWidth == that.charWidth &&
                doubleWidth == that.doubleWidth &&
                floatWidth == that.floatWidth &&
                intWidth == that.intWidth &&
                bigEndian == that.bigEndian &&
                longDoubleWidth == that.longDoubleWidth &&
                longIntWidth == that.longIntWidth &&
                longLongIntWidth == that.longLongIntWidth &&
                memoryOperandSize == that.memoryOperandSize &&
                nullIsZero == that.nullIsZero &&
                pointerWidth == that.pointerWidth &&
                roundingMode.equals(that.roundingMode) &&
                shortIntWidth == that.shortIntWidth &&
                singleWidth == that.singleWidth &&
                wcharTIsUnsigned == that.wcharTIsUnsigned &&
                wcharTWidth == that.wcharTWidth &&
                wordSize == that.wordSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(architecture, alignment, boolWidth, charIsUnsigned, charWidth, doubleWidth, floatWidth, intWidth, bigEndian, longDoubleWidth, longIntWidth, longLongIntWidth, memoryOperandSize, nullIsZero, pointerWidth, roundingMode, shortIntWidth, singleWidth, wcharTIsUnsigned, wcharTWidth, wordSize);
    }

    @Override
    public String toString() {
        return "MachineModel{" + architecture + ", " + pointerWidth + "-bit, "
                + (bigEndian ? "big" : "little") + "-endian}";
    }

    /**
     * The floating point rounding mode, numbered as the verifier numbers them.
     */
    public enum RoundingMode {
        TO_NEAREST,
        DOWNWARD,
        UPWARD,
        TOWARDS_ZERO,
        ;

        public static RoundingMode fromOrdinal(int ordinal) {
            RoundingMode[] values = values();
            if (ordinal < 0 || ordinal >= values.length) {
                throw new IllegalArgumentException("no rounding mode " + ordinal);
            }
            return values[ordinal];
        }
    }

    public static class Builder {
        private String architecture;
        private int alignment;
        private int boolWidth;
        private boolean charIsUnsigned;
        private int charWidth;
        private int doubleWidth;
        private int floatWidth;
        private int intWidth;
        private boolean bigEndian;
        private int longDoubleWidth;
        private int longIntWidth;
        private int longLongIntWidth;
        private int memoryOperandSize;
        private boolean nullIsZero;
        private int pointerWidth;
        private RoundingMode roundingMode;
        private int shortIntWidth;
        private int singleWidth;
        private boolean wcharTIsUnsigned;
        private int wcharTWidth;
        private int wordSize;

        private Builder() {
            architecture = "unknown";
            roundingMode = RoundingMode.TO_NEAREST;
        }

        public Builder setArchitecture(@NotNull String architecture) {
            this.architecture = architecture;
            return this;
        }

        public Builder setAlignment(int alignment) {
            this.alignment = alignment;
            return this;
        }

        public Builder setBoolWidth(int boolWidth) {
            this.boolWidth = boolWidth;
            return this;
        }

        public Builder setCharIsUnsigned(boolean charIsUnsigned) {
            this.charIsUnsigned = charIsUnsigned;
            return this;
        }

        public Builder setCharWidth(int charWidth) {
            this.charWidth = charWidth;
            return this;
        }

        public Builder setDoubleWidth(int doubleWidth) {
            this.doubleWidth = doubleWidth;
            return this;
        }

        public Builder setFloatWidth(int floatWidth) {
            this.floatWidth = floatWidth;
            return this;
        }

        public Builder setIntWidth(int intWidth) {
            this.intWidth = intWidth;
            return this;
        }

        public Builder setBigEndian(boolean bigEndian) {
            this.bigEndian = bigEndian;
            return this;
        }

        public Builder setLongDoubleWidth(int longDoubleWidth) {
            this.longDoubleWidth = longDoubleWidth;
            return this;
        }

        public Builder setLongIntWidth(int longIntWidth) {
            this.longIntWidth = longIntWidth;
            return this;
        }

        public Builder setLongLongIntWidth(int longLongIntWidth) {
            this.longLongIntWidth = longLongIntWidth;
            return this;
        }

        public Builder setMemoryOperandSize(int memoryOperandSize) {
            this.memoryOperandSize = memoryOperandSize;
            return this;
        }

        public Builder setNullIsZero(boolean nullIsZero) {
            this.nullIsZero = nullIsZero;
            return this;
        }

        public Builder setPointerWidth(int pointerWidth) {
            this.pointerWidth = pointerWidth;
            return this;
        }

        public Builder setRoundingMode(@NotNull RoundingMode roundingMode) {
            this.roundingMode = roundingMode;
            return this;
        }

        public Builder setShortIntWidth(int shortIntWidth) {
            this.shortIntWidth = shortIntWidth;
            return this;
        }

        public Builder setSingleWidth(int singleWidth) {
            this.singleWidth = singleWidth;
            return this;
        }

        public Builder setWcharTIsUnsigned(boolean wcharTIsUnsigned) {
            this.wcharTIsUnsigned = wcharTIsUnsigned;
            return this;
        }

        public Builder setWcharTWidth(int wcharTWidth) {
            this.wcharTWidth = wcharTWidth;
            return this;
        }

        public Builder setWordSize(int wordSize) {
            this.wordSize = wordSize;
            return this;
        }

        /**
         * Build the machine model.
         *
         * @return The model.
         * @throws IllegalArgumentException If the architecture or rounding mode is unset,
         *                                  or any type width is not positive.
         */
        public MachineModel build() {
            if (architecture == null) throw new IllegalArgumentException("architecture not set");
            if (roundingMode == null) throw new IllegalArgumentException("rounding mode not set");
            positive("bool_width", boolWidth);
            positive("char_width", charWidth);
            positive("double_width", doubleWidth);
            positive("float_width", floatWidth);
            positive("int_width", intWidth);
            positive("long_double_width", longDoubleWidth);
            positive("long_int_width", longIntWidth);
            positive("long_long_int_width", longLongIntWidth);
            positive("pointer_width", pointerWidth);
            positive("short_int_width", shortIntWidth);
            positive("single_width", singleWidth);
            positive("wchar_t_width", wcharTWidth);
            positive("word_size", wordSize);
            return new MachineModel(this);
        }

        private static void positive(String what, int width) {
            if (width <= 0) throw new IllegalArgumentException(what + " must be positive, got " + width);
        }
    }
}
