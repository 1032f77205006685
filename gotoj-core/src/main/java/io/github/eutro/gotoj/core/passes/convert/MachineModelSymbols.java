package io.github.eutro.gotoj.core.passes.convert;

import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import io.github.eutro.gotoj.core.model.Expr;
import io.github.eutro.gotoj.core.model.Location;
import io.github.eutro.gotoj.core.model.MachineModel;
import io.github.eutro.gotoj.core.model.Symbol;
import io.github.eutro.gotoj.core.model.SymbolValue;
import io.github.eutro.gotoj.core.model.Type;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Stores a {@link MachineModel} in a serialized symbol table, as the
 * {@code __CPROVER_architecture_*} symbols the verifier reads its configuration from.
 */
public class MachineModelSymbols {
    /**
     * The prefix of the architecture symbols.
     */
    public static final String PREFIX = "__CPROVER_architecture_";
    /**
     * The symbol holding the rounding mode.
     */
    public static final String ROUNDING_MODE = "__CPROVER_rounding_mode";

    private static final Map<String, Field<?>> FIELDS = new LinkedHashMap<>();

    static {
        intField("alignment", MachineModel::getAlignment, MachineModel.Builder::setAlignment);
        intField("bool_width", MachineModel::getBoolWidth, MachineModel.Builder::setBoolWidth);
        boolField("char_is_unsigned", MachineModel::isCharUnsigned, MachineModel.Builder::setCharIsUnsigned);
        intField("char_width", MachineModel::getCharWidth, MachineModel.Builder::setCharWidth);
        intField("double_width", MachineModel::getDoubleWidth, MachineModel.Builder::setDoubleWidth);
        intField("float_width", MachineModel::getFloatWidth, MachineModel.Builder::setFloatWidth);
        intField("int_width", MachineModel::getIntWidth, MachineModel.Builder::setIntWidth);
        boolField("is_big_endian", MachineModel::isBigEndian, MachineModel.Builder::setBigEndian);
        intField("long_double_width", MachineModel::getLongDoubleWidth, MachineModel.Builder::setLongDoubleWidth);
        intField("long_int_width", MachineModel::getLongIntWidth, MachineModel.Builder::setLongIntWidth);
        intField("long_long_int_width", MachineModel::getLongLongIntWidth, MachineModel.Builder::setLongLongIntWidth);
        intField("memory_operand_size", MachineModel::getMemoryOperandSize, MachineModel.Builder::setMemoryOperandSize);
        boolField("NULL_is_zero", MachineModel::isNullZero, MachineModel.Builder::setNullIsZero);
        intField("pointer_width", MachineModel::getPointerWidth, MachineModel.Builder::setPointerWidth);
        intField("short_int_width", MachineModel::getShortIntWidth, MachineModel.Builder::setShortIntWidth);
        intField("single_width", MachineModel::getSingleWidth, MachineModel.Builder::setSingleWidth);
        boolField("wchar_t_is_unsigned", MachineModel::isWcharTUnsigned, MachineModel.Builder::setWcharTIsUnsigned);
        intField("wchar_t_width", MachineModel::getWcharTWidth, MachineModel.Builder::setWcharTWidth);
        intField("word_size", MachineModel::getWordSize, MachineModel.Builder::setWordSize);
        FIELDS.put(PREFIX + "arch", new Field<>(
                PREFIX + "arch",
                mm -> Expr.stringConstant(mm.getArchitecture()),
                irep -> irep.require(IrepId.VALUE).id().text(),
                MachineModel.Builder::setArchitecture));
        FIELDS.put(ROUNDING_MODE, new Field<>(
                ROUNDING_MODE,
                mm -> Expr.intConstant(mm.getRoundingMode().ordinal(), Type.cInt()),
                irep -> MachineModel.RoundingMode.fromOrdinal(intBits(irep)),
                MachineModel.Builder::setRoundingMode));
        if (!FIELDS.keySet().equals(MachineModel.SYMBOL_NAMES)) {
            throw new IllegalStateException("machine model fields " + FIELDS.keySet()
                    + " do not match " + MachineModel.SYMBOL_NAMES);
        }
    }

    private static void intField(String name,
                                 Function<MachineModel, Integer> getter,
                                 BiConsumer<MachineModel.Builder, Integer> setter) {
        FIELDS.put(PREFIX + name, new Field<>(
                PREFIX + name,
                mm -> Expr.intConstant(getter.apply(mm), Type.unsignedInt(32)),
                MachineModelSymbols::intBits,
                setter));
    }

    private static void boolField(String name,
                                  Function<MachineModel, Boolean> getter,
                                  BiConsumer<MachineModel.Builder, Boolean> setter) {
        FIELDS.put(PREFIX + name, new Field<>(
                PREFIX + name,
                mm -> Expr.cBoolConstant(getter.apply(mm)),
                irep -> constantBits(irep).signum() != 0,
                setter));
    }

    private static BigInteger constantBits(Irep irep) {
        if (irep.id() != IrepId.CONSTANT) {
            throw new MalformedTreeException("expected a constant, got '" + irep.id() + "'");
        }
        try {
            return irep.require(IrepId.VALUE).id().bitPatternValue();
        } catch (NumberFormatException e) {
            throw new MalformedTreeException("bad constant '" + irep.require(IrepId.VALUE).id() + "'", e);
        }
    }

    private static int intBits(Irep irep) {
        BigInteger bits = constantBits(irep);
        if (bits.bitLength() > 31) throw new MalformedTreeException("value " + bits + " out of range");
        return bits.intValue();
    }

    /**
     * Get whether a symbol name is one of the machine model symbols.
     *
     * @param name The symbol name.
     * @return Whether it holds part of the machine model.
     */
    public static boolean isMachineModelSymbol(@NotNull String name) {
        return MachineModel.SYMBOL_NAMES.contains(name);
    }

    /**
     * Encode a machine model as serialized symbols.
     *
     * @param mm The machine model.
     * @return The symbols.
     */
    public static List<IrepSymbol> toSymbols(@NotNull MachineModel mm) {
        ToIrep toIrep = new ToIrep(mm);
        List<IrepSymbol> symbols = new ArrayList<>(FIELDS.size());
        for (Field<?> field : FIELDS.values()) {
            Expr value = field.encode.apply(mm);
            symbols.add(toIrep.symbol(Symbol.builder(field.name, value.getType())
                    .setValue(SymbolValue.of(value))
                    .setLocation(Location.NONE)
                    .setBaseName(field.name)
                    .setPrettyName(field.name)
                    .addFlag(SymbolFlag.STATIC_LIFETIME)
                    .addFlag(SymbolFlag.STATE_VAR)
                    .build()));
        }
        return symbols;
    }

    /**
     * Read the machine model back from serialized symbols.
     *
     * @param table The table.
     * @return The machine model, or null if the table has none of its symbols.
     * @throws MalformedTreeException If only some of the symbols are present, or any are ill-formed.
     */
    public static @Nullable MachineModel fromSymbols(@NotNull IrepSymbolTable table) {
        MachineModel.Builder builder = MachineModel.builder();
        List<String> missing = new ArrayList<>();
        int found = 0;
        for (Field<?> field : FIELDS.values()) {
            IrepSymbol symbol = table.get(field.name);
            if (symbol == null) {
                missing.add(field.name);
                continue;
            }
            found++;
            try {
                field.read(builder, symbol.getValue());
            } catch (MalformedTreeException e) {
                e.withSymbolName(field.name);
                throw e;
            }
        }
        if (found == 0) return null;
        if (!missing.isEmpty()) {
            throw new MalformedTreeException("incomplete machine model, missing " + missing);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedTreeException("bad machine model: " + e.getMessage(), e);
        }
    }

    private static class Field<T> {
        final String name;
        final Function<MachineModel, Expr> encode;
        final Function<Irep, T> decode;
        final BiConsumer<MachineModel.Builder, T> setter;

        Field(String name, Function<MachineModel, Expr> encode, Function<Irep, T> decode,
              BiConsumer<MachineModel.Builder, T> setter) {
            this.name = name;
            this.encode = encode;
            this.decode = decode;
            this.setter = setter;
        }

        void read(MachineModel.Builder builder, Irep value) {
            T decoded;
            try {
                decoded = decode.apply(value);
            } catch (IllegalArgumentException e) {
                throw new MalformedTreeException("bad value for " + name + ": " + e.getMessage(), e);
            }
            setter.accept(builder, decoded);
        }
    }
}
