package io.github.eutro.gotoj.core.irep;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An interned irep identifier.
 * <p>
 * Every identifier with the same text is the same object, so identifiers are
 * compared by identity. Identifiers are either part of the <i>vocabulary</i>,
 * the fixed set of node kinds and attribute keys known to the verifier at
 * {@link #VOCABULARY_VERSION}, or free-form payloads such as symbol names,
 * file names and numbers, which can only appear as childless nodes.
 * <p>
 * The vocabulary is built when this class is initialised and never changes.
 */
public final class IrepId {
    /**
     * The goto-binary format version whose vocabulary this class describes.
     */
    public static final int VOCABULARY_VERSION = 5;

    private static final Map<String, IrepId> VOCABULARY = new LinkedHashMap<>();
    private static final Map<String, IrepId> PAYLOADS = new ConcurrentHashMap<>();

    // Generic identifiers and payloads
    public static final IrepId EMPTY_STRING = known("");
    public static final IrepId NIL = known("nil");
    public static final IrepId ID0 = known("0");
    public static final IrepId ID1 = known("1");
    public static final IrepId TRUE = known("true");
    public static final IrepId FALSE = known("false");
    public static final IrepId NULL = known("NULL");
    public static final IrepId INFINITY = known("infinity");
    public static final IrepId C = known("C");

    // Attribute keys
    public static final IrepId TYPE = known("type");
    public static final IrepId VALUE = known("value");
    public static final IrepId IDENTIFIER = known("identifier");
    public static final IrepId STATEMENT = known("statement");
    public static final IrepId WIDTH = known("width");
    public static final IrepId F = known("f");
    public static final IrepId SIZE = known("size");
    public static final IrepId TAG = known("tag");
    public static final IrepId COMPONENTS = known("components");
    public static final IrepId COMPONENT_NAME = known("component_name");
    public static final IrepId NAME = known("name");
    public static final IrepId PRETTY_NAME = known("pretty_name");
    public static final IrepId PARAMETERS = known("parameters");
    public static final IrepId RETURN_TYPE = known("return_type");
    public static final IrepId ELLIPSIS = known("ellipsis");
    public static final IrepId INCOMPLETE = known("incomplete");
    public static final IrepId ARGUMENTS = known("arguments");
    public static final IrepId DESTINATION = known("destination");
    public static final IrepId LABEL = known("label");
    public static final IrepId DEFAULT = known("default");
    public static final IrepId BITS_PER_BYTE = known("bits_per_byte");
    public static final IrepId FILE = known("file");
    public static final IrepId LINE = known("line");
    public static final IrepId COLUMN = known("column");
    public static final IrepId FUNCTION = known("function");
    public static final IrepId COMMENT = known("comment");
    public static final IrepId PROPERTY_CLASS = known("property_class");

    // Comments, which do not affect the semantics of a node
    public static final IrepId C_SOURCE_LOCATION = known("#source_location");
    public static final IrepId C_C_TYPE = known("#c_type");
    public static final IrepId C_TYPEDEF = known("#typedef");
    public static final IrepId C_IS_PADDING = known("#is_padding");
    public static final IrepId C_IDENTIFIER = known("#identifier");
    public static final IrepId C_BASE_NAME = known("#base_name");
    public static final IrepId C_LVALUE = known("#lvalue");
    public static final IrepId C_BOUNDS_CHECK = known("#bounds_check");
    public static final IrepId C_FLEXIBLE_ARRAY_MEMBER = known("#flexible_array_member");

    // Types
    public static final IrepId ARRAY = known("array");
    public static final IrepId BOOL = known("bool");
    public static final IrepId C_BIT_FIELD = known("c_bit_field");
    public static final IrepId C_BOOL = known("c_bool");
    public static final IrepId SIGNEDBV = known("signedbv");
    public static final IrepId UNSIGNEDBV = known("unsignedbv");
    public static final IrepId CODE = known("code");
    public static final IrepId CONSTRUCTOR = known("constructor");
    public static final IrepId FLOATBV = known("floatbv");
    public static final IrepId EMPTY = known("empty");
    public static final IrepId POINTER = known("pointer");
    public static final IrepId STRUCT = known("struct");
    public static final IrepId UNION = known("union");
    public static final IrepId STRUCT_TAG = known("struct_tag");
    public static final IrepId UNION_TAG = known("union_tag");
    public static final IrepId VECTOR = known("vector");
    public static final IrepId PARAMETER = known("parameter");
    public static final IrepId CHAR = known("char");
    public static final IrepId SIGNED_INT = known("signed_int");
    public static final IrepId SIGNED_LONG_INT = known("signed_long_int");
    public static final IrepId SIZE_T = known("size_t");
    public static final IrepId SSIZE_T = known("ssize_t");
    public static final IrepId FLOAT = known("float");
    public static final IrepId DOUBLE = known("double");

    // Expressions
    public static final IrepId CONSTANT = known("constant");
    public static final IrepId SYMBOL = known("symbol");
    public static final IrepId ADDRESS_OF = known("address_of");
    public static final IrepId ARRAY_OF = known("array_of");
    public static final IrepId SIDE_EFFECT = known("side_effect");
    public static final IrepId ASSIGN = known("assign");
    public static final IrepId DEREFERENCE = known("dereference");
    public static final IrepId EMPTY_UNION = known("empty_union");
    public static final IrepId FUNCTION_CALL = known("function_call");
    public static final IrepId IF = known("if");
    public static final IrepId INDEX = known("index");
    public static final IrepId MEMBER = known("member");
    public static final IrepId NONDET = known("nondet");
    public static final IrepId POSTINCREMENT = known("postincrement");
    public static final IrepId POSTDECREMENT = known("postdecrement");
    public static final IrepId PREINCREMENT = known("preincrement");
    public static final IrepId PREDECREMENT = known("predecrement");
    public static final IrepId STATEMENT_EXPRESSION = known("statement_expression");
    public static final IrepId STRING_CONSTANT = known("string_constant");
    public static final IrepId TYPECAST = known("typecast");
    public static final IrepId BYTE_EXTRACT_LITTLE_ENDIAN = known("byte_extract_little_endian");
    public static final IrepId BYTE_EXTRACT_BIG_ENDIAN = known("byte_extract_big_endian");
    public static final IrepId FORALL = known("forall");
    public static final IrepId EXISTS = known("exists");
    public static final IrepId TUPLE = known("tuple");

    // Operators
    public static final IrepId AND = known("and");
    public static final IrepId ASHR = known("ashr");
    public static final IrepId BITAND = known("bitand");
    public static final IrepId BITOR = known("bitor");
    public static final IrepId BITXOR = known("bitxor");
    public static final IrepId BITNAND = known("bitnand");
    public static final IrepId DIV = known("/");
    public static final IrepId EQUAL = known("=");
    public static final IrepId GE = known(">=");
    public static final IrepId GT = known(">");
    public static final IrepId IEEE_FLOAT_EQUAL = known("ieee_float_equal");
    public static final IrepId IEEE_FLOAT_NOTEQUAL = known("ieee_float_notequal");
    public static final IrepId IMPLIES = known("=>");
    public static final IrepId LE = known("<=");
    public static final IrepId LSHR = known("lshr");
    public static final IrepId LT = known("<");
    public static final IrepId MINUS = known("-");
    public static final IrepId MOD = known("mod");
    public static final IrepId MULT = known("*");
    public static final IrepId NOTEQUAL = known("notequal");
    public static final IrepId OR = known("or");
    public static final IrepId OVERFLOW_MINUS = known("overflow--");
    public static final IrepId OVERFLOW_MULT = known("overflow-*");
    public static final IrepId OVERFLOW_PLUS = known("overflow-+");
    public static final IrepId PLUS = known("+");
    public static final IrepId ROL = known("rol");
    public static final IrepId ROR = known("ror");
    public static final IrepId SHL = known("shl");
    public static final IrepId XOR = known("xor");
    public static final IrepId BITNOT = known("bitnot");
    public static final IrepId BSWAP = known("bswap");
    public static final IrepId BITREVERSE = known("bitreverse");
    public static final IrepId COUNT_LEADING_ZEROS = known("count_leading_zeros");
    public static final IrepId COUNT_TRAILING_ZEROS = known("count_trailing_zeros");
    public static final IrepId IS_DYNAMIC_OBJECT = known("is_dynamic_object");
    public static final IrepId NOT = known("not");
    public static final IrepId OBJECT_SIZE = known("object_size");
    public static final IrepId POINTER_OBJECT = known("pointer_object");
    public static final IrepId POINTER_OFFSET = known("pointer_offset");
    public static final IrepId POPCOUNT = known("popcount");
    public static final IrepId UNARY_MINUS = known("unary-");

    // Statements
    public static final IrepId BLOCK = known("block");
    public static final IrepId BREAK = known("break");
    public static final IrepId CONTINUE = known("continue");
    public static final IrepId DEAD = known("dead");
    public static final IrepId DECL = known("decl");
    public static final IrepId EXPRESSION = known("expression");
    public static final IrepId FOR = known("for");
    public static final IrepId GOTO = known("goto");
    public static final IrepId IFTHENELSE = known("ifthenelse");
    public static final IrepId RETURN = known("return");
    public static final IrepId SKIP = known("skip");
    public static final IrepId SWITCH = known("switch");
    public static final IrepId SWITCH_CASE = known("switch_case");
    public static final IrepId WHILE = known("while");
    public static final IrepId ASSERT = known("assert");
    public static final IrepId ASSUME = known("assume");
    public static final IrepId ATOMIC_BEGIN = known("atomic_begin");
    public static final IrepId ATOMIC_END = known("atomic_end");

    private final String text;
    private final boolean inVocabulary;

    private IrepId(String text, boolean inVocabulary) {
        this.text = text;
        this.inVocabulary = inVocabulary;
    }

    private static IrepId known(String text) {
        IrepId id = new IrepId(text, true);
        if (VOCABULARY.put(text, id) != null) {
            throw new IllegalStateException("duplicate vocabulary entry: " + text);
        }
        return id;
    }

    /**
     * Intern the given text.
     * <p>
     * This is idempotent: the same text always produces the same object.
     *
     * @param text The text.
     * @return The identifier.
     */
    @Contract(pure = true)
    public static @NotNull IrepId intern(@NotNull String text) {
        IrepId known = VOCABULARY.get(text);
        if (known != null) return known;
        return PAYLOADS.computeIfAbsent(text, t -> new IrepId(t, false));
    }

    public static @NotNull IrepId fromInt(long value) {
        return intern(Long.toString(value));
    }

    public static @NotNull IrepId fromInt(BigInteger value) {
        return intern(value.toString());
    }

    /**
     * Get the identifier for the hexadecimal bit pattern of {@code value},
     * truncated to two's complement at {@code width} bits.
     *
     * @param value The value.
     * @param width The number of bits.
     * @return The identifier.
     */
    public static @NotNull IrepId fromBitPattern(BigInteger value, int width) {
        BigInteger bits = value.signum() < 0 ? value.add(BigInteger.ONE.shiftLeft(width)) : value;
        return intern(bits.toString(16).toUpperCase());
    }

    /**
     * Get every identifier in the vocabulary.
     *
     * @return The vocabulary, in declaration order.
     */
    public static Collection<IrepId> vocabulary() {
        return Collections.unmodifiableCollection(VOCABULARY.values());
    }

    public @NotNull String text() {
        return text;
    }

    /**
     * Get whether this identifier is part of the verifier's vocabulary.
     *
     * @return Whether this is a known identifier.
     */
    public boolean isVocabulary() {
        return inVocabulary;
    }

    /**
     * Get whether this identifier names a comment, which the verifier
     * ignores when comparing nodes.
     *
     * @return Whether this is a comment key.
     */
    public boolean isComment() {
        return text.startsWith("#");
    }

    /**
     * Parse this identifier as a decimal integer.
     *
     * @return The integer.
     * @throws NumberFormatException If it is not one.
     */
    public BigInteger toBigInteger() {
        return new BigInteger(text);
    }

    /**
     * Parse this identifier as a hexadecimal bit pattern.
     *
     * @return The unsigned value of the bit pattern.
     * @throws NumberFormatException If it is not one.
     * @see #fromBitPattern(BigInteger, int)
     */
    public BigInteger bitPatternValue() {
        return new BigInteger(text, 16);
    }

    @Override
    public String toString() {
        return text;
    }
}
