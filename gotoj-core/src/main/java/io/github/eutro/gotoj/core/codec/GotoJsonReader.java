package io.github.eutro.gotoj.core.codec;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;
import io.github.eutro.gotoj.core.error.FormatVersionException;
import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.jetbrains.annotations.NotNull;

import java.io.EOFException;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Map;

import static io.github.eutro.gotoj.core.codec.GotoJsonWriter.*;

/**
 * Reads a symbol table written by {@link GotoJsonWriter}.
 * <p>
 * Input that is not JSON, or not an object with a {@code symbolTable} object, is
 * not a goto symbol table at all and fails with a {@link FormatVersionException}.
 * Problems inside the table fail with a {@link MalformedTreeException}, including an object
 * that repeats a key. Failures of the underlying reader are thrown as they are.
 */
public class GotoJsonReader {
    private final Reader in;

    public GotoJsonReader(@NotNull Reader in) {
        this.in = in;
    }

    /**
     * Read a whole table, which must be all that remains of the reader.
     *
     * @return The table.
     * @throws IOException If the reader does.
     * @throws FormatVersionException If the input is not a JSON symbol table.
     * @throws io.github.eutro.gotoj.core.error.StructuralException If the contents are malformed.
     */
    public IrepSymbolTable readTable() throws IOException {
        JsonElement root;
        JsonReader reader = new JsonReader(in);
        try {
            root = parse(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new FormatVersionException("not a JSON symbol table: trailing data after the root value");
            }
        } catch (MalformedJsonException | EOFException e) {
            throw new FormatVersionException("not a JSON symbol table: " + e.getMessage(), e);
        }
        if (!root.isJsonObject()
                || !root.getAsJsonObject().has(SYMBOL_TABLE)
                || !root.getAsJsonObject().get(SYMBOL_TABLE).isJsonObject()) {
            throw new FormatVersionException("not a JSON symbol table, expected an object with '"
                    + SYMBOL_TABLE + "'");
        }
        IrepSymbolTable table = new IrepSymbolTable();
        for (Map.Entry<String, JsonElement> entry : root.getAsJsonObject()
                .getAsJsonObject(SYMBOL_TABLE)
                .entrySet()) {
            try {
                IrepSymbol symbol = readSymbol(object(entry.getValue(), "symbol"));
                if (!symbol.getName().equals(entry.getKey())) {
                    throw new MalformedTreeException("symbol named '" + symbol.getName()
                            + "' stored under '" + entry.getKey() + "'");
                }
                table.add(symbol);
            } catch (MalformedTreeException e) {
                e.withSymbolName(entry.getKey());
                throw e;
            }
        }
        return table;
    }

    private static JsonElement parse(JsonReader reader) throws IOException {
        switch (reader.peek()) {
            case BEGIN_ARRAY: {
                JsonArray array = new JsonArray();
                reader.beginArray();
                while (reader.hasNext()) array.add(parse(reader));
                reader.endArray();
                return array;
            }
            case BEGIN_OBJECT: {
                JsonObject obj = new JsonObject();
                reader.beginObject();
                while (reader.hasNext()) {
                    String key = reader.nextName();
                    if (obj.has(key)) throw new MalformedTreeException("duplicate key '" + key + "'");
                    obj.add(key, parse(reader));
                }
                reader.endObject();
                return obj;
            }
            case STRING:
                return new JsonPrimitive(reader.nextString());
            case NUMBER:
                return new JsonPrimitive(new BigDecimal(reader.nextString()));
            case BOOLEAN:
                return new JsonPrimitive(reader.nextBoolean());
            case NULL:
                reader.nextNull();
                return JsonNull.INSTANCE;
            default:
                throw new MalformedJsonException("unexpected " + reader.peek() + " at " + reader.getPath());
        }
    }

    private IrepSymbol readSymbol(JsonObject obj) {
        EnumSet<SymbolFlag> flags = EnumSet.noneOf(SymbolFlag.class);
        for (SymbolFlag flag : SymbolFlag.values()) {
            JsonElement element = obj.get(flag.jsonKey());
            if (element != null && bool(element, flag.jsonKey())) flags.add(flag);
        }
        return new IrepSymbol(
                readIrep(field(obj, "type")),
                readIrep(field(obj, "value")),
                readIrep(field(obj, "location")),
                string(field(obj, "name"), "name"),
                string(field(obj, "module"), "module"),
                string(field(obj, "baseName"), "baseName"),
                string(field(obj, "prettyName"), "prettyName"),
                string(field(obj, "mode"), "mode"),
                flags
        );
    }

    private Irep readIrep(JsonElement element) {
        JsonObject obj = object(element, "irep");
        Irep.Builder builder = Irep.builder(IrepId.intern(string(field(obj, ID), ID)));
        JsonElement sub = obj.get(SUB);
        if (sub != null) {
            if (!sub.isJsonArray()) throw new MalformedTreeException("'" + SUB + "' is not an array");
            JsonArray array = sub.getAsJsonArray();
            for (JsonElement child : array) {
                builder.sub(readIrep(child));
            }
        }
        JsonElement namedSub = obj.get(NAMED_SUB);
        if (namedSub != null) {
            for (Map.Entry<String, JsonElement> entry : object(namedSub, NAMED_SUB).entrySet()) {
                builder.named(IrepId.intern(entry.getKey()), readIrep(entry.getValue()));
            }
        }
        Irep irep = builder.build();
        Vocabulary.checkNode(irep);
        return irep;
    }

    private static JsonElement field(JsonObject obj, String name) {
        JsonElement element = obj.get(name);
        if (element == null) throw new MalformedTreeException("missing field '" + name + "'");
        return element;
    }

    private static JsonObject object(JsonElement element, String what) {
        if (!element.isJsonObject()) throw new MalformedTreeException(what + " is not an object");
        return element.getAsJsonObject();
    }

    private static String string(JsonElement element, String what) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new MalformedTreeException("'" + what + "' is not a string");
        }
        return element.getAsString();
    }

    private static boolean bool(JsonElement element, String what) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new MalformedTreeException("'" + what + "' is not a boolean");
        }
        return element.getAsBoolean();
    }
}
