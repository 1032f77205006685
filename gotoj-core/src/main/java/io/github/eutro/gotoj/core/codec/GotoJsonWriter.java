package io.github.eutro.gotoj.core.codec;

import com.google.gson.stream.JsonWriter;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;

/**
 * Writes a symbol table as JSON, in the shape the verifier's JSON symbol table reader expects.
 *
 * @see GotoJsonReader
 */
public class GotoJsonWriter {
    static final String SYMBOL_TABLE = "symbolTable";
    static final String ID = "id";
    static final String SUB = "sub";
    static final String NAMED_SUB = "namedSub";

    private final JsonWriter writer;

    public GotoJsonWriter(@NotNull Writer out) {
        writer = new JsonWriter(out);
        writer.setIndent(" ");
    }

    public void writeTable(@NotNull IrepSymbolTable table) throws IOException {
        writer.beginObject();
        writer.name(SYMBOL_TABLE).beginObject();
        for (IrepSymbol symbol : table.symbols()) {
            writer.name(symbol.getName());
            writeSymbol(symbol);
        }
        writer.endObject();
        writer.endObject();
        writer.flush();
    }

    private void writeSymbol(IrepSymbol symbol) throws IOException {
        writer.beginObject();
        writer.name("type");
        writeIrep(symbol.getType());
        writer.name("value");
        writeIrep(symbol.getValue());
        writer.name("location");
        writeIrep(symbol.getLocation());
        writer.name("name").value(symbol.getName());
        writer.name("module").value(symbol.getModule());
        writer.name("baseName").value(symbol.getBaseName());
        writer.name("prettyName").value(symbol.getPrettyName());
        writer.name("mode").value(symbol.getMode());
        for (SymbolFlag flag : SymbolFlag.values()) {
            writer.name(flag.jsonKey()).value(symbol.is(flag));
        }
        writer.endObject();
    }

    private void writeIrep(Irep irep) throws IOException {
        Vocabulary.checkNode(irep);
        writer.beginObject();
        writer.name(ID).value(irep.id().text());
        if (!irep.sub().isEmpty()) {
            writer.name(SUB).beginArray();
            for (Irep sub : irep.sub()) {
                writeIrep(sub);
            }
            writer.endArray();
        }
        if (!irep.namedSub().isEmpty() || !irep.comments().isEmpty()) {
            writer.name(NAMED_SUB).beginObject();
            writeNamed(irep.namedSub());
            writeNamed(irep.comments());
            writer.endObject();
        }
        writer.endObject();
    }

    private void writeNamed(Map<IrepId, Irep> named) throws IOException {
        for (Map.Entry<IrepId, Irep> entry : named.entrySet()) {
            writer.name(entry.getKey().text());
            writeIrep(entry.getValue());
        }
    }
}
