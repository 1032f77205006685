package io.github.eutro.gotoj.core.codec;

import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes a symbol table in the verifier's binary format.
 * <p>
 * Strings and ireps are numbered in the order they are first written; later occurrences
 * are written as just their number. A writer is used for a single table.
 *
 * @see GotoBinaryReader
 */
public class GotoBinaryWriter {
    private final OutputStream out;
    private final Map<String, Long> strings = new HashMap<>();
    private final Map<Irep, Long> ireps = new HashMap<>();

    public GotoBinaryWriter(@NotNull OutputStream out) {
        this.out = out;
    }

    /**
     * Write a whole table, with its header.
     *
     * @param table The table.
     * @throws IOException If the stream does.
     * @throws io.github.eutro.gotoj.core.error.UnknownTagException If an irep uses a tag outside the vocabulary.
     */
    public void writeTable(@NotNull IrepSymbolTable table) throws IOException {
        out.write(GotoBinaryReader.MAGIC);
        writeVarint(GotoBinaryReader.VERSION);
        writeVarint(table.size());
        for (IrepSymbol symbol : table.symbols()) {
            writeSymbol(symbol);
        }
        writeVarint(0); // functions
        out.flush();
    }

    private void writeSymbol(IrepSymbol symbol) throws IOException {
        writeIrep(symbol.getType());
        writeIrep(symbol.getValue());
        writeIrep(symbol.getLocation());
        writeString(symbol.getName());
        writeString(symbol.getModule());
        writeString(symbol.getBaseName());
        writeString(symbol.getMode());
        writeString(symbol.getPrettyName());
        out.write(0); // ordering
        writeVarint(SymbolFlag.pack(symbol.getFlags()));
    }

    void writeIrep(Irep irep) throws IOException {
        Long number = ireps.get(irep);
        if (number != null) {
            writeVarint(number);
            return;
        }
        Vocabulary.checkNode(irep);
        number = (long) ireps.size();
        ireps.put(irep, number);
        writeVarint(number);
        writeString(irep.id().text());
        for (Irep sub : irep.sub()) {
            out.write('S');
            writeIrep(sub);
        }
        writeNamed(irep.namedSub());
        writeNamed(irep.comments());
        out.write(0);
    }

    private void writeNamed(Map<IrepId, Irep> named) throws IOException {
        for (Map.Entry<IrepId, Irep> entry : named.entrySet()) {
            out.write('N');
            writeString(entry.getKey().text());
            writeIrep(entry.getValue());
        }
    }

    void writeString(String s) throws IOException {
        Long number = strings.get(s);
        if (number != null) {
            writeVarint(number);
            return;
        }
        number = (long) strings.size();
        strings.put(s, number);
        writeVarint(number);
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            if (b == 0 || b == '\\') out.write('\\');
            out.write(b);
        }
        out.write(0);
    }

    void writeVarint(long value) throws IOException {
        if (value < 0) throw new IllegalArgumentException("negative varint " + value);
        while (value >= 0x80) {
            out.write((int) (value & 0x7f) | 0x80);
            value >>>= 7;
        }
        out.write((int) value);
    }
}
