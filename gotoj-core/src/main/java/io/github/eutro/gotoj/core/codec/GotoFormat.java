package io.github.eutro.gotoj.core.codec;

import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.model.SymbolTable;
import io.github.eutro.gotoj.core.passes.IRPass;
import io.github.eutro.gotoj.core.passes.convert.GotoToIrep;
import io.github.eutro.gotoj.core.passes.convert.IrepToGoto;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * The formats symbol tables can be stored in.
 * <p>
 * Both formats hold the same information, so a table can be {@link #convert(byte[], GotoFormat, GotoFormat) converted}
 * between them without loss. Encoding only reads a table; it does not consume it.
 */
public enum GotoFormat {
    /**
     * The verifier's native binary format.
     */
    BINARY("goto") {
        @Override
        public void write(@NotNull IrepSymbolTable table, @NotNull OutputStream out) throws IOException {
            new GotoBinaryWriter(out).writeTable(table);
        }

        @Override
        public IrepSymbolTable read(@NotNull InputStream in) throws IOException {
            return new GotoBinaryReader(in).readTable();
        }
    },
    /**
     * A JSON symbol table.
     */
    JSON("json") {
        @Override
        public void write(@NotNull IrepSymbolTable table, @NotNull OutputStream out) throws IOException {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            new GotoJsonWriter(writer).writeTable(table);
            writer.flush();
        }

        @Override
        public IrepSymbolTable read(@NotNull InputStream in) throws IOException {
            return new GotoJsonReader(new InputStreamReader(in, StandardCharsets.UTF_8)).readTable();
        }
    },
    ;

    private final String extension;

    GotoFormat(String extension) {
        this.extension = extension;
    }

    /**
     * Get the file extension conventionally used for this format, without a dot.
     *
     * @return The extension.
     */
    public String getExtension() {
        return extension;
    }

    /**
     * Write a serialized table.
     *
     * @param table The table.
     * @param out   The stream to write to.
     * @throws IOException If the stream does.
     * @throws io.github.eutro.gotoj.core.error.UnknownTagException If the table uses a tag outside the vocabulary.
     */
    public abstract void write(@NotNull IrepSymbolTable table, @NotNull OutputStream out) throws IOException;

    /**
     * Read a serialized table.
     *
     * @param in The stream to read from.
     * @return The table.
     * @throws IOException If the stream does.
     * @throws io.github.eutro.gotoj.core.error.FormatVersionException If the input is not in this format,
     *                                                                  or in an unsupported version of it.
     * @throws io.github.eutro.gotoj.core.error.StructuralException     If the input is malformed.
     */
    public abstract IrepSymbolTable read(@NotNull InputStream in) throws IOException;

    /**
     * Encode a symbol table in this format.
     *
     * @param table The table, which is left usable.
     * @return The encoded bytes.
     */
    public byte[] encode(@NotNull SymbolTable table) {
        return GotoToIrep.INSTANCE.then(this::encodeIreps).run(table);
    }

    /**
     * Decode a symbol table in this format.
     *
     * @param bytes The encoded bytes.
     * @return The table.
     */
    public SymbolTable decode(byte @NotNull [] bytes) {
        IRPass<byte[], IrepSymbolTable> decoder = this::decodeIreps;
        return decoder.then(IrepToGoto.INSTANCE).run(bytes);
    }

    public byte[] encodeIreps(@NotNull IrepSymbolTable table) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(table, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    public IrepSymbolTable decodeIreps(byte @NotNull [] bytes) {
        try {
            return read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Re-encode a table from one format in another, without building the typed model.
     *
     * @param bytes The encoded table.
     * @param from  The format it is in.
     * @param to    The format to convert it to.
     * @return The converted bytes.
     */
    public static byte[] convert(byte @NotNull [] bytes, @NotNull GotoFormat from, @NotNull GotoFormat to) {
        return to.encodeIreps(from.decodeIreps(bytes));
    }
}
