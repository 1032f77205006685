package io.github.eutro.gotoj.core.codec;

import io.github.eutro.gotoj.core.error.FormatVersionException;
import io.github.eutro.gotoj.core.error.MalformedTreeException;
import io.github.eutro.gotoj.core.irep.Irep;
import io.github.eutro.gotoj.core.irep.IrepId;
import io.github.eutro.gotoj.core.irep.IrepSymbol;
import io.github.eutro.gotoj.core.irep.IrepSymbolTable;
import io.github.eutro.gotoj.core.irep.SymbolFlag;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads a symbol table in the verifier's binary format.
 * <p>
 * The header is checked before anything else is read. Strings and ireps must be numbered in the
 * order they first appear, and the subtrees of an irep must all come before its named subtrees.
 *
 * @see GotoBinaryWriter
 */
public class GotoBinaryReader {
    /**
     * The bytes every goto binary starts with.
     */
    public static final byte[] MAGIC = {0x7f, 'G', 'B', 'F'};
    /**
     * The only format version supported.
     */
    public static final int VERSION = IrepId.VOCABULARY_VERSION;

    private final InputStream in;
    private final Map<Long, String> strings = new HashMap<>();
    private final Map<Long, Irep> ireps = new HashMap<>();
    private long nextIrep;

    public GotoBinaryReader(@NotNull InputStream in) {
        this.in = in;
    }

    /**
     * Read a whole table, which must be all that remains of the stream.
     *
     * @return The table.
     * @throws IOException If the stream does.
     * @throws FormatVersionException If the header is wrong.
     * @throws io.github.eutro.gotoj.core.error.StructuralException If the contents are malformed.
     */
    public IrepSymbolTable readTable() throws IOException {
        readHeader();
        long count = readVarint();
        IrepSymbolTable table = new IrepSymbolTable();
        for (long i = 0; i < count; i++) {
            table.add(readSymbol());
        }
        long functions = readVarint();
        if (functions != 0) {
            throw new MalformedTreeException("goto binary has " + functions
                    + " function bodies, only symbol tables are supported");
        }
        if (in.read() != -1) throw new MalformedTreeException("trailing data after symbol table");
        return table;
    }

    private void readHeader() throws IOException {
        for (int i = 0; i < MAGIC.length; i++) {
            int b = in.read();
            if (b != (MAGIC[i] & 0xff)) {
                throw new FormatVersionException("not a goto binary, bad magic at byte " + i);
            }
        }
        long version;
        try {
            version = readVarint();
        } catch (MalformedTreeException e) {
            throw new FormatVersionException("missing goto binary version", e);
        }
        if (version != VERSION) {
            throw new FormatVersionException("unsupported goto binary version " + version
                    + ", only version " + VERSION + " is supported");
        }
    }

    private IrepSymbol readSymbol() throws IOException {
        Irep type = readIrep();
        Irep value = readIrep();
        Irep location = readIrep();
        String name = readString();
        String module = readString();
        String baseName = readString();
        String mode = readString();
        String prettyName = readString();
        readByte(); // ordering
        long flags = readVarint();
        try {
            return new IrepSymbol(type, value, location, name, module, baseName, prettyName, mode,
                    SymbolFlag.unpack(flags));
        } catch (MalformedTreeException e) {
            e.withSymbolName(name);
            throw e;
        }
    }

    Irep readIrep() throws IOException {
        long number = readVarint();
        Irep known = ireps.get(number);
        if (known != null) return known;
        checkNew("irep", number, nextIrep++);
        Irep.Builder builder = Irep.builder(IrepId.intern(readString()));
        boolean named = false;
        while (true) {
            int marker = readByte();
            if (marker == 'S') {
                if (named) throw new MalformedTreeException("irep " + number + " has a subtree after a named subtree");
                builder.sub(readIrep());
            } else if (marker == 'N') {
                named = true;
                IrepId key = IrepId.intern(readString());
                builder.named(key, readIrep());
            } else if (marker == 0) {
                break;
            } else {
                throw new MalformedTreeException("unexpected byte 0x" + Integer.toHexString(marker) + " in irep");
            }
        }
        Irep irep = builder.build();
        Vocabulary.checkNode(irep);
        ireps.put(number, irep);
        return irep;
    }

    String readString() throws IOException {
        long number = readVarint();
        String known = strings.get(number);
        if (known != null) return known;
        checkNew("string", number, strings.size());
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        while (true) {
            int b = readByte();
            if (b == 0) break;
            if (b == '\\') b = readByte();
            bytes.write(b);
        }
        String s = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
        strings.put(number, s);
        return s;
    }

    private static void checkNew(String what, long number, long expected) {
        if (number != expected) {
            throw new MalformedTreeException("expected new " + what + " number " + expected + ", got " + number);
        }
    }

    long readVarint() throws IOException {
        long value = 0;
        for (int shift = 0; ; shift += 7) {
            if (shift >= 64) throw new MalformedTreeException("varint too long");
            int b = readByte();
            value |= (long) (b & 0x7f) << shift;
            if ((b & 0x80) == 0) return value;
        }
    }

    private int readByte() throws IOException {
        int b = in.read();
        if (b == -1) throw new MalformedTreeException("unexpected end of goto binary");
        return b;
    }
}
