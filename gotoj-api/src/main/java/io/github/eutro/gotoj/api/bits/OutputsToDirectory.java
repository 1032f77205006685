package io.github.eutro.gotoj.api.bits;

import io.github.eutro.gotoj.api.GotoCompiler;
import io.github.eutro.gotoj.api.events.EmitProgramEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * A bit which writes emitted programs to the given directory, as
 * {@code <name>.<extension>} for the format they were emitted in.
 * <p>
 * Program names must be plain file names: empty names, names containing {@code /} or
 * {@code \}, and the names {@code .} and {@code ..} are rejected.
 */
public class OutputsToDirectory implements Bit<Void> {
    private static final Logger LOGGER = Logger.getLogger(OutputsToDirectory.class.getName());

    private final Path directory;

    /**
     * Construct a {@link OutputsToDirectory} for outputting to the given directory.
     *
     * @param directory The directory to write programs to.
     */
    public OutputsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(GotoCompiler cc) {
        cc.lift().listen(EmitProgramEvent.class, evt -> {
            checkName(evt.name);
            Path file = directory.resolve(evt.name + "." + evt.format.getExtension());
            try {
                Files.createDirectories(directory);
                Files.write(file, evt.bytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            LOGGER.info(() -> "Wrote " + evt.bytes.length + " bytes to " + file);
        });
        return null;
    }

    static void checkName(String name) {
        if (name.isEmpty() || name.equals(".") || name.equals("..")
                || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("bad program name '" + name + "' for output to a directory");
        }
    }
}
