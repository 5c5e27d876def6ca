package info.isaksson.erland.syscalls.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** A macro dump captured earlier with {@code gcc -E -dM}, served for any header. */
public final class FileMacroSource implements MacroSource {

    private static final Logger log = LoggerFactory.getLogger(FileMacroSource.class);

    private final Path file;

    public FileMacroSource(Path file) {
        if (file == null) throw new IllegalArgumentException("file is null");
        this.file = file;
    }

    @Override
    public Optional<String> expandMacros(String header) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Could not read macro dump {} for {}: {}", file, header, e.getMessage());
            return Optional.empty();
        }
    }
}
