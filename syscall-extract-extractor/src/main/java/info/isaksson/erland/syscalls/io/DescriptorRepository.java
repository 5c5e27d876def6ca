package info.isaksson.erland.syscalls.io;

import info.isaksson.erland.syscalls.extract.Diagnostics;
import info.isaksson.erland.syscalls.ir.HeaderUnit;
import info.isaksson.erland.syscalls.ir.IrJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Header units produced by the front-end parser, indexed by header name.
 *
 * <p>The source is either one descriptor document or a directory of {@code *.json}
 * documents, read in sorted relative-path order. A document that cannot be read or
 * parsed is logged and recorded, and the others are still loaded. When two units
 * describe the same header the later one wins.</p>
 */
public final class DescriptorRepository {

    private static final Logger log = LoggerFactory.getLogger(DescriptorRepository.class);

    private final Map<String, HeaderUnit> units = new LinkedHashMap<>();

    public DescriptorRepository() {}

    public DescriptorRepository(List<HeaderUnit> units) {
        if (units != null) units.forEach(this::add);
    }

    public static DescriptorRepository load(Path source, Diagnostics diagnostics) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(diagnostics, "diagnostics");

        DescriptorRepository repo = new DescriptorRepository();
        for (Path file : scan(source)) {
            try {
                IrJson.readUnits(file).forEach(repo::add);
            } catch (IOException e) {
                log.error("Could not read descriptors from {}: {}", file, e.getMessage());
                diagnostics.missingHeaders.add(file.getFileName() + " (unreadable)");
            }
        }
        log.debug("Loaded {} header units from {}", repo.units.size(), source);
        return repo;
    }

    /** Descriptor files under {@code source}, or {@code source} itself when it is a file. */
    static List<Path> scan(Path source) throws IOException {
        if (Files.isRegularFile(source)) return List.of(source);
        if (!Files.isDirectory(source)) throw new IOException("No such descriptor file or directory: " + source);

        try (Stream<Path> stream = Files.walk(source)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .forEach(out::add);
            out.sort(Comparator.comparing(p -> source.relativize(p).toString().replace("\\", "/")));
            return out;
        }
    }

    public void add(HeaderUnit unit) {
        if (unit == null || unit.header == null || unit.header.isBlank()) {
            log.warn("Ignoring header unit without a header name");
            return;
        }
        if (units.put(unit.header, unit) != null) {
            log.warn("Header {} described more than once, keeping the last unit", unit.header);
        }
    }

    public Optional<HeaderUnit> find(String header) {
        return Optional.ofNullable(units.get(header));
    }

    /** Header names in load order. */
    public List<String> headers() {
        return new ArrayList<>(units.keySet());
    }

    public int size() {
        return units.size();
    }
}
