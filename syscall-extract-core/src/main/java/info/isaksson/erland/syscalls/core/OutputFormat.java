package info.isaksson.erland.syscalls.core;

import java.nio.file.Path;
import java.util.Locale;

/** Rendering targets and the file extension each one is written with. */
public enum OutputFormat {
    JSON("json", ".json"),
    TEXT("text", ".txt"),
    HEADER("header", ".h");

    public final String id;
    public final String extension;

    OutputFormat(String id, String extension) {
        this.id = id;
        this.extension = extension;
    }

    public static OutputFormat parse(String value) {
        if (value == null) throw new IllegalArgumentException("format is null");
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.id.equals(v)) return f;
        }
        throw new IllegalArgumentException("Unsupported output format: " + value + " (expected json|text|header)");
    }

    /** {@code out/syscalls.json} becomes {@code out/syscalls.h} for HEADER; a name without extension gains one. */
    public Path applyExtension(Path path) {
        if (path == null) throw new IllegalArgumentException("path is null");
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return path.resolveSibling(stem + extension);
    }
}
