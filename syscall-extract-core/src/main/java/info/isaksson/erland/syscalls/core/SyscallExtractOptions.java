package info.isaksson.erland.syscalls.core;

import info.isaksson.erland.syscalls.extract.SyscallNumberParser;
import info.isaksson.erland.syscalls.io.GccMacroSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options for one extraction run.
 *
 * <p>Mirrors the CLI flags in a structured form.</p>
 */
public final class SyscallExtractOptions {
    /** Compiler used to dump {@code sys/syscall.h} macros when {@link #macrosFile} is not set. */
    public String compiler = GccMacroSource.DEFAULT_COMPILER;

    /** Previously captured {@code gcc -E -dM} output; takes precedence over {@link #compiler}. */
    public Path macrosFile;

    /** Descriptor document or directory of documents. Null means no function declarations. */
    public Path descriptors;

    /** Headers searched for declarations, in priority order. Empty means the built-in list. */
    public List<String> headers = new ArrayList<>();

    public String syscallPrefix = SyscallNumberParser.DEFAULT_PREFIX;

    public OutputFormat format = OutputFormat.JSON;
}
