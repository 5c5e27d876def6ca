package info.isaksson.erland.syscalls.core;

import info.isaksson.erland.syscalls.extract.Diagnostics;
import info.isaksson.erland.syscalls.model.SyscallsContext;

/** Extraction result container for programmatic usage. */
public final class SyscallExtractResult {
    public final SyscallsContext context;
    public final Diagnostics diagnostics;
    public final OutputFormat format;
    /** The context rendered in {@link #format}. */
    public final String content;

    SyscallExtractResult(SyscallsContext context, Diagnostics diagnostics, OutputFormat format, String content) {
        this.context = context;
        this.diagnostics = diagnostics;
        this.format = format;
        this.content = content;
    }
}
