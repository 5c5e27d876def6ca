package info.isaksson.erland.syscalls.core;

import info.isaksson.erland.syscalls.emitter.HeaderRenderer;
import info.isaksson.erland.syscalls.emitter.SyscallsJson;
import info.isaksson.erland.syscalls.emitter.TextReport;
import info.isaksson.erland.syscalls.extract.Diagnostics;
import info.isaksson.erland.syscalls.extract.SyscallExtractor;
import info.isaksson.erland.syscalls.extract.SyscallNumberParser;
import info.isaksson.erland.syscalls.io.DescriptorRepository;
import info.isaksson.erland.syscalls.io.FileMacroSource;
import info.isaksson.erland.syscalls.io.GccMacroSource;
import info.isaksson.erland.syscalls.io.MacroSource;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Core API for extracting the syscall table and rendering it.
 *
 * <p>The CLI uses this class instead of wiring the pipeline itself.</p>
 */
public final class SyscallExtractService {

    private static final Logger log = LoggerFactory.getLogger(SyscallExtractService.class);

    /**
     * Run extraction and render the result in {@code options.format}.
     *
     * @throws info.isaksson.erland.syscalls.extract.SyscallExtractionException if the syscall table is unavailable
     * @throws IOException if the descriptor source cannot be read at all
     */
    public SyscallExtractResult generate(SyscallExtractOptions options) throws IOException {
        if (options == null) options = new SyscallExtractOptions();

        Diagnostics diagnostics = new Diagnostics();
        MacroSource macros = macroSource(options);
        DescriptorRepository descriptors = options.descriptors == null
                ? new DescriptorRepository()
                : DescriptorRepository.load(options.descriptors, diagnostics);
        log.info("Loaded descriptors for {} headers", descriptors.size());
        log.debug("Headers with descriptors: {}", descriptors.headers());

        SyscallsContext ctx = new SyscallExtractor(macros, descriptors, options.headers,
                new SyscallNumberParser(options.syscallPrefix), diagnostics).extract();
        log.info("Found {} syscall definitions", ctx.syscalls.size());
        for (Syscall s : ctx.syscallsInOrder()) {
            log.debug("Syscall {} (#{}): {}", s.name, s.number,
                    s.hasFunction() ? "with function definition" : "without function definition");
        }

        OutputFormat format = options.format == null ? OutputFormat.JSON : options.format;
        return new SyscallExtractResult(ctx, diagnostics, format, render(ctx, format));
    }

    public String render(SyscallsContext ctx, OutputFormat format) throws IOException {
        if (ctx == null) throw new IllegalArgumentException("ctx must not be null");
        if (format == null) throw new IllegalArgumentException("format must not be null");
        switch (format) {
            case TEXT:
                return TextReport.render(ctx);
            case HEADER:
                return new HeaderRenderer().render(ctx);
            case JSON:
            default:
                return SyscallsJson.render(ctx);
        }
    }

    private static MacroSource macroSource(SyscallExtractOptions options) {
        if (options.macrosFile != null) {
            log.info("Using macro dump: {}", options.macrosFile);
            return new FileMacroSource(options.macrosFile);
        }
        log.info("Using GCC: {}", options.compiler);
        return new GccMacroSource(options.compiler);
    }
}
