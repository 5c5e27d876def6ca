package info.isaksson.erland.syscalls.io;

import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.PumpStreamHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Runs {@code <gcc> -E -dM -include <header> -} on an empty translation unit and
 * returns what the compiler printed.
 */
public final class GccMacroSource implements MacroSource {

    public static final String DEFAULT_COMPILER = "gcc";

    private static final Logger log = LoggerFactory.getLogger(GccMacroSource.class);
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final String compiler;

    public GccMacroSource() {
        this(DEFAULT_COMPILER);
    }

    public GccMacroSource(String compiler) {
        if (compiler == null || compiler.isBlank()) throw new IllegalArgumentException("compiler is empty");
        this.compiler = compiler;
    }

    @Override
    public Optional<String> expandMacros(String header) {
        if (header == null) throw new IllegalArgumentException("header is null");

        CommandLine cmdLine = new CommandLine(compiler);
        cmdLine.addArgument("-E");
        cmdLine.addArgument("-dM");
        cmdLine.addArgument("-include");
        cmdLine.addArgument(header, false);
        cmdLine.addArgument("-");

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        DefaultExecutor executor = DefaultExecutor.builder().get();
        executor.setStreamHandler(new PumpStreamHandler(out, err, new ByteArrayInputStream(new byte[0])));
        executor.setWatchdog(ExecuteWatchdog.builder().setTimeout(TIMEOUT).get());

        try {
            executor.execute(cmdLine);
            return Optional.of(out.toString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // ExecuteException (non-zero exit) is an IOException too.
            log.error("Error expanding macros in {}: {}", header, e.getMessage());
            String stderr = err.toString(StandardCharsets.UTF_8).trim();
            if (!stderr.isEmpty()) log.debug("{} stderr: {}", compiler, stderr);
            return Optional.empty();
        }
    }
}
