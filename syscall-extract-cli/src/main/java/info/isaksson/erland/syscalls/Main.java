package info.isaksson.erland.syscalls;

import ch.qos.logback.classic.Level;
import info.isaksson.erland.syscalls.core.OutputFormat;
import info.isaksson.erland.syscalls.core.SyscallExtractOptions;
import info.isaksson.erland.syscalls.core.SyscallExtractResult;
import info.isaksson.erland.syscalls.core.SyscallExtractService;
import info.isaksson.erland.syscalls.extract.SyscallExtractionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CLI entrypoint: extracts the syscall table of the host toolchain and writes it as
 * JSON, a text report or a C header.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final SyscallExtractService SERVICE = new SyscallExtractService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        applyLogLevel(parsed.logLevel);

        log.info("Starting syscall extraction");

        final SyscallExtractResult res;
        try {
            res = SERVICE.generate(toCoreOptions(parsed));
        } catch (SyscallExtractionException ex) {
            log.error("Failed to extract syscall definitions", ex);
            return 1;
        } catch (IOException ex) {
            log.error("Could not read descriptors: {}", ex.getMessage());
            return 1;
        }

        try {
            writeOutput(res.content, parsed.output, res.format);
        } catch (IOException ex) {
            System.err.println("Error: could not write output: " + parsed.output);
            System.err.println(ex.getMessage());
            return 2;
        }

        if (!res.diagnostics.isEmpty()) {
            log.warn("{} declarations recovered or skipped, {} headers without descriptors",
                    res.diagnostics.recovered.size() + res.diagnostics.skipped.size(),
                    res.diagnostics.missingHeaders.size());
        }
        log.info("Successfully processed syscall definitions");
        return 0;
    }

    private static SyscallExtractOptions toCoreOptions(CliArgs parsed) {
        SyscallExtractOptions o = new SyscallExtractOptions();
        o.compiler = parsed.gcc;
        o.macrosFile = parsed.macros == null ? null : Paths.get(parsed.macros).toAbsolutePath().normalize();
        o.descriptors = parsed.descriptors == null ? null : Paths.get(parsed.descriptors).toAbsolutePath().normalize();
        o.headers = new ArrayList<>(parsed.headers);
        o.format = parsed.format;
        return o;
    }

    /** {@code -} writes to stdout; any other path gets the extension of {@code format}. */
    static Path writeOutput(String content, String output, OutputFormat format) throws IOException {
        if ("-".equals(output)) {
            System.out.print(content);
            System.out.flush();
            log.info("Wrote output to stdout");
            return null;
        }
        Path target = format.applyExtension(Paths.get(output)).toAbsolutePath().normalize();
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.info("Wrote output to {}", target);
        return target;
    }

    static void applyLogLevel(String level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(toLogbackLevel(level));
        }
    }

    static Level toLogbackLevel(String level) {
        switch (level) {
            case "debug":
                return Level.DEBUG;
            case "warning":
                return Level.WARN;
            case "error":
            case "critical":
                return Level.ERROR;
            case "info":
            default:
                return Level.INFO;
        }
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        static final List<String> LOG_LEVELS = List.of("debug", "info", "warning", "error", "critical");

        boolean help = false;
        String logLevel = "info";
        String gcc = "gcc";
        String macros;
        String descriptors;
        final List<String> headers = new ArrayList<>();
        String output = "syscalls.json";
        OutputFormat format = OutputFormat.JSON;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --header=<name>
                if (a.startsWith("--header=")) {
                    out.headers.add(a.substring("--header=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--log-level":
                        out.logLevel = parseLogLevel(requireValue(args, ++i, "--log-level"));
                        break;
                    case "--gcc":
                        out.gcc = requireValue(args, ++i, "--gcc");
                        break;
                    case "--macros":
                        out.macros = requireValue(args, ++i, "--macros");
                        break;
                    case "--descriptors":
                        out.descriptors = requireValue(args, ++i, "--descriptors");
                        break;
                    case "--header":
                        out.headers.add(requireValue(args, ++i, "--header"));
                        break;
                    case "--output":
                    case "-o":
                        out.output = requireValue(args, ++i, a);
                        break;
                    case "--format":
                        out.format = OutputFormat.parse(requireValue(args, ++i, "--format"));
                        break;
                    default:
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        throw new IllegalArgumentException("Unexpected extra argument: " + a);
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            // "-" alone is a valid value (stdout for --output)
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static String parseLogLevel(String v) {
            String s = v.trim().toLowerCase(Locale.ROOT);
            if (!LOG_LEVELS.contains(s)) {
                throw new IllegalArgumentException("Invalid log level: " + v + " (expected " + String.join("|", LOG_LEVELS) + ")");
            }
            return s;
        }

        static void printHelp() {
            System.out.println(
                    "syscall-extract\n" +
                    "\n" +
                    "Extract syscall information from Linux headers.\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar syscall-extract.jar [--macros <file>] [--descriptors <file|dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --log-level <level>    debug | info | warning | error | critical (default: info)\n" +
                    "  --gcc <path>           Path to GCC binary (default: gcc)\n" +
                    "  --macros <file>        Captured 'gcc -E -dM' output for sys/syscall.h.\n" +
                    "                         Takes precedence over --gcc.\n" +
                    "  --descriptors <path>   Declaration descriptor JSON file, or a directory of them.\n" +
                    "                         Without it only syscall numbers are extracted.\n" +
                    "  --header <name>        Header to search for declarations (repeatable, in priority\n" +
                    "                         order). Also supports --header=<name>.\n" +
                    "                         Default: the built-in POSIX header list.\n" +
                    "  -o, --output <path>    Output file path, '-' for stdout (default: syscalls.json).\n" +
                    "                         The extension is replaced to match --format.\n" +
                    "  --format <fmt>         json | text | header (default: json)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/syscall-extract.jar --descriptors descriptors/ --format header -o out/syscalls\n" +
                    "  java -jar target/syscall-extract.jar --macros syscall.macros --format text -o -\n"
            );
        }
    }
}
