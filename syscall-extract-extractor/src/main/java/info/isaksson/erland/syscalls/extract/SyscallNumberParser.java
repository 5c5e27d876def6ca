package info.isaksson.erland.syscalls.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code #define __NR_<name> <number>} lines out of a preprocessor macro dump.
 *
 * <p>Lines that do not have that shape, or whose value is not an integer literal
 * (e.g. {@code #define __NR_foo (__NR_SYSCALL_BASE + 1)}), are skipped.</p>
 */
public final class SyscallNumberParser {

    public static final String DEFAULT_PREFIX = "__NR_";

    private static final Logger log = LoggerFactory.getLogger(SyscallNumberParser.class);

    private final String prefix;

    public SyscallNumberParser() {
        this(DEFAULT_PREFIX);
    }

    public SyscallNumberParser(String prefix) {
        if (prefix == null || prefix.isEmpty()) throw new IllegalArgumentException("prefix is empty");
        this.prefix = prefix;
    }

    /** Syscall name (prefix removed) to number, in first-seen order; a repeated name keeps the last value. */
    public Map<String, Integer> parse(String macros) {
        Map<String, Integer> out = new LinkedHashMap<>();
        if (macros == null) return out;

        for (String line : macros.split("\\R")) {
            if (!line.contains(prefix)) continue;
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 3 || !"#define".equals(parts[0]) || !parts[1].startsWith(prefix)) continue;

            String name = parts[1].substring(prefix.length());
            if (name.isEmpty()) continue;
            try {
                out.put(name, Integer.decode(parts[2]));
            } catch (NumberFormatException e) {
                log.debug("Skipping non-numeric syscall {} = {}", name, parts[2]);
            }
        }
        return out;
    }
}
