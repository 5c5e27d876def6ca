package info.isaksson.erland.syscalls.model;

import java.util.regex.Pattern;

/**
 * Structural detection of compiler-synthesized aggregate spellings such as
 * {@code struct (unnamed at /usr/include/x.h:12:5)}.
 */
public final class AnonymousAggregates {

    private static final Pattern UNNAMED = Pattern.compile(
            "^(struct|union)(?:\\s+|\\s+\\w+::|::)\\((?:unnamed|anonymous)(?:\\s+(struct|union))?\\s+at\\s+.*:\\d+:\\d+\\)$");

    private AnonymousAggregates() {}

    public static boolean isAnonymous(String spelling) {
        if (spelling == null) return false;
        return UNNAMED.matcher(spelling.trim()).matches();
    }
}
