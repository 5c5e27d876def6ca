package info.isaksson.erland.syscalls.model;

import java.util.Set;
import java.util.StringJoiner;

/**
 * Where qualifier tokens sit in a canonical spelling.
 *
 * <p>The front-end spells qualified pointers with the qualifiers trailing
 * ({@code char *const}) and everything else with them leading ({@code const char}).
 * The policy is chosen solely by "is this a pointer type".</p>
 */
public enum QualifierPolicy {
    /** Tokens lead the spelling: {@code const volatile int}. */
    PREFIX,
    /** Tokens trail the spelling: {@code int *const}. */
    SUFFIX;

    public static QualifierPolicy forPointer(boolean pointer) {
        return pointer ? SUFFIX : PREFIX;
    }

    /** Qualifier token string in fixed order (const, volatile, restrict). */
    public static String tokens(Set<Qualifier> qualifiers) {
        StringJoiner sj = new StringJoiner(" ");
        if (qualifiers == null) return "";
        for (Qualifier q : Qualifier.values()) {
            if (qualifiers.contains(q)) sj.add(q.token);
        }
        return sj.toString();
    }

    /**
     * Remove {@code tokens} from {@code spelling} on the side this policy names.
     * A spelling that does not carry the tokens there is returned trimmed but otherwise unchanged.
     */
    public String strip(String spelling, String tokens) {
        if (spelling == null) return "";
        String s = spelling.trim();
        if (tokens == null || tokens.isBlank()) return s;
        String t = tokens.trim();
        if (this == SUFFIX) {
            if (s.endsWith(t)) return s.substring(0, s.length() - t.length()).trim();
        } else {
            if (s.startsWith(t)) return s.substring(t.length()).trim();
        }
        return s;
    }
}
