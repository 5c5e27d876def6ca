package info.isaksson.erland.syscalls.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Non-fatal problems met during one extraction run.
 *
 * <p>Every entry has already been logged where it happened; this is the tally the
 * report and the CLI summary read from.</p>
 */
public final class Diagnostics {
    /** Locally recovered problems, e.g. an enum constant whose value could not be computed. */
    public final List<String> recovered = new ArrayList<>();
    /** Malformed declarations that were skipped. */
    public final List<String> skipped = new ArrayList<>();
    /** Headers dropped because their upstream material was missing or unreadable. */
    public final List<String> missingHeaders = new ArrayList<>();

    public int total() {
        return recovered.size() + skipped.size() + missingHeaders.size();
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}
