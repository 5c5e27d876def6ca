package info.isaksson.erland.syscalls.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one extraction run: the syscall table, the typedefs its prototypes need,
 * and every type node reachable from them, keyed by spelling.
 */
public final class SyscallsContext {
    /** Keyed and iterated by syscall number. */
    public final Map<Integer, Syscall> syscalls;
    public final List<TypedefEntry> typedefs;
    public final Map<String, TypeNode> types;

    public SyscallsContext(Map<Integer, Syscall> syscalls, List<TypedefEntry> typedefs, Map<String, TypeNode> types) {
        this.syscalls = syscalls == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(syscalls));
        this.typedefs = typedefs == null ? List.of() : List.copyOf(typedefs);
        this.types = types == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public List<Syscall> syscallsInOrder() {
        return new ArrayList<>(syscalls.values());
    }

    public long matchedCount() {
        return syscalls.values().stream().filter(Syscall::hasFunction).count();
    }
}
