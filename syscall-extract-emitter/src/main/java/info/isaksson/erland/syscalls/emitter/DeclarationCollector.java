package info.isaksson.erland.syscalls.emitter;

import info.isaksson.erland.syscalls.extract.DefinitionRank;
import info.isaksson.erland.syscalls.model.FunctionArg;
import info.isaksson.erland.syscalls.model.Syscall;
import info.isaksson.erland.syscalls.model.SyscallsContext;
import info.isaksson.erland.syscalls.model.TypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, deduplicated list of the types the matched prototypes depend on.
 *
 * <p>Candidates are keyed by unqualified name, so {@code const struct stat} and
 * {@code struct stat} share one slot. A name already collected is only replaced by a
 * strictly richer definition ({@link DefinitionRank#supersedes}); the replacement moves
 * to the end so it still follows whatever it depends on.</p>
 */
public final class DeclarationCollector {

    private static final Logger log = LoggerFactory.getLogger(DeclarationCollector.class);

    private final Map<String, TypeNode> candidates = new LinkedHashMap<>();

    public static List<TypeNode> collect(SyscallsContext ctx) {
        DeclarationCollector collector = new DeclarationCollector();
        for (Syscall syscall : ctx.syscallsInOrder()) {
            if (!syscall.hasFunction()) continue;
            collector.addAll(lookup(ctx, syscall.function.returnType));
            for (FunctionArg arg : syscall.function.arguments) {
                collector.addAll(lookup(ctx, arg.type));
            }
        }
        return collector.declarations();
    }

    private static TypeNode lookup(SyscallsContext ctx, String name) {
        TypeNode node = ctx.types.get(name);
        if (node == null) log.debug("Type {} not in store, nothing to declare", name);
        return node;
    }

    /** Offer {@code root} and everything it reaches, leaf first. */
    public void addAll(TypeNode root) {
        if (root == null) return;
        TypeFlattener.reversed(root).forEach(this::offer);
    }

    public void offer(TypeNode node) {
        String key = node.unqualifiedName();
        TypeNode existing = candidates.get(key);
        if (existing == null) {
            candidates.put(key, node);
        } else if (!existing.anonymous && DefinitionRank.supersedes(node, existing)) {
            candidates.remove(key);
            candidates.put(key, node);
        }
    }

    public List<TypeNode> declarations() {
        return new ArrayList<>(candidates.values());
    }
}
