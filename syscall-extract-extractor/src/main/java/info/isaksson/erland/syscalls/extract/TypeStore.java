package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.model.StructField;
import info.isaksson.erland.syscalls.model.TypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicating registry of type nodes keyed by their spelling.
 *
 * <p>One node per name. A name already present is only replaced when the incoming node
 * is a full struct/union/enum definition and the stored one is a forward declaration
 * or a name-only placeholder ({@link DefinitionRank#supersedes}). Children are visited
 * whether or not the parent was stored, so every reachable name ends up registered.
 * The one exception is the identical instance already stored under its name.</p>
 */
public final class TypeStore {

    private static final Logger log = LoggerFactory.getLogger(TypeStore.class);

    private final Map<String, TypeNode> nodes = new LinkedHashMap<>();

    /** Register {@code node} and everything reachable from it. */
    public void insert(TypeNode node) {
        if (node == null) return;
        // A shared node already stored has had its children visited.
        if (nodes.get(node.name) == node) return;
        put(node);

        if (node.pointee != null) insert(node.pointee);
        if (node.element != null) insert(node.element);
        if (node.returnType != null) insert(node.returnType);
        for (TypeNode p : node.params) {
            insert(p);
        }
        for (StructField f : node.fields) {
            insert(f.type);
        }
        if (node.underlying != null) insert(node.underlying);
    }

    /**
     * Fold every entry of {@code other} into this store under the same override rule.
     * The outcome per name does not depend on which store is merged into which.
     */
    public void merge(TypeStore other) {
        if (other == null) return;
        for (TypeNode node : other.nodes.values()) {
            put(node);
        }
    }

    private void put(TypeNode node) {
        TypeNode existing = nodes.get(node.name);
        if (existing == null) {
            nodes.put(node.name, node);
        } else if (DefinitionRank.supersedes(node, existing)) {
            log.debug("Replacing incomplete definition of {} with full definition", node.name);
            nodes.put(node.name, node);
        }
    }

    public TypeNode get(String name) {
        return nodes.get(name);
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /** Names in first-registration order. */
    public List<String> names() {
        return new ArrayList<>(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    /** Read-only view, in first-registration order. */
    public Map<String, TypeNode> asMap() {
        return Collections.unmodifiableMap(nodes);
    }
}
