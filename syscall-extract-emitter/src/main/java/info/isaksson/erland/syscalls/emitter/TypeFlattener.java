package info.isaksson.erland.syscalls.emitter;

import info.isaksson.erland.syscalls.model.StructField;
import info.isaksson.erland.syscalls.model.TypeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Pre-order linearization of everything reachable from a type node.
 *
 * <p>Edges followed: pointee, element, return type, parameters, field types and the
 * typedef underlying type. The graph is acyclic once built, so the stream is finite;
 * a node shared by several parents appears once per path.</p>
 */
public final class TypeFlattener {

    private TypeFlattener() {}

    /** Lazy pre-order stream, {@code node} first. Each call starts a fresh traversal. */
    public static Stream<TypeNode> flatten(TypeNode node) {
        if (node == null) return Stream.empty();
        return Stream.concat(Stream.of(node), children(node).flatMap(TypeFlattener::flatten));
    }

    /** Reverse pre-order: dependencies before the nodes that need them. */
    public static List<TypeNode> reversed(TypeNode node) {
        List<TypeNode> out = new ArrayList<>();
        flatten(node).forEach(out::add);
        Collections.reverse(out);
        return out;
    }

    private static Stream<TypeNode> children(TypeNode node) {
        Stream.Builder<TypeNode> b = Stream.builder();
        if (node.pointee != null) b.add(node.pointee);
        if (node.element != null) b.add(node.element);
        if (node.returnType != null) b.add(node.returnType);
        node.params.forEach(b::add);
        for (StructField f : node.fields) {
            b.add(f.type);
        }
        if (node.underlying != null) b.add(node.underlying);
        return b.build();
    }
}
