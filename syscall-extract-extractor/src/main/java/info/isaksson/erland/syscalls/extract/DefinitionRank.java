package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.model.TypeNode;

/**
 * How complete a node is as a definition of its name.
 *
 * <p>Ordering is a monotonic lattice for aggregates: {@code STUB < FORWARD < FULL}.
 * {@link #OTHER} covers every concrete non-aggregate node and never takes part in
 * upgrades. Both the type store and the declaration renderer use
 * {@link #supersedes(TypeNode, TypeNode)}, so the winner for a name does not depend on
 * the order candidates arrive in.</p>
 */
public enum DefinitionRank {
    /** Name-only placeholder left where expansion was cut short. */
    STUB,
    /** struct/union/enum without a body. */
    FORWARD,
    /** struct/union/enum with at least one field or constant. */
    FULL,
    OTHER;

    public static DefinitionRank of(TypeNode node) {
        if (node == null) return STUB;
        if (node.isStructural()) {
            return node.memberCount() > 0 ? FULL : FORWARD;
        }
        if (node.isPrimitive() && node.baseName.isEmpty()) return STUB;
        return OTHER;
    }

    /** True if {@code incoming} should replace {@code existing} under the same name. */
    public static boolean supersedes(TypeNode incoming, TypeNode existing) {
        if (existing == null) return incoming != null;
        DefinitionRank in = of(incoming);
        DefinitionRank old = of(existing);
        return in == FULL && (old == FORWARD || old == STUB);
    }
}
