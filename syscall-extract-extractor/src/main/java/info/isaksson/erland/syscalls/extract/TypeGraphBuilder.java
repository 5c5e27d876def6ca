package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.ir.ConstantDescriptor;
import info.isaksson.erland.syscalls.ir.DescriptorKind;
import info.isaksson.erland.syscalls.ir.MemberDescriptor;
import info.isaksson.erland.syscalls.ir.TypeDescriptor;
import info.isaksson.erland.syscalls.model.AggregateKind;
import info.isaksson.erland.syscalls.model.EnumConstant;
import info.isaksson.erland.syscalls.model.Qualifier;
import info.isaksson.erland.syscalls.model.QualifierPolicy;
import info.isaksson.erland.syscalls.model.StructField;
import info.isaksson.erland.syscalls.model.TypeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts raw front-end type descriptors into {@link TypeNode} graphs.
 *
 * <p>Descriptor graphs may be cyclic (a record reaching itself through a pointer
 * field). The caller-supplied processing stack holds one {@code "<spelling> <KIND>"}
 * key per descriptor on the current call chain; when an ELABORATED or RECORD descriptor
 * is met whose key is already on the stack, a name-only stub is returned instead of
 * expanding it again. The resulting node graph is acyclic.</p>
 *
 * <p>Within one root call an ELABORATED or RECORD descriptor that has already been
 * expanded on a sibling path is not expanded again: the node built the first time is
 * returned, so shared types are shared nodes.</p>
 *
 * <p>Nothing here throws for odd input except a null root: missing children degrade
 * to primitive nodes named after the spelling, and unknown kinds are primitives.</p>
 */
public final class TypeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TypeGraphBuilder.class);

    private final Diagnostics diagnostics;

    public TypeGraphBuilder() {
        this(new Diagnostics());
    }

    public TypeGraphBuilder(Diagnostics diagnostics) {
        if (diagnostics == null) throw new IllegalArgumentException("diagnostics is null");
        this.diagnostics = diagnostics;
    }

    public TypeNode build(TypeDescriptor descriptor) {
        return build(descriptor, new ArrayDeque<>());
    }

    public TypeNode build(TypeDescriptor descriptor, Deque<String> processing) {
        if (descriptor == null) throw new IllegalArgumentException("descriptor is null");
        if (processing == null) throw new IllegalArgumentException("processing is null");
        return build(descriptor, processing, new HashMap<>());
    }

    private TypeNode build(TypeDescriptor descriptor, Deque<String> processing, Map<String, TypeNode> expanded) {
        String spelling = descriptor.spellingOrEmpty();
        String key = spelling + " " + descriptor.kind;
        boolean named = descriptor.kind == DescriptorKind.ELABORATED || descriptor.kind == DescriptorKind.RECORD;
        if (named) {
            if (processing.contains(key)) {
                log.debug("Already processing {}, returning name-only node", key);
                return TypeNode.nameOnly(spelling);
            }
            TypeNode done = expanded.get(key);
            if (done != null) return done;
        }

        processing.push(key);
        try {
            TypeNode node = convert(descriptor, spelling, processing, expanded);
            if (named) expanded.put(key, node);
            return node;
        } finally {
            processing.pop();
        }
    }

    private TypeNode convert(TypeDescriptor d, String spelling, Deque<String> processing,
                             Map<String, TypeNode> expanded) {
        Set<Qualifier> qualifiers = qualifiersOf(d);
        String tokens = QualifierPolicy.tokens(qualifiers);
        String baseName = QualifierPolicy.forPointer(d.kind == DescriptorKind.POINTER)
                .strip(d.canonicalSpelling(), tokens);

        switch (d.kind) {
            case POINTER: {
                if (d.pointee == null) return degrade(d, spelling, baseName, qualifiers, "pointee");
                TypeNode pointee = build(d.pointee, processing, expanded);
                return TypeNode.pointer(spelling, baseName, qualifiers, pointee);
            }
            case CONSTANT_ARRAY:
            case INCOMPLETE_ARRAY: {
                if (d.element == null) return degrade(d, spelling, baseName, qualifiers, "element");
                TypeNode element = build(d.element, processing, expanded);
                Long size = d.kind == DescriptorKind.CONSTANT_ARRAY ? d.size : null;
                return TypeNode.array(spelling, baseName, qualifiers, element, size);
            }
            case FUNCTION_PROTO:
            case FUNCTION_NO_PROTO: {
                if (d.result == null) return degrade(d, spelling, baseName, qualifiers, "result");
                TypeNode result = build(d.result, processing, expanded);
                List<TypeNode> params = new ArrayList<>();
                if (d.params != null) {
                    for (TypeDescriptor p : d.params) {
                        if (p == null) {
                            note("null parameter in " + spelling);
                            continue;
                        }
                        params.add(build(p, processing, expanded));
                    }
                }
                return TypeNode.function(spelling, baseName, qualifiers, result, params);
            }
            case RECORD:
                return buildRecord(d, spelling, baseName, qualifiers, processing, expanded);
            case ENUM:
                return buildEnum(d, spelling, baseName, qualifiers);
            case TYPEDEF: {
                if (d.underlying == null) return degrade(d, spelling, baseName, qualifiers, "underlying");
                TypeNode underlying = build(d.underlying, processing, expanded);
                if (underlying.isStructural() && !underlying.elaborated) {
                    underlying = underlying.asElaborated(underlying.name);
                }
                return TypeNode.typedef(spelling, baseName, qualifiers, underlying);
            }
            case ELABORATED: {
                if (d.named == null) return degrade(d, spelling, baseName, qualifiers, "named");
                return build(d.named, processing, expanded).asElaborated(spelling);
            }
            default:
                return TypeNode.primitive(spelling, baseName, qualifiers);
        }
    }

    private TypeNode buildRecord(TypeDescriptor d, String spelling, String baseName,
                                 Set<Qualifier> qualifiers, Deque<String> processing,
                                 Map<String, TypeNode> expanded) {
        AggregateKind aggregateKind = "UNION".equalsIgnoreCase(d.recordKind) ? AggregateKind.UNION : AggregateKind.STRUCT;
        List<StructField> fields = new ArrayList<>();
        if (d.members != null) {
            for (MemberDescriptor m : d.members) {
                if (m == null || m.kind != MemberDescriptor.Kind.FIELD) continue;
                if (m.type == null) {
                    note("field " + m.name + " of " + spelling + " has no type");
                    continue;
                }
                fields.add(new StructField(m.name, build(m.type, processing, expanded)));
            }
        }
        log.debug("Found {} fields in {}", fields.size(), spelling);
        return TypeNode.record(spelling, baseName, qualifiers, aggregateKind, fields);
    }

    private TypeNode buildEnum(TypeDescriptor d, String spelling, String baseName, Set<Qualifier> qualifiers) {
        List<EnumConstant> constants = new ArrayList<>();
        if (d.constants != null) {
            for (ConstantDescriptor c : d.constants) {
                if (c == null || c.name == null || c.name.isBlank()) continue;
                Long value = parseEnumValue(c.value);
                if (value == null) {
                    log.debug("Could not compute value of enumerator {} in {}", c.name, spelling);
                    diagnostics.recovered.add("enumerator " + c.name + " in " + spelling + " has no value");
                }
                constants.add(new EnumConstant(c.name, value));
            }
        }
        return TypeNode.enumeration(spelling, baseName, qualifiers, constants);
    }

    /**
     * Integer value of an enumerator literal such as {@code 42}, {@code -1}, {@code 0x10}
     * or {@code 1UL}; null when the literal is missing or not an integer.
     */
    static Long parseEnumValue(String literal) {
        if (literal == null) return null;
        String s = literal.trim();
        while (!s.isEmpty() && "uUlL".indexOf(s.charAt(s.length() - 1)) >= 0) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.isEmpty()) return null;
        try {
            return Long.decode(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Set<Qualifier> qualifiersOf(TypeDescriptor d) {
        Set<Qualifier> out = EnumSet.noneOf(Qualifier.class);
        if (d.constQualified) out.add(Qualifier.CONST);
        if (d.volatileQualified) out.add(Qualifier.VOLATILE);
        if (d.restrictQualified) out.add(Qualifier.RESTRICT);
        return out;
    }

    private TypeNode degrade(TypeDescriptor d, String spelling, String baseName,
                             Set<Qualifier> qualifiers, String missing) {
        String kind = d.kind.name().toLowerCase(Locale.ROOT);
        log.debug("{} descriptor '{}' has no {}, treating as primitive", kind, spelling, missing);
        note(kind + " " + spelling + " has no " + missing);
        return TypeNode.primitive(spelling, baseName, qualifiers);
    }

    private void note(String message) {
        diagnostics.recovered.add(message);
    }
}
