package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One C type, as seen by the front-end parser.
 *
 * <p>A tagged union discriminated by {@link #kind}. Only the fields belonging to the
 * active kind are populated; the rest are null or empty. Children are held by
 * reference so one node may be shared by several parents. Nodes are immutable: the
 * only "mutation" is {@link #asElaborated(String)}, which returns a renamed copy.</p>
 *
 * <p>{@link #name} is the as-spelled type string and doubles as the key into the
 * type store. {@link #baseName} is the canonical spelling with the node's own
 * qualifier tokens removed according to {@link QualifierPolicy}.</p>
 */
@JsonPropertyOrder({"kind", "name", "baseName", "qualifiers", "elaborated", "pointee", "element", "arraySize",
        "returnType", "params", "aggregateKind", "anonymous", "fields", "constants", "underlying"})
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class TypeNode {
    public final TypeNodeKind kind;
    public final String name;
    public final String baseName;
    public final Set<Qualifier> qualifiers;

    /** True when this node was reached through a tag/alias name rather than its canonical form. */
    public final boolean elaborated;

    /** For POINTER. */
    public final TypeNode pointee;

    /** For ARRAY. */
    public final TypeNode element;
    /** For ARRAY: null means incomplete (flexible) array. */
    public final Long arraySize;

    /** For FUNCTION. */
    public final TypeNode returnType;
    /** For FUNCTION, in declaration order. */
    public final List<TypeNode> params;

    /** For AGGREGATE. */
    public final AggregateKind aggregateKind;
    /** For AGGREGATE: derived from {@link #name}, never supplied by the parser. */
    public final boolean anonymous;
    /** For struct/union AGGREGATE, in declaration order. */
    public final List<StructField> fields;
    /** For enum AGGREGATE, in declaration order. */
    public final List<EnumConstant> constants;

    /** For TYPEDEF. */
    public final TypeNode underlying;

    private TypeNode(TypeNodeKind kind,
                     String name,
                     String baseName,
                     Set<Qualifier> qualifiers,
                     boolean elaborated,
                     TypeNode pointee,
                     TypeNode element,
                     Long arraySize,
                     TypeNode returnType,
                     List<TypeNode> params,
                     AggregateKind aggregateKind,
                     List<StructField> fields,
                     List<EnumConstant> constants,
                     TypeNode underlying) {
        this.kind = kind == null ? TypeNodeKind.PRIMITIVE : kind;
        this.name = Objects.requireNonNullElse(name, "");
        this.baseName = Objects.requireNonNullElse(baseName, "");
        this.qualifiers = qualifiers == null || qualifiers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(qualifiers));
        this.elaborated = elaborated;
        this.pointee = pointee;
        this.element = element;
        this.arraySize = arraySize;
        this.returnType = returnType;
        this.params = params == null ? List.of() : List.copyOf(params);
        this.aggregateKind = aggregateKind;
        this.anonymous = this.kind == TypeNodeKind.AGGREGATE && AnonymousAggregates.isAnonymous(this.name);
        this.fields = fields == null ? List.of() : List.copyOf(fields);
        this.constants = constants == null ? List.of() : List.copyOf(constants);
        this.underlying = underlying;
    }

    public static TypeNode primitive(String name, String baseName, Set<Qualifier> qualifiers) {
        return new TypeNode(TypeNodeKind.PRIMITIVE, name, baseName, qualifiers, false,
                null, null, null, null, null, null, null, null, null);
    }

    /** Name-only placeholder used where expansion was cut short (cycles, missing children). */
    public static TypeNode nameOnly(String name) {
        return primitive(name, null, null);
    }

    public static TypeNode pointer(String name, String baseName, Set<Qualifier> qualifiers, TypeNode pointee) {
        return new TypeNode(TypeNodeKind.POINTER, name, baseName, qualifiers, false,
                Objects.requireNonNull(pointee, "pointee"), null, null, null, null, null, null, null, null);
    }

    public static TypeNode array(String name, String baseName, Set<Qualifier> qualifiers, TypeNode element, Long size) {
        return new TypeNode(TypeNodeKind.ARRAY, name, baseName, qualifiers, false,
                null, Objects.requireNonNull(element, "element"), size, null, null, null, null, null, null);
    }

    public static TypeNode function(String name, String baseName, Set<Qualifier> qualifiers,
                                    TypeNode returnType, List<TypeNode> params) {
        return new TypeNode(TypeNodeKind.FUNCTION, name, baseName, qualifiers, false,
                null, null, null, Objects.requireNonNull(returnType, "returnType"), params, null, null, null, null);
    }

    public static TypeNode record(String name, String baseName, Set<Qualifier> qualifiers,
                                  AggregateKind aggregateKind, List<StructField> fields) {
        if (aggregateKind == AggregateKind.ENUM) {
            throw new IllegalArgumentException("record kind must be STRUCT or UNION");
        }
        return new TypeNode(TypeNodeKind.AGGREGATE, name, baseName, qualifiers, false,
                null, null, null, null, null,
                aggregateKind == null ? AggregateKind.STRUCT : aggregateKind, fields, null, null);
    }

    public static TypeNode enumeration(String name, String baseName, Set<Qualifier> qualifiers,
                                       List<EnumConstant> constants) {
        return new TypeNode(TypeNodeKind.AGGREGATE, name, baseName, qualifiers, false,
                null, null, null, null, null, AggregateKind.ENUM, null, constants, null);
    }

    public static TypeNode typedef(String name, String baseName, Set<Qualifier> qualifiers, TypeNode underlying) {
        return new TypeNode(TypeNodeKind.TYPEDEF, name, baseName, qualifiers, false,
                null, null, null, null, null, null, null, null, Objects.requireNonNull(underlying, "underlying"));
    }

    /** Copy of this node spelled {@code newName} and marked elaborated. */
    public TypeNode asElaborated(String newName) {
        return new TypeNode(kind, newName == null ? name : newName, baseName, qualifiers, true,
                pointee, element, arraySize, returnType, params, aggregateKind, fields, constants, underlying);
    }

    public boolean isPrimitive() {
        return kind == TypeNodeKind.PRIMITIVE;
    }

    public boolean isPointer() {
        return kind == TypeNodeKind.POINTER;
    }

    public boolean isArray() {
        return kind == TypeNodeKind.ARRAY;
    }

    public boolean isFunction() {
        return kind == TypeNodeKind.FUNCTION;
    }

    /** A function type, or a pointer straight to one. */
    public boolean isFunctionPointer() {
        return isFunction() || (isPointer() && pointee.isFunction());
    }

    public boolean isStructural() {
        return kind == TypeNodeKind.AGGREGATE;
    }

    public boolean isTypedef() {
        return kind == TypeNodeKind.TYPEDEF;
    }

    /** Number of fields (struct/union) or constants (enum); zero for everything else. */
    public int memberCount() {
        return fields.size() + constants.size();
    }

    /** A struct/union/enum whose body has not been seen. */
    public boolean isForwardDeclaration() {
        return isStructural() && memberCount() == 0;
    }

    /** The function type behind a function pointer, or this node when it is a function. */
    public TypeNode functionType() {
        if (isFunction()) return this;
        if (isPointer() && pointee.isFunction()) return pointee;
        return null;
    }

    /** {@link #name} without this node's own qualifier tokens. */
    public String unqualifiedName() {
        return QualifierPolicy.forPointer(isPointer()).strip(name, QualifierPolicy.tokens(qualifiers));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeNode)) return false;
        TypeNode that = (TypeNode) o;
        return kind == that.kind &&
                elaborated == that.elaborated &&
                name.equals(that.name) &&
                baseName.equals(that.baseName) &&
                qualifiers.equals(that.qualifiers) &&
                Objects.equals(pointee, that.pointee) &&
                Objects.equals(element, that.element) &&
                Objects.equals(arraySize, that.arraySize) &&
                Objects.equals(returnType, that.returnType) &&
                params.equals(that.params) &&
                aggregateKind == that.aggregateKind &&
                fields.equals(that.fields) &&
                constants.equals(that.constants) &&
                Objects.equals(underlying, that.underlying);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, baseName, qualifiers, elaborated, pointee, element, arraySize,
                returnType, params, aggregateKind, fields, constants, underlying);
    }

    @Override public String toString() {
        return kind + ":" + name;
    }
}
