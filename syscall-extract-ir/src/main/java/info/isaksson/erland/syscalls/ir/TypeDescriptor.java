package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIdentityInfo;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.ObjectIdGenerators;

import java.util.ArrayList;
import java.util.List;

/**
 * One type reference as produced by the C front-end parser, mirroring the parser's
 * own type object one level at a time.
 *
 * <p>Children are themselves descriptors. A descriptor that declares an {@link #id}
 * may be referenced from anywhere in the same document by that id string, which is how
 * self-referential records ({@code struct node { struct node *next; }}) are expressed.
 * The resulting object graph may therefore be cyclic.</p>
 *
 * <p>Which child fields are set depends on {@link #kind}:</p>
 * <ul>
 *   <li>POINTER: {@link #pointee}</li>
 *   <li>CONSTANT_ARRAY / INCOMPLETE_ARRAY: {@link #element}, {@link #size} (constant only)</li>
 *   <li>FUNCTION_PROTO: {@link #result}, {@link #params}</li>
 *   <li>RECORD: {@link #recordKind}, {@link #members}</li>
 *   <li>ENUM: {@link #constants}</li>
 *   <li>TYPEDEF: {@link #underlying} (the canonical type)</li>
 *   <li>ELABORATED: {@link #named} (the canonical type)</li>
 * </ul>
 */
@JsonIdentityInfo(generator = ObjectIdGenerators.PropertyGenerator.class, property = "id")
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TypeDescriptor {
    public String id;
    public DescriptorKind kind = DescriptorKind.UNKNOWN;
    public String spelling;
    public String canonical;

    @JsonProperty("const")
    public boolean constQualified;
    @JsonProperty("volatile")
    public boolean volatileQualified;
    @JsonProperty("restrict")
    public boolean restrictQualified;

    public TypeDescriptor pointee;

    public TypeDescriptor element;
    public Long size;

    public TypeDescriptor result;
    public List<TypeDescriptor> params = new ArrayList<>();

    /** STRUCT or UNION. */
    public String recordKind;
    public List<MemberDescriptor> members = new ArrayList<>();

    public List<ConstantDescriptor> constants = new ArrayList<>();

    public TypeDescriptor underlying;

    public TypeDescriptor named;

    public TypeDescriptor() {}

    public TypeDescriptor(DescriptorKind kind, String spelling) {
        this.kind = kind;
        this.spelling = spelling;
        this.canonical = spelling;
    }

    /** Canonical spelling, falling back to the as-written spelling. */
    public String canonicalSpelling() {
        return canonical == null || canonical.isBlank() ? spellingOrEmpty() : canonical;
    }

    public String spellingOrEmpty() {
        return spelling == null ? "" : spelling;
    }

    @Override public String toString() {
        return kind + ":" + spelling;
    }
}
