package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A child of a record declaration. Only {@link Kind#FIELD} members are data members. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MemberDescriptor {
    public enum Kind {
        FIELD,
        @JsonEnumDefaultValue
        OTHER
    }

    public Kind kind = Kind.FIELD;
    public String name;
    public TypeDescriptor type;

    public MemberDescriptor() {}

    public MemberDescriptor(Kind kind, String name, TypeDescriptor type) {
        this.kind = kind;
        this.name = name;
        this.type = type;
    }
}
