package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A typedef declaration: {@link #type} is the typedef type itself, {@link #underlying}
 * the type as written on the right-hand side.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TypedefDecl {
    public String name;
    public TypeDescriptor type;
    public TypeDescriptor underlying;

    public TypedefDecl() {}

    public TypedefDecl(String name, TypeDescriptor type, TypeDescriptor underlying) {
        this.name = name;
        this.type = type;
        this.underlying = underlying;
    }
}
