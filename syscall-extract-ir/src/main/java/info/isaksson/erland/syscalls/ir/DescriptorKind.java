package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * Type kinds reported by the C front-end. Spellings the reader does not know map to
 * {@link #UNKNOWN}, which is handled like a primitive.
 */
public enum DescriptorKind {
    POINTER,
    CONSTANT_ARRAY,
    INCOMPLETE_ARRAY,
    FUNCTION_PROTO,
    FUNCTION_NO_PROTO,
    RECORD,
    ENUM,
    TYPEDEF,
    ELABORATED,
    BUILTIN,
    @JsonEnumDefaultValue
    UNKNOWN;

    public boolean isArray() {
        return this == CONSTANT_ARRAY || this == INCOMPLETE_ARRAY;
    }

    public boolean isFunction() {
        return this == FUNCTION_PROTO || this == FUNCTION_NO_PROTO;
    }
}
