package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/** Linkage of a function declaration as reported by the front-end. */
public enum Linkage {
    @JsonEnumDefaultValue
    INVALID,
    NO_LINKAGE,
    INTERNAL,
    UNIQUE_EXTERNAL,
    EXTERNAL;

    public boolean isExternal() {
        return this == EXTERNAL || this == UNIQUE_EXTERNAL;
    }
}
