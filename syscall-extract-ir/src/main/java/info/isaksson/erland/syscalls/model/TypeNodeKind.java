package info.isaksson.erland.syscalls.model;

/** Discriminator of the {@link TypeNode} tagged union. */
public enum TypeNodeKind {
    /** Builtin or otherwise opaque type, stored by spelling alone. */
    PRIMITIVE,
    /** Pointer; {@link TypeNode#pointee} is set. */
    POINTER,
    /** Constant or incomplete array; {@link TypeNode#element} is set. */
    ARRAY,
    /** Function prototype; {@link TypeNode#returnType} and {@link TypeNode#params} are set. */
    FUNCTION,
    /** struct, union or enum. */
    AGGREGATE,
    /** typedef name; {@link TypeNode#underlying} is the resolved type. */
    TYPEDEF
}
