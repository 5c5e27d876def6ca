package info.isaksson.erland.syscalls.model;

/** C type qualifiers, declared in the order their tokens are spelled. */
public enum Qualifier {
    CONST("const"),
    VOLATILE("volatile"),
    RESTRICT("restrict");

    public final String token;

    Qualifier(String token) {
        this.token = token;
    }
}
