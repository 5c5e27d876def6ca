package info.isaksson.erland.syscalls.model;

public enum AggregateKind {
    STRUCT("struct"),
    UNION("union"),
    ENUM("enum");

    /** The C keyword introducing this kind of aggregate. */
    public final String keyword;

    AggregateKind(String keyword) {
        this.keyword = keyword;
    }
}
