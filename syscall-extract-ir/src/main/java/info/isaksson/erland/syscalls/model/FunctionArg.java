package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A prototype parameter. The type is referenced by its spelling, which is its type store key. */
@JsonPropertyOrder({"name", "type"})
public final class FunctionArg {
    public final String name;
    public final String type;

    public FunctionArg(String name, String type) {
        this.name = name == null ? "" : name;
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionArg)) return false;
        FunctionArg that = (FunctionArg) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }
}
