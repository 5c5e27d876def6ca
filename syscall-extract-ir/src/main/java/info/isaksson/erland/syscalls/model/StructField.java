package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A struct/union member. Anonymous members have an empty name. */
@JsonPropertyOrder({"name", "type"})
public final class StructField {
    public final String name;
    public final TypeNode type;

    public StructField(String name, TypeNode type) {
        this.name = name == null ? "" : name;
        this.type = Objects.requireNonNull(type, "type");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructField)) return false;
        StructField that = (StructField) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override public String toString() {
        return type.name + " " + name;
    }
}
