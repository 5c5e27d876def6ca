package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A typedef name and the canonical spelling of what it aliases. */
@JsonPropertyOrder({"name", "underlyingType"})
public final class TypedefEntry {
    public final String name;
    public final String underlyingType;

    public TypedefEntry(String name, String underlyingType) {
        this.name = Objects.requireNonNull(name, "name");
        this.underlyingType = Objects.requireNonNullElse(underlyingType, "");
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypedefEntry)) return false;
        TypedefEntry that = (TypedefEntry) o;
        return name.equals(that.name) && underlyingType.equals(that.underlyingType);
    }

    @Override public int hashCode() {
        return Objects.hash(name, underlyingType);
    }
}
