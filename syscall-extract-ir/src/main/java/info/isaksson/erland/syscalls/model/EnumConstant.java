package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * An enumerator. {@link #value} is null when the front-end could not determine it.
 */
@JsonPropertyOrder({"name", "value"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EnumConstant {
    public final String name;
    public final Long value;

    public EnumConstant(String name, Long value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumConstant)) return false;
        EnumConstant that = (EnumConstant) o;
        return name.equals(that.name) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value);
    }
}
