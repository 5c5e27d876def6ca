package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One system call number. {@link #function} is present only when a matching extern
 * declaration was found; {@link #headerName} then names the header that declared it.
 */
@JsonPropertyOrder({"name", "number", "headerName", "function"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Syscall {
    public final String name;
    public final int number;
    public final String headerName;
    public final FunctionSignature function;

    public Syscall(String name, int number, String headerName, FunctionSignature function) {
        this.name = Objects.requireNonNull(name, "name");
        this.number = number;
        this.headerName = Objects.requireNonNullElse(headerName, "");
        this.function = function;
    }

    public Syscall(String name, int number, String headerName) {
        this(name, number, headerName, null);
    }

    public boolean hasFunction() {
        return function != null;
    }

    public Syscall withFunction(FunctionSignature function, String headerName) {
        return new Syscall(name, number, headerName, function);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Syscall)) return false;
        Syscall that = (Syscall) o;
        return number == that.number &&
                name.equals(that.name) &&
                headerName.equals(that.headerName) &&
                Objects.equals(function, that.function);
    }

    @Override public int hashCode() {
        return Objects.hash(name, number, headerName, function);
    }
}
