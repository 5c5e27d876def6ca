package info.isaksson.erland.syscalls.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * An extern function declaration.
 *
 * <p>Return and argument types are type store keys, not embedded nodes, so that large
 * sub-graphs are held once.</p>
 */
@JsonPropertyOrder({"name", "returnType", "arguments"})
public final class FunctionSignature {
    public final String name;
    public final String returnType;
    public final List<FunctionArg> arguments;

    public FunctionSignature(String name, String returnType, List<FunctionArg> arguments) {
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionSignature)) return false;
        FunctionSignature that = (FunctionSignature) o;
        return name.equals(that.name) && returnType.equals(that.returnType) && arguments.equals(that.arguments);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, arguments);
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder(returnType).append(' ').append(name).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            FunctionArg a = arguments.get(i);
            sb.append(a.type);
            if (!a.name.isEmpty()) sb.append(' ').append(a.name);
        }
        return sb.append(')').toString();
    }
}
