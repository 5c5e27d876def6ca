package info.isaksson.erland.syscalls.extract;

import info.isaksson.erland.syscalls.model.FunctionSignature;
import info.isaksson.erland.syscalls.model.TypedefEntry;

import java.util.List;

/** What one header contributed: its extern functions, its typedefs and their types. */
public final class HeaderExtraction {
    public final String header;
    public final List<FunctionSignature> functions;
    public final List<TypedefEntry> typedefs;
    public final TypeStore types;

    public HeaderExtraction(String header, List<FunctionSignature> functions,
                            List<TypedefEntry> typedefs, TypeStore types) {
        this.header = header == null ? "" : header;
        this.functions = functions == null ? List.of() : List.copyOf(functions);
        this.typedefs = typedefs == null ? List.of() : List.copyOf(typedefs);
        this.types = types == null ? new TypeStore() : types;
    }
}
