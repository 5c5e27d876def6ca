package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** A function declaration found in a header. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class FunctionDecl {
    public String name;
    public Linkage linkage = Linkage.EXTERNAL;
    public TypeDescriptor result;
    public List<ParamDecl> params = new ArrayList<>();

    public FunctionDecl() {}

    public FunctionDecl(String name, TypeDescriptor result, List<ParamDecl> params) {
        this.name = name;
        this.result = result;
        this.params = params == null ? new ArrayList<>() : new ArrayList<>(params);
    }
}
