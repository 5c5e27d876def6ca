package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParamDecl {
    public String name;
    public TypeDescriptor type;

    public ParamDecl() {}

    public ParamDecl(String name, TypeDescriptor type) {
        this.name = name;
        this.type = type;
    }
}
