package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/** Everything the front-end reported for one preprocessed header. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class HeaderUnit {
    /** Header name as included, e.g. {@code sys/stat.h}. */
    public String header;
    public List<FunctionDecl> functions = new ArrayList<>();
    public List<TypedefDecl> typedefs = new ArrayList<>();

    public HeaderUnit() {}

    public HeaderUnit(String header) {
        this.header = header;
    }
}
