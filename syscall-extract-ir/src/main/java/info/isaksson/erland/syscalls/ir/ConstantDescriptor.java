package info.isaksson.erland.syscalls.ir;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An enumerator as reported upstream. {@link #value} is the literal the front-end
 * produced; it may be missing or not an integer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConstantDescriptor {
    public String name;
    public String value;

    public ConstantDescriptor() {}

    public ConstantDescriptor(String name, String value) {
        this.name = name;
        this.value = value;
    }
}
