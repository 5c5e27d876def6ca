package info.isaksson.erland.syscalls.io;

import java.util.Optional;

/** Supplies the preprocessor macro dump ({@code #define} lines) of a system header. */
public interface MacroSource {

    /**
     * @param header header name as included, e.g. {@code sys/syscall.h}
     * @return the macro dump, or empty when the header could not be processed
     */
    Optional<String> expandMacros(String header);
}
