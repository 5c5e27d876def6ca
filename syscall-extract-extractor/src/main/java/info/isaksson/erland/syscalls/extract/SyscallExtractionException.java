package info.isaksson.erland.syscalls.extract;

/** The run cannot continue, e.g. because the syscall number table could not be obtained. */
public class SyscallExtractionException extends RuntimeException {

    public SyscallExtractionException(String message) {
        super(message);
    }

    public SyscallExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
