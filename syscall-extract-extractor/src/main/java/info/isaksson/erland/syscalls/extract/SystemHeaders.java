package info.isaksson.erland.syscalls.extract;

import java.util.List;

/** Headers searched for syscall wrapper declarations. Later headers win when a name repeats. */
public final class SystemHeaders {

    /** Header whose macros carry the syscall numbers. */
    public static final String SYSCALL_HEADER = "sys/syscall.h";

    public static final List<String> DEFAULT = List.of(
            "unistd.h",
            "signal.h",
            "sys/wait.h",
            "sys/resource.h",
            "sys/times.h",
            "spawn.h",
            "pthread.h",
            "sched.h",
            "fcntl.h",
            "sys/stat.h",
            "sys/statvfs.h",
            "dirent.h",
            "ftw.h",
            "glob.h",
            "sys/select.h",
            "poll.h",
            "aio.h",
            "utime.h",
            "sys/mman.h",
            "sys/ipc.h",
            "sys/msg.h",
            "sys/sem.h",
            "sys/shm.h",
            "mqueue.h",
            "semaphore.h",
            "sys/socket.h",
            "netinet/in.h",
            "netinet/tcp.h",
            "arpa/inet.h",
            "net/if.h",
            "netdb.h",
            "sys/un.h",
            "sys/utsname.h",
            "sys/uio.h",
            "termios.h",
            "time.h",
            "sys/time.h",
            "pwd.h",
            "grp.h",
            "utmpx.h",
            "dlfcn.h",
            "fnmatch.h",
            "regex.h",
            "wordexp.h",
            "langinfo.h",
            "nl_types.h",
            "syslog.h");

    private SystemHeaders() {}
}
