package info.isaksson.erland.syscalls.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileMacroSourceTest {

    @TempDir
    Path tmp;

    @Test
    void servesTheCapturedDump() throws Exception {
        Path dump = tmp.resolve("syscall.macros");
        Files.writeString(dump, "#define __NR_read 0\n");

        Optional<String> content = new FileMacroSource(dump).expandMacros("sys/syscall.h");
        assertEquals(Optional.of("#define __NR_read 0\n"), content);
    }

    @Test
    void missingFileGivesEmpty() {
        assertTrue(new FileMacroSource(tmp.resolve("nope")).expandMacros("sys/syscall.h").isEmpty());
    }

    @Test
    void missingCompilerGivesEmpty() {
        GccMacroSource gcc = new GccMacroSource("definitely-not-a-compiler-7f3a");
        assertTrue(gcc.expandMacros("sys/syscall.h").isEmpty());
    }

    @Test
    void blankCompilerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GccMacroSource(" "));
    }
}
