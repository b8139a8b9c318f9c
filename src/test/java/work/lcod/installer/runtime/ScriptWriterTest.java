package work.lcod.installer.runtime;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptWriterTest {
    @Test
    void prefixesByteOrderMark() {
        var bytes = ScriptWriter.encode("Name \"Démo\"", true);
        assertArrayEquals(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, Arrays.copyOf(bytes, 3));
        assertEquals("Name \"Démo\"", new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8));
        assertEquals("x", new String(ScriptWriter.encode("x", false), StandardCharsets.UTF_8));
    }

    @Test
    void writesAtomicallyIntoNewDirectories(@TempDir Path dir) throws Exception {
        var target = dir.resolve("out/nested/setup.nsi");
        var written = ScriptWriter.write(target, "Unicode true\n", true);

        var bytes = Files.readAllBytes(target);
        assertEquals(bytes.length, written);
        assertEquals("Unicode true\n", new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void replacesExistingScript(@TempDir Path dir) throws Exception {
        var target = dir.resolve("setup.nsi");
        Files.writeString(target, "old");
        ScriptWriter.write(target, "new", false);
        assertEquals("new", Files.readString(target));
    }

    @Test
    void failuresAreWrapped(@TempDir Path dir) throws Exception {
        var blocker = dir.resolve("file");
        Files.writeString(blocker, "not a directory");
        var error = assertThrows(IllegalStateException.class,
            () -> ScriptWriter.write(blocker.resolve("setup.nsi"), "x", true));
        assertTrue(error.getMessage().startsWith("Failed to write script: "));
    }
}
