package work.lcod.installer.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompileCommandTest {
    @TempDir
    Path workDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var commandLine = Main.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path writeConfig(String yaml) throws IOException {
        var config = workDir.resolve("installer.yaml");
        Files.writeString(config, yaml);
        return config;
    }

    @Test
    void dryRunPrintsScript() throws IOException {
        var config = writeConfig("app:\n  name: Demo\n  version: 1.0.0\n");

        var exit = run("-c", config.toString(), "--dry-run");

        assertEquals(0, exit, err.toString());
        assertTrue(out.toString().contains("Unicode true"), out.toString());
        assertFalse(Files.exists(workDir.resolve("Demo.nsi")));
    }

    @Test
    void writesScriptAndPrintsJsonSummary() throws IOException {
        var config = writeConfig("app:\n  name: Demo\n  version: 1.0.0\n");
        var output = workDir.resolve("build").resolve("demo-setup.nsi");

        var exit = run("--config", config.toString(), "--output", output.toString());

        assertEquals(0, exit, err.toString());
        assertTrue(Files.isRegularFile(output));
        assertTrue(out.toString().contains("\"status\" : \"success\""), out.toString());
        assertTrue(out.toString().contains("\"format\" : \"nsis\""), out.toString());
    }

    @Test
    void strictFailureExitsWithOne() throws IOException {
        var config = writeConfig("app:\n  name: Demo\n  version: ${app.release}\n");

        var exit = run("-c", config.toString(), "--strict", "--dry-run");

        assertEquals(1, exit);
        assertTrue(err.toString().contains("Unknown variable references found: ${app.release}"), err.toString());
    }

    @Test
    void unknownFormatIsUsageError() throws IOException {
        var config = writeConfig("app:\n  name: Demo\n");

        assertEquals(2, run("-c", config.toString(), "-f", "msi"));
    }

    @Test
    void configOptionIsRequired() {
        assertEquals(2, run("--dry-run"));
        assertTrue(err.toString().contains("--config"), err.toString());
    }
}
