package work.lcod.installer.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.installer.support.CompilerTestSupport;

class InstallerCompilerTest {
    @TempDir
    Path workDir;

    private Path demoConfig() throws IOException {
        var target = workDir.resolve("demo.yaml");
        Files.copy(CompilerTestSupport.fixture("demo.yaml"), target);
        return target;
    }

    @Test
    void writesScriptNextToConfig() throws IOException {
        var config = demoConfig();
        var result = new InstallerCompiler().compile(CompileConfiguration.builder().configPath(config).build());

        assertTrue(result.isSuccess(), result.toPrettyJson());
        var output = workDir.resolve("Demo.nsi");
        assertEquals(output.toString(), result.metadata().get("output"));
        var bytes = Files.readAllBytes(output);
        assertEquals((byte) 0xEF, bytes[0]);
        assertEquals((byte) 0xBB, bytes[1]);
        assertEquals((byte) 0xBF, bytes[2]);
        var text = new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        assertEquals(result.script(), text);
        assertTrue(text.contains("!insertmacro MUI_LANGUAGE \"SimpChinese\""), text);
        assertTrue(text.contains("WriteRegStr HKLM \"Software\\Acme Tools\\Demo\" \"DataDir\" \"$APPDATA\\Demo\""), text);
        assertTrue(text.contains("StrCmp $R2 \"${APP_VERSION}\" _ei_done"), text);
        assertTrue(text.contains("IntCmp $R3 30000 _ei_wait_done 0 _ei_wait_done"), text);
        assertFalse(text.contains("${app."), text);
    }

    @Test
    void dryRunWritesNothing() throws IOException {
        var config = demoConfig();
        var result = new InstallerCompiler().compile(CompileConfiguration.builder().configPath(config).dryRun(true).build());

        assertTrue(result.isSuccess(), result.toPrettyJson());
        assertEquals(true, result.metadata().get("dryRun"));
        assertFalse(Files.exists(workDir.resolve("Demo.nsi")));
        assertTrue(result.script().contains("Section \"core\" SEC_PKG_0"));
        assertFalse(result.toPrettyJson().contains("Section \"core\""));
    }

    @Test
    void explicitOutputWins() throws IOException {
        var output = workDir.resolve("out").resolve("setup.nsi");
        var result = new InstallerCompiler().compile(CompileConfiguration.builder()
            .configPath(demoConfig())
            .outputPath(output)
            .build());

        assertTrue(result.isSuccess(), result.toPrettyJson());
        assertTrue(Files.isRegularFile(output));
    }

    @Test
    void strictModeFailsOnUnknownReferences() {
        var tree = CompilerTestSupport.tree("""
            app:
              name: Demo
              version: 1.0.0
              publisher: ${app.vendor}
            """);
        var lenient = new InstallerCompiler().compile(CompileConfiguration.builder().tree(tree).dryRun(true).build());
        assertTrue(lenient.isSuccess(), lenient.toPrettyJson());
        assertEquals(List.of("${app.vendor}"), lenient.metadata().get("unresolvedReferences"));
        assertTrue(lenient.script().contains("!define APP_PUBLISHER \"${app.vendor}\""));

        var strict = new InstallerCompiler().compile(CompileConfiguration.builder()
            .tree(tree)
            .strictReferences(true)
            .dryRun(true)
            .build());
        assertFalse(strict.isSuccess());
        assertEquals("unknown_reference", strict.errorCode());
        assertEquals(List.of("${app.vendor}"), strict.metadata().get("data"));
        assertEquals(1, strict.status().exitCode());
    }

    @Test
    void cyclicReferencesAreReported() {
        var tree = CompilerTestSupport.tree("""
            app:
              name: Demo
              version: 1.0.0
              publisher: ${loop.a}
            loop:
              a: ${loop.b}
              b: ${loop.a}
            """);
        var result = new InstallerCompiler().compile(CompileConfiguration.builder().tree(tree).dryRun(true).build());

        assertFalse(result.isSuccess());
        assertEquals("reference_cycle", result.errorCode());
        assertTrue(String.valueOf(result.metadata().get("error")).startsWith("Circular reference detected"));
    }

    @Test
    void unsupportedFormatFails() {
        var tree = CompilerTestSupport.tree("app:\n  name: Demo\n  version: 1.0.0\n");
        var result = new InstallerCompiler().compile(CompileConfiguration.builder()
            .tree(tree)
            .dialect(Dialect.WIX)
            .dryRun(true)
            .build());

        assertFalse(result.isSuccess());
        assertEquals("invalid_config", result.errorCode());
        assertTrue(String.valueOf(result.metadata().get("error")).startsWith("No script generator for format 'wix'"));
    }

    @Test
    void missingConfigFileFails() {
        var result = new InstallerCompiler().compile(CompileConfiguration.builder()
            .configPath(workDir.resolve("absent.yaml"))
            .build());

        assertFalse(result.isSuccess());
        assertFalse(result.errorCode().isEmpty());
    }
}
