package work.lcod.installer.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.installer.support.CompilerTestSupport;

class ConfigTreeTest {
    @Test
    void lookupWalksDottedPaths() {
        var tree = CompilerTestSupport.tree("""
            app:
              name: Demo
              meta:
                channel: beta
            """);
        assertEquals("beta", tree.lookup("app.meta.channel").text(""));
        assertTrue(tree.lookup("app.meta.missing").isAbsent());
        assertTrue(tree.lookup("app.name.deeper").isAbsent());
        assertTrue(tree.lookup("").isAbsent());
    }

    @Test
    void keyOrderIsPreserved() {
        var config = CompilerTestSupport.config("""
            app:
              name: Demo
            packages:
              zeta:
                sources: z.txt
              alpha:
                sources: a.txt
            """);
        assertEquals(List.of("zeta", "alpha"), config.components().stream().map(ComponentEntry::name).toList());
    }

    @Test
    void loadsTomlRelativeToItsDirectory(@TempDir Path dir) throws Exception {
        var file = dir.resolve("installer.toml");
        Files.writeString(file, """
            [app]
            name = "Demo"
            version = "3.0.0"

            [install.existing_install]
            mode = "auto_uninstall"
            uninstall_wait_ms = "2s"
            """);
        var tree = ConfigLoader.load(file);
        assertEquals("Demo", tree.lookup("app.name").text(""));
        assertEquals(dir.toAbsolutePath().normalize(), tree.baseDirectory().orElseThrow());

        var policy = PackageConfig.from(tree).install().existingInstall();
        assertEquals(ExistingInstallPolicy.Mode.AUTO_UNINSTALL, policy.mode());
        assertEquals(2000L, policy.uninstallWaitMs());
    }

    @Test
    void existingInstallDefaults() {
        var policy = CompilerTestSupport.config("app:\n  name: Demo\n").install().existingInstall();
        assertEquals(ExistingInstallPolicy.Mode.PROMPT_UNINSTALL, policy.mode());
        assertEquals(ExistingInstallPolicy.DEFAULT_WAIT_MS, policy.uninstallWaitMs());
        assertTrue(policy.showVersionInfo());
    }

    @Test
    void existingInstallModeString() {
        var policy = CompilerTestSupport.config("""
            app:
              name: Demo
            install:
              existing_install: none
            """).install().existingInstall();
        assertEquals(ExistingInstallPolicy.Mode.NONE, policy.mode());
    }

    @Test
    void componentSourcesAcceptSeveralShapes() {
        var config = CompilerTestSupport.config("""
            app:
              name: Demo
            packages:
              single:
                source: bin/app.exe
                destination: $INSTDIR\\bin
              listed:
                sources:
                  - a.txt
                  - source: docs/**
                    destination: $INSTDIR\\docs
            """);
        var single = config.components().get(0);
        assertEquals(List.of(new SourceMapping("bin/app.exe", "$INSTDIR\\bin")), single.sources());
        var listed = config.components().get(1);
        assertEquals(List.of(
            new SourceMapping("a.txt", FileEntry.DEFAULT_DESTINATION),
            new SourceMapping("docs/**", "$INSTDIR\\docs")
        ), listed.sources());
    }

    @Test
    void invalidRegistryTypeNamesThePath() {
        var error = assertThrows(IllegalArgumentException.class, () -> CompilerTestSupport.config("""
            app:
              name: Demo
            install:
              registry_entries:
                - key: Software\\\\Demo
                  name: Mode
                  value: x
                  type: binary
            """));
        assertTrue(error.getMessage().contains("registry_entries"), error.getMessage());
    }

    @Test
    void missingAppNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CompilerTestSupport.config("app:\n  version: 1.0.0\n"));
    }
}
