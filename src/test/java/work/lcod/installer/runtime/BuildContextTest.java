package work.lcod.installer.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.config.ConfigLoader;
import work.lcod.installer.config.PackageConfig;
import work.lcod.installer.support.CompilerTestSupport;

class BuildContextTest {
    @Test
    void registryKeyDefaultsToPublisherAndName() {
        assertEquals("Software\\Acme\\Demo", CompilerTestSupport.context("""
            app:
              name: Demo
              publisher: Acme
            """).registryKey());
        assertEquals("Software\\Demo", CompilerTestSupport.context("app:\n  name: Demo\n").registryKey());
        assertEquals("Software\\Custom\\Demo", CompilerTestSupport.context("""
            app:
              name: Demo
            install:
              registry_key: "Software\\\\Custom\\\\${app.name}"
            """).registryKey());
    }

    @Test
    void autoViewFollowsInstallDirectory() {
        assertEquals("64", CompilerTestSupport.context("app:\n  name: Demo\n").effectiveRegistryView());
        assertEquals("32", CompilerTestSupport.context("""
            app:
              name: Demo
            install:
              install_dir: "$PROGRAMFILES\\\\Demo"
            """).effectiveRegistryView());
        assertEquals("32", CompilerTestSupport.context("""
            app:
              name: Demo
            install:
              install_dir: "$PROGRAMFILES64\\\\Demo"
              registry_view: "32"
            """).effectiveRegistryView());
    }

    @Test
    void sourcePathIsRelativeToTheScript() {
        var base = Path.of("/work/project").toAbsolutePath();
        var tree = ConfigLoader.fromYaml("app:\n  name: Demo\n", base);
        var ctx = BuildContext.create(PackageConfig.from(tree), Dialect.NSIS, base.resolve("build/setup.nsi"));

        assertEquals(Path.of("..", "bin", "app.exe").toString(), ctx.sourcePath("bin/app.exe"));
        assertEquals("$INSTDIR\\app.exe", ctx.sourcePath("$INSTDIR\\app.exe"));
    }

    @Test
    void sourcePathWithoutBaseKeepsText() {
        var ctx = CompilerTestSupport.context("app:\n  name: Demo\n");
        assertEquals("bin/app.exe", ctx.sourcePath("bin/app.exe"));
    }
}
