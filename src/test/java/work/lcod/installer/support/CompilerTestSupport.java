package work.lcod.installer.support;

import java.nio.file.Path;
import java.util.List;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.config.ConfigLoader;
import work.lcod.installer.config.ConfigTree;
import work.lcod.installer.config.PackageConfig;
import work.lcod.installer.nsis.NsisScriptGenerator;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.FinalSubstitution;

/**
 * Builds configuration trees and contexts from inline YAML so generator tests stay short.
 */
public final class CompilerTestSupport {
    private CompilerTestSupport() {}

    public static ConfigTree tree(String yaml) {
        return ConfigLoader.fromYaml(yaml);
    }

    public static PackageConfig config(String yaml) {
        return PackageConfig.from(tree(yaml));
    }

    public static BuildContext context(String yaml) {
        return BuildContext.create(config(yaml), Dialect.NSIS, null);
    }

    public static BuildContext context(String yaml, Dialect dialect) {
        return BuildContext.create(config(yaml), dialect, null);
    }

    public static List<String> lines(String yaml) {
        return new NsisScriptGenerator().assemble(context(yaml));
    }

    /** Full NSIS script text, after the final substitution sweep. */
    public static String script(String yaml) {
        var ctx = context(yaml);
        return FinalSubstitution.apply(String.join("\n", new NsisScriptGenerator().assemble(ctx)), ctx);
    }

    public static Path fixture(String name) {
        return Path.of("src", "test", "resources", "configs", name).toAbsolutePath();
    }

    /** Index of the first line whose stripped text starts with {@code prefix}, or -1. */
    public static int indexOf(List<String> lines, String prefix) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).strip().startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }

    /** Index of the last line whose stripped text starts with {@code prefix}, or -1. */
    public static int lastIndexOf(List<String> lines, String prefix) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).strip().startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }
}
