package work.lcod.installer.runtime;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.config.PackageConfig;
import work.lcod.installer.config.RegistryView;
import work.lcod.installer.variables.ReferenceResolver;
import work.lcod.installer.variables.VariableRegistry;

/**
 * Everything a generator needs for one compilation: the typed configuration, a resolver bound to
 * the target dialect and where the script will be written.
 */
public final class BuildContext {
    private final PackageConfig config;
    private final Dialect dialect;
    private final ReferenceResolver resolver;
    private final Path outputPath;

    public BuildContext(PackageConfig config, Dialect dialect, ReferenceResolver resolver, Path outputPath) {
        this.config = Objects.requireNonNull(config, "config");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.outputPath = outputPath;
    }

    public static BuildContext create(PackageConfig config, Dialect dialect, Path outputPath) {
        var resolver = ReferenceResolver.create(config.tree(), new VariableRegistry(dialect));
        return new BuildContext(config, dialect, resolver, outputPath);
    }

    public PackageConfig config() {
        return config;
    }

    public Dialect dialect() {
        return dialect;
    }

    public ReferenceResolver resolver() {
        return resolver;
    }

    public Optional<Path> outputPath() {
        return Optional.ofNullable(outputPath);
    }

    public String resolve(String text) {
        return resolver.resolve(text);
    }

    public List<String> languages() {
        return config.languageNames();
    }

    public boolean hasLanguages() {
        return !config.languages().isEmpty();
    }

    public boolean loggingEnabled() {
        return config.logging().enabled();
    }

    public String appName() {
        return resolve(config.app().name());
    }

    /**
     * Registry key holding install metadata; defaults to {@code Software\<publisher>\<name>}.
     */
    public String registryKey() {
        var configured = config.install().registryKey();
        if (configured != null && !configured.isBlank()) {
            return resolve(configured);
        }
        var publisher = resolve(config.app().publisher());
        if (publisher.isBlank()) {
            return "Software\\" + appName();
        }
        return "Software\\" + publisher + "\\" + appName();
    }

    /**
     * Registry view used for install metadata. {@code auto} follows the install directory: a
     * 64-bit program files location selects the 64-bit view.
     */
    public String effectiveRegistryView() {
        var view = config.install().registryView();
        if (view == RegistryView.VIEW_64) {
            return "64";
        }
        if (view == RegistryView.VIEW_32) {
            return "32";
        }
        var installDir = config.install().installDir().toUpperCase(Locale.ROOT);
        if (installDir.contains("PROGRAMFILES64") || installDir.contains("COMMONFILES64")) {
            return "64";
        }
        if (installDir.contains("PROGRAMFILES") || installDir.contains("COMMONFILES")) {
            return "32";
        }
        return "64";
    }

    /**
     * Path of a source file as the script compiler will see it: relative to the script when both
     * locations are known, absolute when only the configuration directory is known.
     */
    public String sourcePath(String source) {
        var resolved = resolve(source);
        if (resolved.isEmpty() || resolved.startsWith("$") || looksAbsolute(resolved)) {
            return resolved;
        }
        var base = config.tree().baseDirectory();
        if (base.isEmpty()) {
            return resolved;
        }
        try {
            var absolute = base.get().toAbsolutePath().resolve(resolved).normalize();
            var scriptDir = outputPath().map(Path::toAbsolutePath).map(Path::getParent);
            if (scriptDir.isPresent() && scriptDir.get().getRoot() != null
                && scriptDir.get().getRoot().equals(absolute.getRoot())) {
                return scriptDir.get().relativize(absolute).toString();
            }
            return absolute.toString();
        } catch (InvalidPathException ex) {
            // wildcards are not valid path characters everywhere; keep the text as written
            return resolved;
        }
    }

    private static boolean looksAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\") || (path.length() > 1 && path.charAt(1) == ':');
    }
}
