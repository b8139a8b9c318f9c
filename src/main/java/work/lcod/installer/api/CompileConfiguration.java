package work.lcod.installer.api;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;
import work.lcod.installer.config.ConfigTree;

/**
 * Immutable options of one compiler run. Exactly one of {@code configPath} and {@code tree} is set.
 */
public record CompileConfiguration(
    Optional<Path> configPath,
    Optional<ConfigTree> tree,
    Dialect dialect,
    Optional<Path> outputPath,
    boolean strictReferences,
    boolean dryRun
) {
    public CompileConfiguration {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(outputPath, "outputPath");
        if (configPath.isPresent() == tree.isPresent()) {
            throw new IllegalArgumentException("Exactly one of configPath or tree must be provided");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Human readable origin of the configuration, for results and logs. */
    public String source() {
        return configPath.map(Path::toString).orElse("<memory>");
    }

    /**
     * The explicit output path, or {@code <config-dir>/<appName><extension>}. In-memory trees without
     * a base directory fall back to the working directory.
     */
    public Path effectiveOutput(ConfigTree loaded, String appName) {
        if (outputPath.isPresent()) {
            return outputPath.get().toAbsolutePath().normalize();
        }
        var directory = loaded.baseDirectory().orElseGet(() -> Paths.get("").toAbsolutePath());
        return directory.resolve(appName + dialect.fileExtension()).toAbsolutePath().normalize();
    }

    public static final class Builder {
        private Path configPath;
        private ConfigTree tree;
        private Dialect dialect = Dialect.NSIS;
        private Path outputPath;
        private boolean strictReferences;
        private boolean dryRun;

        public Builder configPath(Path configPath) {
            this.configPath = configPath;
            return this;
        }

        public Builder tree(ConfigTree tree) {
            this.tree = tree;
            return this;
        }

        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder strictReferences(boolean strictReferences) {
            this.strictReferences = strictReferences;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public CompileConfiguration build() {
            return new CompileConfiguration(
                Optional.ofNullable(configPath),
                Optional.ofNullable(tree),
                dialect,
                Optional.ofNullable(outputPath),
                strictReferences,
                dryRun
            );
        }
    }
}
