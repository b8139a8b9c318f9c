package work.lcod.installer.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable root of a package description, plus the directory relative sources are read from.
 */
public final class ConfigTree {
    private final ConfigValue.MapValue root;
    private final Path baseDirectory;

    public ConfigTree(ConfigValue.MapValue root, Path baseDirectory) {
        this.root = Objects.requireNonNull(root, "root");
        this.baseDirectory = baseDirectory;
    }

    public static ConfigTree of(Map<String, ?> raw) {
        return of(raw, null);
    }

    public static ConfigTree of(Map<String, ?> raw, Path baseDirectory) {
        var converted = ConfigValue.of(raw);
        if (!(converted instanceof ConfigValue.MapValue map)) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        return new ConfigTree(map, baseDirectory);
    }

    public ConfigValue.MapValue root() {
        return root;
    }

    public Optional<Path> baseDirectory() {
        return Optional.ofNullable(baseDirectory);
    }

    public ConfigValue get(String key) {
        return root.get(key);
    }

    /**
     * Walks a dotted path such as {@code app.name}. Returns {@link ConfigValue#absent()} when a
     * segment is missing or a non-mapping node sits in the middle of the path.
     */
    public ConfigValue lookup(String dottedPath) {
        if (dottedPath == null || dottedPath.isEmpty()) {
            return ConfigValue.absent();
        }
        ConfigValue current = root;
        for (var segment : dottedPath.split("\\.", -1)) {
            if (current.asMap().isEmpty()) {
                return ConfigValue.absent();
            }
            current = current.get(segment);
            if (current.isAbsent()) {
                return current;
            }
        }
        return current;
    }
}
