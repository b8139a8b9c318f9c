package work.lcod.installer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view of a package description. The underlying {@link ConfigTree} stays available for
 * dotted path references.
 */
public record PackageConfig(
    ConfigTree tree,
    AppInfo app,
    InstallPolicy install,
    List<FileEntry> files,
    List<ComponentEntry> components,
    SigningPolicy signing,
    UpdatePolicy update,
    LoggingPolicy logging,
    List<LanguageConfig> languages,
    Map<String, List<String>> customIncludes
) {
    public PackageConfig {
        Objects.requireNonNull(tree, "tree");
        files = List.copyOf(files);
        components = List.copyOf(components);
        languages = List.copyOf(languages);
        customIncludes = Collections.unmodifiableMap(new LinkedHashMap<>(customIncludes));
    }

    public static PackageConfig from(ConfigTree tree) {
        var files = new ArrayList<FileEntry>();
        tree.get("files").items().forEach(item -> files.add(FileEntry.from(item)));

        var components = new ArrayList<ComponentEntry>();
        tree.get("packages").asMap().ifPresent(map -> map.entries().forEach((name, value) ->
            components.add(ComponentEntry.from(name, value, "packages." + name))));

        var languages = new ArrayList<LanguageConfig>();
        tree.get("languages").items().forEach(item -> languages.add(LanguageConfig.from(item)));

        var includes = new LinkedHashMap<String, List<String>>();
        tree.get("custom_includes").asMap().ifPresent(map -> map.entries().forEach((dialect, list) -> {
            var paths = new ArrayList<String>();
            list.items().forEach(item -> paths.add(item.text("")));
            if (paths.isEmpty() && list.asText().isPresent()) {
                paths.add(list.text(""));
            }
            includes.put(dialect, paths);
        }));

        return new PackageConfig(
            tree,
            AppInfo.from(tree.get("app")),
            InstallPolicy.from(tree.get("install")),
            files,
            components,
            SigningPolicy.from(tree.get("signing")),
            UpdatePolicy.from(tree.get("update")),
            LoggingPolicy.from(tree.get("logging")),
            languages,
            includes
        );
    }

    public List<String> languageNames() {
        var names = new ArrayList<String>();
        languages.forEach(language -> names.add(language.name()));
        return names;
    }

    public Map<String, String> stringOverrides(String language) {
        return languages.stream()
            .filter(config -> config.name().equals(language))
            .findFirst()
            .map(LanguageConfig::strings)
            .orElse(Map.of());
    }
}
