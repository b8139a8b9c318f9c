package work.lcod.installer.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shortcuts, registry values, environment variables and file associations attached either to the
 * whole installation or to a single component.
 */
public record ActionSet(
    Optional<ShortcutConfig> desktopShortcut,
    Optional<ShortcutConfig> startMenuShortcut,
    List<ShortcutConfig> shortcuts,
    List<RegistryEntry> registryEntries,
    List<EnvVarEntry> envVars,
    List<FileAssociation> fileAssociations
) {
    public ActionSet {
        shortcuts = List.copyOf(shortcuts);
        registryEntries = List.copyOf(registryEntries);
        envVars = List.copyOf(envVars);
        fileAssociations = List.copyOf(fileAssociations);
    }

    public static ActionSet from(ConfigValue value, String path) {
        var shortcuts = new ArrayList<ShortcutConfig>();
        value.get("shortcuts").items().forEach(item -> shortcuts.add(ShortcutConfig.from(item)));

        var registry = new ArrayList<RegistryEntry>();
        var rawRegistry = value.get("registry_entries").items();
        for (int i = 0; i < rawRegistry.size(); i++) {
            registry.add(RegistryEntry.from(rawRegistry.get(i), path + ".registry_entries[" + i + "]"));
        }

        var env = new ArrayList<EnvVarEntry>();
        var rawEnv = value.get("env_vars").items();
        for (int i = 0; i < rawEnv.size(); i++) {
            env.add(EnvVarEntry.from(rawEnv.get(i), path + ".env_vars[" + i + "]"));
        }

        var associations = new ArrayList<FileAssociation>();
        value.get("file_associations").items().forEach(item -> associations.add(FileAssociation.from(item)));

        return new ActionSet(
            shortcut(value, "desktop_shortcut"),
            shortcut(value, "start_menu_shortcut"),
            shortcuts,
            registry,
            env,
            associations
        );
    }

    private static Optional<ShortcutConfig> shortcut(ConfigValue value, String key) {
        var raw = value.get(key);
        if (raw.isAbsent() || (raw.asMap().isEmpty() && raw.text("").isBlank())) {
            var legacyTarget = value.text(key + "_target", "");
            if (legacyTarget.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(ShortcutConfig.from(ConfigValue.of(legacyTarget)));
        }
        return Optional.of(ShortcutConfig.from(raw));
    }

    public boolean hasPathAppend() {
        return envVars.stream().anyMatch(EnvVarEntry::isPathAppend);
    }
}
