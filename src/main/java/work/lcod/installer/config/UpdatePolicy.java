package work.lcod.installer.config;

public record UpdatePolicy(
    boolean enabled,
    String updateUrl,
    String downloadUrl,
    boolean backupOnUpgrade,
    boolean repairEnabled,
    boolean checkOnStartup,
    String registryHive,
    String registryKey
) {
    public static final String DEFAULT_REGISTRY_KEY = "Software\\${app.publisher}\\${app.name}";

    public static UpdatePolicy disabled() {
        return new UpdatePolicy(false, "", "", false, false, true, "HKLM", DEFAULT_REGISTRY_KEY);
    }

    public static UpdatePolicy from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return disabled();
        }
        return new UpdatePolicy(
            value.bool("enabled", false),
            value.text("update_url", ""),
            value.text("download_url", ""),
            value.bool("backup_on_upgrade", false),
            value.bool("repair_enabled", false),
            value.bool("check_on_startup", true),
            value.text("registry_hive", "HKLM"),
            value.text("registry_key", DEFAULT_REGISTRY_KEY)
        );
    }
}
