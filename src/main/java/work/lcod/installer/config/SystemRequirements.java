package work.lcod.installer.config;

public record SystemRequirements(String minWindowsVersion, long minFreeSpaceMb, long minRamMb, boolean requireAdmin) {
    private static final SystemRequirements NONE = new SystemRequirements("", 0, 0, false);

    public static SystemRequirements none() {
        return NONE;
    }

    public static SystemRequirements from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return NONE;
        }
        return new SystemRequirements(
            value.text("min_windows_version", ""),
            value.integer("min_free_space_mb", 0),
            value.integer("min_ram_mb", 0),
            value.bool("require_admin", false)
        );
    }

    public boolean isEmpty() {
        return minWindowsVersion.isBlank() && minFreeSpaceMb <= 0 && minRamMb <= 0 && !requireAdmin;
    }
}
