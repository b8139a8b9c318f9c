package work.lcod.installer.config;

import java.util.Locale;

public record RegistryEntry(String hive, String key, String name, String value, Type type, RegistryView view) {

    public enum Type {
        STRING,
        EXPAND,
        DWORD
    }

    public static RegistryEntry from(ConfigValue value, String path) {
        var rawType = value.text("type", "string").trim().toUpperCase(Locale.ROOT);
        Type type;
        try {
            type = Type.valueOf(rawType);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported registry type at " + path + ".type: " + rawType.toLowerCase(Locale.ROOT));
        }
        return new RegistryEntry(
            value.text("hive", "HKLM"),
            value.text("key", ""),
            value.text("name", ""),
            value.text("value", ""),
            type,
            RegistryView.from(value.text("view", "auto"), path + ".view")
        );
    }
}
