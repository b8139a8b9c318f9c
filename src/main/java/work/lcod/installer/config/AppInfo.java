package work.lcod.installer.config;

import java.util.Objects;

public record AppInfo(
    String name,
    String version,
    String publisher,
    LangText description,
    String branding,
    String installIcon,
    String uninstallIcon,
    LangText license
) {
    public AppInfo {
        Objects.requireNonNull(name, "name");
    }

    public static AppInfo from(ConfigValue value) {
        var name = value.text("name", "");
        if (name.isBlank()) {
            throw new IllegalArgumentException("app.name is required");
        }
        var installIcon = value.text("install_icon", "");
        return new AppInfo(
            name,
            value.text("version", "1.0.0"),
            value.text("publisher", ""),
            LangText.from(value.get("description")),
            value.text("branding", ""),
            installIcon,
            value.text("uninstall_icon", installIcon),
            LangText.from(value.get("license"))
        );
    }
}
