package work.lcod.installer.config;

/**
 * A shortcut to create. A plain string in the configuration is shorthand for the target.
 */
public record ShortcutConfig(
    String name,
    String target,
    String location,
    String icon,
    String args,
    String workdir,
    LangText label,
    boolean optional,
    boolean defaultOn
) {
    public static ShortcutConfig from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return new ShortcutConfig("", value.text(""), "Desktop", "", "", "", LangText.empty(), true, true);
        }
        return new ShortcutConfig(
            value.text("name", ""),
            value.text("target", ""),
            value.text("location", "Desktop"),
            value.text("icon", ""),
            value.text("args", ""),
            value.text("workdir", ""),
            LangText.from(value.get("label")),
            value.bool("optional", true),
            value.bool("default", true)
        );
    }
}
