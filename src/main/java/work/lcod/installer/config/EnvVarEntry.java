package work.lcod.installer.config;

import java.util.Locale;

public record EnvVarEntry(String name, String value, Scope scope, boolean removeOnUninstall, boolean append) {

    public enum Scope {
        SYSTEM,
        USER
    }

    public static EnvVarEntry from(ConfigValue value, String path) {
        var rawScope = value.text("scope", "system").trim().toUpperCase(Locale.ROOT);
        Scope scope;
        try {
            scope = Scope.valueOf(rawScope);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported environment scope at " + path + ".scope: " + rawScope.toLowerCase(Locale.ROOT));
        }
        return new EnvVarEntry(
            value.text("name", ""),
            value.text("value", ""),
            scope,
            value.bool("remove_on_uninstall", true),
            value.bool("append", false)
        );
    }

    public boolean isPathAppend() {
        return append && "PATH".equalsIgnoreCase(name);
    }
}
