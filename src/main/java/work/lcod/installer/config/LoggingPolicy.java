package work.lcod.installer.config;

import java.util.Locale;

/**
 * Install-time logging written by the generated installer (not the compiler's own logging).
 */
public record LoggingPolicy(boolean enabled, String path, String level) {

    public static LoggingPolicy disabled() {
        return new LoggingPolicy(false, "", "INFO");
    }

    public static LoggingPolicy from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return disabled();
        }
        return new LoggingPolicy(
            value.bool("enabled", false),
            value.text("path", ""),
            value.text("level", "INFO").toUpperCase(Locale.ROOT)
        );
    }

    public boolean isDebug() {
        return "DEBUG".equals(level);
    }
}
