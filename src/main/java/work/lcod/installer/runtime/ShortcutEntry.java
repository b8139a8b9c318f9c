package work.lcod.installer.runtime;

import java.util.Locale;
import work.lcod.installer.config.ShortcutConfig;

/**
 * A shortcut with its stable index, resolved kind and owning section ({@code global} for shortcuts
 * not tied to a component).
 */
public record ShortcutEntry(int index, Kind kind, String section, ShortcutConfig config, String displayName) {
    public static final String GLOBAL = "global";

    public enum Kind {
        DESKTOP,
        START_MENU,
        QUICK_LAUNCH,
        CUSTOM;

        public static Kind fromLocation(String location) {
            var normalized = location == null ? "" : location.trim().toLowerCase(Locale.ROOT);
            switch (normalized) {
                case "desktop":
                case "desk":
                    return DESKTOP;
                case "startmenu":
                case "start_menu":
                case "start menu":
                case "programs":
                    return START_MENU;
                case "quicklaunch":
                case "quick_launch":
                case "quick launch":
                    return QUICK_LAUNCH;
                default:
                    return CUSTOM;
            }
        }
    }

    public boolean isGlobal() {
        return GLOBAL.equals(section);
    }

    public boolean isOptional() {
        return config.optional();
    }
}
