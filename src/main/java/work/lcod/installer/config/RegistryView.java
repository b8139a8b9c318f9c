package work.lcod.installer.config;

import java.util.Locale;

/**
 * Which registry view a write targets on 64-bit Windows.
 */
public enum RegistryView {
    AUTO("auto"),
    VIEW_32("32"),
    VIEW_64("64");

    private final String id;

    RegistryView(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static RegistryView from(String value, String path) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var view : values()) {
            if (view.id.equals(normalized)) {
                return view;
            }
        }
        throw new IllegalArgumentException("Unsupported registry view at " + path + ": " + value + " (expected auto, 32 or 64)");
    }
}
