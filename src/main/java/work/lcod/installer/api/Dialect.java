package work.lcod.installer.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Target installer dialects. Each one owns a column in the built-in variable table.
 */
public enum Dialect {
    NSIS("nsis", ".nsi"),
    WIX("wix", ".wxs"),
    INNO("inno", ".iss");

    private final String id;
    private final String fileExtension;

    Dialect(String id, String fileExtension) {
        this.id = id;
        this.fileExtension = fileExtension;
    }

    public String id() {
        return id;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public static Dialect from(String value) {
        if (value == null || value.isBlank()) {
            return NSIS;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var dialect : values()) {
            if (dialect.id.equals(normalized)) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown format '" + value + "'. Available formats: " + knownIds());
    }

    static String knownIds() {
        return Arrays.stream(values()).map(Dialect::id).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return id;
    }
}
