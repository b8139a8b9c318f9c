package work.lcod.installer.config;

import java.util.Locale;

/**
 * One file or glob to install. Sources starting with {@code http://} or {@code https://} are
 * downloaded by the installer at install time.
 */
public record FileEntry(
    String source,
    String destination,
    String checksumType,
    String checksumValue,
    boolean decompress
) {
    public static final String DEFAULT_DESTINATION = "$INSTDIR";

    public static FileEntry from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return new FileEntry(value.text(""), DEFAULT_DESTINATION, "", "", false);
        }
        var source = value.text("source", "");
        if (source.isBlank()) {
            source = value.text("download_url", "");
        }
        return new FileEntry(
            source,
            value.text("destination", DEFAULT_DESTINATION),
            value.text("checksum_type", ""),
            value.text("checksum_value", ""),
            value.bool("decompress", false)
        );
    }

    public boolean isRemote() {
        var lower = source.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    public boolean hasChecksum() {
        return !checksumType.isBlank() && !checksumValue.isBlank();
    }

    public boolean isRecursive() {
        return source.contains("**");
    }
}
