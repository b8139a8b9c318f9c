package work.lcod.installer.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses wait durations written as plain milliseconds ({@code 1500}) or with a unit
 * ({@code 15s}, {@code 2m}). {@code infinite} and negative values mean "no bound".
 */
public final class DurationParser {
    public static final Duration UNBOUNDED = Duration.ofMillis(-1);

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("infinite".equals(trimmed) || "forever".equals(trimmed)) {
            return Optional.of(UNBOUNDED);
        }
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        }
        try {
            long value = Long.parseLong(trimmed.trim());
            return Optional.of(value < 0 ? UNBOUNDED : Duration.ofMillis(value * multiplier));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
    }

    public static long toMillis(String raw, long fallback) {
        return parse(raw).map(Duration::toMillis).orElse(fallback);
    }
}
