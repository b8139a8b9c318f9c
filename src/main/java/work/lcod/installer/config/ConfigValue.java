package work.lcod.installer.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Node of an immutable configuration tree: a mapping, a list, a scalar, or {@link #absent()}.
 *
 * <p>Accessors never throw on a missing key; they return {@code absent()} or the supplied
 * fallback so callers can treat absence as an ordinary outcome.</p>
 */
public interface ConfigValue {

    static ConfigValue absent() {
        return Absent.INSTANCE;
    }

    /**
     * Wraps plain Java values ({@link Map}, {@link List}, scalars) into config nodes.
     */
    static ConfigValue of(Object raw) {
        if (raw == null) {
            return Absent.INSTANCE;
        }
        if (raw instanceof ConfigValue value) {
            return value;
        }
        if (raw instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, ConfigValue>();
            map.forEach((key, value) -> entries.put(String.valueOf(key), of(value)));
            return new MapValue(entries);
        }
        if (raw instanceof List<?> list) {
            var items = new ArrayList<ConfigValue>(list.size());
            for (var item : list) {
                items.add(of(item));
            }
            return new ListValue(items);
        }
        return new Scalar(raw);
    }

    default boolean isAbsent() {
        return false;
    }

    default ConfigValue get(String key) {
        return Absent.INSTANCE;
    }

    default Optional<MapValue> asMap() {
        return Optional.empty();
    }

    default List<ConfigValue> items() {
        return List.of();
    }

    /**
     * Scalar rendered as text; empty for containers and absent values.
     */
    default Optional<String> asText() {
        return Optional.empty();
    }

    default String text(String fallback) {
        return asText().orElse(fallback);
    }

    default boolean bool(boolean fallback) {
        return fallback;
    }

    default long integer(long fallback) {
        return fallback;
    }

    default String text(String key, String fallback) {
        return get(key).text(fallback);
    }

    default boolean bool(String key, boolean fallback) {
        return get(key).bool(fallback);
    }

    default long integer(String key, long fallback) {
        return get(key).integer(fallback);
    }

    record Scalar(Object value) implements ConfigValue {
        @Override
        public Optional<String> asText() {
            if (value instanceof BigDecimal decimal) {
                return Optional.of(decimal.toPlainString());
            }
            return Optional.of(String.valueOf(value));
        }

        @Override
        public boolean bool(boolean fallback) {
            if (value instanceof Boolean flag) {
                return flag;
            }
            var normalized = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "true", "yes", "on", "1" -> true;
                case "false", "no", "off", "0" -> false;
                default -> fallback;
            };
        }

        @Override
        public long integer(long fallback) {
            if (value instanceof Number number) {
                return number.longValue();
            }
            try {
                return Long.parseLong(String.valueOf(value).trim());
            } catch (NumberFormatException ex) {
                return fallback;
            }
        }
    }

    record ListValue(List<ConfigValue> values) implements ConfigValue {
        public ListValue {
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public List<ConfigValue> items() {
            return values;
        }
    }

    record MapValue(Map<String, ConfigValue> entries) implements ConfigValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        @Override
        public ConfigValue get(String key) {
            var value = entries.get(key);
            return value != null ? value : Absent.INSTANCE;
        }

        @Override
        public Optional<MapValue> asMap() {
            return Optional.of(this);
        }

        public boolean has(String key) {
            return !get(key).isAbsent();
        }
    }

    enum Absent implements ConfigValue {
        INSTANCE;

        @Override
        public boolean isAbsent() {
            return true;
        }
    }
}
