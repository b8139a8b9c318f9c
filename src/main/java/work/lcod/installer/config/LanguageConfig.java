package work.lcod.installer.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.installer.i18n.Languages;

/**
 * A configured installer language with optional overrides of built-in strings.
 */
public record LanguageConfig(String name, Map<String, String> strings) {
    public LanguageConfig {
        name = Languages.resolve(name);
        strings = Collections.unmodifiableMap(new LinkedHashMap<>(strings));
    }

    public static LanguageConfig from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return new LanguageConfig(value.text(""), Map.of());
        }
        var strings = new LinkedHashMap<String, String>();
        value.get("strings").asMap().ifPresent(map ->
            map.entries().forEach((id, text) -> strings.put(id, text.text(""))));
        return new LanguageConfig(value.text("name", ""), strings);
    }
}
