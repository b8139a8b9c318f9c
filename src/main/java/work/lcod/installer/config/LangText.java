package work.lcod.installer.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.installer.errors.MissingTranslationException;
import work.lcod.installer.i18n.Languages;

/**
 * A user-facing text that is either a single string or a set of per-language values.
 */
public record LangText(String text, Map<String, String> translations) {
    private static final LangText EMPTY = new LangText("", Map.of());

    public LangText {
        text = text == null ? "" : text;
        translations = Collections.unmodifiableMap(new LinkedHashMap<>(translations));
    }

    public static LangText empty() {
        return EMPTY;
    }

    public static LangText of(String text) {
        return new LangText(text, Map.of());
    }

    /**
     * A scalar becomes the default text; a mapping is read as language name to translation.
     */
    public static LangText from(ConfigValue value) {
        var map = value.asMap();
        if (map.isPresent()) {
            return new LangText("", canonicalize(map.get()));
        }
        return of(value.text(""));
    }

    /** Explicit per-language overrides win over what the base value declared. */
    public LangText withOverrides(ConfigValue overrides) {
        var map = overrides.asMap();
        if (map.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(translations);
        merged.putAll(canonicalize(map.get()));
        return new LangText(text, merged);
    }

    public boolean isEmpty() {
        return text.isBlank() && translations.isEmpty();
    }

    public boolean isLocalized() {
        return !translations.isEmpty();
    }

    /**
     * Text for one configured language: the translation, then the default text.
     *
     * @throws MissingTranslationException when neither covers the language
     */
    public String forLanguage(String language, String field) {
        var canonical = Languages.resolve(language);
        var translated = translations.get(canonical);
        if (translated != null) {
            return translated;
        }
        if (!text.isBlank()) {
            return text;
        }
        throw new MissingTranslationException(field, canonical, List.copyOf(translations.keySet()));
    }

    /** Best single-language rendering, used when no languages are configured. */
    public String defaultText() {
        if (!text.isBlank()) {
            return text;
        }
        var english = translations.get(Languages.ENGLISH);
        if (english != null) {
            return english;
        }
        return translations.values().stream().findFirst().orElse("");
    }

    private static Map<String, String> canonicalize(ConfigValue.MapValue map) {
        var result = new LinkedHashMap<String, String>();
        map.entries().forEach((key, value) -> result.put(Languages.resolve(key), value.text("")));
        return result;
    }
}
