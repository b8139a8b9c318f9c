package work.lcod.installer.i18n;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical language names and the alias table that maps ISO codes and legacy spellings onto them.
 */
public final class Languages {
    public static final String ENGLISH = "English";

    private static final Map<String, LanguageInfo> LANGUAGES = buildLanguages();
    private static final Map<String, String> ALIASES = buildAliases(LANGUAGES);

    private Languages() {}

    /**
     * Case-insensitive alias resolution. Unknown names come back unchanged so dialect-specific
     * language names can still be looked up downstream.
     */
    public static String resolve(String name) {
        if (name == null) {
            return "";
        }
        var trimmed = name.trim();
        return ALIASES.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }

    public static Optional<LanguageInfo> info(String name) {
        return Optional.ofNullable(LANGUAGES.get(resolve(name)));
    }

    public static List<String> names() {
        return List.copyOf(LANGUAGES.keySet());
    }

    private static Map<String, LanguageInfo> buildLanguages() {
        var table = new LinkedHashMap<String, LanguageInfo>();
        add(table, "English", "en", "English (US)");
        add(table, "SimplifiedChinese", "zh-CN", "Simplified Chinese");
        add(table, "TraditionalChinese", "zh-TW", "Traditional Chinese");
        add(table, "French", "fr", "French (France)");
        add(table, "German", "de", "German (Germany)");
        add(table, "Spanish", "es", "Spanish (Spain)");
        add(table, "SpanishInternational", "es-419", "Spanish (International)");
        add(table, "Portuguese", "pt", "Portuguese (Portugal)");
        add(table, "BrazilianPortuguese", "pt-BR", "Portuguese (Brazil)");
        add(table, "Italian", "it", "Italian (Italy)");
        add(table, "Dutch", "nl", "Dutch (Netherlands)");
        add(table, "Polish", "pl", "Polish (Poland)");
        add(table, "Czech", "cs", "Czech (Czech Republic)");
        add(table, "Hungarian", "hu", "Hungarian (Hungary)");
        add(table, "Turkish", "tr", "Turkish (Turkey)");
        add(table, "Japanese", "ja", "Japanese (Japan)");
        add(table, "Korean", "ko", "Korean (South Korea)");
        add(table, "Russian", "ru", "Russian (Russia)");
        add(table, "Swedish", "sv", "Swedish (Sweden)");
        add(table, "Norwegian", "nb", "Norwegian (Bokmål)");
        add(table, "NorwegianNynorsk", "nn", "Norwegian (Nynorsk)");
        add(table, "Danish", "da", "Danish (Denmark)");
        add(table, "Ukrainian", "uk", "Ukrainian (Ukraine)");
        add(table, "Arabic", "ar", "Arabic (Saudi Arabia)");
        add(table, "Thai", "th", "Thai (Thailand)");
        add(table, "Vietnamese", "vi", "Vietnamese (Vietnam)");
        return Collections.unmodifiableMap(table);
    }

    private static void add(Map<String, LanguageInfo> table, String name, String iso, String description) {
        table.put(name, new LanguageInfo(name, iso, description));
    }

    private static Map<String, String> buildAliases(Map<String, LanguageInfo> languages) {
        var aliases = new LinkedHashMap<String, String>();
        languages.keySet().forEach(name -> aliases.put(name.toLowerCase(Locale.ROOT), name));
        languages.values().forEach(info -> aliases.put(info.isoCode().toLowerCase(Locale.ROOT), info.name()));
        aliases.put("chinese", "SimplifiedChinese");
        aliases.put("zh", "SimplifiedChinese");
        aliases.put("simpchinese", "SimplifiedChinese");
        aliases.put("tradchinese", "TraditionalChinese");
        aliases.put("portuguesebr", "BrazilianPortuguese");
        aliases.put("he", "Hebrew");
        aliases.put("fa", "Farsi");
        return Collections.unmodifiableMap(aliases);
    }
}
