package work.lcod.installer.i18n;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.DialectTokenAbsentException;

/**
 * Per-dialect language tables. Only dialects with a script generator carry a table.
 */
public final class LanguageMappings {
    private static final Map<Dialect, Map<String, DialectLanguage>> TABLES = buildTables();

    private LanguageMappings() {}

    public static Optional<DialectLanguage> lookup(Dialect dialect, String language) {
        var table = TABLES.getOrDefault(dialect, Map.of());
        return Optional.ofNullable(table.get(Languages.resolve(language)));
    }

    public static DialectLanguage require(Dialect dialect, String language) {
        var canonical = Languages.resolve(language);
        return lookup(dialect, canonical).orElseThrow(() -> new DialectTokenAbsentException(
            "Language",
            canonical,
            dialect,
            dialectsFor(canonical)
        ));
    }

    /**
     * Reverse lookup from a dialect display name (as found in emitted language directives).
     */
    public static Optional<DialectLanguage> byDisplayName(Dialect dialect, String displayName) {
        return TABLES.getOrDefault(dialect, Map.of()).values().stream()
            .filter(mapping -> mapping.displayName().equalsIgnoreCase(displayName))
            .findFirst();
    }

    static List<Dialect> dialectsFor(String canonical) {
        return TABLES.entrySet().stream()
            .filter(entry -> entry.getValue().containsKey(canonical))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private static Map<Dialect, Map<String, DialectLanguage>> buildTables() {
        var tables = new EnumMap<Dialect, Map<String, DialectLanguage>>(Dialect.class);
        tables.put(Dialect.NSIS, buildNsis());
        return Collections.unmodifiableMap(tables);
    }

    private static Map<String, DialectLanguage> buildNsis() {
        var table = new LinkedHashMap<String, DialectLanguage>();
        nsis(table, "English", "English", 1033);
        nsis(table, "French", "French", 1036);
        nsis(table, "German", "German", 1031);
        nsis(table, "Spanish", "Spanish", 1034);
        nsis(table, "SpanishInternational", "SpanishInternational", 3082);
        nsis(table, "Portuguese", "Portuguese", 2070);
        nsis(table, "BrazilianPortuguese", "PortugueseBR", 1046);
        nsis(table, "Italian", "Italian", 1040);
        nsis(table, "Dutch", "Dutch", 1043);
        nsis(table, "Catalan", "Catalan", 1027);
        nsis(table, "Swedish", "Swedish", 1053);
        nsis(table, "Norwegian", "Norwegian", 1044);
        nsis(table, "NorwegianNynorsk", "NorwegianNynorsk", 2068);
        nsis(table, "Danish", "Danish", 1030);
        nsis(table, "Finnish", "Finnish", 1035);
        nsis(table, "Polish", "Polish", 1045);
        nsis(table, "Czech", "Czech", 1029);
        nsis(table, "Hungarian", "Hungarian", 1038);
        nsis(table, "Romanian", "Romanian", 1048);
        nsis(table, "Bulgarian", "Bulgarian", 1026);
        nsis(table, "Croatian", "Croatian", 1050);
        nsis(table, "Slovak", "Slovak", 1051);
        nsis(table, "Serbian", "Serbian", 3098);
        nsis(table, "SerbianLatin", "SerbianLatin", 2074);
        nsis(table, "Slovenian", "Slovenian", 1060);
        nsis(table, "Estonian", "Estonian", 1061);
        nsis(table, "Latvian", "Latvian", 1062);
        nsis(table, "Lithuanian", "Lithuanian", 1063);
        nsis(table, "Ukrainian", "Ukrainian", 1058);
        nsis(table, "Russian", "Russian", 1049);
        nsis(table, "SimplifiedChinese", "SimpChinese", 2052);
        nsis(table, "TraditionalChinese", "TradChinese", 1028);
        nsis(table, "Japanese", "Japanese", 1041);
        nsis(table, "Korean", "Korean", 1042);
        nsis(table, "Thai", "Thai", 1054);
        nsis(table, "Vietnamese", "Vietnamese", 1066);
        nsis(table, "Indonesian", "Indonesian", 1057);
        nsis(table, "Turkish", "Turkish", 1055);
        nsis(table, "Arabic", "Arabic", 1025);
        nsis(table, "Hebrew", "Hebrew", 1037);
        nsis(table, "Farsi", "Farsi", 1065);
        nsis(table, "Greek", "Greek", 1032);
        nsis(table, "Macedonian", "Macedonian", 1071);
        return Collections.unmodifiableMap(table);
    }

    private static void nsis(Map<String, DialectLanguage> table, String canonical, String mui, int lcid) {
        table.put(canonical, new DialectLanguage(canonical, mui, "LANG_" + mui.toUpperCase(Locale.ROOT), lcid));
    }
}
