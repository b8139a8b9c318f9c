package work.lcod.installer.i18n;

/**
 * Dialect-neutral metadata for one installer language.
 */
public record LanguageInfo(String name, String isoCode, String description) {}
