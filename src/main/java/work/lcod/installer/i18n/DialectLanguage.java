package work.lcod.installer.i18n;

/**
 * How one canonical language is spelled in a target dialect.
 *
 * @param displayName name used by the dialect's language directive (e.g. {@code SimpChinese})
 * @param constant    language constant used to key string tables (e.g. {@code LANG_SIMPCHINESE})
 * @param lcid        Windows locale id
 */
public record DialectLanguage(String canonical, String displayName, String constant, int lcid) {}
