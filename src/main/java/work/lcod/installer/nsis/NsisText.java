package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lcod.installer.i18n.BuiltinStrings;
import work.lcod.installer.runtime.BuildContext;

/**
 * Quoting and escaping rules of NSIS string literals.
 */
public final class NsisText {
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private NsisText() {}

    /** Escapes double quotes for use inside a {@code "..."} literal. */
    public static String escape(String value) {
        return value == null ? "" : value.replace("\"", "$\\\"");
    }

    public static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    /**
     * Escapes text for a {@code LangString}. Already escaped line breaks ({@code $\r}, {@code $\n})
     * are kept; raw line breaks are converted.
     */
    public static String escapeLangString(String value) {
        if (value == null) {
            return "";
        }
        var normalized = value.replace("$\\r", "\r").replace("$\\n", "\n");
        return escape(normalized).replace("\r", "$\\r").replace("\n", "$\\n");
    }

    /** Turns glob-style source paths into NSIS {@code File} paths. */
    public static String normalizePath(String path) {
        return path.replace("/**/", "\\")
            .replace("**/", "")
            .replace("/", "\\")
            .replace("**", "*");
    }

    /** Four-part numeric version required by {@code VIProductVersion}. */
    public static String versionInfo(String version) {
        var parts = new ArrayList<String>();
        var matcher = DIGITS.matcher(version == null ? "" : version);
        while (matcher.find() && parts.size() < 4) {
            parts.add(String.valueOf(Long.parseLong(matcher.group())));
        }
        while (parts.size() < 4) {
            parts.add("0");
        }
        return String.join(".", parts);
    }

    /** Last path segment of a URL or path, {@code download} when there is none. */
    public static String fileName(String source) {
        var normalized = source.replace('\\', '/');
        var slash = normalized.lastIndexOf('/');
        var name = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        var query = name.indexOf('?');
        if (query >= 0) {
            name = name.substring(0, query);
        }
        return name.isEmpty() ? "download" : name;
    }

    /**
     * A built-in message: a {@code $(ID)} reference when the script declares language strings,
     * otherwise the English text inlined.
     */
    public static String message(BuildContext ctx, String id) {
        if (ctx.hasLanguages()) {
            return "$(" + BuiltinStrings.constantName(id) + ")";
        }
        return escapeLangString(fill(ctx, id, BuiltinStrings.english(id)));
    }

    /** Fills the placeholders of a built-in string from the configuration. */
    static String fill(BuildContext ctx, String id, String text) {
        var requirements = ctx.config().install().systemRequirements();
        var megabytes = "not_enough_memory".equals(id) ? requirements.minRamMb() : requirements.minFreeSpaceMb();
        return text.replace("{mv}", requirements.minWindowsVersion())
            .replace("{mb}", String.valueOf(megabytes))
            .replace("{name}", ctx.appName());
    }

    static List<String> banner(String title) {
        return List.of(
            "; ===========================================================================",
            "; " + title,
            "; ==========================================================================="
        );
    }
}
