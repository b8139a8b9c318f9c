package work.lcod.installer.runtime;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last sweep over the assembled script for lower-case {@code ${dotted.path}} references. Upper-case
 * tokens such as {@code ${APP_NAME}} belong to the script dialect and are left alone.
 */
public final class FinalSubstitution {
    private static final Pattern LOWERCASE_REFERENCE = Pattern.compile("\\$\\{([a-z][a-z0-9_.]*)\\}");

    private FinalSubstitution() {}

    public static String apply(String script, BuildContext ctx) {
        var matcher = LOWERCASE_REFERENCE.matcher(script);
        var out = new StringBuilder(script.length());
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(ctx.resolve(matcher.group(0))));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
