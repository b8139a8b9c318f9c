package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves language registrations and string tables behind the last page declaration.
 *
 * <p>Modern UI only accepts {@code MUI_LANGUAGE} after every page macro, and {@code LangString}
 * entries need the {@code LANG_*} constants that {@code MUI_LANGUAGE} defines. Relative order within
 * each moved class is kept. Without a page declaration or a language directive the lines are
 * returned unchanged.</p>
 */
public final class ReorderPass {
    private ReorderPass() {}

    public static List<String> apply(List<String> lines) {
        var languages = new ArrayList<String>();
        var strings = new ArrayList<String>();
        var other = new ArrayList<String>();
        int lastPage = -1;
        for (var line : lines) {
            var stripped = line.strip();
            if (isPage(stripped)) {
                lastPage = other.size();
            }
            if (stripped.startsWith("!insertmacro MUI_LANGUAGE")) {
                languages.add(line);
            } else if (stripped.startsWith("LangString ")) {
                strings.add(line);
            } else {
                other.add(line);
            }
        }
        if (lastPage < 0 || languages.isEmpty()) {
            return lines;
        }
        var result = new ArrayList<String>(lines.size());
        result.addAll(other.subList(0, lastPage + 1));
        result.addAll(languages);
        result.addAll(strings);
        result.addAll(other.subList(lastPage + 1, other.size()));
        return result;
    }

    private static boolean isPage(String stripped) {
        return stripped.startsWith("!insertmacro MUI_PAGE")
            || stripped.startsWith("!insertmacro MUI_UNPAGE")
            || stripped.startsWith("Page custom");
    }
}
