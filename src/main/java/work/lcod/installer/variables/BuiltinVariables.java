package work.lcod.installer.variables;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import work.lcod.installer.api.Dialect;

/**
 * Process-wide table of built-in variables. Adding a dialect means adding one column here.
 */
final class BuiltinVariables {
    static final Map<String, VariableDefinition> TABLE = build();

    private BuiltinVariables() {}

    private static Map<String, VariableDefinition> build() {
        var table = new TreeMap<String, VariableDefinition>();
        define(table, "INSTDIR", "Installation directory", "$INSTDIR", "[INSTALLDIR]", "{app}");
        define(table, "PROGRAMFILES", "Program Files directory (32-bit)", "$PROGRAMFILES", "[ProgramFilesFolder]", "{pf}");
        define(table, "PROGRAMFILES64", "Program Files directory (64-bit)", "$PROGRAMFILES64", "[ProgramFiles64Folder]", "{pf64}");
        define(table, "APPDATA", "Roaming application data directory", "$APPDATA", "[AppDataFolder]", "{userappdata}");
        define(table, "LOCALAPPDATA", "Local application data directory", "$LOCALAPPDATA", "[LocalAppDataFolder]", "{localappdata}");
        define(table, "DESKTOP", "User desktop", "$DESKTOP", "[DesktopFolder]", "{userdesktop}");
        define(table, "STARTMENU", "Start menu root", "$STARTMENU", "[StartMenuFolder]", "{userstartmenu}");
        define(table, "SMPROGRAMS", "Start menu programs folder", "$SMPROGRAMS", "[ProgramMenuFolder]", "{userprograms}");
        define(table, "TEMP", "Temporary directory", "$TEMP", "[TempFolder]", "{tmp}");
        define(table, "WINDIR", "Windows directory", "$WINDIR", "[WindowsFolder]", "{win}");
        define(table, "SYSDIR", "Windows system directory", "$SYSDIR", "[SystemFolder]", "{sys}");
        define(table, "COMMONFILES", "Common Files directory (32-bit)", "$COMMONFILES", "[CommonFilesFolder]", "{cf}");
        define(table, "COMMONFILES64", "Common Files directory (64-bit)", "$COMMONFILES64", "[CommonFiles64Folder]", "{cf64}");
        define(table, "DOCUMENTS", "User documents directory", "$DOCUMENTS", "[PersonalFolder]", "{userdocs}");
        return Collections.unmodifiableMap(table);
    }

    private static void define(
        Map<String, VariableDefinition> table,
        String name,
        String description,
        String nsis,
        String wix,
        String inno
    ) {
        var tokens = new EnumMap<Dialect, String>(Dialect.class);
        tokens.put(Dialect.NSIS, nsis);
        tokens.put(Dialect.WIX, wix);
        tokens.put(Dialect.INNO, inno);
        table.put(name, new VariableDefinition(name, description, tokens));
    }
}
