package work.lcod.installer.nsis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.installer.support.CompilerTestSupport.indexOf;
import static work.lcod.installer.support.CompilerTestSupport.lastIndexOf;
import static work.lcod.installer.support.CompilerTestSupport.lines;
import static work.lcod.installer.support.CompilerTestSupport.script;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.MissingTranslationException;
import work.lcod.installer.i18n.LanguageMappings;

class NsisScriptGeneratorTest {
    private static final String MINIMAL = """
        app:
          name: Demo
          version: 1.2.3
          publisher: Acme
        """;

    @Test
    void minimalScriptHasHeaderInstallAndUninstall() {
        var text = script(MINIMAL);
        assertTrue(text.contains("\nUnicode true\n"), text);
        assertTrue(text.contains("!define APP_NAME \"Demo\""), text);
        assertTrue(text.contains("!define APP_VERSION_VI \"1.2.3.0\""), text);
        assertTrue(text.contains("Section \"-Install\" SEC_INSTALL"), text);
        assertTrue(text.contains("WriteUninstaller \"$INSTDIR\\Uninstall.exe\""), text);
        assertTrue(text.contains("Section \"Uninstall\""), text);
        assertTrue(text.contains("!insertmacro MUI_LANGUAGE \"English\""), text);
        assertFalse(text.contains("Function _StrContains"), text);
        assertFalse(text.contains("Function .onInstSuccess"), text);
    }

    @Test
    void languagesFollowPagesAndStringsFollowLanguages() {
        var lines = lines(MINIMAL + """
            languages:
              - en
              - zh
            """);
        var lastPage = Math.max(lastIndexOf(lines, "!insertmacro MUI_PAGE"), lastIndexOf(lines, "!insertmacro MUI_UNPAGE"));
        var firstLanguage = indexOf(lines, "!insertmacro MUI_LANGUAGE");
        var lastLanguage = lastIndexOf(lines, "!insertmacro MUI_LANGUAGE");
        var firstString = indexOf(lines, "LangString ");

        assertTrue(lastPage >= 0 && lastPage < firstLanguage, "languages after pages");
        assertTrue(lastLanguage < firstString, "strings after languages");
        assertTrue(lines.contains("  !insertmacro MUI_LANGDLL_DISPLAY"));
        assertTrue(lines.contains("!insertmacro MUI_RESERVEFILE_LANGDLL"));
    }

    @Test
    void languageDisplayNamesMapBackToConfiguredLanguages() {
        var lines = lines(MINIMAL + """
            languages:
              - English
              - SimplifiedChinese
            """);
        var names = new ArrayList<String>();
        for (var line : lines) {
            var stripped = line.strip();
            if (stripped.startsWith("!insertmacro MUI_LANGUAGE ")) {
                var display = stripped.substring("!insertmacro MUI_LANGUAGE ".length()).replace("\"", "");
                names.add(LanguageMappings.byDisplayName(Dialect.NSIS, display).orElseThrow().canonical());
            }
        }
        assertEquals(List.of("English", "SimplifiedChinese"), names);
    }

    @Test
    void builtinStringsAreDeclaredPerLanguage() {
        var text = script(MINIMAL + """
            languages:
              - en
              - name: fr
                strings:
                  finish_run: Lancer Demo maintenant
            """);
        assertTrue(text.contains("LangString FINISH_RUN ${LANG_FRENCH} \"Lancer Demo maintenant\""), text);
        assertTrue(text.contains("LangString INSTALLER_RUNNING ${LANG_ENGLISH} "), text);
        assertTrue(text.contains("MessageBox MB_OK|MB_ICONEXCLAMATION \"$(INSTALLER_RUNNING)\""), text);
    }

    @Test
    void localizedDescriptionWithoutLanguagesIsRejected() {
        var yaml = MINIMAL + """
            packages:
              core:
                source: bin/**
                description:
                  en: Core files
                  zh: 核心文件
            """;
        var error = assertThrows(IllegalArgumentException.class, () -> lines(yaml));
        assertEquals("packages.core.description requires languages when using per-language values.", error.getMessage());
    }

    @Test
    void missingTranslationNamesFieldAndLanguage() {
        var yaml = MINIMAL + """
            languages: [en, fr]
            packages:
              core:
                source: bin/**
                description:
                  en: Core files
            """;
        var error = assertThrows(MissingTranslationException.class, () -> lines(yaml));
        assertTrue(error.getMessage().contains("packages.core.description"), error.getMessage());
        assertTrue(error.getMessage().contains("French"), error.getMessage());
    }

    @Test
    void componentTreeBecomesSectionsAndGroups() {
        var text = script(MINIMAL + """
            packages:
              core:
                source: bin/**
                description: Core files
              tools:
                description: Tools
                children:
                  cli:
                    source: tools/cli.exe
                    optional: true
                    default: false
                    post_install: "$INSTDIR\\\\cli.exe --register"
            """);
        assertTrue(text.contains("Section \"core\" SEC_PKG_0"), text);
        assertTrue(text.contains("SectionGroup /e \"tools\" SEC_GROUP_0"), text);
        assertTrue(text.contains("Section \"cli\" SEC_PKG_1"), text);
        assertTrue(text.contains("ExecWait \"$INSTDIR\\cli.exe --register\""), text);
        assertTrue(text.contains("LangString DESC_0 ${LANG_ENGLISH} \"Core files\""), text);
        assertTrue(text.contains("!insertmacro MUI_DESCRIPTION_TEXT ${SEC_PKG_0} $(DESC_0)"), text);
        assertTrue(text.contains("!insertmacro MUI_DESCRIPTION_TEXT ${SEC_GROUP_0} $(DESC_1)"), text);
        assertTrue(text.contains("SectionSetFlags ${SEC_PKG_0} 17"), text);
        assertTrue(text.contains("SectionSetFlags ${SEC_PKG_1} 0"), text);
    }

    @Test
    void optionalShortcutIsGuardedAndOffered() {
        var text = script(MINIMAL + """
            install:
              desktop_shortcut:
                target: Demo.exe
                optional: true
                default: false
            """);
        assertTrue(text.contains("StrCmp $CREATE_SC_0 \"1\" 0 _sc_0_skip"), text);
        assertTrue(text.contains("CreateShortCut \"$DESKTOP\\${APP_NAME}.lnk\" \"$INSTDIR\\Demo.exe\""), text);
        assertTrue(text.contains("Var CREATE_SC_0"), text);
        assertTrue(text.contains("Page custom ShortcutOptionsPage ShortcutOptionsPageLeave"), text);
        assertTrue(text.contains("StrCpy $CREATE_SC_0 \"0\""), text);
        assertTrue(text.contains("Delete \"$DESKTOP\\${APP_NAME}.lnk\""), text);
    }

    @Test
    void pathAppendPullsInHelpers() {
        var text = script(MINIMAL + """
            install:
              env_vars:
                - name: PATH
                  value: $INSTDIR\\bin
                  append: true
            """);
        assertTrue(text.contains("Function _StrContains"), text);
        assertTrue(text.contains("Function un._RemovePathEntry"), text);
        assertTrue(text.contains("StrCmp $R9 \"1\" _path_global_0_skip"), text);
        assertTrue(text.contains("Call un._RemovePathEntry"), text);
    }

    @Test
    void loggingReportsSkippedOptionalComponents() {
        var text = script(MINIMAL + """
            logging:
              enabled: true
            packages:
              extras:
                source: extras/**
                optional: true
            """);
        assertTrue(text.contains("Function .onInstSuccess"), text);
        assertTrue(text.contains("SectionGetFlags ${SEC_PKG_0} $0"), text);
        assertTrue(text.contains("!insertmacro LogWrite \"Skipping component: extras\""), text);
    }

    @Test
    void finishPageRunDirectiveIsDropped() {
        var kept = NsisScriptGenerator.dropOverridden(List.of(
            "!define MUI_FINISHPAGE_RUN \"$INSTDIR\\Demo.exe\"",
            "  !define MUI_FINISHPAGE_RUN_TEXT \"Run\"",
            "!define MUI_FINISHPAGE_SHOWREADME \"\""
        ));
        assertEquals(List.of("!define MUI_FINISHPAGE_SHOWREADME \"\""), kept);
    }

    @Test
    void launchOnFinishUsesCustomFunction() {
        var text = script(MINIMAL + """
            install:
              launch_on_finish: Demo.exe
            """);
        assertFalse(text.contains("MUI_FINISHPAGE_RUN"), text);
        assertTrue(text.contains("!define MUI_FINISHPAGE_SHOWREADME_FUNCTION LaunchApplication"), text);
        assertTrue(text.contains("Function LaunchApplication"), text);
        assertTrue(text.contains("Exec '\"$INSTDIR\\Demo.exe\"'"), text);
    }
}
