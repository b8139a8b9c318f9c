package work.lcod.installer.nsis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class ReorderPassTest {
    @Test
    void languagesAndStringsFollowTheLastPage() {
        var input = List.of(
            "!define MUI_ABORTWARNING",
            "!insertmacro MUI_LANGUAGE \"English\"",
            "LangString DESC_0 ${LANG_ENGLISH} \"Core\"",
            "!insertmacro MUI_PAGE_WELCOME",
            "Page custom ShortcutOptionsPage ShortcutOptionsPageLeave",
            "!insertmacro MUI_UNPAGE_INSTFILES",
            "!insertmacro MUI_LANGUAGE \"SimpChinese\"",
            "Section \"-Install\" SEC_INSTALL"
        );

        assertEquals(List.of(
            "!define MUI_ABORTWARNING",
            "!insertmacro MUI_PAGE_WELCOME",
            "Page custom ShortcutOptionsPage ShortcutOptionsPageLeave",
            "!insertmacro MUI_UNPAGE_INSTFILES",
            "!insertmacro MUI_LANGUAGE \"English\"",
            "!insertmacro MUI_LANGUAGE \"SimpChinese\"",
            "LangString DESC_0 ${LANG_ENGLISH} \"Core\"",
            "Section \"-Install\" SEC_INSTALL"
        ), ReorderPass.apply(input));
    }

    @Test
    void indentedLinesAreRecognised() {
        var input = List.of(
            "  LangString A ${LANG_ENGLISH} \"a\"",
            "  !insertmacro MUI_LANGUAGE \"English\"",
            "  !insertmacro MUI_PAGE_DIRECTORY"
        );

        assertEquals(List.of(
            "  !insertmacro MUI_PAGE_DIRECTORY",
            "  !insertmacro MUI_LANGUAGE \"English\"",
            "  LangString A ${LANG_ENGLISH} \"a\""
        ), ReorderPass.apply(input));
    }

    @Test
    void withoutPagesNothingMoves() {
        var input = List.of(
            "LangString A ${LANG_ENGLISH} \"a\"",
            "!insertmacro MUI_LANGUAGE \"English\""
        );
        assertEquals(input, ReorderPass.apply(input));
    }

    @Test
    void withoutLanguagesNothingMoves() {
        var input = List.of(
            "LangString A ${LANG_ENGLISH} \"a\"",
            "!insertmacro MUI_PAGE_WELCOME"
        );
        assertEquals(input, ReorderPass.apply(input));
    }
}
