package work.lcod.installer.nsis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class NsisTextTest {
    @Test
    void quotesAreEscapedWithDollarBackslash() {
        assertEquals("Say $\\\"hi$\\\"", NsisText.escape("Say \"hi\""));
        assertEquals("\"a$\\\"b\"", NsisText.quote("a\"b"));
        assertEquals("", NsisText.escape(null));
    }

    @Test
    void langStringsKeepEscapedBreaksAndConvertRawOnes() {
        assertEquals("one$\\r$\\ntwo", NsisText.escapeLangString("one$\\r$\\ntwo"));
        assertEquals("one$\\r$\\ntwo", NsisText.escapeLangString("one\r\ntwo"));
        assertEquals("line$\\n$\\\"quoted$\\\"", NsisText.escapeLangString("line\n\"quoted\""));
    }

    @Test
    void versionInfoHasFourNumericParts() {
        assertEquals("1.2.0.0", NsisText.versionInfo("1.2"));
        assertEquals("1.2.3.4", NsisText.versionInfo("v1.2.3.4.5"));
        assertEquals("2.0.7.0", NsisText.versionInfo("2.0.7-beta"));
        assertEquals("0.0.0.0", NsisText.versionInfo(null));
    }

    @Test
    void globsBecomeNsisPaths() {
        assertEquals("dist\\*", NsisText.normalizePath("dist/**"));
        assertEquals("dist\\*.dll", NsisText.normalizePath("dist/**/*.dll"));
    }

    @Test
    void fileNameStripsQueryAndDirectories() {
        assertEquals("vc_redist.x64.exe", NsisText.fileName("https://example.com/dl/vc_redist.x64.exe?x=1"));
        assertEquals("tool.msi", NsisText.fileName("deps\\tool.msi"));
        assertEquals("download", NsisText.fileName("https://example.com/"));
    }
}
