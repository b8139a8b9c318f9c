package work.lcod.installer.i18n;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.DialectTokenAbsentException;

class LanguageMappingsTest {
    @Test
    void aliasesResolveCaseInsensitively() {
        assertEquals("SimplifiedChinese", Languages.resolve("zh-cn"));
        assertEquals("SimplifiedChinese", Languages.resolve("SIMPCHINESE"));
        assertEquals("BrazilianPortuguese", Languages.resolve("portuguesebr"));
        assertEquals("Elvish", Languages.resolve(" Elvish "));
    }

    @Test
    void nsisMappingCarriesConstantAndLcid() {
        var mapping = LanguageMappings.require(Dialect.NSIS, "zh");
        assertEquals("SimpChinese", mapping.displayName());
        assertEquals("LANG_SIMPCHINESE", mapping.constant());
        assertEquals(2052, mapping.lcid());
        assertEquals("SimplifiedChinese", LanguageMappings.byDisplayName(Dialect.NSIS, "SimpChinese").orElseThrow().canonical());
    }

    @Test
    void missingMappingNamesDialectsThatHaveOne() {
        var error = assertThrows(DialectTokenAbsentException.class, () -> LanguageMappings.require(Dialect.WIX, "English"));
        assertEquals("dialect_token_absent", error.code());
        assertEquals(List.of(Dialect.NSIS), error.data());
        assertTrue(LanguageMappings.lookup(Dialect.NSIS, "Elvish").isEmpty());
    }
}
