package work.lcod.installer.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import work.lcod.installer.support.CompilerTestSupport;

class FinalSubstitutionTest {
    @Test
    void resolvesLowercasePathsOnly() {
        var ctx = CompilerTestSupport.context("""
            app:
              name: Demo
              version: 1.2.3
            """);
        var script = "!define APP_NAME \"${app.name}\"\nOutFile \"${APP_NAME}-${app.version}.exe\"";
        assertEquals("!define APP_NAME \"Demo\"\nOutFile \"${APP_NAME}-1.2.3.exe\"", FinalSubstitution.apply(script, ctx));
    }

    @Test
    void unknownPathsSurvive() {
        var ctx = CompilerTestSupport.context("app:\n  name: Demo\n");
        assertEquals("${app.unknown}", FinalSubstitution.apply("${app.unknown}", ctx));
    }
}
