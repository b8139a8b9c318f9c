package work.lcod.installer.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.ReferenceCycleException;
import work.lcod.installer.errors.ResolutionDepthException;
import work.lcod.installer.errors.UnknownReferenceException;
import work.lcod.installer.support.CompilerTestSupport;

class ReferenceResolverTest {
    private static ReferenceResolver resolver(String yaml, Dialect dialect) {
        return ReferenceResolver.create(CompilerTestSupport.tree(yaml), new VariableRegistry(dialect));
    }

    private static ReferenceResolver resolver(String yaml) {
        return resolver(yaml, Dialect.NSIS);
    }

    @Test
    void resolvesPathReferencesRecursively() {
        var resolver = resolver("""
            app:
              name: Demo
              version: 2.1.0
              title: "${app.name} ${app.version}"
            """);
        assertEquals("Setup for Demo 2.1.0", resolver.resolve("Setup for ${app.title}"));
    }

    @Test
    void resolvesBuiltinsPerDialect() {
        var yaml = "app:\n  name: Demo\n";
        assertEquals("$INSTDIR\\bin", resolver(yaml).resolve("$INSTDIR\\bin"));
        assertEquals("[INSTALLDIR]\\bin", resolver(yaml, Dialect.WIX).resolve("$INSTDIR\\bin"));
        assertEquals("{app}\\bin", resolver(yaml, Dialect.INNO).resolve("$INSTDIR\\bin"));
    }

    @Test
    void escapedDollarIsLiteral() {
        var resolver = resolver("app:\n  name: Demo\n");
        assertEquals("cost: $INSTDIR", resolver.resolve("cost: $$INSTDIR"));
    }

    @Test
    void unknownReferencesPassThrough() {
        var resolver = resolver("app:\n  name: Demo\n");
        assertEquals("${app.missing} $NOT_A_VAR", resolver.resolve("${app.missing} $NOT_A_VAR"));
    }

    @Test
    void containerValuesDoNotSubstitute() {
        var resolver = resolver("""
            app:
              name: Demo
            """);
        assertEquals("${app}", resolver.resolve("${app}"));
    }

    @Test
    void customVariablesAreReachable() {
        var resolver = resolver("""
            app:
              name: Demo
            variables:
              DATA_DIR: "$APPDATA\\\\${app.name}"
            """);
        assertEquals("$APPDATA\\Demo\\cache", resolver.resolve("${variables.DATA_DIR}\\cache"));
        assertTrue(resolver.registry().has("DATA_DIR"));
    }

    @Test
    void resolutionIsIdempotent() {
        var resolver = resolver("""
            app:
              name: Demo
              dir: "$PROGRAMFILES64\\\\${app.name}"
            """);
        var once = resolver.resolve("${app.dir}");
        assertEquals(once, resolver.resolve(once));
    }

    @Test
    void cycleReportsTheFullChain() {
        var resolver = resolver("""
            a:
              x: "${a.y}"
              y: "${a.z}"
              z: "${a.x}"
            """);
        var error = assertThrows(ReferenceCycleException.class, () -> resolver.resolve("${a.x}"));
        assertEquals(List.of("a.x", "a.y", "a.z", "a.x"), error.chain());
        assertEquals("reference_cycle", error.code());
    }

    @Test
    void siblingReferencesAreNotCycles() {
        var resolver = resolver("""
            a:
              name: Demo
              both: "${a.name}-${a.name}"
            """);
        assertEquals("Demo-Demo", resolver.resolve("${a.both}"));
    }

    @Test
    void deepNestingFails() {
        var yaml = new StringBuilder("v:\n");
        for (int i = 0; i < 12; i++) {
            yaml.append("  v").append(i).append(": \"${v.v").append(i + 1).append("}\"\n");
        }
        yaml.append("  v12: end\n");
        var resolver = resolver(yaml.toString());
        assertThrows(ResolutionDepthException.class, () -> resolver.resolve("${v.v0}"));
        assertEquals("end", resolver.resolve("${v.v5}"));
    }

    @Test
    void validateListsUnknownsInOrder() {
        var resolver = resolver("app:\n  name: Demo\n");
        var unknown = resolver.validate("${app.name} ${app.nope} $INSTDIR $NOPE", false);
        assertEquals(List.of("${app.nope}", "$NOPE"), unknown);
    }

    @Test
    void strictValidationJoinsAllUnknowns() {
        var resolver = resolver("app:\n  name: Demo\n");
        var error = assertThrows(UnknownReferenceException.class,
            () -> resolver.validate("${app.one} ${app.two}", true));
        assertTrue(error.getMessage().contains("${app.one}"));
        assertTrue(error.getMessage().contains("${app.two}"));
        assertEquals(List.of("${app.one}", "${app.two}"), error.unknown());
    }
}
