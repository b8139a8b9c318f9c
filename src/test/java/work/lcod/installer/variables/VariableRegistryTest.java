package work.lcod.installer.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.UnknownReferenceException;

class VariableRegistryTest {
    @Test
    void unknownBuiltinIsAbsent() {
        var registry = new VariableRegistry(Dialect.NSIS);
        assertEquals(Optional.empty(), registry.resolveBuiltin("NOT_BUILTIN"));
        assertEquals(Optional.of("$SMPROGRAMS"), registry.resolveBuiltin("SMPROGRAMS"));
    }

    @Test
    void customOverlayLastWriteWins() {
        var registry = new VariableRegistry(Dialect.NSIS);
        registry.addCustom("CHANNEL", "beta");
        registry.addCustom("CHANNEL", "stable");
        assertEquals(Optional.of("stable"), registry.custom("CHANNEL"));
        assertTrue(registry.has("CHANNEL"));
        assertFalse(registry.has("OTHER"));
    }

    @Test
    void strictLookupListsSortedBuiltins() {
        var registry = new VariableRegistry(Dialect.WIX);
        var error = assertThrows(UnknownReferenceException.class, () -> registry.require("NOPE"));
        var names = new ArrayList<>(VariableRegistry.builtinNames());
        var sorted = new ArrayList<>(names);
        sorted.sort(null);
        assertEquals(sorted, names);
        assertTrue(error.getMessage().endsWith("Available built-in variables: " + String.join(", ", sorted)));
    }
}
