package work.lcod.installer.errors;

import java.util.List;
import work.lcod.installer.api.Dialect;

/**
 * A variable or language exists but has no spelling in the active dialect.
 */
public final class DialectTokenAbsentException extends CompilerException {
    public DialectTokenAbsentException(String kind, String name, Dialect dialect, List<Dialect> available) {
        super(
            "dialect_token_absent",
            kind + " '" + name + "' is not defined for tool '" + dialect.id() + "'. Available tools: " + available,
            List.copyOf(available)
        );
    }
}
