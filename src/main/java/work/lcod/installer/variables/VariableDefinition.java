package work.lcod.installer.variables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.DialectTokenAbsentException;

/**
 * A built-in installer-runtime variable with its spelling in each dialect.
 */
public record VariableDefinition(String name, String description, Map<Dialect, String> tokens) {
    public VariableDefinition {
        Objects.requireNonNull(name, "name");
        var copy = new EnumMap<Dialect, String>(Dialect.class);
        copy.putAll(tokens);
        tokens = Collections.unmodifiableMap(copy);
    }

    /**
     * @throws DialectTokenAbsentException when the variable has no token for {@code dialect}
     */
    public String token(Dialect dialect) {
        var token = tokens.get(dialect);
        if (token == null || token.isEmpty()) {
            throw new DialectTokenAbsentException("Variable", name, dialect, new ArrayList<>(tokens.keySet()));
        }
        return token;
    }
}
