package work.lcod.installer.variables;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.errors.UnknownReferenceException;

/**
 * Built-in variables for one dialect plus a per-run overlay of custom variables.
 *
 * <p>Instances are owned by a single compilation; the built-in table they read is shared and
 * immutable.</p>
 */
public final class VariableRegistry {
    private final Dialect dialect;
    private final Map<String, String> custom = new LinkedHashMap<>();

    public VariableRegistry(Dialect dialect) {
        this.dialect = dialect;
    }

    public Dialect dialect() {
        return dialect;
    }

    public static Set<String> builtinNames() {
        return BuiltinVariables.TABLE.keySet();
    }

    public static Optional<VariableDefinition> definition(String name) {
        return Optional.ofNullable(BuiltinVariables.TABLE.get(name));
    }

    /**
     * Token for {@code name} in this registry's dialect, or empty when the name is not built in.
     */
    public Optional<String> resolveBuiltin(String name) {
        return definition(name).map(definition -> definition.token(dialect));
    }

    public void addCustom(String name, String value) {
        custom.put(name, value);
    }

    public Optional<String> custom(String name) {
        return Optional.ofNullable(custom.get(name));
    }

    public Map<String, String> customVariables() {
        return Collections.unmodifiableMap(custom);
    }

    public boolean has(String name) {
        return BuiltinVariables.TABLE.containsKey(name) || custom.containsKey(name);
    }

    /**
     * Strict variant of {@link #has(String)}.
     *
     * @throws UnknownReferenceException listing every built-in name, sorted
     */
    public void require(String name) {
        if (!has(name)) {
            throw new UnknownReferenceException(
                "Unknown variable: $" + name + ". Available built-in variables: " + String.join(", ", builtinNames()),
                List.of(name)
            );
        }
    }
}
