package work.lcod.installer.runtime;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.nsis.NsisScriptGenerator;

/**
 * Script backends by dialect.
 */
public final class ScriptBackends {
    private final Map<Dialect, ScriptBackend> backends = new EnumMap<>(Dialect.class);

    public static ScriptBackends defaults() {
        return new ScriptBackends().register(new NsisScriptGenerator());
    }

    public ScriptBackends register(ScriptBackend backend) {
        backends.put(backend.dialect(), backend);
        return this;
    }

    public ScriptBackend get(Dialect dialect) {
        return backends.get(dialect);
    }

    /** Returns the backend for {@code dialect} or fails with the list of available formats. */
    public ScriptBackend require(Dialect dialect) {
        var backend = backends.get(dialect);
        if (backend == null) {
            var available = backends.keySet().stream().map(Dialect::id).collect(Collectors.joining(", "));
            throw new IllegalArgumentException(
                "No script generator for format '" + dialect.id() + "'. Available formats: " + available
            );
        }
        return backend;
    }

    public Map<Dialect, ScriptBackend> entries() {
        return Collections.unmodifiableMap(backends);
    }
}
