package work.lcod.installer.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.installer.config.ConfigLoader;
import work.lcod.installer.config.ConfigTree;
import work.lcod.installer.config.ConfigValue;
import work.lcod.installer.config.PackageConfig;
import work.lcod.installer.errors.CompilerException;
import work.lcod.installer.errors.UnknownReferenceException;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.FinalSubstitution;
import work.lcod.installer.runtime.ScriptBackends;
import work.lcod.installer.runtime.ScriptWriter;

/**
 * Public entry point: configuration in, installer script out.
 */
public final class InstallerCompiler {
    private static final Logger log = LoggerFactory.getLogger(InstallerCompiler.class);

    private final ScriptBackends backends;

    public InstallerCompiler() {
        this(ScriptBackends.defaults());
    }

    public InstallerCompiler(ScriptBackends backends) {
        this.backends = backends;
    }

    /**
     * Runs the whole pipeline. Failures are reported through the result, never thrown.
     */
    public CompileResult compile(CompileConfiguration configuration) {
        var started = Instant.now();
        try {
            var tree = configuration.tree().orElseGet(() -> ConfigLoader.load(configuration.configPath().orElseThrow()));
            var config = PackageConfig.from(tree);
            var backend = backends.require(configuration.dialect());
            var output = configuration.effectiveOutput(tree, config.app().name());
            var ctx = BuildContext.create(config, configuration.dialect(), output);
            log.info("Compiling {} to {} ({})", configuration.source(), output, configuration.dialect());

            var unresolved = validateReferences(ctx, tree, configuration.strictReferences());
            var lines = backend.assemble(ctx);
            var script = FinalSubstitution.apply(String.join("\n", lines), ctx);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("config", configuration.source());
            metadata.put("format", configuration.dialect().id());
            metadata.put("lines", lines.size());
            metadata.put("unresolvedReferences", unresolved);
            if (configuration.dryRun()) {
                metadata.put("output", null);
                metadata.put("dryRun", true);
            } else {
                var bytes = ScriptWriter.write(output, script, true);
                metadata.put("output", output.toString());
                metadata.put("bytes", bytes);
            }
            metadata.put("status", "ok");
            log.info("Generated {} lines of {} script", lines.size(), configuration.dialect());
            return CompileResult.success(metadata, script, started);
        } catch (RuntimeException ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("config", configuration.source());
            errorMeta.put("format", configuration.dialect().id());
            errorMeta.put("code", codeOf(ex));
            if (ex instanceof CompilerException compilerError && compilerError.data() != null) {
                errorMeta.put("data", compilerError.data());
            }
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            if (Boolean.getBoolean("lcod.installer.debug")) {
                ex.printStackTrace();
            }
            log.debug("Compilation failed", ex);
            return CompileResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    private static String codeOf(RuntimeException ex) {
        if (ex instanceof CompilerException compilerError) {
            return compilerError.code();
        }
        if (ex instanceof IllegalArgumentException) {
            return "invalid_config";
        }
        return "compile_failed";
    }

    /**
     * Checks every string of the configuration for references that cannot be resolved. In strict
     * mode any unknown reference aborts the run; otherwise each reference is logged once.
     */
    static List<String> validateReferences(BuildContext ctx, ConfigTree tree, boolean strict) {
        var texts = new ArrayList<String>();
        collectTexts(tree.root(), texts);
        var unknown = new LinkedHashSet<String>();
        for (var text : texts) {
            unknown.addAll(ctx.resolver().validate(text, false));
        }
        if (strict && !unknown.isEmpty()) {
            var references = List.copyOf(unknown);
            throw new UnknownReferenceException(
                "Unknown variable references found: " + String.join(", ", references), references);
        }
        for (var reference : unknown) {
            log.warn("Unresolved reference {} left as-is", reference);
        }
        return List.copyOf(unknown);
    }

    private static void collectTexts(ConfigValue value, List<String> out) {
        if (value instanceof ConfigValue.MapValue map) {
            for (Map.Entry<String, ConfigValue> entry : map.entries().entrySet()) {
                collectTexts(entry.getValue(), out);
            }
        } else if (value instanceof ConfigValue.ListValue list) {
            list.items().forEach(item -> collectTexts(item, out));
        } else {
            value.asText().ifPresent(out::add);
        }
    }
}
