package work.lcod.installer.variables;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.installer.config.ConfigTree;
import work.lcod.installer.config.ConfigValue;
import work.lcod.installer.errors.ReferenceCycleException;
import work.lcod.installer.errors.ResolutionDepthException;
import work.lcod.installer.errors.UnknownReferenceException;

/**
 * Resolves {@code ${dotted.path}} references against the configuration tree and {@code $NAME}
 * tokens against the {@link VariableRegistry}.
 *
 * <p>Path references are resolved first and their values recursively; unknown references of either
 * kind are left as they are. {@code $$} stands for a literal dollar sign.</p>
 */
public final class ReferenceResolver {
    public static final int MAX_DEPTH = 10;
    public static final String CUSTOM_VARIABLES_PREFIX = "variables";

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);
    private static final Pattern PATH_REFERENCE = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final Pattern BUILTIN_REFERENCE = Pattern.compile("\\$([A-Z_][A-Z0-9_]*)");
    private static final String ESCAPED_DOLLAR = "$$";
    private static final String DOLLAR_PLACEHOLDER = "\u0000LITERAL_DOLLAR\u0000";

    private final ConfigTree tree;
    private final VariableRegistry registry;

    public ReferenceResolver(ConfigTree tree, VariableRegistry registry) {
        this.tree = tree;
        this.registry = registry;
    }

    /**
     * Builds a resolver whose registry overlay holds every string entry of the {@code variables} map.
     */
    public static ReferenceResolver create(ConfigTree tree, VariableRegistry registry) {
        tree.get(CUSTOM_VARIABLES_PREFIX).asMap().ifPresent(map -> map.entries().forEach((name, value) ->
            value.asText().ifPresent(text -> registry.addCustom(name, text))));
        return new ReferenceResolver(tree, registry);
    }

    public VariableRegistry registry() {
        return registry;
    }

    public String resolve(String text) {
        return new Resolution().resolve(text, 0);
    }

    /**
     * Reports references whose target is absent, in order of appearance, without resolving anything.
     *
     * @throws UnknownReferenceException in strict mode when at least one reference is unknown
     */
    public List<String> validate(String text, boolean strict) {
        var unknown = new LinkedHashSet<String>();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        var paths = PATH_REFERENCE.matcher(text);
        while (paths.find()) {
            var path = paths.group(1);
            if (lookup(path).isEmpty()) {
                unknown.add("${" + path + "}");
            }
        }
        var builtins = BUILTIN_REFERENCE.matcher(text.replace(ESCAPED_DOLLAR, DOLLAR_PLACEHOLDER));
        while (builtins.find()) {
            var name = builtins.group(1);
            if (!registry.has(name)) {
                unknown.add("$" + name);
            }
        }
        var result = new ArrayList<>(unknown);
        if (strict && !result.isEmpty()) {
            throw new UnknownReferenceException("Unknown variable references found: " + String.join(", ", result), result);
        }
        if (!result.isEmpty()) {
            log.debug("Unresolved references left as-is: {}", result);
        }
        return result;
    }

    private Optional<String> lookup(String path) {
        ConfigValue value = tree.lookup(path);
        return value.asText();
    }

    /**
     * State of one top-level {@link #resolve(String)} call.
     */
    private final class Resolution {
        private final Set<String> inFlight = new LinkedHashSet<>();

        String resolve(String text, int depth) {
            if (text == null || text.isEmpty()) {
                return text;
            }
            if (depth > MAX_DEPTH) {
                throw new ResolutionDepthException(MAX_DEPTH, text);
            }
            var withPaths = replace(PATH_REFERENCE, text, match -> resolvePath(match, depth));
            return resolveBuiltins(withPaths);
        }

        private String resolvePath(Matcher match, int depth) {
            var path = match.group(1);
            if (inFlight.contains(path)) {
                var chain = new ArrayList<>(inFlight);
                chain.add(path);
                throw new ReferenceCycleException(chain);
            }
            inFlight.add(path);
            try {
                var value = lookup(path);
                if (value.isEmpty()) {
                    return match.group(0);
                }
                return resolve(value.get(), depth + 1);
            } finally {
                inFlight.remove(path);
            }
        }

        private String resolveBuiltins(String text) {
            var protectedText = text.replace(ESCAPED_DOLLAR, DOLLAR_PLACEHOLDER);
            var substituted = replace(BUILTIN_REFERENCE, protectedText, match ->
                registry.resolveBuiltin(match.group(1)).orElse(match.group(0)));
            return substituted.replace(DOLLAR_PLACEHOLDER, "$");
        }
    }

    private static String replace(Pattern pattern, String text, Function<Matcher, String> replacement) {
        var matcher = pattern.matcher(text);
        var out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
