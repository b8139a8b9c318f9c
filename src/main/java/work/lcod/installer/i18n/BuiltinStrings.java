package work.lcod.installer.i18n;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in installer UI strings shipped with the compiler.
 *
 * <p>The tables are read once from {@code builtin-strings.yaml} and never mutated afterwards.</p>
 */
public final class BuiltinStrings {
    private static final String RESOURCE = "builtin-strings.yaml";

    /** String ids emitted for every configured language. Stable across dialects. */
    public static final List<String> IDS = List.of(
        "shortcuts_desktop",
        "shortcuts_startmenu",
        "shortcuts_page_title",
        "shortcuts_page_desc",
        "langpage_title",
        "langpage_desc",
        "finish_run",
        "uninstall_not_finished",
        "installer_running",
        "uninstaller_running",
        "signature_failed",
        "requires_windows",
        "not_enough_space",
        "not_enough_memory",
        "need_admin",
        "existing_install_prompt",
        "existing_install_prompt_no_ver",
        "existing_install_abort",
        "existing_install_abort_no_ver"
    );

    private static final Map<String, Map<String, String>> TABLES = load();

    private BuiltinStrings() {}

    /**
     * Lookup order: user override, built-in text for the language, English, empty string.
     */
    public static String lookup(String language, String id, Map<String, String> overrides) {
        if (overrides != null && overrides.containsKey(id)) {
            return overrides.get(id);
        }
        var table = TABLES.get(Languages.resolve(language));
        if (table != null && table.containsKey(id)) {
            return table.get(id);
        }
        return TABLES.getOrDefault(Languages.ENGLISH, Map.of()).getOrDefault(id, "");
    }

    public static String english(String id) {
        return lookup(Languages.ENGLISH, id, Map.of());
    }

    /** NSIS-style identifier for a string id, e.g. {@code finish_run -> FINISH_RUN}. */
    public static String constantName(String id) {
        return id.toUpperCase(Locale.ROOT);
    }

    private static Map<String, Map<String, String>> load() {
        var mapper = new ObjectMapper(new YAMLFactory());
        try (var in = BuiltinStrings.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + RESOURCE);
            }
            var root = mapper.readTree(in);
            var tables = new LinkedHashMap<String, Map<String, String>>();
            var languages = root.path("strings").fields();
            while (languages.hasNext()) {
                var entry = languages.next();
                tables.put(entry.getKey(), readTable(entry.getValue()));
            }
            var inherit = root.path("inherit").fields();
            while (inherit.hasNext()) {
                var entry = inherit.next();
                var parent = tables.get(entry.getValue().asText());
                if (parent != null) {
                    tables.putIfAbsent(entry.getKey(), parent);
                }
            }
            return Collections.unmodifiableMap(tables);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load " + RESOURCE, ex);
        }
    }

    private static Map<String, String> readTable(JsonNode node) {
        var table = new LinkedHashMap<String, String>();
        var fields = node.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            table.put(entry.getKey(), entry.getValue().asText());
        }
        return Collections.unmodifiableMap(table);
    }
}
