package work.lcod.installer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Loads package descriptions (YAML, JSON or TOML) into a {@link ConfigTree}.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ConfigLoader() {}

    public static ConfigTree load(Path path) {
        var absolute = path.toAbsolutePath().normalize();
        var fileName = absolute.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            var content = Files.readString(absolute);
            Map<String, Object> raw;
            if (fileName.endsWith(".toml")) {
                raw = parseToml(content, absolute);
            } else if (fileName.endsWith(".json")) {
                raw = parseJackson(JSON_MAPPER, content, absolute);
            } else {
                raw = parseJackson(YAML_MAPPER, content, absolute);
            }
            log.debug("Loaded configuration {} ({} top-level keys)", absolute, raw.size());
            return ConfigTree.of(raw, absolute.getParent());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + absolute, ex);
        }
    }

    public static ConfigTree fromYaml(String yaml) {
        return fromYaml(yaml, null);
    }

    public static ConfigTree fromYaml(String yaml, Path baseDirectory) {
        try {
            return ConfigTree.of(parseJackson(YAML_MAPPER, yaml, null), baseDirectory);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid YAML configuration: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> parseJackson(ObjectMapper mapper, String content, Path source) throws IOException {
        var root = mapper.readTree(content);
        if (root == null || root.isNull() || root.isMissingNode()) {
            return new LinkedHashMap<>();
        }
        if (!root.isObject()) {
            throw new IOException("Configuration root must be a mapping" + (source != null ? ": " + source : ""));
        }
        @SuppressWarnings("unchecked")
        var map = (Map<String, Object>) convertNode(root);
        return map;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isBigDecimal()) {
            return node.decimalValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static Map<String, Object> parseToml(String content, Path source) throws IOException {
        TomlParseResult result = Toml.parse(content);
        if (result.hasErrors()) {
            var first = result.errors().get(0);
            throw new IOException("Invalid TOML in " + source + ": " + first.toString());
        }
        return convertTable(result);
    }

    private static Map<String, Object> convertTable(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (var key : table.keySet()) {
            map.put(key, convertToml(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertToml(Object value) {
        if (value instanceof TomlTable table) {
            return convertTable(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(convertToml(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
