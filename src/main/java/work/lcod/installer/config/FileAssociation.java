package work.lcod.installer.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record FileAssociation(
    String extension,
    String progId,
    LangText description,
    String application,
    String defaultIcon,
    Map<String, String> verbs,
    boolean registerForAllUsers
) {
    public FileAssociation {
        verbs = Collections.unmodifiableMap(new LinkedHashMap<>(verbs));
    }

    public static FileAssociation from(ConfigValue value) {
        var verbs = new LinkedHashMap<String, String>();
        value.get("verbs").asMap().ifPresent(map ->
            map.entries().forEach((verb, command) -> verbs.put(verb, command.text(""))));
        return new FileAssociation(
            value.text("extension", ""),
            value.text("prog_id", ""),
            LangText.from(value.get("description")),
            value.text("application", ""),
            value.text("default_icon", ""),
            verbs,
            value.bool("register_for_all_users", true)
        );
    }
}
