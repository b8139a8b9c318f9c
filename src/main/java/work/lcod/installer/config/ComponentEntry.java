package work.lcod.installer.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A user-selectable component. Components with children are groups; the rest install files.
 */
public record ComponentEntry(
    String name,
    List<SourceMapping> sources,
    boolean optional,
    boolean defaultSelected,
    LangText description,
    List<String> postInstall,
    List<ComponentEntry> children,
    ActionSet actions
) {
    public ComponentEntry {
        Objects.requireNonNull(name, "name");
        sources = List.copyOf(sources);
        postInstall = List.copyOf(postInstall);
        children = List.copyOf(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public static ComponentEntry from(String name, ConfigValue value, String path) {
        var children = new ArrayList<ComponentEntry>();
        value.get("children").asMap().ifPresent(map -> map.entries().forEach((childName, child) -> {
            if (child.asMap().isPresent()) {
                children.add(from(childName, child, path + ".children." + childName));
            }
        }));

        var description = LangText.from(value.get("description"))
            .withOverrides(value.get("description_i18n"));

        return new ComponentEntry(
            name,
            readSources(value),
            value.bool("optional", false),
            value.bool("default", true),
            description,
            readPostInstall(value.get("post_install")),
            children,
            ActionSet.from(value, path)
        );
    }

    private static List<SourceMapping> readSources(ConfigValue value) {
        var defaultDestination = value.text("destination", FileEntry.DEFAULT_DESTINATION);
        var raw = value.get("sources");
        if (raw.isAbsent()) {
            raw = value.get("source");
        }
        var sources = new ArrayList<SourceMapping>();
        if (raw.asText().isPresent()) {
            sources.add(new SourceMapping(raw.text(""), defaultDestination));
            return sources;
        }
        for (var item : raw.items()) {
            if (item.asMap().isEmpty()) {
                sources.add(new SourceMapping(item.text(""), defaultDestination));
                continue;
            }
            var destination = item.text("destination", defaultDestination);
            var source = item.get("source");
            if (!source.items().isEmpty()) {
                source.items().forEach(s -> sources.add(new SourceMapping(s.text(""), destination)));
            } else {
                sources.add(new SourceMapping(source.text(""), destination));
            }
        }
        return sources;
    }

    private static List<String> readPostInstall(ConfigValue raw) {
        if (raw.asText().isPresent()) {
            return List.of(raw.text(""));
        }
        var commands = new ArrayList<String>();
        for (var item : raw.items()) {
            var command = item.text("");
            if (!command.isBlank()) {
                commands.add(command);
            }
        }
        return commands;
    }
}
