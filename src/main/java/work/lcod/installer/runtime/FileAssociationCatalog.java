package work.lcod.installer.runtime;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.config.FileAssociation;

/**
 * Enumerates file associations in the same order as shortcuts: global first, then per component.
 */
public final class FileAssociationCatalog {
    private FileAssociationCatalog() {}

    public record Entry(int index, String section, FileAssociation association) {}

    public static List<Entry> collect(BuildContext ctx) {
        var entries = new ArrayList<Entry>();
        for (var association : ctx.config().install().actions().fileAssociations()) {
            entries.add(new Entry(entries.size(), ShortcutEntry.GLOBAL, association));
        }
        for (var section : ComponentTree.of(ctx.config().components()).sections()) {
            for (var association : section.entry().actions().fileAssociations()) {
                entries.add(new Entry(entries.size(), section.id(), association));
            }
        }
        return entries;
    }

    public static List<Entry> forSection(BuildContext ctx, String section) {
        var matching = new ArrayList<Entry>();
        for (var entry : collect(ctx)) {
            if (entry.section().equals(section)) {
                matching.add(entry);
            }
        }
        return matching;
    }
}
