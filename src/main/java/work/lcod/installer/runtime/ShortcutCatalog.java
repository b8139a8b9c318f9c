package work.lcod.installer.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.installer.config.ActionSet;
import work.lcod.installer.config.ShortcutConfig;

/**
 * Enumerates shortcuts: global ones first, then per component in tree order. Creation, removal and
 * the options page each call {@link #collect(BuildContext)} and get the same indices.
 */
public final class ShortcutCatalog {
    private ShortcutCatalog() {}

    public static List<ShortcutEntry> collect(BuildContext ctx) {
        var entries = new ArrayList<ShortcutEntry>();
        add(ctx, entries, ctx.config().install().actions(), ShortcutEntry.GLOBAL);
        for (var section : ComponentTree.of(ctx.config().components()).sections()) {
            add(ctx, entries, section.entry().actions(), section.id());
        }
        return entries;
    }

    public static List<ShortcutEntry> forSection(BuildContext ctx, String section) {
        var matching = new ArrayList<ShortcutEntry>();
        for (var entry : collect(ctx)) {
            if (entry.section().equals(section)) {
                matching.add(entry);
            }
        }
        return matching;
    }

    private static void add(BuildContext ctx, List<ShortcutEntry> entries, ActionSet actions, String section) {
        append(ctx, entries, actions.desktopShortcut(), ShortcutEntry.Kind.DESKTOP, section);
        append(ctx, entries, actions.startMenuShortcut(), ShortcutEntry.Kind.START_MENU, section);
        for (var shortcut : actions.shortcuts()) {
            append(ctx, entries, Optional.of(shortcut), ShortcutEntry.Kind.fromLocation(shortcut.location()), section);
        }
    }

    private static void append(
        BuildContext ctx,
        List<ShortcutEntry> entries,
        Optional<ShortcutConfig> shortcut,
        ShortcutEntry.Kind kind,
        String section
    ) {
        if (shortcut.isEmpty() || shortcut.get().target().isBlank()) {
            return;
        }
        var config = shortcut.get();
        var name = config.name().isBlank() ? "${APP_NAME}" : ctx.resolve(config.name());
        entries.add(new ShortcutEntry(entries.size(), kind, section, config, name));
    }
}
