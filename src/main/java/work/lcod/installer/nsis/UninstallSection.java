package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ComponentTree;
import work.lcod.installer.runtime.FileAssociationCatalog;
import work.lcod.installer.runtime.ShortcutCatalog;
import work.lcod.installer.runtime.ShortcutEntry;

/**
 * The uninstaller: removes what the install and component sections created, files in reverse order.
 */
final class UninstallSection {
    private UninstallSection() {}

    static List<String> generate(BuildContext ctx) {
        var config = ctx.config();
        var logging = ctx.loggingEnabled();
        var lines = new ArrayList<String>(NsisText.banner("Uninstaller Section"));
        lines.add("Section \"Uninstall\"");
        lines.add("");
        if (logging) {
            lines.add("  !insertmacro LogInit \"Uninstall\"");
            lines.add("  !insertmacro LogWrite \"Removing installed files ...\"");
        }

        lines.add("  ; Remove installed files");
        var files = config.files();
        for (int i = files.size() - 1; i >= 0; i--) {
            var file = files.get(i);
            var destination = ctx.resolve(file.destination());
            lines.add(file.isRemote()
                ? FileLines.removeRemote(ctx, file.source(), destination)
                : FileLines.remove(ctx, file.source(), destination));
        }

        var tree = ComponentTree.of(config.components());
        if (!tree.isEmpty()) {
            lines.add("");
            lines.add("  ; Remove component files");
            var sections = tree.sections();
            for (int i = sections.size() - 1; i >= 0; i--) {
                var sources = sections.get(i).entry().sources();
                for (int s = sources.size() - 1; s >= 0; s--) {
                    var source = sources.get(s);
                    lines.add(FileLines.remove(ctx, source.source(), ctx.resolve(source.destination())));
                }
            }
        }

        lines.add("");
        lines.add("  ; Remove uninstaller");
        lines.add("  Delete \"$INSTDIR\\Uninstall.exe\"");
        lines.add("");
        lines.add("  ; Remove install directory (only if empty)");
        lines.add("  RMDir \"$INSTDIR\"");
        lines.add("");

        var shortcuts = ShortcutCatalog.collect(ctx);
        lines.addAll(ActionEmitter.shortcutRemovals(ctx, shortcuts));
        if (logging && !shortcuts.isEmpty()) {
            lines.add("  !insertmacro LogWrite \"Shortcuts removed.\"");
        }

        if (logging) {
            lines.add("  !insertmacro LogWrite \"Removing registry entries ...\"");
        }
        var view = ctx.effectiveRegistryView();
        lines.add("  ; Remove registry entries");
        lines.add("  SetRegView " + view);
        lines.add("  DeleteRegKey HKLM \"${REG_KEY}\"");
        lines.add("  DeleteRegKey HKLM \"${ARP_KEY}\"");
        lines.add("  SetRegView lastused");
        lines.add("");

        var actions = config.install().actions();
        if (!actions.registryEntries().isEmpty()) {
            lines.add("  ; Remove custom registry entries");
            lines.addAll(ActionEmitter.registryRemovals(ctx, actions.registryEntries(), true));
            lines.add("");
        }
        lines.addAll(ActionEmitter.associationRemovals(FileAssociationCatalog.forSection(ctx, ShortcutEntry.GLOBAL)));
        lines.addAll(ActionEmitter.envRemovals(ctx, actions.envVars()));

        for (var section : tree.sections()) {
            var sectionActions = section.entry().actions();
            var associations = FileAssociationCatalog.forSection(ctx, section.id());
            if (sectionActions.registryEntries().isEmpty() && sectionActions.envVars().isEmpty() && associations.isEmpty()) {
                continue;
            }
            lines.add("  ; Cleanup for component: " + section.name());
            lines.addAll(ActionEmitter.registryRemovals(ctx, sectionActions.registryEntries(), false));
            lines.addAll(ActionEmitter.associationRemovals(associations));
            lines.addAll(ActionEmitter.envRemovals(ctx, sectionActions.envVars()));
            lines.add("");
        }

        if (logging) {
            lines.add("  !insertmacro LogWrite \"Uninstallation completed.\"");
            lines.add("  !insertmacro LogClose");
        }
        lines.add("SectionEnd");
        lines.add("");
        return lines;
    }
}
