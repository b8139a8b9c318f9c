package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.i18n.LanguageMappings;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ComponentTree;
import work.lcod.installer.runtime.FileAssociationCatalog;
import work.lcod.installer.runtime.ShortcutCatalog;

/**
 * Component sections and their Components-page descriptions.
 */
final class ComponentSections {
    private ComponentSections() {}

    static List<String> sections(BuildContext ctx) {
        var tree = ComponentTree.of(ctx.config().components());
        var lines = new ArrayList<String>();
        if (tree.isEmpty()) {
            return lines;
        }
        lines.addAll(NsisText.banner("Component Sections"));
        lines.add("");
        emit(ctx, tree.roots(), lines);
        return lines;
    }

    private static void emit(BuildContext ctx, List<ComponentTree.Node> nodes, List<String> lines) {
        for (var node : nodes) {
            switch (node.kind()) {
                case GROUP -> {
                    lines.add("SectionGroup /e " + NsisText.quote(node.name()) + " " + node.id());
                    emit(ctx, node.children(), lines);
                    lines.add("SectionGroupEnd");
                    lines.add("");
                }
                case TRANSPARENT -> emit(ctx, node.children(), lines);
                default -> lines.addAll(section(ctx, node));
            }
        }
    }

    private static List<String> section(BuildContext ctx, ComponentTree.Node node) {
        var entry = node.entry();
        var logging = ctx.loggingEnabled();
        var lines = new ArrayList<String>();
        lines.add("Section " + NsisText.quote(node.name()) + " " + node.id());
        if (logging) {
            lines.add("  !insertmacro LogWrite \"Installing component: " + NsisText.escape(node.name()) + "\"");
        }
        String outPath = null;
        for (var source : entry.sources()) {
            var destination = ctx.resolve(source.destination());
            if (!destination.equals(outPath)) {
                lines.add("  SetOutPath \"" + destination + "\"");
                outPath = destination;
            }
            lines.add(FileLines.install(ctx, source.source()));
        }
        if (!entry.postInstall().isEmpty()) {
            lines.add("");
            lines.add("  ; Post-install commands");
            for (var command : entry.postInstall()) {
                var escaped = NsisText.escape(ctx.resolve(command));
                if (logging) {
                    lines.add("  !insertmacro LogWrite \"Running: " + escaped + "\"");
                }
                lines.add("  ExecWait \"" + escaped + "\"");
            }
        }
        var actions = entry.actions();
        if (!actions.registryEntries().isEmpty()) {
            lines.add("");
            lines.addAll(ActionEmitter.registryWrites(ctx, actions.registryEntries(), "Registry entries"));
        }
        lines.addAll(ActionEmitter.envWrites(ctx, actions.envVars(), node.id()));
        ShortcutCatalog.forSection(ctx, node.id())
            .forEach(shortcut -> lines.addAll(ActionEmitter.shortcutCreation(ctx, shortcut, false)));
        lines.addAll(ActionEmitter.associationWrites(ctx, FileAssociationCatalog.forSection(ctx, node.id())));
        if (logging) {
            lines.add("  !insertmacro LogWrite \"Component " + NsisText.escape(node.name()) + " done.\"");
        }
        lines.add("SectionEnd");
        lines.add("");
        return lines;
    }

    /**
     * One {@code DESC_<k>} string per described section or group, bound with
     * {@code MUI_DESCRIPTION_TEXT}. Per-language values require configured languages.
     */
    static List<String> descriptions(BuildContext ctx) {
        var described = ComponentTree.of(ctx.config().components()).described();
        var lines = new ArrayList<String>();
        if (described.isEmpty()) {
            return lines;
        }
        lines.addAll(NsisText.banner("Component Descriptions"));
        lines.add("");
        for (int k = 0; k < described.size(); k++) {
            var node = described.get(k);
            var description = node.entry().description();
            var field = "packages." + node.name() + ".description";
            if (ctx.hasLanguages()) {
                for (var language : ctx.languages()) {
                    var constant = LanguageMappings.require(ctx.dialect(), language).constant();
                    var text = ctx.resolve(description.forLanguage(language, field));
                    lines.add("LangString DESC_" + k + " ${" + constant + "} \"" + NsisText.escapeLangString(text) + "\"");
                }
            } else {
                if (description.isLocalized()) {
                    throw new IllegalArgumentException(field + " requires languages when using per-language values.");
                }
                var text = ctx.resolve(description.text());
                lines.add("LangString DESC_" + k + " ${LANG_ENGLISH} \"" + NsisText.escapeLangString(text) + "\"");
            }
        }
        lines.add("");
        lines.add("!insertmacro MUI_FUNCTION_DESCRIPTION_BEGIN");
        for (int k = 0; k < described.size(); k++) {
            lines.add("  !insertmacro MUI_DESCRIPTION_TEXT ${" + described.get(k).id() + "} $(DESC_" + k + ")");
        }
        lines.add("!insertmacro MUI_FUNCTION_DESCRIPTION_END");
        lines.add("");
        return lines;
    }
}
