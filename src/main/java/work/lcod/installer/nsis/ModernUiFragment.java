package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.config.LangText;
import work.lcod.installer.i18n.BuiltinStrings;
import work.lcod.installer.i18n.LanguageMappings;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ComponentTree;
import work.lcod.installer.runtime.FileAssociationCatalog;
import work.lcod.installer.runtime.ShortcutCatalog;
import work.lcod.installer.runtime.ShortcutEntry;

/**
 * Modern UI pages, language registration and the localized string tables.
 *
 * <p>Language directives and string tables are emitted here in logical order; the reorder pass moves
 * them behind the last page declaration of the assembled script.</p>
 */
final class ModernUiFragment {
    static final String SHORTCUT_PAGE = "ShortcutOptionsPage";
    static final String LAUNCH_FUNCTION = "LaunchApplication";

    private ModernUiFragment() {}

    static List<String> generate(BuildContext ctx) {
        var config = ctx.config();
        var install = config.install();
        var shortcuts = ShortcutCatalog.collect(ctx);
        var optional = optionalShortcuts(shortcuts);
        var lines = new ArrayList<String>(NsisText.banner("Modern UI"));
        lines.add("!define MUI_ABORTWARNING");
        if (ctx.languages().size() > 1) {
            lines.add("!define MUI_LANGDLL_WINDOWTITLE " + NsisText.quote(BuiltinStrings.english("langpage_title")));
            lines.add("!define MUI_LANGDLL_INFO " + NsisText.quote(BuiltinStrings.english("langpage_desc")));
        }
        lines.add("");

        lines.add("!insertmacro MUI_PAGE_WELCOME");
        var license = config.app().license();
        if (!license.isEmpty()) {
            if (license.isLocalized() && ctx.hasLanguages()) {
                lines.add("!insertmacro MUI_PAGE_LICENSE \"$(MUI_LICENSE)\"");
            } else {
                lines.add("!insertmacro MUI_PAGE_LICENSE " + NsisText.quote(HeaderFragments.filePath(ctx, license.defaultText())));
            }
        }
        if (!ComponentTree.of(config.components()).isEmpty()) {
            lines.add("!insertmacro MUI_PAGE_COMPONENTS");
        }
        if (install.existingInstall().isEnabled() && install.existingInstall().allowMultiple()) {
            lines.add("!define MUI_PAGE_CUSTOMFUNCTION_LEAVE " + ExistingInstallHelpers.DIRECTORY_CALLBACK);
        }
        lines.add("!insertmacro MUI_PAGE_DIRECTORY");
        if (!optional.isEmpty()) {
            lines.add("Page custom " + SHORTCUT_PAGE + " " + SHORTCUT_PAGE + "Leave");
        }
        lines.add("!insertmacro MUI_PAGE_INSTFILES");
        if (!install.launchOnFinish().isBlank()) {
            lines.add("!define MUI_FINISHPAGE_SHOWREADME \"\"");
            lines.add("!define MUI_FINISHPAGE_SHOWREADME_TEXT \"" + launchLabel(ctx) + "\"");
            lines.add("!define MUI_FINISHPAGE_SHOWREADME_FUNCTION " + LAUNCH_FUNCTION);
        }
        lines.add("!insertmacro MUI_PAGE_FINISH");
        lines.add("");
        lines.add("!insertmacro MUI_UNPAGE_CONFIRM");
        lines.add("!insertmacro MUI_UNPAGE_INSTFILES");
        lines.add("");

        lines.addAll(languages(ctx));
        if (ctx.languages().size() > 1) {
            lines.add("!insertmacro MUI_RESERVEFILE_LANGDLL");
        }
        lines.add("");
        if (ctx.hasLanguages()) {
            lines.addAll(stringTables(ctx, optional));
        }

        for (var shortcut : shortcuts) {
            lines.add("Var CREATE_SC_" + shortcut.index());
        }
        for (var shortcut : optional) {
            lines.add("Var _SC_CTRL_" + shortcut.index());
        }
        lines.add("");
        return lines;
    }

    static List<ShortcutEntry> optionalShortcuts(List<ShortcutEntry> shortcuts) {
        var optional = new ArrayList<ShortcutEntry>();
        for (var shortcut : shortcuts) {
            if (shortcut.isOptional()) {
                optional.add(shortcut);
            }
        }
        return optional;
    }

    private static List<String> languages(BuildContext ctx) {
        var lines = new ArrayList<String>();
        if (!ctx.hasLanguages()) {
            lines.add("!insertmacro MUI_LANGUAGE \"English\"");
            return lines;
        }
        for (var language : ctx.languages()) {
            var mapping = LanguageMappings.require(ctx.dialect(), language);
            lines.add("!insertmacro MUI_LANGUAGE \"" + mapping.displayName() + "\"");
        }
        return lines;
    }

    private static List<String> stringTables(BuildContext ctx, List<ShortcutEntry> optional) {
        var lines = new ArrayList<String>();
        var config = ctx.config();
        for (var id : BuiltinStrings.IDS) {
            var constantName = BuiltinStrings.constantName(id);
            for (var language : ctx.languages()) {
                var text = BuiltinStrings.lookup(language, id, config.stringOverrides(language));
                lines.add(langString(ctx, constantName, language, NsisText.fill(ctx, id, text)));
            }
        }
        for (var shortcut : optional) {
            for (var language : ctx.languages()) {
                lines.add(langString(ctx, "SC_LABEL_" + shortcut.index(), language, labelText(ctx, shortcut, language)));
            }
        }
        for (var entry : FileAssociationCatalog.collect(ctx)) {
            var description = entry.association().description();
            if (!description.isLocalized()) {
                continue;
            }
            var field = "file_associations[" + entry.index() + "].description";
            for (var language : ctx.languages()) {
                lines.add(langString(ctx, "FA_DESC_" + entry.index(), language, ctx.resolve(description.forLanguage(language, field))));
            }
        }
        var launchLabel = config.install().launchOnFinishLabel();
        if (!config.install().launchOnFinish().isBlank() && !launchLabel.isEmpty()) {
            for (var language : ctx.languages()) {
                lines.add(langString(ctx, "LAUNCH_LABEL", language,
                    ctx.resolve(launchLabel.forLanguage(language, "install.launch_on_finish_label"))));
            }
        }
        var license = config.app().license();
        if (license.isLocalized()) {
            for (var language : ctx.languages()) {
                var constant = LanguageMappings.require(ctx.dialect(), language).constant();
                var path = HeaderFragments.filePath(ctx, license.forLanguage(language, "app.license"));
                lines.add("LicenseLangString MUI_LICENSE ${" + constant + "} " + NsisText.quote(path));
            }
        }
        lines.add("");
        return lines;
    }

    private static String langString(BuildContext ctx, String name, String language, String text) {
        var constant = LanguageMappings.require(ctx.dialect(), language).constant();
        return "LangString " + name + " ${" + constant + "} \"" + NsisText.escapeLangString(text) + "\"";
    }

    private static String labelText(BuildContext ctx, ShortcutEntry shortcut, String language) {
        LangText label = shortcut.config().label();
        if (!label.isEmpty()) {
            return ctx.resolve(label.forLanguage(language, "shortcuts[" + shortcut.index() + "].label"));
        }
        var id = builtinLabelId(shortcut);
        var text = BuiltinStrings.lookup(language, id, ctx.config().stringOverrides(language));
        return NsisText.fill(ctx, id, text.replace("{name}", shortcut.displayName()));
    }

    private static String builtinLabelId(ShortcutEntry shortcut) {
        switch (shortcut.kind()) {
            case DESKTOP:
                return "shortcuts_desktop";
            case START_MENU:
                return "shortcuts_startmenu";
            default:
                return "shortcuts_custom";
        }
    }

    /** Checkbox text of an optional shortcut on the shortcut options page. */
    static String shortcutLabel(BuildContext ctx, ShortcutEntry shortcut) {
        if (ctx.hasLanguages()) {
            return "$(SC_LABEL_" + shortcut.index() + ")";
        }
        var label = shortcut.config().label();
        if (!label.isEmpty()) {
            return NsisText.escapeLangString(ctx.resolve(label.defaultText()));
        }
        return NsisText.escapeLangString(labelText(ctx, shortcut, "English"));
    }

    private static String launchLabel(BuildContext ctx) {
        var label = ctx.config().install().launchOnFinishLabel();
        if (label.isEmpty()) {
            return NsisText.message(ctx, "finish_run");
        }
        if (ctx.hasLanguages()) {
            return "$(LAUNCH_LABEL)";
        }
        return NsisText.escapeLangString(ctx.resolve(label.defaultText()));
    }
}
