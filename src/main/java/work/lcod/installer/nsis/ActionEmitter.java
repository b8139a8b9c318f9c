package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.installer.config.EnvVarEntry;
import work.lcod.installer.config.FileAssociation;
import work.lcod.installer.config.RegistryEntry;
import work.lcod.installer.config.RegistryView;
import work.lcod.installer.flow.ControlFlow;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.FileAssociationCatalog;
import work.lcod.installer.runtime.ShortcutEntry;

/**
 * Install and uninstall code for registry values, environment variables, shortcuts and file
 * associations. Used for both global actions and per-component actions.
 */
final class ActionEmitter {
    private static final Logger log = LoggerFactory.getLogger(ActionEmitter.class);
    private static final Pattern DRIVE_PATH = Pattern.compile("^[A-Za-z]:\\\\.*");
    private static final String SYSTEM_ENV_KEY = "SYSTEM\\CurrentControlSet\\Control\\Session Manager\\Environment";
    private static final String BROADCAST = "SendMessage ${HWND_BROADCAST} ${WM_SETTINGCHANGE} 0 \"STR:Environment\" /TIMEOUT=500";

    private ActionEmitter() {}

    // registry

    static List<String> registryWrites(BuildContext ctx, List<RegistryEntry> entries, String heading) {
        var lines = new ArrayList<String>();
        if (entries.isEmpty()) {
            return lines;
        }
        lines.add("  ; " + heading);
        var views = new ViewSwitch(lines);
        for (var entry : entries) {
            views.switchTo(entry.view());
            var key = NsisText.escape(ctx.resolve(entry.key()));
            var name = NsisText.escape(entry.name());
            var value = ctx.resolve(entry.value());
            switch (entry.type()) {
                case DWORD -> lines.add("  WriteRegDWORD " + entry.hive() + " \"" + key + "\" \"" + name + "\" " + value.trim());
                case EXPAND -> lines.add("  WriteRegExpandStr " + entry.hive() + " \"" + key + "\" \"" + name + "\" " + NsisText.quote(value));
                default -> lines.add("  WriteRegStr " + entry.hive() + " \"" + key + "\" \"" + name + "\" " + NsisText.quote(value));
            }
        }
        views.close();
        lines.add("");
        return lines;
    }

    /**
     * Deletes the values written by {@link #registryWrites}; with {@code removeEmptyKeys} the keys
     * are removed afterwards when nothing else is left in them.
     */
    static List<String> registryRemovals(BuildContext ctx, List<RegistryEntry> entries, boolean removeEmptyKeys) {
        var lines = new ArrayList<String>();
        if (entries.isEmpty()) {
            return lines;
        }
        var views = new ViewSwitch(lines);
        var keys = new LinkedHashSet<String>();
        for (var entry : entries) {
            views.switchTo(entry.view());
            var key = NsisText.escape(ctx.resolve(entry.key()));
            lines.add("  DeleteRegValue " + entry.hive() + " \"" + key + "\" \"" + NsisText.escape(entry.name()) + "\"");
            keys.add(entry.hive() + " \"" + key + "\"");
        }
        views.close();
        if (removeEmptyKeys) {
            lines.add("  ; Remove empty registry keys (only if no remaining values)");
            keys.forEach(key -> lines.add("  DeleteRegKey /ifempty " + key));
        }
        return lines;
    }

    /** Emits {@code SetRegView} only when consecutive entries change view. */
    private static final class ViewSwitch {
        private final List<String> lines;
        private String current;

        ViewSwitch(List<String> lines) {
            this.lines = lines;
        }

        void switchTo(RegistryView view) {
            var target = view == RegistryView.AUTO ? null : view.id();
            if (target == null ? current == null : target.equals(current)) {
                return;
            }
            if (current != null) {
                lines.add("  SetRegView lastused");
            }
            if (target != null) {
                lines.add("  SetRegView " + target);
            }
            current = target;
        }

        void close() {
            if (current != null) {
                lines.add("  SetRegView lastused");
                current = null;
            }
        }
    }

    // environment

    static String envHive(EnvVarEntry env) {
        return env.scope() == EnvVarEntry.Scope.SYSTEM ? "HKLM" : "HKCU";
    }

    static String envKey(EnvVarEntry env) {
        return env.scope() == EnvVarEntry.Scope.SYSTEM ? SYSTEM_ENV_KEY : "Environment";
    }

    /**
     * @param scopeTag distinguishes label sets of different owners, e.g. {@code global} or a section id
     */
    static List<String> envWrites(BuildContext ctx, List<EnvVarEntry> envVars, String scopeTag) {
        var lines = new ArrayList<String>();
        for (int i = 0; i < envVars.size(); i++) {
            var env = envVars.get(i);
            var value = NsisText.escape(ctx.resolve(env.value()));
            var hive = envHive(env);
            var key = envKey(env);
            lines.add("  ; Environment variable: " + env.name() + " (" + env.scope().name().toLowerCase(Locale.ROOT) + ")");
            if (env.isPathAppend()) {
                var prefix = "_path_" + scopeTag.toLowerCase(Locale.ROOT) + "_" + i + "_";
                lines.addAll(pathAppendFlow(prefix, hive, key, env.name(), value).emit(""));
            } else {
                lines.add("  WriteRegExpandStr " + hive + " \"" + key + "\" \"" + env.name() + "\" \"" + value + "\"");
                lines.add("  " + BROADCAST);
            }
            lines.add("");
        }
        return lines;
    }

    /** Appends {@code value} to a PATH-like variable unless it is already present. */
    static ControlFlow pathAppendFlow(String prefix, String hive, String key, String name, String value) {
        return ControlFlow.builder(prefix)
            .state("check", List.of(
                "ReadRegStr $0 " + hive + " \"" + key + "\" \"" + name + "\"",
                "StrCpy $1 \"" + value + "\"",
                "Push $0",
                "Push $1",
                "Call _StrContains"
            ), ControlFlow.branch("StrCmp $R9 \"1\" {0}", "empty_check", "skip"))
            .state("empty_check", ControlFlow.branch("StrCmp $0 \"\" {0}", "append", "first"))
            .state("append", List.of("StrCpy $0 \"$0;" + value + "\""), ControlFlow.jump("write"))
            .state("first", List.of("StrCpy $0 \"" + value + "\""), ControlFlow.next())
            .state("write", List.of(
                "WriteRegExpandStr " + hive + " \"" + key + "\" \"" + name + "\" \"$0\"",
                BROADCAST
            ), ControlFlow.next())
            .state("skip", ControlFlow.next())
            .build();
    }

    static List<String> envRemovals(BuildContext ctx, List<EnvVarEntry> envVars) {
        var lines = new ArrayList<String>();
        for (var env : envVars) {
            if (!env.removeOnUninstall()) {
                continue;
            }
            var hive = envHive(env);
            var key = envKey(env);
            if (env.isPathAppend()) {
                var value = NsisText.escape(ctx.resolve(env.value()));
                lines.add("  ; Remove PATH entry: " + value);
                lines.add("  ReadRegStr $0 " + hive + " \"" + key + "\" \"" + env.name() + "\"");
                lines.add("  StrCpy $1 \"" + value + "\"");
                lines.add("  Call un._RemovePathEntry");
                lines.add("  WriteRegExpandStr " + hive + " \"" + key + "\" \"" + env.name() + "\" \"$0\"");
                lines.add("  " + BROADCAST);
            } else {
                lines.add("  DeleteRegValue " + hive + " \"" + key + "\" \"" + env.name() + "\"");
            }
        }
        return lines;
    }

    // shortcuts

    static String shortcutPath(BuildContext ctx, String path) {
        if (path == null || path.isBlank()) {
            return "";
        }
        var resolved = ctx.resolve(path).replace('/', '\\');
        if (resolved.startsWith("$") || DRIVE_PATH.matcher(resolved).matches()) {
            return resolved;
        }
        return "$INSTDIR\\" + resolved;
    }

    static String shortcutDirectory(BuildContext ctx, ShortcutEntry shortcut) {
        switch (shortcut.kind()) {
            case DESKTOP:
                return "$DESKTOP";
            case START_MENU:
                return "$SMPROGRAMS\\${APP_NAME}";
            case QUICK_LAUNCH:
                return "$QUICKLAUNCH";
            default:
                return shortcutPath(ctx, shortcut.config().location());
        }
    }

    static String shortcutLink(BuildContext ctx, ShortcutEntry shortcut) {
        var directory = shortcutDirectory(ctx, shortcut);
        while (directory.endsWith("\\")) {
            directory = directory.substring(0, directory.length() - 1);
        }
        return directory + "\\" + shortcut.displayName() + ".lnk";
    }

    /**
     * Creation code for one shortcut. Optional shortcuts are guarded by their
     * {@code $CREATE_SC_<index>} toggle.
     */
    static List<String> shortcutCreation(BuildContext ctx, ShortcutEntry shortcut, boolean uninstallLink) {
        var config = shortcut.config();
        var directory = NsisText.escape(shortcutDirectory(ctx, shortcut));
        var link = NsisText.escape(shortcutLink(ctx, shortcut));
        var target = NsisText.escape(shortcutPath(ctx, config.target()));
        var args = config.args().isBlank() ? "" : NsisText.escape(ctx.resolve(config.args()));
        var icon = NsisText.escape(shortcutPath(ctx, config.icon()));

        var body = new ArrayList<String>();
        if (!config.workdir().isBlank()) {
            var workdir = ctx.resolve(config.workdir());
            log.warn("Shortcut '{}' requests working directory '{}' which CreateShortCut cannot set", shortcut.displayName(), workdir);
            body.add("; WARNING: requested workdir \"" + workdir + "\" cannot be set by CreateShortCut and will be ignored");
        }
        if (!"$DESKTOP".equals(directory) && !"$QUICKLAUNCH".equals(directory)) {
            body.add("CreateDirectory \"" + directory + "\"");
        }
        var create = new StringBuilder("CreateShortCut \"").append(link).append("\" \"").append(target).append('"');
        if (!icon.isEmpty()) {
            create.append(" \"").append(args).append("\" \"").append(icon).append("\" 0");
        } else if (!args.isEmpty()) {
            create.append(" \"").append(args).append('"');
        }
        body.add(create.toString());
        if (uninstallLink && shortcut.kind() == ShortcutEntry.Kind.START_MENU) {
            body.add("CreateShortCut \"" + directory + "\\Uninstall.lnk\" \"$INSTDIR\\Uninstall.exe\"");
        }

        var lines = new ArrayList<String>();
        lines.add("  ; Shortcut (" + shortcut.displayName() + ")");
        if (shortcut.isOptional()) {
            var guard = ControlFlow.builder("_sc_" + shortcut.index() + "_")
                .state("check", ControlFlow.branch("StrCmp $CREATE_SC_" + shortcut.index() + " \"1\" 0 {0}", "create", "skip"))
                .state("create", body, ControlFlow.next())
                .state("skip", ControlFlow.next())
                .build();
            lines.addAll(guard.emit(""));
        } else {
            body.forEach(line -> lines.add("  " + line));
        }
        lines.add("");
        return lines;
    }

    static List<String> shortcutRemovals(BuildContext ctx, List<ShortcutEntry> shortcuts) {
        var lines = new ArrayList<String>();
        if (shortcuts.isEmpty()) {
            return lines;
        }
        lines.add("  ; Remove shortcuts");
        var startMenuDirs = new TreeSet<String>();
        for (var shortcut : shortcuts) {
            lines.add("  Delete \"" + NsisText.escape(shortcutLink(ctx, shortcut)) + "\"");
            if (shortcut.kind() == ShortcutEntry.Kind.START_MENU && shortcut.isGlobal()) {
                startMenuDirs.add(NsisText.escape(shortcutDirectory(ctx, shortcut)));
            }
        }
        startMenuDirs.forEach(dir -> lines.add("  Delete \"" + dir + "\\Uninstall.lnk\""));
        startMenuDirs.forEach(dir -> lines.add("  RMDir \"" + dir + "\""));
        lines.add("");
        return lines;
    }

    // file associations

    static String associationHive(FileAssociation association) {
        return association.registerForAllUsers() ? "HKCR" : "HKCU";
    }

    static String associationPrefix(FileAssociation association) {
        return association.registerForAllUsers() ? "" : "Software\\Classes\\";
    }

    static List<String> associationWrites(BuildContext ctx, List<FileAssociationCatalog.Entry> entries) {
        var lines = new ArrayList<String>();
        for (var entry : entries) {
            var association = entry.association();
            var hive = associationHive(association);
            var prefix = associationPrefix(association);
            var progId = association.progId();
            lines.add("  ; File association: " + association.extension() + " -> " + association.application());
            lines.add("  WriteRegStr " + hive + " \"" + prefix + association.extension() + "\" \"\" \"" + progId + "\"");
            if (!progId.isBlank()) {
                lines.add("  WriteRegStr " + hive + " \"" + prefix + progId + "\" \"\" \"" + description(ctx, entry) + "\"");
            }
            if (!association.defaultIcon().isBlank()) {
                var icon = NsisText.escape(ctx.resolve(association.defaultIcon()));
                lines.add("  WriteRegStr " + hive + " \"" + prefix + progId + "\\DefaultIcon\" \"\" \"" + icon + "\"");
            }
            if (!association.verbs().isEmpty()) {
                association.verbs().forEach((verb, command) -> lines.add("  WriteRegStr " + hive + " \"" + prefix + progId
                    + "\\Shell\\" + verb + "\\Command\" \"\" \"" + NsisText.escape(ctx.resolve(command)) + "\""));
            } else if (!association.application().isBlank()) {
                var application = NsisText.escape(ctx.resolve(association.application()));
                lines.add("  WriteRegStr " + hive + " \"" + prefix + progId + "\\Shell\\Open\\Command\" \"\" \""
                    + application + " $\\\"%1$\\\"\"");
            }
            lines.add("");
        }
        return lines;
    }

    private static String description(BuildContext ctx, FileAssociationCatalog.Entry entry) {
        var text = entry.association().description();
        if (text.isLocalized()) {
            if (!ctx.hasLanguages()) {
                throw new IllegalArgumentException(
                    "file_associations.description requires languages when using per-language values ("
                        + entry.association().extension() + ")");
            }
            return "$(FA_DESC_" + entry.index() + ")";
        }
        return NsisText.escape(ctx.resolve(text.text()));
    }

    static List<String> associationRemovals(List<FileAssociationCatalog.Entry> entries) {
        var lines = new ArrayList<String>();
        for (var entry : entries) {
            var association = entry.association();
            var hive = associationHive(association);
            var prefix = associationPrefix(association);
            lines.add("  ; Remove file association: " + association.extension());
            lines.add("  DeleteRegKey " + hive + " \"" + prefix + association.extension() + "\"");
            if (!association.progId().isBlank()) {
                lines.add("  DeleteRegKey " + hive + " \"" + prefix + association.progId() + "\"");
            }
        }
        return lines;
    }
}
