package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.FileAssociationCatalog;
import work.lcod.installer.runtime.ShortcutCatalog;
import work.lcod.installer.runtime.ShortcutEntry;

/**
 * The hidden main section: global files, uninstaller, install metadata and global actions.
 */
final class InstallSection {
    private InstallSection() {}

    static List<String> generate(BuildContext ctx) {
        var config = ctx.config();
        var logging = ctx.loggingEnabled();
        var view = ctx.effectiveRegistryView();
        var lines = new ArrayList<String>(NsisText.banner("Installer Section"));
        lines.add("Section \"-Install\" SEC_INSTALL");
        lines.add("");
        if (logging) {
            lines.add("  !insertmacro LogInit \"Install\"");
            lines.add("  !insertmacro LogWrite \"Install directory: $INSTDIR\"");
            lines.add("  !insertmacro LogWrite \"Copying files ...\"");
        }

        String outPath = null;
        for (var file : config.files()) {
            var destination = ctx.resolve(file.destination());
            if (!destination.equals(outPath)) {
                lines.add("  SetOutPath \"" + destination + "\"");
                outPath = destination;
            }
            if (file.isRemote()) {
                lines.addAll(HelperRoutines.remoteFile(ctx, file));
            } else {
                lines.add(FileLines.install(ctx, file.source()));
            }
        }
        lines.add("");

        lines.add("  ; Write uninstaller");
        lines.add("  SetOutPath $INSTDIR");
        lines.add("  WriteUninstaller \"$INSTDIR\\Uninstall.exe\"");
        lines.add("");
        if (logging) {
            lines.add("  !insertmacro LogWrite \"Uninstaller created.\"");
        }

        lines.add("  ; Application registry entries (" + view + "-bit registry view)");
        lines.add("  SetRegView " + view);
        lines.add("  WriteRegStr HKLM \"${REG_KEY}\" \"InstallPath\" \"$INSTDIR\"");
        lines.add("  WriteRegStr HKLM \"${REG_KEY}\" \"Version\" \"${APP_VERSION}\"");
        lines.add("");
        lines.add("  ; Add/Remove Programs");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"DisplayName\" \"${APP_NAME}\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"DisplayVersion\" \"${APP_VERSION}\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"Publisher\" \"${APP_PUBLISHER}\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"UninstallString\" \"$\\\"$INSTDIR\\Uninstall.exe$\\\"\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"QuietUninstallString\" \"$\\\"$INSTDIR\\Uninstall.exe$\\\" /S\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"InstallLocation\" \"$INSTDIR\"");
        lines.add("  WriteRegStr HKLM \"${ARP_KEY}\" \"DisplayIcon\" \"$INSTDIR\\Uninstall.exe,0\"");
        lines.add("  WriteRegDWORD HKLM \"${ARP_KEY}\" \"NoModify\" 1");
        lines.add("  WriteRegDWORD HKLM \"${ARP_KEY}\" \"NoRepair\" 1");
        lines.add("  SetRegView lastused");
        lines.add("");
        if (logging) {
            lines.add("  !insertmacro LogWrite \"Registry entries written.\"");
        }

        var actions = config.install().actions();
        lines.addAll(ActionEmitter.registryWrites(ctx, actions.registryEntries(), "Custom registry entries"));
        lines.addAll(ActionEmitter.envWrites(ctx, actions.envVars(), ShortcutEntry.GLOBAL));

        var shortcuts = ShortcutCatalog.forSection(ctx, ShortcutEntry.GLOBAL);
        shortcuts.forEach(shortcut -> lines.addAll(ActionEmitter.shortcutCreation(ctx, shortcut, true)));
        if (logging && !shortcuts.isEmpty()) {
            lines.add("  !insertmacro LogWrite \"Shortcuts created.\"");
        }
        lines.addAll(ActionEmitter.associationWrites(ctx, FileAssociationCatalog.forSection(ctx, ShortcutEntry.GLOBAL)));

        lines.add("  ; Installed size for Add/Remove Programs");
        lines.add("  ${GetSize} \"$INSTDIR\" \"/S=0K\" $0 $1 $2");
        lines.add("  IntFmt $0 \"0x%08X\" $0");
        lines.add("  SetRegView " + view);
        lines.add("  WriteRegDWORD HKLM \"${ARP_KEY}\" \"EstimatedSize\" $0");
        lines.add("  SetRegView lastused");
        lines.add("SectionEnd");
        lines.add("");
        return lines;
    }
}
