package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.runtime.BuildContext;

/**
 * Code signing of the built installer and the update metadata it records.
 */
final class PolicyFragments {
    private PolicyFragments() {}

    static List<String> signing(BuildContext ctx) {
        var signing = ctx.config().signing();
        var lines = new ArrayList<String>();
        if (!signing.enabled()) {
            return lines;
        }
        var command = "signtool sign /f \"" + HeaderFragments.filePath(ctx, signing.certificate()) + "\""
            + (signing.password().isBlank() ? "" : " /p \"" + ctx.resolve(signing.password()) + "\"")
            + " /fd sha256 /t \"" + ctx.resolve(signing.timestampUrl()) + "\" \"%1\"";
        lines.add("; --- Code Signing ---");
        lines.add("; Timestamp: " + signing.timestampUrl());
        if (!signing.checksumType().isBlank()) {
            lines.add("; Checksum: " + signing.checksumType() + " " + signing.checksumValue());
        }
        lines.add("!finalize '" + command + "'");
        lines.add("!uninstfinalize '" + command + "'");
        lines.add("");
        return lines;
    }

    static List<String> update(BuildContext ctx) {
        var update = ctx.config().update();
        var lines = new ArrayList<String>();
        if (!update.enabled()) {
            return lines;
        }
        var hive = update.registryHive();
        var key = NsisText.escape(ctx.resolve(update.registryKey()));
        lines.add("; --- Auto-Update Configuration ---");
        lines.add("!define UPDATE_URL " + NsisText.quote(ctx.resolve(update.updateUrl())));
        lines.add("!define DOWNLOAD_URL " + NsisText.quote(ctx.resolve(update.downloadUrl())));
        lines.add("!define CHECK_ON_STARTUP \"" + update.checkOnStartup() + "\"");
        lines.add("!define BACKUP_ON_UPGRADE \"" + update.backupOnUpgrade() + "\"");
        lines.add("!define REPAIR_ENABLED \"" + update.repairEnabled() + "\"");
        lines.add("");
        lines.add("Section \"-UpdateConfiguration\"");
        lines.add("  SetRegView " + ctx.effectiveRegistryView());
        lines.add("  WriteRegStr " + hive + " \"" + key + "\" \"UpdateURL\" \"${UPDATE_URL}\"");
        lines.add("  WriteRegStr " + hive + " \"" + key + "\" \"DownloadURL\" \"${DOWNLOAD_URL}\"");
        lines.add("  WriteRegStr " + hive + " \"" + key + "\" \"CheckOnStartup\" \"${CHECK_ON_STARTUP}\"");
        lines.add("  WriteRegStr " + hive + " \"" + key + "\" \"BackupOnUpgrade\" \"${BACKUP_ON_UPGRADE}\"");
        lines.add("  WriteRegStr " + hive + " \"" + key + "\" \"RepairEnabled\" \"${REPAIR_ENABLED}\"");
        lines.add("  SetRegView lastused");
        lines.add("SectionEnd");
        lines.add("");
        return lines;
    }
}
