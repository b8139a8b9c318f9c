package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.lcod.installer.config.ActionSet;
import work.lcod.installer.config.FileEntry;
import work.lcod.installer.flow.ControlFlow;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ComponentTree;

/**
 * Shared macros and functions: install log, PATH manipulation, checksum verification and archive
 * extraction. Each block is emitted only when something in the script calls it.
 */
final class HelperRoutines {
    static final String DEFAULT_LOG_PATH = "$TEMP\\${APP_NAME}-install.log";

    private HelperRoutines() {}

    static List<String> logMacros(BuildContext ctx) {
        var lines = new ArrayList<String>();
        if (!ctx.loggingEnabled()) {
            return lines;
        }
        var configured = ctx.config().logging().path();
        var path = configured.isBlank() ? DEFAULT_LOG_PATH : NsisText.escape(ctx.resolve(configured));
        lines.add("; --- Install log ---");
        lines.add("Var LogFile");
        lines.add("");
        lines.add("!macro LogInit _phase");
        lines.add("  FileOpen $LogFile \"" + path + "\" a");
        lines.add("  FileSeek $LogFile 0 END");
        lines.add("  FileWrite $LogFile \"=== ${APP_NAME} ${APP_VERSION}: ${_phase} ===$\\r$\\n\"");
        lines.add("!macroend");
        lines.add("");
        lines.add("!macro LogWrite _msg");
        lines.add("  StrCmp $LogFile \"\" +2");
        lines.add("  FileWrite $LogFile \"${_msg}$\\r$\\n\"");
        lines.add("!macroend");
        lines.add("");
        lines.add("!macro LogClose");
        lines.add("  StrCmp $LogFile \"\" +3");
        lines.add("  FileClose $LogFile");
        lines.add("  StrCpy $LogFile \"\"");
        lines.add("!macroend");
        lines.add("");
        return lines;
    }

    /** True when any global or component environment entry appends to PATH. */
    static boolean needsPathHelpers(BuildContext ctx) {
        if (ctx.config().install().actions().hasPathAppend()) {
            return true;
        }
        return ComponentTree.of(ctx.config().components()).sections().stream()
            .map(node -> node.entry().actions())
            .anyMatch(ActionSet::hasPathAppend);
    }

    static List<String> pathHelpers(BuildContext ctx) {
        var lines = new ArrayList<String>();
        if (!needsPathHelpers(ctx)) {
            return lines;
        }
        lines.add("; --- PATH helpers ---");
        lines.add("; Push haystack, push needle, Call _StrContains. Sets $R9 to \"1\" when found.");
        lines.add("Function _StrContains");
        lines.add("  Exch $R1");
        lines.add("  Exch");
        lines.add("  Exch $R0");
        lines.add("  Push $R2");
        lines.add("  Push $R3");
        lines.add("  Push $R4");
        lines.add("  StrCpy $R9 \"0\"");
        lines.add("  StrLen $R3 $R1");
        lines.add("  StrCpy $R2 0");
        lines.addAll(strContainsFlow().emit(""));
        lines.add("FunctionEnd");
        lines.add("");
        lines.add("; $0 = current value, $1 = entry to drop. Leaves the remaining entries in $0.");
        lines.add("Function un._RemovePathEntry");
        lines.add("  Push $2");
        lines.add("  Push $3");
        lines.add("  Push $4");
        lines.add("  Push $5");
        lines.add("  Push $6");
        lines.add("  StrCpy $2 $0");
        lines.add("  StrCpy $3 \"\"");
        lines.addAll(removePathEntryFlow().emit(""));
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    static ControlFlow strContainsFlow() {
        return ControlFlow.builder("_sc_find_")
            .state("scan", List.of("StrCpy $R4 $R0 $R3 $R2"), ControlFlow.branch("StrCmp $R4 $R1 {0}", "at_end", "found"))
            .state("at_end", ControlFlow.branch("StrCmp $R4 \"\" {0}", "step", "done"))
            .state("step", List.of("IntOp $R2 $R2 + 1"), ControlFlow.jump("scan"))
            .state("found", List.of("StrCpy $R9 \"1\""), ControlFlow.next())
            .state("done", List.of("Pop $R4", "Pop $R3", "Pop $R2", "Pop $R0", "Pop $R1"), ControlFlow.next())
            .build();
    }

    static ControlFlow removePathEntryFlow() {
        return ControlFlow.builder("_rpe_")
            .state("segment", List.of("StrCpy $5 0"), ControlFlow.next())
            .state("scan", List.of("StrCpy $6 $2 1 $5"), ControlFlow.branch("StrCmp $6 \"\" {0}", "separator", "cut"))
            .state("separator", ControlFlow.branch("StrCmp $6 \";\" {0}", "step", "cut"))
            .state("step", List.of("IntOp $5 $5 + 1"), ControlFlow.jump("scan"))
            .state("cut", List.of("StrCpy $4 $2 $5", "IntOp $5 $5 + 1", "StrCpy $2 $2 \"\" $5"),
                ControlFlow.branch("StrCmp $4 $1 {0}", "keep", "rest"))
            .state("keep", ControlFlow.branch("StrCmp $4 \"\" {0}", "append", "rest"))
            .state("append", ControlFlow.branch("StrCmp $3 \"\" {0}", "join", "first"))
            .state("join", List.of("StrCpy $3 \"$3;$4\""), ControlFlow.jump("rest"))
            .state("first", List.of("StrCpy $3 $4"), ControlFlow.next())
            .state("rest", ControlFlow.branch("StrCmp $2 \"\" 0 {0}", "finish", "segment"))
            .state("finish", List.of("StrCpy $0 $3", "Pop $6", "Pop $5", "Pop $4", "Pop $3", "Pop $2"), ControlFlow.next())
            .build();
    }

    static boolean needsChecksumHelpers(BuildContext ctx) {
        return ctx.config().files().stream().anyMatch(file -> file.isRemote() || !file.checksumType().isBlank());
    }

    static List<String> checksumHelpers(BuildContext ctx) {
        var lines = new ArrayList<String>();
        if (!needsChecksumHelpers(ctx)) {
            return lines;
        }
        lines.add("; --- Checksum and archive helpers ---");
        lines.add("; Push file, push algorithm, push expected hash, Call VerifyChecksum, Pop exit code (\"0\" = match).");
        lines.add("Function VerifyChecksum");
        lines.add("  Pop $R2");
        lines.add("  Pop $R1");
        lines.add("  Pop $R0");
        lines.add("  nsExec::ExecToStack `powershell -NoProfile -Command \"if ((Get-FileHash -Algorithm $R1 -LiteralPath '$R0').Hash -ne '$R2') { exit 1 }\"`");
        lines.add("  Pop $R3");
        lines.add("  Pop $R4");
        lines.add("  Push $R3");
        lines.add("FunctionEnd");
        lines.add("");
        lines.add("; Push archive, push destination, Call ExtractArchive.");
        lines.add("Function ExtractArchive");
        lines.add("  Pop $R1");
        lines.add("  Pop $R0");
        lines.add("  nsExec::ExecToStack `powershell -NoProfile -Command \"Expand-Archive -LiteralPath '$R0' -DestinationPath '$R1' -Force\"`");
        lines.add("  Pop $R2");
        lines.add("  Pop $R3");
        lines.add("  StrCmp $R2 \"0\" +2 0");
        lines.add("  MessageBox MB_OK|MB_ICONEXCLAMATION \"Failed to extract $R0\"");
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    /** Download, verify and unpack code for one remote file. */
    static List<String> remoteFile(BuildContext ctx, FileEntry file) {
        var url = ctx.resolve(file.source());
        var target = "$OUTDIR\\" + NsisText.fileName(url);
        var lines = new ArrayList<String>();
        lines.add("  ; Download: " + url);
        lines.add("  inetc::get /SILENT \"" + url + "\" \"" + target + "\" /END");
        lines.add("  Pop $0");
        lines.add("  StrCmp $0 \"OK\" +3 0");
        lines.add("  MessageBox MB_OK|MB_ICONSTOP \"Download failed: $0\"");
        lines.add("  Abort");
        if (file.hasChecksum()) {
            lines.add("  ; Verify checksum: " + file.checksumType() + " " + file.checksumValue());
            lines.add("  Push \"" + target + "\"");
            lines.add("  Push \"" + file.checksumType().toUpperCase(Locale.ROOT) + "\"");
            lines.add("  Push \"" + file.checksumValue() + "\"");
            lines.add("  Call VerifyChecksum");
            lines.add("  Pop $0");
            lines.add("  StrCmp $0 \"0\" +3 0");
            lines.add("  MessageBox MB_OK|MB_ICONSTOP \"Checksum verification failed: " + NsisText.fileName(url) + "\"");
            lines.add("  Abort");
        }
        if (file.decompress()) {
            lines.add("  Push \"" + target + "\"");
            lines.add("  Push \"$OUTDIR\"");
            lines.add("  Call ExtractArchive");
        }
        return lines;
    }
}
