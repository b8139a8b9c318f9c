package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.flow.ControlFlow;
import work.lcod.installer.runtime.BuildContext;

/**
 * Macros and functions the existing-install machine calls: the early debug log, the product
 * version reader and, with {@code allow_multiple}, the directory page leave callback.
 */
final class ExistingInstallHelpers {
    static final String DIRECTORY_CALLBACK = "ExistingInstall_DirLeave";

    private ExistingInstallHelpers() {}

    static List<String> generate(BuildContext ctx) {
        var policy = ctx.config().install().existingInstall();
        var lines = new ArrayList<String>();
        if (!policy.isEnabled()) {
            return lines;
        }
        lines.addAll(debugMacro(ctx));
        if (policy.needsVersion()) {
            lines.addAll(versionFunction());
        }
        if (policy.allowMultiple()) {
            lines.add("; Existing-install check for the directory chosen on the directory page");
            lines.add("Function " + DIRECTORY_CALLBACK);
            if (ctx.loggingEnabled()) {
                lines.add("  " + ExistingInstallFlow.debug("ExistingInstall_DirLeave: INSTDIR=$INSTDIR"));
            }
            lines.addAll(ExistingInstallFlow.build(ctx, ExistingInstallFlow.Scope.DIRECTORY).emit(""));
            lines.add("FunctionEnd");
            lines.add("");
        }
        return lines;
    }

    /**
     * Debug log usable before the install log exists. Writes only with logging at DEBUG level;
     * otherwise the macro expands to nothing.
     */
    static List<String> debugMacro(BuildContext ctx) {
        var lines = new ArrayList<String>();
        lines.add("!macro " + ExistingInstallFlow.DEBUG_MACRO + " _msg");
        if (ctx.loggingEnabled() && ctx.config().logging().isDebug()) {
            lines.add("  Push $R7");
            lines.add("  Push $R8");
            lines.add("  StrCpy $R7 `${_msg}`");
            lines.add("  FileOpen $R8 \"$TEMP\\${APP_NAME}-debug.log\" a");
            lines.add("  StrCmp $R8 \"\" +4");
            lines.add("  FileSeek $R8 0 END");
            lines.add("  FileWrite $R8 \"$R7$\\r$\\n\"");
            lines.add("  FileClose $R8");
            lines.add("  Pop $R8");
            lines.add("  Pop $R7");
        } else {
            lines.add("  ; debug logging disabled");
        }
        lines.add("!macroend");
        lines.add("");
        return lines;
    }

    /**
     * {@code Push <file>}, {@code Call}, {@code Pop <version>}: the ProductVersion string of a
     * binary, falling back to its FileVersion string, empty when neither exists.
     */
    static List<String> versionFunction() {
        var lines = new ArrayList<String>();
        lines.add("Function " + ExistingInstallFlow.VERSION_FUNCTION);
        lines.add("  Exch $0");
        for (int register = 1; register <= 9; register++) {
            lines.add("  Push $" + register);
        }
        lines.add("  StrCpy $9 \"\"");
        lines.addAll(versionFlow().emit(""));
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    static ControlFlow versionFlow() {
        var readString = "System::Call \"*$5(&t${NSIS_MAX_STRLEN} .r9)\"";
        var query = "System::Call 'version::VerQueryValueW(i r3, w r2, *p .r5, *i .r6) i .r7'";
        var restore = new ArrayList<String>();
        restore.add("StrCpy $0 $9");
        for (int register = 9; register >= 1; register--) {
            restore.add("Pop $" + register);
        }
        restore.add("Exch $0");
        return ControlFlow.builder("_gfpv_")
            .state("size", List.of("System::Call 'version::GetFileVersionInfoSizeW(w r0, *i .r1) i .r2'"),
                ControlFlow.branch("StrCmp $2 0 {0}", "alloc", "done"))
            .state("alloc", List.of("System::Alloc $2", "Pop $3"),
                ControlFlow.branch("StrCmp $3 0 {0}", "read", "done"))
            .state("read", List.of("System::Call 'version::GetFileVersionInfoW(w r0, i 0, i r2, i r3) i .r4'"),
                ControlFlow.branch("StrCmp $4 0 {0}", "translation", "free"))
            .state("translation", List.of("System::Call 'version::VerQueryValueW(i r3, w \"\\VarFileInfo\\Translation\", *p .r5, *i .r6) i .r7'"),
                ControlFlow.branch("StrCmp $7 0 {0}", "langcp", "english"))
            .state("langcp", List.of(
                "System::Call \"*$5(&i .r8)\"",
                "IntOp $6 $8 & 0xFFFF",
                "IntOp $7 $8 >> 16",
                "IntFmt $1 \"%04X\" $6",
                "IntFmt $2 \"%04X\" $7",
                "StrCpy $1 \"$1$2\""
            ), ControlFlow.branch("StrCmp $1 \"00000000\" {0}", "query", "english"))
            .state("english", List.of("StrCpy $1 \"040904B0\""), ControlFlow.next())
            .state("query", List.of("StrCpy $2 \"\\StringFileInfo\\$1\\ProductVersion\"", query),
                ControlFlow.branch("StrCmp $7 0 {0}", "product", "next_langcp"))
            .state("product", List.of(readString), ControlFlow.branch("StrCmp $9 \"\" 0 {0}", "file_version", "free"))
            .state("file_version", List.of("StrCpy $2 \"\\StringFileInfo\\$1\\FileVersion\"", query),
                ControlFlow.branch("StrCmp $7 0 {0}", "file_version_read", "next_langcp"))
            .state("file_version_read", List.of(readString), ControlFlow.jump("free"))
            .state("next_langcp", ControlFlow.branch("StrCmp $1 \"000004B0\" {0}", "after_chinese", "free"))
            .state("after_chinese", ControlFlow.branch("StrCmp $1 \"080404B0\" {0}", "after_english", "use_neutral"))
            .state("after_english", ControlFlow.branch("StrCmp $1 \"040904B0\" {0}", "english", "use_chinese"))
            .state("use_chinese", List.of("StrCpy $1 \"080404B0\""), ControlFlow.jump("query"))
            .state("use_neutral", List.of("StrCpy $1 \"000004B0\""), ControlFlow.jump("query"))
            .state("free", List.of("System::Free $3"), ControlFlow.next())
            .state("done", restore, ControlFlow.next())
            .build();
    }
}
