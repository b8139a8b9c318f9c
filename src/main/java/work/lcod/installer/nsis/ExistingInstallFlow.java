package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.config.ExistingInstallPolicy;
import work.lcod.installer.config.ExistingInstallPolicy.Mode;
import work.lcod.installer.flow.ControlFlow;
import work.lcod.installer.runtime.BuildContext;

/**
 * Detection and handling of a previous installation, as a {@link ControlFlow}.
 *
 * <p>The same machine is instantiated twice: globally in {@code .onInit}, probing the install path
 * recorded in the registry, and per directory in the directory page leave callback, probing the
 * directory the user picked. Only the probe differs.</p>
 *
 * <p>Registers: {@code $R1} install path, {@code $R2} installed version, {@code $R3} elapsed wait,
 * {@code $R4} uninstaller exit code, {@code $R6} version source.</p>
 */
public final class ExistingInstallFlow {
    public static final String GLOBAL_PREFIX = "_ei_";
    public static final String DIRECTORY_PREFIX = "_eid_";
    public static final String VERSION_FUNCTION = "_IC_GetFileProductVersion";
    public static final String DEBUG_MACRO = "_IC_DebugLog";
    static final int POLL_INTERVAL_MS = 500;

    private static final String UNINSTALLER = "\"$R1\\Uninstall.exe\"";

    public enum Scope {
        GLOBAL,
        DIRECTORY
    }

    private ExistingInstallFlow() {}

    /**
     * Builds the machine for the configured policy; callers skip it entirely for {@link Mode#NONE}.
     */
    public static ControlFlow build(BuildContext ctx, Scope scope) {
        var policy = ctx.config().install().existingInstall();
        var logging = ctx.loggingEnabled();
        var flow = ControlFlow.builder(scope == Scope.GLOBAL ? GLOBAL_PREFIX : DIRECTORY_PREFIX);

        probe(ctx, scope, flow, logging);
        versionStates(policy, flow, logging);
        decisionStates(ctx, policy, flow);
        uninstallStates(ctx, policy, flow, logging);

        flow.state("cancel", ControlFlow.stop("Abort"));
        if (scope == Scope.GLOBAL) {
            flow.state("overwrite_only", List.of("; No uninstaller found, files will be overwritten"), ControlFlow.next());
        }
        var done = new ArrayList<String>();
        if (logging) {
            done.add(debug("ExistingInstall: done (path=$R1)"));
        }
        done.add("SetRegView lastused");
        flow.state("done", done, ControlFlow.next());
        return flow.build();
    }

    private static void probe(BuildContext ctx, Scope scope, ControlFlow.Builder flow, boolean logging) {
        var view = "SetRegView " + ctx.effectiveRegistryView();
        if (scope == Scope.GLOBAL) {
            flow.state("probe", List.of(view, "ReadRegStr $R0 HKLM \"${REG_KEY}\" \"InstallPath\""),
                ControlFlow.branch("StrCmp $R0 \"\" {0}", "located", "done"));
            flow.state("located", List.of("StrCpy $R1 $R0"),
                ControlFlow.branch("IfFileExists " + UNINSTALLER + " 0 {0}", "has_uninst", "overwrite_only"));
        } else {
            var body = new ArrayList<String>();
            body.add(view);
            body.add("StrCpy $R1 $INSTDIR");
            if (logging) {
                body.add(debug("ExistingInstall_DirLeave: checking path=$R1"));
            }
            flow.state("probe", body, ControlFlow.branch("IfFileExists " + UNINSTALLER + " 0 {0}", "has_uninst", "done"));
        }
    }

    private static void versionStates(ExistingInstallPolicy policy, ControlFlow.Builder flow, boolean logging) {
        if (!policy.needsVersion()) {
            flow.state("has_uninst", ControlFlow.next());
            return;
        }
        flow.state("has_uninst", List.of(
            "StrCpy $R6 \"ProductVersion\"",
            "Push " + UNINSTALLER,
            "Call " + VERSION_FUNCTION,
            "Pop $R2"
        ), ControlFlow.branch("StrCmp $R2 \"\" 0 {0}", "ver_fixed", "ver_done"));
        flow.state("ver_fixed", List.of(
            "; Fallback: numeric file version (VS_FIXEDFILEINFO)",
            "StrCpy $R6 \"FileVersionFixed\"",
            "ClearErrors",
            "GetDLLVersion " + UNINSTALLER + " $0 $1"
        ), ControlFlow.branch("IfErrors {0}", "ver_split", "ver_clear"));
        flow.state("ver_split", List.of(
            "IntOp $2 $0 >> 16",
            "IntOp $3 $0 & 0xFFFF",
            "IntOp $4 $1 >> 16",
            "IntOp $5 $1 & 0xFFFF",
            "StrCpy $R2 \"$2.$3.$4.$5\""
        ), ControlFlow.branch("StrCmp $R2 \"0.0.0.0\" 0 {0}", "ver_clear", "ver_done"));
        flow.state("ver_clear", List.of("StrCpy $R2 \"\""), ControlFlow.next());
        var resolved = new ArrayList<String>();
        if (logging) {
            resolved.add(debug("ExistingInstall: resolved version=$R2 source=$R6 (path=$R1)"));
        }
        if (policy.versionCheck()) {
            flow.state("ver_done", resolved, ControlFlow.branch("StrCmp $R2 \"${APP_VERSION}\" {0}", "ver_same_vi", "done"));
            flow.state("ver_same_vi", ControlFlow.branch("StrCmp $R2 \"${APP_VERSION_VI}\" {0}", "decide", "done"));
        } else {
            flow.state("ver_done", resolved, ControlFlow.next());
        }
    }

    private static void decisionStates(BuildContext ctx, ExistingInstallPolicy policy, ControlFlow.Builder flow) {
        switch (policy.mode()) {
            case PROMPT_UNINSTALL -> {
                var noVersion = prompt(NsisText.message(ctx, "existing_install_prompt_no_ver"));
                if (policy.showVersionInfo()) {
                    flow.state("decide", ControlFlow.branch("StrCmp $R2 \"\" {0}", "prompt_ver", "prompt_no_ver"));
                    flow.state("prompt_ver", prompt(NsisText.message(ctx, "existing_install_prompt")));
                    flow.state("prompt_no_ver", noVersion);
                } else {
                    flow.state("decide", noVersion);
                }
            }
            case AUTO_UNINSTALL -> flow.state("decide", ControlFlow.jump("do_uninstall"));
            case ABORT -> {
                var noVersion = List.of(abortBox(NsisText.message(ctx, "existing_install_abort_no_ver")));
                if (policy.showVersionInfo()) {
                    flow.state("decide", ControlFlow.branch("StrCmp $R2 \"\" {0}", "abort_ver", "abort_no_ver"));
                    flow.state("abort_ver", List.of(abortBox(NsisText.message(ctx, "existing_install_abort"))), ControlFlow.jump("cancel"));
                    flow.state("abort_no_ver", noVersion, ControlFlow.jump("cancel"));
                } else {
                    flow.state("decide", noVersion, ControlFlow.jump("cancel"));
                }
            }
            case OVERWRITE -> flow.state("decide", List.of("; Overwrite mode: keep the existing files"), ControlFlow.jump("done"));
            default -> throw new IllegalStateException("No existing-install flow for mode " + policy.mode().id());
        }
    }

    private static ControlFlow.Exit prompt(String message) {
        return ControlFlow.branch("MessageBox MB_YESNO|MB_ICONQUESTION \"" + message + "\" IDYES {0}", "cancel", "do_uninstall");
    }

    private static String abortBox(String message) {
        return "MessageBox MB_OK|MB_ICONSTOP \"" + message + "\"";
    }

    private static void uninstallStates(BuildContext ctx, ExistingInstallPolicy policy, ControlFlow.Builder flow, boolean logging) {
        var args = policy.uninstallerArgs().isBlank() ? "/S" : policy.uninstallerArgs();
        var run = new ArrayList<String>();
        if (logging) {
            run.add("!insertmacro LogWrite \"Running existing uninstaller: $R1\\Uninstall.exe " + args + "\"");
        }
        run.add("ClearErrors");
        run.add("ExecWait '" + UNINSTALLER + " " + args + "' $R4");
        flow.state("do_uninstall", run, ControlFlow.branch("IfErrors {0}", "wait_start", "retry_prompt"));

        if (policy.waitsForever()) {
            flow.state("wait_start", List.of("; Wait for the uninstaller to remove itself (no timeout)"), ControlFlow.next());
            flow.state("wait_poll", List.of("Sleep " + POLL_INTERVAL_MS),
                ControlFlow.branch("IfFileExists " + UNINSTALLER + " {0}", "done", "wait_poll"));
        } else {
            var bound = policy.uninstallWaitMs();
            flow.state("wait_start", List.of(
                "; Wait for the uninstaller to remove itself (up to " + bound + "ms)",
                "StrCpy $R3 0"
            ), ControlFlow.next());
            flow.state("wait_loop", ControlFlow.branch("IntCmp $R3 " + bound + " {0} 0 {0}", "wait_poll", "wait_done"));
            flow.state("wait_poll", List.of("Sleep " + POLL_INTERVAL_MS, "IntOp $R3 $R3 + " + POLL_INTERVAL_MS),
                ControlFlow.branch("IfFileExists " + UNINSTALLER + " {0}", "done", "wait_loop"));
            flow.state("wait_done", ControlFlow.branch("IfFileExists " + UNINSTALLER + " 0 {0}", "retry_prompt", "done"));
        }

        var retry = new ArrayList<String>();
        if (logging) {
            retry.add("!insertmacro LogWrite \"Previous uninstaller did not finish (exit code $R4).\"");
        }
        flow.state("retry_prompt", retry, ControlFlow.branch(
            "MessageBox MB_RETRYCANCEL|MB_ICONEXCLAMATION \"" + NsisText.message(ctx, "uninstall_not_finished") + "\" IDRETRY {0}",
            "cancel",
            "do_uninstall"
        ));
    }

    static String debug(String message) {
        return "!insertmacro " + DEBUG_MACRO + " \"" + message + "\"";
    }
}
