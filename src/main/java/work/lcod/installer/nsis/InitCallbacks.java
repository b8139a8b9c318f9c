package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.lcod.installer.flow.ControlFlow;
import work.lcod.installer.runtime.BuildContext;
import work.lcod.installer.runtime.ComponentTree;
import work.lcod.installer.runtime.ShortcutCatalog;
import work.lcod.installer.runtime.ShortcutEntry;

/**
 * Installer and uninstaller callbacks: {@code .onInit}, {@code .onInstSuccess}, {@code un.onInit}
 * and the functions behind the shortcut options page and the finish page launch checkbox.
 */
final class InitCallbacks {
    private InitCallbacks() {}

    static List<String> onInstSuccess(BuildContext ctx) {
        var lines = new ArrayList<String>();
        if (!ctx.loggingEnabled()) {
            return lines;
        }
        lines.add("; Runs after all sections complete");
        lines.add("Function .onInstSuccess");
        for (var node : ComponentTree.of(ctx.config().components()).sections()) {
            if (!node.entry().optional()) {
                continue;
            }
            lines.add("  SectionGetFlags ${" + node.id() + "} $0");
            lines.add("  IntOp $0 $0 & ${SF_SELECTED}");
            var skipped = ControlFlow.builder("_" + node.id().toLowerCase(Locale.ROOT) + "_")
                .state("check", ControlFlow.branch("StrCmp $0 \"0\" 0 {0}", "skipped", "done"))
                .state("skipped", List.of("!insertmacro LogWrite \"Skipping component: " + NsisText.escape(node.name()) + "\""),
                    ControlFlow.next())
                .state("done", ControlFlow.next())
                .build();
            lines.addAll(skipped.emit(""));
        }
        lines.add("  !insertmacro LogWrite \"Installation completed successfully.\"");
        lines.add("  !insertmacro LogClose");
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    static List<String> onInit(BuildContext ctx) {
        var config = ctx.config();
        var lines = new ArrayList<String>(NsisText.banner("Initialization"));
        lines.add("Function .onInit");
        lines.add("");
        lines.addAll(mutex("InstallerMutex", NsisText.message(ctx, "installer_running")));

        if (ctx.languages().size() > 1) {
            lines.add("  !insertmacro MUI_LANGDLL_DISPLAY");
            lines.add("");
        }
        if (config.signing().verifySignature()) {
            lines.addAll(signatureCheck(ctx));
        }
        lines.addAll(requirementChecks(ctx));
        if (ctx.loggingEnabled()) {
            lines.add("!ifdef NSIS_CONFIG_LOG");
            lines.add("  LogSet on");
            lines.add("!endif");
        }
        lines.addAll(existingInstall(ctx));

        var shortcuts = ShortcutCatalog.collect(ctx);
        if (!shortcuts.isEmpty()) {
            lines.add("  ; Default shortcut states, changed on the shortcut options page");
            for (var shortcut : shortcuts) {
                var on = !shortcut.isOptional() || shortcut.config().defaultOn();
                lines.add("  StrCpy $CREATE_SC_" + shortcut.index() + " \"" + (on ? "1" : "0") + "\"");
            }
            lines.add("");
        }
        for (var node : ComponentTree.of(config.components()).sections()) {
            var entry = node.entry();
            if (!entry.optional()) {
                // SF_SELECTED | SF_RO
                lines.add("  SectionSetFlags ${" + node.id() + "} 17");
            } else if (!entry.defaultSelected()) {
                lines.add("  SectionSetFlags ${" + node.id() + "} 0");
            }
        }
        lines.add("FunctionEnd");
        lines.add("");

        var optional = ModernUiFragment.optionalShortcuts(shortcuts);
        if (!optional.isEmpty()) {
            lines.addAll(shortcutPage(ctx, optional));
        }
        if (!config.install().launchOnFinish().isBlank()) {
            lines.addAll(launchFunction(ctx));
        }
        return lines;
    }

    static List<String> unOnInit(BuildContext ctx) {
        var lines = new ArrayList<String>(NsisText.banner("Uninstaller Initialization"));
        lines.add("Function un.onInit");
        lines.add("");
        lines.addAll(mutex("UninstallerMutex", NsisText.message(ctx, "uninstaller_running")));
        if (ctx.loggingEnabled()) {
            lines.add("!ifdef NSIS_CONFIG_LOG");
            lines.add("  LogSet on");
            lines.add("!endif");
        }
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    private static List<String> mutex(String name, String message) {
        return List.of(
            "  ; Single instance",
            "  System::Call 'kernel32::CreateMutex(p 0, i 0, t \"${APP_NAME}_" + name + "\") p .r1 ?e'",
            "  Pop $R0",
            "  StrCmp $R0 \"0\" +3 0",
            "  MessageBox MB_OK|MB_ICONEXCLAMATION \"" + message + "\"",
            "  Abort",
            ""
        );
    }

    private static List<String> signatureCheck(BuildContext ctx) {
        var lines = new ArrayList<String>();
        lines.add("  ; Verify the installer's digital signature");
        var check = ControlFlow.builder("_sig_")
            .state("check", List.of(
                    powershell("$$s = Get-AuthenticodeSignature -LiteralPath '$EXEPATH'; "
                        + "if ($$s.Status -ne 'Valid') { exit 1 }"),
                    "Pop $0",
                    "Pop $1"
                ),
                ControlFlow.branch("StrCmp $0 \"0\" {0}", "failed", "ok"))
            .state("failed", List.of("MessageBox MB_OK|MB_ICONSTOP \"" + NsisText.message(ctx, "signature_failed") + "\""),
                ControlFlow.stop("Abort"))
            .state("ok", ControlFlow.next())
            .build();
        lines.addAll(check.emit(""));
        lines.add("");
        return lines;
    }

    private static List<String> requirementChecks(BuildContext ctx) {
        var requirements = ctx.config().install().systemRequirements();
        var lines = new ArrayList<String>();
        if (!requirements.minWindowsVersion().isBlank()) {
            var version = requirements.minWindowsVersion();
            lines.add("  ; Minimum Windows version " + version);
            lines.add("  " + powershell("$$v = (Get-CimInstance Win32_OperatingSystem).Version; "
                + "if ([Version]$$v -lt [Version]'" + version + "') { exit 1 }"));
            lines.addAll(failUnlessZero(NsisText.message(ctx, "requires_windows")));
        }
        if (requirements.minFreeSpaceMb() > 0) {
            var mb = requirements.minFreeSpaceMb();
            lines.add("  ; Free disk space >= " + mb + " MB");
            lines.add("  " + powershell("$$d = Get-PSDrive ($$env:SystemDrive[0]); "
                + "if ($$d.Free / 1MB -lt " + mb + ") { exit 1 }"));
            lines.addAll(failUnlessZero(NsisText.message(ctx, "not_enough_space")));
        }
        if (requirements.minRamMb() > 0) {
            var mb = requirements.minRamMb();
            lines.add("  ; Physical memory >= " + mb + " MB");
            lines.add("  " + powershell("$$m = (Get-CimInstance Win32_ComputerSystem).TotalPhysicalMemory / 1MB; "
                + "if ($$m -lt " + mb + ") { exit 1 }"));
            lines.addAll(failUnlessZero(NsisText.message(ctx, "not_enough_memory")));
        }
        if (requirements.requireAdmin()) {
            lines.add("  ; Administrator privileges");
            lines.add("  UserInfo::GetAccountType");
            lines.add("  Pop $0");
            lines.add("  StrCmp $0 \"Admin\" +3 0");
            lines.add("  MessageBox MB_OK|MB_ICONSTOP \"" + NsisText.message(ctx, "need_admin") + "\"");
            lines.add("  Abort");
            lines.add("");
        }
        return lines;
    }

    private static String powershell(String script) {
        return "nsExec::ExecToStack `powershell -NoProfile -Command \"& { " + script + " }\"`";
    }

    private static List<String> failUnlessZero(String message) {
        return List.of(
            "  Pop $0",
            "  Pop $1",
            "  StrCmp $0 \"0\" +3 0",
            "  MessageBox MB_OK|MB_ICONSTOP \"" + message + "\"",
            "  Abort",
            ""
        );
    }

    private static List<String> existingInstall(BuildContext ctx) {
        var policy = ctx.config().install().existingInstall();
        var lines = new ArrayList<String>();
        if (!policy.isEnabled()) {
            return lines;
        }
        if (policy.allowMultiple()) {
            lines.add("  ; Existing installs are checked when the directory page is left;");
            lines.add("  ; silent installs never show that page.");
            lines.add("  ${If} ${Silent}");
            lines.add("    Call " + ExistingInstallHelpers.DIRECTORY_CALLBACK);
            lines.add("  ${EndIf}");
        } else {
            lines.add("  ; Existing installation");
            lines.addAll(ExistingInstallFlow.build(ctx, ExistingInstallFlow.Scope.GLOBAL).emit(""));
        }
        lines.add("");
        return lines;
    }

    private static List<String> shortcutPage(BuildContext ctx, List<ShortcutEntry> optional) {
        var lines = new ArrayList<String>();
        lines.add("Function " + ModernUiFragment.SHORTCUT_PAGE);
        lines.add("  !insertmacro MUI_HEADER_TEXT \"" + NsisText.message(ctx, "shortcuts_page_title") + "\" \""
            + NsisText.message(ctx, "shortcuts_page_desc") + "\"");
        lines.add("  nsDialogs::Create 1018");
        lines.add("  Pop $0");
        lines.add("  ${If} $0 == error");
        lines.add("    Abort");
        lines.add("  ${EndIf}");
        int row = 0;
        for (var shortcut : optional) {
            var control = "$_SC_CTRL_" + shortcut.index();
            lines.add("  ${NSD_CreateCheckbox} 0 " + (row * 16) + "u 100% 12u \"" + ModernUiFragment.shortcutLabel(ctx, shortcut) + "\"");
            lines.add("  Pop " + control);
            lines.add("  ${If} $CREATE_SC_" + shortcut.index() + " == \"1\"");
            lines.add("    ${NSD_Check} " + control);
            lines.add("  ${EndIf}");
            row++;
        }
        lines.add("  nsDialogs::Show");
        lines.add("FunctionEnd");
        lines.add("");

        lines.add("Function " + ModernUiFragment.SHORTCUT_PAGE + "Leave");
        for (var shortcut : optional) {
            var variable = "$CREATE_SC_" + shortcut.index();
            lines.add("  ${NSD_GetState} $_SC_CTRL_" + shortcut.index() + " $1");
            lines.add("  ${If} $1 == ${BST_CHECKED}");
            lines.add("    StrCpy " + variable + " \"1\"");
            lines.add("  ${Else}");
            lines.add("    StrCpy " + variable + " \"0\"");
            lines.add("  ${EndIf}");
        }
        lines.add("FunctionEnd");
        lines.add("");
        return lines;
    }

    private static List<String> launchFunction(BuildContext ctx) {
        var install = ctx.config().install();
        var target = ActionEmitter.shortcutPath(ctx, install.launchOnFinish());
        var command = install.launchInBackground() ? "Exec" : "ExecWait";
        return List.of(
            "Function " + ModernUiFragment.LAUNCH_FUNCTION,
            "  " + command + " '\"" + target + "\"'",
            "FunctionEnd",
            ""
        );
    }
}
