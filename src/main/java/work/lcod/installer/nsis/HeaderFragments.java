package work.lcod.installer.nsis;

import java.util.ArrayList;
import java.util.List;
import work.lcod.installer.runtime.BuildContext;

/**
 * Script header, custom includes and the general installer attributes.
 */
final class HeaderFragments {
    private static final List<String> INCLUDES = List.of(
        "MUI2.nsh",
        "LogicLib.nsh",
        "FileFunc.nsh",
        "nsDialogs.nsh",
        "WinMessages.nsh",
        "WinVer.nsh",
        "x64.nsh"
    );

    private HeaderFragments() {}

    static List<String> header(BuildContext ctx) {
        var app = ctx.config().app();
        var lines = new ArrayList<String>();
        lines.add("; " + ctx.appName() + " installer script");
        lines.add("; Generated by lcod-installer. Edit the package configuration instead of this file.");
        lines.add("");
        lines.add("Unicode true");
        lines.add("");
        lines.add("!define APP_NAME " + NsisText.quote(ctx.appName()));
        lines.add("!define APP_VERSION " + NsisText.quote(ctx.resolve(app.version())));
        lines.add("!define APP_VERSION_VI " + NsisText.quote(NsisText.versionInfo(ctx.resolve(app.version()))));
        lines.add("!define APP_PUBLISHER " + NsisText.quote(ctx.resolve(app.publisher())));
        lines.add("!define REG_KEY " + NsisText.quote(ctx.registryKey()));
        lines.add("!define ARP_KEY \"Software\\Microsoft\\Windows\\CurrentVersion\\Uninstall\\${APP_NAME}\"");
        lines.add("");
        if (!app.installIcon().isBlank()) {
            lines.add("!define MUI_ICON " + NsisText.quote(filePath(ctx, app.installIcon())));
        }
        if (!app.uninstallIcon().isBlank()) {
            lines.add("!define MUI_UNICON " + NsisText.quote(filePath(ctx, app.uninstallIcon())));
        }
        INCLUDES.forEach(include -> lines.add("!include \"" + include + "\""));
        if (ctx.config().files().stream().anyMatch(file -> file.isRemote())) {
            lines.add("; Remote files are downloaded with the inetc plugin");
        }
        lines.add("");
        return lines;
    }

    static List<String> customIncludes(BuildContext ctx) {
        var includes = ctx.config().customIncludes().getOrDefault(ctx.dialect().id(), List.of());
        var lines = new ArrayList<String>();
        if (includes.isEmpty()) {
            return lines;
        }
        lines.add("; Custom includes");
        for (var include : includes) {
            if (!include.isBlank()) {
                lines.add("!include " + NsisText.quote(filePath(ctx, include)));
            }
        }
        lines.add("");
        return lines;
    }

    static List<String> generalSettings(BuildContext ctx) {
        var config = ctx.config();
        var install = config.install();
        var lines = new ArrayList<String>();
        lines.addAll(NsisText.banner("General Settings"));
        lines.add("Name \"${APP_NAME}\"");
        var installerName = install.installerName().isBlank()
            ? "${APP_NAME}-${APP_VERSION}-Setup.exe"
            : ctx.resolve(install.installerName());
        lines.add("OutFile " + NsisText.quote(installerName));
        lines.add("InstallDir " + NsisText.quote(ctx.resolve(install.installDir())));
        lines.add("InstallDirRegKey HKLM \"${REG_KEY}\" \"InstallPath\"");
        lines.add("RequestExecutionLevel admin");
        lines.add("SetCompressor /SOLID lzma");
        lines.add("ShowInstDetails show");
        lines.add("ShowUninstDetails show");
        if (!config.app().branding().isBlank()) {
            lines.add("BrandingText " + NsisText.quote(ctx.resolve(config.app().branding())));
        }
        lines.add("");
        lines.add("VIProductVersion \"${APP_VERSION_VI}\"");
        lines.add("VIAddVersionKey \"ProductName\" \"${APP_NAME}\"");
        lines.add("VIAddVersionKey \"ProductVersion\" \"${APP_VERSION}\"");
        lines.add("VIAddVersionKey \"CompanyName\" \"${APP_PUBLISHER}\"");
        lines.add("VIAddVersionKey \"FileVersion\" \"${APP_VERSION}\"");
        var description = config.app().description().defaultText();
        lines.add("VIAddVersionKey \"FileDescription\" "
            + NsisText.quote(description.isBlank() ? ctx.appName() + " Installer" : ctx.resolve(description)));
        if (install.silentInstall()) {
            lines.add("");
            lines.add("SilentInstall silent");
            lines.add("SilentUnInstall silent");
        }
        lines.add("");
        return lines;
    }

    /** Paths of files read by the script compiler, with Windows separators. */
    static String filePath(BuildContext ctx, String path) {
        return NsisText.normalizePath(ctx.sourcePath(path));
    }
}
