package work.lcod.installer.config;

import java.util.Objects;

/**
 * Global install behaviour: target directory, registry location, global actions and UI options.
 */
public record InstallPolicy(
    String installDir,
    ActionSet actions,
    SystemRequirements systemRequirements,
    String launchOnFinish,
    LangText launchOnFinishLabel,
    boolean launchInBackground,
    boolean silentInstall,
    String installerName,
    String registryKey,
    RegistryView registryView,
    ExistingInstallPolicy existingInstall
) {
    public static final String DEFAULT_INSTALL_DIR = "$PROGRAMFILES64\\${app.name}";

    public InstallPolicy {
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(existingInstall, "existingInstall");
    }

    public static InstallPolicy from(ConfigValue value) {
        return new InstallPolicy(
            value.text("install_dir", DEFAULT_INSTALL_DIR),
            ActionSet.from(value, "install"),
            SystemRequirements.from(value.get("system_requirements")),
            value.text("launch_on_finish", ""),
            LangText.from(value.get("launch_on_finish_label")),
            value.bool("launch_in_background", true),
            value.bool("silent_install", false),
            value.text("installer_name", ""),
            value.text("registry_key", ""),
            RegistryView.from(value.text("registry_view", "auto"), "install.registry_view"),
            ExistingInstallPolicy.from(value.get("existing_install"), value.bool("allow_multiple_installations", false))
        );
    }
}
