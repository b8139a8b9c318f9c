package work.lcod.installer.config;

import java.util.Locale;
import java.util.Objects;
import work.lcod.installer.shared.DurationParser;

/**
 * What the installer does when a previous installation of the same application is found.
 *
 * @param uninstallWaitMs how long to wait for the previous uninstaller to disappear; negative waits forever
 */
public record ExistingInstallPolicy(
    Mode mode,
    boolean versionCheck,
    boolean allowMultiple,
    String uninstallerArgs,
    boolean showVersionInfo,
    long uninstallWaitMs
) {
    public static final long DEFAULT_WAIT_MS = 15_000L;

    public ExistingInstallPolicy {
        Objects.requireNonNull(mode, "mode");
        uninstallerArgs = uninstallerArgs == null ? "" : uninstallerArgs;
    }

    public enum Mode {
        PROMPT_UNINSTALL,
        AUTO_UNINSTALL,
        OVERWRITE,
        ABORT,
        NONE;

        public static Mode from(String value) {
            if (value == null || value.isBlank()) {
                return PROMPT_UNINSTALL;
            }
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported existing_install mode: " + value);
            }
        }

        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ExistingInstallPolicy defaults() {
        return new ExistingInstallPolicy(Mode.PROMPT_UNINSTALL, false, false, "", true, DEFAULT_WAIT_MS);
    }

    public static ExistingInstallPolicy from(ConfigValue value, boolean legacyAllowMultiple) {
        if (value.asMap().isEmpty()) {
            var defaults = defaults();
            var mode = value.isAbsent() ? defaults.mode() : Mode.from(value.text(""));
            return new ExistingInstallPolicy(mode, false, legacyAllowMultiple, "", true, DEFAULT_WAIT_MS);
        }
        var wait = value.get("uninstall_wait_ms");
        return new ExistingInstallPolicy(
            Mode.from(value.text("mode", "prompt_uninstall")),
            value.bool("version_check", false),
            value.bool("allow_multiple", legacyAllowMultiple),
            value.text("uninstaller_args", ""),
            value.bool("show_version_info", true),
            DurationParser.toMillis(wait.text(""), DEFAULT_WAIT_MS)
        );
    }

    public boolean isEnabled() {
        return mode != Mode.NONE;
    }

    public boolean waitsForever() {
        return uninstallWaitMs < 0;
    }

    /** Version of the previous install is needed to compare or to show it. */
    public boolean needsVersion() {
        return versionCheck || showVersionInfo;
    }
}
