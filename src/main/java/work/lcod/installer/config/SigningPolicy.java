package work.lcod.installer.config;

public record SigningPolicy(
    boolean enabled,
    String certificate,
    String password,
    String timestampUrl,
    boolean verifySignature,
    String checksumType,
    String checksumValue
) {
    public static final String DEFAULT_TIMESTAMP_URL = "http://timestamp.digicert.com";

    public static SigningPolicy disabled() {
        return new SigningPolicy(false, "", "", DEFAULT_TIMESTAMP_URL, false, "", "");
    }

    public static SigningPolicy from(ConfigValue value) {
        if (value.asMap().isEmpty()) {
            return disabled();
        }
        return new SigningPolicy(
            value.bool("enabled", false),
            value.text("certificate", ""),
            value.text("password", ""),
            value.text("timestamp_url", DEFAULT_TIMESTAMP_URL),
            value.bool("verify_signature", false),
            value.text("checksum_type", ""),
            value.text("checksum_value", "")
        );
    }
}
