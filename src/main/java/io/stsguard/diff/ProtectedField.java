package io.stsguard.diff;

import java.util.Locale;

public enum ProtectedField {
    SERVICE_NAME("serviceName"),
    SELECTOR("selector"),
    VOLUME_CLAIM_TEMPLATES("volumeClaimTemplates");

    private final String settingName;

    ProtectedField(String settingName) {
        this.settingName = settingName;
    }

    public String settingName() {
        return settingName;
    }

    public static ProtectedField fromSettingName(String raw) {
        if (raw != null) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            for (ProtectedField field : values()) {
                if (field.settingName.toLowerCase(Locale.ROOT).equals(value)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unknown protected field: " + raw);
    }
}
