package io.stsguard.diff;

import io.stsguard.config.GuardSettings;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

public record ProtectedFieldPolicy(
        Set<ProtectedField> fields,
        boolean allowVolumeExpansion
) {
    public ProtectedFieldPolicy {
        fields = fields == null || fields.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(fields));
    }

    public static ProtectedFieldPolicy conservative() {
        return new ProtectedFieldPolicy(EnumSet.allOf(ProtectedField.class), true);
    }

    public static ProtectedFieldPolicy fromSettings(GuardSettings settings) {
        return of(settings.protectedFields(), settings.allowVolumeExpansion());
    }

    public static ProtectedFieldPolicy of(Collection<String> names, boolean allowVolumeExpansion) {
        EnumSet<ProtectedField> fields = EnumSet.noneOf(ProtectedField.class);
        if (names != null) {
            for (String name : names) {
                fields.add(ProtectedField.fromSettingName(name));
            }
        }
        return new ProtectedFieldPolicy(fields, allowVolumeExpansion);
    }

    public boolean protects(ProtectedField field) {
        return fields.contains(field);
    }
}
