package io.stsguard.model;

import java.util.regex.Pattern;

public record WorkloadIdentity(String namespace, String name) {
    private static final Pattern DNS_LABEL = Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?");
    public static final String DEFAULT_NAMESPACE = "default";

    public WorkloadIdentity {
        namespace = validateLabel(namespace == null || namespace.isBlank() ? DEFAULT_NAMESPACE : namespace.trim(), "namespace");
        name = validateLabel(name == null ? "" : name.trim(), "name");
    }

    public static WorkloadIdentity of(String namespace, String name) {
        return new WorkloadIdentity(namespace, name);
    }

    public static WorkloadIdentity parse(String raw, String defaultNamespace) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Workload identity is required");
        }
        String value = raw.trim();
        int slash = value.indexOf('/');
        if (slash < 0) {
            return new WorkloadIdentity(defaultNamespace, value);
        }
        if (slash != value.lastIndexOf('/')) {
            throw new IllegalArgumentException("Invalid workload identity: " + raw);
        }
        return new WorkloadIdentity(value.substring(0, slash), value.substring(slash + 1));
    }

    public String key() {
        return namespace + "/" + name;
    }

    @Override
    public String toString() {
        return key();
    }

    private static String validateLabel(String value, String field) {
        if (value.isEmpty() || value.length() > 63 || !DNS_LABEL.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid workload " + field + ": '" + value + "'");
        }
        return value;
    }
}
