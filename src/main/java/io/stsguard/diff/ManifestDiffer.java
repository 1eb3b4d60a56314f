package io.stsguard.diff;

import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.Quantity;
import io.stsguard.model.FieldChange;
import io.stsguard.model.FieldDiff;
import io.stsguard.model.LiveWorkloadState;
import io.stsguard.model.VolumeClaimTemplate;
import io.stsguard.model.WorkloadSpec;
import io.stsguard.util.Jsons;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Compares a live workload with its desired spec, restricted to the protected fields of the
 * configured policy. Comparison is structural: ordering of maps and access modes is ignored and
 * storage quantities are compared by value.
 */
public final class ManifestDiffer {
    private final ProtectedFieldPolicy policy;

    public ManifestDiffer(ProtectedFieldPolicy policy) {
        this.policy = policy == null ? ProtectedFieldPolicy.conservative() : policy;
    }

    public FieldDiff diff(LiveWorkloadState live, WorkloadSpec desired) {
        Objects.requireNonNull(desired, "desired");
        if (live == null) {
            return FieldDiff.create();
        }
        WorkloadSpec current = live.spec();
        List<FieldChange> changes = new ArrayList<>();
        if (policy.protects(ProtectedField.SERVICE_NAME)
                && !normalize(current.serviceName()).equals(normalize(desired.serviceName()))) {
            changes.add(change("spec.serviceName", current.serviceName(), desired.serviceName()));
        }
        if (policy.protects(ProtectedField.SELECTOR) && !current.selector().equals(desired.selector())) {
            changes.add(change("spec.selector", current.selector(), desired.selector()));
        }
        if (policy.protects(ProtectedField.VOLUME_CLAIM_TEMPLATES)) {
            diffVolumeTemplates(current.volumeClaimTemplates(), desired.volumeClaimTemplates(), changes);
        }
        return FieldDiff.update(changes);
    }

    private void diffVolumeTemplates(List<VolumeClaimTemplate> live, List<VolumeClaimTemplate> desired, List<FieldChange> out) {
        String base = "spec.volumeClaimTemplates";
        if (live.size() != desired.size()) {
            out.add(change(base + ".count", live.size(), desired.size()));
        }
        Map<String, VolumeClaimTemplate> liveByName = byName(live);
        Map<String, VolumeClaimTemplate> desiredByName = byName(desired);
        for (Map.Entry<String, VolumeClaimTemplate> entry : liveByName.entrySet()) {
            if (!desiredByName.containsKey(entry.getKey())) {
                out.add(change(base + "[" + entry.getKey() + "]", entry.getValue(), null));
            }
        }
        for (Map.Entry<String, VolumeClaimTemplate> entry : desiredByName.entrySet()) {
            String path = base + "[" + entry.getKey() + "]";
            VolumeClaimTemplate want = entry.getValue();
            VolumeClaimTemplate have = liveByName.get(entry.getKey());
            if (have == null) {
                out.add(change(path, null, want));
                continue;
            }
            if (!new TreeSet<>(have.accessModes()).equals(new TreeSet<>(want.accessModes()))) {
                out.add(change(path + ".accessModes", have.accessModes(), want.accessModes()));
            }
            if (!normalize(have.storageClassName()).equals(normalize(want.storageClassName()))) {
                out.add(change(path + ".storageClassName", have.storageClassName(), want.storageClassName()));
            }
            if (storageRequestProtected(have.storageRequest(), want.storageRequest())) {
                out.add(change(path + ".storage", have.storageRequest(), want.storageRequest()));
            }
        }
    }

    private boolean storageRequestProtected(String live, String desired) {
        String have = normalize(live);
        String want = normalize(desired);
        if (have.equals(want)) {
            return false;
        }
        if (have.isEmpty() || want.isEmpty()) {
            return true;
        }
        int cmp;
        try {
            BigDecimal haveBytes = Quantity.getAmountInBytes(new Quantity(have));
            BigDecimal wantBytes = Quantity.getAmountInBytes(new Quantity(want));
            cmp = wantBytes.compareTo(haveBytes);
        } catch (RuntimeException e) {
            // unparseable quantity: treat any textual change as protected
            return true;
        }
        if (cmp == 0) {
            return false;
        }
        return cmp < 0 || !policy.allowVolumeExpansion();
    }

    private static Map<String, VolumeClaimTemplate> byName(List<VolumeClaimTemplate> templates) {
        Map<String, VolumeClaimTemplate> out = new LinkedHashMap<>();
        for (VolumeClaimTemplate template : templates) {
            out.put(normalize(template.name()), template);
        }
        return out;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    private static FieldChange change(String path, Object live, Object desired) {
        JsonNode liveNode = Jsons.tree(live);
        JsonNode desiredNode = Jsons.tree(desired);
        return new FieldChange(path, liveNode, desiredNode);
    }
}
