package com.libragraph.attest.core.baseline;

import com.libragraph.attest.core.manifest.Manifest;
import com.libragraph.attest.core.manifest.MasterFingerprint;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A trusted manifest and its master fingerprint, saved by a compute run and loaded by
 * verify runs. Baselines are addressed by id so several can coexist.
 */
public record Baseline(String baselineId, MasterFingerprint master, Manifest manifest, Instant createdAt) {

    private static final Pattern ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");

    public Baseline {
        requireValidId(baselineId);
        Objects.requireNonNull(master, "master cannot be null");
        Objects.requireNonNull(manifest, "manifest cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
        if (!master.algorithmVersion().equals(manifest.algorithmVersion())
                || !master.layerHashes().equals(manifest.layerHashes())) {
            throw new IllegalArgumentException("Master fingerprint does not belong to the manifest");
        }
    }

    public static String requireValidId(String baselineId) {
        if (baselineId == null || !ID.matcher(baselineId).matches()) {
            throw new IllegalArgumentException("Invalid baseline id: '" + baselineId + "'");
        }
        return baselineId;
    }
}
