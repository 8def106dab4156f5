package com.libragraph.attest.core.verify;

import com.libragraph.attest.core.manifest.MasterFingerprint;

import java.util.List;

/**
 * @param current        null when the current manifest could not be built
 * @param missingFiles   baseline or critical files absent from the current set
 * @param fallbackFiles  files that failed to parse and were compared by raw bytes
 * @param cosmeticDrift  files whose canonical form matches the baseline but whose raw bytes
 *                       changed; worth a look, since a normalizer defect would hide here
 */
public record LocalVerificationResult(
        LocalVerificationStatus status,
        String baselineId,
        MasterFingerprint baseline,
        MasterFingerprint current,
        List<LayerDivergence> divergences,
        List<String> missingFiles,
        List<String> fallbackFiles,
        List<String> cosmeticDrift
) {

    public LocalVerificationResult {
        divergences = List.copyOf(divergences);
        missingFiles = List.copyOf(missingFiles);
        fallbackFiles = List.copyOf(fallbackFiles);
        cosmeticDrift = List.copyOf(cosmeticDrift);
    }

    public List<String> divergingLayers() {
        return divergences.stream().map(LayerDivergence::layer).toList();
    }
}
