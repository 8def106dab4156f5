package com.libragraph.attest.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.core.verify.LayerDivergence;
import com.libragraph.attest.core.verify.LocalVerificationResult;
import com.libragraph.attest.core.verify.LocalVerificationStatus;
import com.libragraph.attest.util.ContentHash;

import java.util.List;

/**
 * Local verification outcome. {@code current_master_fingerprint} is null when a critical
 * file is missing.
 */
public record VerificationSummary(
        @JsonProperty("status") LocalVerificationStatus status,
        @JsonProperty("baseline_id") String baselineId,
        @JsonProperty("baseline_master_fingerprint") ContentHash baselineMasterFingerprint,
        @JsonProperty("current_master_fingerprint") ContentHash currentMasterFingerprint,
        @JsonProperty("divergences") List<Divergence> divergences,
        @JsonProperty("missing_files") List<String> missingFiles,
        @JsonProperty("fallback_files") List<String> fallbackFiles,
        @JsonProperty("cosmetic_drift") List<String> cosmeticDrift
) {

    public record Divergence(
            @JsonProperty("layer") String layer,
            @JsonProperty("baseline_hash") ContentHash baselineHash,
            @JsonProperty("current_hash") ContentHash currentHash,
            @JsonProperty("changed") List<String> changed,
            @JsonProperty("added") List<String> added,
            @JsonProperty("removed") List<String> removed
    ) {

        static Divergence of(LayerDivergence d) {
            return new Divergence(d.layer(), d.baselineHash(), d.currentHash(), d.changed(), d.added(), d.removed());
        }
    }

    public static VerificationSummary of(LocalVerificationResult result) {
        return new VerificationSummary(
                result.status(),
                result.baselineId(),
                result.baseline().aggregate(),
                result.current() == null ? null : result.current().aggregate(),
                result.divergences().stream().map(Divergence::of).toList(),
                result.missingFiles(),
                result.fallbackFiles(),
                result.cosmeticDrift());
    }
}
