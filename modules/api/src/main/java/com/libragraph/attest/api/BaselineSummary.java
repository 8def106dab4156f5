package com.libragraph.attest.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.core.baseline.Baseline;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

public record BaselineSummary(
        @JsonProperty("baseline_id") String baselineId,
        @JsonProperty("algorithm_version") String algorithmVersion,
        @JsonProperty("master_fingerprint") ContentHash masterFingerprint,
        @JsonProperty("layers") SortedMap<String, ContentHash> layers,
        @JsonProperty("file_count") int fileCount,
        @JsonProperty("fallback_files") List<String> fallbackFiles,
        @JsonProperty("missing_files") List<String> missingFiles,
        @JsonProperty("created_at") Instant createdAt
) {

    public static BaselineSummary of(Baseline baseline) {
        return new BaselineSummary(
                baseline.baselineId(),
                baseline.master().algorithmVersion(),
                baseline.master().aggregate(),
                baseline.master().layerHashes(),
                baseline.manifest().fingerprints().size(),
                baseline.manifest().fallbacks().stream().map(f -> f.path()).toList(),
                baseline.manifest().missingFiles(),
                baseline.createdAt());
    }
}
