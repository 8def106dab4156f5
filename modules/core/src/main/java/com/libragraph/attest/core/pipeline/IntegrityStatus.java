package com.libragraph.attest.core.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current versus baseline master fingerprint, as hex. Either side is null when it could
 * not be determined; {@code match} is then false.
 */
public record IntegrityStatus(
        @JsonProperty("baseline_id") String baselineId,
        @JsonProperty("current_master_fingerprint") String currentMasterFingerprint,
        @JsonProperty("baseline_master_fingerprint") String baselineMasterFingerprint,
        @JsonProperty("match") boolean match
) {}
