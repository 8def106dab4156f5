package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.util.ContentHash;

import java.util.Objects;

/**
 * The metadata published next to a content hash. Nothing else about a receipt leaves the
 * process.
 */
public record AnchorMetadata(
        @JsonProperty("engine_version") String engineVersion,
        @JsonProperty("validation_passed") boolean validationPassed,
        @JsonProperty("fingerprint") ContentHash fingerprint
) {

    public AnchorMetadata {
        Objects.requireNonNull(engineVersion, "engineVersion cannot be null");
        Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
    }

    public static AnchorMetadata of(CertificationReceipt receipt) {
        return new AnchorMetadata(receipt.engine().version(), receipt.allPassed(), receipt.masterFingerprint());
    }
}
