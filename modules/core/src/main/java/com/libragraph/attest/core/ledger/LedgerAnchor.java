package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.util.Objects;

/**
 * A confirmed publication of a receipt's content hash.
 */
public record LedgerAnchor(
        @JsonProperty("content_hash") ContentHash contentHash,
        @JsonProperty("metadata") AnchorMetadata metadata,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("anchored_at") Instant anchoredAt
) {

    public LedgerAnchor {
        Objects.requireNonNull(contentHash, "contentHash cannot be null");
        Objects.requireNonNull(metadata, "metadata cannot be null");
        Objects.requireNonNull(transactionId, "transactionId cannot be null");
        Objects.requireNonNull(anchoredAt, "anchoredAt cannot be null");
    }
}
