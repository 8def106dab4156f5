package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.util.List;

/**
 * One certified fact: a content hash with every transaction that anchored it.
 */
public record CertifiedFact(
        @JsonProperty("content_hash") ContentHash contentHash,
        @JsonProperty("transaction_ids") List<String> transactionIds,
        @JsonProperty("first_anchored_at") Instant firstAnchoredAt
) {

    public CertifiedFact {
        transactionIds = List.copyOf(transactionIds);
    }
}
