package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;

/**
 * A transaction as read back from the ledger.
 */
public record OnChainRecord(
        @JsonProperty("content_hash") ContentHash contentHash,
        @JsonProperty("metadata") AnchorMetadata metadata,
        @JsonProperty("block_timestamp") Instant blockTimestamp
) {}
