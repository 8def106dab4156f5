package com.libragraph.attest.core.verify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.util.ContentHash;

import java.util.List;

/**
 * @param onChainHash   null when the transaction was not found
 * @param discrepancies what differs between the held receipt and the ledger record
 */
public record LedgerVerificationResult(
        @JsonProperty("status") LedgerVerificationStatus status,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("recomputed_hash") ContentHash recomputedHash,
        @JsonProperty("on_chain_hash") ContentHash onChainHash,
        @JsonProperty("discrepancies") List<String> discrepancies
) {

    public LedgerVerificationResult {
        discrepancies = List.copyOf(discrepancies);
    }
}
