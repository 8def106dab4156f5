package com.libragraph.attest.core.ledger;

import com.libragraph.attest.util.ContentHash;
import io.smallrye.mutiny.Uni;

import java.util.Optional;

/**
 * Boundary to the public append-only ledger. The ledger is treated as an opaque publication
 * service: broadcasting, consensus and fees are its own business.
 *
 * <p>Anchoring the same content hash twice may create two transactions; consumers group
 * anchors by content hash, never by transaction id.
 */
public interface LedgerClient {

    /**
     * Publishes a content hash with its minimal metadata.
     *
     * @return the transaction id
     * @throws LedgerUnavailableException (as a failure) when the ledger cannot be reached
     */
    Uni<String> anchor(ContentHash contentHash, AnchorMetadata metadata);

    /**
     * Reads a published transaction; empty when the ledger has no such transaction.
     *
     * @throws LedgerUnavailableException (as a failure) when the ledger cannot be reached
     */
    Uni<Optional<OnChainRecord>> fetch(String transactionId);

    /**
     * Cheap connectivity probe for health checks.
     */
    Uni<Boolean> isReachable();
}
