package com.libragraph.attest.core.ledger;

import java.util.Optional;

/**
 * Outcome of an anchoring attempt: either the confirmed anchor, or the reason anchoring was
 * deferred. A deferred anchor leaves the receipt valid.
 */
public record AnchorResult(LedgerAnchor anchor, String deferredReason) {

    public AnchorResult {
        if ((anchor == null) == (deferredReason == null)) {
            throw new IllegalArgumentException("exactly one of anchor and deferredReason must be set");
        }
    }

    public static AnchorResult anchored(LedgerAnchor anchor) {
        return new AnchorResult(anchor, null);
    }

    public static AnchorResult deferred(String reason) {
        return new AnchorResult(null, reason);
    }

    public boolean isAnchored() {
        return anchor != null;
    }

    public Optional<LedgerAnchor> anchorIfPresent() {
        return Optional.ofNullable(anchor);
    }
}
