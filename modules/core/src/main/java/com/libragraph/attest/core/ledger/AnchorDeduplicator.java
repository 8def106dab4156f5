package com.libragraph.attest.core.ledger;

import com.libragraph.attest.util.ContentHash;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups anchors by content hash. Re-anchoring the same receipt yields new transaction ids
 * for the same certified fact.
 */
public final class AnchorDeduplicator {

    private AnchorDeduplicator() {
    }

    /**
     * @return one fact per distinct content hash, ordered by content hash; transaction ids
     *         within a fact are ordered by anchor time
     */
    public static List<CertifiedFact> deduplicate(Collection<LedgerAnchor> anchors) {
        Map<ContentHash, List<LedgerAnchor>> byHash = new TreeMap<>();
        for (LedgerAnchor anchor : anchors) {
            byHash.computeIfAbsent(anchor.contentHash(), h -> new ArrayList<>()).add(anchor);
        }

        List<CertifiedFact> facts = new ArrayList<>();
        byHash.forEach((hash, group) -> {
            group.sort(Comparator.comparing(LedgerAnchor::anchoredAt).thenComparing(LedgerAnchor::transactionId));
            facts.add(new CertifiedFact(hash,
                    group.stream().map(LedgerAnchor::transactionId).distinct().toList(),
                    group.get(0).anchoredAt()));
        });
        return facts;
    }
}
