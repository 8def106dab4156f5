package com.libragraph.attest.core.ledger;

import com.libragraph.attest.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AnchorDeduplicatorTest {

    private static final ContentHash MASTER = ContentHash.digest("master".getBytes(StandardCharsets.UTF_8));
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private static LedgerAnchor anchor(ContentHash hash, String txId, long secondsAfter) {
        return new LedgerAnchor(hash, new AnchorMetadata("2.1.0", true, MASTER), txId, T0.plusSeconds(secondsAfter));
    }

    @Test
    void shouldCollapseReanchoredReceiptIntoOneFact() {
        ContentHash receipt = ContentHash.digest("receipt".getBytes(StandardCharsets.UTF_8));

        List<CertifiedFact> facts = AnchorDeduplicator.deduplicate(List.of(
                anchor(receipt, "tx-late", 60),
                anchor(receipt, "tx-early", 0)));

        assertThat(facts).hasSize(1);
        assertThat(facts.get(0).contentHash()).isEqualTo(receipt);
        assertThat(facts.get(0).transactionIds()).containsExactly("tx-early", "tx-late");
        assertThat(facts.get(0).firstAnchoredAt()).isEqualTo(T0);
    }

    @Test
    void shouldKeepDistinctReceiptsApartInHashOrder() {
        ContentHash one = ContentHash.digest("one".getBytes(StandardCharsets.UTF_8));
        ContentHash two = ContentHash.digest("two".getBytes(StandardCharsets.UTF_8));

        List<CertifiedFact> facts = AnchorDeduplicator.deduplicate(List.of(
                anchor(one, "tx-1", 0), anchor(two, "tx-2", 1), anchor(one, "tx-1", 0)));

        assertThat(facts).hasSize(2);
        assertThat(facts).extracting(CertifiedFact::contentHash).isSorted();
        assertThat(facts).filteredOn(f -> f.contentHash().equals(one))
                .singleElement().extracting(CertifiedFact::transactionIds)
                .isEqualTo(List.of("tx-1"));
    }

    @Test
    void shouldReturnNothingForNoAnchors() {
        assertThat(AnchorDeduplicator.deduplicate(List.of())).isEmpty();
    }
}
