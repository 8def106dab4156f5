package com.libragraph.attest.core.ledger;

import com.libragraph.attest.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Append-only in-process ledger for development and testing.
 *
 * <p>{@link #simulateOutage(int)} makes the next calls fail as unreachable, to exercise the
 * retry and deferral paths. {@link #simulateLag(int)} hides anchored transactions from the next
 * fetches, as a ledger that has not yet confirmed them would.
 */
@ApplicationScoped
@IfBuildProperty(name = "attest.ledger.type", stringValue = "memory")
public class InMemoryLedgerClient implements LedgerClient {

    private static final Logger log = Logger.getLogger(InMemoryLedgerClient.class);

    private final Map<String, OnChainRecord> transactions = new ConcurrentHashMap<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger lagRemaining = new AtomicInteger();

    @Override
    public Uni<String> anchor(ContentHash contentHash, AnchorMetadata metadata) {
        return Uni.createFrom().item(() -> {
            checkAvailable();
            String txId = UUID.randomUUID().toString();
            transactions.put(txId, new OnChainRecord(contentHash, metadata, Instant.now()));
            log.debugf("Anchored %s as transaction %s", contentHash, txId);
            return txId;
        });
    }

    @Override
    public Uni<Optional<OnChainRecord>> fetch(String transactionId) {
        return Uni.createFrom().item(() -> {
            checkAvailable();
            if (countDown(lagRemaining)) {
                log.debugf("Transaction %s not yet visible", transactionId);
                return Optional.<OnChainRecord>empty();
            }
            return Optional.ofNullable(transactions.get(transactionId));
        });
    }

    @Override
    public Uni<Boolean> isReachable() {
        return Uni.createFrom().item(() -> failuresRemaining.get() == 0);
    }

    /**
     * Fails the next {@code calls} anchor or fetch calls with {@link LedgerUnavailableException}.
     */
    public void simulateOutage(int calls) {
        failuresRemaining.set(calls);
    }

    /**
     * Makes the next {@code fetches} fetch calls find nothing.
     */
    public void simulateLag(int fetches) {
        lagRemaining.set(fetches);
    }

    public int size() {
        return transactions.size();
    }

    private void checkAvailable() {
        if (countDown(failuresRemaining)) {
            throw new LedgerUnavailableException("In-memory ledger outage");
        }
    }

    private static boolean countDown(AtomicInteger remaining) {
        return remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }
}
