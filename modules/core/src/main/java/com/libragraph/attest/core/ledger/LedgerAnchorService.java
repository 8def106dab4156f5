package com.libragraph.attest.core.ledger;

import com.libragraph.attest.core.receipt.CertificationReceipt;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Calls the ledger off the caller's thread, with a timeout per attempt and capped
 * exponential backoff between attempts. Only {@link LedgerUnavailableException} is retried.
 *
 * <p>Anchoring never fails the caller: once retries are exhausted, or on any other error,
 * the result is a deferred {@link AnchorResult}. Fetching propagates the failure, since a
 * verification read can simply be repeated.
 */
@Singleton
public class LedgerAnchorService {

    private static final Logger log = Logger.getLogger(LedgerAnchorService.class);

    private final LedgerClient ledger;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    @Inject
    public LedgerAnchorService(
            LedgerClient ledger,
            @ConfigProperty(name = "attest.ledger.timeout", defaultValue = "10s") Duration timeout,
            @ConfigProperty(name = "attest.ledger.max-retries", defaultValue = "3") int maxRetries,
            @ConfigProperty(name = "attest.ledger.initial-backoff", defaultValue = "500ms") Duration initialBackoff,
            @ConfigProperty(name = "attest.ledger.max-backoff", defaultValue = "10s") Duration maxBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("attest.ledger.max-retries cannot be negative: " + maxRetries);
        }
        this.ledger = ledger;
        this.timeout = timeout;
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public Uni<AnchorResult> anchor(CertificationReceipt receipt) {
        AnchorMetadata metadata = AnchorMetadata.of(receipt);
        Uni<String> call = guarded(ledger.anchor(receipt.contentHash(), metadata), "anchor " + receipt.contentHash());

        return call
                .map(txId -> {
                    log.infof("Anchored receipt %s in transaction %s", receipt.contentHash(), txId);
                    return AnchorResult.anchored(new LedgerAnchor(receipt.contentHash(), metadata, txId, Instant.now()));
                })
                .onFailure().recoverWithItem(e -> {
                    LedgerUnavailableException unavailable = unavailableCause(e);
                    if (unavailable != null) {
                        log.warnf("Anchoring receipt %s deferred: %s", receipt.contentHash(), unavailable.getMessage());
                        return AnchorResult.deferred(unavailable.getMessage());
                    }
                    log.errorf(e, "Anchoring receipt %s failed", receipt.contentHash());
                    return AnchorResult.deferred(String.valueOf(e.getMessage()));
                });
    }

    public Uni<Optional<OnChainRecord>> fetch(String transactionId) {
        return guarded(ledger.fetch(transactionId), "fetch " + transactionId);
    }

    public Uni<Boolean> isReachable() {
        return ledger.isReachable()
                .ifNoItem().after(timeout).recoverWithItem(false)
                .onFailure().recoverWithItem(false);
    }

    private <T> Uni<T> guarded(Uni<T> call, String operation) {
        Uni<T> attempt = call
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool())
                .ifNoItem().after(timeout)
                .failWith(() -> new LedgerUnavailableException("Ledger " + operation + " timed out after " + timeout));
        if (maxRetries == 0) {
            return attempt;
        }
        return attempt
                .onFailure(LedgerUnavailableException.class)
                .invoke(e -> log.debugf("Ledger %s failed, retrying: %s", operation, e.getMessage()))
                .onFailure(LedgerUnavailableException.class)
                .retry().withBackOff(initialBackoff, maxBackoff).atMost(maxRetries);
    }

    /**
     * True if the failure, or any cause, is a {@link LedgerUnavailableException}. Exhausted
     * retries surface as a wrapper around the last attempt's failure.
     */
    public static boolean isUnavailable(Throwable e) {
        return unavailableCause(e) != null;
    }

    private static LedgerUnavailableException unavailableCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof LedgerUnavailableException unavailable) {
                return unavailable;
            }
        }
        return null;
    }
}
