package com.libragraph.attest.core.receipt;

import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.SortedMap;

/**
 * Builds certification receipts. The content hash is a plain BLAKE3-256 digest of the
 * canonical serialization, so anyone with a BLAKE3 tool can recompute it.
 */
@Singleton
public class ReceiptGenerator {

    private static final Logger log = Logger.getLogger(ReceiptGenerator.class);

    private final Clock clock;

    @Inject
    public ReceiptGenerator() {
        this(Clock.systemUTC());
    }

    public ReceiptGenerator(Clock clock) {
        this.clock = clock;
    }

    public CertificationReceipt generate(EngineIdentity engine, Map<String, Boolean> validation,
                                         MasterFingerprint master) {
        return generate(engine, validation, master, clock.instant());
    }

    /**
     * @param timestamp truncated to milliseconds
     * @throws IllegalArgumentException if the validation results are empty or name an
     *                                  invalid problem class
     */
    public CertificationReceipt generate(EngineIdentity engine, Map<String, Boolean> validation,
                                         MasterFingerprint master, Instant timestamp) {
        SortedMap<String, Boolean> sorted = CertificationReceipt.checkValidation(validation);
        Instant millis = timestamp.truncatedTo(ChronoUnit.MILLIS);
        ContentHash contentHash = ContentHash.digest(ReceiptCanonicalizer.canonicalize(
                engine, sorted, master.aggregate(), master.algorithmVersion(), millis));

        CertificationReceipt receipt = new CertificationReceipt(engine, sorted, master.aggregate(),
                master.algorithmVersion(), millis, contentHash);
        log.infof("Generated receipt %s for %s %s (%d problem classes, all passed: %s)",
                contentHash, engine.name(), engine.version(), sorted.size(), receipt.allPassed());
        return receipt;
    }

    public static ContentHash recomputeContentHash(CertificationReceipt receipt) {
        return ContentHash.digest(ReceiptCanonicalizer.canonicalize(receipt));
    }

    public static boolean isSelfConsistent(CertificationReceipt receipt) {
        return recomputeContentHash(receipt).equals(receipt.contentHash());
    }
}
