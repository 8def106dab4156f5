package com.libragraph.attest.core.verify;

import com.libragraph.attest.core.baseline.Baseline;
import com.libragraph.attest.core.fingerprint.FallbackReason;
import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.ledger.AnchorMetadata;
import com.libragraph.attest.core.ledger.LedgerAnchorService;
import com.libragraph.attest.core.ledger.OnChainRecord;
import com.libragraph.attest.core.manifest.FingerprintAggregator;
import com.libragraph.attest.core.manifest.LayerConfig;
import com.libragraph.attest.core.manifest.Manifest;
import com.libragraph.attest.core.manifest.ManifestBuilder;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.manifest.MissingCriticalFileException;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.core.receipt.ReceiptGenerator;
import com.libragraph.attest.types.FingerprintMode;
import com.libragraph.attest.util.ContentHash;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-and-compare checks: current files against a baseline, and a held receipt against the
 * ledger. Nothing here writes a baseline or the ledger.
 */
@Singleton
public class Verifier {

    private static final Logger log = Logger.getLogger(Verifier.class);

    private final ManifestBuilder manifestBuilder;
    private final FingerprintAggregator aggregator;
    private final LedgerAnchorService ledger;

    @Inject
    public Verifier(ManifestBuilder manifestBuilder, FingerprintAggregator aggregator, LedgerAnchorService ledger) {
        this.manifestBuilder = manifestBuilder;
        this.aggregator = aggregator;
        this.ledger = ledger;
    }

    /**
     * Recomputes the manifest for the current files and compares it with the baseline.
     *
     * @throws IncomparableFingerprintException if the baseline uses another algorithm version
     */
    public LocalVerificationResult verifyLocal(Baseline baseline, LayerConfig config, Collection<SourceFile> files) {
        Manifest current;
        try {
            current = manifestBuilder.build(config, files);
        } catch (MissingCriticalFileException e) {
            log.warnf("Verification against baseline '%s': %s", baseline.baselineId(), e.getMessage());
            List<String> missing = e.missing().stream()
                    .map(MissingCriticalFileException.MissingFile::path)
                    .distinct().sorted().toList();
            return new LocalVerificationResult(LocalVerificationStatus.MISSING_FILE, baseline.baselineId(),
                    baseline.master(), null, List.of(), missing, List.of(), List.of());
        }
        return compare(baseline, current);
    }

    /**
     * Compares an already built manifest with the baseline, layer by layer and then the
     * aggregate.
     *
     * @throws IncomparableFingerprintException if the algorithm versions differ
     */
    public LocalVerificationResult compare(Baseline baseline, Manifest current) {
        MasterFingerprint baselineMaster = baseline.master();
        MasterFingerprint currentMaster = aggregator.aggregate(current);
        if (!baselineMaster.isComparableWith(currentMaster)) {
            throw new IncomparableFingerprintException(baselineMaster.algorithmVersion(),
                    currentMaster.algorithmVersion());
        }

        Manifest base = baseline.manifest();
        Map<String, FileFingerprint> baseFiles = byPath(base.fingerprints());
        Map<String, FileFingerprint> currentFiles = byPath(current.fingerprints());

        List<String> missing = baseFiles.keySet().stream()
                .filter(path -> !currentFiles.containsKey(path))
                .sorted().toList();

        List<LayerDivergence> divergences = new ArrayList<>();
        Set<String> layers = new TreeSet<>(base.layerHashes().keySet());
        layers.addAll(current.layerHashes().keySet());
        for (String layer : layers) {
            ContentHash before = base.layerHashes().get(layer);
            ContentHash after = current.layerHashes().get(layer);
            if (Objects.equals(before, after)) {
                continue;
            }
            List<String> beforeMembers = base.layerMembers().getOrDefault(layer, List.of());
            List<String> afterMembers = current.layerMembers().getOrDefault(layer, List.of());
            List<String> changed = beforeMembers.stream()
                    .filter(afterMembers::contains)
                    .filter(path -> !baseFiles.get(path).hash().equals(currentFiles.get(path).hash()))
                    .toList();
            List<String> added = afterMembers.stream().filter(p -> !beforeMembers.contains(p)).toList();
            List<String> removed = beforeMembers.stream().filter(p -> !afterMembers.contains(p)).toList();
            divergences.add(new LayerDivergence(layer, before, after, changed, added, removed));
        }

        List<String> fallbacks = current.fallbacks().stream()
                .filter(f -> f.fallbackReason() == FallbackReason.PARSE_ERROR)
                .map(FileFingerprint::path)
                .toList();

        List<String> cosmeticDrift = current.fingerprints().stream()
                .filter(f -> f.mode() == FingerprintMode.SEMANTIC)
                .filter(f -> {
                    FileFingerprint b = baseFiles.get(f.path());
                    return b != null && b.hash().equals(f.hash()) && !b.rawHash().equals(f.rawHash());
                })
                .map(FileFingerprint::path)
                .toList();

        LocalVerificationStatus status;
        if (!missing.isEmpty()) {
            status = LocalVerificationStatus.MISSING_FILE;
        } else if (!divergences.isEmpty() || !baselineMaster.aggregate().equals(currentMaster.aggregate())) {
            status = LocalVerificationStatus.MISMATCH;
        } else if (!fallbacks.isEmpty()) {
            status = LocalVerificationStatus.PARSE_FALLBACK_PRESENT;
        } else {
            status = LocalVerificationStatus.MATCH;
        }

        if (status == LocalVerificationStatus.MISMATCH) {
            log.warnf("Baseline '%s' mismatch in layers %s",
                    baseline.baselineId(), divergences.stream().map(LayerDivergence::layer).toList());
        } else {
            log.infof("Baseline '%s' verification: %s", baseline.baselineId(), status);
        }
        return new LocalVerificationResult(status, baseline.baselineId(), baselineMaster, currentMaster,
                divergences, missing, fallbacks, cosmeticDrift);
    }

    /**
     * Fetches the transaction and checks the held receipt against it.
     */
    public Uni<LedgerVerificationResult> verifyLedger(CertificationReceipt receipt, String transactionId) {
        return ledger.fetch(transactionId)
                .map(record -> compareWithLedger(receipt, transactionId, record));
    }

    /**
     * Recomputes the receipt's content hash from its fields and compares it, and the
     * anchored metadata, with the ledger record.
     */
    public static LedgerVerificationResult compareWithLedger(CertificationReceipt receipt, String transactionId,
                                                             Optional<OnChainRecord> record) {
        ContentHash recomputed = ReceiptGenerator.recomputeContentHash(receipt);
        if (record.isEmpty()) {
            return new LedgerVerificationResult(LedgerVerificationStatus.NOT_FOUND, transactionId,
                    recomputed, null, List.of());
        }

        OnChainRecord onChain = record.get();
        List<String> discrepancies = new ArrayList<>();
        if (!recomputed.equals(onChain.contentHash())) {
            discrepancies.add("content hash " + recomputed + " != on-chain " + onChain.contentHash());
        }
        if (!recomputed.equals(receipt.contentHash())) {
            discrepancies.add("receipt states content hash " + receipt.contentHash()
                    + " but its fields hash to " + recomputed);
        }
        AnchorMetadata expected = AnchorMetadata.of(receipt);
        if (!expected.equals(onChain.metadata())) {
            discrepancies.add("metadata " + expected + " != on-chain " + onChain.metadata());
        }

        if (discrepancies.isEmpty()) {
            return new LedgerVerificationResult(LedgerVerificationStatus.AUTHENTIC, transactionId,
                    recomputed, onChain.contentHash(), List.of());
        }
        log.errorf("Receipt %s TAMPERED against transaction %s: %s", receipt.contentHash(), transactionId,
                discrepancies);
        return new LedgerVerificationResult(LedgerVerificationStatus.TAMPERED, transactionId,
                recomputed, onChain.contentHash(), discrepancies);
    }

    private static Map<String, FileFingerprint> byPath(List<FileFingerprint> fingerprints) {
        return fingerprints.stream().collect(Collectors.toMap(FileFingerprint::path, Function.identity()));
    }
}
