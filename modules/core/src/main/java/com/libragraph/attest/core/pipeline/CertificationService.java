package com.libragraph.attest.core.pipeline;

import com.libragraph.attest.core.baseline.Baseline;
import com.libragraph.attest.core.baseline.BaselineNotFoundException;
import com.libragraph.attest.core.baseline.BaselineStore;
import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.ledger.AnchorResult;
import com.libragraph.attest.core.ledger.LedgerAnchor;
import com.libragraph.attest.core.ledger.LedgerAnchorService;
import com.libragraph.attest.core.ledger.ReceiptArchive;
import com.libragraph.attest.core.manifest.FingerprintAggregator;
import com.libragraph.attest.core.manifest.LayerConfig;
import com.libragraph.attest.core.manifest.LayerConfigLoader;
import com.libragraph.attest.core.manifest.Manifest;
import com.libragraph.attest.core.manifest.ManifestBuilder;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.manifest.MissingCriticalFileException;
import com.libragraph.attest.core.manifest.SourceTreeReader;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.core.receipt.ReceiptGenerator;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.core.verify.IncomparableFingerprintException;
import com.libragraph.attest.core.verify.LedgerVerificationResult;
import com.libragraph.attest.core.verify.LedgerVerificationStatus;
import com.libragraph.attest.core.verify.LocalVerificationResult;
import com.libragraph.attest.core.verify.Verifier;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The operations offered to callers: compute a baseline, verify or check status against it,
 * certify the current source, retry a deferred anchor, confirm a lagging one, and verify a
 * receipt on the ledger.
 *
 * <p>Certification builds the manifest and the receipt completely before the ledger is
 * contacted, and holds no lock while it is. Runs stay available by id for
 * {@code attest.runs.retention}, and at most {@code attest.runs.max-retained} are kept.
 */
@Singleton
public class CertificationService {

    private static final Logger log = Logger.getLogger(CertificationService.class);

    private final ManifestBuilder manifestBuilder;
    private final FingerprintAggregator aggregator;
    private final BaselineStore baselines;
    private final ReceiptGenerator receiptGenerator;
    private final LedgerAnchorService ledger;
    private final Verifier verifier;
    private final ReceiptArchive archive;
    private final SourceTreeReader sourceReader;
    private final AttestSettings settings;

    private final Map<String, CertificationRun> runs = new ConcurrentHashMap<>();

    @Inject
    public CertificationService(ManifestBuilder manifestBuilder, FingerprintAggregator aggregator,
                                BaselineStore baselines, ReceiptGenerator receiptGenerator,
                                LedgerAnchorService ledger, Verifier verifier, ReceiptArchive archive,
                                SourceTreeReader sourceReader, AttestSettings settings) {
        this.manifestBuilder = manifestBuilder;
        this.aggregator = aggregator;
        this.baselines = baselines;
        this.receiptGenerator = receiptGenerator;
        this.ledger = ledger;
        this.verifier = verifier;
        this.archive = archive;
        this.sourceReader = sourceReader;
        this.settings = settings;
    }

    /**
     * Reads the configured source tree with the configured layer configuration.
     */
    public SourceSnapshot configuredSource() {
        LayerConfig config = LayerConfigLoader.load(settings.layersConfig());
        return new SourceSnapshot(config, sourceReader.read(settings.sourceRoot(), config));
    }

    public AttestSettings settings() {
        return settings;
    }

    // -- compute / verify / status --

    /**
     * Builds the manifest for the source and saves it as the baseline {@code baselineId},
     * replacing any previous baseline with that id.
     *
     * @throws MissingCriticalFileException if a critical file is absent
     */
    public Baseline compute(String baselineId, SourceSnapshot source) {
        Baseline.requireValidId(baselineId);
        Manifest manifest = manifestBuilder.build(source.config(), source.files());
        MasterFingerprint master = aggregator.aggregate(manifest);
        Baseline baseline = new Baseline(baselineId, master, manifest, Instant.now());
        baselines.save(baseline);
        log.infof("Computed baseline '%s': %d files in %d layers, %d by raw fallback",
                baselineId, manifest.fingerprints().size(), manifest.layerHashes().size(),
                manifest.fallbacks().size());
        return baseline;
    }

    /**
     * @throws BaselineNotFoundException if no baseline has that id
     * @throws IncomparableFingerprintException if the baseline uses another algorithm version
     */
    public LocalVerificationResult verify(String baselineId, SourceSnapshot source) {
        return verifier.verifyLocal(requireBaseline(baselineId), source.config(), source.files());
    }

    public IntegrityStatus status(String baselineId, SourceSnapshot source) {
        Optional<Baseline> baseline = baselines.load(baselineId);
        String current;
        try {
            current = aggregator.aggregate(manifestBuilder.build(source.config(), source.files())).toHex();
        } catch (MissingCriticalFileException e) {
            log.debugf("Status for '%s': current fingerprint unavailable: %s", baselineId, e.getMessage());
            current = null;
        }
        String stored = baseline.map(b -> b.master().toHex()).orElse(null);
        boolean match = current != null && current.equals(stored);
        return new IntegrityStatus(baselineId, current, stored, match);
    }

    // -- certification pipeline --

    /**
     * Runs the pipeline as far as it can go. A deferred anchor is not a failure: the run is
     * returned at {@link PipelineStage#CERTIFIED} and can be passed to {@link #retryAnchor}. An
     * anchor the ledger cannot show yet leaves the run at {@link PipelineStage#ANCHORED} for
     * {@link #confirmAnchor}.
     *
     * @throws CertificationPipelineException naming the stage that could not be entered
     */
    public CertificationRun certify(CertificationRequest request) {
        Instant now = Instant.now();
        evictRuns(now);
        CertificationRun run = new CertificationRun(request, now);
        runs.put(run.runId(), run);
        log.infof("Run %s: certifying %s %s against baseline '%s'", run.runId(),
                request.engine().name(), request.engine().version(), request.baselineId());

        fingerprint(run);
        manifest(run);
        receipt(run);
        claimAnchoring(run);
        try {
            anchorAndConfirm(run);
        } finally {
            run.endAnchoring();
        }
        return run;
    }

    /**
     * Re-attempts anchoring for a run whose anchor was deferred.
     *
     * @throws RunStateException if the run is not waiting for an anchor, or another
     *                           anchoring attempt on it is in flight
     */
    public CertificationRun retryAnchor(CertificationRun run) {
        claimAnchoring(run);
        try {
            if (run.stage() != PipelineStage.CERTIFIED || run.failure().isPresent() || run.receipt().isEmpty()) {
                throw new RunStateException(run.runId(), run.stage(), "is not awaiting an anchor");
            }
            log.infof("Run %s: retrying anchor", run.runId());
            anchorAndConfirm(run);
        } finally {
            run.endAnchoring();
        }
        return run;
    }

    /**
     * Reads back the recorded anchor transaction of a run left at {@link PipelineStage#ANCHORED}
     * and advances it to {@link PipelineStage#VERIFIABLE} once the ledger shows it. Nothing is
     * anchored again.
     *
     * @throws RunStateException if the run has no unconfirmed anchor, or another anchoring
     *                           attempt on it is in flight
     * @throws CertificationPipelineException if the ledger record contradicts the receipt
     */
    public CertificationRun confirmAnchor(CertificationRun run) {
        claimAnchoring(run);
        try {
            if (run.stage() != PipelineStage.ANCHORED || run.failure().isPresent() || run.anchor().isEmpty()) {
                throw new RunStateException(run.runId(), run.stage(), "has no unconfirmed anchor");
            }
            log.infof("Run %s: confirming anchor %s", run.runId(), run.anchor().get().transactionId());
            confirm(run, run.receipt().orElseThrow(), run.anchor().get());
        } finally {
            run.endAnchoring();
        }
        return run;
    }

    public Optional<CertificationRun> run(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Checks a held receipt against its ledger transaction.
     */
    public LedgerVerificationResult verifyReceipt(CertificationReceipt receipt, String transactionId) {
        return verifier.verifyLedger(receipt, transactionId).await().indefinitely();
    }

    // -- stages --

    private void fingerprint(CertificationRun run) {
        SourceSnapshot source = run.request().source();
        List<FileFingerprint> fingerprints;
        try {
            fingerprints = manifestBuilder.fingerprintAll(source.config(), source.files());
        } catch (RuntimeException e) {
            throw run.fail(PipelineStage.FINGERPRINTED, e.getMessage(), e);
        }
        for (FileFingerprint fp : fingerprints) {
            if (fp.isFallback()) {
                run.warn(PipelineWarning.Code.PARSE_FALLBACK, fp.path() + " (" + fp.fallbackReason() + ")");
            }
        }
        run.fingerprints(fingerprints);
        run.advance(PipelineStage.FINGERPRINTED);
    }

    private void manifest(CertificationRun run) {
        SourceSnapshot source = run.request().source();
        Manifest manifest;
        LocalVerificationResult check;
        try {
            manifest = manifestBuilder.assemble(source.config(), source.files(), run.fingerprints());
            Optional<Baseline> baseline = baselines.load(run.request().baselineId());
            if (baseline.isEmpty()) {
                throw run.fail(PipelineStage.MANIFESTED,
                        "baseline '" + run.request().baselineId() + "' not found", null);
            }
            check = verifier.compare(baseline.get(), manifest);
        } catch (MissingCriticalFileException | IncomparableFingerprintException | StoreException e) {
            throw run.fail(PipelineStage.MANIFESTED, e.getMessage(), e);
        }

        switch (check.status()) {
            case MISSING_FILE -> throw run.fail(PipelineStage.MANIFESTED,
                    "files missing since baseline: " + check.missingFiles(), null);
            case MISMATCH -> throw run.fail(PipelineStage.MANIFESTED,
                    "hash mismatch in layers " + check.divergingLayers(), null);
            default -> {
            }
        }

        manifest.missingFiles().forEach(path -> run.warn(PipelineWarning.Code.NON_CRITICAL_FILE_MISSING, path));
        manifest.layerMembers().forEach((layer, members) -> {
            if (members.isEmpty()) {
                run.warn(PipelineWarning.Code.EMPTY_LAYER, layer);
            }
        });
        check.cosmeticDrift().forEach(path -> run.warn(PipelineWarning.Code.COSMETIC_DRIFT, path));

        run.manifest(manifest, check.current(), check);
        run.advance(PipelineStage.MANIFESTED);
        run.releaseSource();
    }

    private void receipt(CertificationRun run) {
        CertificationReceipt receipt;
        try {
            receipt = receiptGenerator.generate(run.request().engine(),
                    run.request().validation().results(), run.master().orElseThrow());
            archive.store(receipt);
        } catch (IllegalArgumentException | StoreException e) {
            throw run.fail(PipelineStage.CERTIFIED, e.getMessage(), e);
        }
        run.request().validation().skipped()
                .forEach(problemClass -> run.warn(PipelineWarning.Code.VALIDATION_SKIPPED, problemClass));
        run.receipt(receipt);
        run.advance(PipelineStage.CERTIFIED);
    }

    private void anchorAndConfirm(CertificationRun run) {
        CertificationReceipt receipt = run.receipt().orElseThrow();
        AnchorResult result = ledger.anchor(receipt).await().indefinitely();
        if (!result.isAnchored()) {
            run.warn(PipelineWarning.Code.ANCHOR_DEFERRED, result.deferredReason());
            return;
        }

        LedgerAnchor anchor = result.anchor();
        archive.recordAnchor(anchor);
        run.anchor(anchor);
        run.advance(PipelineStage.ANCHORED);
        confirm(run, receipt, anchor);
    }

    private void confirm(CertificationRun run, CertificationReceipt receipt, LedgerAnchor anchor) {
        LedgerVerificationResult confirmation;
        try {
            confirmation = verifyReceipt(receipt, anchor.transactionId());
        } catch (RuntimeException e) {
            run.warn(PipelineWarning.Code.ANCHOR_UNCONFIRMED, anchor.transactionId() + ": " + e.getMessage());
            return;
        }

        if (confirmation.status() == LedgerVerificationStatus.AUTHENTIC) {
            run.advance(PipelineStage.VERIFIABLE);
        } else if (confirmation.status() == LedgerVerificationStatus.NOT_FOUND) {
            run.warn(PipelineWarning.Code.ANCHOR_UNCONFIRMED, anchor.transactionId() + " not yet readable");
        } else {
            throw run.fail(PipelineStage.VERIFIABLE, "ledger record for " + anchor.transactionId()
                    + " does not match the receipt: " + confirmation.discrepancies(), null);
        }
    }

    private static void claimAnchoring(CertificationRun run) {
        if (!run.beginAnchoring()) {
            throw new RunStateException(run.runId(), run.stage(), "is already being anchored");
        }
    }

    private void evictRuns(Instant now) {
        Instant cutoff = now.minus(settings.runRetention());
        if (runs.values().removeIf(run -> run.startedAt().isBefore(cutoff))) {
            log.debugf("Dropped runs started before %s", cutoff);
        }
        int excess = runs.size() - settings.maxRetainedRuns() + 1;
        if (excess > 0) {
            runs.values().stream()
                    .sorted(Comparator.comparing((CertificationRun run) -> !run.isSettled())
                            .thenComparing(CertificationRun::startedAt))
                    .limit(excess)
                    .toList()
                    .forEach(run -> runs.remove(run.runId()));
            log.debugf("Dropped %d runs over the cap of %d", excess, settings.maxRetainedRuns());
        }
    }

    private Baseline requireBaseline(String baselineId) {
        return baselines.load(baselineId).orElseThrow(() -> new BaselineNotFoundException(baselineId));
    }
}
