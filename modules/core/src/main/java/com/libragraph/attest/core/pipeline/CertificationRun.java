package com.libragraph.attest.core.pipeline;

import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.ledger.LedgerAnchor;
import com.libragraph.attest.core.manifest.Manifest;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.core.verify.LocalVerificationResult;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one certification run:
 * {@code INIT -> FINGERPRINTED -> MANIFESTED -> CERTIFIED -> ANCHORED -> VERIFIABLE}.
 *
 * <p>Stages only move forward, one at a time. A fatal failure is recorded and freezes the
 * run at its last completed stage. Warnings accumulate across stages, including anchor
 * retries. At most one anchoring attempt runs at a time. The source file contents are
 * released once the manifest is built.
 */
public class CertificationRun {

    private static final Logger log = Logger.getLogger(CertificationRun.class);

    private final String runId;
    private final Instant startedAt;
    private final AtomicReference<PipelineStage> stage = new AtomicReference<>(PipelineStage.INIT);
    private final AtomicBoolean anchoring = new AtomicBoolean();
    private final List<PipelineWarning> warnings = new CopyOnWriteArrayList<>();

    private volatile CertificationRequest request;
    private volatile PipelineFailure failure;
    private volatile List<FileFingerprint> fingerprints = List.of();
    private volatile Manifest manifest;
    private volatile MasterFingerprint master;
    private volatile LocalVerificationResult baselineCheck;
    private volatile CertificationReceipt receipt;
    private volatile LedgerAnchor anchor;

    CertificationRun(CertificationRequest request, Instant startedAt) {
        this.runId = UUID.randomUUID().toString();
        this.request = request;
        this.startedAt = startedAt;
    }

    // -- state machine --

    void advance(PipelineStage to) {
        if (failure != null) {
            throw new IllegalStateException("Run " + runId + " already failed at " + failure.stage());
        }
        PipelineStage from = stage.get();
        if (to.ordinal() != from.ordinal() + 1 || !stage.compareAndSet(from, to)) {
            throw new IllegalStateException("Run " + runId + ": illegal transition " + from + " -> " + to);
        }
        log.infof("Run %s: %s -> %s", runId, from, to);
    }

    CertificationPipelineException fail(PipelineStage entering, String reason, Throwable cause) {
        failure = new PipelineFailure(entering, reason);
        log.errorf("Run %s failed entering %s (was %s): %s", runId, entering, stage.get(), reason);
        return new CertificationPipelineException(runId, entering, reason, cause);
    }

    /**
     * Claims the run for one anchoring attempt.
     *
     * @return false if another attempt holds it
     */
    boolean beginAnchoring() {
        return anchoring.compareAndSet(false, true);
    }

    void endAnchoring() {
        anchoring.set(false);
    }

    /** True once the run can make no further progress. */
    public boolean isSettled() {
        return failure != null || stage.get() == PipelineStage.VERIFIABLE;
    }

    void warn(PipelineWarning.Code code, String detail) {
        PipelineWarning warning = new PipelineWarning(code, detail);
        warnings.add(warning);
        log.warnf("Run %s: %s %s", runId, code, detail);
    }

    // -- results, set by CertificationService as stages complete --

    void fingerprints(List<FileFingerprint> fingerprints) {
        this.fingerprints = List.copyOf(fingerprints);
    }

    void manifest(Manifest manifest, MasterFingerprint master, LocalVerificationResult baselineCheck) {
        this.manifest = manifest;
        this.master = master;
        this.baselineCheck = baselineCheck;
    }

    void releaseSource() {
        SourceSnapshot source = request.source();
        request = new CertificationRequest(request.baselineId(), request.engine(), request.validation(),
                new SourceSnapshot(source.config(), List.of()));
    }

    void receipt(CertificationReceipt receipt) {
        this.receipt = receipt;
    }

    void anchor(LedgerAnchor anchor) {
        this.anchor = anchor;
    }

    // -- accessors --

    public String runId() {
        return runId;
    }

    public CertificationRequest request() {
        return request;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public PipelineStage stage() {
        return stage.get();
    }

    public Optional<PipelineFailure> failure() {
        return Optional.ofNullable(failure);
    }

    public List<PipelineWarning> warnings() {
        return List.copyOf(warnings);
    }

    public boolean hasWarning(PipelineWarning.Code code) {
        return warnings.stream().anyMatch(w -> w.code() == code);
    }

    public List<FileFingerprint> fingerprints() {
        return fingerprints;
    }

    public Optional<Manifest> manifest() {
        return Optional.ofNullable(manifest);
    }

    public Optional<MasterFingerprint> master() {
        return Optional.ofNullable(master);
    }

    public Optional<LocalVerificationResult> baselineCheck() {
        return Optional.ofNullable(baselineCheck);
    }

    public Optional<CertificationReceipt> receipt() {
        return Optional.ofNullable(receipt);
    }

    public Optional<LedgerAnchor> anchor() {
        return Optional.ofNullable(anchor);
    }
}
