package com.libragraph.attest.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.attest.core.ledger.LedgerAnchor;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.pipeline.CertificationRun;
import com.libragraph.attest.core.pipeline.PipelineFailure;
import com.libragraph.attest.core.pipeline.PipelineStage;
import com.libragraph.attest.core.pipeline.PipelineWarning;
import com.libragraph.attest.core.receipt.ReceiptCodec;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.util.List;

/**
 * A certification run as seen by API callers. The receipt is the published record, so it
 * can be handed to third parties as is.
 */
public record RunSummary(
        @JsonProperty("run_id") String runId,
        @JsonProperty("baseline_id") String baselineId,
        @JsonProperty("stage") PipelineStage stage,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("failure") PipelineFailure failure,
        @JsonProperty("warnings") List<PipelineWarning> warnings,
        @JsonProperty("master_fingerprint") ContentHash masterFingerprint,
        @JsonProperty("receipt") ReceiptCodec.ReceiptRecord receipt,
        @JsonProperty("transaction_id") String transactionId
) {

    public static RunSummary of(CertificationRun run) {
        return new RunSummary(
                run.runId(),
                run.request().baselineId(),
                run.stage(),
                run.startedAt(),
                run.failure().orElse(null),
                run.warnings(),
                run.master().map(MasterFingerprint::aggregate).orElse(null),
                run.receipt().map(ReceiptCodec::toRecord).orElse(null),
                run.anchor().map(LedgerAnchor::transactionId).orElse(null));
    }
}
