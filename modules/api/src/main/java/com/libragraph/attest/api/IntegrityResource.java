package com.libragraph.attest.api;

import com.libragraph.attest.core.baseline.Baseline;
import com.libragraph.attest.core.baseline.BaselineStore;
import com.libragraph.attest.core.ledger.CertifiedFact;
import com.libragraph.attest.core.ledger.ReceiptArchive;
import com.libragraph.attest.core.pipeline.CertificationRequest;
import com.libragraph.attest.core.pipeline.CertificationRun;
import com.libragraph.attest.core.pipeline.CertificationService;
import com.libragraph.attest.core.pipeline.IntegrityStatus;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.core.receipt.ReceiptCodec;
import com.libragraph.attest.core.receipt.ValidationReport;
import com.libragraph.attest.core.receipt.ValidationReportReader;
import com.libragraph.attest.core.verify.LedgerVerificationResult;
import com.libragraph.attest.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Operations over the configured engine source tree and layer configuration. Baseline ids
 * default to {@code attest.baseline.default-id}.
 */
@Path("/api/integrity")
@Produces(MediaType.APPLICATION_JSON)
public class IntegrityResource {

    private static final Logger log = Logger.getLogger(IntegrityResource.class);

    @Inject
    CertificationService certification;

    @Inject
    BaselineStore baselines;

    @Inject
    ReceiptArchive archive;

    @POST
    @Path("/baseline")
    public BaselineSummary computeBaseline(@QueryParam("baseline") String baselineId) {
        Baseline baseline = certification.compute(baselineId(baselineId), certification.configuredSource());
        return BaselineSummary.of(baseline);
    }

    @GET
    @Path("/baselines")
    public List<String> listBaselines() {
        return baselines.list();
    }

    @GET
    @Path("/status")
    public IntegrityStatus status(@QueryParam("baseline") String baselineId) {
        return certification.status(baselineId(baselineId), certification.configuredSource());
    }

    @POST
    @Path("/verify")
    public VerificationSummary verify(@QueryParam("baseline") String baselineId) {
        return VerificationSummary.of(certification.verify(baselineId(baselineId), certification.configuredSource()));
    }

    /**
     * Certifies the configured source against a baseline. The body is the test harness
     * report, either {@code {"problem_class": true}} or a claim list.
     */
    @POST
    @Path("/certify")
    @Consumes(MediaType.APPLICATION_JSON)
    public RunSummary certify(@QueryParam("baseline") String baselineId, String validationReport) {
        if (validationReport == null || validationReport.isBlank()) {
            throw new BadRequestException("A validation report is required");
        }
        ValidationReport validation = ValidationReportReader.parse(validationReport.getBytes(StandardCharsets.UTF_8));
        CertificationRun run = certification.certify(new CertificationRequest(baselineId(baselineId),
                certification.settings().engine(), validation, certification.configuredSource()));
        return RunSummary.of(run);
    }

    @GET
    @Path("/runs/{runId}")
    public RunSummary run(@PathParam("runId") String runId) {
        return RunSummary.of(requireRun(runId));
    }

    @POST
    @Path("/runs/{runId}/anchor")
    public RunSummary retryAnchor(@PathParam("runId") String runId) {
        return RunSummary.of(certification.retryAnchor(requireRun(runId)));
    }

    @POST
    @Path("/runs/{runId}/confirm")
    public RunSummary confirmAnchor(@PathParam("runId") String runId) {
        return RunSummary.of(certification.confirmAnchor(requireRun(runId)));
    }

    @GET
    @Path("/receipts/{contentHash}")
    public ReceiptCodec.ReceiptRecord receipt(@PathParam("contentHash") String contentHash) {
        CertificationReceipt receipt = archive.load(ContentHash.fromHex(contentHash))
                .orElseThrow(() -> new NotFoundException("No archived receipt " + contentHash));
        return ReceiptCodec.toRecord(receipt);
    }

    /**
     * Checks a held receipt, posted as its published JSON record, against a ledger
     * transaction.
     */
    @POST
    @Path("/receipts/verify")
    @Consumes(MediaType.APPLICATION_JSON)
    public LedgerVerificationResult verifyReceipt(@QueryParam("tx") String transactionId, String receipt) {
        if (transactionId == null || transactionId.isBlank()) {
            throw new BadRequestException("Query parameter 'tx' is required");
        }
        if (receipt == null || receipt.isBlank()) {
            throw new BadRequestException("A receipt is required");
        }
        LedgerVerificationResult result = certification.verifyReceipt(
                ReceiptCodec.read(receipt.getBytes(StandardCharsets.UTF_8)), transactionId);
        log.infof("Receipt verification against %s: %s", transactionId, result.status());
        return result;
    }

    @GET
    @Path("/facts")
    public List<CertifiedFact> facts() {
        return archive.certifiedFacts();
    }

    private String baselineId(String requested) {
        return requested == null || requested.isBlank() ? certification.settings().defaultBaselineId() : requested;
    }

    private CertificationRun requireRun(String runId) {
        return certification.run(runId).orElseThrow(() -> new NotFoundException("Unknown run " + runId));
    }
}
