package com.libragraph.attest.core.pipeline;

/**
 * Fatal pipeline failure. Names the run, the stage that could not be entered, and why.
 */
public class CertificationPipelineException extends RuntimeException {

    private final String runId;
    private final PipelineStage stage;
    private final String reason;

    public CertificationPipelineException(String runId, PipelineStage stage, String reason, Throwable cause) {
        super("Certification halted at " + stage + ": " + reason, cause);
        this.runId = runId;
        this.stage = stage;
        this.reason = reason;
    }

    public String runId() {
        return runId;
    }

    public PipelineStage stage() {
        return stage;
    }

    public String reason() {
        return reason;
    }
}
