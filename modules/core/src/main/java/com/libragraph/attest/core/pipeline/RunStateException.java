package com.libragraph.attest.core.pipeline;

/**
 * A run-level operation was asked of a run in the wrong stage, or while another anchoring
 * attempt on the same run is in flight.
 */
public class RunStateException extends IllegalStateException {

    private final String runId;
    private final PipelineStage stage;

    public RunStateException(String runId, PipelineStage stage, String message) {
        super("Run " + runId + " " + message + " (stage " + stage + ")");
        this.runId = runId;
        this.stage = stage;
    }

    public String runId() {
        return runId;
    }

    public PipelineStage stage() {
        return stage;
    }
}
