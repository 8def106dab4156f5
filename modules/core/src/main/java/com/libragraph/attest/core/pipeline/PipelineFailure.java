package com.libragraph.attest.core.pipeline;

/**
 * The fatal failure recorded on a run.
 *
 * @param stage the stage that could not be entered
 */
public record PipelineFailure(PipelineStage stage, String reason) {}
