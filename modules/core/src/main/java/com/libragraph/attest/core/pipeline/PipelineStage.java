package com.libragraph.attest.core.pipeline;

/**
 * Stages of a certification run, in order. A run's stage is the last one it completed.
 */
public enum PipelineStage {
    INIT,
    FINGERPRINTED,
    MANIFESTED,
    CERTIFIED,
    ANCHORED,
    VERIFIABLE;

    public boolean isAfter(PipelineStage other) {
        return ordinal() > other.ordinal();
    }
}
