package com.libragraph.attest.core.pipeline;

import com.libragraph.attest.core.receipt.EngineIdentity;
import com.libragraph.attest.core.receipt.ValidationReport;

import java.util.Objects;

/**
 * Input to a certification run: the current source, the baseline it must match, the
 * harness outcomes, and the engine identity to put in the receipt.
 */
public record CertificationRequest(String baselineId, EngineIdentity engine, ValidationReport validation,
                                   SourceSnapshot source) {

    public CertificationRequest {
        Objects.requireNonNull(baselineId, "baselineId cannot be null");
        Objects.requireNonNull(engine, "engine cannot be null");
        Objects.requireNonNull(validation, "validation cannot be null");
        Objects.requireNonNull(source, "source cannot be null");
    }
}
