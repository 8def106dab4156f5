package com.libragraph.attest.core.baseline;

/**
 * Thrown when an operation needs a baseline that has not been computed.
 */
public class BaselineNotFoundException extends RuntimeException {

    private final String baselineId;

    public BaselineNotFoundException(String baselineId) {
        super("Baseline not found: " + baselineId);
        this.baselineId = baselineId;
    }

    public String baselineId() {
        return baselineId;
    }
}
