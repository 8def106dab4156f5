package com.libragraph.attest.core.pipeline;

import java.util.Objects;

/**
 * A non-fatal condition attached to a run. The guarantee it weakens is named by the code.
 */
public record PipelineWarning(Code code, String detail) {

    public enum Code {
        /** A file was hashed by raw bytes. */
        PARSE_FALLBACK,
        NON_CRITICAL_FILE_MISSING,
        /** A configured layer has no members. */
        EMPTY_LAYER,
        /** Canonical form matches the baseline but raw bytes changed. */
        COSMETIC_DRIFT,
        /** The test harness skipped a problem class; it is not in the receipt. */
        VALIDATION_SKIPPED,
        /** The ledger was unavailable; the receipt is valid but not yet anchored. */
        ANCHOR_DEFERRED,
        /** The anchor transaction could not be read back yet. */
        ANCHOR_UNCONFIRMED
    }

    public PipelineWarning {
        Objects.requireNonNull(code, "code cannot be null");
        Objects.requireNonNull(detail, "detail cannot be null");
    }
}
