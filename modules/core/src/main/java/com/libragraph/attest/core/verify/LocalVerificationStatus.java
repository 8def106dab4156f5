package com.libragraph.attest.core.verify;

/**
 * Outcome of comparing current files against a baseline, most severe first.
 */
public enum LocalVerificationStatus {
    /** A file recorded in the baseline, or a critical file, is absent. */
    MISSING_FILE,
    /** At least one layer hash, or the aggregate, differs. */
    MISMATCH,
    /** Hashes match, but some files could not be parsed and were compared by raw bytes. */
    PARSE_FALLBACK_PRESENT,
    MATCH;

    /** Whether the result supports certifying the current files. */
    public boolean passes() {
        return this == MATCH || this == PARSE_FALLBACK_PRESENT;
    }
}
