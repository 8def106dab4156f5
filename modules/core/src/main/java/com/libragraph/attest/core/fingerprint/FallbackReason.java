package com.libragraph.attest.core.fingerprint;

/**
 * Why a file was hashed by its raw bytes instead of its canonical form.
 */
public enum FallbackReason {
    /** A normalizer exists for the kind but could not parse the content. */
    PARSE_ERROR,
    /** No normalizer handles the kind. */
    UNSUPPORTED_KIND
}
