package com.libragraph.attest.core.manifest;

/**
 * Version tag of the fingerprinting algorithm. It is hashed into every master fingerprint
 * and must change whenever any hash input or canonical encoding changes.
 */
public final class IntegrityAlgorithm {

    public static final String VERSION = "blake3-256/layered-v1";

    static final String LAYER_DOMAIN = "attest layer v1";
    static final String MASTER_DOMAIN = "attest master v1";

    private IntegrityAlgorithm() {
    }
}
