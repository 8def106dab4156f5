package com.libragraph.attest.core.verify;

/**
 * Thrown when two fingerprints were computed under different algorithm versions.
 */
public class IncomparableFingerprintException extends RuntimeException {

    public IncomparableFingerprintException(String baselineVersion, String currentVersion) {
        super("Cannot compare fingerprints across algorithm versions: baseline "
                + baselineVersion + ", current " + currentVersion);
    }
}
