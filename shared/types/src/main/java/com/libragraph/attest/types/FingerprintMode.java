package com.libragraph.attest.types;

/**
 * How a file's fingerprint was derived.
 *
 * <p>{@code RAW_FALLBACK} fingerprints are byte-exact: any change to the file, cosmetic or not,
 * changes the hash, and a semantic normalization was not applied.
 */
public enum FingerprintMode {
    SEMANTIC(0, "semantic"),
    RAW_FALLBACK(1, "raw-fallback");

    private final int id;
    private final String label;

    FingerprintMode(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static FingerprintMode fromId(int id) {
        for (FingerprintMode m : values()) {
            if (m.id == id) return m;
        }
        throw new IllegalArgumentException("Unknown FingerprintMode id: " + id);
    }
}
