package com.libragraph.attest.formats.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * Output of a {@link SemanticNormalizer}: the canonical bytes and the rules that produced them.
 */
public record CanonicalForm(String normalizerId, String normalizerVersion, byte[] bytes) {

    public CanonicalForm {
        Objects.requireNonNull(normalizerId, "normalizerId cannot be null");
        Objects.requireNonNull(normalizerVersion, "normalizerVersion cannot be null");
        Objects.requireNonNull(bytes, "bytes cannot be null");
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /** Normalizer id and version joined, e.g. {@code python/1}. */
    public String normalizer() {
        return normalizerId + "/" + normalizerVersion;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CanonicalForm other)) return false;
        return normalizerId.equals(other.normalizerId)
                && normalizerVersion.equals(other.normalizerVersion)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizerId, normalizerVersion, Arrays.hashCode(bytes));
    }

    @Override
    public String toString() {
        return "CanonicalForm[" + normalizer() + ", " + bytes.length + " bytes]";
    }
}
