package com.libragraph.attest.core.fingerprint;

import com.libragraph.attest.types.FingerprintMode;
import com.libragraph.attest.util.ContentHash;

import java.util.Objects;

/**
 * Immutable fingerprint of one source file.
 *
 * @param hash           the hash contributing to the layer hash
 * @param rawHash        hash of the raw bytes, kept for cross-checking semantic matches
 * @param normalizer     {@code id/version} of the normalizer that produced or attempted the
 *                       canonical form, or {@code null} when none applies
 * @param fallbackReason set only in {@link FingerprintMode#RAW_FALLBACK} mode
 */
public record FileFingerprint(
        String path,
        ContentHash hash,
        FingerprintMode mode,
        ContentHash rawHash,
        String normalizer,
        FallbackReason fallbackReason
) {

    public FileFingerprint {
        SourceFile.requireCanonicalPath(path);
        Objects.requireNonNull(hash, "hash cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(rawHash, "rawHash cannot be null");
        if (mode == FingerprintMode.SEMANTIC && (fallbackReason != null || normalizer == null)) {
            throw new IllegalArgumentException(
                    "Semantic fingerprint needs a normalizer and no fallback reason: " + path);
        }
        if (mode == FingerprintMode.RAW_FALLBACK && fallbackReason == null) {
            throw new IllegalArgumentException("Raw fallback fingerprint needs a reason: " + path);
        }
    }

    public static FileFingerprint semantic(String path, ContentHash hash, ContentHash rawHash, String normalizer) {
        return new FileFingerprint(path, hash, FingerprintMode.SEMANTIC, rawHash, normalizer, null);
    }

    public static FileFingerprint rawFallback(String path, ContentHash rawHash, String normalizer,
                                              FallbackReason reason) {
        return new FileFingerprint(path, rawHash, FingerprintMode.RAW_FALLBACK, rawHash, normalizer, reason);
    }

    public boolean isFallback() {
        return mode == FingerprintMode.RAW_FALLBACK;
    }
}
