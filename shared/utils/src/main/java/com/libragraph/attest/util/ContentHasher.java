package com.libragraph.attest.util;

import org.apache.commons.codec.digest.Blake3;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Incremental, domain-separated BLAKE3-256 hasher over length-prefixed fields.
 *
 * <p>Every field is written as an 8-byte big-endian length followed by its bytes, so
 * {@code update("ab").update("c")} and {@code update("a").update("bc")} never collide.
 * The domain string keys the hash through BLAKE3's key-derivation mode: two hashers with
 * different domains produce unrelated outputs for identical input.
 *
 * <p>Single use; not thread-safe.
 */
public final class ContentHasher {

    private final Blake3 blake3;
    private boolean finished;

    private ContentHasher(Blake3 blake3) {
        this.blake3 = blake3;
    }

    public static ContentHasher forDomain(String domain) {
        Objects.requireNonNull(domain, "domain cannot be null");
        if (domain.isEmpty()) {
            throw new IllegalArgumentException("domain cannot be empty");
        }
        return new ContentHasher(
                Blake3.initKeyDerivationFunction(domain.getBytes(StandardCharsets.UTF_8)));
    }

    public ContentHasher update(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        ensureOpen();
        blake3.update(lengthPrefix(bytes.length));
        blake3.update(bytes);
        return this;
    }

    public ContentHasher update(String value) {
        Objects.requireNonNull(value, "value cannot be null");
        return update(value.getBytes(StandardCharsets.UTF_8));
    }

    public ContentHasher update(long value) {
        ensureOpen();
        blake3.update(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
        return this;
    }

    public ContentHasher update(ContentHash hash) {
        Objects.requireNonNull(hash, "hash cannot be null");
        return update(hash.bytes());
    }

    public ContentHash finish() {
        ensureOpen();
        finished = true;
        return new ContentHash(blake3.doFinalize(ContentHash.HASH_LENGTH));
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("ContentHasher already finished");
        }
    }

    private static byte[] lengthPrefix(int length) {
        return ByteBuffer.allocate(Long.BYTES).putLong(length).array();
    }
}
