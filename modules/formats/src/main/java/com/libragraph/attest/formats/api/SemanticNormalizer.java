package com.libragraph.attest.formats.api;

/**
 * Reduces source content of one file kind to a canonical, formatting-insensitive form.
 * Implementations should be stateless {@code @ApplicationScoped} CDI beans.
 *
 * <p>Elements a normalizer strips must never carry behavior: whitespace, comments and purely
 * descriptive string literals may go; value-bearing literals, identifiers and the order of
 * statements must survive into the canonical form.
 */
public interface SemanticNormalizer {

    /**
     * Stable identifier, embedded in every fingerprint produced from this normalizer's output.
     */
    String id();

    /**
     * Version of the canonicalization rules. Must change whenever the canonical form of any
     * input could change.
     */
    String version();

    /**
     * Returns criteria for detecting when this normalizer should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Parses the content and serializes what remains after stripping non-semantic elements.
     *
     * @throws SourceParseException if the content cannot be parsed as this normalizer's kind;
     *                              callers fall back to hashing raw bytes
     */
    CanonicalForm normalize(byte[] content, FileContext context) throws SourceParseException;
}
