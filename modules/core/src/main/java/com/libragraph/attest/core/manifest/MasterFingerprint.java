package com.libragraph.attest.core.manifest;

import com.libragraph.attest.util.ContentHash;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Versioned summary of all layers of a file set.
 *
 * <p>Two master fingerprints are comparable only under the same algorithm version; the
 * version is also part of the aggregate's hash input.
 */
public record MasterFingerprint(String algorithmVersion, SortedMap<String, ContentHash> layerHashes,
                                ContentHash aggregate) {

    public MasterFingerprint {
        Objects.requireNonNull(algorithmVersion, "algorithmVersion cannot be null");
        Objects.requireNonNull(aggregate, "aggregate cannot be null");
        layerHashes = Collections.unmodifiableSortedMap(new TreeMap<>((Map<String, ContentHash>) layerHashes));
    }

    public boolean isComparableWith(MasterFingerprint other) {
        return algorithmVersion.equals(other.algorithmVersion);
    }

    public String toHex() {
        return aggregate.toHex();
    }
}
