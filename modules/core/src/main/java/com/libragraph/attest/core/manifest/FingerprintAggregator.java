package com.libragraph.attest.core.manifest;

import com.libragraph.attest.util.ContentHash;
import com.libragraph.attest.util.ContentHasher;
import jakarta.inject.Singleton;

import java.util.Map;
import java.util.TreeMap;

/**
 * Combines layer hashes into the master fingerprint: hash of the algorithm version, the
 * layer count and every (name, hash) pair in name order.
 */
@Singleton
public class FingerprintAggregator {

    public MasterFingerprint aggregate(Manifest manifest) {
        return aggregate(manifest.algorithmVersion(), manifest.layerHashes());
    }

    public MasterFingerprint aggregate(String algorithmVersion, Map<String, ContentHash> layerHashes) {
        TreeMap<String, ContentHash> sorted = new TreeMap<>(layerHashes);
        ContentHasher hasher = ContentHasher.forDomain(IntegrityAlgorithm.MASTER_DOMAIN)
                .update(algorithmVersion)
                .update(sorted.size());
        sorted.forEach((name, hash) -> hasher.update(name).update(hash));
        return new MasterFingerprint(algorithmVersion, sorted, hasher.finish());
    }
}
