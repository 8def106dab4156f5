package com.libragraph.attest.core.baseline;

import java.util.List;
import java.util.Optional;

/**
 * Persisted baselines.
 */
public interface BaselineStore {

    /**
     * Saves a baseline, replacing any previous baseline with the same id atomically.
     *
     * @throws com.libragraph.attest.core.storage.StoreException on I/O errors
     */
    void save(Baseline baseline);

    /**
     * @throws com.libragraph.attest.core.storage.StoreException on I/O errors or a corrupt document
     */
    Optional<Baseline> load(String baselineId);

    List<String> list();

    boolean isAvailable();
}
