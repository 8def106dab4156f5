package com.libragraph.attest.core.verify;

import com.libragraph.attest.util.ContentHash;

import java.util.List;

/**
 * A layer whose hash differs from the baseline, with the files responsible.
 *
 * @param baselineHash null if the layer is new
 * @param currentHash  null if the layer is no longer configured
 * @param changed      members present in both whose file hash differs
 */
public record LayerDivergence(
        String layer,
        ContentHash baselineHash,
        ContentHash currentHash,
        List<String> changed,
        List<String> added,
        List<String> removed
) {

    public LayerDivergence {
        changed = List.copyOf(changed);
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }
}
