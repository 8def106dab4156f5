package com.libragraph.attest.core.pipeline;

import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.manifest.LayerConfig;

import java.util.List;
import java.util.Objects;

/**
 * The files of one run together with the layer configuration that groups them.
 */
public record SourceSnapshot(LayerConfig config, List<SourceFile> files) {

    public SourceSnapshot {
        Objects.requireNonNull(config, "config cannot be null");
        files = List.copyOf(files);
    }
}
