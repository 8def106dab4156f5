package com.libragraph.attest.core;

import com.libragraph.attest.core.fingerprint.FileFingerprinter;
import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.manifest.FingerprintAggregator;
import com.libragraph.attest.core.manifest.LayerConfig;
import com.libragraph.attest.core.manifest.LayerDefinition;
import com.libragraph.attest.core.manifest.ManifestBuilder;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.receipt.EngineIdentity;
import com.libragraph.attest.formats.registry.NormalizerRegistry;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared engine source fixtures: three Python files A, B and C in layer "source", with B
 * critical.
 */
public final class Fixtures {

    public static final String A_PATH = "engine/annealer.py";
    public static final String B_PATH = "engine/core.py";
    public static final String C_PATH = "engine/params.py";

    public static final String A = """
            \"\"\"Simulated annealing schedule.\"\"\"
            import math

            RATE = 0.95  # cooling rate


            def cool(t):
                return t * RATE
            """;

    public static final String B = """
            def energy(spins, couplings):
                total = 0
                for (i, j), w in couplings.items():
                    total -= w * spins[i] * spins[j]
                return total
            """;

    public static final String C = """
            SWEEPS = 64
            BETA_MAX = 3.0
            """;

    public static final EngineIdentity ENGINE = new EngineIdentity("ising-engine", "2.1.0");

    private static final ExecutorService EXECUTOR = Executors.newFixedThreadPool(4, r -> {
        Thread t = new Thread(r, "test-fingerprint");
        t.setDaemon(true);
        return t;
    });

    private Fixtures() {
    }

    public static SourceFile file(String path, String content) {
        return SourceFile.of(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public static List<SourceFile> abc() {
        return new ArrayList<>(List.of(file(A_PATH, A), file(B_PATH, B), file(C_PATH, C)));
    }

    /** Replaces the content of one file in a file set. */
    public static List<SourceFile> with(List<SourceFile> files, String path, String content) {
        List<SourceFile> result = new ArrayList<>();
        for (SourceFile f : files) {
            result.add(f.path().equals(path) ? file(path, content) : f);
        }
        return result;
    }

    public static List<SourceFile> without(List<SourceFile> files, String path) {
        return files.stream().filter(f -> !f.path().equals(path)).toList();
    }

    public static LayerConfig sourceLayer() {
        return LayerConfig.of(List.of(
                new LayerDefinition("source", List.of(A_PATH, C_PATH), List.of(B_PATH), List.of())));
    }

    public static FileFingerprinter fingerprinter() {
        return new FileFingerprinter(NormalizerRegistry.withDefaults());
    }

    public static ManifestBuilder manifestBuilder() {
        return new ManifestBuilder(fingerprinter(), EXECUTOR);
    }

    public static MasterFingerprint master(LayerConfig config, List<SourceFile> files) {
        return new FingerprintAggregator().aggregate(manifestBuilder().build(config, files));
    }
}
