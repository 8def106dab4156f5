package com.libragraph.attest.core.pipeline;

import com.libragraph.attest.core.receipt.EngineIdentity;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Deployment settings for runs that use the configured engine and source tree.
 */
@Singleton
public class AttestSettings {

    private final EngineIdentity engine;
    private final String defaultBaselineId;
    private final Optional<String> sourceRoot;
    private final Optional<String> layersConfig;
    private final Duration runRetention;
    private final int maxRetainedRuns;

    @Inject
    public AttestSettings(
            @ConfigProperty(name = "attest.engine.name") String engineName,
            @ConfigProperty(name = "attest.engine.version") String engineVersion,
            @ConfigProperty(name = "attest.baseline.default-id", defaultValue = "default") String defaultBaselineId,
            @ConfigProperty(name = "attest.source.root") Optional<String> sourceRoot,
            @ConfigProperty(name = "attest.layers.config") Optional<String> layersConfig,
            @ConfigProperty(name = "attest.runs.retention", defaultValue = "24h") Duration runRetention,
            @ConfigProperty(name = "attest.runs.max-retained", defaultValue = "256") int maxRetainedRuns) {
        if (runRetention.isNegative()) {
            throw new IllegalArgumentException("attest.runs.retention must not be negative");
        }
        if (maxRetainedRuns < 1) {
            throw new IllegalArgumentException("attest.runs.max-retained must be at least 1");
        }
        this.engine = new EngineIdentity(engineName, engineVersion);
        this.defaultBaselineId = defaultBaselineId;
        this.sourceRoot = sourceRoot;
        this.layersConfig = layersConfig;
        this.runRetention = runRetention;
        this.maxRetainedRuns = maxRetainedRuns;
    }

    public EngineIdentity engine() {
        return engine;
    }

    public String defaultBaselineId() {
        return defaultBaselineId;
    }

    /** How long a settled run stays available by id. */
    public Duration runRetention() {
        return runRetention;
    }

    public int maxRetainedRuns() {
        return maxRetainedRuns;
    }

    public Path sourceRoot() {
        return Path.of(sourceRoot.orElseThrow(
                () -> new IllegalStateException("attest.source.root is not configured")));
    }

    public Path layersConfig() {
        return Path.of(layersConfig.orElseThrow(
                () -> new IllegalStateException("attest.layers.config is not configured")));
    }
}
