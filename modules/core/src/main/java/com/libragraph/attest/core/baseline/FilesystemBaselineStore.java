package com.libragraph.attest.core.baseline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.attest.core.fingerprint.FallbackReason;
import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.manifest.FingerprintAggregator;
import com.libragraph.attest.core.manifest.Manifest;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.types.FingerprintMode;
import com.libragraph.attest.util.ContentHash;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Baselines as JSON documents on the local filesystem.
 *
 * <p>Layout: {@code {root}/{baselineId}/baseline.json}. Saving writes a temporary file next
 * to the target and moves it into place, so readers never see a partial document. Loading
 * recomputes the master fingerprint from the stored layer hashes and rejects a document
 * whose stored value disagrees.
 */
@Singleton
public class FilesystemBaselineStore implements BaselineStore {

    private static final Logger log = Logger.getLogger(FilesystemBaselineStore.class);
    private static final String FILE_NAME = "baseline.json";
    private static final ObjectMapper MAPPER = AttestJson.newMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final FingerprintAggregator aggregator;
    private final Path root;

    @Inject
    public FilesystemBaselineStore(FingerprintAggregator aggregator,
                                   @ConfigProperty(name = "attest.baseline.root") String root) {
        this(aggregator, Path.of(root));
    }

    public FilesystemBaselineStore(FingerprintAggregator aggregator, Path root) {
        this.aggregator = aggregator;
        this.root = root;
    }

    private Path resolvePath(String baselineId) {
        return root.resolve(Baseline.requireValidId(baselineId)).resolve(FILE_NAME);
    }

    @Override
    public void save(Baseline baseline) {
        Path path = resolvePath(baseline.baselineId());
        try {
            Files.createDirectories(path.getParent());
            Path tmp = Files.createTempFile(path.getParent(), FILE_NAME, ".tmp");
            try {
                Files.write(tmp, MAPPER.writeValueAsBytes(toDocument(baseline)));
                move(tmp, path);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new StoreException("Failed to save baseline: " + baseline.baselineId(), e);
        }
        log.infof("Saved baseline '%s' with master fingerprint %s",
                baseline.baselineId(), baseline.master().toHex());
    }

    @Override
    public Optional<Baseline> load(String baselineId) {
        Path path = resolvePath(baselineId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        BaselineDocument doc;
        try {
            doc = MAPPER.readValue(path.toFile(), BaselineDocument.class);
        } catch (IOException e) {
            throw new StoreException("Failed to read baseline: " + baselineId, e);
        }
        return Optional.of(fromDocument(baselineId, doc));
    }

    @Override
    public List<String> list() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root)) {
            for (Path dir : dirs) {
                if (Files.exists(dir.resolve(FILE_NAME))) {
                    ids.add(dir.getFileName().toString());
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list baselines", e);
        }
        Collections.sort(ids);
        return ids;
    }

    @Override
    public boolean isAvailable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            return false;
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static BaselineDocument toDocument(Baseline baseline) {
        Manifest m = baseline.manifest();
        List<FileRecord> files = m.fingerprints().stream()
                .map(f -> new FileRecord(f.path(), f.hash(), f.mode(), f.rawHash(), f.normalizer(), f.fallbackReason()))
                .toList();
        return new BaselineDocument(baseline.baselineId(), baseline.createdAt(), m.algorithmVersion(),
                baseline.master().aggregate(), m.layerHashes(), m.layerMembers(), m.missingFiles(), files);
    }

    private Baseline fromDocument(String baselineId, BaselineDocument doc) {
        if (!baselineId.equals(doc.baselineId())) {
            throw new StoreException("Baseline document " + baselineId + " names id " + doc.baselineId());
        }
        try {
            List<FileFingerprint> fingerprints = doc.files().stream()
                    .map(f -> new FileFingerprint(f.path(), f.hash(), f.mode(), f.rawHash(), f.normalizer(),
                            f.fallbackReason()))
                    .toList();
            Manifest manifest = new Manifest(doc.algorithmVersion(), doc.layers(), doc.layerMembers(),
                    fingerprints, doc.missingFiles());

            MasterFingerprint master = aggregator.aggregate(manifest);
            if (!master.aggregate().equals(doc.masterFingerprint())) {
                throw new StoreException("Baseline " + baselineId + " is corrupt: stored master fingerprint "
                        + doc.masterFingerprint() + " does not match its layers (" + master.toHex() + ")");
            }
            return new Baseline(baselineId, master, manifest, doc.createdAt());
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new StoreException("Baseline " + baselineId + " is malformed: " + e.getMessage(), e);
        }
    }

    record BaselineDocument(
            @JsonProperty("baseline_id") String baselineId,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("algorithm_version") String algorithmVersion,
            @JsonProperty("master_fingerprint") ContentHash masterFingerprint,
            @JsonProperty("layers") SortedMap<String, ContentHash> layers,
            @JsonProperty("layer_members") SortedMap<String, List<String>> layerMembers,
            @JsonProperty("missing_files") List<String> missingFiles,
            @JsonProperty("files") List<FileRecord> files
    ) {}

    record FileRecord(
            @JsonProperty("path") String path,
            @JsonProperty("hash") ContentHash hash,
            @JsonProperty("mode") FingerprintMode mode,
            @JsonProperty("raw_hash") ContentHash rawHash,
            @JsonProperty("normalizer") String normalizer,
            @JsonProperty("fallback_reason") FallbackReason fallbackReason
    ) {}
}
