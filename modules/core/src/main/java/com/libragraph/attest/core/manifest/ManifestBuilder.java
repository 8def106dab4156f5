package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.fingerprint.FileFingerprinter;
import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.util.ContentHash;
import com.libragraph.attest.util.ContentHasher;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;

/**
 * Builds the layered manifest for a set of source files.
 *
 * <p>Fingerprinting fans out to the {@code fingerprintExecutor} pool; each task returns an
 * immutable fingerprint and the results are merged by sorting on path, so worker completion
 * order never reaches a hash. A layer hash covers the layer name, its member count and every
 * member's (path, hash) pair in path order.
 */
@Singleton
public class ManifestBuilder {

    private static final Logger log = Logger.getLogger(ManifestBuilder.class);

    private final FileFingerprinter fingerprinter;
    private final ExecutorService executor;

    @Inject
    public ManifestBuilder(FileFingerprinter fingerprinter,
                           @Named("fingerprintExecutor") ExecutorService executor) {
        this.fingerprinter = fingerprinter;
        this.executor = executor;
    }

    /**
     * Fingerprints and assembles in one step.
     *
     * @throws MissingCriticalFileException if a critical file of any layer is absent
     */
    public Manifest build(LayerConfig config, Collection<SourceFile> files) {
        return assemble(config, files, fingerprintAll(config, files));
    }

    /**
     * Fingerprints every file selected by at least one layer, sorted by path.
     *
     * @throws IllegalArgumentException on duplicate paths or tags naming unconfigured layers
     */
    public List<FileFingerprint> fingerprintAll(LayerConfig config, Collection<SourceFile> files) {
        checkInput(config, files);

        List<CompletableFuture<FileFingerprint>> futures = new ArrayList<>();
        for (SourceFile file : files) {
            if (!config.selects(file)) {
                log.debugf("Skipping %s: not in any layer", file.path());
                continue;
            }
            futures.add(CompletableFuture.supplyAsync(() -> fingerprinter.fingerprint(file), executor));
        }

        TreeMap<String, FileFingerprint> byPath = new TreeMap<>();
        for (CompletableFuture<FileFingerprint> future : futures) {
            FileFingerprint fp = join(future);
            byPath.put(fp.path(), fp);
        }
        log.debugf("Fingerprinted %d of %d files", byPath.size(), files.size());
        return List.copyOf(byPath.values());
    }

    /**
     * Groups fingerprints into layers and hashes each layer.
     *
     * @throws MissingCriticalFileException if a critical file of any layer is absent
     */
    public Manifest assemble(LayerConfig config, Collection<SourceFile> files,
                             Collection<FileFingerprint> fingerprints) {
        checkInput(config, files);
        Map<String, FileFingerprint> byPath = new HashMap<>();
        for (FileFingerprint fp : fingerprints) {
            if (byPath.put(fp.path(), fp) != null) {
                throw new IllegalArgumentException("Duplicate fingerprint for " + fp.path());
            }
        }

        List<MissingCriticalFileException.MissingFile> missingCritical = new ArrayList<>();
        Set<String> missing = new TreeSet<>();
        for (LayerDefinition layer : config.layers().values()) {
            for (String path : layer.declaredPaths()) {
                if (byPath.containsKey(path)) {
                    continue;
                }
                if (layer.isCritical(path)) {
                    missingCritical.add(new MissingCriticalFileException.MissingFile(layer.name(), path));
                } else {
                    missing.add(path);
                }
            }
        }
        if (!missingCritical.isEmpty()) {
            throw new MissingCriticalFileException(missingCritical);
        }

        TreeMap<String, ContentHash> layerHashes = new TreeMap<>();
        TreeMap<String, List<String>> layerMembers = new TreeMap<>();
        for (LayerDefinition layer : config.layers().values()) {
            Predicate<String> selector = layer.selector();
            TreeSet<String> members = new TreeSet<>();
            for (SourceFile file : files) {
                if (selector.test(file.path()) || file.layers().contains(layer.name())) {
                    if (!byPath.containsKey(file.path())) {
                        throw new IllegalArgumentException("No fingerprint for " + file.path());
                    }
                    members.add(file.path());
                }
            }
            layerHashes.put(layer.name(), layerHash(layer.name(), members, byPath));
            layerMembers.put(layer.name(), List.copyOf(members));
        }

        if (!missing.isEmpty()) {
            log.warnf("Non-critical files missing: %s", missing);
        }
        return new Manifest(IntegrityAlgorithm.VERSION, layerHashes, layerMembers,
                List.copyOf(byPath.values()), List.copyOf(missing));
    }

    static ContentHash layerHash(String name, TreeSet<String> members, Map<String, FileFingerprint> byPath) {
        ContentHasher hasher = ContentHasher.forDomain(IntegrityAlgorithm.LAYER_DOMAIN)
                .update(name)
                .update(members.size());
        for (String path : members) {
            hasher.update(path).update(byPath.get(path).hash());
        }
        return hasher.finish();
    }

    private static void checkInput(LayerConfig config, Collection<SourceFile> files) {
        Set<String> seen = new TreeSet<>();
        for (SourceFile file : files) {
            if (!seen.add(file.path())) {
                throw new IllegalArgumentException("Duplicate source path: " + file.path());
            }
            for (String tag : file.layers()) {
                if (!config.layers().containsKey(tag)) {
                    throw new IllegalArgumentException(
                            file.path() + " declares unconfigured layer '" + tag + "'");
                }
            }
        }
    }

    private static FileFingerprint join(CompletableFuture<FileFingerprint> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
