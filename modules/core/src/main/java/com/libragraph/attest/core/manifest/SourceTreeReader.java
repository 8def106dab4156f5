package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.storage.StoreException;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the files a layer configuration selects from a directory tree.
 *
 * <p>Configured files that do not exist are simply not returned; the manifest builder
 * reports them. Paths are converted to canonical {@code /}-separated form, so the same tree
 * yields the same paths on every OS.
 */
@Singleton
public class SourceTreeReader {

    private static final Logger log = Logger.getLogger(SourceTreeReader.class);

    public List<SourceFile> read(Path root, LayerConfig config) {
        if (!Files.isDirectory(root)) {
            throw new StoreException("Source root is not a directory: " + root);
        }

        Map<String, Predicate<String>> selectors = config.layers().values().stream()
                .collect(Collectors.toMap(LayerDefinition::name, LayerDefinition::selector));

        List<SourceFile> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path file : (Iterable<Path>) walk.filter(Files::isRegularFile).sorted()::iterator) {
                String path = canonicalPath(root.relativize(file));
                Set<String> layers = new TreeSet<>();
                selectors.forEach((name, selector) -> {
                    if (selector.test(path)) {
                        layers.add(name);
                    }
                });
                if (layers.isEmpty()) {
                    continue;
                }
                byte[] content = Files.readAllBytes(file);
                files.add(new SourceFile(path, content, config.declaredKind(path).orElse(null), layers));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to read source tree: " + root, e);
        }

        log.debugf("Read %d source files from %s", files.size(), root);
        return files;
    }

    static String canonicalPath(Path relative) {
        List<String> segments = new ArrayList<>();
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }
}
