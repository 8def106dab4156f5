package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.SourceFile;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * One configured layer.
 *
 * @param files    explicitly listed member paths; absent ones are recorded as missing
 * @param critical member paths whose absence halts the manifest build; implicitly members
 * @param includes globs selecting further members from whatever files are present
 */
public record LayerDefinition(String name, List<String> files, List<String> critical, List<String> includes) {

    public LayerDefinition {
        Objects.requireNonNull(name, "layer name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("layer name cannot be blank");
        }
        files = List.copyOf(files == null ? List.of() : files);
        critical = List.copyOf(critical == null ? List.of() : critical);
        includes = List.copyOf(includes == null ? List.of() : includes);
        files.forEach(SourceFile::requireCanonicalPath);
        critical.forEach(SourceFile::requireCanonicalPath);
        includes.forEach(GlobPattern::compile);
    }

    /** Explicit and critical paths, sorted. */
    public Set<String> declaredPaths() {
        Set<String> paths = new TreeSet<>(files);
        paths.addAll(critical);
        return paths;
    }

    public boolean isCritical(String path) {
        return critical.contains(path);
    }

    /**
     * Whether a present file at {@code path} belongs to this layer by configuration.
     */
    public boolean selects(String path) {
        return selector().test(path);
    }

    /**
     * Membership test with the include globs compiled once, for matching many paths.
     */
    public Predicate<String> selector() {
        Set<String> declared = declaredPaths();
        List<GlobPattern> globs = includes.stream().map(GlobPattern::compile).toList();
        return path -> declared.contains(path) || globs.stream().anyMatch(g -> g.matches(path));
    }
}
