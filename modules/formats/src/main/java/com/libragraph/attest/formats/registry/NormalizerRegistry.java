package com.libragraph.attest.formats.registry;

import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.handlers.JsonNormalizer;
import com.libragraph.attest.formats.handlers.PropertiesNormalizer;
import com.libragraph.attest.formats.handlers.PythonNormalizer;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Central registry that matches files to semantic normalizers.
 * All {@link SemanticNormalizer} beans are discovered via CDI.
 */
@Singleton
public class NormalizerRegistry {

    private final List<SemanticNormalizer> normalizers;

    @Inject
    public NormalizerRegistry(Instance<SemanticNormalizer> normalizers) {
        this(normalizers.stream().toList());
    }

    public NormalizerRegistry(List<SemanticNormalizer> normalizers) {
        Set<String> ids = new HashSet<>();
        for (SemanticNormalizer n : normalizers) {
            if (!ids.add(n.id())) {
                throw new IllegalArgumentException("Duplicate normalizer id: " + n.id());
            }
        }
        this.normalizers = List.copyOf(normalizers);
    }

    /**
     * Registry with the built-in normalizers, for use outside a CDI container.
     */
    public static NormalizerRegistry withDefaults() {
        return new NormalizerRegistry(List.of(
                new PythonNormalizer(), new JsonNormalizer(), new PropertiesNormalizer()));
    }

    /**
     * Finds the highest-priority normalizer for the file; ties go to the lowest id so the
     * choice never depends on discovery order. Empty means the kind is unsupported.
     */
    public Optional<SemanticNormalizer> findNormalizer(FileContext context) {
        String filename = context.filename();
        return normalizers.stream()
                .filter(n -> n.getDetectionCriteria().matches(context.declaredKind().orElse(null), filename))
                .min(Comparator.comparingInt((SemanticNormalizer n) -> -n.getDetectionCriteria().priority())
                        .thenComparing(SemanticNormalizer::id));
    }

    public List<SemanticNormalizer> normalizers() {
        return normalizers;
    }
}
