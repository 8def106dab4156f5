package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.types.FileKind;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The configured layers of an engine source tree, plus file kinds declared for paths whose
 * extension does not reveal them.
 */
public record LayerConfig(SortedMap<String, LayerDefinition> layers, Map<String, FileKind> kinds) {

    public LayerConfig {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("at least one layer must be configured");
        }
        layers.forEach((name, def) -> {
            if (!name.equals(def.name())) {
                throw new IllegalArgumentException(
                        "layer key '" + name + "' does not match definition name '" + def.name() + "'");
            }
        });
        layers = Collections.unmodifiableSortedMap(new TreeMap<>(layers));
        kinds = kinds == null ? Map.of() : Map.copyOf(kinds);
        kinds.keySet().forEach(SourceFile::requireCanonicalPath);
    }

    public static LayerConfig of(List<LayerDefinition> definitions) {
        return of(definitions, Map.of());
    }

    public static LayerConfig of(List<LayerDefinition> definitions, Map<String, FileKind> kinds) {
        TreeMap<String, LayerDefinition> layers = new TreeMap<>();
        for (LayerDefinition def : definitions) {
            if (layers.put(def.name(), def) != null) {
                throw new IllegalArgumentException("Duplicate layer: " + def.name());
            }
        }
        return new LayerConfig(layers, kinds);
    }

    public Optional<FileKind> declaredKind(String path) {
        return Optional.ofNullable(kinds.get(path));
    }

    /**
     * Whether any layer selects the file, by configuration or by the file's own tags.
     */
    public boolean selects(SourceFile file) {
        if (!file.layers().isEmpty()) {
            return true;
        }
        return layers.values().stream().anyMatch(def -> def.selects(file.path()));
    }
}
