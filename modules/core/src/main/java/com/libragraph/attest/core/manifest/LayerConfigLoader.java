package com.libragraph.attest.core.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.types.FileKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a layer configuration document:
 *
 * <pre>{@code
 * {
 *   "layers": {
 *     "source": {"files": ["engine/solver.py"], "critical": ["engine/core.py"], "include": ["engine/**"]},
 *     "config": {"include": ["config/*.json"]}
 *   },
 *   "kinds": {"bin/run-engine": "python"}
 * }
 * }</pre>
 */
public final class LayerConfigLoader {

    private static final ObjectMapper MAPPER = AttestJson.newMapper();

    private LayerConfigLoader() {
    }

    public static LayerConfig load(Path path) {
        try {
            return parse(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StoreException("Failed to read layer config: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or names an unknown kind
     */
    public static LayerConfig parse(byte[] json) {
        Document doc;
        try {
            doc = MAPPER.readValue(json, Document.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid layer config: " + e.getMessage(), e);
        }
        if (doc.layers() == null) {
            throw new IllegalArgumentException("Invalid layer config: missing 'layers'");
        }

        List<LayerDefinition> definitions = new ArrayList<>();
        doc.layers().forEach((name, layer) -> definitions.add(
                new LayerDefinition(name, layer.files(), layer.critical(), layer.include())));

        Map<String, FileKind> kinds = new HashMap<>();
        if (doc.kinds() != null) {
            doc.kinds().forEach((path, label) -> kinds.put(path, FileKind.fromLabel(label)));
        }
        return LayerConfig.of(definitions, kinds);
    }

    record Document(
            @JsonProperty("layers") Map<String, Layer> layers,
            @JsonProperty("kinds") Map<String, String> kinds
    ) {}

    record Layer(
            @JsonProperty("files") List<String> files,
            @JsonProperty("critical") List<String> critical,
            @JsonProperty("include") List<String> include
    ) {}
}
