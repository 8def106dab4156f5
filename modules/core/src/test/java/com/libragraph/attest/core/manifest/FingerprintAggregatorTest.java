package com.libragraph.attest.core.manifest;

import com.libragraph.attest.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class FingerprintAggregatorTest {

    private final FingerprintAggregator aggregator = new FingerprintAggregator();

    private static ContentHash h(String s) {
        return ContentHash.digest(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldIgnoreLayerEnumerationOrder() {
        Map<String, ContentHash> forward = new LinkedHashMap<>();
        forward.put("config", h("c"));
        forward.put("source", h("s"));
        Map<String, ContentHash> reverse = new LinkedHashMap<>();
        reverse.put("source", h("s"));
        reverse.put("config", h("c"));

        assertThat(aggregator.aggregate("v1", reverse)).isEqualTo(aggregator.aggregate("v1", forward));
    }

    @Test
    void shouldEmbedAlgorithmVersion() {
        Map<String, ContentHash> layers = Map.of("source", h("s"));

        MasterFingerprint v1 = aggregator.aggregate("v1", layers);
        MasterFingerprint v2 = aggregator.aggregate("v2", layers);

        assertThat(v2.aggregate()).isNotEqualTo(v1.aggregate());
        assertThat(v1.isComparableWith(v2)).isFalse();
        assertThat(v1.isComparableWith(aggregator.aggregate("v1", Map.of()))).isTrue();
    }

    @Test
    void shouldReflectEveryLayer() {
        MasterFingerprint base = aggregator.aggregate("v1", Map.of("a", h("1"), "b", h("2")));

        assertThat(aggregator.aggregate("v1", Map.of("a", h("1"), "b", h("3"))).aggregate())
                .isNotEqualTo(base.aggregate());
        assertThat(aggregator.aggregate("v1", Map.of("a", h("1"))).aggregate())
                .isNotEqualTo(base.aggregate());
        assertThat(aggregator.aggregate("v1", Map.of("a", h("2"), "b", h("1"))).aggregate())
                .isNotEqualTo(base.aggregate());
    }

    @Test
    void shouldKeepLayerHashesSorted() {
        Map<String, ContentHash> layers = new LinkedHashMap<>();
        layers.put("z", h("z"));
        layers.put("a", h("a"));

        assertThat(aggregator.aggregate("v1", layers).layerHashes().keySet()).containsExactly("a", "z");
    }
}
