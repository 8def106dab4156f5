package com.libragraph.attest.core.manifest;

import com.libragraph.attest.types.FileKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class LayerConfigLoaderTest {

    private static LayerConfig parse(String json) {
        return LayerConfigLoader.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldParseLayersAndKinds() {
        LayerConfig config = parse("""
                {
                  "layers": {
                    "source": {"files": ["engine/annealer.py"], "critical": ["engine/core.py"],
                               "include": ["engine/solvers/**"]},
                    "config": {"include": ["config/*.json"]}
                  },
                  "kinds": {"bin/run-engine": "python"}
                }
                """);

        assertThat(config.layers()).containsOnlyKeys("config", "source");
        LayerDefinition source = config.layers().get("source");
        assertThat(source.files()).containsExactly("engine/annealer.py");
        assertThat(source.critical()).containsExactly("engine/core.py");
        assertThat(source.isCritical("engine/core.py")).isTrue();
        assertThat(source.selects("engine/solvers/sat.py")).isTrue();
        assertThat(source.selects("engine/core.py")).isTrue();
        assertThat(source.selects("config/engine.json")).isFalse();
        assertThat(config.declaredKind("bin/run-engine")).contains(FileKind.PYTHON);
    }

    @Test
    void shouldRejectUnknownFields() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> parse("{\"layers\": {\"source\": {\"files\": [], \"optional\": []}}}"));
    }

    @Test
    void shouldRejectMissingOrEmptyLayers() {
        assertThatIllegalArgumentException().isThrownBy(() -> parse("{}"));
        assertThatIllegalArgumentException().isThrownBy(() -> parse("{\"layers\": {}}"));
    }

    @Test
    void shouldRejectNonCanonicalPaths() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> parse("{\"layers\": {\"source\": {\"files\": [\"../outside.py\"]}}}"));
    }

    @Test
    void shouldRejectUnknownKinds() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> parse("{\"layers\": {\"s\": {}}, \"kinds\": {\"a\": \"cobol\"}}"));
    }
}
