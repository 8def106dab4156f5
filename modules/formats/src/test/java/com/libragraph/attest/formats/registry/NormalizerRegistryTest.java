package com.libragraph.attest.formats.registry;

import com.libragraph.attest.formats.api.CanonicalForm;
import com.libragraph.attest.formats.api.DetectionCriteria;
import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.handlers.JsonNormalizer;
import com.libragraph.attest.formats.handlers.PythonNormalizer;
import com.libragraph.attest.types.FileKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class NormalizerRegistryTest {

    private final NormalizerRegistry registry = NormalizerRegistry.withDefaults();

    @Test
    void shouldResolveByExtension() {
        assertThat(registry.findNormalizer(FileContext.of("engine/core.py")))
                .get().extracting(SemanticNormalizer::id).isEqualTo("python");
        assertThat(registry.findNormalizer(FileContext.of("config/engine.json")))
                .get().extracting(SemanticNormalizer::id).isEqualTo("json");
        assertThat(registry.findNormalizer(FileContext.of("config/app.properties")))
                .get().extracting(SemanticNormalizer::id).isEqualTo("properties");
    }

    @Test
    void shouldResolveByDeclaredKind() {
        assertThat(registry.findNormalizer(FileContext.of("bin/engine", FileKind.PYTHON)))
                .get().extracting(SemanticNormalizer::id).isEqualTo("python");
    }

    @Test
    void shouldReturnEmptyForUnsupportedKinds() {
        assertThat(registry.findNormalizer(FileContext.of("kernels/solver.cu"))).isEmpty();
        assertThat(registry.findNormalizer(FileContext.of("README"))).isEmpty();
    }

    @Test
    void shouldPreferHigherPriority() {
        NormalizerRegistry custom = new NormalizerRegistry(List.of(
                new PythonNormalizer(), new StrictPython()));

        assertThat(custom.findNormalizer(FileContext.of("a.py")))
                .get().extracting(SemanticNormalizer::id).isEqualTo("strict-python");
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new NormalizerRegistry(List.of(new JsonNormalizer(), new JsonNormalizer())))
                .withMessageContaining("json");
    }

    private static final class StrictPython implements SemanticNormalizer {
        @Override
        public String id() {
            return "strict-python";
        }

        @Override
        public String version() {
            return "1";
        }

        @Override
        public DetectionCriteria getDetectionCriteria() {
            return new DetectionCriteria(Set.of(FileKind.PYTHON), Set.of("py"), 200);
        }

        @Override
        public CanonicalForm normalize(byte[] content, FileContext context) {
            return new CanonicalForm(id(), version(), content);
        }
    }
}
