package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.Fixtures;
import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.types.FingerprintMode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.libragraph.attest.core.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

class ManifestBuilderTest {

    private final ManifestBuilder builder = Fixtures.manifestBuilder();

    @Test
    void shouldBuildConfiguredLayer() {
        Manifest manifest = builder.build(sourceLayer(), abc());

        assertThat(manifest.algorithmVersion()).isEqualTo(IntegrityAlgorithm.VERSION);
        assertThat(manifest.layerHashes()).containsOnlyKeys("source");
        assertThat(manifest.layerMembers().get("source")).containsExactly(A_PATH, B_PATH, C_PATH);
        assertThat(manifest.fingerprints()).extracting(FileFingerprint::path)
                .containsExactly(A_PATH, B_PATH, C_PATH);
        assertThat(manifest.fingerprints()).allMatch(f -> f.mode() == FingerprintMode.SEMANTIC);
        assertThat(manifest.missingFiles()).isEmpty();
    }

    @Test
    void shouldFailWhenCriticalFileMissing() {
        Throwable thrown = catchThrowable(() -> builder.build(sourceLayer(), without(abc(), B_PATH)));

        assertThat(thrown)
                .isInstanceOf(MissingCriticalFileException.class)
                .hasMessageContaining("source:" + B_PATH);
        assertThat(((MissingCriticalFileException) thrown).missing())
                .containsExactly(new MissingCriticalFileException.MissingFile("source", B_PATH));
    }

    @Test
    void shouldNameEveryMissingCriticalFile() {
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of(), List.of(A_PATH, B_PATH), List.of()),
                new LayerDefinition("config", List.of(), List.of("config/engine.json"), List.of())));

        Throwable thrown = catchThrowable(() -> builder.build(config, List.of(file(C_PATH, C))));

        assertThat(thrown).isInstanceOf(MissingCriticalFileException.class);
        assertThat(((MissingCriticalFileException) thrown).missing())
                .extracting(MissingCriticalFileException.MissingFile::layer)
                .containsExactly("config", "source", "source");
    }

    @Test
    void shouldRecordMissingNonCriticalFiles() {
        Manifest manifest = builder.build(sourceLayer(), without(abc(), C_PATH));

        assertThat(manifest.missingFiles()).containsExactly(C_PATH);
        assertThat(manifest.layerMembers().get("source")).containsExactly(A_PATH, B_PATH);
    }

    @Test
    void shouldBeIndependentOfDiscoveryOrder() {
        List<SourceFile> files = new ArrayList<>(abc());
        for (int i = 0; i < 20; i++) {
            files.add(file("engine/solvers/s" + i + ".py", "WEIGHT = " + i + "\n"));
        }
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of(A_PATH, C_PATH), List.of(B_PATH), List.of()),
                new LayerDefinition("solvers", List.of(), List.of(), List.of("engine/solvers/*.py"))));
        Manifest expected = builder.build(config, files);

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            List<SourceFile> shuffled = new ArrayList<>(files);
            Collections.shuffle(shuffled, random);
            assertThat(builder.build(config, shuffled)).isEqualTo(expected);
        }
    }

    @Test
    void shouldBeIndependentOfLayerOrder() {
        LayerDefinition source = new LayerDefinition("source", List.of(A_PATH), List.of(B_PATH), List.of());
        LayerDefinition params = new LayerDefinition("params", List.of(C_PATH), List.of(), List.of());

        Manifest forward = builder.build(LayerConfig.of(List.of(source, params)), abc());
        Manifest reverse = builder.build(LayerConfig.of(List.of(params, source)), abc());

        assertThat(reverse.layerHashes()).isEqualTo(forward.layerHashes());
    }

    @Test
    void shouldIncludeGlobMatchesAndFileTags() {
        List<SourceFile> files = new ArrayList<>(abc());
        files.add(file("engine/solvers/sat.py", "MODE = 'dpll'\n"));
        files.add(new SourceFile("tools/tagged.py", "x = 1\n".getBytes(StandardCharsets.UTF_8),
                null, Set.of("source")));
        files.add(file("docs/notes.txt", "not in any layer"));
        LayerConfig config = LayerConfig.of(List.of(new LayerDefinition(
                "source", List.of(A_PATH, C_PATH), List.of(B_PATH), List.of("engine/solvers/**"))));

        Manifest manifest = builder.build(config, files);

        assertThat(manifest.layerMembers().get("source"))
                .containsExactly(A_PATH, B_PATH, C_PATH, "engine/solvers/sat.py", "tools/tagged.py");
        assertThat(manifest.fingerprint("docs/notes.txt")).isEmpty();
    }

    @Test
    void shouldHashEmptyLayers() {
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of(A_PATH, C_PATH), List.of(B_PATH), List.of()),
                new LayerDefinition("kernels", List.of(), List.of(), List.of("kernels/**"))));

        Manifest manifest = builder.build(config, abc());

        assertThat(manifest.layerMembers().get("kernels")).isEmpty();
        assertThat(manifest.layerHashes().get("kernels")).isNotNull();
    }

    @Test
    void shouldBindLayerHashToPaths() {
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of(), List.of(), List.of("engine/**"))));

        Manifest original = builder.build(config, List.of(file("engine/a.py", B)));
        Manifest renamed = builder.build(config, List.of(file("engine/b.py", B)));

        assertThat(renamed.layerHashes().get("source")).isNotEqualTo(original.layerHashes().get("source"));
    }

    @Test
    void shouldAssembleFromFingerprintsInAnyOrder() {
        List<FileFingerprint> fingerprints = new ArrayList<>(builder.fingerprintAll(sourceLayer(), abc()));
        Manifest expected = builder.assemble(sourceLayer(), abc(), fingerprints);

        Collections.reverse(fingerprints);

        assertThat(builder.assemble(sourceLayer(), abc(), fingerprints)).isEqualTo(expected);
    }

    @Test
    void shouldRejectDuplicatePaths() {
        List<SourceFile> files = new ArrayList<>(abc());
        files.add(file(A_PATH, "x = 2\n"));

        assertThatIllegalArgumentException()
                .isThrownBy(() -> builder.build(sourceLayer(), files))
                .withMessageContaining(A_PATH);
    }

    @Test
    void shouldRejectTagsForUnconfiguredLayers() {
        List<SourceFile> files = new ArrayList<>(abc());
        files.add(new SourceFile("x.py", new byte[0], null, Set.of("gpu")));

        assertThatIllegalArgumentException()
                .isThrownBy(() -> builder.build(sourceLayer(), files))
                .withMessageContaining("gpu");
    }
}
