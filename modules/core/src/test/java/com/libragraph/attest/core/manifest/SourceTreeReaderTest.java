package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.types.FileKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class SourceTreeReaderTest {

    @TempDir
    Path root;

    private final SourceTreeReader reader = new SourceTreeReader();

    private void write(String path, String content) throws IOException {
        Path file = root.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void shouldReadSelectedFilesWithCanonicalPaths() throws IOException {
        write("engine/core.py", "x = 1\n");
        write("engine/solvers/sat.py", "y = 2\n");
        write("config/engine.json", "{}");
        write("docs/README.md", "ignored");
        write("bin/run-engine", "main()\n");
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of("bin/run-engine"), List.of("engine/core.py"),
                        List.of("engine/**/*.py")),
                new LayerDefinition("config", List.of(), List.of(), List.of("config/*.json"))),
                Map.of("bin/run-engine", FileKind.PYTHON));

        List<SourceFile> files = reader.read(root, config);

        assertThat(files).extracting(SourceFile::path)
                .containsExactly("bin/run-engine", "config/engine.json", "engine/core.py", "engine/solvers/sat.py");
        SourceFile script = files.get(0);
        assertThat(script.declaredKind()).isEqualTo(FileKind.PYTHON);
        assertThat(script.layers()).containsExactly("source");
        assertThat(new String(files.get(2).content(), StandardCharsets.UTF_8)).isEqualTo("x = 1\n");
        assertThat(files.get(1).layers()).containsExactly("config");
    }

    @Test
    void shouldSkipAbsentConfiguredFiles() throws IOException {
        write("engine/a.py", "a = 1\n");
        LayerConfig config = LayerConfig.of(List.of(
                new LayerDefinition("source", List.of("engine/a.py", "engine/gone.py"), List.of(), List.of())));

        assertThat(reader.read(root, config)).extracting(SourceFile::path).containsExactly("engine/a.py");
    }

    @Test
    void shouldFailForMissingRoot() {
        LayerConfig config = LayerConfig.of(List.of(new LayerDefinition("s", List.of(), List.of(), List.of("**"))));

        assertThatThrownBy(() -> reader.read(root.resolve("nope"), config))
                .isInstanceOf(StoreException.class);
    }
}
