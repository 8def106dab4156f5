package com.libragraph.attest.core.fingerprint;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class SourceFileTest {

    @Test
    void shouldAcceptCanonicalPaths() {
        assertThat(SourceFile.requireCanonicalPath("engine/core.py")).isEqualTo("engine/core.py");
        assertThat(SourceFile.requireCanonicalPath("README")).isEqualTo("README");
    }

    @Test
    void shouldRejectNonCanonicalPaths() {
        for (String path : new String[]{"", "/etc/passwd", "engine/../secret.py", "./a.py",
                "engine//core.py", "engine\\core.py", "engine/"}) {
            assertThatIllegalArgumentException()
                    .isThrownBy(() -> SourceFile.requireCanonicalPath(path));
        }
    }

    @Test
    void shouldCopyContent() {
        byte[] content = "x = 1\n".getBytes(StandardCharsets.UTF_8);
        SourceFile file = SourceFile.of("a.py", content);

        content[0] = 'y';
        file.content()[0] = 'z';

        assertThat(new String(file.content(), StandardCharsets.UTF_8)).isEqualTo("x = 1\n");
    }
}
