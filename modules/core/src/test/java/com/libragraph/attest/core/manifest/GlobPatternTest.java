package com.libragraph.attest.core.manifest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GlobPatternTest {

    @Test
    void shouldMatchWithinOneSegment() {
        GlobPattern glob = GlobPattern.compile("config/*.json");

        assertThat(glob.matches("config/engine.json")).isTrue();
        assertThat(glob.matches("config/nested/engine.json")).isFalse();
        assertThat(glob.matches("config/engine.jsonc")).isFalse();
    }

    @Test
    void shouldMatchAcrossSegments() {
        GlobPattern glob = GlobPattern.compile("engine/**/*.py");

        assertThat(glob.matches("engine/core.py")).isTrue();
        assertThat(glob.matches("engine/solvers/sat/dpll.py")).isTrue();
        assertThat(glob.matches("tools/core.py")).isFalse();
    }

    @Test
    void shouldMatchTrailingDoubleStar() {
        GlobPattern glob = GlobPattern.compile("engine/**");

        assertThat(glob.matches("engine/a/b/c.txt")).isTrue();
        assertThat(glob.matches("engineering/a.py")).isFalse();
    }

    @Test
    void shouldMatchSingleCharacter() {
        GlobPattern glob = GlobPattern.compile("data/v?.bin");

        assertThat(glob.matches("data/v1.bin")).isTrue();
        assertThat(glob.matches("data/v10.bin")).isFalse();
        assertThat(glob.matches("data/v/.bin")).isFalse();
    }

    @Test
    void shouldTreatRegexCharactersLiterally() {
        GlobPattern glob = GlobPattern.compile("a+b(1).py");

        assertThat(glob.matches("a+b(1).py")).isTrue();
        assertThat(glob.matches("aab(1)xpy")).isFalse();
    }

    @Test
    void shouldRejectAbsoluteGlobs() {
        assertThatIllegalArgumentException().isThrownBy(() -> GlobPattern.compile("/engine/*.py"));
        assertThatIllegalArgumentException().isThrownBy(() -> GlobPattern.compile(""));
    }
}
