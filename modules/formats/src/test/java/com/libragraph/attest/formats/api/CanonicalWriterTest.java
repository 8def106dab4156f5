package com.libragraph.attest.formats.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class CanonicalWriterTest {

    @Test
    void shouldWriteLengthPrefixedAtomsInGroups() {
        byte[] bytes = new CanonicalWriter()
                .open('S')
                .atom('N', "x")
                .atom('O', "=")
                .atom('D', "10")
                .close()
                .toByteArray();

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("S(N1:xO1:=D2:10)");
    }

    @Test
    void shouldMeasureLengthInUtf8Bytes() {
        byte[] bytes = new CanonicalWriter().atom('Q', "é").toByteArray();

        assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("Q2:é");
    }

    @Test
    void shouldKeepAtomBoundariesDistinct() {
        byte[] split = new CanonicalWriter().atom('N', "ab").atom('N', "c").toByteArray();
        byte[] joined = new CanonicalWriter().atom('N', "a").atom('N', "bc").toByteArray();

        assertThat(split).isNotEqualTo(joined);
    }

    @Test
    void shouldRejectUnbalancedGroups() {
        assertThatIllegalStateException().isThrownBy(() -> new CanonicalWriter().close());
        assertThatIllegalStateException().isThrownBy(() -> new CanonicalWriter().open('B').toByteArray());
    }

    @Test
    void shouldRejectNonLetterTags() {
        assertThatIllegalArgumentException().isThrownBy(() -> new CanonicalWriter().atom('(', "x"));
    }
}
