package com.libragraph.attest.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class FileKindTest {

    @Test
    void shouldResolveByLabelOrName() {
        assertThat(FileKind.fromLabel("python")).isEqualTo(FileKind.PYTHON);
        assertThat(FileKind.fromLabel("JSON")).isEqualTo(FileKind.JSON);
        assertThat(FileKind.fromLabel("Properties")).isEqualTo(FileKind.PROPERTIES);
    }

    @Test
    void shouldRejectUnknownLabel() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> FileKind.fromLabel("cobol"))
                .withMessageContaining("cobol");
    }

    @Test
    void shouldRoundTripIds() {
        for (FileKind kind : FileKind.values()) {
            assertThat(FileKind.fromId(kind.id())).isEqualTo(kind);
        }
        for (FingerprintMode mode : FingerprintMode.values()) {
            assertThat(FingerprintMode.fromId(mode.id())).isEqualTo(mode);
        }
    }
}
