package com.libragraph.attest.core.receipt;

import com.libragraph.attest.core.Fixtures;
import com.libragraph.attest.core.manifest.MasterFingerprint;
import com.libragraph.attest.util.ContentHash;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

class ReceiptGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.123456789Z");

    private final ReceiptGenerator generator = new ReceiptGenerator(Clock.fixed(NOW, ZoneOffset.UTC));
    private final MasterFingerprint master = Fixtures.master(Fixtures.sourceLayer(), Fixtures.abc());

    private CertificationReceipt receipt() {
        return generator.generate(Fixtures.ENGINE, Map.of("sat", true, "ising", true, "maxcut", false), master);
    }

    @Test
    void shouldBuildSelfConsistentReceipt() {
        CertificationReceipt receipt = receipt();

        assertThat(receipt.timestamp()).isEqualTo(Instant.parse("2026-03-01T12:00:00.123Z"));
        assertThat(receipt.masterFingerprint()).isEqualTo(master.aggregate());
        assertThat(receipt.algorithmVersion()).isEqualTo(master.algorithmVersion());
        assertThat(receipt.validation().keySet()).containsExactly("ising", "maxcut", "sat");
        assertThat(receipt.allPassed()).isFalse();
        assertThat(ReceiptGenerator.isSelfConsistent(receipt)).isTrue();
    }

    @Test
    void shouldSerializeCanonically() {
        CertificationReceipt receipt = receipt();

        String canonical = new String(ReceiptCanonicalizer.canonicalize(receipt), StandardCharsets.UTF_8);

        assertThat(canonical).isEqualTo("{\"engine\":{\"name\":\"ising-engine\",\"version\":\"2.1.0\"},"
                + "\"integrity\":{\"algorithm_version\":\"" + master.algorithmVersion() + "\","
                + "\"master_fingerprint\":\"" + master.toHex() + "\"},"
                + "\"timestamp\":\"2026-03-01T12:00:00.123Z\","
                + "\"validation\":{\"ising\":true,\"maxcut\":false,\"sat\":true}}");
        assertThat(canonical).doesNotContain("content_hash");
        assertThat(receipt.contentHash()).isEqualTo(ContentHash.digest(canonical.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void shouldNotDependOnValidationOrder() {
        Map<String, Boolean> forward = new LinkedHashMap<>();
        forward.put("a", true);
        forward.put("b", false);
        Map<String, Boolean> reverse = new LinkedHashMap<>();
        reverse.put("b", false);
        reverse.put("a", true);

        assertThat(generator.generate(Fixtures.ENGINE, reverse, master).contentHash())
                .isEqualTo(generator.generate(Fixtures.ENGINE, forward, master).contentHash());
    }

    @Test
    void shouldDetectTamperingWithAnySingleField() {
        CertificationReceipt r = receipt();
        TreeMap<String, Boolean> flipped = new TreeMap<>(r.validation());
        flipped.put("maxcut", true);
        TreeMap<String, Boolean> added = new TreeMap<>(r.validation());
        added.put("tsp", true);
        TreeMap<String, Boolean> removed = new TreeMap<>(r.validation());
        removed.remove("maxcut");

        CertificationReceipt[] tampered = {
                new CertificationReceipt(new EngineIdentity("other-engine", "2.1.0"), r.validation(),
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(new EngineIdentity("ising-engine", "2.1.1"), r.validation(),
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), flipped,
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), added,
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), removed,
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), r.validation(),
                        ContentHash.digest(new byte[1]), r.algorithmVersion(), r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), r.validation(),
                        r.masterFingerprint(), "blake3-256/layered-v2", r.timestamp(), r.contentHash()),
                new CertificationReceipt(r.engine(), r.validation(),
                        r.masterFingerprint(), r.algorithmVersion(), r.timestamp().plusMillis(1), r.contentHash()),
        };

        for (CertificationReceipt t : tampered) {
            assertThat(ReceiptGenerator.recomputeContentHash(t)).isNotEqualTo(r.contentHash());
            assertThat(ReceiptGenerator.isSelfConsistent(t)).isFalse();
        }
    }

    @Test
    void shouldRejectEmptyOrInvalidValidation() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> generator.generate(Fixtures.ENGINE, Map.of(), master));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> generator.generate(Fixtures.ENGINE, Map.of("energy=-1234.5 params", true), master));
    }

    @Test
    void shouldRejectFreeFormEngineIdentity() {
        assertThatIllegalArgumentException().isThrownBy(() -> new EngineIdentity("engine\nwith secrets", "1"));
        assertThatIllegalArgumentException().isThrownBy(() -> new EngineIdentity("engine", ""));
    }

    @Test
    void shouldRejectSubMillisecondTimestamps() {
        CertificationReceipt r = receipt();

        assertThatIllegalArgumentException().isThrownBy(() -> new CertificationReceipt(r.engine(),
                r.validation(), r.masterFingerprint(), r.algorithmVersion(), NOW, r.contentHash()));
    }
}
