package com.libragraph.attest;

import com.libragraph.attest.core.baseline.Baseline;
import com.libragraph.attest.core.fingerprint.SourceFile;
import com.libragraph.attest.core.ledger.InMemoryLedgerClient;
import com.libragraph.attest.core.ledger.LedgerClient;
import com.libragraph.attest.core.pipeline.CertificationRequest;
import com.libragraph.attest.core.pipeline.CertificationRun;
import com.libragraph.attest.core.pipeline.CertificationService;
import com.libragraph.attest.core.pipeline.PipelineStage;
import com.libragraph.attest.core.pipeline.SourceSnapshot;
import com.libragraph.attest.core.receipt.ValidationReport;
import com.libragraph.attest.core.verify.LedgerVerificationStatus;
import com.libragraph.attest.core.verify.LocalVerificationStatus;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class CertificationFlowTest {

    @Inject
    CertificationService certification;

    @Inject
    LedgerClient ledgerClient;

    @Test
    void selectsConfiguredLedger() {
        assertThat(ledgerClient).isInstanceOf(InMemoryLedgerClient.class);
    }

    @Test
    void readsConfiguredSourceTree() {
        SourceSnapshot source = certification.configuredSource();

        assertThat(source.config().layers()).containsOnlyKeys("config", "source");
        assertThat(source.files()).extracting(SourceFile::path).containsExactly(
                "config/engine.json",
                "engine/annealer.py",
                "engine/core.py",
                "engine/params.py",
                "engine/solvers/sat.py");
    }

    @Test
    void computeVerifyCertifyAndConfirm() {
        SourceSnapshot source = certification.configuredSource();
        Baseline baseline = certification.compute("flow", source);

        assertThat(certification.verify("flow", source).status()).isEqualTo(LocalVerificationStatus.MATCH);

        CertificationRun run = certification.certify(new CertificationRequest("flow",
                certification.settings().engine(),
                new ValidationReport(new TreeMap<>(Map.of("sat", true)), List.of()),
                source));

        assertThat(run.stage()).isEqualTo(PipelineStage.VERIFIABLE);
        assertThat(run.receipt().orElseThrow().masterFingerprint()).isEqualTo(baseline.master().aggregate());
        assertThat(certification.verifyReceipt(run.receipt().orElseThrow(),
                run.anchor().orElseThrow().transactionId()).status())
                .isEqualTo(LedgerVerificationStatus.AUTHENTIC);
    }
}
