package com.libragraph.attest.core.receipt;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ValidationReportReaderTest {

    private static ValidationReport parse(String json) {
        return ValidationReportReader.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void shouldReadOutcomeMap() {
        ValidationReport report = parse("{\"sat\": true, \"ising\": false}");

        assertThat(report.results()).containsExactly(
                entry("ising", false), entry("sat", true));
        assertThat(report.skipped()).isEmpty();
    }

    @Test
    void shouldReadClaimListAndExcludeSkippedClaims() {
        ValidationReport report = parse("""
                [
                  {"claim_id": "sat-001", "verified": true, "problem_type": "sat"},
                  {"claim_id": "ising-002", "verified": false, "error": "energy above bound"},
                  {"claim_id": "million-spin", "verified": null, "note": "live demo"},
                  {"claim_id": "maxcut-003", "verified": null, "error": "API not reachable"}
                ]
                """);

        assertThat(report.results()).containsExactly(
                entry("ising-002", false), entry("sat-001", true));
        assertThat(report.skipped()).containsExactly("maxcut-003", "million-spin");
    }

    @Test
    void shouldRejectDuplicateClaims() {
        assertThatIllegalArgumentException().isThrownBy(() -> parse(
                "[{\"claim_id\": \"a\", \"verified\": true}, {\"claim_id\": \"a\", \"verified\": false}]"));
    }

    @Test
    void shouldRejectMalformedReports() {
        assertThatIllegalArgumentException().isThrownBy(() -> parse("{\"sat\": \"yes\"}"));
        assertThatIllegalArgumentException().isThrownBy(() -> parse("[{\"verified\": true}]"));
        assertThatIllegalArgumentException().isThrownBy(() -> parse("42"));
        assertThatIllegalArgumentException().isThrownBy(() -> parse("{"));
    }
}
