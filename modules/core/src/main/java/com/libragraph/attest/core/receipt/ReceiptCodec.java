package com.libragraph.attest.core.receipt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.util.ContentHash;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads and writes the published receipt record:
 * {@code {content_hash, engine:{name,version}, integrity:{algorithm_version, master_fingerprint},
 * timestamp, validation:{..}}}.
 *
 * <p>Reading rejects unknown and missing fields but does not check the content hash, so
 * tampered receipts can still be loaded and verified.
 */
public final class ReceiptCodec {

    private static final ObjectMapper MAPPER = AttestJson.newMapper();
    private static final ObjectMapper PRETTY = AttestJson.newMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReceiptCodec() {
    }

    public static byte[] write(CertificationReceipt receipt) {
        try {
            return PRETTY.writeValueAsBytes(toRecord(receipt));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize receipt " + receipt.contentHash(), e);
        }
    }

    /**
     * @throws IllegalArgumentException if the document is not a well-formed receipt record
     */
    public static CertificationReceipt read(byte[] json) {
        try {
            return fromRecord(MAPPER.readValue(json, ReceiptRecord.class));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid receipt: " + e.getMessage(), e);
        }
    }

    public static ReceiptRecord toRecord(CertificationReceipt receipt) {
        return new ReceiptRecord(
                receipt.contentHash(),
                new EngineRecord(receipt.engine().name(), receipt.engine().version()),
                new IntegrityRecord(receipt.algorithmVersion(), receipt.masterFingerprint()),
                ReceiptCanonicalizer.formatTimestamp(receipt.timestamp()),
                receipt.validation());
    }

    /**
     * @throws IllegalArgumentException if a field is missing or invalid
     */
    public static CertificationReceipt fromRecord(ReceiptRecord record) {
        if (record.engine() == null || record.integrity() == null || record.timestamp() == null
                || record.contentHash() == null || record.validation() == null) {
            throw new IllegalArgumentException("Invalid receipt: missing field");
        }
        Instant timestamp;
        try {
            timestamp = Instant.parse(record.timestamp());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid receipt timestamp: " + record.timestamp(), e);
        }
        if (record.integrity().masterFingerprint() == null) {
            throw new IllegalArgumentException("Invalid receipt: missing master_fingerprint");
        }
        return new CertificationReceipt(
                new EngineIdentity(record.engine().name(), record.engine().version()),
                new TreeMap<>(record.validation()),
                record.integrity().masterFingerprint(),
                record.integrity().algorithmVersion(),
                timestamp,
                record.contentHash());
    }

    @JsonPropertyOrder(alphabetic = true)
    public record ReceiptRecord(
            @JsonProperty("content_hash") ContentHash contentHash,
            @JsonProperty("engine") EngineRecord engine,
            @JsonProperty("integrity") IntegrityRecord integrity,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("validation") Map<String, Boolean> validation
    ) {}

    @JsonPropertyOrder(alphabetic = true)
    public record EngineRecord(
            @JsonProperty("name") String name,
            @JsonProperty("version") String version
    ) {}

    @JsonPropertyOrder(alphabetic = true)
    public record IntegrityRecord(
            @JsonProperty("algorithm_version") String algorithmVersion,
            @JsonProperty("master_fingerprint") ContentHash masterFingerprint
    ) {}
}
