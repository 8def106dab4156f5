package com.libragraph.attest.core.receipt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Canonical serialization of a receipt without its content hash: compact UTF-8 JSON with
 * every object's keys in sorted order.
 *
 * <pre>{@code
 * {"engine":{"name":"..","version":".."},
 *  "integrity":{"algorithm_version":"..","master_fingerprint":"<hex>"},
 *  "timestamp":"<ISO-8601 UTC>",
 *  "validation":{"<problem class>":true}}
 * }</pre>
 *
 * Any implementation producing the same bytes from the same field values computes the same
 * content hash.
 */
public final class ReceiptCanonicalizer {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private ReceiptCanonicalizer() {
    }

    public static byte[] canonicalize(CertificationReceipt receipt) {
        return canonicalize(receipt.engine(), receipt.validation(), receipt.masterFingerprint(),
                receipt.algorithmVersion(), receipt.timestamp());
    }

    public static byte[] canonicalize(EngineIdentity engine, SortedMap<String, Boolean> validation,
                                      ContentHash masterFingerprint, String algorithmVersion,
                                      Instant timestamp) {
        Map<String, Object> root = new TreeMap<>();
        root.put("engine", new TreeMap<>(Map.of(
                "name", engine.name(),
                "version", engine.version())));
        root.put("integrity", new TreeMap<>(Map.of(
                "algorithm_version", algorithmVersion,
                "master_fingerprint", masterFingerprint.toHex())));
        root.put("timestamp", formatTimestamp(timestamp));
        root.put("validation", new TreeMap<>(validation));
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize receipt", e);
        }
    }

    static String formatTimestamp(Instant timestamp) {
        return DateTimeFormatter.ISO_INSTANT.format(timestamp);
    }
}
