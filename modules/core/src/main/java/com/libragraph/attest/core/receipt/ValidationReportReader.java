package com.libragraph.attest.core.receipt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.core.storage.StoreException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads a test harness report in either of two shapes:
 * <ul>
 *   <li>an object mapping problem class to {@code true}/{@code false}</li>
 *   <li>a claim list {@code [{"claim_id": "..", "verified": true|false|null, ...}]}, where
 *       {@code null} marks a skipped claim and other members are ignored</li>
 * </ul>
 */
public final class ValidationReportReader {

    private static final Logger log = Logger.getLogger(ValidationReportReader.class);
    private static final ObjectMapper MAPPER = AttestJson.newMapper();

    private ValidationReportReader() {
    }

    public static ValidationReport load(Path path) {
        try {
            return parse(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StoreException("Failed to read validation report: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the report is malformed or names a class twice
     */
    public static ValidationReport parse(byte[] json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid validation report: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("Invalid validation report: empty document");
        }

        Map<String, Boolean> results = new TreeMap<>();
        List<String> skipped = new ArrayList<>();
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                record(field.getKey(), field.getValue(), results, skipped);
            }
        } else if (root.isArray()) {
            for (JsonNode claim : root) {
                JsonNode id = claim.get("claim_id");
                if (id == null || !id.isTextual()) {
                    throw new IllegalArgumentException("Invalid validation report: claim without claim_id");
                }
                record(id.textValue(), claim.get("verified"), results, skipped);
            }
        } else {
            throw new IllegalArgumentException("Invalid validation report: expected an object or a list");
        }

        if (!skipped.isEmpty()) {
            log.warnf("Validation report skipped %d problem classes: %s", skipped.size(), skipped);
        }
        return new ValidationReport(new TreeMap<>(results), skipped);
    }

    private static void record(String problemClass, JsonNode outcome,
                               Map<String, Boolean> results, List<String> skipped) {
        if (results.containsKey(problemClass) || skipped.contains(problemClass)) {
            throw new IllegalArgumentException("Problem class reported twice: " + problemClass);
        }
        if (outcome == null || outcome.isNull()) {
            skipped.add(problemClass);
        } else if (outcome.isBoolean()) {
            results.put(problemClass, outcome.booleanValue());
        } else {
            throw new IllegalArgumentException("Outcome for " + problemClass + " is not a boolean");
        }
    }
}
