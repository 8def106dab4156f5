package com.libragraph.attest.core.receipt;

import com.libragraph.attest.util.ContentHash;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Public summary of one certification run. The field list is closed: engine identity,
 * validation outcome per problem class, the master fingerprint with its algorithm version,
 * a millisecond-precision UTC timestamp, and the content hash over all of those.
 *
 * <p>The record does not check its own content hash; a tampered receipt can be held and
 * verified. See {@link ReceiptGenerator#isSelfConsistent}.
 */
public record CertificationReceipt(
        EngineIdentity engine,
        SortedMap<String, Boolean> validation,
        ContentHash masterFingerprint,
        String algorithmVersion,
        Instant timestamp,
        ContentHash contentHash
) {

    private static final Pattern PROBLEM_CLASS = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:/-]{0,127}");
    private static final Pattern ALGORITHM_VERSION = Pattern.compile("[A-Za-z0-9][A-Za-z0-9./+_-]{0,63}");

    public CertificationReceipt {
        Objects.requireNonNull(engine, "engine cannot be null");
        Objects.requireNonNull(masterFingerprint, "masterFingerprint cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(contentHash, "contentHash cannot be null");
        validation = checkValidation(validation);
        checkAlgorithmVersion(algorithmVersion);
        checkTimestamp(timestamp);
    }

    /** True when at least one problem class was validated and all of them passed. */
    public boolean allPassed() {
        return !validation.isEmpty() && validation.values().stream().allMatch(Boolean::booleanValue);
    }

    static SortedMap<String, Boolean> checkValidation(Map<String, Boolean> validation) {
        Objects.requireNonNull(validation, "validation cannot be null");
        if (validation.isEmpty()) {
            throw new IllegalArgumentException("validation results cannot be empty");
        }
        TreeMap<String, Boolean> sorted = new TreeMap<>();
        validation.forEach((problemClass, passed) -> {
            if (problemClass == null || !PROBLEM_CLASS.matcher(problemClass).matches()) {
                throw new IllegalArgumentException("Invalid problem class: '" + problemClass + "'");
            }
            if (passed == null) {
                throw new IllegalArgumentException("No outcome for problem class: " + problemClass);
            }
            sorted.put(problemClass, passed);
        });
        return Collections.unmodifiableSortedMap(sorted);
    }

    static void checkAlgorithmVersion(String algorithmVersion) {
        if (algorithmVersion == null || !ALGORITHM_VERSION.matcher(algorithmVersion).matches()) {
            throw new IllegalArgumentException("Invalid algorithm version: '" + algorithmVersion + "'");
        }
    }

    static void checkTimestamp(Instant timestamp) {
        if (timestamp.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException("Receipt timestamp must have millisecond precision: " + timestamp);
        }
    }
}
