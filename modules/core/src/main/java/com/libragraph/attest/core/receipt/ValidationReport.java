package com.libragraph.attest.core.receipt;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome matrix from the external test harness.
 *
 * @param results problem class to pass/fail, for the classes that ran
 * @param skipped problem classes the harness could not evaluate, sorted
 */
public record ValidationReport(SortedMap<String, Boolean> results, List<String> skipped) {

    public ValidationReport {
        results = Collections.unmodifiableSortedMap(new TreeMap<>(results));
        skipped = skipped.stream().sorted().toList();
    }
}
