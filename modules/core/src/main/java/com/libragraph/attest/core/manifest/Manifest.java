package com.libragraph.attest.core.manifest;

import com.libragraph.attest.core.fingerprint.FileFingerprint;
import com.libragraph.attest.util.ContentHash;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable result of one manifest build.
 *
 * @param layerHashes  layer name to layer hash, for exactly the configured layers
 * @param layerMembers layer name to sorted member paths
 * @param fingerprints every file fingerprint the layers were built from, sorted by path
 * @param missingFiles configured non-critical files that were absent, sorted
 */
public record Manifest(
        String algorithmVersion,
        SortedMap<String, ContentHash> layerHashes,
        SortedMap<String, List<String>> layerMembers,
        List<FileFingerprint> fingerprints,
        List<String> missingFiles
) {

    public Manifest {
        Objects.requireNonNull(algorithmVersion, "algorithmVersion cannot be null");
        layerHashes = Collections.unmodifiableSortedMap(new TreeMap<>((Map<String, ContentHash>) layerHashes));
        TreeMap<String, List<String>> members = new TreeMap<>();
        layerMembers.forEach((layer, paths) -> members.put(layer, paths.stream().sorted().toList()));
        layerMembers = Collections.unmodifiableSortedMap(members);
        if (!layerHashes.keySet().equals(layerMembers.keySet())) {
            throw new IllegalArgumentException("layer hashes and members name different layers");
        }

        List<FileFingerprint> sorted = new ArrayList<>(fingerprints);
        sorted.sort(Comparator.comparing(FileFingerprint::path));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).path().equals(sorted.get(i - 1).path())) {
                throw new IllegalArgumentException("Duplicate fingerprint for " + sorted.get(i).path());
            }
        }
        fingerprints = List.copyOf(sorted);
        missingFiles = missingFiles.stream().distinct().sorted().toList();
    }

    public Optional<FileFingerprint> fingerprint(String path) {
        return fingerprints.stream().filter(f -> f.path().equals(path)).findFirst();
    }

    /** Files hashed by raw bytes, whatever the reason. */
    public List<FileFingerprint> fallbacks() {
        return fingerprints.stream().filter(FileFingerprint::isFallback).toList();
    }
}
