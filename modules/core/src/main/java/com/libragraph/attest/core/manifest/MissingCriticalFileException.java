package com.libragraph.attest.core.manifest;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a file configured as critical for a layer is absent. Names every missing
 * (layer, path) pair, not just the first.
 */
public class MissingCriticalFileException extends RuntimeException {

    public record MissingFile(String layer, String path) {
        @Override
        public String toString() {
            return layer + ":" + path;
        }
    }

    private final List<MissingFile> missing;

    public MissingCriticalFileException(List<MissingFile> missing) {
        super("Missing critical files: " + missing.stream()
                .map(MissingFile::toString)
                .collect(Collectors.joining(", ")));
        this.missing = List.copyOf(missing);
    }

    public List<MissingFile> missing() {
        return missing;
    }
}
