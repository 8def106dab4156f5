package com.libragraph.attest.formats.api;

import com.libragraph.attest.types.FileKind;

import java.util.Locale;
import java.util.Set;

/**
 * Criteria for detecting when a normalizer should be used.
 *
 * @param kinds      declared file kinds this normalizer handles
 * @param extensions file extensions without dot (e.g., "py", "json")
 * @param priority   higher priority wins on conflict
 */
public record DetectionCriteria(
        Set<FileKind> kinds,
        Set<String> extensions,
        int priority
) {
    public DetectionCriteria {
        kinds = Set.copyOf(kinds);
        extensions = Set.copyOf(extensions);
    }

    /**
     * Checks if this criteria matches the given file.
     * A declared kind is authoritative: when present, the extension is not consulted.
     */
    public boolean matches(FileKind declaredKind, String filename) {
        if (declaredKind != null && declaredKind != FileKind.UNKNOWN) {
            return kinds.contains(declaredKind);
        }

        if (filename != null) {
            int dotIndex = filename.lastIndexOf('.');
            if (dotIndex > 0) {
                String ext = filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
                return extensions.contains(ext);
            }
        }

        return false;
    }
}
