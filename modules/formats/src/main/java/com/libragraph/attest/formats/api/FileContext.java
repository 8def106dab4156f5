package com.libragraph.attest.formats.api;

import com.libragraph.attest.types.FileKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Context information about a file being normalized.
 *
 * @param path         canonical, {@code /}-separated path of the file
 * @param declaredKind kind declared by configuration, if any
 */
public record FileContext(
        String path,
        Optional<FileKind> declaredKind
) {
    public FileContext {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(declaredKind, "declaredKind cannot be null");
    }

    public static FileContext of(String path) {
        return new FileContext(path, Optional.empty());
    }

    public static FileContext of(String path, FileKind declaredKind) {
        return new FileContext(path, Optional.ofNullable(declaredKind));
    }

    public String filename() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
