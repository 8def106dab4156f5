package com.libragraph.attest.core.fingerprint;

import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.types.FileKind;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One file of the engine source as read for a fingerprinting run.
 *
 * <p>The path is the layer-independent identifier: relative, {@code /}-separated, with no
 * empty, {@code .} or {@code ..} segments. Content is copied on the way in and out, so a
 * file cannot change during a run.
 *
 * @param declaredKind file kind declared by configuration, or {@code null} to detect by extension
 * @param layers       layer tags declared on the file itself, in addition to the layer configuration
 */
public record SourceFile(String path, byte[] content, FileKind declaredKind, Set<String> layers) {

    public SourceFile {
        requireCanonicalPath(path);
        Objects.requireNonNull(content, "content cannot be null");
        content = Arrays.copyOf(content, content.length);
        layers = layers == null ? Set.of() : Set.copyOf(layers);
    }

    public static SourceFile of(String path, byte[] content) {
        return new SourceFile(path, content, null, Set.of());
    }

    @Override
    public byte[] content() {
        return Arrays.copyOf(content, content.length);
    }

    public int size() {
        return content.length;
    }

    public FileContext context() {
        return new FileContext(path, Optional.ofNullable(declaredKind));
    }

    /**
     * Validates a canonical source path.
     *
     * @throws IllegalArgumentException if the path is not canonical
     */
    public static String requireCanonicalPath(String path) {
        Objects.requireNonNull(path, "path cannot be null");
        if (path.isEmpty() || path.startsWith("/") || path.indexOf('\\') >= 0) {
            throw new IllegalArgumentException("Not a canonical relative path: '" + path + "'");
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Not a canonical relative path: '" + path + "'");
            }
        }
        return path;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SourceFile other)) return false;
        return path.equals(other.path)
                && Arrays.equals(content, other.content)
                && declaredKind == other.declaredKind
                && layers.equals(other.layers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, Arrays.hashCode(content), declaredKind, layers);
    }

    @Override
    public String toString() {
        return "SourceFile[" + path + ", " + content.length + " bytes]";
    }
}
