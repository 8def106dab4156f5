package com.libragraph.attest.formats.api;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes the typed, length-prefixed encoding shared by all canonical forms.
 *
 * <p>Atoms are {@code <tag><utf8-length>:<utf8-bytes>}; groups are {@code <tag>( ... )}.
 * Tags are single ASCII characters chosen by each normalizer. Because every atom carries its
 * length, distinct trees always encode to distinct byte sequences.
 */
public final class CanonicalWriter {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private int depth;

    public CanonicalWriter open(char tag) {
        checkTag(tag);
        out.write(tag);
        out.write('(');
        depth++;
        return this;
    }

    public CanonicalWriter close() {
        if (depth == 0) {
            throw new IllegalStateException("close() without matching open()");
        }
        out.write(')');
        depth--;
        return this;
    }

    public CanonicalWriter atom(char tag, String text) {
        checkTag(tag);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        out.write(tag);
        out.writeBytes(Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII));
        out.write(':');
        out.writeBytes(bytes);
        return this;
    }

    public byte[] toByteArray() {
        if (depth != 0) {
            throw new IllegalStateException("Unclosed groups: " + depth);
        }
        return out.toByteArray();
    }

    private static void checkTag(char tag) {
        if (tag > 0x7F || !Character.isLetter(tag)) {
            throw new IllegalArgumentException("Tag must be an ASCII letter: " + tag);
        }
    }
}
