package com.libragraph.attest.types;

import java.util.Locale;

public enum FileKind {
    PYTHON(0, "python"),
    JSON(1, "json"),
    PROPERTIES(2, "properties"),
    UNKNOWN(3, "unknown");

    private final int id;
    private final String label;

    FileKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static FileKind fromId(int id) {
        for (FileKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown FileKind id: " + id);
    }

    /**
     * Resolves a kind by label or enum name, case-insensitively.
     */
    public static FileKind fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("FileKind label cannot be null");
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (FileKind k : values()) {
            if (k.label.equals(lower) || k.name().toLowerCase(Locale.ROOT).equals(lower)) {
                return k;
            }
        }
        throw new IllegalArgumentException("Unknown FileKind label: " + label);
    }
}
