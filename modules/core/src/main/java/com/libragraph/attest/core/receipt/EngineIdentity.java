package com.libragraph.attest.core.receipt;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Public identity of the certified engine. Both parts are short printable tokens, so no
 * free-form text can travel in a receipt.
 */
public record EngineIdentity(String name, String version) {

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,63}");
    private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9][A-Za-z0-9.+_-]{0,63}");

    public EngineIdentity {
        Objects.requireNonNull(name, "engine name cannot be null");
        Objects.requireNonNull(version, "engine version cannot be null");
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid engine name: '" + name + "'");
        }
        if (!VERSION.matcher(version).matches()) {
            throw new IllegalArgumentException("Invalid engine version: '" + version + "'");
        }
    }
}
