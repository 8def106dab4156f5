package com.libragraph.attest.core.manifest;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Glob over canonical {@code /}-separated paths, independent of the host filesystem.
 *
 * <ul>
 *   <li>{@code *} matches within one segment</li>
 *   <li>{@code ?} matches one character other than {@code /}</li>
 *   <li>{@code **} matches across segments; {@code **}{@code /} also matches zero segments</li>
 * </ul>
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob cannot be null");
        if (glob.isEmpty() || glob.startsWith("/")) {
            throw new IllegalArgumentException("Invalid glob: '" + glob + "'");
        }
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                        sb.append("(?:.*/)?");
                        i += 3;
                    } else {
                        sb.append(".*");
                        i += 2;
                    }
                    continue;
                }
                sb.append("[^/]*");
            } else if (c == '?') {
                sb.append("[^/]");
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return new GlobPattern(glob, Pattern.compile(sb.toString()));
    }

    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }

    public String glob() {
        return glob;
    }

    @Override
    public String toString() {
        return glob;
    }
}
