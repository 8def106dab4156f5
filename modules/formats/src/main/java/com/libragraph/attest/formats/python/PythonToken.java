package com.libragraph.attest.formats.python;

import java.util.Locale;

/**
 * One lexical token. Structural tokens (NEWLINE, INDENT, DEDENT, END) carry empty text.
 *
 * @param line   1-based line where the token starts
 * @param column 0-based column where the token starts
 */
public record PythonToken(PythonTokenType type, String text, int line, int column) {

    public boolean isOp(String op) {
        return type == PythonTokenType.OP && text.equals(op);
    }

    public boolean isName(String name) {
        return type == PythonTokenType.NAME && text.equals(name);
    }

    /**
     * Lowercased string prefix (e.g. {@code "rb"}), or empty for non-prefixed strings.
     * Only meaningful for STRING tokens.
     */
    public String stringPrefix() {
        int i = 0;
        while (i < text.length() && text.charAt(i) != '\'' && text.charAt(i) != '"') {
            i++;
        }
        return text.substring(0, i).toLowerCase(Locale.ROOT);
    }
}
