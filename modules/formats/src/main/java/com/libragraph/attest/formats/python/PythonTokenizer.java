package com.libragraph.attest.formats.python;

import com.libragraph.attest.formats.api.SourceParseException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits Python source into tokens, following the language's lexical rules for logical lines.
 *
 * <p>Comments, blank lines and intra-line whitespace produce no tokens. Line breaks inside
 * brackets and after a backslash continuation join physical lines. Indentation changes at the
 * start of a logical line become INDENT/DEDENT tokens; tabs advance to the next multiple of 8.
 *
 * <p>Single use; not thread-safe.
 */
public final class PythonTokenizer {

    private static final Set<String> STRING_PREFIXES = Set.of(
            "r", "u", "b", "f", "br", "rb", "fr", "rf");

    private static final Set<String> THREE_CHAR_OPS = Set.of(
            "**=", "//=", ">>=", "<<=", "...");

    private static final Set<String> TWO_CHAR_OPS = Set.of(
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=");

    private static final String ONE_CHAR_OPS = "+-*/%@&|^~<>()[]{},:.;=";

    private final String src;
    private final List<PythonToken> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<PythonToken> brackets = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;

    public PythonTokenizer(String source) {
        String s = source.replace("\r\n", "\n").replace('\r', '\n');
        if (s.startsWith("\uFEFF")) {
            s = s.substring(1);
        }
        this.src = s;
    }

    public List<PythonToken> tokenize() throws SourceParseException {
        indents.push(0);
        boolean atLineStart = true;

        while (true) {
            if (atLineStart && brackets.isEmpty()) {
                if (!readIndentation()) {
                    break;
                }
                atLineStart = false;
                continue;
            }
            if (pos >= src.length()) {
                break;
            }

            char c = src.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\n') {
                if (brackets.isEmpty()) {
                    emit(PythonTokenType.NEWLINE, "", pos);
                    atLineStart = true;
                }
                newLine();
            } else if (c == '\\') {
                readContinuation();
            } else if (c == '\'' || c == '"') {
                readString(pos);
            } else if (isDigit(c) || (c == '.' && pos + 1 < src.length() && isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (isIdentifierStart(src.codePointAt(pos))) {
                readNameOrPrefixedString();
            } else {
                readOperator();
            }
        }

        if (!brackets.isEmpty()) {
            PythonToken open = brackets.peek();
            throw new SourceParseException("'" + open.text() + "' was never closed",
                    open.line(), open.column());
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != PythonTokenType.NEWLINE
                && tokens.get(tokens.size() - 1).type() != PythonTokenType.DEDENT) {
            emit(PythonTokenType.NEWLINE, "", pos);
        }
        while (indents.size() > 1) {
            indents.pop();
            emit(PythonTokenType.DEDENT, "", pos);
        }
        emit(PythonTokenType.END, "", pos);
        return List.copyOf(tokens);
    }

    /**
     * Measures indentation of the next non-blank line and emits INDENT/DEDENT.
     * Blank and comment-only lines are consumed. Returns false at end of input.
     */
    private boolean readIndentation() throws SourceParseException {
        while (true) {
            int col = 0;
            int p = pos;
            while (p < src.length()) {
                char c = src.charAt(p);
                if (c == ' ') {
                    col++;
                } else if (c == '\t') {
                    col = (col / 8 + 1) * 8;
                } else if (c == '\f') {
                    col = 0;
                } else {
                    break;
                }
                p++;
            }
            pos = p;
            if (pos >= src.length()) {
                return false;
            }

            char c = src.charAt(pos);
            if (c == '#') {
                skipComment();
                if (pos >= src.length()) {
                    return false;
                }
            }
            if (src.charAt(pos) == '\n') {
                newLine();
                continue;
            }

            int current = indents.peek();
            if (col > current) {
                indents.push(col);
                emit(PythonTokenType.INDENT, "", pos);
            } else {
                while (col < indents.peek()) {
                    indents.pop();
                    emit(PythonTokenType.DEDENT, "", pos);
                }
                if (col != indents.peek()) {
                    throw error("unindent does not match any outer indentation level", pos);
                }
            }
            return true;
        }
    }

    private void readContinuation() throws SourceParseException {
        if (pos + 1 >= src.length()) {
            throw error("unexpected end of input after line continuation", pos);
        }
        if (src.charAt(pos + 1) != '\n') {
            throw error("unexpected character after line continuation character", pos);
        }
        pos++;
        newLine();
    }

    private void readNameOrPrefixedString() throws SourceParseException {
        int start = pos;
        while (pos < src.length() && isIdentifierPart(src.codePointAt(pos))) {
            pos += Character.charCount(src.codePointAt(pos));
        }
        String word = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '\'' || src.charAt(pos) == '"')
                && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            pos = start;
            readString(start);
            return;
        }
        emit(PythonTokenType.NAME, word, start);
    }

    private void readString(int start) throws SourceParseException {
        int startLine = line;
        int startColumn = start - lineStart;
        while (src.charAt(pos) != '\'' && src.charAt(pos) != '"') {
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        while (true) {
            if (pos >= src.length()) {
                throw new SourceParseException(triple
                        ? "unterminated triple-quoted string literal"
                        : "unterminated string literal", startLine, startColumn);
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                // Escapes hide the next character from termination in raw strings too.
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos++;
                    newLine();
                } else {
                    pos += 2;
                }
                continue;
            }
            if (triple) {
                if (src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
                if (c == '\n') {
                    newLine();
                    continue;
                }
            } else {
                if (c == quote) {
                    pos++;
                    break;
                }
                if (c == '\n') {
                    throw new SourceParseException("unterminated string literal", startLine, startColumn);
                }
            }
            pos++;
        }

        tokens.add(new PythonToken(PythonTokenType.STRING, src.substring(start, pos), startLine, startColumn));
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length()
                && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (isHexDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            consumeDigits();
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                consumeDigits();
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int mark = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < src.length() && isDigit(src.charAt(pos))) {
                    consumeDigits();
                } else {
                    pos = mark;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                pos++;
            }
        }
        emit(PythonTokenType.NUMBER, src.substring(start, pos), start);
    }

    private void consumeDigits() {
        while (pos < src.length() && (isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readOperator() throws SourceParseException {
        int start = pos;
        String op;
        if (pos + 3 <= src.length() && THREE_CHAR_OPS.contains(src.substring(pos, pos + 3))) {
            op = src.substring(pos, pos + 3);
        } else if (pos + 2 <= src.length() && TWO_CHAR_OPS.contains(src.substring(pos, pos + 2))) {
            op = src.substring(pos, pos + 2);
        } else if (ONE_CHAR_OPS.indexOf(src.charAt(pos)) >= 0) {
            op = String.valueOf(src.charAt(pos));
        } else {
            throw error("invalid character '" + new String(Character.toChars(src.codePointAt(pos))) + "'", pos);
        }
        pos += op.length();

        PythonToken token = new PythonToken(PythonTokenType.OP, op, line, start - lineStart);
        switch (op) {
            case "(", "[", "{" -> brackets.push(token);
            case ")", "]", "}" -> closeBracket(token);
            default -> { }
        }
        tokens.add(token);
    }

    private void closeBracket(PythonToken closing) throws SourceParseException {
        if (brackets.isEmpty()) {
            throw new SourceParseException("unmatched '" + closing.text() + "'",
                    closing.line(), closing.column());
        }
        PythonToken open = brackets.pop();
        String expected = switch (open.text()) {
            case "(" -> ")";
            case "[" -> "]";
            default -> "}";
        };
        if (!expected.equals(closing.text())) {
            throw new SourceParseException("closing parenthesis '" + closing.text()
                    + "' does not match opening parenthesis '" + open.text() + "' on line "
                    + open.line(), closing.line(), closing.column());
        }
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void newLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    private void emit(PythonTokenType type, String text, int at) {
        tokens.add(new PythonToken(type, text, line, at - lineStart));
    }

    private SourceParseException error(String message, int at) {
        return new SourceParseException(message, line, at - lineStart);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isIdentifierStart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierStart(cp);
    }

    private static boolean isIdentifierPart(int cp) {
        return cp == '_' || Character.isUnicodeIdentifierPart(cp);
    }
}
