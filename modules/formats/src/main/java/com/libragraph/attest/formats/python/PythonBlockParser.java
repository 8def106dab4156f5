package com.libragraph.attest.formats.python;

import com.libragraph.attest.formats.api.SourceParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the block tree from a token stream: each statement is a logical line, optionally
 * followed by the indented suite it introduces.
 *
 * <p>Rejects indentation that the interpreter would reject: an indent that does not follow a
 * header ending in {@code :}, and a header ending in {@code :} with no suite.
 */
public final class PythonBlockParser {

    private final List<PythonToken> tokens;
    private int index;

    public PythonBlockParser(List<PythonToken> tokens) {
        this.tokens = tokens;
    }

    public PythonBlock parseModule() throws SourceParseException {
        PythonBlock module = parseBlock();
        PythonToken next = peek();
        if (next.type() != PythonTokenType.END) {
            throw error("unexpected " + next.type(), next);
        }
        return module;
    }

    private PythonBlock parseBlock() throws SourceParseException {
        List<PythonBlock.Statement> statements = new ArrayList<>();
        while (peek().type() != PythonTokenType.END && peek().type() != PythonTokenType.DEDENT) {
            if (peek().type() == PythonTokenType.INDENT) {
                throw error("unexpected indent", peek());
            }

            List<PythonToken> line = new ArrayList<>();
            while (peek().type() != PythonTokenType.NEWLINE) {
                PythonToken token = next();
                if (token.type() == PythonTokenType.END) {
                    throw error("unexpected end of input", token);
                }
                line.add(token);
            }
            PythonToken newline = next();
            if (line.isEmpty()) {
                continue;
            }

            PythonToken last = line.get(line.size() - 1);
            PythonBlock body = null;
            if (peek().type() == PythonTokenType.INDENT) {
                if (!last.isOp(":")) {
                    throw error("unexpected indent", peek());
                }
                next();
                body = parseBlock();
                PythonToken dedent = next();
                if (dedent.type() != PythonTokenType.DEDENT) {
                    throw error("expected dedent", dedent);
                }
            } else if (last.isOp(":")) {
                throw error("expected an indented block", newline);
            }

            statements.add(new PythonBlock.Statement(line, body));
        }
        return new PythonBlock(statements);
    }

    private PythonToken peek() {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private PythonToken next() {
        PythonToken token = peek();
        if (index < tokens.size()) {
            index++;
        }
        return token;
    }

    private static SourceParseException error(String message, PythonToken at) {
        return new SourceParseException(message, at.line(), at.column());
    }
}
