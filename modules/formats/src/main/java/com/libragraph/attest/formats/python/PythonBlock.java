package com.libragraph.attest.formats.python;

import java.util.List;

/**
 * A suite of statements at one indentation level.
 */
public record PythonBlock(List<Statement> statements) {

    public PythonBlock {
        statements = List.copyOf(statements);
    }

    /**
     * One logical line. {@code body} is the indented suite following a compound statement
     * header, or null.
     */
    public record Statement(List<PythonToken> tokens, PythonBlock body) {

        public Statement {
            tokens = List.copyOf(tokens);
        }

        /**
         * True for {@code def}, {@code async def} and {@code class} headers, whose first body
         * statement may be a docstring.
         */
        public boolean definesDocstringScope() {
            if (body == null || tokens.isEmpty()) {
                return false;
            }
            PythonToken first = tokens.get(0);
            if (first.isName("async") && tokens.size() > 1) {
                first = tokens.get(1);
            }
            return first.isName("def") || first.isName("class");
        }

        /**
         * True if the statement is nothing but adjacent plain or raw string literals, which
         * Python treats as a docstring when it opens a module, function or class body.
         */
        public boolean isDocstring() {
            if (body != null || tokens.isEmpty()) {
                return false;
            }
            for (PythonToken token : tokens) {
                if (token.type() != PythonTokenType.STRING) {
                    return false;
                }
                String prefix = token.stringPrefix();
                if (prefix.contains("f") || prefix.contains("b")) {
                    return false;
                }
            }
            return true;
        }
    }
}
