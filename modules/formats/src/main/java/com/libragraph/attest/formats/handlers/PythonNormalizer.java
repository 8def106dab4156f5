package com.libragraph.attest.formats.handlers;

import com.libragraph.attest.formats.api.CanonicalForm;
import com.libragraph.attest.formats.api.CanonicalWriter;
import com.libragraph.attest.formats.api.DetectionCriteria;
import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.api.SourceParseException;
import com.libragraph.attest.formats.python.PythonBlock;
import com.libragraph.attest.formats.python.PythonBlockParser;
import com.libragraph.attest.formats.python.PythonToken;
import com.libragraph.attest.formats.python.PythonTokenizer;
import com.libragraph.attest.types.FileKind;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.Set;

/**
 * Normalizer for Python source.
 *
 * <p>Canonical form: the block tree with comments, blank lines, layout and docstrings removed.
 * Every remaining token is kept verbatim, in source order, so literal values, identifiers and
 * statement order all reach the hash. A docstring is dropped only when it is the first
 * statement of the module or of a {@code def}/{@code class} body.
 */
@ApplicationScoped
public class PythonNormalizer implements SemanticNormalizer {

    public static final String ID = "python";
    public static final String VERSION = "1";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(Set.of(FileKind.PYTHON), Set.of("py", "pyi"), 100);
    }

    @Override
    public CanonicalForm normalize(byte[] content, FileContext context) throws SourceParseException {
        String source = Utf8.decode(content);
        List<PythonToken> tokens = new PythonTokenizer(source).tokenize();
        PythonBlock module = new PythonBlockParser(tokens).parseModule();

        CanonicalWriter writer = new CanonicalWriter();
        writeBlock(writer, module, true);
        return new CanonicalForm(ID, VERSION, writer.toByteArray());
    }

    private void writeBlock(CanonicalWriter writer, PythonBlock block, boolean docstringScope) {
        writer.open('B');
        List<PythonBlock.Statement> statements = block.statements();
        for (int i = 0; i < statements.size(); i++) {
            PythonBlock.Statement statement = statements.get(i);
            if (i == 0 && docstringScope && statement.isDocstring()) {
                continue;
            }
            writeStatement(writer, statement);
        }
        writer.close();
    }

    private void writeStatement(CanonicalWriter writer, PythonBlock.Statement statement) {
        writer.open('S');
        for (PythonToken token : statement.tokens()) {
            writer.atom(tag(token), token.text());
        }
        if (statement.body() != null) {
            writeBlock(writer, statement.body(), statement.definesDocstringScope());
        }
        writer.close();
    }

    private static char tag(PythonToken token) {
        return switch (token.type()) {
            case NAME -> 'N';
            case NUMBER -> 'D';
            case STRING -> 'Q';
            case OP -> 'O';
            default -> throw new IllegalStateException("Structural token inside statement: " + token);
        };
    }
}
