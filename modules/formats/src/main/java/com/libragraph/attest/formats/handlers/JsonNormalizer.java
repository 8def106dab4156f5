package com.libragraph.attest.formats.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.libragraph.attest.formats.api.CanonicalForm;
import com.libragraph.attest.formats.api.CanonicalWriter;
import com.libragraph.attest.formats.api.DetectionCriteria;
import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.api.SourceParseException;
import com.libragraph.attest.types.FileKind;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Set;
import java.util.TreeMap;

/**
 * Normalizer for JSON configuration.
 *
 * <p>Accepts comments and trailing commas; rejects duplicate keys and trailing content.
 * Canonical form sorts object members, drops {@code $comment} annotations with a string
 * value, and writes numbers by value: {@code 1.50} and {@code 1.5} agree, integer {@code 1}
 * and decimal {@code 1.0} do not. Decimals keep scientific notation ({@code 1E+2}), so a
 * large exponent costs no more than its digits.
 *
 * <p>Any other member, {@code //} included, is a value: an engine may read it.
 */
@ApplicationScoped
public class JsonNormalizer implements SemanticNormalizer {

    public static final String ID = "json";
    public static final String VERSION = "2";

    private static final String COMMENT_KEY = "$comment";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS, JsonReadFeature.ALLOW_YAML_COMMENTS,
                    JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS,
                    DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

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
        return new DetectionCriteria(Set.of(FileKind.JSON), Set.of("json"), 100);
    }

    @Override
    public CanonicalForm normalize(byte[] content, FileContext context) throws SourceParseException {
        JsonNode root;
        try {
            root = MAPPER.readTree(Utf8.decode(content));
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            if (loc != null) {
                throw new SourceParseException(e.getOriginalMessage(), loc.getLineNr(), loc.getColumnNr());
            }
            throw new SourceParseException("Invalid JSON in " + context.path(), e);
        } catch (IOException e) {
            throw new SourceParseException("Failed to read JSON in " + context.path(), e);
        } catch (NumberFormatException e) {
            throw new SourceParseException("Number out of range in " + context.path(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new SourceParseException("empty JSON document", 1, 0);
        }

        CanonicalWriter writer = new CanonicalWriter();
        try {
            write(writer, root);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new SourceParseException("Number out of range in " + context.path(), e);
        }
        return new CanonicalForm(ID, VERSION, writer.toByteArray());
    }

    private void write(CanonicalWriter writer, JsonNode node) {
        if (node.isObject()) {
            TreeMap<String, JsonNode> sorted = new TreeMap<>();
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                JsonNode value = node.get(name);
                if (!isComment(name, value)) {
                    sorted.put(name, value);
                }
            }
            writer.open('O');
            sorted.forEach((name, value) -> {
                writer.atom('K', name);
                write(writer, value);
            });
            writer.close();
        } else if (node.isArray()) {
            writer.open('A');
            node.forEach(element -> write(writer, element));
            writer.close();
        } else if (node.isTextual()) {
            writer.atom('S', node.textValue());
        } else if (node.isIntegralNumber()) {
            writer.atom('I', node.bigIntegerValue().toString());
        } else if (node.isNumber()) {
            writer.atom('F', canonicalDecimal(node.decimalValue()));
        } else if (node.isBoolean()) {
            writer.atom('T', Boolean.toString(node.booleanValue()));
        } else if (node.isNull()) {
            writer.atom('Z', "null");
        } else {
            throw new IllegalStateException("Unexpected JSON node type: " + node.getNodeType());
        }
    }

    private static boolean isComment(String name, JsonNode value) {
        return COMMENT_KEY.equals(name) && value.isTextual();
    }

    private static String canonicalDecimal(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toString();
    }
}
