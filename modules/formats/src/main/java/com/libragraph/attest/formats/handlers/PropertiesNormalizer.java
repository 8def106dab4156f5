package com.libragraph.attest.formats.handlers;

import com.libragraph.attest.formats.api.CanonicalForm;
import com.libragraph.attest.formats.api.CanonicalWriter;
import com.libragraph.attest.formats.api.DetectionCriteria;
import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.api.SourceParseException;
import com.libragraph.attest.types.FileKind;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.StringReader;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Normalizer for {@code .properties} files (read as UTF-8).
 * Canonical form is the sorted key/value set; comments, layout and entry order are dropped.
 */
@ApplicationScoped
public class PropertiesNormalizer implements SemanticNormalizer {

    public static final String ID = "properties";
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
        return new DetectionCriteria(Set.of(FileKind.PROPERTIES), Set.of("properties"), 100);
    }

    @Override
    public CanonicalForm normalize(byte[] content, FileContext context) throws SourceParseException {
        Properties properties = new Properties();
        try {
            properties.load(new StringReader(Utf8.decode(content)));
        } catch (IllegalArgumentException e) {
            throw new SourceParseException("Malformed escape in " + context.path() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new SourceParseException("Failed to read properties in " + context.path(), e);
        }

        CanonicalWriter writer = new CanonicalWriter();
        writer.open('P');
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            writer.atom('K', key);
            writer.atom('V', properties.getProperty(key));
        }
        writer.close();
        return new CanonicalForm(ID, VERSION, writer.toByteArray());
    }
}
