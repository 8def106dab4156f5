package com.libragraph.attest.core.fingerprint;

import com.libragraph.attest.formats.api.CanonicalForm;
import com.libragraph.attest.formats.api.FileContext;
import com.libragraph.attest.formats.api.SemanticNormalizer;
import com.libragraph.attest.formats.api.SourceParseException;
import com.libragraph.attest.formats.registry.NormalizerRegistry;
import com.libragraph.attest.util.ContentHash;
import com.libragraph.attest.util.ContentHasher;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Hashes one source file by its canonical form, or by its raw bytes when no normalizer
 * applies or the content does not parse.
 *
 * <p>The result depends only on the file content and the normalizer id and version. Semantic
 * and raw hashes use separate key-derivation domains, so a canonical form can never be
 * mistaken for raw content with the same bytes.
 */
@Singleton
public class FileFingerprinter {

    static final String SEMANTIC_DOMAIN = "attest file semantic v1";
    static final String RAW_DOMAIN = "attest file raw v1";

    private static final Logger log = Logger.getLogger(FileFingerprinter.class);

    private final NormalizerRegistry registry;

    @Inject
    public FileFingerprinter(NormalizerRegistry registry) {
        this.registry = registry;
    }

    public FileFingerprint fingerprint(SourceFile file) {
        byte[] content = file.content();
        ContentHash rawHash = rawHash(content);
        FileContext context = file.context();

        Optional<SemanticNormalizer> normalizer = registry.findNormalizer(context);
        if (normalizer.isEmpty()) {
            log.debugf("No normalizer for %s, hashing raw bytes", file.path());
            return FileFingerprint.rawFallback(file.path(), rawHash, null, FallbackReason.UNSUPPORTED_KIND);
        }

        SemanticNormalizer n = normalizer.get();
        try {
            CanonicalForm form = n.normalize(content, context);
            ContentHash hash = ContentHasher.forDomain(SEMANTIC_DOMAIN)
                    .update(form.normalizerId())
                    .update(form.normalizerVersion())
                    .update(form.bytes())
                    .finish();
            return FileFingerprint.semantic(file.path(), hash, rawHash, form.normalizer());
        } catch (SourceParseException e) {
            log.warnf("Cannot parse %s as %s, falling back to raw hash: %s",
                    file.path(), n.id(), e.getMessage());
            return FileFingerprint.rawFallback(file.path(), rawHash, n.id() + "/" + n.version(),
                    FallbackReason.PARSE_ERROR);
        }
    }

    static ContentHash rawHash(byte[] content) {
        return ContentHasher.forDomain(RAW_DOMAIN).update(content).finish();
    }
}
