package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.attest.core.receipt.CertificationReceipt;
import com.libragraph.attest.core.receipt.ReceiptCodec;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Write-once local evidence: receipts keyed by content hash, and every anchor recorded for
 * each of them.
 *
 * <p>Layout: {@code {root}/receipts/{contentHash}.json} and
 * {@code {root}/anchors/{contentHash}/{transactionId}.json}. Existing files are never
 * rewritten.
 */
@ApplicationScoped
public class ReceiptArchive {

    private static final Logger log = Logger.getLogger(ReceiptArchive.class);
    private static final ObjectMapper MAPPER = AttestJson.newMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @ConfigProperty(name = "attest.archive.root")
    String root;

    ReceiptArchive() {
    }

    public ReceiptArchive(Path root) {
        this.root = root.toString();
    }

    private Path receiptPath(ContentHash contentHash) {
        return Path.of(root, "receipts", contentHash.toHex() + ".json");
    }

    private Path anchorDir(ContentHash contentHash) {
        return Path.of(root, "anchors", contentHash.toHex());
    }

    /**
     * Stores a receipt unless one with the same content hash is already archived.
     *
     * @return true if the receipt was newly written
     */
    public boolean store(CertificationReceipt receipt) {
        return writeOnce(receiptPath(receipt.contentHash()), ReceiptCodec.write(receipt),
                "receipt " + receipt.contentHash());
    }

    public Optional<CertificationReceipt> load(ContentHash contentHash) {
        Path path = receiptPath(contentHash);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ReceiptCodec.read(Files.readAllBytes(path)));
        } catch (IOException e) {
            throw new StoreException("Failed to read receipt: " + contentHash, e);
        }
    }

    public boolean recordAnchor(LedgerAnchor anchor) {
        Path path = anchorDir(anchor.contentHash()).resolve(anchor.transactionId() + ".json");
        try {
            return writeOnce(path, MAPPER.writeValueAsBytes(anchor), "anchor " + anchor.transactionId());
        } catch (IOException e) {
            throw new StoreException("Failed to serialize anchor: " + anchor.transactionId(), e);
        }
    }

    public List<LedgerAnchor> anchors(ContentHash contentHash) {
        Path dir = anchorDir(contentHash);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<LedgerAnchor> anchors = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                anchors.add(MAPPER.readValue(file.toFile(), LedgerAnchor.class));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list anchors for " + contentHash, e);
        }
        return anchors;
    }

    /**
     * Every archived anchor, grouped into certified facts by content hash.
     */
    public List<CertifiedFact> certifiedFacts() {
        Path dir = Path.of(root, "anchors");
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<LedgerAnchor> all = new ArrayList<>();
        try (Stream<Path> hashes = Files.list(dir)) {
            for (Path hashDir : (Iterable<Path>) hashes.filter(Files::isDirectory)::iterator) {
                all.addAll(anchors(ContentHash.fromHex(hashDir.getFileName().toString())));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list archived anchors", e);
        }
        return AnchorDeduplicator.deduplicate(all);
    }

    private boolean writeOnce(Path path, byte[] bytes, String what) {
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debugf("Archived %s", what);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debugf("Already archived: %s", what);
            return false;
        } catch (IOException e) {
            throw new StoreException("Failed to archive " + what, e);
        }
    }
}
