package com.libragraph.attest.core.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.libragraph.attest.core.storage.AttestJson;
import com.libragraph.attest.core.storage.StoreException;
import com.libragraph.attest.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Append-only ledger journal on the local filesystem: one write-once JSON file per
 * transaction.
 *
 * <p>Layout: {@code {root}/{tier1}/{transactionId}.json} where tier1 = transactionId[0:2].
 */
@ApplicationScoped
@IfBuildProperty(name = "attest.ledger.type", stringValue = "filesystem")
public class FilesystemLedgerClient implements LedgerClient {

    private static final Logger log = Logger.getLogger(FilesystemLedgerClient.class);
    private static final ObjectMapper MAPPER = AttestJson.newMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern TX_ID = Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    @ConfigProperty(name = "attest.ledger.filesystem.root")
    String root;

    FilesystemLedgerClient() {
    }

    public FilesystemLedgerClient(Path root) {
        this.root = root.toString();
    }

    private Path resolvePath(String transactionId) {
        return Path.of(root, transactionId.substring(0, 2), transactionId + ".json");
    }

    @Override
    public Uni<String> anchor(ContentHash contentHash, AnchorMetadata metadata) {
        return Uni.createFrom().item(() -> {
            String txId = UUID.randomUUID().toString();
            Path path = resolvePath(txId);
            Transaction tx = new Transaction(txId, new OnChainRecord(contentHash, metadata, Instant.now()));
            try {
                Files.createDirectories(path.getParent());
                Files.write(path, MAPPER.writeValueAsBytes(tx),
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (IOException e) {
                throw new LedgerUnavailableException("Failed to append transaction for " + contentHash, e);
            }
            log.debugf("Anchored %s as transaction %s", contentHash, txId);
            return txId;
        });
    }

    @Override
    public Uni<Optional<OnChainRecord>> fetch(String transactionId) {
        return Uni.createFrom().item(() -> {
            if (!TX_ID.matcher(transactionId).matches()) {
                return Optional.empty();
            }
            Path path = resolvePath(transactionId);
            if (!Files.exists(path)) {
                return Optional.empty();
            }
            try {
                Transaction tx = MAPPER.readValue(path.toFile(), Transaction.class);
                return Optional.of(tx.record());
            } catch (IOException e) {
                throw new StoreException("Failed to read transaction: " + transactionId, e);
            }
        });
    }

    @Override
    public Uni<Boolean> isReachable() {
        return Uni.createFrom().item(() -> {
            try {
                Files.createDirectories(Path.of(root));
                return Files.isWritable(Path.of(root));
            } catch (IOException e) {
                log.warnf("Ledger journal root %s is not usable: %s", root, e.getMessage());
                return false;
            }
        });
    }

    record Transaction(
            @JsonProperty("transaction_id") String transactionId,
            @JsonProperty("record") OnChainRecord record
    ) {}
}
