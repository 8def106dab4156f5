package com.libragraph.attest.core.ledger;

import com.libragraph.attest.util.ContentHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class FilesystemLedgerClientTest {

    @TempDir
    Path root;

    private final ContentHash hash = ContentHash.digest("receipt".getBytes(StandardCharsets.UTF_8));
    private final AnchorMetadata metadata =
            new AnchorMetadata("2.1.0", true, ContentHash.digest("master".getBytes(StandardCharsets.UTF_8)));

    @Test
    void shouldAppendOneFilePerTransaction() {
        FilesystemLedgerClient ledger = new FilesystemLedgerClient(root);

        String first = ledger.anchor(hash, metadata).await().indefinitely();
        String second = ledger.anchor(hash, metadata).await().indefinitely();

        assertThat(first).isNotEqualTo(second);
        assertThat(root.resolve(first.substring(0, 2)).resolve(first + ".json")).exists();
        assertThat(root.resolve(second.substring(0, 2)).resolve(second + ".json")).exists();
    }

    @Test
    void shouldReadBackAnchoredRecord() {
        FilesystemLedgerClient ledger = new FilesystemLedgerClient(root);
        String txId = ledger.anchor(hash, metadata).await().indefinitely();

        Optional<OnChainRecord> record = new FilesystemLedgerClient(root).fetch(txId).await().indefinitely();

        assertThat(record).isPresent();
        assertThat(record.get().contentHash()).isEqualTo(hash);
        assertThat(record.get().metadata()).isEqualTo(metadata);
        assertThat(record.get().blockTimestamp()).isNotNull();
    }

    @Test
    void shouldReturnEmptyForUnknownOrMalformedTransaction() {
        FilesystemLedgerClient ledger = new FilesystemLedgerClient(root);

        assertThat(ledger.fetch("00000000-0000-0000-0000-000000000000").await().indefinitely()).isEmpty();
        assertThat(ledger.fetch("../../etc/passwd").await().indefinitely()).isEmpty();
    }

    @Test
    void shouldReportReachability() throws Exception {
        assertThat(new FilesystemLedgerClient(root.resolve("journal")).isReachable().await().indefinitely()).isTrue();

        Path file = Files.writeString(root.resolve("not-a-dir"), "x");
        assertThat(new FilesystemLedgerClient(file).isReachable().await().indefinitely()).isFalse();
    }
}
