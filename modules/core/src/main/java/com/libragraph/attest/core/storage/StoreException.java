package com.libragraph.attest.core.storage;

/**
 * Wraps checked I/O exceptions from the baseline store, the ledger journal, the receipt
 * archive and source tree reads.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
