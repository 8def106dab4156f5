package com.libragraph.attest.core.verify;

public enum LedgerVerificationStatus {
    AUTHENTIC,
    TAMPERED,
    NOT_FOUND
}
