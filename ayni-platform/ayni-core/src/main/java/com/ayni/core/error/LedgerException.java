package com.ayni.core.error;

/**
 * Raised when a ledger operation is rejected. No state has been written when this
 * escapes a ledger operation.
 */
public class LedgerException extends RuntimeException {

    private final LedgerError error;

    public LedgerException(LedgerError error, String message) {
        super(message);
        this.error = error;
    }

    public LedgerException(LedgerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public LedgerError getError() {
        return error;
    }

    public static LedgerException of(LedgerError error, String message) {
        return new LedgerException(error, message);
    }
}
