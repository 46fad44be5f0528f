package com.ayni.core.error;

/**
 * Raised when a mutating ledger call is made while another one is still in flight on
 * the same thread, typically from inside an outbound transfer.
 */
public class ReentrantCallException extends LedgerException {

    public ReentrantCallException(String operation) {
        super(LedgerError.REENTRANT_CALL, "Reentrant call rejected: " + operation);
    }
}
