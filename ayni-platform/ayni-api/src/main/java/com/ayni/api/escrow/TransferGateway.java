package com.ayni.api.escrow;

import java.math.BigInteger;

/**
 * Outbound movement of funds leaving the vault. Called after the vault has already
 * debited its own books, inside the same transaction.
 */
public interface TransferGateway {

    /**
     * @throws TransferException when the recipient cannot be paid
     */
    void transfer(String recipient, BigInteger amount);

    class TransferException extends RuntimeException {
        public TransferException(String message) { super(message); }
        public TransferException(String message, Throwable cause) { super(message, cause); }
    }
}
