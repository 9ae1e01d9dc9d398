package com.peerledger.common.exception;

/**
 * Base exception for all peer ledger exceptions.
 */
public class PeerLedgerException extends RuntimeException {

    public PeerLedgerException(String message) {
        super(message);
    }

    public PeerLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
