package com.peerledger.common.exception;

/**
 * Thrown when an account is not registered in the ledger.
 */
public class AccountNotFoundException extends PeerLedgerException {

    public AccountNotFoundException(String accountId) {
        super("Account not found: " + accountId);
    }
}
