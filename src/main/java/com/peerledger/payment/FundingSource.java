package com.peerledger.payment;

/**
 * Where the money for an approved payment came from.
 */
public enum FundingSource {
    /**
     * The payer's own cash balance.
     */
    CASH,

    /**
     * The credit line assigned to the payer, used only when cash is insufficient.
     */
    CREDIT_LINE
}
