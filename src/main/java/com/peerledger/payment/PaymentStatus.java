package com.peerledger.payment;

/**
 * Outcome of a payment.
 */
public enum PaymentStatus {
    /**
     * Funds moved and both activity logs were updated.
     */
    APPROVED,

    /**
     * Nothing changed on either account.
     */
    DECLINED
}
