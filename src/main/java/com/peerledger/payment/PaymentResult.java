package com.peerledger.payment;

import lombok.Builder;
import lombok.Value;

/**
 * Result of a payment attempt.
 */
@Value
@Builder
public class PaymentResult {

    PaymentStatus status;

    /**
     * Set only for approved payments.
     */
    FundingSource fundingSource;

    /**
     * Set only for declined payments.
     */
    String declineReason;

    public static PaymentResult approved(FundingSource fundingSource) {
        return PaymentResult.builder()
            .status(PaymentStatus.APPROVED)
            .fundingSource(fundingSource)
            .build();
    }

    public static PaymentResult declined(String reason) {
        return PaymentResult.builder()
            .status(PaymentStatus.DECLINED)
            .declineReason(reason)
            .build();
    }

    public boolean isApproved() {
        return status == PaymentStatus.APPROVED;
    }
}
