package com.peerledger.payment;

import com.peerledger.accounts.Account;
import com.peerledger.common.Money;
import lombok.Builder;
import lombok.Value;

/**
 * A request to move money from one account to another.
 */
@Value
@Builder
public class PaymentRequest {

    /**
     * Account sending the money.
     */
    Account payer;

    /**
     * Account receiving the money.
     */
    Account recipient;

    Money amount;

    /**
     * Free-text memo, never null (empty when the caller gave none).
     */
    String description;
}
