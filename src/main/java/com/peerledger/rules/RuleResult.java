package com.peerledger.rules;

import lombok.Value;

/**
 * Result of a payment rule evaluation.
 * A decline names the rule that raised it; its reason ends up in the declined
 * {@link com.peerledger.payment.PaymentResult}.
 */
@Value
public class RuleResult {
    boolean approved;
    String ruleName;
    String reason;

    public static RuleResult approve() {
        return new RuleResult(true, null, null);
    }

    public static RuleResult decline(String ruleName, String reason) {
        return new RuleResult(false, ruleName, reason);
    }
}
