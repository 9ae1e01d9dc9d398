package com.peerledger.rules;

import com.peerledger.payment.PaymentRequest;

/**
 * Interface for payment rules.
 *
 * Each rule evaluates a payment request before any money moves and returns a
 * result indicating whether the payment may proceed.
 */
public interface PaymentRule {

    /**
     * Evaluate the rule against a payment request.
     *
     * @param request the payment request to evaluate
     * @return the result of the rule evaluation
     */
    RuleResult evaluate(PaymentRequest request);

    /**
     * Get the name of this rule.
     */
    String getRuleName();
}
