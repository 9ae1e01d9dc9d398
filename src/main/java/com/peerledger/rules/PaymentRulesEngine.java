package com.peerledger.rules;

import com.peerledger.payment.PaymentRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Rules engine that evaluates all configured rules against payment requests.
 *
 * Rules are evaluated in order, and the first rule that declines the payment
 * will cause the entire payment to be declined.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentRulesEngine {

    private final List<PaymentRule> rules;

    /**
     * Engine with no extra rules. Self-payments and non-positive amounts are
     * rejected by the account before any rule runs.
     */
    public static PaymentRulesEngine defaults() {
        return new PaymentRulesEngine(List.of());
    }

    /**
     * Evaluate all rules against a payment request.
     *
     * @param request the payment request to evaluate
     * @return the result of the rules evaluation
     */
    public RuleResult evaluateRules(PaymentRequest request) {
        log.debug("Evaluating {} rules for payment from {} to {}",
            rules.size(), request.getPayer().getName(), request.getRecipient().getName());

        for (PaymentRule rule : rules) {
            RuleResult result = rule.evaluate(request);

            if (!result.isApproved()) {
                log.info("Rule {} declined payment: {}", result.getRuleName(), result.getReason());
                return result;
            }

            log.debug("Rule {} approved", rule.getRuleName());
        }

        return RuleResult.approve();
    }
}
