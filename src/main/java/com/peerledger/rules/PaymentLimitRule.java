package com.peerledger.rules;

import com.peerledger.common.Money;
import com.peerledger.payment.PaymentRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Rule that enforces an optional per-payment ceiling.
 * With no {@code peer-ledger.rules.max-payment} configured every amount passes.
 */
@Component
public class PaymentLimitRule implements PaymentRule {

    private final Money maxPayment;

    public PaymentLimitRule(@Value("${peer-ledger.rules.max-payment:#{null}}") BigDecimal maxPayment) {
        this.maxPayment = maxPayment == null ? null : Money.of(maxPayment);
    }

    @Override
    public RuleResult evaluate(PaymentRequest request) {
        if (maxPayment != null && request.getAmount().isGreaterThan(maxPayment)) {
            return RuleResult.decline(getRuleName(),
                String.format("Payment amount %s exceeds limit %s",
                    request.getAmount().format(), maxPayment.format())
            );
        }
        return RuleResult.approve();
    }

    @Override
    public String getRuleName() {
        return "PaymentLimit";
    }
}
