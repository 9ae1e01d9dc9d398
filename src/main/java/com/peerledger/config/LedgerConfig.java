package com.peerledger.config;

import com.peerledger.accounts.Ledger;
import com.peerledger.rules.PaymentRule;
import com.peerledger.rules.PaymentRulesEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the payment rules into a rules engine and exposes the application's ledger.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Bean
    public PaymentRulesEngine paymentRulesEngine(List<PaymentRule> rules) {
        log.info("Configured payment rules: {}", rules.stream().map(PaymentRule::getRuleName).toList());
        return new PaymentRulesEngine(rules);
    }

    @Bean
    public Ledger ledger(PaymentRulesEngine paymentRulesEngine) {
        return new Ledger(paymentRulesEngine);
    }
}
