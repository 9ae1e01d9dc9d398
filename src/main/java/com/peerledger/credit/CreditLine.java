package com.peerledger.credit;

import com.peerledger.common.Money;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

/**
 * A credit line that can be charged when an account's cash balance is not enough.
 *
 * Credit lines are not owned by the account they are assigned to: the same
 * credit line may be referenced by several accounts, so every balance read
 * and debit synchronizes on the credit line itself.
 */
@Slf4j
public class CreditLine {

    @Getter
    private final String creditLineId;

    private Money balance;

    @Getter
    private final Instant createdAt;

    private Instant updatedAt;

    public CreditLine(Money balance) {
        if (balance == null) {
            throw new IllegalArgumentException("Credit line balance cannot be null");
        }
        this.creditLineId = UUID.randomUUID().toString();
        this.balance = balance;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public synchronized Money getBalance() {
        return balance;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Charge the credit line if the available balance covers the amount.
     * The check and the charge happen as one step; on failure nothing changes.
     *
     * @param amount the amount to charge
     * @return true if the credit line was charged, false if the balance was insufficient
     */
    public synchronized boolean debit(Money amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (balance.isLessThan(amount)) {
            log.debug("Credit line {} cannot cover {} (balance {})", creditLineId, amount, balance);
            return false;
        }

        balance = balance.subtract(amount);
        updatedAt = Instant.now();
        log.debug("Charged {} to credit line {}, remaining {}", amount, creditLineId, balance);
        return true;
    }
}
