package com.peerledger.accounts;

import com.peerledger.common.Money;
import com.peerledger.credit.CreditLine;
import com.peerledger.payment.FundingSource;
import com.peerledger.payment.PaymentRequest;
import com.peerledger.payment.PaymentResult;
import com.peerledger.rules.PaymentRulesEngine;
import com.peerledger.rules.RuleResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * A user of the ledger: a cash balance, an optional credit line, a set of friends
 * and an append-only activity log.
 *
 * Accounts interact with each other directly. Operations that touch two accounts
 * (friendship, payment) lock both of them in creation order, so the pair is
 * always updated as a unit. Failed operations never change either account.
 *
 * Accounts use identity equality: two accounts with the same name are different users.
 */
@Slf4j
public class Account {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    @Getter
    private final String accountId;

    @Getter
    private final String name;

    @Getter
    private final Instant createdAt;

    // global lock order
    private final long sequence;

    private final PaymentRulesEngine rulesEngine;

    private Money balance;

    private CreditLine creditLine;

    private final Set<Account> friends = new LinkedHashSet<>();

    private final List<String> activityLog = new ArrayList<>();

    Account(String name, Money balance, PaymentRulesEngine rulesEngine) {
        if (name == null) {
            throw new IllegalArgumentException("Account name cannot be null");
        }
        if (balance == null) {
            throw new IllegalArgumentException("Initial balance cannot be null");
        }
        if (rulesEngine == null) {
            throw new IllegalArgumentException("Rules engine cannot be null");
        }
        this.accountId = UUID.randomUUID().toString();
        this.name = name;
        this.balance = balance;
        this.rulesEngine = rulesEngine;
        this.sequence = SEQUENCE.incrementAndGet();
        this.createdAt = Instant.now();
    }

    public synchronized Money getBalance() {
        return balance;
    }

    public synchronized Optional<CreditLine> getCreditLine() {
        return Optional.ofNullable(creditLine);
    }

    /**
     * Link a credit line to this account, replacing any previous one.
     * Passing null removes the credit line.
     */
    public synchronized void assignCreditLine(CreditLine creditLine) {
        this.creditLine = creditLine;
        log.info("Assigned credit line {} to account {}",
            creditLine == null ? null : creditLine.getCreditLineId(), accountId);
    }

    /**
     * Befriend another account. Friendship is mutual: both accounts record it.
     *
     * @param friend the account to befriend
     * @return true if the friendship was created, false if {@code friend} is this
     *         account or already a friend
     */
    public boolean addFriend(Account friend) {
        if (friend == null) {
            throw new IllegalArgumentException("Friend cannot be null");
        }
        if (friend == this) {
            log.debug("Account {} cannot befriend itself", accountId);
            return false;
        }

        return withBothLocked(this, friend, () -> {
            if (friends.contains(friend)) {
                log.debug("Accounts {} and {} are already friends", accountId, friend.accountId);
                return false;
            }

            friends.add(friend);
            friend.friends.add(this);
            activityLog.add(ActivityMessages.friendship(this, friend));
            friend.activityLog.add(ActivityMessages.friendship(friend, this));

            log.info("Accounts {} ({}) and {} ({}) are now friends",
                accountId, name, friend.accountId, friend.name);
            return true;
        });
    }

    public boolean pay(Account recipient, Money amount) {
        return pay(recipient, amount, "");
    }

    /**
     * Pay another account, from cash first and from the credit line if cash is short.
     *
     * @return true if the payment went through
     * @see #transfer(Account, Money, String)
     */
    public boolean pay(Account recipient, Money amount, String description) {
        return transfer(recipient, amount, description).isApproved();
    }

    /**
     * Pay another account and report how the payment was funded or why it was declined.
     *
     * Payment flow:
     * 1. Decline payments to this same account
     * 2. Decline zero and negative amounts
     * 3. Run the rules engine
     * 4. Pay from the cash balance if it covers the amount
     * 5. Otherwise charge the credit line if one is assigned and covers the amount
     * 6. Otherwise decline
     *
     * @param recipient the account receiving the money
     * @param amount the amount to pay
     * @param description memo for the activity log; null is treated as empty
     * @return the payment result
     */
    public PaymentResult transfer(Account recipient, Money amount, String description) {
        if (recipient == null) {
            throw new IllegalArgumentException("Recipient cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }

        if (recipient == this) {
            log.info("Payment from {} to itself DECLINED", accountId);
            return PaymentResult.declined("Cannot pay yourself");
        }
        if (!amount.isPositive()) {
            log.info("Payment of {} from {} to {} DECLINED: amount must be positive",
                amount, accountId, recipient.accountId);
            return PaymentResult.declined("Payment amount must be positive");
        }

        PaymentRequest request = PaymentRequest.builder()
            .payer(this)
            .recipient(recipient)
            .amount(amount)
            .description(description == null ? "" : description)
            .build();

        RuleResult ruleResult = rulesEngine.evaluateRules(request);
        if (!ruleResult.isApproved()) {
            log.info("Payment from {} to {} DECLINED by rule {}: {}",
                accountId, recipient.accountId, ruleResult.getRuleName(), ruleResult.getReason());
            return PaymentResult.declined(ruleResult.getReason());
        }

        return withBothLocked(this, recipient, () -> settle(request));
    }

    // caller holds both locks
    private PaymentResult settle(PaymentRequest request) {
        Account recipient = request.getRecipient();
        Money amount = request.getAmount();
        String description = request.getDescription();

        if (balance.isGreaterThanOrEqual(amount)) {
            balance = balance.subtract(amount);
            recipient.balance = recipient.balance.add(amount);

            String entry = ActivityMessages.payment(this, recipient, amount, description);
            activityLog.add(entry);
            recipient.activityLog.add(entry);

            log.info("Payment of {} from {} to {} APPROVED from cash", amount, accountId, recipient.accountId);
            return PaymentResult.approved(FundingSource.CASH);
        }

        if (creditLine != null && creditLine.debit(amount)) {
            recipient.balance = recipient.balance.add(amount);

            activityLog.add(ActivityMessages.creditLinePayment(recipient, amount, description));
            recipient.activityLog.add(ActivityMessages.payment(this, recipient, amount, description));

            log.info("Payment of {} from {} to {} APPROVED from credit line {}",
                amount, accountId, recipient.accountId, creditLine.getCreditLineId());
            return PaymentResult.approved(FundingSource.CREDIT_LINE);
        }

        log.info("Payment of {} from {} to {} DECLINED: insufficient funds (cash {}, credit line {})",
            amount, accountId, recipient.accountId, balance,
            creditLine == null ? "none" : creditLine.getBalance());
        return PaymentResult.declined("Insufficient funds");
    }

    /**
     * Get this account's activity log in the order entries were recorded.
     * The returned list is an unmodifiable snapshot.
     */
    public synchronized List<String> retrieveActivity() {
        return List.copyOf(activityLog);
    }

    public synchronized Set<Account> getFriends() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(friends));
    }

    public synchronized boolean isFriendsWith(Account other) {
        return friends.contains(other);
    }

    private static <T> T withBothLocked(Account a, Account b, Supplier<T> action) {
        Account first = a.sequence <= b.sequence ? a : b;
        Account second = first == a ? b : a;
        synchronized (first) {
            synchronized (second) {
                return action.get();
            }
        }
    }

    @Override
    public String toString() {
        return "Account(" + name + ", " + accountId + ")";
    }
}
