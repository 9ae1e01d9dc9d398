package com.peerledger.accounts;

import com.peerledger.common.Money;
import com.peerledger.common.exception.AccountNotFoundException;
import com.peerledger.rules.PaymentRulesEngine;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of accounts and source of the global activity feed.
 *
 * The ledger creates accounts and remembers them in creation order. It does not
 * take part in payments or friendships; it only reads the activity logs back
 * out when rendering the feed.
 */
@Slf4j
public class Ledger {

    private final PaymentRulesEngine rulesEngine;

    private final List<Account> accounts = new CopyOnWriteArrayList<>();

    public Ledger() {
        this(PaymentRulesEngine.defaults());
    }

    public Ledger(PaymentRulesEngine rulesEngine) {
        if (rulesEngine == null) {
            throw new IllegalArgumentException("Rules engine cannot be null");
        }
        this.rulesEngine = rulesEngine;
    }

    public Account createAccount(String name) {
        return createAccount(name, Money.zero());
    }

    /**
     * Create and register a new account. Names are not required to be unique.
     */
    public Account createAccount(String name, Money balance) {
        Account account = new Account(name, balance, rulesEngine);
        accounts.add(account);
        log.info("Created account {} for {} with balance {}", account.getAccountId(), name, balance);
        return account;
    }

    /**
     * All accounts in creation order.
     */
    public List<Account> getAccounts() {
        return List.copyOf(accounts);
    }

    public Account getAccount(String accountId) {
        return accounts.stream()
            .filter(account -> account.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    /**
     * Render the global activity feed.
     *
     * Entries are taken account by account in creation order, each account's log in
     * recorded order. An entry whose exact text already appeared earlier in the feed
     * is skipped, so a cash payment logged by both sides shows up once.
     *
     * @return a snapshot of the feed
     */
    public List<String> renderFeed() {
        Set<String> feed = new LinkedHashSet<>();
        for (Account account : accounts) {
            feed.addAll(account.retrieveActivity());
        }
        log.debug("Rendered feed with {} entries from {} accounts", feed.size(), accounts.size());
        return List.copyOf(feed);
    }
}
