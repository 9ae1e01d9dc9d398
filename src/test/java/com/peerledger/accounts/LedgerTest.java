package com.peerledger.accounts;

import com.peerledger.common.Money;
import com.peerledger.common.exception.AccountNotFoundException;
import com.peerledger.credit.CreditLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the account registry and the global activity feed.
 */
class LedgerTest {

    private Ledger ledger;
    private Account alice;
    private Account bob;

    @BeforeEach
    void setUp() {
        ledger = new Ledger();
        alice = ledger.createAccount("Alice", Money.of(50));
        bob = ledger.createAccount("Bob", Money.of(20));
    }

    @Test
    void testCreateAccount() {
        Account charlie = ledger.createAccount("Charlie", Money.of(30));

        assertEquals("Charlie", charlie.getName());
        assertEquals(Money.of(30), charlie.getBalance());
        assertNotNull(charlie.getAccountId());
        assertTrue(charlie.getCreditLine().isEmpty());
        assertTrue(charlie.getFriends().isEmpty());
        assertTrue(charlie.retrieveActivity().isEmpty());
    }

    @Test
    void testCreateAccountWithNoInitialBalance() {
        Account dana = ledger.createAccount("Dana");

        assertEquals(Money.zero(), dana.getBalance());
    }

    @Test
    void testAccountsKeptInCreationOrder() {
        Account duplicate = ledger.createAccount("Alice");

        assertEquals(List.of(alice, bob, duplicate), ledger.getAccounts());
        assertNotSame(alice, duplicate);
    }

    @Test
    void testGetAccountById() {
        assertSame(bob, ledger.getAccount(bob.getAccountId()));
        assertThrows(AccountNotFoundException.class, () -> ledger.getAccount("missing"));
    }

    @Test
    void testAccountNotFromThisLedger() {
        Account stranger = new Ledger().createAccount("Stranger");

        assertThrows(AccountNotFoundException.class, () -> ledger.getAccount(stranger.getAccountId()));
    }

    @Test
    void testEmptyFeed() {
        assertTrue(ledger.renderFeed().isEmpty());
    }

    @Test
    void testRenderFeed() {
        alice.pay(bob, Money.of(5), "Coffee");
        bob.pay(alice, Money.of(15), "Lunch");

        assertEquals(List.of("Alice paid Bob $5.00 for Coffee", "Bob paid Alice $15.00 for Lunch"),
            ledger.renderFeed());
    }

    @Test
    void testFeedShowsFriendAddition() {
        alice.addFriend(bob);

        List<String> feed = ledger.renderFeed();

        assertEquals(List.of("Alice and Bob are now friends", "Bob and Alice are now friends"), feed);
    }

    @Test
    void testFeedDeduplicatesCashPayment() {
        alice.pay(bob, Money.of("5.00"), "Coffee");

        List<String> feed = ledger.renderFeed();

        assertEquals(1, Collections.frequency(feed, "Alice paid Bob $5.00 for Coffee"));
        assertEquals(1, feed.size());
    }

    @Test
    void testFeedKeepsBothSidesOfCreditLinePayment() {
        Account payer = ledger.createAccount("Dana");
        payer.assignCreditLine(new CreditLine(Money.of(100)));

        payer.pay(alice, Money.of(20), "gift");

        assertEquals(List.of("Dana paid Alice $20.00 for gift", "Paid Alice $20.00 for gift (credit card)"),
            ledger.renderFeed());
    }

    @Test
    void testFeedDeduplicatesRepeatedIdenticalPayments() {
        alice.pay(bob, Money.of(5), "Coffee");
        alice.pay(bob, Money.of(5), "Coffee");

        assertEquals(List.of("Alice paid Bob $5.00 for Coffee"), ledger.renderFeed());
        assertEquals(Money.of(40), alice.getBalance());
    }

    @Test
    void testFeedOrderFollowsAccountCreationThenLogOrder() {
        Account charlie = ledger.createAccount("Charlie", Money.of(10));

        charlie.pay(bob, Money.of(1), "first");
        bob.pay(alice, Money.of(2), "second");
        alice.pay(charlie, Money.of(3), "third");

        assertEquals(List.of(
            "Bob paid Alice $2.00 for second",
            "Alice paid Charlie $3.00 for third",
            "Charlie paid Bob $1.00 for first"
        ), ledger.renderFeed());
    }

    @Test
    void testFeedIsASnapshot() {
        alice.pay(bob, Money.of(1), "before");
        List<String> feed = ledger.renderFeed();

        alice.pay(bob, Money.of(1), "after");

        assertEquals(1, feed.size());
        assertThrows(UnsupportedOperationException.class, () -> feed.add("forged"));
    }

    @Test
    void testConcurrentPaymentsConserveTotal() throws Exception {
        Account charlie = ledger.createAccount("Charlie", Money.of(30));
        List<Account> accounts = List.of(alice, bob, charlie);
        Money total = Money.of(100);

        ExecutorService executor = Executors.newFixedThreadPool(6);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 6; t++) {
            int offset = t;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    Account from = accounts.get((i + offset) % 3);
                    Account to = accounts.get((i + offset + 1 + (offset % 2)) % 3);
                    from.pay(to, Money.of(1 + (i % 4)), "round " + i);
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();

        Money sum = accounts.stream().map(Account::getBalance).reduce(Money.zero(), Money::add);
        assertEquals(total, sum);
        accounts.forEach(account -> assertFalse(account.getBalance().isNegative()));
    }

    @Test
    void testConcurrentFriendRequestsCreateOneFriendship() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<Boolean> fromAlice = executor.submit(() -> alice.addFriend(bob));
        Future<Boolean> fromBob = executor.submit(() -> bob.addFriend(alice));

        boolean first = fromAlice.get();
        boolean second = fromBob.get();
        executor.shutdown();

        assertTrue(first ^ second);
        assertEquals(1, alice.retrieveActivity().size());
        assertEquals(1, bob.retrieveActivity().size());
    }
}
