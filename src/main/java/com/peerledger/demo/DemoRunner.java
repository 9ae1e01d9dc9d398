package com.peerledger.demo;

import com.peerledger.accounts.Account;
import com.peerledger.accounts.Ledger;
import com.peerledger.common.Money;
import com.peerledger.credit.CreditLine;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Sample session run at startup: three users, two credit lines, a few payments,
 * then the global feed printed to the console.
 */
@Component
@ConditionalOnProperty(name = "peer-ledger.demo.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoRunner implements CommandLineRunner {

    private final Ledger ledger;

    @Override
    public void run(String... args) {
        print(runScenario(), System.out);
    }

    Session runScenario() {
        Account alice = ledger.createAccount("Alice", Money.of(100));
        Account bob = ledger.createAccount("Bob", Money.of(50));
        Account charlie = ledger.createAccount("Charlie", Money.zero());

        alice.assignCreditLine(new CreditLine(Money.of(200)));
        charlie.assignCreditLine(new CreditLine(Money.of(100)));

        alice.addFriend(bob);
        bob.addFriend(charlie);

        alice.pay(bob, Money.of(25), "lunch");
        bob.pay(charlie, Money.of(10), "movie ticket");
        charlie.pay(alice, Money.of(5), "snack");

        boolean selfPayment = alice.pay(alice, Money.of(10), "self-payment");

        charlie.pay(alice, Money.of(50), "gift");

        log.debug("Demo session finished with {} accounts", ledger.getAccounts().size());
        return new Session(selfPayment, ledger.renderFeed());
    }

    void print(Session session, PrintStream out) {
        out.println("Self-payment successful? " + session.isSelfPaymentSucceeded());
        out.println();
        out.println("Peer Ledger Activity Feed:");
        session.getFeed().forEach(out::println);
    }

    /**
     * What the sample session produced.
     */
    @Value
    static class Session {
        boolean selfPaymentSucceeded;
        List<String> feed;
    }
}
