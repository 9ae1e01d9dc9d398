package com.peerledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Peer Ledger.
 *
 * Peer Ledger is an in-memory peer-to-peer payment ledger: users hold a cash
 * balance and an optional credit line, befriend each other, pay each other,
 * and every friendship and payment shows up in a global activity feed.
 */
@SpringBootApplication
public class PeerLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PeerLedgerApplication.class, args);
    }
}
