package com.peerledger.accounts;

import com.peerledger.common.Money;

/**
 * Builds the human-readable activity log lines.
 *
 * The feed deduplicates entries by exact text, so these formats are part of the
 * observable behavior: a cash payment produces the same line on both sides,
 * while the payer's credit line line differs from the recipient's.
 */
final class ActivityMessages {

    private ActivityMessages() {
    }

    static String friendship(Account self, Account friend) {
        return String.format("%s and %s are now friends", self.getName(), friend.getName());
    }

    static String payment(Account payer, Account recipient, Money amount, String description) {
        return String.format("%s paid %s $%s for %s",
            payer.getName(), recipient.getName(), amount.format(), description);
    }

    static String creditLinePayment(Account recipient, Money amount, String description) {
        return String.format("Paid %s $%s for %s (credit card)",
            recipient.getName(), amount.format(), description);
    }
}
