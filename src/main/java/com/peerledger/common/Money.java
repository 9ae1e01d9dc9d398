package com.peerledger.common;

import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Immutable value object representing a dollar amount.
 * Uses BigDecimal so fractional amounts keep their precision; rounding to cents
 * only happens when the amount is rendered with {@link #format()}.
 */
@Getter
public final class Money {

    private static final int DISPLAY_SCALE = 2;

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount;
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    public static Money of(String amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return of(new BigDecimal(amount));
    }

    public static Money of(long amount) {
        return of(BigDecimal.valueOf(amount));
    }

    public static Money zero() {
        return of(BigDecimal.ZERO);
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    public boolean isGreaterThan(Money other) {
        return this.amount.compareTo(other.amount) > 0;
    }

    public boolean isGreaterThanOrEqual(Money other) {
        return this.amount.compareTo(other.amount) >= 0;
    }

    public boolean isLessThan(Money other) {
        return this.amount.compareTo(other.amount) < 0;
    }

    public boolean isPositive() {
        return this.amount.signum() > 0;
    }

    public boolean isNegative() {
        return this.amount.signum() < 0;
    }

    /**
     * Render the amount with exactly two decimal places, e.g. {@code 5 -> "5.00"}.
     */
    public String format() {
        return amount.setScale(DISPLAY_SCALE, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return amount.compareTo(((Money) o).amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return "$" + format();
    }
}
