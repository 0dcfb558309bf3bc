package com.sibol.contract_ledger.money;

import com.sibol.contract_ledger.exception.CurrencyMismatchException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-point monetary amount.
 *
 * The amount is held as a whole number of minor units (centavos for PHP), so addition and
 * subtraction are exact. The only operation that rounds is {@link #multiplyByPercent}, which
 * always rounds HALF_UP to the nearest minor unit. Penalties, commissions and construction
 * thresholds all go through it, so their totals reconcile to the minor unit.
 *
 * Key invariants:
 * - Arithmetic between two amounts requires the same currency
 * - Negative amounts are legal (adjustments), callers decide where they are allowed
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Money implements Comparable<Money> {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    long amountMinor;
    CurrencyCode currency;

    public static Money ofMinor(long amountMinor, CurrencyCode currency) {
        return new Money(amountMinor, Objects.requireNonNull(currency, "currency"));
    }

    public static Money zero(CurrencyCode currency) {
        return ofMinor(0L, currency);
    }

    /**
     * Parses a decimal amount in major units ("16666.67").
     *
     * @throws IllegalArgumentException if the value has more fractional digits than the
     *                                  currency allows
     */
    public static Money of(String amount, CurrencyCode currency) {
        return of(new BigDecimal(amount), currency);
    }

    public static Money of(BigDecimal amount, CurrencyCode currency) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(currency, "currency");
        try {
            long minor = amount.setScale(currency.getMinorUnits(), RoundingMode.UNNECESSARY)
                    .movePointRight(currency.getMinorUnits())
                    .longValueExact();
            return new Money(minor, currency);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    String.format("Amount %s is not representable in %s minor units", amount, currency), e);
        }
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(amountMinor, other.amountMinor), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other);
        return new Money(Math.subtractExact(amountMinor, other.amountMinor), currency);
    }

    public Money negate() {
        return new Money(Math.negateExact(amountMinor), currency);
    }

    /**
     * Returns {@code this × rate / 100}, rounded HALF_UP to the minor unit.
     * A rate of {@code 1.5} means one and a half percent.
     */
    public Money multiplyByPercent(BigDecimal ratePercent) {
        Objects.requireNonNull(ratePercent, "ratePercent");
        BigDecimal result = BigDecimal.valueOf(amountMinor)
                .multiply(ratePercent)
                .divide(ONE_HUNDRED, 0, RoundingMode.HALF_UP);
        return new Money(result.longValueExact(), currency);
    }

    /**
     * Splits this amount into {@code parts} installments: every part but the last is the
     * HALF_UP-rounded share, the last absorbs the remainder so the parts sum back exactly.
     * Returns the regular share; the last part is {@code this - share × (parts - 1)}.
     */
    public Money share(int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be positive");
        }
        long rounded = BigDecimal.valueOf(amountMinor)
                .divide(BigDecimal.valueOf(parts), 0, RoundingMode.HALF_UP)
                .longValueExact();
        return new Money(rounded, currency);
    }

    public Money times(int factor) {
        return new Money(Math.multiplyExact(amountMinor, (long) factor), currency);
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return amountMinor == 0L;
    }

    public boolean isPositive() {
        return amountMinor > 0L;
    }

    public boolean isNegative() {
        return amountMinor < 0L;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    /**
     * Amount in major units with the currency's scale ("16666.67").
     */
    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(amountMinor, currency.getMinorUnits());
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(amountMinor, other.amountMinor);
    }

    @Override
    public String toString() {
        return toDecimal().toPlainString() + " " + currency;
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other");
        if (currency != other.currency) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }
}
