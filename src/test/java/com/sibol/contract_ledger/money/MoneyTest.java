package com.sibol.contract_ledger.money;

import com.sibol.contract_ledger.exception.CurrencyMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Decimal amounts are held exactly as minor units")
    void testParsesIntoMinorUnits() {
        Money money = Money.of("16666.67", CurrencyCode.PHP);

        assertEquals(1666667L, money.getAmountMinor());
        assertEquals(new BigDecimal("16666.67"), money.toDecimal());
        assertEquals("16666.67 PHP", money.toString());
    }

    @Test
    @DisplayName("Amounts finer than the currency allows are rejected")
    void testRejectsExtraDecimals() {
        assertThrows(IllegalArgumentException.class, () -> Money.of("10.001", CurrencyCode.PHP));
        assertThrows(IllegalArgumentException.class, () -> Money.of("10.5", CurrencyCode.JPY));
    }

    @Test
    @DisplayName("multiplyByPercent rounds HALF_UP to the minor unit")
    void testMultiplyByPercentRoundsHalfUp() {
        // 0.50 * 1% = 0.005 -> 0.01
        assertEquals(1L, Money.of("0.50", CurrencyCode.PHP).multiplyByPercent(BigDecimal.ONE).getAmountMinor());
        // 0.49 * 1% = 0.0049 -> 0.00
        assertEquals(0L, Money.of("0.49", CurrencyCode.PHP).multiplyByPercent(BigDecimal.ONE).getAmountMinor());
        assertEquals(Money.of("400.00", CurrencyCode.PHP),
            Money.of("40000.00", CurrencyCode.PHP).multiplyByPercent(new BigDecimal("1.00")));
    }

    @Test
    @DisplayName("share() rounds each part and leaves the remainder for the last")
    void testShare() {
        Money total = Money.of("200000.00", CurrencyCode.PHP);
        Money share = total.share(12);

        assertEquals(Money.of("16666.67", CurrencyCode.PHP), share);
        assertEquals(Money.of("16666.63", CurrencyCode.PHP), total.subtract(share.times(11)));
        assertThrows(IllegalArgumentException.class, () -> total.share(0));
    }

    @Test
    @DisplayName("Arithmetic across currencies is rejected")
    void testCurrencyMismatch() {
        Money php = Money.of("1.00", CurrencyCode.PHP);
        Money usd = Money.of("1.00", CurrencyCode.USD);

        assertThrows(CurrencyMismatchException.class, () -> php.add(usd));
        assertThrows(CurrencyMismatchException.class, () -> php.compareTo(usd));
    }

    @Test
    @DisplayName("Comparisons and sign checks")
    void testComparisons() {
        Money ten = Money.of("10.00", CurrencyCode.PHP);
        Money five = Money.of("5.00", CurrencyCode.PHP);

        assertTrue(ten.isGreaterThan(five));
        assertTrue(five.isLessThan(ten));
        assertEquals(five, ten.min(five));
        assertTrue(five.subtract(ten).isNegative());
        assertTrue(Money.zero(CurrencyCode.PHP).isZero());
        assertEquals(ten, five.negate().negate().add(five));
    }
}
