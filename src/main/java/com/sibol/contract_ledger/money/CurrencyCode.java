package com.sibol.contract_ledger.money;

/**
 * ISO-4217 currency codes accepted by the ledger, with the number of minor-unit digits
 * each one uses.
 */
public enum CurrencyCode {
    PHP(2), // Philippine Peso
    USD(2), // US Dollar
    EUR(2), // Euro
    GBP(2), // British Pound
    INR(2), // Indian Rupee
    JPY(0); // Japanese Yen

    private final int minorUnits;

    CurrencyCode(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    /**
     * Number of decimal digits between the major and the minor unit (2 for centavos).
     */
    public int getMinorUnits() {
        return minorUnits;
    }
}
