package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Monetary amount on the wire: decimal for people, minor units for machines.
 */
@Value
public class MoneyDto {

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("amount_minor")
    long amountMinor;

    @JsonProperty("currency")
    String currency;

    public static MoneyDto from(Money money) {
        if (money == null) {
            return null;
        }
        return new MoneyDto(money.toDecimal(), money.getAmountMinor(), money.getCurrency().name());
    }

    /**
     * Parses a request amount. A null amount stays null.
     *
     * @throws IllegalArgumentException for an unknown currency or too many decimals
     */
    static Money toMoney(BigDecimal amount, String currency) {
        if (amount == null) {
            return null;
        }
        return Money.of(amount, currencyCode(currency));
    }

    static CurrencyCode currencyCode(String currency) {
        try {
            return CurrencyCode.valueOf(currency.toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid currency code: " + currency);
        }
    }
}
