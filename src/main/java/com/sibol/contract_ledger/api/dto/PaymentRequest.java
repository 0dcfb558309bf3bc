package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.money.Money;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment received from the buyer. The external reference (bank or gateway reference)
 * makes the request idempotent per contract.
 */
@Value
public class PaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Currency is required")
    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be a 3-letter ISO code")
    @JsonProperty("currency")
    String currency;

    @NotBlank(message = "External reference is required")
    @JsonProperty("external_reference")
    String externalReference;

    // Defaults to the time the request is processed
    @JsonProperty("received_at")
    Instant receivedAt;

    public Money toMoney() {
        return MoneyDto.toMoney(amount, currency);
    }
}
