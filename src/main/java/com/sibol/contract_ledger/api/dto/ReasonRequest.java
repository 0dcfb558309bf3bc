package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Body of reversal, cancellation and termination requests.
 */
@Value
public class ReasonRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
