package com.sibol.contract_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sibol.contract_ledger.contract.SignatoryRole;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class SignatureRequest {

    @NotNull(message = "Role is required")
    @JsonProperty("role")
    SignatoryRole role;

    @JsonProperty("payload")
    String payload;
}
