package com.sibol.contract_ledger.commission;

public enum BeneficiaryRole {
    AGENT,
    BROKER
}
