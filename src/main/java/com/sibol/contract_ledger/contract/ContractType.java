package com.sibol.contract_ledger.contract;

public enum ContractType {
    RESERVATION_AGREEMENT,
    PURCHASE_AGREEMENT,
    LEASE_AGREEMENT
}
