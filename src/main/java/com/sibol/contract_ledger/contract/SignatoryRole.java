package com.sibol.contract_ledger.contract;

/**
 * Parties whose signature a contract may require. The landlord is the developer or owner
 * selling or leasing the property.
 */
public enum SignatoryRole {
    CLIENT,
    LANDLORD,
    AGENT
}
