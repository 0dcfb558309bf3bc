package com.sibol.contract_ledger.schedule;

/**
 * Kind of obligation an installment represents, in the order they appear in a schedule.
 */
public enum PaymentType {
    RESERVATION_FEE,
    DOWNPAYMENT,
    EQUITY,
    MONTHLY_AMORTIZATION
}
