package com.sibol.contract_ledger.schedule;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.exception.InvalidScheduleException;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static com.sibol.contract_ledger.ContractFixtures.draft;
import static com.sibol.contract_ledger.ContractFixtures.millionPesoTerms;
import static com.sibol.contract_ledger.ContractFixtures.php;
import static com.sibol.contract_ledger.ContractFixtures.twoInstallmentTerms;
import static org.junit.jupiter.api.Assertions.*;

class PaymentScheduleBuilderTest {

    private final PaymentScheduleBuilder builder = new PaymentScheduleBuilder();

    private static Money sum(List<ScheduledInstallment> installments) {
        return installments.stream()
            .map(ScheduledInstallment::getAmount)
            .reduce(Money.zero(CurrencyCode.PHP), Money::add);
    }

    private static List<ScheduledInstallment> ofType(List<ScheduledInstallment> installments, PaymentType type) {
        return installments.stream()
            .filter(installment -> installment.getPaymentType() == type)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("1,000,000 contract: 12 downpayments, 1 equity, 24 amortizations")
    void testMillionPesoSchedule() {
        List<ScheduledInstallment> schedule = builder.build(draft(millionPesoTerms().build()));

        assertEquals(37, schedule.size());
        assertEquals(php("1000000.00"), sum(schedule));

        List<ScheduledInstallment> downpayments = ofType(schedule, PaymentType.DOWNPAYMENT);
        assertEquals(12, downpayments.size());
        for (int i = 0; i < 11; i++) {
            assertEquals(php("16666.67"), downpayments.get(i).getAmount());
        }
        assertEquals(php("16666.63"), downpayments.get(11).getAmount());
        assertEquals(php("200000.00"), sum(downpayments));

        List<ScheduledInstallment> equity = ofType(schedule, PaymentType.EQUITY);
        assertEquals(1, equity.size());
        assertEquals(php("200000.00"), equity.get(0).getAmount());

        List<ScheduledInstallment> amortization = ofType(schedule, PaymentType.MONTHLY_AMORTIZATION);
        assertEquals(24, amortization.size());
        assertEquals(php("600000.00"), sum(amortization));
    }

    @Test
    @DisplayName("The negotiated monthly payment is kept on the terms but does not shape the schedule")
    void testMonthlyPaymentIsInformational() {
        List<ScheduledInstallment> plain = builder.build(draft(millionPesoTerms().build()));
        Contract contract = draft(millionPesoTerms().monthlyPayment(php("12345.67")).build());

        List<ScheduledInstallment> schedule = builder.build(contract);

        assertEquals(php("12345.67"), contract.getTerms().getMonthlyPayment());
        assertEquals(plain.size(), schedule.size());
        for (int i = 0; i < plain.size(); i++) {
            assertEquals(plain.get(i).getAmount(), schedule.get(i).getAmount());
            assertEquals(plain.get(i).getDueDate(), schedule.get(i).getDueDate());
        }
        assertEquals(php("25000.00"), ofType(schedule, PaymentType.MONTHLY_AMORTIZATION).get(0).getAmount());
    }

    @Test
    @DisplayName("Installments are numbered in order and due monthly from the start date")
    void testNumberingAndDueDates() {
        List<ScheduledInstallment> schedule = builder.build(draft(millionPesoTerms().build()));

        for (int i = 0; i < schedule.size(); i++) {
            assertEquals(i + 1, schedule.get(i).getInstallmentNumber());
            assertEquals(LocalDate.of(2024, 1, 1).plusMonths(i + 1), schedule.get(i).getDueDate());
        }
        assertEquals(LocalDate.of(2025, 2, 1), ofType(schedule, PaymentType.EQUITY).get(0).getDueDate());
    }

    @Test
    @DisplayName("Reservation fee is due on the start date and deducted from the downpayment")
    void testReservationFee() {
        Contract contract = draft(twoInstallmentTerms()
            .reservationFee(php("5000.00"))
            .build());

        List<ScheduledInstallment> schedule = builder.build(contract);

        assertEquals(3, schedule.size());
        assertEquals(PaymentType.RESERVATION_FEE, schedule.get(0).getPaymentType());
        assertEquals(LocalDate.of(2024, 1, 1), schedule.get(0).getDueDate());
        assertEquals(php("5000.00"), schedule.get(0).getAmount());
        assertEquals(php("37500.00"), schedule.get(1).getAmount());
        assertEquals(php("37500.00"), schedule.get(2).getAmount());
        assertEquals(php("80000.00"), sum(schedule));
    }

    @Test
    @DisplayName("A start on the 31st clamps to month end without drifting")
    void testMonthEndStart() {
        Contract contract = draft(twoInstallmentTerms()
            .startDate(LocalDate.of(2024, 1, 31))
            .downpaymentMonths(2)
            .build());

        List<ScheduledInstallment> schedule = builder.build(contract);

        assertEquals(LocalDate.of(2024, 2, 29), schedule.get(0).getDueDate());
        assertEquals(LocalDate.of(2024, 3, 31), schedule.get(1).getDueDate());
    }

    @Test
    @DisplayName("Every split reconciles to the total for awkward amounts")
    void testAwkwardAmountsReconcile() {
        Contract contract = draft(twoInstallmentTerms()
            .totalAmount(php("100000.01"))
            .downpaymentAmount(php("33333.33"))
            .equityAmount(php("0.68"))
            .loanableAmount(php("66666.00"))
            .downpaymentMonths(7)
            .equityMonths(3)
            .termMonths(11)
            .build());

        List<ScheduledInstallment> schedule = builder.build(contract);

        assertEquals(php("100000.01"), sum(schedule));
        assertTrue(schedule.stream().allMatch(installment -> installment.getAmount().isPositive()));
    }

    @Test
    @DisplayName("A group too small to split into positive parts is rejected")
    void testGroupTooSmall() {
        Contract contract = draft(twoInstallmentTerms()
            .totalAmount(php("80000.02"))
            .downpaymentAmount(php("80000.00"))
            .equityAmount(php("0.02"))
            .equityMonths(3)
            .build());

        assertThrows(InvalidScheduleException.class, () -> builder.build(contract));
    }

    @Test
    @DisplayName("Non-positive term months are rejected")
    void testInvalidTermMonths() {
        Contract contract = draft(twoInstallmentTerms().termMonths(0).build());

        assertThrows(InvalidScheduleException.class, () -> builder.build(contract));
    }

    @Test
    @DisplayName("Components that do not add up are rejected when the contract is drafted")
    void testComponentsMustAddUp() {
        assertThrows(InvalidScheduleException.class, () -> draft(twoInstallmentTerms()
            .downpaymentAmount(php("70000.00"))
            .build()));
    }
}
