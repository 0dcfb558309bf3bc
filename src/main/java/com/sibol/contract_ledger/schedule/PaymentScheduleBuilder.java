package com.sibol.contract_ledger.schedule;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.exception.InvalidScheduleException;
import com.sibol.contract_ledger.money.Money;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns a contract's terms into its ordered list of installments.
 *
 * Layout, one installment per month on the start date's day of month:
 * <pre>
 *   [reservation fee]              due on the start date (only when the fee is non-zero)
 *   downpayment - reservation fee  split over downpaymentMonths, start + 1 .. start + k
 *   equity                         split over equityMonths, continuing the cadence
 *   loanable amount                split over termMonths, continuing the cadence
 * </pre>
 *
 * Every split uses the HALF_UP-rounded share for all but the last installment of its group;
 * the last one absorbs the remainder, so the installments always add up to the contract
 * total to the minor unit. Due dates are computed from the start date rather than from the
 * previous due date, so a start on the 31st does not drift to the 28th after February.
 *
 * Stateless and thread-safe.
 */
public class PaymentScheduleBuilder {

    public List<ScheduledInstallment> build(Contract contract) {
        ContractTerms terms = contract.getTerms();
        validate(terms);

        UUID contractId = contract.getId();
        LocalDate start = terms.getStartDate();
        List<ScheduledInstallment> installments = new ArrayList<>();

        Money reservationFee = terms.reservationFeeOrZero();
        if (reservationFee.isPositive()) {
            installments.add(ScheduledInstallment.scheduled(
                contractId, 1, reservationFee, start, PaymentType.RESERVATION_FEE));
        }

        int monthOffset = 1;
        monthOffset = addGroup(installments, contractId, start, monthOffset,
            terms.getDownpaymentAmount().subtract(reservationFee), terms.getDownpaymentMonths(),
            PaymentType.DOWNPAYMENT);
        monthOffset = addGroup(installments, contractId, start, monthOffset,
            terms.equityOrZero(), terms.getEquityMonths(), PaymentType.EQUITY);
        addGroup(installments, contractId, start, monthOffset,
            terms.loanableOrZero(), terms.getTermMonths(), PaymentType.MONTHLY_AMORTIZATION);

        Money scheduled = installments.stream()
            .map(ScheduledInstallment::getAmount)
            .reduce(Money.zero(terms.getCurrency()), Money::add);
        if (scheduled.compareTo(terms.getTotalAmount()) != 0) {
            // Cannot happen once validate() passed; kept as a hard stop on the reconciliation
            throw new IllegalStateException(String.format(
                "Schedule for contract %s sums to %s, expected %s", contractId, scheduled, terms.getTotalAmount()));
        }
        return installments;
    }

    /**
     * Appends one group and returns the month offset following its last installment.
     * A zero amount adds nothing.
     */
    private int addGroup(List<ScheduledInstallment> installments, UUID contractId, LocalDate start,
                         int monthOffset, Money groupTotal, int parts, PaymentType type) {
        if (groupTotal.isZero()) {
            return monthOffset;
        }
        Money share = groupTotal.share(parts);
        Money last = groupTotal.subtract(share.times(parts - 1));
        if (!share.isPositive() || !last.isPositive()) {
            throw new InvalidScheduleException(String.format(
                "%s of %s cannot be split into %d positive installments", type, groupTotal, parts));
        }
        for (int i = 0; i < parts; i++) {
            Money amount = i == parts - 1 ? last : share;
            installments.add(ScheduledInstallment.scheduled(
                contractId, installments.size() + 1, amount, start.plusMonths(monthOffset + i), type));
        }
        return monthOffset + parts;
    }

    private void validate(ContractTerms terms) {
        if (terms.getTermMonths() <= 0) {
            throw new InvalidScheduleException("Term months must be positive, got " + terms.getTermMonths());
        }
        if (terms.getDownpaymentMonths() <= 0) {
            throw new InvalidScheduleException(
                "Downpayment months must be positive, got " + terms.getDownpaymentMonths());
        }
        if (terms.equityOrZero().isPositive() && terms.getEquityMonths() <= 0) {
            throw new InvalidScheduleException(
                "Equity months must be positive when there is equity, got " + terms.getEquityMonths());
        }
        Money components = terms.getDownpaymentAmount().add(terms.equityOrZero()).add(terms.loanableOrZero());
        if (components.compareTo(terms.getTotalAmount()) != 0) {
            throw new InvalidScheduleException(String.format(
                "Downpayment, equity and loanable amounts add up to %s but the total is %s",
                components, terms.getTotalAmount()));
        }
        if (terms.reservationFeeOrZero().isGreaterThan(terms.getDownpaymentAmount())) {
            throw new InvalidScheduleException(String.format(
                "Reservation fee %s exceeds the downpayment %s",
                terms.reservationFeeOrZero(), terms.getDownpaymentAmount()));
        }
    }
}
