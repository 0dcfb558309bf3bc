package com.sibol.contract_ledger.ledger;

import com.sibol.contract_ledger.exception.LedgerConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.ZoneId;

/**
 * Rates and calendar rules the engine applies to every contract.
 *
 * Built once by the caller and handed to the engine components; nothing in the engine reads
 * configuration on its own. A missing penalty rate is a configuration error, never zero.
 * Commission defaults may be absent, in which case every contract with that beneficiary must
 * carry its own rate.
 */
@Value
@Builder(toBuilder = true)
public class LedgerPolicy {

    /**
     * Percent of the outstanding principal charged per overdue period.
     */
    BigDecimal penaltyRatePercent;

    /**
     * Days past due before the first penalty is assessed.
     */
    @Builder.Default
    int graceDays = 30;

    /**
     * Length of one penalty period in days.
     */
    @Builder.Default
    int penaltyPeriodDays = 30;

    /**
     * Zone in which payment timestamps are turned into calendar dates.
     */
    @Builder.Default
    ZoneId zone = ZoneId.of("Asia/Manila");

    BigDecimal defaultAgentCommissionRate;
    BigDecimal defaultBrokerCommissionRate;

    @Builder.Default
    BigDecimal defaultConstructionTriggerPercentage = new BigDecimal("50.00");
    @Builder.Default
    BigDecimal defaultTurnoverReadinessPercentage = new BigDecimal("85.00");

    /**
     * @throws LedgerConfigurationException when a required value is missing or out of range
     */
    public LedgerPolicy validate() {
        if (penaltyRatePercent == null) {
            throw new LedgerConfigurationException("Penalty rate is not configured");
        }
        if (penaltyRatePercent.signum() < 0) {
            throw new LedgerConfigurationException("Penalty rate must not be negative: " + penaltyRatePercent);
        }
        if (graceDays < 0) {
            throw new LedgerConfigurationException("Grace days must not be negative: " + graceDays);
        }
        if (penaltyPeriodDays <= 0) {
            throw new LedgerConfigurationException("Penalty period must be positive: " + penaltyPeriodDays);
        }
        if (zone == null) {
            throw new LedgerConfigurationException("Ledger time zone is not configured");
        }
        return this;
    }

    /**
     * Number of penalty periods owed for an installment {@code daysOverdue} days past due;
     * zero inside the grace window, at least one once the grace window has passed.
     */
    public int penaltyMonthsFor(long daysOverdue) {
        if (daysOverdue <= 0 || daysOverdue < graceDays) {
            return 0;
        }
        return (int) Math.max(1L, daysOverdue / penaltyPeriodDays);
    }
}
