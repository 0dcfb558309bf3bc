package com.sibol.contract_ledger.config;

import com.sibol.contract_ledger.commission.CommissionCalculator;
import com.sibol.contract_ledger.construction.ConstructionTrigger;
import com.sibol.contract_ledger.contract.ContractLifecycle;
import com.sibol.contract_ledger.ledger.LedgerEngine;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.schedule.PaymentScheduleBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the engine components. They are plain classes; this is the only place they meet
 * Spring, and the only place the {@code ledger.policy.*} properties are read.
 */
@Configuration
@EnableScheduling
@Slf4j
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LedgerPolicy ledgerPolicy(
            @Value("${ledger.policy.penalty-rate-percent}") BigDecimal penaltyRatePercent,
            @Value("${ledger.policy.grace-days:30}") int graceDays,
            @Value("${ledger.policy.penalty-period-days:30}") int penaltyPeriodDays,
            @Value("${ledger.policy.zone:Asia/Manila}") String zone,
            @Value("${ledger.policy.default-agent-commission-rate:#{null}}") BigDecimal defaultAgentRate,
            @Value("${ledger.policy.default-broker-commission-rate:#{null}}") BigDecimal defaultBrokerRate,
            @Value("${ledger.policy.construction-trigger-percentage:50.00}") BigDecimal triggerPercentage,
            @Value("${ledger.policy.turnover-readiness-percentage:85.00}") BigDecimal turnoverPercentage) {
        LedgerPolicy policy = LedgerPolicy.builder()
                .penaltyRatePercent(penaltyRatePercent)
                .graceDays(graceDays)
                .penaltyPeriodDays(penaltyPeriodDays)
                .zone(ZoneId.of(zone))
                .defaultAgentCommissionRate(defaultAgentRate)
                .defaultBrokerCommissionRate(defaultBrokerRate)
                .defaultConstructionTriggerPercentage(triggerPercentage)
                .defaultTurnoverReadinessPercentage(turnoverPercentage)
                .build()
                .validate();
        log.info("Ledger policy: penalty {}%/{} days after {} grace days, zone {}, default commission agent={} broker={}",
                policy.getPenaltyRatePercent(), policy.getPenaltyPeriodDays(), policy.getGraceDays(),
                policy.getZone(), defaultAgentRate, defaultBrokerRate);
        return policy;
    }

    @Bean
    public PaymentScheduleBuilder paymentScheduleBuilder() {
        return new PaymentScheduleBuilder();
    }

    @Bean
    public ContractLifecycle contractLifecycle() {
        return new ContractLifecycle();
    }

    @Bean
    public CommissionCalculator commissionCalculator(LedgerPolicy ledgerPolicy) {
        return new CommissionCalculator(ledgerPolicy);
    }

    @Bean
    public ConstructionTrigger constructionTrigger() {
        return new ConstructionTrigger();
    }

    @Bean
    public LedgerEngine ledgerEngine(LedgerPolicy ledgerPolicy, CommissionCalculator commissionCalculator,
                                     ContractLifecycle contractLifecycle, Clock clock) {
        return new LedgerEngine(ledgerPolicy, commissionCalculator, contractLifecycle, clock);
    }
}
