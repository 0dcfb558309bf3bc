package com.sibol.contract_ledger.persistence;

import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.contract.ContractStatus;
import com.sibol.contract_ledger.contract.ContractTerms;
import com.sibol.contract_ledger.contract.ContractType;
import com.sibol.contract_ledger.money.CurrencyCode;
import com.sibol.contract_ledger.money.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Contract row: the immutable terms plus the mutable status and balance columns.
 *
 * No setters. Terms are written once by {@link #fromDomain}; afterwards only
 * {@link #updateFromDomain} may change the row, and only its mutable columns. The
 * {@code version} column makes a concurrent writer that skipped the row lock fail instead
 * of overwriting.
 */
@Entity
@Table(
    name = "contracts",
    indexes = {
        @Index(name = "idx_contracts_status_end_date", columnList = "status, end_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContractEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "contract_number", nullable = false, updatable = false, unique = true, length = 64)
    private String contractNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "contract_type", nullable = false, updatable = false, length = 32)
    private ContractType contractType;

    @Column(name = "property_id", updatable = false)
    private UUID propertyId;

    @Column(name = "client_id", nullable = false, updatable = false)
    private UUID clientId;

    @Column(name = "developer_id", nullable = false, updatable = false)
    private UUID developerId;

    @Column(name = "agent_id", updatable = false)
    private UUID agentId;

    @Column(name = "broker_id", updatable = false)
    private UUID brokerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "total_amount_minor", nullable = false, updatable = false)
    private long totalAmountMinor;

    @Column(name = "reservation_fee_minor", nullable = false, updatable = false)
    private long reservationFeeMinor;

    @Column(name = "downpayment_minor", nullable = false, updatable = false)
    private long downpaymentMinor;

    @Column(name = "equity_minor", nullable = false, updatable = false)
    private long equityMinor;

    @Column(name = "loanable_minor", nullable = false, updatable = false)
    private long loanableMinor;

    @Column(name = "monthly_payment_minor", updatable = false)
    private Long monthlyPaymentMinor;

    @Column(name = "downpayment_months", nullable = false, updatable = false)
    private int downpaymentMonths;

    @Column(name = "equity_months", nullable = false, updatable = false)
    private int equityMonths;

    @Column(name = "term_months", nullable = false, updatable = false)
    private int termMonths;

    @Column(name = "start_date", nullable = false, updatable = false)
    private LocalDate startDate;

    @Column(name = "end_date", updatable = false)
    private LocalDate endDate;

    @Column(name = "agent_commission_rate", precision = 7, scale = 4, updatable = false)
    private BigDecimal agentCommissionRate;

    @Column(name = "broker_commission_rate", precision = 7, scale = 4, updatable = false)
    private BigDecimal brokerCommissionRate;

    @Column(name = "allow_prepayment", nullable = false, updatable = false)
    private boolean allowPrepayment;

    @Column(name = "construction_trigger_pct", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal constructionTriggerPercentage;

    @Column(name = "turnover_readiness_pct", nullable = false, precision = 5, scale = 2, updatable = false)
    private BigDecimal turnoverReadinessPercentage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ContractStatus status;

    @Column(name = "cumulative_principal_paid_minor", nullable = false)
    private long cumulativePrincipalPaidMinor;

    @Column(name = "prepayment_credit_minor", nullable = false)
    private long prepaymentCreditMinor;

    @Column(name = "closure_reason", columnDefinition = "TEXT")
    private String closureReason;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "construction_triggered_at")
    private Instant constructionTriggeredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(nullable = false)
    private Long version;

    static ContractEntity fromDomain(Contract contract) {
        ContractTerms terms = contract.getTerms();
        ContractEntity entity = new ContractEntity();
        entity.id = contract.getId();
        entity.contractNumber = terms.getContractNumber();
        entity.contractType = terms.getContractType();
        entity.propertyId = terms.getPropertyId();
        entity.clientId = terms.getClientId();
        entity.developerId = terms.getDeveloperId();
        entity.agentId = terms.getAgentId();
        entity.brokerId = terms.getBrokerId();
        entity.currency = terms.getCurrency();
        entity.totalAmountMinor = terms.getTotalAmount().getAmountMinor();
        entity.reservationFeeMinor = terms.reservationFeeOrZero().getAmountMinor();
        entity.downpaymentMinor = terms.getDownpaymentAmount().getAmountMinor();
        entity.equityMinor = terms.equityOrZero().getAmountMinor();
        entity.loanableMinor = terms.loanableOrZero().getAmountMinor();
        entity.monthlyPaymentMinor = terms.getMonthlyPayment() != null ? terms.getMonthlyPayment().getAmountMinor() : null;
        entity.downpaymentMonths = terms.getDownpaymentMonths();
        entity.equityMonths = terms.getEquityMonths();
        entity.termMonths = terms.getTermMonths();
        entity.startDate = terms.getStartDate();
        entity.endDate = terms.getEndDate();
        entity.agentCommissionRate = terms.getAgentCommissionRate();
        entity.brokerCommissionRate = terms.getBrokerCommissionRate();
        entity.allowPrepayment = terms.isAllowPrepayment();
        entity.constructionTriggerPercentage = terms.getConstructionTriggerPercentage();
        entity.turnoverReadinessPercentage = terms.getTurnoverReadinessPercentage();
        entity.createdAt = contract.getCreatedAt();
        entity.updateFromDomain(contract);
        return entity;
    }

    /**
     * Copies the mutable state. Terms are never rewritten.
     */
    void updateFromDomain(Contract contract) {
        if (!id.equals(contract.getId())) {
            throw new IllegalArgumentException("Contract " + contract.getId() + " cannot update row " + id);
        }
        this.status = contract.getStatus();
        this.cumulativePrincipalPaidMinor = contract.getCumulativePrincipalPaid().getAmountMinor();
        this.prepaymentCreditMinor = contract.getPrepaymentCredit().getAmountMinor();
        this.closureReason = contract.getClosureReason();
        this.closedAt = contract.getClosedAt();
        this.activatedAt = contract.getActivatedAt();
        this.completedAt = contract.getCompletedAt();
        this.constructionTriggeredAt = contract.getConstructionTriggeredAt();
    }

    ContractTerms toTerms() {
        return ContractTerms.builder()
            .contractNumber(contractNumber)
            .contractType(contractType)
            .propertyId(propertyId)
            .clientId(clientId)
            .developerId(developerId)
            .agentId(agentId)
            .brokerId(brokerId)
            .totalAmount(money(totalAmountMinor))
            .reservationFee(money(reservationFeeMinor))
            .downpaymentAmount(money(downpaymentMinor))
            .equityAmount(money(equityMinor))
            .loanableAmount(money(loanableMinor))
            .monthlyPayment(monthlyPaymentMinor != null ? money(monthlyPaymentMinor) : null)
            .downpaymentMonths(downpaymentMonths)
            .equityMonths(equityMonths)
            .termMonths(termMonths)
            .startDate(startDate)
            .endDate(endDate)
            .agentCommissionRate(agentCommissionRate)
            .brokerCommissionRate(brokerCommissionRate)
            .allowPrepayment(allowPrepayment)
            .constructionTriggerPercentage(constructionTriggerPercentage)
            .turnoverReadinessPercentage(turnoverReadinessPercentage)
            .build();
    }

    Money money(long amountMinor) {
        return Money.ofMinor(amountMinor, currency);
    }
}
