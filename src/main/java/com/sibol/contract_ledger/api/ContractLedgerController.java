package com.sibol.contract_ledger.api;

import com.sibol.contract_ledger.api.dto.CommissionResponse;
import com.sibol.contract_ledger.api.dto.PaymentRequest;
import com.sibol.contract_ledger.api.dto.ReasonRequest;
import com.sibol.contract_ledger.api.dto.RefundRequest;
import com.sibol.contract_ledger.api.dto.TransactionResponse;
import com.sibol.contract_ledger.service.ContractLedgerService;
import com.sibol.contract_ledger.service.PaymentResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for money movements on a contract.
 *
 * Payments are idempotent on {@code external_reference}: a retry returns the original
 * transaction with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/contracts/{contractId}")
@RequiredArgsConstructor
@Slf4j
public class ContractLedgerController {

    private final ContractLedgerService ledgerService;

    @PostMapping("/payments")
    public ResponseEntity<TransactionResponse> applyPayment(@PathVariable("contractId") UUID contractId,
                                                            @Valid @RequestBody PaymentRequest request) {
        log.info("Received payment: reference={}, amount={} {}",
            request.getExternalReference(), request.getAmount(), request.getCurrency());
        PaymentResult result = ledgerService.applyPayment(
            contractId, request.toMoney(), request.getReceivedAt(), request.getExternalReference());
        HttpStatus status = result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }

    @GetMapping("/transactions")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@PathVariable("contractId") UUID contractId) {
        return ResponseEntity.ok(ledgerService.getTransactions(contractId).stream()
            .map(TransactionResponse::from)
            .collect(Collectors.toList()));
    }

    @PostMapping("/transactions/{txId}/reversal")
    public ResponseEntity<TransactionResponse> reverse(@PathVariable("contractId") UUID contractId,
                                                       @PathVariable("txId") UUID txId,
                                                       @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(ledgerService.reverseTransaction(contractId, txId, request.getReason())));
    }

    @PostMapping("/transactions/{txId}/refund")
    public ResponseEntity<TransactionResponse> refund(@PathVariable("contractId") UUID contractId,
                                                      @PathVariable("txId") UUID txId,
                                                      @Valid @RequestBody RefundRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(
                ledgerService.refundPayment(contractId, txId, request.toMoney(), request.getReason())));
    }

    @GetMapping("/commissions")
    public ResponseEntity<CommissionResponse> getCommissions(@PathVariable("contractId") UUID contractId) {
        return ResponseEntity.ok(CommissionResponse.from(
            ledgerService.getCommissions(contractId), ledgerService.getTotalCommission(contractId)));
    }

    @PostMapping("/commissions/{recordId}/payout")
    public ResponseEntity<TransactionResponse> payout(@PathVariable("contractId") UUID contractId,
                                                      @PathVariable("recordId") UUID recordId) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TransactionResponse.from(ledgerService.recordCommissionPayout(contractId, recordId)));
    }
}
