package com.sibol.contract_ledger.api;

import com.sibol.contract_ledger.api.dto.ConstructionResponse;
import com.sibol.contract_ledger.api.dto.ContractResponse;
import com.sibol.contract_ledger.api.dto.CreateContractRequest;
import com.sibol.contract_ledger.api.dto.InstallmentResponse;
import com.sibol.contract_ledger.api.dto.ReasonRequest;
import com.sibol.contract_ledger.api.dto.SignatureRequest;
import com.sibol.contract_ledger.construction.ConstructionTrigger;
import com.sibol.contract_ledger.contract.Contract;
import com.sibol.contract_ledger.ledger.LedgerPolicy;
import com.sibol.contract_ledger.schedule.ScheduledInstallment;
import com.sibol.contract_ledger.service.ContractService;
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
 * REST controller for contract setup and lifecycle.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    private final ContractService contractService;
    private final ConstructionTrigger constructionTrigger;
    private final LedgerPolicy ledgerPolicy;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(@Valid @RequestBody CreateContractRequest request) {
        log.info("Received contract creation request: number={}, type={}, total={} {}",
            request.getContractNumber(), request.getContractType(), request.getTotalAmount(), request.getCurrency());
        Contract contract = contractService.createContract(request.toTerms(ledgerPolicy));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(contract));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContractResponse> getContract(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(contractService.getContract(id)));
    }

    @PostMapping("/{id}/schedule")
    public ResponseEntity<List<InstallmentResponse>> attachSchedule(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(contractService.attachSchedule(id)));
    }

    @GetMapping("/{id}/installments")
    public ResponseEntity<List<InstallmentResponse>> getInstallments(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(contractService.getContract(id).getInstallments()));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<ContractResponse> submitForSignature(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(toResponse(contractService.submitForSignature(id)));
    }

    @PostMapping("/{id}/signatures")
    public ResponseEntity<ContractResponse> sign(@PathVariable("id") UUID id,
                                                 @Valid @RequestBody SignatureRequest request) {
        return ResponseEntity.ok(toResponse(contractService.sign(id, request.getRole(), request.getPayload())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ContractResponse> cancel(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(toResponse(contractService.cancel(id, request.getReason())));
    }

    @PostMapping("/{id}/terminate")
    public ResponseEntity<ContractResponse> terminate(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody ReasonRequest request) {
        return ResponseEntity.ok(toResponse(contractService.terminate(id, request.getReason())));
    }

    @GetMapping("/{id}/construction")
    public ResponseEntity<ConstructionResponse> getConstructionReadiness(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ConstructionResponse.from(contractService.getConstructionReadiness(id)));
    }

    private ContractResponse toResponse(Contract contract) {
        return ContractResponse.from(contract,
            constructionTrigger.progress(contract.getTotalAmount(), contract.getCumulativePrincipalPaid()));
    }

    private static List<InstallmentResponse> toResponse(List<ScheduledInstallment> installments) {
        return installments.stream().map(InstallmentResponse::from).collect(Collectors.toList());
    }
}
