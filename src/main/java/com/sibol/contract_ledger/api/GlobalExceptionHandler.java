package com.sibol.contract_ledger.api;

import com.sibol.contract_ledger.exception.AlreadyPaidException;
import com.sibol.contract_ledger.exception.AlreadyReversedException;
import com.sibol.contract_ledger.exception.CommissionRecordNotFoundException;
import com.sibol.contract_ledger.exception.ContractNotFoundException;
import com.sibol.contract_ledger.exception.ContractNotOpenException;
import com.sibol.contract_ledger.exception.CurrencyMismatchException;
import com.sibol.contract_ledger.exception.DuplicateContractNumberException;
import com.sibol.contract_ledger.exception.InvalidRefundException;
import com.sibol.contract_ledger.exception.InvalidReversalException;
import com.sibol.contract_ledger.exception.InvalidScheduleException;
import com.sibol.contract_ledger.exception.InvalidTransitionException;
import com.sibol.contract_ledger.exception.LedgerConfigurationException;
import com.sibol.contract_ledger.exception.OverpaymentException;
import com.sibol.contract_ledger.exception.TransactionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger rejections to HTTP responses with a consistent error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({
        ContractNotFoundException.class,
        TransactionNotFoundException.class,
        CommissionRecordNotFoundException.class
    })
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body or path could not be read");
    }

    @ExceptionHandler({
        CurrencyMismatchException.class,
        InvalidScheduleException.class,
        InvalidRefundException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(RuntimeException e) {
        log.warn("Invalid request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage());
    }

    @ExceptionHandler({
        InvalidTransitionException.class,
        InvalidReversalException.class,
        AlreadyReversedException.class,
        AlreadyPaidException.class,
        OverpaymentException.class,
        ContractNotOpenException.class,
        DuplicateContractNumberException.class,
        IllegalStateException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getMessage());
    }

    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConcurrentModification(RuntimeException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrent Modification",
            "The contract was modified by another request; retry with fresh state");
    }

    @ExceptionHandler(LedgerConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(LedgerConfigurationException e) {
        log.error("Ledger misconfigured: {}", e.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build());
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
