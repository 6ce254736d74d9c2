package com.creditledger.controller;

import com.creditledger.model.ActiveLoan;
import com.creditledger.model.LoanApplication;
import com.creditledger.service.LoanLifecycleService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for the loan lifecycle.
 *
 * apply -> approve (owner) -> disburse (owner) -> payments (borrower)
 */
@RestController
@RequestMapping("/api/loans")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    private final LoanLifecycleService lifecycleService;

    /**
     * POST /api/loans/applications
     *
     * Example request:
     * {
     *   "amount": 50000,
     *   "purpose": "Home renovation",
     *   "termMonths": 60
     * }
     */
    @PostMapping("/applications")
    public ResponseEntity<Object> apply(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(value = CallerHeaders.CALLER_ROLE, required = false) String callerRole,
            @Valid @RequestBody ApplyRequest request) {

        log.info("Received loan application from: {}", callerId);
        return LendingResponses.toResponse(
                lifecycleService.apply(CallerHeaders.resolve(callerId, callerRole),
                        request.getAmount(), request.getPurpose(), request.getTermMonths()),
                id -> Map.of("applicationId", id));
    }

    /**
     * The caller's own applications, oldest first.
     *
     * GET /api/loans/applications
     */
    @GetMapping("/applications")
    public List<LoanApplication> getMyApplications(@RequestHeader(CallerHeaders.CALLER_ID) String callerId) {
        return lifecycleService.getApplicationsFor(CallerHeaders.resolve(callerId, null).identity());
    }

    @GetMapping("/applications/{id}")
    public ResponseEntity<LoanApplication> getApplication(@PathVariable long id) {
        return lifecycleService.getApplication(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/applications/{id}/approve")
    public ResponseEntity<Object> approve(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(value = CallerHeaders.CALLER_ROLE, required = false) String callerRole,
            @PathVariable long id) {
        return LendingResponses.toResponse(
                lifecycleService.approve(CallerHeaders.resolve(callerId, callerRole), id),
                application -> application);
    }

    @PostMapping("/applications/{id}/disburse")
    public ResponseEntity<Object> disburse(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(value = CallerHeaders.CALLER_ROLE, required = false) String callerRole,
            @PathVariable long id) {
        return LendingResponses.toResponse(
                lifecycleService.disburse(CallerHeaders.resolve(callerId, callerRole), id),
                loan -> loan);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ActiveLoan> getActiveLoan(@PathVariable long id) {
        return lifecycleService.getActiveLoan(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/payments")
    public ResponseEntity<Object> recordPayment(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(value = CallerHeaders.CALLER_ROLE, required = false) String callerRole,
            @PathVariable long id,
            @Valid @RequestBody PaymentRequest request) {
        return LendingResponses.toResponse(
                lifecycleService.recordPayment(CallerHeaders.resolve(callerId, callerRole), id, request.getAmount()),
                balance -> Map.of("loanId", id, "outstandingBalance", balance));
    }

    // ==================== DTOs ====================

    @Data
    public static class ApplyRequest {
        @NotNull(message = "Amount is required")
        private Long amount;

        @NotBlank(message = "Purpose is required")
        private String purpose;

        @NotNull(message = "Term is required")
        private Integer termMonths;
    }

    @Data
    public static class PaymentRequest {
        @NotNull(message = "Payment amount is required")
        private Long amount;
    }
}
