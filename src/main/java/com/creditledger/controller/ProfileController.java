package com.creditledger.controller;

import com.creditledger.model.BorrowerProfile;
import com.creditledger.service.ProfileCommand;
import com.creditledger.service.ProfileService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for borrower profiles.
 */
@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
@Slf4j
public class ProfileController {

    private final ProfileService profileService;

    /**
     * Register or replace the caller's own profile.
     *
     * PUT /api/profiles/me
     *
     * Example request:
     * {
     *   "creditScore": 720,
     *   "annualIncome": 100000,
     *   "totalDebt": 20000,
     *   "employmentYears": 5,
     *   "previousDefaults": 0,
     *   "onTimePayments": 18,
     *   "totalLoans": 20
     * }
     */
    @PutMapping("/me")
    public ResponseEntity<Object> registerProfile(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestHeader(value = CallerHeaders.CALLER_ROLE, required = false) String callerRole,
            @Valid @RequestBody ProfileRequest request) {

        log.info("Received profile registration for: {}", callerId);
        return LendingResponses.toResponse(
                profileService.registerProfile(CallerHeaders.resolve(callerId, callerRole), request.toCommand()),
                profile -> profile);
    }

    @GetMapping("/{identity}")
    public ResponseEntity<BorrowerProfile> getProfile(@PathVariable String identity) {
        return profileService.getProfile(identity)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    // ==================== DTOs ====================

    @Data
    public static class ProfileRequest {
        @NotNull(message = "Credit score is required")
        private Integer creditScore;

        @NotNull(message = "Annual income is required")
        @PositiveOrZero(message = "Annual income cannot be negative")
        private Long annualIncome;

        @NotNull(message = "Total debt is required")
        @PositiveOrZero(message = "Total debt cannot be negative")
        private Long totalDebt;

        @NotNull @PositiveOrZero
        private Integer employmentYears;

        @NotNull @PositiveOrZero
        private Integer previousDefaults;

        @NotNull @PositiveOrZero
        private Integer onTimePayments;

        @NotNull @PositiveOrZero
        private Integer totalLoans;

        ProfileCommand toCommand() {
            return new ProfileCommand(creditScore, annualIncome, totalDebt, employmentYears,
                    previousDefaults, onTimePayments, totalLoans);
        }
    }
}
