package com.creditledger.controller;

import com.creditledger.service.RiskAssessmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Comprehensive risk assessment. Open to any caller, no side effects.
 *
 * GET /api/risk/{identity}?requestedAmount=60000&purpose=car
 */
@RestController
@RequestMapping("/api/risk")
@RequiredArgsConstructor
public class RiskController {

    private final RiskAssessmentService riskAssessmentService;

    @GetMapping("/{identity}")
    public ResponseEntity<Object> assess(@PathVariable String identity,
                                         @RequestParam long requestedAmount,
                                         @RequestParam(required = false) String purpose) {
        return LendingResponses.toResponse(
                riskAssessmentService.assessComprehensiveRisk(identity, requestedAmount, purpose),
                assessment -> assessment);
    }
}
