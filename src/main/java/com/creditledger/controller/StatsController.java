package com.creditledger.controller;

import com.creditledger.service.LedgerStatsService;
import com.creditledger.service.LedgerStatsView;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
@RequiredArgsConstructor
public class StatsController {

    private final LedgerStatsService ledgerStatsService;

    @GetMapping
    public LedgerStatsView getStats() {
        return ledgerStatsService.getStats();
    }
}
