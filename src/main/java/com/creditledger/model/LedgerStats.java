package com.creditledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Singleton row holding ledger-wide counters.
 *
 * Why one row for everything?
 * - The application id counter and the disbursement totals are process-wide state
 * - Every mutating operation locks this row first (SELECT ... FOR UPDATE)
 * - That lock is the single serialization point for the whole ledger
 *
 * Counters only increase, and only when the operation that owns them succeeds.
 */
@Entity
@Table(name = "ledger_stats")
@Data
@NoArgsConstructor
public class LedgerStats {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false)
    private Long totalLoansIssued;

    @Column(nullable = false)
    private Long totalAmountDisbursed;

    @Column(nullable = false)
    private Integer modelVersion;

    /**
     * Last application id handed out. Advanced only on a successful apply.
     */
    @Column(nullable = false)
    private Long lastApplicationId;

    public static LedgerStats initial(int modelVersion) {
        LedgerStats stats = new LedgerStats();
        stats.setId(SINGLETON_ID);
        stats.setTotalLoansIssued(0L);
        stats.setTotalAmountDisbursed(0L);
        stats.setModelVersion(modelVersion);
        stats.setLastApplicationId(0L);
        return stats;
    }
}
