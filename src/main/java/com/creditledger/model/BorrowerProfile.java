package com.creditledger.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing a borrower's financial profile.
 *
 * One profile per identity. The profile is upserted by its own borrower and
 * riskCategory is recomputed from creditScore on every write, so the two never
 * drift apart.
 *
 * onTimePayments <= totalLoans is expected but not enforced here.
 */
@Entity
@Table(name = "borrower_profiles")
@Data
@NoArgsConstructor
public class BorrowerProfile {

    public static final int MIN_CREDIT_SCORE = 300;
    public static final int MAX_CREDIT_SCORE = 850;

    @Id
    private String borrower;

    @Column(nullable = false)
    private Integer creditScore;

    @Column(nullable = false)
    private Long annualIncome;

    @Column(nullable = false)
    private Long totalDebt;

    @Column(nullable = false)
    private Integer employmentYears;

    @Column(nullable = false)
    private Integer previousDefaults;

    @Column(nullable = false)
    private Integer onTimePayments;

    @Column(nullable = false)
    private Integer totalLoans;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RiskCategory riskCategory;

    @Column(nullable = false)
    private Instant lastUpdated;
}
