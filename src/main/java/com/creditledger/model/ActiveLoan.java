package com.creditledger.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entity representing a disbursed loan under repayment.
 *
 * The id is the id of the originating {@link LoanApplication}. It is a lookup
 * key only; the application is read through its own repository.
 *
 * principalAmount, interestRate and monthlyPayment are fixed at disbursement.
 * outstandingBalance only goes down and never below zero.
 */
@Entity
@Table(name = "active_loans")
@Data
@NoArgsConstructor
@JsonIgnoreProperties(value = "status", allowGetters = true)
public class ActiveLoan {

    @Id
    private Long id;

    @Column(nullable = false)
    private String borrower;

    @Column(nullable = false, updatable = false)
    private Long principalAmount;

    @Column(nullable = false)
    private Long outstandingBalance;

    /** Basis points. */
    @Column(nullable = false, updatable = false)
    private Integer interestRate;

    @Column(nullable = false, updatable = false)
    private Long monthlyPayment;

    @Column(nullable = false)
    private Integer paymentsMade;

    @Column(nullable = false)
    private Integer paymentsMissed;

    @Column(nullable = false)
    private Integer termMonths;

    @Column(nullable = false)
    private Instant disbursedAt;

    @Transient
    @JsonIgnore
    public boolean isRepaid() {
        return outstandingBalance != null && outstandingBalance == 0L;
    }

    @Transient
    public LoanStatus getStatus() {
        return isRepaid() ? LoanStatus.REPAID : LoanStatus.REPAYING;
    }

    public enum LoanStatus {
        REPAYING,   // Balance still outstanding
        REPAID      // Terminal
    }
}
