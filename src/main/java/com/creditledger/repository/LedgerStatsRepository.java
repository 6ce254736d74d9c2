package com.creditledger.repository;

import com.creditledger.model.LedgerStats;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the singleton ledger stats row.
 *
 * Key method: lockById()
 * - SELECT ... FOR UPDATE on the singleton row
 * - Called first by every mutating operation
 * - Holds until the surrounding transaction commits or rolls back
 */
@Repository
public interface LedgerStatsRepository extends JpaRepository<LedgerStats, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM LedgerStats s WHERE s.id = :id")
    Optional<LedgerStats> lockById(@Param("id") Long id);
}
