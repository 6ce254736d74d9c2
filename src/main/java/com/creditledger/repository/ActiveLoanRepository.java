package com.creditledger.repository;

import com.creditledger.model.ActiveLoan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ActiveLoanRepository extends JpaRepository<ActiveLoan, Long> {
}
