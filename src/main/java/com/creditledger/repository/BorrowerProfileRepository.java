package com.creditledger.repository;

import com.creditledger.model.BorrowerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BorrowerProfileRepository extends JpaRepository<BorrowerProfile, String> {
}
